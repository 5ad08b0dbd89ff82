package com.example.ctdose.util.extract;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 采集块切分器
 *
 * 在归一化文本中查找所有采集起始标记，按文档顺序切成 N 个连续文本块：
 * - 块 i 从第 i 个标记之后开始，到第 i+1 个标记之前结束（最后一块到文本末尾）
 * - 第一个标记之前的文本（报告头、患者信息）不属于任何采集
 * - 没有标记时返回空列表，不视为错误
 *
 * 多个规则的命中区间重叠时视为同一个标记；
 * 互不重叠的命中各自开始一个新块（宁可多切，不可少切：少切会把两个采集的字段合并，
 * 多切最多产生一个大部分字段为空的采集）。
 */
public class AcquisitionSegmenter {

    private final AcquisitionMarkerPolicy policy;

    public AcquisitionSegmenter(AcquisitionMarkerPolicy policy) {
        this.policy = policy;
    }

    /**
     * 切分采集块
     *
     * @param text 归一化后的文本
     * @return 按文档顺序排列的采集块文本
     */
    public List<String> segment(String text) {
        List<int[]> markers = findMarkers(text);
        List<String> blocks = new ArrayList<>(markers.size());

        for (int i = 0; i < markers.size(); i++) {
            int start = markers.get(i)[1];
            int end = (i + 1 < markers.size()) ? markers.get(i + 1)[0] : text.length();
            blocks.add(text.substring(start, end));
        }
        return blocks;
    }

    /**
     * 统计标记出现次数（与 segment 返回的块数一致）
     */
    public int countMarkers(String text) {
        return findMarkers(text).size();
    }

    /**
     * 查找所有标记区间 [start, end)，按起点排序并合并重叠区间
     */
    private List<int[]> findMarkers(String text) {
        List<int[]> hits = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return hits;
        }

        for (Pattern marker : policy.getMarkers()) {
            Matcher matcher = marker.matcher(text);
            while (matcher.find()) {
                if (matcher.end() > matcher.start()) {
                    hits.add(new int[]{matcher.start(), matcher.end()});
                }
            }
        }

        hits.sort(Comparator.<int[]>comparingInt(h -> h[0]).thenComparingInt(h -> h[1]));

        List<int[]> merged = new ArrayList<>();
        for (int[] hit : hits) {
            if (!merged.isEmpty()) {
                int[] last = merged.get(merged.size() - 1);
                if (hit[0] < last[1]) {
                    // 重叠：同一个标记
                    last[1] = Math.max(last[1], hit[1]);
                    continue;
                }
            }
            merged.add(new int[]{hit[0], hit[1]});
        }
        return merged;
    }
}
