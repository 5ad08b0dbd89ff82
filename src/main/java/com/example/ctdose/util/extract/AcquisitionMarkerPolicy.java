package com.example.ctdose.util.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 采集块起始标记的识别规则
 *
 * 每个 CT 采集小节以一个编号标题开头，例如 "1.2 CT Acquisition"。
 * 不同厂商的报告标题不完全一致，因此规则是可配置的正则列表
 * （配置项 ctdose.extraction.acquisition-markers）。
 */
public final class AcquisitionMarkerPolicy {

    /**
     * 默认标记："x.y CT Acquisition"
     * - 前面不能紧跟数字或点（避免命中 UID "1.2.840..." 的中间部分）
     * - 编号与标题在同一行
     * - 排除 "CT Acquisition Type:" 字段标签
     */
    public static final String DEFAULT_MARKER =
            "(?<![\\d.])\\d+\\.\\d+[ \\t]+CT[ \\t]+Acquisition\\b(?![ \\t]*Type)";

    private final List<Pattern> markers;

    public AcquisitionMarkerPolicy(List<Pattern> markers) {
        if (markers == null || markers.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个采集标记规则");
        }
        this.markers = Collections.unmodifiableList(new ArrayList<>(markers));
    }

    public static AcquisitionMarkerPolicy defaultPolicy() {
        return fromRegexes(Collections.singletonList(DEFAULT_MARKER));
    }

    /**
     * 从正则字符串构建规则（大小写不敏感、MULTILINE）
     *
     * @param regexes 正则列表
     * @return 规则
     * @throws IllegalStateException 正则非法时（启动即失败）
     */
    public static AcquisitionMarkerPolicy fromRegexes(List<String> regexes) {
        if (regexes == null || regexes.isEmpty()) {
            return defaultPolicy();
        }

        List<Pattern> patterns = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            try {
                patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE));
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("采集标记正则非法: " + regex, e);
            }
        }
        return new AcquisitionMarkerPolicy(patterns);
    }

    public List<Pattern> getMarkers() {
        return markers;
    }
}
