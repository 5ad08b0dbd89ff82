package com.example.ctdose.util.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * PDF 提取文本归一化工具类
 *
 * 问题：PDF 渲染得到的线性文本存在以下问题
 * - 空白不规则（多个空格、制表符、不换行空格、零宽字符）
 * - 多栏排版导致标签落在一栏末尾，值落在下一栏开头，被换行拆开
 *   例如："Patient ID:\n123456" 或 "DLP = 445.02\nmGy.cm"
 *
 * 处理逻辑：
 * 1. 去除零宽字符，特殊空格替换为普通空格
 * 2. 统一换行符为 \n
 * 3. 每行内连续空白压缩为单个空格，并去除首尾空白
 * 4. 连续空行压缩为一个空行（保留段落边界）
 * 5. 重新拼接被换行拆开的 "标签 值" 对
 *
 * 归一化是尽力而为的：不会抛出异常，无法识别的内容原样保留（仅压缩空白）。
 */
public class TextNormalizer {

    /**
     * 行尾为标签结束符（":" 或 "="），且前面至少有一个字母或右括号
     */
    private static final Pattern STRANDED_LABEL = Pattern.compile(".*[A-Za-z')]\\s*[:=]$");

    /**
     * 行尾为 "= 数值"，单位被挤到下一行
     */
    private static final Pattern STRANDED_NUMBER = Pattern.compile(".*=\\s*[\\d.]+$");

    /**
     * 下一行以单位开头
     */
    private static final Pattern LEADING_UNIT = Pattern.compile(
            "^(mGy\\.cm|mGy|mAs|mA|kV|mm|s|ratio|events|X-Ray sources)\\b.*");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f]+");

    /**
     * 归一化 PDF 提取的原始文本
     *
     * @param rawText 原始文本（可为 null）
     * @return 归一化后的文本，null 输入返回空字符串
     */
    public static String normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }

        String text = replaceInvisibleChars(rawText)
                .replace("\r\n", "\n")
                .replace("\r", "\n");

        List<String> lines = collapseLines(text.split("\n", -1));
        List<String> joined = rejoinStrandedLabels(lines);

        return String.join("\n", joined);
    }

    /**
     * 去除零宽字符，将特殊空格替换为普通空格
     *
     * 与纯展示用的清理不同，这里把特殊空格替换成普通空格而不是直接删除，
     * 否则 "Patient[NBSP]ID" 会变成 "PatientID"。
     *
     * @param text 原始文本
     * @return 处理后的文本
     */
    public static String replaceInvisibleChars(String text) {
        if (text == null) {
            return "";
        }

        return text
                // 零宽字符
                .replace("\u200B", "")  // Zero Width Space
                .replace("\u200C", "")  // Zero Width Non-Joiner
                .replace("\u200D", "")  // Zero Width Joiner
                .replace("\uFEFF", "")  // BOM
                // Unicode 行分隔符
                .replace("\u2028", "\n")  // Line Separator
                .replace("\u2029", "\n")  // Paragraph Separator
                // 特殊空格
                .replaceAll("[\\u00A0\\u1680\\u2000-\\u200A\\u202F\\u205F\\u3000]", " ");
    }

    /**
     * 行内空白压缩，连续空行压缩为一个
     */
    private static List<String> collapseLines(String[] rawLines) {
        List<String> lines = new ArrayList<>(rawLines.length);
        boolean previousBlank = true;  // 丢弃开头的空行

        for (String rawLine : rawLines) {
            String line = HORIZONTAL_WHITESPACE.matcher(rawLine).replaceAll(" ").trim();
            boolean blank = line.isEmpty();
            if (blank && previousBlank) {
                continue;
            }
            lines.add(line);
            previousBlank = blank;
        }

        // 丢弃末尾空行
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * 拼接跨栏被拆开的 "标签 值"
     *
     * 规则：
     * - 当前行以 ":" 或 "=" 结尾，下一行是孤立的值（非空，不含 ":" 和 "="）
     * - 当前行以 "= 数值" 结尾，下一行以单位开头
     *
     * 每次拼接只吸收一行，拼接后的行不再继续吸收。
     */
    private static List<String> rejoinStrandedLabels(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());

        int i = 0;
        while (i < lines.size()) {
            String current = lines.get(i);
            String next = (i + 1 < lines.size()) ? lines.get(i + 1) : null;

            if (next != null && !next.isEmpty() && shouldJoin(current, next)) {
                result.add(current + " " + next);
                i += 2;
            } else {
                result.add(current);
                i++;
            }
        }
        return result;
    }

    private static boolean shouldJoin(String current, String next) {
        if (STRANDED_LABEL.matcher(current).matches()) {
            return isIsolatedValue(next);
        }
        return STRANDED_NUMBER.matcher(current).matches() && LEADING_UNIT.matcher(next).matches();
    }

    private static boolean isIsolatedValue(String line) {
        return line.indexOf(':') < 0 && line.indexOf('=') < 0;
    }
}
