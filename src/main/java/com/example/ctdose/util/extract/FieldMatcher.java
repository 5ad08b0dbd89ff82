package com.example.ctdose.util.extract;

import java.util.List;
import java.util.Optional;

/**
 * 字段匹配器
 *
 * 匹配策略：first-match-wins
 * - 按 PatternLibrary 中的顺序依次尝试候选模式
 * - 第一个匹配成功的模式决定结果，后续模式不再尝试
 * - 值原样返回（保留数值格式和单位），不做数值解析或单位换算
 * - 全部失败时字段缺失（返回 empty），不使用占位符；占位符由导出层负责
 */
public class FieldMatcher {

    private final PatternLibrary library;

    public FieldMatcher(PatternLibrary library) {
        this.library = library;
    }

    /**
     * 匹配字段值
     *
     * @param text  归一化后的文本
     * @param field 字段
     * @return 捕获值，未匹配返回 empty
     */
    public Optional<String> match(String text, ReportField field) {
        MatchResult result = matchFirst(text, field);
        return result.isFound() ? Optional.of(result.getValue()) : Optional.empty();
    }

    /**
     * 匹配字段值，未匹配返回 null（供报告组装直接写入模型）
     */
    public String matchOrNull(String text, ReportField field) {
        return match(text, field).orElse(null);
    }

    /**
     * 匹配字段值，并返回命中模式的位置
     *
     * @param text  归一化后的文本
     * @param field 字段
     * @return 匹配结果，未匹配时 patternIndex 为 -1
     */
    public MatchResult matchFirst(String text, ReportField field) {
        List<FieldPattern> patterns = library.patternsFor(field);
        for (int i = 0; i < patterns.size(); i++) {
            FieldPattern pattern = patterns.get(i);
            Optional<String> value = pattern.find(text);
            if (value.isPresent()) {
                return new MatchResult(field, value.get(), i, pattern.getName());
            }
        }
        return MatchResult.absent(field);
    }

    /**
     * 单个字段的匹配结果
     */
    public static final class MatchResult {
        private final ReportField field;
        private final String value;
        private final int patternIndex;
        private final String patternName;

        MatchResult(ReportField field, String value, int patternIndex, String patternName) {
            this.field = field;
            this.value = value;
            this.patternIndex = patternIndex;
            this.patternName = patternName;
        }

        static MatchResult absent(ReportField field) {
            return new MatchResult(field, null, -1, null);
        }

        public boolean isFound() { return value != null; }

        public ReportField getField() { return field; }

        public String getValue() { return value; }

        public int getPatternIndex() { return patternIndex; }

        public String getPatternName() { return patternName; }

        @Override
        public String toString() {
            return isFound()
                    ? field + "='" + value + "' (#" + patternIndex + " " + patternName + ")"
                    : field + "=<absent>";
        }
    }
}
