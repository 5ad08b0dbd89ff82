package com.example.ctdose.util.extract;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单个字段的一个候选匹配模式
 *
 * 值取第 1 个捕获组，去除首尾空白后原样返回（保留数值格式和单位）。
 * 捕获为空白时视为未匹配。
 */
public final class FieldPattern {

    private final String name;
    private final Pattern pattern;

    public FieldPattern(String name, Pattern pattern) {
        if (pattern.matcher("").groupCount() < 1) {
            throw new IllegalArgumentException("模式缺少捕获组: " + pattern.pattern());
        }
        this.name = name;
        this.pattern = pattern;
    }

    public static FieldPattern of(String name, String regex) {
        return new FieldPattern(name, Pattern.compile(regex, Pattern.MULTILINE));
    }

    /**
     * 在文本中查找第一个匹配
     *
     * @param text 待匹配文本
     * @return 捕获值，未匹配返回 empty
     */
    public Optional<String> find(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }

        String value = matcher.group(1);
        if (value == null) {
            return Optional.empty();
        }
        value = value.trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return name + " /" + pattern.pattern() + "/";
    }
}
