package com.example.ctdose.util.date;

import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 年龄计算（周岁）
 *
 * 报告中的日期格式不统一（"Jul 1, 1997"、"1997-07-01"、"1997/7/1"、"19970701"、"1.7.1997" ...），
 * 按固定顺序依次尝试，第一个能解析的格式生效。
 * 日期后面的时间部分（"May 5, 2025 10:32:11 AM"）忽略。
 *
 * 任一日期无法解析时返回 empty，不抛异常。
 */
public class AgeCalculator {

    private static final char[] SEPARATORS = {'-', '/', '.'};

    private final List<DateTimeFormatter> formatters;

    /**
     * 尝试顺序即优先级：月份名称、年在前、紧凑 8 位、日在前、"d MMM yyyy"。
     * 数字的月和日接受 1~2 位，年固定 4 位；分隔符为 "-"、"/" 或 "."。
     * 日在前的数字日期一律按"日/月"理解。
     */
    public AgeCalculator() {
        List<DateTimeFormatter> list = new ArrayList<>();
        list.add(monthNameFirst(TextStyle.SHORT));
        list.add(monthNameFirst(TextStyle.FULL));
        for (char separator : SEPARATORS) {
            list.add(numeric(separator, true));
        }
        list.add(toFormatter(new DateTimeFormatterBuilder()
                .appendValue(ChronoField.YEAR, 4)
                .appendValue(ChronoField.MONTH_OF_YEAR, 2)
                .appendValue(ChronoField.DAY_OF_MONTH, 2)));
        for (char separator : SEPARATORS) {
            list.add(numeric(separator, false));
        }
        list.add(toFormatter(new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                .appendLiteral(' ')
                .appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT)
                .appendLiteral(' ')
                .appendValue(ChronoField.YEAR, 4)));
        this.formatters = Collections.unmodifiableList(list);
    }

    /** "Jul 1, 1997" / "Jul. 1, 1997" / "July 1,1997" */
    private static DateTimeFormatter monthNameFirst(TextStyle style) {
        return toFormatter(new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendText(ChronoField.MONTH_OF_YEAR, style)
                .optionalStart().appendLiteral('.').optionalEnd()
                .appendLiteral(' ')
                .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                .appendLiteral(',')
                .optionalStart().appendLiteral(' ').optionalEnd()
                .appendValue(ChronoField.YEAR, 4));
    }

    /** "1997-7-1"（yearFirst）或 "1-7-1997" */
    private static DateTimeFormatter numeric(char separator, boolean yearFirst) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        if (yearFirst) {
            builder.appendValue(ChronoField.YEAR, 4)
                    .appendLiteral(separator)
                    .appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(separator)
                    .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE);
        } else {
            builder.appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(separator)
                    .appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(separator)
                    .appendValue(ChronoField.YEAR, 4);
        }
        return toFormatter(builder);
    }

    private static DateTimeFormatter toFormatter(DateTimeFormatterBuilder builder) {
        return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * 计算 reference 日期时的周岁
     *
     * @param birthDate     出生日期文本
     * @param referenceDate 参照日期文本（检查日期）
     * @return 周岁，任一日期无法解析时 empty
     */
    public OptionalInt age(String birthDate, String referenceDate) {
        Optional<LocalDate> birth = parse(birthDate);
        Optional<LocalDate> reference = parse(referenceDate);
        if (!birth.isPresent() || !reference.isPresent()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(age(birth.get(), reference.get()));
    }

    /**
     * 周岁：年份差，参照日的月日早于生日的月日时减一
     */
    public static int age(LocalDate birth, LocalDate reference) {
        int years = reference.getYear() - birth.getYear();
        if (reference.getMonthValue() < birth.getMonthValue()
                || (reference.getMonthValue() == birth.getMonthValue()
                && reference.getDayOfMonth() < birth.getDayOfMonth())) {
            years--;
        }
        return years;
    }

    /**
     * 按格式顺序解析日期，只要求日期位于文本开头
     */
    public Optional<LocalDate> parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            return Optional.empty();
        }
        String value = text.trim();

        for (DateTimeFormatter formatter : formatters) {
            LocalDate date = tryParse(formatter, value);
            if (date != null) {
                return Optional.of(date);
            }
        }
        return Optional.empty();
    }

    private static LocalDate tryParse(DateTimeFormatter formatter, String value) {
        ParsePosition position = new ParsePosition(0);
        TemporalAccessor parsed = formatter.parseUnresolved(value, position);
        if (parsed == null || position.getErrorIndex() >= 0) {
            return null;
        }
        // 剩余部分必须是时间等附加信息，不能紧跟数字（"2025-01-011" 不是日期）
        int end = position.getIndex();
        if (end < value.length() && Character.isDigit(value.charAt(end))) {
            return null;
        }
        try {
            return LocalDate.from(formatter.parse(value.substring(0, end)));
        } catch (RuntimeException e) {
            // 非法日历日期（2月30日等）
            return null;
        }
    }
}
