package com.example.ctdose.util.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 字段匹配模式库
 *
 * 每个字段对应一个有序、不可变的候选模式列表，按可靠性从高到低排列：
 * 最具体、最不易歧义的模式在前，最宽松的模式在后。
 * FieldMatcher 按顺序尝试，第一个匹配成功的模式决定结果。
 *
 * 模式库在启动时构建一次，之后只读共享（线程安全）。
 *
 * 模式约定：
 * - 标签部分大小写不敏感，值部分保持各自的大小写规则
 * - 所有模式以 MULTILINE 编译，"$" 表示行尾
 * - 文本型值不跨行（标签后只允许空格/制表符），跨栏拆开的值由 TextNormalizer 预先拼回
 * - 数值型值带单位一起捕获，例如 "445.02 mGy.cm"
 */
public final class PatternLibrary {

    // ==================== 值片段 ====================

    /** 数值（整数或小数） */
    private static final String NUMBER = "\\d*\\.?\\d+";

    /** 英文月份日期，例如 "Jul 1, 1997"、"January 12, 2025" */
    private static final String MONTH_NAME_DATE = "[A-Z][a-z]{2,8}\\.?\\s+\\d{1,2},\\s*\\d{4}";

    /** 年在前，例如 "2025-01-05"、"2025/1/5" */
    private static final String YEAR_FIRST_DATE = "\\d{4}[-/.]\\d{1,2}[-/.]\\d{1,2}";

    /** 日在前，例如 "05/01/2025"、"5.1.2025" */
    private static final String DAY_FIRST_DATE = "\\d{1,2}[-/.]\\d{1,2}[-/.]\\d{4}";

    /** DICOM 紧凑日期，例如 "20250105" */
    private static final String COMPACT_DATE = "\\d{8}(?!\\d)";

    /** 含至少一位数字的字母数字编号 */
    private static final String ALNUM_ID = "[A-Za-z0-9\\-]*\\d[A-Za-z0-9\\-]*";

    /**
     * 同一行中可能紧跟在值后面的已知标签
     *
     * 多栏文本中一行可能包含多个 "标签: 值"，文本型值截止到下一个已知标签之前。
     * 只认已知标签，避免把值中的普通单词误判为标签。
     */
    private static final List<String> KNOWN_LABELS = Arrays.asList(
            "Patient ID", "Patient's Name", "Patient Name", "Patient's Birth Date", "Birth Date",
            "Patient's Sex", "Sex", "Gender", "Patient's Age", "Study ID", "Study Date", "Study Time",
            "Accession Number", "Referring Physician", "Device Observer Name",
            "Device Observer Manufacturer", "Device Observer Model Name", "Device Observer Serial Number",
            "Device Observer Physical Location", "Device Observer UID", "Start of X-Ray Irradiation",
            "End of X-Ray Irradiation", "Acquisition Protocol", "Target Region", "CT Acquisition Type",
            "Procedure Context", "Irradiation Event UID", "Comment", "Identification of the X-Ray Source",
            "CTDIw Phantom Type");

    private static final String NEXT_LABEL;

    /** 下一个已知标签或行尾 */
    private static final String NEXT_LABEL_OR_EOL;

    static {
        List<String> alternatives = new ArrayList<>();
        for (String label : KNOWN_LABELS) {
            alternatives.add(phrase(label));
        }
        String labels = "(?i:" + String.join("|", alternatives) + ")";
        NEXT_LABEL = "(?=[ \\t]+" + labels + "[ \\t]*:)";
        NEXT_LABEL_OR_EOL = "(?=[ \\t]+" + labels + "[ \\t]*:|[ \\t]*$)";
    }

    private final Map<ReportField, List<FieldPattern>> patterns;

    /**
     * @param patterns 字段到有序模式列表的映射（会做防御性拷贝）
     */
    public PatternLibrary(Map<ReportField, List<FieldPattern>> patterns) {
        EnumMap<ReportField, List<FieldPattern>> copy = new EnumMap<>(ReportField.class);
        for (Map.Entry<ReportField, List<FieldPattern>> entry : patterns.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.patterns = Collections.unmodifiableMap(copy);
    }

    /**
     * 获取字段的有序模式列表
     *
     * @param field 字段
     * @return 不可变列表，未配置的字段返回空列表
     */
    public List<FieldPattern> patternsFor(ReportField field) {
        return patterns.getOrDefault(field, Collections.emptyList());
    }

    public Map<ReportField, List<FieldPattern>> asMap() {
        return patterns;
    }

    /**
     * 构建默认模式库（覆盖全部 ReportField）
     *
     * @return 模式库
     * @throws IllegalStateException 如果有字段没有配置模式
     */
    public static PatternLibrary defaultLibrary() {
        Map<ReportField, List<FieldPattern>> map = new EnumMap<>(ReportField.class);

        // ---------- 报告头："By X Hospital on CT, <date>" ----------
        map.put(ReportField.HOSPITAL, Arrays.asList(
                FieldPattern.of("by-hospital-on-ct", "^By\\s+(.*?Hospital.*?)\\s+(?i:on\\s+CT)\\s*,"),
                FieldPattern.of("any-on-ct", "^(?:By\\s+)?(.+?)\\s+(?i:on\\s+CT)\\s*,")));
        map.put(ReportField.REPORT_DATE, Arrays.asList(
                FieldPattern.of("after-on-ct", "(?i:\\bon\\s+CT)\\s*,[ \\t]*(\\S.*)$"),
                FieldPattern.of("report-date-label", "(?i:Report\\s*Date)[ \\t]*:[ \\t]*(\\S.*)$")));

        // ---------- 核心识别信息：编号优先调优 ----------
        map.put(ReportField.PATIENT_ID, Arrays.asList(
                typed("patient-id-digits", "Patient\\s*ID", ":", "\\d+"),
                typed("patient-id-alnum", "Patient\\s*ID", ":", ALNUM_ID),
                // 最宽松，只在以上都失败时使用
                typed("bare-id-digits", "\\bID", ":", "\\d+")));
        map.put(ReportField.STUDY_ID, Arrays.asList(
                typed("study-id-digits", "Study\\s*ID", ":", "\\d+"),
                typed("study-id-alnum", "Study\\s*ID", ":", ALNUM_ID)));
        map.put(ReportField.ACCESSION_NUMBER, Arrays.asList(
                typed("accession-digits", "Accession\\s*Number", ":", "\\d+"),
                typed("accession-alnum", "Accession\\s*Number", ":", ALNUM_ID),
                typed("accession-short-label", "Accession\\s*(?:No\\.?|#)", ":", ALNUM_ID)));
        map.put(ReportField.STUDY_DATE, dates("study-date", "Study\\s*Date"));

        List<FieldPattern> birthDate = new ArrayList<>(dates("patients-birth-date", "Patient'?s\\s*Birth\\s*Date"));
        birthDate.addAll(dates("birth-date", "(?:Birth\\s*Date|Date\\s+of\\s+Birth)"));
        map.put(ReportField.BIRTH_DATE, birthDate);

        map.put(ReportField.SEX, Arrays.asList(
                typed("patients-sex-code", "Patient'?s\\s*Sex", ":", "(?i:male|female|other|M|F|O)\\b"),
                FieldPattern.of("patients-sex-word", "(?i:Patient'?s\\s*Sex)[ \\t]*:[ \\t]*([A-Za-z]+)"),
                typed("sex-code", "\\bSex", ":", "(?i:male|female|other|M|F|O)\\b"),
                typed("gender-code", "\\bGender", ":", "(?i:male|female|other|M|F|O)\\b"),
                FieldPattern.of("gender-word", "(?i:\\bGender)[ \\t]*:[ \\t]*([A-Za-z]+)")));

        // ---------- 设备 ----------
        map.put(ReportField.OBSERVER_NAME, text("observer-name",
                phrase("Device Observer Name"), phrase("Observer Name")));
        map.put(ReportField.MANUFACTURER, text("manufacturer",
                phrase("Device Observer Manufacturer"), "\\bManufacturer"));
        map.put(ReportField.MODEL_NAME, text("model-name",
                phrase("Device Observer Model Name"), phrase("Model Name")));
        map.put(ReportField.SERIAL_NUMBER, text("serial-number",
                phrase("Device Observer Serial Number"), phrase("Serial Number")));
        map.put(ReportField.PHYSICAL_LOCATION, text("physical-location",
                phrase("Device Observer Physical Location during observation"),
                phrase("Device Observer Physical Location"),
                phrase("Physical Location")));

        // ---------- 照射汇总 ----------
        map.put(ReportField.START_TIME, text("start-time", phrase("Start of X-Ray Irradiation")));
        map.put(ReportField.END_TIME, text("end-time", phrase("End of X-Ray Irradiation")));
        map.put(ReportField.TOTAL_EVENTS, measured("total-events",
                phrase("Total Number of Irradiation Events"), "events"));
        List<FieldPattern> totalDlp = new ArrayList<>(measured("total-dlp",
                phrase("CT Dose Length Product Total"), "mGy\\.cm"));
        totalDlp.addAll(measured("total-dlp-short", phrase("Total DLP"), "mGy\\.cm"));
        map.put(ReportField.TOTAL_DLP, totalDlp);

        // ---------- 采集基本信息 ----------
        map.put(ReportField.PROTOCOL, text("protocol", phrase("Acquisition Protocol")));
        map.put(ReportField.TARGET_REGION, text("target-region", phrase("Target Region")));
        map.put(ReportField.ACQUISITION_TYPE, text("acquisition-type", phrase("CT Acquisition Type")));
        map.put(ReportField.PROCEDURE_CONTEXT, text("procedure-context", phrase("Procedure Context")));
        List<FieldPattern> uid = new ArrayList<>();
        uid.add(typed("irradiation-uid-dotted", phrase("Irradiation Event UID"), ":", "\\d+(?:\\.\\d+)+"));
        uid.addAll(text("irradiation-uid", phrase("Irradiation Event UID")));
        map.put(ReportField.IRRADIATION_EVENT_UID, uid);
        map.put(ReportField.COMMENT, text("comment", "\\bComment"));

        // ---------- 采集参数 ----------
        map.put(ReportField.EXPOSURE_TIME, measured("exposure-time",
                phrase("Exposure Time") + "(?!\\s+per)", "s"));
        map.put(ReportField.SCANNING_LENGTH, measured("scanning-length", phrase("Scanning Length"), "mm"));
        map.put(ReportField.NOMINAL_SINGLE_COLLIMATION, measured("single-collimation",
                phrase("Nominal Single Collimation Width"), "mm"));
        map.put(ReportField.NOMINAL_TOTAL_COLLIMATION, measured("total-collimation",
                phrase("Nominal Total Collimation Width"), "mm"));
        map.put(ReportField.NUM_XRAY_SOURCES, measured("xray-sources",
                phrase("Number of X-Ray Sources"), phrase("X-Ray sources")));
        map.put(ReportField.PITCH_FACTOR, measured("pitch-factor", phrase("Pitch Factor"), "ratio"));

        // ---------- X 射线源 ----------
        map.put(ReportField.SOURCE_IDENTIFICATION, text("source-identification",
                phrase("Identification of the X-Ray Source")));
        map.put(ReportField.KVP, measured("kvp", "\\bKVP", "kVp?"));
        map.put(ReportField.MAX_TUBE_CURRENT, measured("max-tube-current",
                phrase("Maximum X-Ray Tube Current"), "mA"));
        map.put(ReportField.TUBE_CURRENT, measured("tube-current",
                "(?<!Maximum\\s)" + phrase("X-Ray Tube Current"), "mA"));
        map.put(ReportField.EXPOSURE_TIME_PER_ROTATION, measured("rotation-time",
                phrase("Exposure Time per Rotation"), "s"));

        // ---------- 剂量 ----------
        map.put(ReportField.MEAN_CTDIVOL, measured("mean-ctdivol", phrase("Mean CTDIvol"), "mGy"));
        map.put(ReportField.PHANTOM_TYPE, text("phantom-type", phrase("CTDIw Phantom Type")));
        map.put(ReportField.DLP, measured("dlp", "\\bDLP", "mGy\\.cm"));
        map.put(ReportField.SIZE_SPECIFIC_DOSE, measured("ssde",
                phrase("Size Specific Dose Estimation"), "mGy"));
        map.put(ReportField.CTDIVOL_ALERT_VALUE, measured("ctdivol-alert",
                phrase("CTDIvol Alert Value"), "mGy"));

        for (ReportField field : ReportField.values()) {
            if (!map.containsKey(field) || map.get(field).isEmpty()) {
                throw new IllegalStateException("字段未配置匹配模式: " + field);
            }
        }
        return new PatternLibrary(map);
    }

    // ==================== 模式构造 ====================

    /**
     * 将空格分隔的标签单词转为允许任意空白的正则
     * 例如 "Mean CTDIvol" -> "Mean\s+CTDIvol"
     */
    static String phrase(String words) {
        return String.join("\\s+", words.trim().split(" +"));
    }

    /**
     * 标签 + 分隔符 + 指定格式的值，值允许跨行（跨栏时值可能被挤到下一行）
     */
    static FieldPattern typed(String name, String labelRegex, String separator, String valueRegex) {
        return FieldPattern.of(name,
                "(?i:" + labelRegex + ")\\s*" + separator + "\\s*(" + valueRegex + ")");
    }

    /**
     * 文本型字段：每个标签生成两个模式
     * 1. 同一行后面还有其他 "Label:"（多栏文本），截止到该标签之前
     * 2. 截止到行尾
     */
    static List<FieldPattern> text(String name, String... labelRegexes) {
        List<FieldPattern> list = new ArrayList<>();
        for (int i = 0; i < labelRegexes.length; i++) {
            String label = "(?i:" + labelRegexes[i] + ")[ \\t]*:[ \\t]*";
            list.add(FieldPattern.of(name + "-" + i + "-bounded", label + "(\\S.*?)" + NEXT_LABEL));
            list.add(FieldPattern.of(name + "-" + i + "-line", label + "(\\S.*)$"));
        }
        return list;
    }

    /**
     * 日期型字段：按日期格式从具体到宽松
     */
    static List<FieldPattern> dates(String name, String labelRegex) {
        return Arrays.asList(
                typed(name + "-month-name", labelRegex, ":", MONTH_NAME_DATE),
                typed(name + "-year-first", labelRegex, ":", YEAR_FIRST_DATE),
                typed(name + "-day-first", labelRegex, ":", DAY_FIRST_DATE),
                typed(name + "-compact", labelRegex, ":", COMPACT_DATE),
                FieldPattern.of(name + "-free-text",
                        "(?i:" + labelRegex + ")[ \\t]*:[ \\t]*(\\S.*?)" + NEXT_LABEL_OR_EOL));
    }

    /**
     * 数值型字段（保留单位）：
     * 1. "Label = 数值 单位"
     * 2. "Label: 数值 单位"
     * 3. "Label = 数值" 或 "Label: 数值"（无单位，最宽松）
     */
    static List<FieldPattern> measured(String name, String labelRegex, String unitRegex) {
        int flags = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;
        String valueWithUnit = "(" + NUMBER + "\\s*" + unitRegex + ")(?![A-Za-z])";
        return Arrays.asList(
                new FieldPattern(name + "-equals-unit",
                        Pattern.compile(labelRegex + "\\s*=\\s*" + valueWithUnit, flags)),
                new FieldPattern(name + "-colon-unit",
                        Pattern.compile(labelRegex + "\\s*:\\s*" + valueWithUnit, flags)),
                new FieldPattern(name + "-bare-number",
                        Pattern.compile(labelRegex + "\\s*[=:]\\s*(" + NUMBER + ")(?![\\d.])", flags)));
    }
}
