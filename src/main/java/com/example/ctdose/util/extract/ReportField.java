package com.example.ctdose.util.extract;

/**
 * 报告中的逻辑字段
 *
 * scope 决定字段在哪段文本上匹配：
 * - HEADER：报告开头几行（医院、报告日期）
 * - DOCUMENT：整篇文本
 * - ACQUISITION：单个采集块，不能跨越采集边界
 */
public enum ReportField {

    // 报告头
    HOSPITAL(Scope.HEADER),
    REPORT_DATE(Scope.HEADER),

    // 核心识别信息
    PATIENT_ID(Scope.DOCUMENT),
    STUDY_ID(Scope.DOCUMENT),
    ACCESSION_NUMBER(Scope.DOCUMENT),
    STUDY_DATE(Scope.DOCUMENT),
    BIRTH_DATE(Scope.DOCUMENT),
    SEX(Scope.DOCUMENT),

    // 设备
    OBSERVER_NAME(Scope.DOCUMENT),
    MANUFACTURER(Scope.DOCUMENT),
    MODEL_NAME(Scope.DOCUMENT),
    SERIAL_NUMBER(Scope.DOCUMENT),
    PHYSICAL_LOCATION(Scope.DOCUMENT),

    // 照射汇总
    START_TIME(Scope.DOCUMENT),
    END_TIME(Scope.DOCUMENT),
    TOTAL_EVENTS(Scope.DOCUMENT),
    TOTAL_DLP(Scope.DOCUMENT),

    // 采集基本信息
    PROTOCOL(Scope.ACQUISITION),
    TARGET_REGION(Scope.ACQUISITION),
    ACQUISITION_TYPE(Scope.ACQUISITION),
    PROCEDURE_CONTEXT(Scope.ACQUISITION),
    IRRADIATION_EVENT_UID(Scope.ACQUISITION),
    COMMENT(Scope.ACQUISITION),

    // 采集参数
    EXPOSURE_TIME(Scope.ACQUISITION),
    SCANNING_LENGTH(Scope.ACQUISITION),
    NOMINAL_SINGLE_COLLIMATION(Scope.ACQUISITION),
    NOMINAL_TOTAL_COLLIMATION(Scope.ACQUISITION),
    NUM_XRAY_SOURCES(Scope.ACQUISITION),
    PITCH_FACTOR(Scope.ACQUISITION),

    // X 射线源
    SOURCE_IDENTIFICATION(Scope.ACQUISITION),
    KVP(Scope.ACQUISITION),
    MAX_TUBE_CURRENT(Scope.ACQUISITION),
    TUBE_CURRENT(Scope.ACQUISITION),
    EXPOSURE_TIME_PER_ROTATION(Scope.ACQUISITION),

    // 剂量
    MEAN_CTDIVOL(Scope.ACQUISITION),
    PHANTOM_TYPE(Scope.ACQUISITION),
    DLP(Scope.ACQUISITION),
    SIZE_SPECIFIC_DOSE(Scope.ACQUISITION),
    CTDIVOL_ALERT_VALUE(Scope.ACQUISITION);

    public enum Scope {
        HEADER,
        DOCUMENT,
        ACQUISITION
    }

    private final Scope scope;

    ReportField(Scope scope) {
        this.scope = scope;
    }

    public Scope getScope() {
        return scope;
    }
}
