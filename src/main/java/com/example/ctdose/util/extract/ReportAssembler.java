package com.example.ctdose.util.extract;

import com.example.ctdose.dto.Acquisition;
import com.example.ctdose.dto.AcquisitionParams;
import com.example.ctdose.dto.CtDose;
import com.example.ctdose.dto.DeviceInfo;
import com.example.ctdose.dto.EssentialInfo;
import com.example.ctdose.dto.IrradiationInfo;
import com.example.ctdose.dto.Report;
import com.example.ctdose.dto.XraySourceParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 报告组装器：一份归一化文本 -> 一个 Report
 *
 * 组装顺序：
 * 1. 报告头（前几行）：医院、报告日期
 * 2. 全文：核心识别信息
 * 3. 全文：设备、照射汇总
 * 4. 切分采集块
 * 5. 每个采集块内：采集参数、X 射线源、剂量（字段不跨越采集边界）
 *
 * 单个字段匹配失败不会中断组装；所有字段都缺失的 Report 仍然有效。
 */
public class ReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

    /** 报告头取前几行（医院名称和报告日期所在位置） */
    static final int HEADER_LINE_COUNT = 5;

    private final FieldMatcher matcher;
    private final AcquisitionSegmenter segmenter;

    public ReportAssembler(FieldMatcher matcher, AcquisitionSegmenter segmenter) {
        this.matcher = matcher;
        this.segmenter = segmenter;
    }

    /**
     * 组装报告
     *
     * @param normalizedText TextNormalizer 输出的文本
     * @return 报告（不会返回 null）
     */
    public Report assemble(String normalizedText) {
        String text = normalizedText != null ? normalizedText : "";
        ScopedText document = new ScopedText(headerOf(text), text, null);

        EssentialInfo essential = new EssentialInfo(
                find(document, ReportField.PATIENT_ID),
                find(document, ReportField.STUDY_ID),
                find(document, ReportField.ACCESSION_NUMBER),
                find(document, ReportField.STUDY_DATE),
                find(document, ReportField.BIRTH_DATE),
                find(document, ReportField.SEX));

        if (log.isDebugEnabled()) {
            log.debug("核心识别信息: patientId='{}', studyId='{}', accession='{}', studyDate='{}', birthDate='{}', sex='{}'",
                    essential.getPatientId(), essential.getStudyId(), essential.getAccessionNumber(),
                    essential.getStudyDate(), essential.getBirthDate(), essential.getSex());
        }

        DeviceInfo device = new DeviceInfo(
                find(document, ReportField.OBSERVER_NAME),
                find(document, ReportField.MANUFACTURER),
                find(document, ReportField.MODEL_NAME),
                find(document, ReportField.SERIAL_NUMBER),
                find(document, ReportField.PHYSICAL_LOCATION));

        IrradiationInfo irradiation = new IrradiationInfo(
                find(document, ReportField.START_TIME),
                find(document, ReportField.END_TIME),
                find(document, ReportField.TOTAL_EVENTS),
                find(document, ReportField.TOTAL_DLP));

        List<String> blocks = segmenter.segment(text);
        List<Acquisition> acquisitions = new ArrayList<>(blocks.size());
        for (String block : blocks) {
            acquisitions.add(assembleAcquisition(document.withBlock(block)));
        }
        log.debug("采集块数量: {}", acquisitions.size());

        return new Report(find(document, ReportField.HOSPITAL), find(document, ReportField.REPORT_DATE),
                essential, device, irradiation, acquisitions);
    }

    /**
     * 组装单个采集（只在该采集块内匹配）
     */
    Acquisition assembleAcquisition(String block) {
        return assembleAcquisition(new ScopedText(null, null, block));
    }

    private Acquisition assembleAcquisition(ScopedText scoped) {
        AcquisitionParams params = new AcquisitionParams(
                find(scoped, ReportField.EXPOSURE_TIME),
                find(scoped, ReportField.SCANNING_LENGTH),
                find(scoped, ReportField.NOMINAL_SINGLE_COLLIMATION),
                find(scoped, ReportField.NOMINAL_TOTAL_COLLIMATION),
                find(scoped, ReportField.NUM_XRAY_SOURCES),
                find(scoped, ReportField.PITCH_FACTOR));

        XraySourceParams xray = new XraySourceParams(
                find(scoped, ReportField.SOURCE_IDENTIFICATION),
                find(scoped, ReportField.KVP),
                find(scoped, ReportField.MAX_TUBE_CURRENT),
                find(scoped, ReportField.TUBE_CURRENT),
                find(scoped, ReportField.EXPOSURE_TIME_PER_ROTATION));

        CtDose dose = new CtDose(
                find(scoped, ReportField.MEAN_CTDIVOL),
                find(scoped, ReportField.PHANTOM_TYPE),
                find(scoped, ReportField.DLP),
                find(scoped, ReportField.SIZE_SPECIFIC_DOSE),
                find(scoped, ReportField.CTDIVOL_ALERT_VALUE));

        return new Acquisition(
                find(scoped, ReportField.PROTOCOL),
                find(scoped, ReportField.TARGET_REGION),
                find(scoped, ReportField.ACQUISITION_TYPE),
                find(scoped, ReportField.PROCEDURE_CONTEXT),
                find(scoped, ReportField.IRRADIATION_EVENT_UID),
                find(scoped, ReportField.COMMENT),
                params, xray, dose);
    }

    /**
     * 按字段的 scope 选择匹配的文本；该 scope 没有文本时字段缺失
     */
    String find(ScopedText scoped, ReportField field) {
        String source = scoped.textFor(field.getScope());
        return source != null ? matcher.matchOrNull(source, field) : null;
    }

    /**
     * 取文本的前 HEADER_LINE_COUNT 行
     */
    static String headerOf(String text) {
        int index = -1;
        for (int i = 0; i < HEADER_LINE_COUNT; i++) {
            index = text.indexOf('\n', index + 1);
            if (index < 0) {
                return text;
            }
        }
        return text.substring(0, index);
    }

    /**
     * 一次匹配可用的三段文本：报告头、全文、当前采集块
     */
    static final class ScopedText {
        private final String header;
        private final String document;
        private final String block;

        ScopedText(String header, String document, String block) {
            this.header = header;
            this.document = document;
            this.block = block;
        }

        ScopedText withBlock(String block) {
            return new ScopedText(header, document, block);
        }

        String textFor(ReportField.Scope scope) {
            switch (scope) {
                case HEADER:
                    return header;
                case ACQUISITION:
                    return block;
                default:
                    return document;
            }
        }
    }
}
