package com.example.ctdose.util.export;

import com.example.ctdose.dto.Report;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 报告 JSON 导出
 *
 * 生成两类文件：
 * - 汇总文件（默认 ct_reports_all.json）：全部报告的数组，按处理顺序
 * - 单患者文件 ct_report_{patient_id}.json：只含一个元素的数组
 *
 * 没有 patient_id 的报告只出现在汇总文件中。
 */
public class ReportJsonExporter {

    private static final Logger log = LoggerFactory.getLogger(ReportJsonExporter.class);

    public static final String DEFAULT_AGGREGATE_FILE_NAME = "ct_reports_all.json";

    static final String PATIENT_FILE_PREFIX = "ct_report_";

    private final ObjectMapper mapper;

    public ReportJsonExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 导出汇总文件和单患者文件
     *
     * 单个文件写入失败不影响其它文件。
     *
     * @param reports           报告列表
     * @param outputDir         输出目录（不存在则创建）
     * @param aggregateFileName 汇总文件名，为空时使用默认值
     * @return 写入失败的文件（全部成功时为空列表）
     */
    public List<ExportWriteException> export(List<Report> reports, File outputDir, String aggregateFileName) {
        List<ExportWriteException> failures = new ArrayList<>();

        for (Report report : reports) {
            if (patientFileName(report) == null) {
                log.debug("报告缺少 patient_id，只写入汇总文件");
                continue;
            }
            try {
                writePatientReport(report, outputDir);
            } catch (ExportWriteException e) {
                log.error("单患者JSON写入失败: {}", e.getMessage(), e);
                failures.add(e);
            }
        }

        try {
            writeAggregate(reports, outputDir, aggregateFileName);
        } catch (ExportWriteException e) {
            log.error("汇总JSON写入失败: {}", e.getMessage(), e);
            failures.add(e);
        }
        return failures;
    }

    /**
     * 写入汇总文件
     *
     * @return 写入的文件
     */
    public File writeAggregate(List<Report> reports, File outputDir, String aggregateFileName)
            throws ExportWriteException {
        String fileName = (aggregateFileName == null || aggregateFileName.trim().isEmpty())
                ? DEFAULT_AGGREGATE_FILE_NAME : aggregateFileName.trim();
        File target = new File(outputDir, fileName);
        write(reports, target);
        log.info("汇总JSON已写入: {}, 报告数={}", target.getAbsolutePath(), reports.size());
        return target;
    }

    /**
     * 写入单患者文件（内容为只含一个元素的数组）
     *
     * @return 写入的文件
     * @throws ExportWriteException 报告缺少 patient_id 或写入失败
     */
    public File writePatientReport(Report report, File outputDir) throws ExportWriteException {
        String fileName = patientFileName(report);
        if (fileName == null) {
            throw new ExportWriteException(null, "报告缺少 patient_id，无法生成单患者文件", null);
        }
        File target = new File(outputDir, fileName);
        write(Collections.singletonList(report), target);
        log.info("单患者JSON已写入: {}", target.getAbsolutePath());
        return target;
    }

    /**
     * 单患者文件名，patient_id 中不能出现在文件名里的字符替换为下划线
     *
     * @return 文件名，报告没有 patient_id 时返回 null
     */
    static String patientFileName(Report report) {
        String patientId = report.getEssential().getPatientId();
        if (patientId == null || patientId.trim().isEmpty()) {
            return null;
        }
        return PATIENT_FILE_PREFIX + patientId.trim().replaceAll("[\\\\/:*?\"<>|\\s]", "_") + ".json";
    }

    private void write(List<Report> reports, File target) throws ExportWriteException {
        File parent = target.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new ExportWriteException(target.getAbsolutePath(), "无法创建输出目录: " + parent.getAbsolutePath(), null);
        }
        try {
            mapper.writeValue(target, reports);
        } catch (IOException e) {
            throw new ExportWriteException(target.getAbsolutePath(),
                    "JSON写入失败: " + target.getAbsolutePath() + ", " + e.getMessage(), e);
        }
    }
}
