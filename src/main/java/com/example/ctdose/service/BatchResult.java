package com.example.ctdose.service;

import com.example.ctdose.dto.Report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 批处理结果
 *
 * reports 按处理顺序；failures 为无法读取的文档；exportFailures 为写入失败的输出文件。
 */
public class BatchResult {

    private final List<Report> reports = new ArrayList<>();
    private final List<DocumentFailure> failures = new ArrayList<>();
    private final List<String> exportFailures = new ArrayList<>();
    private String aggregatePath;

    void addReport(Report report) {
        reports.add(report);
    }

    void addFailure(String fileName, String message) {
        failures.add(new DocumentFailure(fileName, message));
    }

    void addExportFailure(String message) {
        exportFailures.add(message);
    }

    void setAggregatePath(String aggregatePath) {
        this.aggregatePath = aggregatePath;
    }

    public List<Report> getReports() {
        return Collections.unmodifiableList(reports);
    }

    public List<DocumentFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public List<String> getExportFailures() {
        return Collections.unmodifiableList(exportFailures);
    }

    /**
     * @return 汇总 JSON 路径，未导出或导出失败时为 null
     */
    public String getAggregatePath() {
        return aggregatePath;
    }

    public int getProcessedCount() {
        return reports.size();
    }

    /**
     * @return 没有读取失败也没有导出失败
     */
    public boolean isComplete() {
        return failures.isEmpty() && exportFailures.isEmpty();
    }

    /**
     * 单个文档的失败记录
     */
    public static class DocumentFailure {
        private final String fileName;
        private final String message;

        public DocumentFailure(String fileName, String message) {
            this.fileName = fileName;
            this.message = message;
        }

        public String getFileName() {
            return fileName;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return fileName + ": " + message;
        }
    }
}
