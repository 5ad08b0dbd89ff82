package com.example.ctdose.config;

import com.example.ctdose.util.extract.AcquisitionMarkerPolicy;
import com.example.ctdose.util.export.ReportJsonExporter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 剂量报告提取配置（前缀 ctdose）
 */
@ConfigurationProperties(prefix = "ctdose")
public class CtDoseProperties {

    private final Extraction extraction = new Extraction();
    private final Batch batch = new Batch();
    private final Excel excel = new Excel();

    public Extraction getExtraction() {
        return extraction;
    }

    public Batch getBatch() {
        return batch;
    }

    public Excel getExcel() {
        return excel;
    }

    public static class Extraction {

        /**
         * 采集块起始标记正则，任意一个命中即开始新的采集块
         */
        private List<String> acquisitionMarkers =
                new ArrayList<>(Collections.singletonList(AcquisitionMarkerPolicy.DEFAULT_MARKER));

        public List<String> getAcquisitionMarkers() {
            return acquisitionMarkers;
        }

        public void setAcquisitionMarkers(List<String> acquisitionMarkers) {
            this.acquisitionMarkers = acquisitionMarkers;
        }
    }

    public static class Batch {

        /** PDF 输入目录 */
        private String sourceFolder = "ct_reports";

        /** JSON 输出目录 */
        private String outputFolder = "ct_reports_json";

        /** 汇总 JSON 文件名 */
        private String aggregateFileName = ReportJsonExporter.DEFAULT_AGGREGATE_FILE_NAME;

        public String getSourceFolder() {
            return sourceFolder;
        }

        public void setSourceFolder(String sourceFolder) {
            this.sourceFolder = sourceFolder;
        }

        public String getOutputFolder() {
            return outputFolder;
        }

        public void setOutputFolder(String outputFolder) {
            this.outputFolder = outputFolder;
        }

        public String getAggregateFileName() {
            return aggregateFileName;
        }

        public void setAggregateFileName(String aggregateFileName) {
            this.aggregateFileName = aggregateFileName;
        }
    }

    public static class Excel {

        /** JSON 输入目录 */
        private String inputFolder = "ct_reports_json";

        /** XLSX 输出文件 */
        private String outputFile = "ct_dose_report.xlsx";

        public String getInputFolder() {
            return inputFolder;
        }

        public void setInputFolder(String inputFolder) {
            this.inputFolder = inputFolder;
        }

        public String getOutputFile() {
            return outputFile;
        }

        public void setOutputFile(String outputFile) {
            this.outputFile = outputFile;
        }
    }
}
