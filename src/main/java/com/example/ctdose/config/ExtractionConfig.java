package com.example.ctdose.config;

import com.example.ctdose.util.date.AgeCalculator;
import com.example.ctdose.util.export.DoseSheetRowMapper;
import com.example.ctdose.util.export.ExcelReportWriter;
import com.example.ctdose.util.export.ReportJsonExporter;
import com.example.ctdose.util.export.ReportJsonReader;
import com.example.ctdose.util.extract.AcquisitionMarkerPolicy;
import com.example.ctdose.util.extract.AcquisitionSegmenter;
import com.example.ctdose.util.extract.FieldMatcher;
import com.example.ctdose.util.extract.PatternLibrary;
import com.example.ctdose.util.extract.ReportAssembler;
import com.example.ctdose.util.pdf.DocumentTextRenderer;
import com.example.ctdose.util.pdf.PdfBoxTextRenderer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 提取引擎和导出组件
 *
 * 模式库、标记规则、ObjectMapper 启动时创建一次，所有文档共享（均不可变/线程安全）。
 * 标记正则非法时启动失败。
 */
@Configuration
public class ExtractionConfig {

    @Bean
    public PatternLibrary patternLibrary() {
        return PatternLibrary.defaultLibrary();
    }

    @Bean
    public AcquisitionMarkerPolicy acquisitionMarkerPolicy(CtDoseProperties properties) {
        return AcquisitionMarkerPolicy.fromRegexes(properties.getExtraction().getAcquisitionMarkers());
    }

    @Bean
    public FieldMatcher fieldMatcher(PatternLibrary patternLibrary) {
        return new FieldMatcher(patternLibrary);
    }

    @Bean
    public AcquisitionSegmenter acquisitionSegmenter(AcquisitionMarkerPolicy policy) {
        return new AcquisitionSegmenter(policy);
    }

    @Bean
    public ReportAssembler reportAssembler(FieldMatcher fieldMatcher, AcquisitionSegmenter segmenter) {
        return new ReportAssembler(fieldMatcher, segmenter);
    }

    @Bean
    public DocumentTextRenderer documentTextRenderer() {
        return new PdfBoxTextRenderer();
    }

    @Bean
    public AgeCalculator ageCalculator() {
        return new AgeCalculator();
    }

    /**
     * 报告 JSON 专用（缩进输出，忽略未知字段以兼容旧版本 JSON）
     */
    @Bean
    public ObjectMapper reportObjectMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public ReportJsonExporter reportJsonExporter(ObjectMapper reportObjectMapper) {
        return new ReportJsonExporter(reportObjectMapper);
    }

    @Bean
    public ReportJsonReader reportJsonReader(ObjectMapper reportObjectMapper) {
        return new ReportJsonReader(reportObjectMapper);
    }

    @Bean
    public DoseSheetRowMapper doseSheetRowMapper(AgeCalculator ageCalculator) {
        return new DoseSheetRowMapper(ageCalculator);
    }

    @Bean
    public ExcelReportWriter excelReportWriter() {
        return new ExcelReportWriter();
    }
}
