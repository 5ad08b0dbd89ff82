package com.example.ctdose.service;

import com.example.ctdose.config.CtDoseProperties;
import com.example.ctdose.dto.Report;
import com.example.ctdose.util.export.ExportWriteException;
import com.example.ctdose.util.export.ReportJsonExporter;
import com.example.ctdose.util.extract.ReportAssembler;
import com.example.ctdose.util.pdf.DocumentReadException;
import com.example.ctdose.util.pdf.DocumentTextRenderer;
import com.example.ctdose.util.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * CT 剂量报告提取服务
 *
 * 处理流程：PDF -> 文本 -> 归一化 -> 报告组装 -> JSON 导出
 *
 * 批处理按文件名顺序逐个处理，文档之间互不影响：
 * 单个 PDF 读取失败或处理异常只记录失败，继续处理后续文档。
 */
@Slf4j
@Service
public class CtDoseExtractionService {

    private final DocumentTextRenderer renderer;
    private final ReportAssembler assembler;
    private final ReportJsonExporter exporter;
    private final CtDoseProperties properties;

    public CtDoseExtractionService(DocumentTextRenderer renderer,
                                   ReportAssembler assembler,
                                   ReportJsonExporter exporter,
                                   CtDoseProperties properties) {
        this.renderer = renderer;
        this.assembler = assembler;
        this.exporter = exporter;
        this.properties = properties;
    }

    /**
     * 从已渲染的文本组装报告
     *
     * @param rawText PDF 渲染出的原始文本
     * @return 报告（字段全部缺失时也返回）
     */
    public Report extractFromText(String rawText) {
        return assembler.assemble(TextNormalizer.normalize(rawText));
    }

    /**
     * 提取单个 PDF
     *
     * @param pdfFile PDF 文件
     * @return 报告
     * @throws DocumentReadException PDF 无法读取
     */
    public Report extract(File pdfFile) throws DocumentReadException {
        String text = renderer.render(pdfFile);
        Report report = extractFromText(text);
        log.info("报告提取完成: {}, patientId={}, 采集数={}",
                pdfFile.getName(), report.getEssential().getPatientId(), report.getAcquisitions().size());
        return report;
    }

    /**
     * 提取上传的 PDF
     *
     * @param input        PDF 内容，调用方负责关闭
     * @param documentName 原始文件名
     * @return 报告
     * @throws DocumentReadException PDF 无法读取
     */
    public Report extract(InputStream input, String documentName) throws DocumentReadException {
        String text = renderer.render(input, documentName);
        Report report = extractFromText(text);
        log.info("报告提取完成: {}, patientId={}, 采集数={}",
                documentName, report.getEssential().getPatientId(), report.getAcquisitions().size());
        return report;
    }

    /**
     * 查找目录中的 PDF（扩展名不区分大小写，按文件名排序）
     *
     * 目录不存在时创建目录并返回空列表。
     */
    public List<File> discoverPdfs(File sourceFolder) {
        if (!sourceFolder.exists()) {
            boolean created = sourceFolder.mkdirs();
            log.warn("PDF目录不存在，已创建: {}, 结果: {}", sourceFolder.getAbsolutePath(), created);
            return Collections.emptyList();
        }

        File[] files = sourceFolder.listFiles((dir, name) -> name.toLowerCase().endsWith(".pdf"));
        if (files == null || files.length == 0) {
            log.warn("目录中没有PDF文件: {}", sourceFolder.getAbsolutePath());
            return Collections.emptyList();
        }

        List<File> pdfs = new ArrayList<>(Arrays.asList(files));
        pdfs.removeIf(f -> !f.isFile());
        pdfs.sort(Comparator.comparing(File::getName));
        return pdfs;
    }

    /**
     * 逐个提取目录中的 PDF（不导出）
     *
     * @param sourceFolder PDF 目录
     * @return 批处理结果
     */
    public BatchResult processFolder(File sourceFolder) {
        BatchResult result = new BatchResult();
        List<File> pdfs = discoverPdfs(sourceFolder);
        log.info("开始批量处理: {}, PDF数量={}", sourceFolder.getAbsolutePath(), pdfs.size());

        for (File pdf : pdfs) {
            try {
                result.addReport(extract(pdf));
            } catch (DocumentReadException e) {
                log.error("PDF处理失败，跳过: {}, {}", pdf.getName(), e.getMessage());
                result.addFailure(pdf.getName(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("PDF处理异常，跳过: {}", pdf.getName(), e);
                result.addFailure(pdf.getName(), "处理异常: " + e);
            }
        }

        log.info("批量处理完成: 成功={}, 失败={}", result.getProcessedCount(), result.getFailures().size());
        return result;
    }

    /**
     * 批量提取并导出 JSON
     *
     * @param sourceFolder      PDF 目录，为空时使用配置
     * @param outputFolder      JSON 输出目录，为空时使用配置
     * @param aggregateFileName 汇总文件名，为空时使用配置
     * @return 批处理结果
     */
    public BatchResult runBatch(String sourceFolder, String outputFolder, String aggregateFileName) {
        CtDoseProperties.Batch batch = properties.getBatch();
        File source = new File(orDefault(sourceFolder, batch.getSourceFolder()));
        File output = new File(orDefault(outputFolder, batch.getOutputFolder()));
        String aggregate = orDefault(aggregateFileName, batch.getAggregateFileName());

        BatchResult result = processFolder(source);
        if (result.getReports().isEmpty()) {
            log.warn("没有可导出的报告");
            return result;
        }

        List<ExportWriteException> exportFailures = exporter.export(result.getReports(), output, aggregate);
        for (ExportWriteException e : exportFailures) {
            result.addExportFailure(e.getMessage());
        }

        File aggregateFile = new File(output, aggregate);
        boolean aggregateFailed = exportFailures.stream()
                .anyMatch(e -> aggregateFile.getAbsolutePath().equals(e.getTarget()));
        if (!aggregateFailed) {
            result.setAggregatePath(aggregateFile.getAbsolutePath());
        }
        return result;
    }

    private static String orDefault(String value, String defaultValue) {
        return (value == null || value.trim().isEmpty()) ? defaultValue : value.trim();
    }
}
