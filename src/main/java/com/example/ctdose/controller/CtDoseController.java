package com.example.ctdose.controller;

import com.example.ctdose.dto.Report;
import com.example.ctdose.service.BatchResult;
import com.example.ctdose.service.CtDoseExcelService;
import com.example.ctdose.service.CtDoseExtractionService;
import com.example.ctdose.util.pdf.DocumentReadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CT 剂量报告提取控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/ct-dose")
public class CtDoseController {

    @Autowired
    private CtDoseExtractionService extractionService;

    @Autowired
    private CtDoseExcelService excelService;

    /**
     * 提取单个剂量报告 PDF
     *
     * @param file PDF文件
     * @return 包含 report 的响应
     */
    @PostMapping("/extract")
    public ResponseEntity<Map<String, Object>> extract(@RequestParam("file") MultipartFile file) {
        Map<String, Object> result = new HashMap<>();

        // 验证文件
        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".pdf")) {
            result.put("success", false);
            result.put("message", "只支持.pdf文件");
            return ResponseEntity.badRequest().body(result);
        }

        try (InputStream is = file.getInputStream()) {
            log.info("接收文件: {}", originalFilename);
            Report report = extractionService.extract(is, originalFilename);

            result.put("success", true);
            result.put("fileName", originalFilename);
            result.put("report", report);
            return ResponseEntity.ok(result);

        } catch (DocumentReadException e) {
            log.warn("PDF无法读取: {}, {}", originalFilename, e.getMessage());
            result.put("success", false);
            result.put("message", "PDF无法读取: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);

        } catch (IOException e) {
            log.error("文件读取失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "文件读取失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 批量提取目录中的 PDF 并导出 JSON
     *
     * @param sourceFolder      PDF目录（可选，默认使用配置）
     * @param outputFolder      JSON输出目录（可选，默认使用配置）
     * @param aggregateFileName 汇总文件名（可选，默认使用配置）
     * @return 处理数量、失败列表、汇总文件路径
     */
    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> batch(
            @RequestParam(value = "sourceFolder", required = false) String sourceFolder,
            @RequestParam(value = "outputFolder", required = false) String outputFolder,
            @RequestParam(value = "aggregateFileName", required = false) String aggregateFileName) {

        Map<String, Object> result = new HashMap<>();
        try {
            BatchResult batch = extractionService.runBatch(sourceFolder, outputFolder, aggregateFileName);

            List<Map<String, Object>> failed = new ArrayList<>();
            for (BatchResult.DocumentFailure failure : batch.getFailures()) {
                Map<String, Object> item = new HashMap<>();
                item.put("fileName", failure.getFileName());
                item.put("message", failure.getMessage());
                failed.add(item);
            }

            result.put("success", batch.getExportFailures().isEmpty());
            result.put("processed", batch.getProcessedCount());
            result.put("failed", failed);
            result.put("exportFailures", batch.getExportFailures());
            result.put("aggregatePath", batch.getAggregatePath());
            return ResponseEntity.ok(result);

        } catch (Exception e) {
            log.error("批量处理失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "批量处理失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * JSON 报告转换为 Excel 剂量表格
     *
     * @param inputFolder JSON目录（可选，默认使用配置）
     * @param outputFile  XLSX文件（可选，默认使用配置）
     * @return 行数和输出文件路径
     */
    @PostMapping("/excel")
    public ResponseEntity<Map<String, Object>> excel(
            @RequestParam(value = "inputFolder", required = false) String inputFolder,
            @RequestParam(value = "outputFile", required = false) String outputFile) {

        Map<String, Object> result = new HashMap<>();
        try {
            int rows = excelService.convert(inputFolder, outputFile);

            result.put("success", true);
            result.put("rows", rows);
            result.put("outputFile", excelService.resolveOutputFile(outputFile));
            return ResponseEntity.ok(result);

        } catch (IOException e) {
            log.error("Excel生成失败: {}", e.getMessage(), e);
            result.put("success", false);
            result.put("message", "Excel生成失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }
}
