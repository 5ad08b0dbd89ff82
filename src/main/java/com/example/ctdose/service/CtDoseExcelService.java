package com.example.ctdose.service;

import com.example.ctdose.config.CtDoseProperties;
import com.example.ctdose.dto.Report;
import com.example.ctdose.util.export.DoseSheetRow;
import com.example.ctdose.util.export.DoseSheetRowMapper;
import com.example.ctdose.util.export.ExcelReportWriter;
import com.example.ctdose.util.export.ReportJsonReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * JSON 报告 -> XLSX 剂量表格
 */
@Slf4j
@Service
public class CtDoseExcelService {

    private final ReportJsonReader reader;
    private final DoseSheetRowMapper rowMapper;
    private final ExcelReportWriter writer;
    private final CtDoseProperties properties;

    public CtDoseExcelService(ReportJsonReader reader,
                              DoseSheetRowMapper rowMapper,
                              ExcelReportWriter writer,
                              CtDoseProperties properties) {
        this.reader = reader;
        this.rowMapper = rowMapper;
        this.writer = writer;
        this.properties = properties;
    }

    /**
     * 读取 JSON 目录并生成表格
     *
     * @param inputFolder JSON 目录，为空时使用配置
     * @param outputFile  XLSX 文件，为空时使用配置
     * @return 写入的数据行数
     * @throws IOException JSON 读取失败或表格写入失败
     */
    public int convert(String inputFolder, String outputFile) throws IOException {
        CtDoseProperties.Excel excel = properties.getExcel();
        File input = new File(orDefault(inputFolder, excel.getInputFolder()));
        File output = new File(orDefault(outputFile, excel.getOutputFile()));

        List<Report> reports = reader.read(input, properties.getBatch().getAggregateFileName());
        log.info("读取到报告数: {}", reports.size());

        List<DoseSheetRow> rows = rowMapper.toRows(reports);
        writer.write(rows, output);
        return rows.size();
    }

    /**
     * @return 实际使用的输出文件路径
     */
    public String resolveOutputFile(String outputFile) {
        return new File(orDefault(outputFile, properties.getExcel().getOutputFile())).getAbsolutePath();
    }

    private static String orDefault(String value, String defaultValue) {
        return (value == null || value.trim().isEmpty()) ? defaultValue : value.trim();
    }
}
