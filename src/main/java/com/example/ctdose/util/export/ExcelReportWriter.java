package com.example.ctdose.util.export;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.List;

/**
 * 剂量表格写入 XLSX
 *
 * 工作表 "CT Reports"：第一行为表头（粗体、灰色底），所有单元格细边框，列宽固定。
 */
public class ExcelReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ExcelReportWriter.class);

    public static final String SHEET_NAME = "CT Reports";

    /** 列宽（字符数），与 DoseSheetRow.HEADERS 一一对应 */
    private static final int[] COLUMN_WIDTHS = {
            15, 6, 14, 6, 28, 14, 30, 14, 10, 10, 12, 14, 14, 16, 10, 14
    };

    /**
     * 写入表格
     *
     * @param rows   数据行
     * @param output 输出文件（父目录不存在则创建）
     * @throws ExportWriteException 写入失败
     */
    public void write(List<DoseSheetRow> rows, File output) throws ExportWriteException {
        File parent = output.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new ExportWriteException(output.getAbsolutePath(), "无法创建输出目录: " + parent.getAbsolutePath(), null);
        }

        try (Workbook workbook = new XSSFWorkbook();
             OutputStream os = Files.newOutputStream(output.toPath())) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            CellStyle headerStyle = headerStyle(workbook);
            CellStyle bodyStyle = bodyStyle(workbook);

            // 表头
            Row headerRow = sheet.createRow(0);
            for (int col = 0; col < DoseSheetRow.HEADERS.size(); col++) {
                Cell cell = headerRow.createCell(col);
                cell.setCellValue(DoseSheetRow.HEADERS.get(col));
                cell.setCellStyle(headerStyle);
            }

            // 数据行
            int rowIndex = 1;
            for (DoseSheetRow dataRow : rows) {
                Row row = sheet.createRow(rowIndex++);
                List<String> cells = dataRow.getCells();
                for (int col = 0; col < cells.size(); col++) {
                    Cell cell = row.createCell(col);
                    cell.setCellValue(cells.get(col));
                    cell.setCellStyle(bodyStyle);
                }
            }

            for (int col = 0; col < COLUMN_WIDTHS.length; col++) {
                sheet.setColumnWidth(col, COLUMN_WIDTHS[col] * 256);
            }
            sheet.createFreezePane(0, 1);

            workbook.write(os);
        } catch (IOException e) {
            throw new ExportWriteException(output.getAbsolutePath(),
                    "Excel写入失败: " + output.getAbsolutePath() + ", " + e.getMessage(), e);
        }

        log.info("Excel已写入: {}, 数据行数={}", output.getAbsolutePath(), rows.size());
    }

    private static CellStyle headerStyle(Workbook workbook) {
        CellStyle style = bodyStyle(workbook);
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }

    private static CellStyle bodyStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        return style;
    }
}
