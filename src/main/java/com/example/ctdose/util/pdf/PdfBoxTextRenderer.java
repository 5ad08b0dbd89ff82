package com.example.ctdose.util.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.io.RandomAccessReadBuffer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * 基于 PDFBox 的文本渲染
 *
 * 剂量报告多为两栏排版，按坐标排序（sortByPosition）后同一行左右两栏的文本会出现在同一行，
 * 被拆开的 "标签 / 值" 由 TextNormalizer 再拼接。
 */
public class PdfBoxTextRenderer implements DocumentTextRenderer {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextRenderer.class);

    @Override
    public String render(File file) throws DocumentReadException {
        if (file == null || !file.isFile()) {
            throw new DocumentReadException(file != null ? file.getName() : null,
                    "PDF文件不存在: " + (file != null ? file.getAbsolutePath() : null), null);
        }

        try (PDDocument doc = Loader.loadPDF(file)) {
            return strip(doc, file.getName());
        } catch (IOException | RuntimeException e) {
            // 字体、内容流损坏时 PDFBox 会抛运行时异常
            throw new DocumentReadException(file.getName(), "PDF读取失败: " + file.getName() + ", " + e.getMessage(), e);
        }
    }

    @Override
    public String render(InputStream input, String documentName) throws DocumentReadException {
        try (PDDocument doc = Loader.loadPDF(new RandomAccessReadBuffer(input))) {
            return strip(doc, documentName);
        } catch (IOException | RuntimeException e) {
            throw new DocumentReadException(documentName, "PDF读取失败: " + documentName + ", " + e.getMessage(), e);
        }
    }

    private String strip(PDDocument doc, String documentName) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        String text = stripper.getText(doc);
        log.debug("PDF文本提取完成: {}, 页数={}, 字符数={}", documentName, doc.getNumberOfPages(), text.length());
        return text;
    }
}
