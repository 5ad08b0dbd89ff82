package com.example.ctdose.util.pdf;

import java.io.IOException;

/**
 * 文档无法渲染为文本（损坏、加密、不是 PDF 等）
 *
 * 批处理中按单个文档记录，不影响后续文档。
 */
public class DocumentReadException extends IOException {

    private final String documentName;

    public DocumentReadException(String documentName, String message, Throwable cause) {
        super(message, cause);
        this.documentName = documentName;
    }

    public String getDocumentName() {
        return documentName;
    }
}
