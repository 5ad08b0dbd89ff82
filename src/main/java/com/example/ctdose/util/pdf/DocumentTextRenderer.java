package com.example.ctdose.util.pdf;

import java.io.File;
import java.io.InputStream;

/**
 * 文档 -> 线性文本
 */
public interface DocumentTextRenderer {

    /**
     * 渲染文件
     *
     * @param file 文档文件
     * @return 原始文本（未归一化）
     * @throws DocumentReadException 文档无法读取时
     */
    String render(File file) throws DocumentReadException;

    /**
     * 渲染输入流（上传的文件）
     *
     * @param input        文档内容，调用方负责关闭
     * @param documentName 文档名称，用于日志和异常信息
     * @return 原始文本（未归一化）
     * @throws DocumentReadException 文档无法读取时
     */
    String render(InputStream input, String documentName) throws DocumentReadException;
}
