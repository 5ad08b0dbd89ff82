package com.example.ctdose.util.export;

import com.example.ctdose.dto.Report;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 从 JSON 目录读取报告
 *
 * 文件选择：优先汇总文件；不存在时取文件名排序后的第一个 *.json。
 * 文件内容可以是报告数组，也可以是单个报告对象（视为只含一个元素的数组）。
 */
public class ReportJsonReader {

    private static final Logger log = LoggerFactory.getLogger(ReportJsonReader.class);

    private static final TypeReference<List<Report>> REPORT_LIST = new TypeReference<List<Report>>() {};

    private final ObjectMapper mapper;

    public ReportJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 读取目录中的报告
     *
     * @param inputFolder       JSON 目录
     * @param aggregateFileName 汇总文件名，为空时使用默认值
     * @return 报告列表（文件中没有报告时为空列表）
     * @throws FileNotFoundException 目录不存在或目录中没有 JSON 文件
     * @throws IOException           JSON 解析失败
     */
    public List<Report> read(File inputFolder, String aggregateFileName) throws IOException {
        File source = selectSource(inputFolder, aggregateFileName);
        log.info("读取JSON: {}", source.getAbsolutePath());
        return readFile(source);
    }

    /**
     * 读取单个 JSON 文件
     */
    public List<Report> readFile(File file) throws IOException {
        JsonNode root = mapper.readTree(file);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return Collections.emptyList();
        }
        if (root.isArray()) {
            return new ArrayList<>(mapper.convertValue(root, REPORT_LIST));
        }
        if (root.isObject()) {
            return new ArrayList<>(Collections.singletonList(mapper.treeToValue(root, Report.class)));
        }
        throw new IOException("JSON格式不支持（需要数组或对象）: " + file.getAbsolutePath());
    }

    File selectSource(File inputFolder, String aggregateFileName) throws FileNotFoundException {
        if (inputFolder == null || !inputFolder.isDirectory()) {
            throw new FileNotFoundException("JSON目录不存在: " + (inputFolder != null ? inputFolder.getAbsolutePath() : null));
        }

        String fileName = (aggregateFileName == null || aggregateFileName.trim().isEmpty())
                ? ReportJsonExporter.DEFAULT_AGGREGATE_FILE_NAME : aggregateFileName.trim();
        File aggregate = new File(inputFolder, fileName);
        if (aggregate.isFile()) {
            return aggregate;
        }

        File[] jsonFiles = inputFolder.listFiles((dir, name) -> name.toLowerCase().endsWith(".json"));
        if (jsonFiles == null || jsonFiles.length == 0) {
            throw new FileNotFoundException("目录中没有JSON文件: " + inputFolder.getAbsolutePath());
        }
        Arrays.sort(jsonFiles, (a, b) -> a.getName().compareTo(b.getName()));
        log.warn("未找到汇总文件 {}，使用 {}", fileName, jsonFiles[0].getName());
        return jsonFiles[0];
    }
}
