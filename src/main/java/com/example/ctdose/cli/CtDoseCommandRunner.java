package com.example.ctdose.cli;

import com.example.ctdose.service.BatchResult;
import com.example.ctdose.service.CtDoseExcelService;
import com.example.ctdose.service.CtDoseExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * 命令行入口
 *
 * 用法：
 * --mode=extract [--folder=ct_reports] [--output-folder=ct_reports_json] [--output=ct_reports_all.json] [--debug]
 * --mode=excel [--input-folder=ct_reports_json] [--output=ct_dose_report.xlsx]
 *
 * 未指定 --mode 时只启动 Web 服务。
 * 指定 --mode 时不启动 Web 容器，执行完成后进程退出（见 CtDoseApplication），
 * 有文档读取失败或导出失败时退出码为 1。
 */
@Slf4j
@Component
public class CtDoseCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String MODE_EXTRACT = "extract";
    static final String MODE_EXCEL = "excel";

    static final String MODE_OPTION = "--mode";

    private static final String BASE_PACKAGE = "com.example.ctdose";

    private final CtDoseExtractionService extractionService;
    private final CtDoseExcelService excelService;
    private final LoggingSystem loggingSystem;

    private int exitCode;

    public CtDoseCommandRunner(CtDoseExtractionService extractionService,
                               CtDoseExcelService excelService,
                               LoggingSystem loggingSystem) {
        this.extractionService = extractionService;
        this.excelService = excelService;
        this.loggingSystem = loggingSystem;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String mode = option(args, "mode");
        if (mode == null) {
            return;
        }

        if (args.containsOption("debug")) {
            loggingSystem.setLogLevel(BASE_PACKAGE, LogLevel.DEBUG);
            log.debug("已开启DEBUG日志");
        }

        switch (mode.toLowerCase()) {
            case MODE_EXTRACT:
                runExtract(args);
                break;
            case MODE_EXCEL:
                runExcel(args);
                break;
            default:
                throw new IllegalArgumentException("未知的 --mode: " + mode + "（支持 extract / excel）");
        }
    }

    private void runExtract(ApplicationArguments args) {
        BatchResult result = extractionService.runBatch(
                option(args, "folder"),
                option(args, "output-folder"),
                option(args, "output"));

        log.info("提取完成: 成功={}, 失败={}", result.getProcessedCount(), result.getFailures().size());
        for (BatchResult.DocumentFailure failure : result.getFailures()) {
            log.warn("  失败: {}", failure);
        }
        for (String exportFailure : result.getExportFailures()) {
            log.warn("  导出失败: {}", exportFailure);
        }
        if (result.getAggregatePath() != null) {
            log.info("汇总JSON: {}", result.getAggregatePath());
        }
        exitCode = result.isComplete() ? 0 : 1;
    }

    private void runExcel(ApplicationArguments args) throws IOException {
        String output = option(args, "output");
        int rows = excelService.convert(option(args, "input-folder"), output);
        log.info("Excel生成完成: {}, 数据行数={}", excelService.resolveOutputFile(output), rows);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * 命令行参数中是否指定了 --mode（此时按批处理工具运行）
     */
    public static boolean isCommandLineMode(String... args) {
        if (args == null) {
            return false;
        }
        for (String arg : args) {
            if (MODE_OPTION.equals(arg) || (arg != null && arg.startsWith(MODE_OPTION + "="))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 取选项的最后一个值，未提供或没有值时返回 null
     */
    static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return (value == null || value.trim().isEmpty()) ? null : value.trim();
    }
}
