package com.example.ctdose.util.export;

import com.example.ctdose.dto.Acquisition;
import com.example.ctdose.dto.EssentialInfo;
import com.example.ctdose.dto.Report;
import com.example.ctdose.util.date.AgeCalculator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * 报告 -> 表格行
 *
 * 每个采集一行；没有采集的报告输出一行，采集相关列为 "-"。
 * 年龄按出生日期和检查日期计算，检查日期缺失时使用报告日期。
 */
public class DoseSheetRowMapper {

    private final AgeCalculator ageCalculator;

    public DoseSheetRowMapper(AgeCalculator ageCalculator) {
        this.ageCalculator = ageCalculator;
    }

    public List<DoseSheetRow> toRows(List<Report> reports) {
        List<DoseSheetRow> rows = new ArrayList<>();
        for (Report report : reports) {
            rows.addAll(toRows(report));
        }
        return rows;
    }

    public List<DoseSheetRow> toRows(Report report) {
        if (report.getAcquisitions().isEmpty()) {
            return Collections.singletonList(toRow(report, null));
        }
        List<DoseSheetRow> rows = new ArrayList<>(report.getAcquisitions().size());
        for (Acquisition acquisition : report.getAcquisitions()) {
            rows.add(toRow(report, acquisition));
        }
        return rows;
    }

    /**
     * @param acquisition 可以为 null（报告没有采集时）
     */
    DoseSheetRow toRow(Report report, Acquisition acquisition) {
        EssentialInfo essential = report.getEssential();

        String protocol = null;
        String comment = null;
        String scanMode = null;
        String tubeCurrent = null;
        String kvp = null;
        String ctdivol = null;
        String dlp = null;
        String phantomType = null;
        String ssde = null;
        if (acquisition != null) {
            protocol = acquisition.getProtocol();
            comment = acquisition.getComment();
            scanMode = acquisition.getAcquisitionType();
            tubeCurrent = acquisition.getXraySourceParams().getTubeCurrent();
            kvp = acquisition.getXraySourceParams().getKvp();
            ctdivol = acquisition.getCtDose().getMeanCtdivol();
            dlp = acquisition.getCtDose().getDlp();
            phantomType = acquisition.getCtDose().getPhantomType();
            ssde = acquisition.getCtDose().getSizeSpecificDose();
        }

        return new DoseSheetRow(Arrays.asList(
                essential.getPatientId(),
                essential.getSex(),
                essential.getBirthDate(),
                age(report),
                protocol,
                essential.getStudyDate(),
                comment,
                scanMode,
                tubeCurrent,
                kvp,
                ctdivol,
                dlp,
                report.getIrradiation().getTotalDlp(),
                phantomType,
                ssde,
                // 源报告中没有平均扫描尺寸
                null
        ));
    }

    private String age(Report report) {
        String birthDate = report.getEssential().getBirthDate();
        String studyDate = report.getEssential().getStudyDate();

        OptionalInt age = ageCalculator.age(birthDate, studyDate);
        if (!age.isPresent()) {
            age = ageCalculator.age(birthDate, report.getReportDate());
        }
        return age.isPresent() ? String.valueOf(age.getAsInt()) : null;
    }
}
