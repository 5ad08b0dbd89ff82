package com.example.ctdose.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一份 CT 剂量报告的结构化结果（一个 PDF 对应一个 Report）
 *
 * 组装完成后不可变；采集列表保持文档顺序。
 * 所有字段都未匹配到的 Report 仍然是合法输出。
 */
@JsonPropertyOrder({"hospital", "report_date", "essential", "device", "irradiation", "acquisitions"})
public final class Report {

    @JsonProperty("hospital")
    private final String hospital;

    @JsonProperty("report_date")
    private final String reportDate;

    @JsonProperty("essential")
    private final EssentialInfo essential;

    @JsonProperty("device")
    private final DeviceInfo device;

    @JsonProperty("irradiation")
    private final IrradiationInfo irradiation;

    @JsonProperty("acquisitions")
    private final List<Acquisition> acquisitions;

    @JsonCreator
    public Report(@JsonProperty("hospital") String hospital,
                  @JsonProperty("report_date") String reportDate,
                  @JsonProperty("essential") EssentialInfo essential,
                  @JsonProperty("device") DeviceInfo device,
                  @JsonProperty("irradiation") IrradiationInfo irradiation,
                  @JsonProperty("acquisitions") List<Acquisition> acquisitions) {
        this.hospital = hospital;
        this.reportDate = reportDate;
        this.essential = essential != null ? essential : EssentialInfo.empty();
        this.device = device != null ? device : DeviceInfo.empty();
        this.irradiation = irradiation != null ? irradiation : IrradiationInfo.empty();
        this.acquisitions = acquisitions != null
                ? Collections.unmodifiableList(new ArrayList<>(acquisitions))
                : Collections.emptyList();
    }

    public String getHospital() { return hospital; }

    public String getReportDate() { return reportDate; }

    public EssentialInfo getEssential() { return essential; }

    public DeviceInfo getDevice() { return device; }

    public IrradiationInfo getIrradiation() { return irradiation; }

    public List<Acquisition> getAcquisitions() { return acquisitions; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Report)) return false;
        Report that = (Report) o;
        return Objects.equals(hospital, that.hospital)
                && Objects.equals(reportDate, that.reportDate)
                && Objects.equals(essential, that.essential)
                && Objects.equals(device, that.device)
                && Objects.equals(irradiation, that.irradiation)
                && Objects.equals(acquisitions, that.acquisitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hospital, reportDate, essential, device, irradiation, acquisitions);
    }
}
