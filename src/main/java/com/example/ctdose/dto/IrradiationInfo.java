package com.example.ctdose.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 照射汇总信息
 *
 * 数值保留原始单位，例如 "445.02 mGy.cm"、"3 events"
 */
public final class IrradiationInfo {

    @JsonProperty("start_time")
    private final String startTime;

    @JsonProperty("end_time")
    private final String endTime;

    @JsonProperty("total_events")
    private final String totalEvents;

    @JsonProperty("total_dlp")
    private final String totalDlp;

    @JsonCreator
    public IrradiationInfo(@JsonProperty("start_time") String startTime,
                           @JsonProperty("end_time") String endTime,
                           @JsonProperty("total_events") String totalEvents,
                           @JsonProperty("total_dlp") String totalDlp) {
        this.startTime = startTime;
        this.endTime = endTime;
        this.totalEvents = totalEvents;
        this.totalDlp = totalDlp;
    }

    public static IrradiationInfo empty() {
        return new IrradiationInfo(null, null, null, null);
    }

    public String getStartTime() { return startTime; }

    public String getEndTime() { return endTime; }

    public String getTotalEvents() { return totalEvents; }

    public String getTotalDlp() { return totalDlp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrradiationInfo)) return false;
        IrradiationInfo that = (IrradiationInfo) o;
        return Objects.equals(startTime, that.startTime)
                && Objects.equals(endTime, that.endTime)
                && Objects.equals(totalEvents, that.totalEvents)
                && Objects.equals(totalDlp, that.totalDlp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, endTime, totalEvents, totalDlp);
    }
}
