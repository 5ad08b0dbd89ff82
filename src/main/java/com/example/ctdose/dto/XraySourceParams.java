package com.example.ctdose.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * X 射线源参数
 */
public final class XraySourceParams {

    @JsonProperty("identification")
    private final String identification;

    @JsonProperty("kvp")
    private final String kvp;

    @JsonProperty("max_tube_current")
    private final String maxTubeCurrent;

    @JsonProperty("tube_current")
    private final String tubeCurrent;

    @JsonProperty("exposure_time_per_rotation")
    private final String exposureTimePerRotation;

    @JsonCreator
    public XraySourceParams(@JsonProperty("identification") String identification,
                            @JsonProperty("kvp") String kvp,
                            @JsonProperty("max_tube_current") String maxTubeCurrent,
                            @JsonProperty("tube_current") String tubeCurrent,
                            @JsonProperty("exposure_time_per_rotation") String exposureTimePerRotation) {
        this.identification = identification;
        this.kvp = kvp;
        this.maxTubeCurrent = maxTubeCurrent;
        this.tubeCurrent = tubeCurrent;
        this.exposureTimePerRotation = exposureTimePerRotation;
    }

    public String getIdentification() { return identification; }

    public String getKvp() { return kvp; }

    public String getMaxTubeCurrent() { return maxTubeCurrent; }

    public String getTubeCurrent() { return tubeCurrent; }

    public String getExposureTimePerRotation() { return exposureTimePerRotation; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XraySourceParams)) return false;
        XraySourceParams that = (XraySourceParams) o;
        return Objects.equals(identification, that.identification)
                && Objects.equals(kvp, that.kvp)
                && Objects.equals(maxTubeCurrent, that.maxTubeCurrent)
                && Objects.equals(tubeCurrent, that.tubeCurrent)
                && Objects.equals(exposureTimePerRotation, that.exposureTimePerRotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identification, kvp, maxTubeCurrent, tubeCurrent, exposureTimePerRotation);
    }
}
