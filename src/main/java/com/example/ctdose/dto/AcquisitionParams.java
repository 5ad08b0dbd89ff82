package com.example.ctdose.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * CT 采集参数（CT Acquisition Parameters）
 */
public final class AcquisitionParams {

    @JsonProperty("exposure_time")
    private final String exposureTime;

    @JsonProperty("scanning_length")
    private final String scanningLength;

    @JsonProperty("nominal_single_collimation")
    private final String nominalSingleCollimation;

    @JsonProperty("nominal_total_collimation")
    private final String nominalTotalCollimation;

    @JsonProperty("num_xray_sources")
    private final String numXraySources;

    @JsonProperty("pitch_factor")
    private final String pitchFactor;

    @JsonCreator
    public AcquisitionParams(@JsonProperty("exposure_time") String exposureTime,
                             @JsonProperty("scanning_length") String scanningLength,
                             @JsonProperty("nominal_single_collimation") String nominalSingleCollimation,
                             @JsonProperty("nominal_total_collimation") String nominalTotalCollimation,
                             @JsonProperty("num_xray_sources") String numXraySources,
                             @JsonProperty("pitch_factor") String pitchFactor) {
        this.exposureTime = exposureTime;
        this.scanningLength = scanningLength;
        this.nominalSingleCollimation = nominalSingleCollimation;
        this.nominalTotalCollimation = nominalTotalCollimation;
        this.numXraySources = numXraySources;
        this.pitchFactor = pitchFactor;
    }

    public String getExposureTime() { return exposureTime; }

    public String getScanningLength() { return scanningLength; }

    public String getNominalSingleCollimation() { return nominalSingleCollimation; }

    public String getNominalTotalCollimation() { return nominalTotalCollimation; }

    public String getNumXraySources() { return numXraySources; }

    public String getPitchFactor() { return pitchFactor; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AcquisitionParams)) return false;
        AcquisitionParams that = (AcquisitionParams) o;
        return Objects.equals(exposureTime, that.exposureTime)
                && Objects.equals(scanningLength, that.scanningLength)
                && Objects.equals(nominalSingleCollimation, that.nominalSingleCollimation)
                && Objects.equals(nominalTotalCollimation, that.nominalTotalCollimation)
                && Objects.equals(numXraySources, that.numXraySources)
                && Objects.equals(pitchFactor, that.pitchFactor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exposureTime, scanningLength, nominalSingleCollimation,
                nominalTotalCollimation, numXraySources, pitchFactor);
    }
}
