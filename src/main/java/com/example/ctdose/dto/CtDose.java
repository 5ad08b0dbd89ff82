package com.example.ctdose.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 单次采集的剂量信息（CTDIvol、DLP、SSDE 等）
 */
public final class CtDose {

    @JsonProperty("mean_ctdivol")
    private final String meanCtdivol;

    @JsonProperty("phantom_type")
    private final String phantomType;

    @JsonProperty("dlp")
    private final String dlp;

    @JsonProperty("size_specific_dose")
    private final String sizeSpecificDose;

    @JsonProperty("ctdivol_alert_value")
    private final String ctdivolAlertValue;

    @JsonCreator
    public CtDose(@JsonProperty("mean_ctdivol") String meanCtdivol,
                  @JsonProperty("phantom_type") String phantomType,
                  @JsonProperty("dlp") String dlp,
                  @JsonProperty("size_specific_dose") String sizeSpecificDose,
                  @JsonProperty("ctdivol_alert_value") String ctdivolAlertValue) {
        this.meanCtdivol = meanCtdivol;
        this.phantomType = phantomType;
        this.dlp = dlp;
        this.sizeSpecificDose = sizeSpecificDose;
        this.ctdivolAlertValue = ctdivolAlertValue;
    }

    public String getMeanCtdivol() { return meanCtdivol; }

    public String getPhantomType() { return phantomType; }

    public String getDlp() { return dlp; }

    public String getSizeSpecificDose() { return sizeSpecificDose; }

    public String getCtdivolAlertValue() { return ctdivolAlertValue; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CtDose)) return false;
        CtDose that = (CtDose) o;
        return Objects.equals(meanCtdivol, that.meanCtdivol)
                && Objects.equals(phantomType, that.phantomType)
                && Objects.equals(dlp, that.dlp)
                && Objects.equals(sizeSpecificDose, that.sizeSpecificDose)
                && Objects.equals(ctdivolAlertValue, that.ctdivolAlertValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(meanCtdivol, phantomType, dlp, sizeSpecificDose, ctdivolAlertValue);
    }
}
