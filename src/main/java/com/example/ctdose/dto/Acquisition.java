package com.example.ctdose.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 单次 CT 采集（报告中的一个 "x.y CT Acquisition" 小节）
 *
 * 三个参数分组始终非 null，未匹配到的字段为 null
 */
public final class Acquisition {

    @JsonProperty("protocol")
    private final String protocol;

    @JsonProperty("target_region")
    private final String targetRegion;

    @JsonProperty("acquisition_type")
    private final String acquisitionType;

    @JsonProperty("procedure_context")
    private final String procedureContext;

    @JsonProperty("irradiation_event_uid")
    private final String irradiationEventUid;

    @JsonProperty("comment")
    private final String comment;

    @JsonProperty("acquisition_params")
    private final AcquisitionParams acquisitionParams;

    @JsonProperty("xray_source_params")
    private final XraySourceParams xraySourceParams;

    @JsonProperty("ct_dose")
    private final CtDose ctDose;

    @JsonCreator
    public Acquisition(@JsonProperty("protocol") String protocol,
                       @JsonProperty("target_region") String targetRegion,
                       @JsonProperty("acquisition_type") String acquisitionType,
                       @JsonProperty("procedure_context") String procedureContext,
                       @JsonProperty("irradiation_event_uid") String irradiationEventUid,
                       @JsonProperty("comment") String comment,
                       @JsonProperty("acquisition_params") AcquisitionParams acquisitionParams,
                       @JsonProperty("xray_source_params") XraySourceParams xraySourceParams,
                       @JsonProperty("ct_dose") CtDose ctDose) {
        this.protocol = protocol;
        this.targetRegion = targetRegion;
        this.acquisitionType = acquisitionType;
        this.procedureContext = procedureContext;
        this.irradiationEventUid = irradiationEventUid;
        this.comment = comment;
        this.acquisitionParams = acquisitionParams != null
                ? acquisitionParams : new AcquisitionParams(null, null, null, null, null, null);
        this.xraySourceParams = xraySourceParams != null
                ? xraySourceParams : new XraySourceParams(null, null, null, null, null);
        this.ctDose = ctDose != null ? ctDose : new CtDose(null, null, null, null, null);
    }

    public String getProtocol() { return protocol; }

    public String getTargetRegion() { return targetRegion; }

    public String getAcquisitionType() { return acquisitionType; }

    public String getProcedureContext() { return procedureContext; }

    public String getIrradiationEventUid() { return irradiationEventUid; }

    public String getComment() { return comment; }

    public AcquisitionParams getAcquisitionParams() { return acquisitionParams; }

    public XraySourceParams getXraySourceParams() { return xraySourceParams; }

    public CtDose getCtDose() { return ctDose; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Acquisition)) return false;
        Acquisition that = (Acquisition) o;
        return Objects.equals(protocol, that.protocol)
                && Objects.equals(targetRegion, that.targetRegion)
                && Objects.equals(acquisitionType, that.acquisitionType)
                && Objects.equals(procedureContext, that.procedureContext)
                && Objects.equals(irradiationEventUid, that.irradiationEventUid)
                && Objects.equals(comment, that.comment)
                && Objects.equals(acquisitionParams, that.acquisitionParams)
                && Objects.equals(xraySourceParams, that.xraySourceParams)
                && Objects.equals(ctDose, that.ctDose);
    }

    @Override
    public int hashCode() {
        return Objects.hash(protocol, targetRegion, acquisitionType, procedureContext,
                irradiationEventUid, comment, acquisitionParams, xraySourceParams, ctDose);
    }
}
