package com.example.ctdose.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 检查识别所需的核心信息
 *
 * 所有字段均可为 null（未匹配到），匹配到时保留原始格式，日期不做解析
 */
public final class EssentialInfo {

    @JsonProperty("patient_id")
    private final String patientId;

    @JsonProperty("study_id")
    private final String studyId;

    @JsonProperty("accession_number")
    private final String accessionNumber;

    @JsonProperty("study_date")
    private final String studyDate;

    @JsonProperty("birth_date")
    private final String birthDate;

    @JsonProperty("sex")
    private final String sex;

    @JsonCreator
    public EssentialInfo(@JsonProperty("patient_id") String patientId,
                         @JsonProperty("study_id") String studyId,
                         @JsonProperty("accession_number") String accessionNumber,
                         @JsonProperty("study_date") String studyDate,
                         @JsonProperty("birth_date") String birthDate,
                         @JsonProperty("sex") String sex) {
        this.patientId = patientId;
        this.studyId = studyId;
        this.accessionNumber = accessionNumber;
        this.studyDate = studyDate;
        this.birthDate = birthDate;
        this.sex = sex;
    }

    public static EssentialInfo empty() {
        return new EssentialInfo(null, null, null, null, null, null);
    }

    public String getPatientId() { return patientId; }

    public String getStudyId() { return studyId; }

    public String getAccessionNumber() { return accessionNumber; }

    public String getStudyDate() { return studyDate; }

    public String getBirthDate() { return birthDate; }

    public String getSex() { return sex; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EssentialInfo)) return false;
        EssentialInfo that = (EssentialInfo) o;
        return Objects.equals(patientId, that.patientId)
                && Objects.equals(studyId, that.studyId)
                && Objects.equals(accessionNumber, that.accessionNumber)
                && Objects.equals(studyDate, that.studyDate)
                && Objects.equals(birthDate, that.birthDate)
                && Objects.equals(sex, that.sex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patientId, studyId, accessionNumber, studyDate, birthDate, sex);
    }

    @Override
    public String toString() {
        return "EssentialInfo{patientId='" + patientId + "', studyId='" + studyId
                + "', accessionNumber='" + accessionNumber + "', studyDate='" + studyDate
                + "', birthDate='" + birthDate + "', sex='" + sex + "'}";
    }
}
