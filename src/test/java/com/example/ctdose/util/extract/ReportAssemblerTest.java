package com.example.ctdose.util.extract;

import com.example.ctdose.dto.Acquisition;
import com.example.ctdose.dto.Report;
import com.example.ctdose.util.text.TextNormalizer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ReportAssemblerTest {

    private final ReportAssembler assembler = new ReportAssembler(
            new FieldMatcher(PatternLibrary.defaultLibrary()),
            new AcquisitionSegmenter(AcquisitionMarkerPolicy.defaultPolicy()));

    static String fixture() throws IOException {
        try (InputStream is = ReportAssemblerTest.class.getResourceAsStream("/fixtures/ct_dose_report.txt")) {
            assertThat(is).as("fixtures/ct_dose_report.txt").isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void shouldAssembleHeaderAndEssentialInfo() throws IOException {
        Report report = assembler.assemble(TextNormalizer.normalize(fixture()));

        assertThat(report.getHospital()).isEqualTo("Santa Casa Hospital");
        assertThat(report.getReportDate()).isEqualTo("May 5, 2025 10:32:11 AM");
        assertThat(report.getEssential().getPatientId()).isEqualTo("123456");
        assertThat(report.getEssential().getStudyId()).isEqualTo("7788");
        assertThat(report.getEssential().getAccessionNumber()).isEqualTo("99001122");
        assertThat(report.getEssential().getStudyDate()).isEqualTo("May 5, 2025");
        assertThat(report.getEssential().getBirthDate()).isEqualTo("Jul 1, 1997");
        assertThat(report.getEssential().getSex()).isEqualTo("M");
    }

    @Test
    void shouldAssembleDeviceAndIrradiationSummary() throws IOException {
        Report report = assembler.assemble(TextNormalizer.normalize(fixture()));

        assertThat(report.getDevice().getObserverName()).isEqualTo("CT01");
        assertThat(report.getDevice().getManufacturer()).isEqualTo("Siemens");
        assertThat(report.getDevice().getModelName()).isEqualTo("SOMATOM go.Up");
        assertThat(report.getDevice().getSerialNumber()).isEqualTo("112233");
        assertThat(report.getDevice().getPhysicalLocation()).isEqualTo("Radiology Room 2");
        assertThat(report.getIrradiation().getStartTime()).isEqualTo("May 5, 2025 10:01:02 AM");
        assertThat(report.getIrradiation().getEndTime()).isEqualTo("May 5, 2025 10:05:40 AM");
        // 跨栏拆开的值由归一化拼回
        assertThat(report.getIrradiation().getTotalEvents()).isEqualTo("2 events");
        assertThat(report.getIrradiation().getTotalDlp()).isEqualTo("445.02 mGy.cm");
    }

    @Test
    void shouldScopeAcquisitionFieldsToTheirOwnBlock() throws IOException {
        Report report = assembler.assemble(TextNormalizer.normalize(fixture()));

        assertThat(report.getAcquisitions()).hasSize(2);

        Acquisition first = report.getAcquisitions().get(0);
        assertThat(first.getProtocol()).isEqualTo("Head Routine");
        assertThat(first.getTargetRegion()).isEqualTo("Head");
        assertThat(first.getAcquisitionType()).isEqualTo("Spiral Acquisition");
        assertThat(first.getProcedureContext()).isEqualTo("Diagnostic");
        assertThat(first.getIrradiationEventUid()).isEqualTo("1.2.840.113619.2.1.1");
        assertThat(first.getComment()).isEqualTo("Head 5.0 H31s");
        assertThat(first.getAcquisitionParams().getExposureTime()).isEqualTo("8.5 s");
        assertThat(first.getAcquisitionParams().getScanningLength()).isEqualTo("180.5 mm");
        assertThat(first.getAcquisitionParams().getNominalSingleCollimation()).isEqualTo("0.6 mm");
        assertThat(first.getAcquisitionParams().getNominalTotalCollimation()).isEqualTo("19.2 mm");
        assertThat(first.getAcquisitionParams().getNumXraySources()).isEqualTo("1 X-Ray sources");
        assertThat(first.getAcquisitionParams().getPitchFactor()).isEqualTo("0.55 ratio");
        assertThat(first.getXraySourceParams().getIdentification()).isEqualTo("A");
        assertThat(first.getXraySourceParams().getKvp()).isEqualTo("120 kV");
        assertThat(first.getXraySourceParams().getMaxTubeCurrent()).isEqualTo("350 mA");
        assertThat(first.getXraySourceParams().getTubeCurrent()).isEqualTo("280 mA");
        assertThat(first.getXraySourceParams().getExposureTimePerRotation()).isEqualTo("1 s");
        assertThat(first.getCtDose().getMeanCtdivol()).isEqualTo("45.5 mGy");
        assertThat(first.getCtDose().getPhantomType()).isEqualTo("IEC Head Dosimetry Phantom");
        assertThat(first.getCtDose().getDlp()).isEqualTo("400.12 mGy.cm");
        assertThat(first.getCtDose().getSizeSpecificDose()).isEqualTo("50.1 mGy");
        // 第二个采集的告警值不能泄漏到第一个采集
        assertThat(first.getCtDose().getCtdivolAlertValue()).isNull();

        Acquisition second = report.getAcquisitions().get(1);
        assertThat(second.getTargetRegion()).isEqualTo("Neck");
        assertThat(second.getProcedureContext()).isNull();
        assertThat(second.getAcquisitionParams().getPitchFactor()).isNull();
        assertThat(second.getXraySourceParams().getKvp()).isEqualTo("100 kV");
        assertThat(second.getXraySourceParams().getTubeCurrent()).isEqualTo("35 mA");
        assertThat(second.getXraySourceParams().getExposureTimePerRotation()).isNull();
        assertThat(second.getCtDose().getDlp()).isEqualTo("44.9 mGy.cm");
        assertThat(second.getCtDose().getSizeSpecificDose()).isNull();
        assertThat(second.getCtDose().getCtdivolAlertValue()).isEqualTo("1000 mGy");
    }

    @Test
    void shouldKeepOtherGroupsWhenNoAcquisitionMarkers() {
        String text = TextNormalizer.normalize("By City Hospital on CT, Jan 1, 2025\n"
                + "Patient ID: 42\n"
                + "Device Observer Manufacturer: GE\n"
                + "CT Dose Length Product Total = 10 mGy.cm\n"
                + "DLP = 10 mGy.cm");

        Report report = assembler.assemble(text);

        assertThat(report.getAcquisitions()).isEmpty();
        assertThat(report.getHospital()).isEqualTo("City Hospital");
        assertThat(report.getEssential().getPatientId()).isEqualTo("42");
        assertThat(report.getDevice().getManufacturer()).isEqualTo("GE");
        assertThat(report.getIrradiation().getTotalDlp()).isEqualTo("10 mGy.cm");
    }

    @Test
    void shouldReturnReportWithAllFieldsAbsentForUnrecognizedText() {
        Report report = assembler.assemble("lorem ipsum dolor sit amet");

        assertThat(report).isNotNull();
        assertThat(report.getHospital()).isNull();
        assertThat(report.getEssential().getPatientId()).isNull();
        assertThat(report.getDevice().getManufacturer()).isNull();
        assertThat(report.getAcquisitions()).isEmpty();
        assertThat(assembler.assemble(null)).isEqualTo(assembler.assemble(""));
    }

    @Test
    void shouldOnlyLookForHospitalInHeaderLines() {
        String text = "line1\nline2\nline3\nline4\nline5\nBy Late Hospital on CT, Jan 1, 2025";

        Report report = assembler.assemble(text);

        assertThat(report.getHospital()).isNull();
        assertThat(report.getReportDate()).isNull();
        assertThat(ReportAssembler.headerOf(text)).isEqualTo("line1\nline2\nline3\nline4\nline5");
    }

    @Test
    void shouldMatchEachFieldOnlyAgainstTheTextOfItsScope() {
        String document = "Patient ID: 42\nKVP = 120 kV\nBy Late Hospital on CT, Jan 1, 2025";
        ReportAssembler.ScopedText noBlock = new ReportAssembler.ScopedText("line1", document, null);

        assertThat(ReportField.KVP.getScope()).isEqualTo(ReportField.Scope.ACQUISITION);
        assertThat(assembler.find(noBlock, ReportField.PATIENT_ID)).isEqualTo("42");
        // 没有采集块时采集字段缺失，即使全文中有对应文本
        assertThat(assembler.find(noBlock, ReportField.KVP)).isNull();
        assertThat(assembler.find(noBlock, ReportField.HOSPITAL)).isNull();

        ReportAssembler.ScopedText inBlock = noBlock.withBlock("1.1 CT Acquisition\nKVP = 100 kV");
        assertThat(assembler.find(inBlock, ReportField.KVP)).isEqualTo("100 kV");
        assertThat(assembler.find(inBlock, ReportField.PATIENT_ID)).isEqualTo("42");
    }

    @Test
    void shouldBeDeterministic() throws IOException {
        String text = TextNormalizer.normalize(fixture());

        assertThat(assembler.assemble(text)).isEqualTo(assembler.assemble(text));
    }
}
