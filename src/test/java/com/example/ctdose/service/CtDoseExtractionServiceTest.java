package com.example.ctdose.service;

import com.example.ctdose.config.CtDoseProperties;
import com.example.ctdose.dto.Report;
import com.example.ctdose.util.export.ReportJsonExporter;
import com.example.ctdose.util.extract.AcquisitionMarkerPolicy;
import com.example.ctdose.util.extract.AcquisitionSegmenter;
import com.example.ctdose.util.extract.FieldMatcher;
import com.example.ctdose.util.extract.PatternLibrary;
import com.example.ctdose.util.extract.ReportAssembler;
import com.example.ctdose.util.pdf.DocumentReadException;
import com.example.ctdose.util.pdf.DocumentTextRenderer;
import com.example.ctdose.util.pdf.PdfBoxTextRenderer;
import com.example.ctdose.util.pdf.SamplePdfFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CtDoseExtractionServiceTest {

    @TempDir
    Path tempDir;

    private ReportAssembler assembler;
    private ReportJsonExporter exporter;
    private CtDoseExtractionService service;

    @BeforeEach
    void setUp() {
        assembler = new ReportAssembler(
                new FieldMatcher(PatternLibrary.defaultLibrary()),
                new AcquisitionSegmenter(AcquisitionMarkerPolicy.defaultPolicy()));
        exporter = new ReportJsonExporter(
                new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
        service = new CtDoseExtractionService(new PdfBoxTextRenderer(), assembler, exporter, new CtDoseProperties());
    }

    @Test
    void shouldContinueAfterUnreadableDocument() throws IOException {
        File source = tempDir.resolve("pdfs").toFile();
        assertThat(source.mkdirs()).isTrue();
        SamplePdfFactory.write(new File(source, "a_first.pdf"), report("111", "10 mGy.cm"));
        Files.write(new File(source, "b_corrupt.pdf").toPath(), "this is not a pdf document".getBytes(StandardCharsets.UTF_8));
        SamplePdfFactory.write(new File(source, "c_third.PDF"), report("333", "30 mGy.cm"));

        BatchResult result = service.processFolder(source);

        assertThat(result.getReports()).extracting(r -> r.getEssential().getPatientId())
                .containsExactly("111", "333");
        assertThat(result.getFailures()).hasSize(1);
        assertThat(result.getFailures().get(0).getFileName()).isEqualTo("b_corrupt.pdf");
    }

    @Test
    void shouldRecordRuntimeFailureAndContinueWithRemainingDocuments() throws IOException {
        File source = tempDir.resolve("pdfs").toFile();
        assertThat(source.mkdirs()).isTrue();
        SamplePdfFactory.write(new File(source, "a.pdf"), report("111", "10 mGy.cm"));
        SamplePdfFactory.write(new File(source, "b.pdf"), report("222", "20 mGy.cm"));
        SamplePdfFactory.write(new File(source, "c.pdf"), report("333", "30 mGy.cm"));

        DocumentTextRenderer pdfBox = new PdfBoxTextRenderer();
        DocumentTextRenderer failingOnB = new DocumentTextRenderer() {
            @Override
            public String render(File file) throws DocumentReadException {
                if ("b.pdf".equals(file.getName())) {
                    throw new IllegalStateException("malformed font stream");
                }
                return pdfBox.render(file);
            }

            @Override
            public String render(InputStream input, String documentName) throws DocumentReadException {
                return pdfBox.render(input, documentName);
            }
        };
        CtDoseExtractionService batchService = new CtDoseExtractionService(failingOnB, assembler, exporter,
                new CtDoseProperties());

        BatchResult result = batchService.processFolder(source);

        assertThat(result.getReports()).extracting(r -> r.getEssential().getPatientId())
                .containsExactly("111", "333");
        assertThat(result.getFailures()).hasSize(1);
        assertThat(result.getFailures().get(0).getFileName()).isEqualTo("b.pdf");
        assertThat(result.getFailures().get(0).getMessage()).contains("malformed font stream");
        assertThat(result.isComplete()).isFalse();
    }

    @Test
    void shouldExportJsonForBatch() throws IOException {
        File source = tempDir.resolve("pdfs").toFile();
        File output = tempDir.resolve("json").toFile();
        assertThat(source.mkdirs()).isTrue();
        SamplePdfFactory.write(new File(source, "one.pdf"), report("111", "10 mGy.cm"));

        BatchResult result = service.runBatch(source.getPath(), output.getPath(), "all.json");

        assertThat(result.getProcessedCount()).isEqualTo(1);
        assertThat(result.getExportFailures()).isEmpty();
        assertThat(result.isComplete()).isTrue();
        assertThat(result.getAggregatePath()).isEqualTo(new File(output, "all.json").getAbsolutePath());
        assertThat(new File(output, "all.json")).isFile();
        assertThat(new File(output, "ct_report_111.json")).isFile();
    }

    @Test
    void shouldCreateMissingSourceFolderAndReturnEmptyBatch() {
        File source = tempDir.resolve("does-not-exist").toFile();

        BatchResult result = service.runBatch(source.getPath(), tempDir.resolve("json").toString(), null);

        assertThat(source).isDirectory();
        assertThat(result.getReports()).isEmpty();
        assertThat(result.getAggregatePath()).isNull();
    }

    @Test
    void shouldDiscoverPdfsSortedByNameIgnoringExtensionCase() throws IOException {
        File source = tempDir.toFile();
        Files.write(tempDir.resolve("b.PDF"), new byte[0]);
        Files.write(tempDir.resolve("a.pdf"), new byte[0]);
        Files.write(tempDir.resolve("notes.txt"), new byte[0]);

        List<File> pdfs = service.discoverPdfs(source);

        assertThat(pdfs).extracting(File::getName).containsExactly("a.pdf", "b.PDF");
    }

    @Test
    void shouldProduceIdenticalReportsOnRerun() throws IOException {
        File source = tempDir.resolve("pdfs").toFile();
        assertThat(source.mkdirs()).isTrue();
        SamplePdfFactory.write(new File(source, "one.pdf"), report("111", "10 mGy.cm"));
        SamplePdfFactory.write(new File(source, "two.pdf"), report("222", "20 mGy.cm"));

        List<Report> first = service.processFolder(source).getReports();
        List<Report> second = service.processFolder(source).getReports();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldExtractFromText() {
        Report report = service.extractFromText("Patient ID:\n42\n1.1 CT Acquisition\nKVP = 120 kV");

        assertThat(report.getEssential().getPatientId()).isEqualTo("42");
        assertThat(report.getAcquisitions()).hasSize(1);
        assertThat(report.getAcquisitions().get(0).getXraySourceParams().getKvp()).isEqualTo("120 kV");
    }

    private static List<String> report(String patientId, String dlp) {
        return Arrays.asList(
                "By Santa Casa Hospital on CT, May 5, 2025",
                "Patient ID: " + patientId,
                "Study Date: May 5, 2025",
                "1.1 CT Acquisition",
                "Acquisition Protocol: Head Routine",
                "DLP = " + dlp);
    }
}
