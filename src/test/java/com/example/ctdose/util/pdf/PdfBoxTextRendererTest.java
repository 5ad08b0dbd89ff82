package com.example.ctdose.util.pdf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfBoxTextRendererTest {

    private final PdfBoxTextRenderer renderer = new PdfBoxTextRenderer();

    @TempDir
    Path tempDir;

    @Test
    void shouldRenderTextLinesInReadingOrder() throws IOException {
        File pdf = SamplePdfFactory.write(tempDir.resolve("report.pdf").toFile(), Arrays.asList(
                "By Santa Casa Hospital on CT, May 5, 2025",
                "Patient ID: 123456",
                "1.1 CT Acquisition",
                "DLP = 400.12 mGy.cm"));

        String text = renderer.render(pdf);

        assertThat(text).contains("Patient ID: 123456");
        assertThat(text.indexOf("Santa Casa Hospital")).isLessThan(text.indexOf("Patient ID"));
        assertThat(text.indexOf("1.1 CT Acquisition")).isLessThan(text.indexOf("DLP = 400.12 mGy.cm"));
    }

    @Test
    void shouldRenderUploadedStream() throws IOException {
        byte[] bytes = SamplePdfFactory.bytes(Arrays.asList("Study ID: 7788"));

        try (InputStream is = new ByteArrayInputStream(bytes)) {
            assertThat(renderer.render(is, "upload.pdf")).contains("Study ID: 7788");
        }
    }

    @Test
    void shouldWrapCorruptDocumentInDocumentReadException() throws IOException {
        File corrupt = tempDir.resolve("corrupt.pdf").toFile();
        Files.write(corrupt.toPath(), "this is not a pdf".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> renderer.render(corrupt))
                .isInstanceOfSatisfying(DocumentReadException.class,
                        e -> assertThat(e.getDocumentName()).isEqualTo("corrupt.pdf"))
                .hasMessageContaining("corrupt.pdf");
    }

    @Test
    void shouldWrapRuntimeFailureInDocumentReadException() {
        InputStream broken = new InputStream() {
            @Override
            public int read() {
                throw new IllegalStateException("stream decode error");
            }

            @Override
            public int read(byte[] b, int off, int len) {
                throw new IllegalStateException("stream decode error");
            }
        };

        assertThatThrownBy(() -> renderer.render(broken, "broken.pdf"))
                .isInstanceOfSatisfying(DocumentReadException.class,
                        e -> assertThat(e.getCause()).isInstanceOf(IllegalStateException.class))
                .hasMessageContaining("stream decode error");
    }

    @Test
    void shouldFailForMissingFile() {
        File missing = tempDir.resolve("missing.pdf").toFile();

        assertThatThrownBy(() -> renderer.render(missing)).isInstanceOf(DocumentReadException.class);
    }
}
