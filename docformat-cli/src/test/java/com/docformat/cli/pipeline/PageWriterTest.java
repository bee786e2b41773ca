package com.docformat.cli.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PageWriter}.
 */
class PageWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_createsNestedDirectories() throws IOException {
        Path outputDir = tempDir.resolve("docs/api");
        PageWriter writer = new PageWriter(outputDir);

        writer.write(List.of(
            new GeneratedPage("index.html", "<html>root</html>"),
            new GeneratedPage("com.example/Parser/index.html", "<html>parser</html>")));

        assertThat(Files.readString(outputDir.resolve("index.html"))).isEqualTo("<html>root</html>");
        assertThat(Files.readString(outputDir.resolve("com.example/Parser/index.html"))).isEqualTo("<html>parser</html>");
    }

    @Test
    void write_overwritesExistingFiles() throws IOException {
        Files.writeString(tempDir.resolve("index.html"), "stale");

        new PageWriter(tempDir).write(List.of(new GeneratedPage("index.html", "fresh")));

        assertThat(Files.readString(tempDir.resolve("index.html"))).isEqualTo("fresh");
    }

    @Test
    void write_pathOutsideOutputDirectory_throwsException() {
        Path outputDir = tempDir.resolve("out");
        PageWriter writer = new PageWriter(outputDir);

        assertThatThrownBy(() -> writer.write(List.of(new GeneratedPage("../escaped.html", "x"))))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolve("escaped.html")).doesNotExist();
    }

    @Test
    void write_pathNormalizingInsideOutputDirectory_isWritten() throws IOException {
        new PageWriter(tempDir).write(List.of(new GeneratedPage("a/../b.html", "x")));

        assertThat(Files.readString(tempDir.resolve("b.html"))).isEqualTo("x");
    }

    @Test
    void write_whenOutputIsAFile_throwsException() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThatThrownBy(() -> new PageWriter(blocker).write(List.of(new GeneratedPage("index.html", "x"))))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("output directory");
    }
}
