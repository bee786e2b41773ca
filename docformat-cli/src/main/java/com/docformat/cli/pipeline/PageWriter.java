package com.docformat.cli.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rendered pages to the filesystem.
 *
 * <p>Creates directory structure automatically and preserves relative paths.
 * Handles existing files by overwriting them. Pages whose path leads outside the output
 * directory are rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * PageWriter writer = new PageWriter(Paths.get("./docs/api"));
 * writer.write(List.of(new GeneratedPage("com.example/index.html", "<html>...")));
 * // Creates: ./docs/api/com.example/index.html
 * }</pre>
 */
public class PageWriter {

    private static final Logger log = LoggerFactory.getLogger(PageWriter.class);

    private final Path outputDir;

    public PageWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Writes pages below the output directory.
     *
     * @param pages pages to write
     * @throws UncheckedIOException if a directory or file cannot be written, or a page path
     *         leads outside the output directory
     */
    public void write(List<GeneratedPage> pages) {
        log.info("Writing {} page(s) to: {}", pages.size(), outputDir);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedPage page : pages) {
            writePage(page);
        }
    }

    private void writePage(GeneratedPage page) {
        Path root = outputDir.toAbsolutePath().normalize();
        Path targetPath = root.resolve(page.relativePath()).normalize();
        if (!targetPath.startsWith(root) || targetPath.equals(root)) {
            throw new UncheckedIOException(new IOException(
                "Page path escapes output directory: " + page.relativePath()));
        }
        log.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, page.content());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write file: " + page.relativePath(), e);
        }
    }
}
