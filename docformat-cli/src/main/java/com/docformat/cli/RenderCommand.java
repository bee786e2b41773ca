package com.docformat.cli;

import com.docformat.cli.model.ModelLoadException;
import com.docformat.cli.model.ModelLoader;
import com.docformat.cli.pipeline.FolderLocationService;
import com.docformat.cli.pipeline.GeneratedPage;
import com.docformat.cli.pipeline.KindSignatureService;
import com.docformat.cli.pipeline.PageRenderer;
import com.docformat.cli.pipeline.PageWriter;
import com.docformat.core.config.ConfigLoader;
import com.docformat.core.config.FormatterConfig;
import com.docformat.core.format.html.HtmlFormatter;
import com.docformat.core.format.html.HtmlTemplateService;
import com.docformat.core.location.LocationService;
import com.docformat.core.model.DocumentationNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to render a documentation model into HTML pages.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration ({@code docformat.yaml}, optional)</li>
 *   <li>Load the JSON documentation model</li>
 *   <li>Render one HTML page per documented location</li>
 *   <li>Write the pages below the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Render with defaults
 * docformat render -i model.json
 *
 * # Render to a specific directory
 * docformat render -i model.json -o build/docs
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a documentation model into HTML pages",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Option(
        names = {"-i", "--input"},
        description = "Documentation model file (JSON)",
        required = true
    )
    private Path modelPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docformat.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Override
    public Integer call() {
        try {
            FormatterConfig config = ConfigLoader.load(configPath);
            Path targetDir = outputDir != null ? outputDir : Paths.get(config.output().directory());

            DocumentationNode root = new ModelLoader().load(modelPath);
            System.out.println("✓ Loaded model: " + modelPath);

            LocationService locationService = new FolderLocationService();
            HtmlFormatter formatter = new HtmlFormatter(
                locationService,
                new KindSignatureService(),
                HtmlTemplateService.of(config.template())
            );
            List<GeneratedPage> pages = new PageRenderer(formatter, locationService).render(root);
            System.out.println("✓ Rendered " + pages.size() + " page(s)");

            new PageWriter(targetDir).write(pages);
            System.out.println("✓ Wrote output to: " + targetDir);
            return 0;
        } catch (ModelLoadException | UncheckedIOException e) {
            log.error("Render failed", e);
            System.err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }
}
