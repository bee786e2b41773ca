package com.docformat.cli;

import com.docformat.cli.model.ModelLoadException;
import com.docformat.cli.model.ModelLoader;
import com.docformat.core.model.DocumentationNode;
import com.docformat.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to check that a documentation model loads, and summarize its contents.
 */
@Command(
    name = "validate",
    description = "Validate a documentation model file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Documentation model file (JSON)")
    private Path modelPath;

    @Override
    public Integer call() {
        log.info("Validating model: {}", modelPath);
        DocumentationNode root;
        try {
            root = new ModelLoader().load(modelPath);
        } catch (ModelLoadException e) {
            log.error("Validation failed", e);
            System.err.println("✗ Invalid model: " + e.getMessage());
            return 1;
        }

        Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
        count(root, counts);

        System.out.println("✓ Model is valid: " + modelPath);
        counts.forEach((kind, count) -> System.out.println("  " + kind + ": " + count));
        return 0;
    }

    private void count(DocumentationNode node, Map<NodeKind, Integer> counts) {
        counts.merge(node.kind(), 1, Integer::sum);
        for (DocumentationNode member : node.members()) {
            count(member, counts);
        }
    }
}
