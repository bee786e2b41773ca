package com.docformat.cli.pipeline;

import com.docformat.core.format.StructuredFormatter;
import com.docformat.core.location.Location;
import com.docformat.core.location.LocationService;
import com.docformat.core.model.DocumentationNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders every node of a documentation tree onto its page.
 *
 * <p>Nodes are assigned to pages by the {@link LocationService}; nodes sharing a page
 * (overloads) are rendered together in one call, in tree order.
 */
public class PageRenderer {

    private static final Logger log = LoggerFactory.getLogger(PageRenderer.class);

    private final StructuredFormatter formatter;
    private final LocationService locationService;

    public PageRenderer(StructuredFormatter formatter, LocationService locationService) {
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.locationService = Objects.requireNonNull(locationService, "locationService must not be null");
    }

    /**
     * Renders the pages of a tree.
     *
     * @param root root of the documentation tree
     * @return one page per distinct location, in tree order
     */
    public List<GeneratedPage> render(DocumentationNode root) {
        Map<Location, List<DocumentationNode>> pages = new LinkedHashMap<>();
        collect(root, pages);

        List<GeneratedPage> generated = new ArrayList<>(pages.size());
        pages.forEach((location, nodes) -> {
            log.debug("Rendering page {} ({} node(s))", location.path(), nodes.size());
            generated.add(new GeneratedPage(location.path(), formatter.render(location, nodes)));
        });
        log.info("Rendered {} page(s)", generated.size());
        return generated;
    }

    private void collect(DocumentationNode node, Map<Location, List<DocumentationNode>> pages) {
        Location location = locationService.location(node, formatter.extension());
        pages.computeIfAbsent(location, key -> new ArrayList<>()).add(node);
        for (DocumentationNode member : node.members()) {
            collect(member, pages);
        }
    }
}
