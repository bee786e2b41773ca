package com.docformat.core.format;

import com.docformat.core.format.html.HtmlFormatter;
import com.docformat.core.format.html.HtmlTemplateService;
import com.docformat.core.language.LanguageService;
import com.docformat.core.location.Location;
import com.docformat.core.location.LocationService;
import com.docformat.core.model.Content;
import com.docformat.core.model.ContentNode;
import com.docformat.core.model.ContentNodes;
import com.docformat.core.model.DocumentationNode;
import com.docformat.core.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Base class for formatter tests.
 *
 * <p>Provides:
 * <ul>
 *   <li>A flat location service: every node lives at {@code <qualified name>.<ext>}</li>
 *   <li>A language service rendering the node name as an identifier, unless a signature
 *       was registered with {@link #signature(DocumentationNode, String)}</li>
 *   <li>An {@link HtmlFormatter} without page template, so output starts with the page body</li>
 * </ul>
 */
public abstract class FormatterTestBase {

    protected static final Location PAGE = new Location("page.html");

    protected final Map<DocumentationNode, ContentNode> signatures = new IdentityHashMap<>();

    protected LocationService locationService;
    protected LanguageService languageService;
    protected HtmlFormatter formatter;

    @BeforeEach
    void setUpFormatter() {
        locationService = new FlatLocationService();
        languageService = node -> signatures.getOrDefault(node, ContentNodes.identifier(node.name()));
        formatter = new HtmlFormatter(locationService, languageService, bareTemplate());
    }

    protected static HtmlTemplateService bareTemplate() {
        return new HtmlTemplateService() {
            @Override
            public void appendHeader(StringBuilder to) {
            }

            @Override
            public void appendFooter(StringBuilder to) {
            }
        };
    }

    protected void signature(DocumentationNode node, String text) {
        signatures.put(node, ContentNodes.identifier(text));
    }

    protected static DocumentationNode node(String name, NodeKind kind) {
        return new DocumentationNode(name, kind, Content.EMPTY);
    }

    protected static DocumentationNode node(String name, NodeKind kind, String summary) {
        return new DocumentationNode(name, kind, Content.ofSummary(ContentNodes.text(summary)));
    }

    /**
     * Counts non-overlapping occurrences of a fragment.
     */
    protected static int count(String text, String fragment) {
        int count = 0;
        for (int index = text.indexOf(fragment); index >= 0; index = text.indexOf(fragment, index + fragment.length())) {
            count++;
        }
        return count;
    }

    protected static class FlatLocationService implements LocationService {
        @Override
        public Location location(DocumentationNode node, String extension) {
            String name = node.qualifiedName();
            return new Location((name.isEmpty() ? "index" : name) + "." + extension);
        }

        @Override
        public Location relativeLocation(Location from, DocumentationNode to, String extension) {
            return location(to, extension);
        }
    }
}
