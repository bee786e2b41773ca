package com.docformat.core.format;

import com.docformat.core.language.LanguageService;
import com.docformat.core.location.Location;
import com.docformat.core.location.LocationService;
import com.docformat.core.model.Content;
import com.docformat.core.model.ContentBlockCode;
import com.docformat.core.model.ContentCode;
import com.docformat.core.model.ContentEmphasis;
import com.docformat.core.model.ContentExternalLink;
import com.docformat.core.model.ContentIdentifier;
import com.docformat.core.model.ContentKeyword;
import com.docformat.core.model.ContentList;
import com.docformat.core.model.ContentListItem;
import com.docformat.core.model.ContentNode;
import com.docformat.core.model.ContentNodeLink;
import com.docformat.core.model.ContentParagraph;
import com.docformat.core.model.ContentStrong;
import com.docformat.core.model.ContentSymbol;
import com.docformat.core.model.ContentText;
import com.docformat.core.model.DocumentationNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Format-independent traversal of a documentation tree.
 *
 * <p>This class decides which sections a page contains and in which order; subclasses
 * decide how each primitive (header, paragraph, table, link, code block) is written in
 * their output syntax.
 *
 * <h2>Page Layout</h2>
 * <ol>
 *   <li><b>Breadcrumbs:</b> the ancestor chain of the documented nodes, as links</li>
 *   <li><b>Location block:</b> per distinct name, a header, the signatures grouped by
 *       summary, then the description and named sections</li>
 *   <li><b>Member tables:</b> one table per non-empty {@link MemberCategory}, in the
 *       category's declaration order</li>
 * </ol>
 *
 * <h2>Escaping</h2>
 * <p>Text is escaped once, at the leaves of a content tree, by {@link #formatText(String)}
 * and the symbol/keyword/identifier hooks. Hooks receiving the output of other hooks
 * (strong, emphasis, code, list, link text) must wrap it without escaping again. Link
 * targets are never escaped.
 *
 * <h2>Grouping</h2>
 * <p>Every grouping (by breadcrumbs, name, summary or resolved link) preserves the order in
 * which keys are first seen, so output is identical across runs.
 *
 * <p>Collaborator failures are not caught; they abort the current render call.
 *
 * @see com.docformat.core.format.html.HtmlFormatter
 */
public abstract class StructuredFormatter implements FormatService {

    private static final Logger log = LoggerFactory.getLogger(StructuredFormatter.class);

    private static final String DESCRIPTION = "Description";
    private static final int SECTION_HEADER_LEVEL = 3;

    protected final LocationService locationService;
    protected final LanguageService languageService;

    protected StructuredFormatter(LocationService locationService, LanguageService languageService) {
        this.locationService = Objects.requireNonNull(locationService, "locationService must not be null");
        this.languageService = Objects.requireNonNull(languageService, "languageService must not be null");
    }

    // Block hooks

    public abstract void appendBlockCode(StringBuilder to, String line);

    public abstract void appendBlockCode(StringBuilder to, List<String> lines);

    public abstract void appendHeader(StringBuilder to, String text, int level);

    public void appendHeader(StringBuilder to, String text) {
        appendHeader(to, text, 1);
    }

    /**
     * Appends a paragraph.
     *
     * @param to output buffer
     * @param text already formatted paragraph body
     */
    public abstract void appendText(StringBuilder to, String text);

    public abstract void appendLine(StringBuilder to, String text);

    public abstract void appendLine(StringBuilder to);

    // Table hooks; body writes the region's content into the same buffer

    public abstract void appendTable(StringBuilder to, Runnable body);

    public abstract void appendTableHeader(StringBuilder to, Runnable body);

    public abstract void appendTableBody(StringBuilder to, Runnable body);

    public abstract void appendTableRow(StringBuilder to, Runnable body);

    public abstract void appendTableCell(StringBuilder to, Runnable body);

    // Inline hooks

    /**
     * Escapes untrusted text for the output syntax.
     *
     * @param text raw text
     * @return text safe to embed in the output
     */
    public abstract String formatText(String text);

    public abstract String formatSymbol(String text);

    public abstract String formatKeyword(String text);

    public abstract String formatIdentifier(String text);

    /**
     * Formats a link to a resolved location.
     *
     * @param text already formatted link text
     * @param location destination, embedded without escaping
     * @return formatted link
     */
    public abstract String formatLink(String text, Location location);

    /**
     * Formats a link to a raw external target.
     *
     * @param text already formatted link text
     * @param href destination, embedded without escaping
     * @return formatted link
     */
    public abstract String formatLink(String text, String href);

    public String formatLink(FormatLink link) {
        return formatLink(formatText(link.text()), link.location());
    }

    public abstract String formatStrong(String text);

    public abstract String formatEmphasis(String text);

    public abstract String formatCode(String code);

    public abstract String formatList(String text);

    public abstract String formatListItem(String text);

    /**
     * Joins breadcrumb links into one line.
     *
     * @param items links from the root down to the documented node
     * @return formatted breadcrumb trail
     */
    public abstract String formatBreadcrumbs(List<FormatLink> items);

    // Outline hooks

    public abstract void appendOutlineHeader(StringBuilder to, DocumentationNode node);

    public abstract void appendOutlineChildren(StringBuilder to, List<DocumentationNode> nodes);

    /**
     * Renders a sequence of content nodes and concatenates the results.
     *
     * @param location location of the page being rendered
     * @param nodes content nodes
     * @return formatted text, empty for an empty sequence
     */
    public String renderText(Location location, List<? extends ContentNode> nodes) {
        StringBuilder to = new StringBuilder();
        for (ContentNode node : nodes) {
            to.append(renderText(location, node));
        }
        return to.toString();
    }

    /**
     * Renders a content tree.
     *
     * <p>Node links are resolved relative to {@code location} using this format's
     * {@link #extension()}.
     *
     * @param location location of the page being rendered
     * @param content content tree
     * @return formatted text
     */
    public String renderText(Location location, ContentNode content) {
        Objects.requireNonNull(content, "content must not be null");
        StringBuilder to = new StringBuilder();
        if (content instanceof ContentText text) {
            to.append(formatText(text.text()));
        } else if (content instanceof ContentSymbol symbol) {
            to.append(formatSymbol(symbol.text()));
        } else if (content instanceof ContentKeyword keyword) {
            to.append(formatKeyword(keyword.text()));
        } else if (content instanceof ContentIdentifier identifier) {
            to.append(formatIdentifier(identifier.text()));
        } else if (content instanceof ContentStrong) {
            to.append(formatStrong(renderText(location, content.children())));
        } else if (content instanceof ContentCode) {
            to.append(formatCode(renderText(location, content.children())));
        } else if (content instanceof ContentEmphasis) {
            to.append(formatEmphasis(renderText(location, content.children())));
        } else if (content instanceof ContentList) {
            to.append(formatList(renderText(location, content.children())));
        } else if (content instanceof ContentListItem) {
            to.append(formatListItem(renderText(location, content.children())));
        } else if (content instanceof ContentNodeLink link) {
            Location linkTo = locationService.relativeLocation(location, link.node(), extension());
            to.append(formatLink(renderText(location, link.children()), linkTo));
        } else if (content instanceof ContentExternalLink link) {
            to.append(formatLink(renderText(location, link.children()), link.href()));
        } else if (content instanceof ContentParagraph) {
            appendText(to, renderText(location, content.children()));
        } else if (content instanceof ContentBlockCode) {
            appendBlockCode(to, renderText(location, content.children()));
        } else {
            to.append(renderText(location, content.children()));
        }
        return to.toString();
    }

    /**
     * Builds a link from one node's page to another node, using this format's extension.
     *
     * @param from node whose page the link appears on
     * @param to link target
     * @return link labelled with the target's name
     */
    public FormatLink crossLink(DocumentationNode from, DocumentationNode to) {
        return crossLink(from, to, extension());
    }

    public FormatLink crossLink(DocumentationNode from, DocumentationNode to, String extension) {
        return new FormatLink(to.name(), locationService.relativeLocation(from, to, extension));
    }

    /**
     * Appends the description block of the nodes that have documentation content.
     *
     * <p>When several nodes are described under one heading, each is preceded by its
     * signature. Sections with a reserved label (starting with {@code $}) and sections
     * named like one of the node's members are skipped; member tables already cover them.
     *
     * @param location location of the page being rendered
     * @param to output buffer
     * @param nodes candidates; nodes with empty content are ignored
     */
    public void renderDescription(Location location, StringBuilder to, List<DocumentationNode> nodes) {
        List<DocumentationNode> described = nodes.stream()
            .filter(node -> !node.content().isEmpty())
            .collect(Collectors.toList());
        if (described.isEmpty()) {
            return;
        }

        boolean single = described.size() == 1;
        appendHeader(to, DESCRIPTION, SECTION_HEADER_LEVEL);
        for (DocumentationNode node : described) {
            if (!single) {
                appendBlockCode(to, renderText(location, languageService.render(node)));
            }
            appendLine(to, renderText(location, node.content().description()));
            appendLine(to);
            for (Map.Entry<String, ContentNode> section : node.content().sections().entrySet()) {
                String label = section.getKey();
                if (Content.isReserved(label) || hasMemberNamed(node, label)) {
                    continue;
                }
                appendLine(to, formatStrong(formatText(label)));
                appendLine(to, renderText(location, section.getValue()));
            }
        }
    }

    /**
     * Appends signatures grouped by identical summary, each group followed by its summary.
     *
     * @param location location of the page being rendered
     * @param to output buffer
     * @param nodes nodes to summarize
     */
    public void renderSummary(Location location, StringBuilder to, List<DocumentationNode> nodes) {
        Map<String, List<DocumentationNode>> bySummary =
            groupBy(nodes, node -> renderText(location, node.summary()));

        bySummary.forEach((summary, items) -> {
            for (DocumentationNode item : items) {
                appendBlockCode(to, renderText(location, languageService.render(item)));
            }
            appendLine(to, summary);
            appendLine(to);
        });
    }

    /**
     * Appends a header, summary and description for each distinct node name.
     *
     * @param location location of the page being rendered
     * @param to output buffer
     * @param nodes documented nodes; overloads sharing a name share one block
     */
    public void renderLocationBlock(Location location, StringBuilder to, List<DocumentationNode> nodes) {
        Map<String, List<DocumentationNode>> byName = groupBy(nodes, DocumentationNode::name);
        byName.forEach((name, items) -> {
            appendHeader(to, formatText(name));
            renderSummary(location, to, items);
            renderDescription(location, to, items);
        });
    }

    /**
     * Appends one member table.
     *
     * <p>Members are sorted by name and grouped by their resolved link, so members sharing
     * a page (overloads) share one row. The second cell lists, per distinct summary, the
     * signatures of the members having it followed by the summary itself.
     *
     * @param location location of the page being rendered
     * @param caption section header
     * @param members members to list; nothing is written when empty
     * @param owner node the links are computed from
     * @param to output buffer
     */
    public void renderSection(Location location, String caption, List<DocumentationNode> members,
                              DocumentationNode owner, StringBuilder to) {
        if (members.isEmpty()) {
            return;
        }

        appendHeader(to, caption, SECTION_HEADER_LEVEL);

        List<DocumentationNode> sorted = members.stream()
            .sorted(Comparator.comparing(DocumentationNode::name))
            .collect(Collectors.toList());
        Map<FormatLink, List<DocumentationNode>> byLink = groupBy(sorted, member -> crossLink(owner, member));

        appendTable(to, () -> appendTableBody(to, () -> byLink.forEach((memberLink, items) ->
            appendTableRow(to, () -> {
                appendTableCell(to, () -> appendText(to, formatLink(memberLink)));
                appendTableCell(to, () -> appendSummaryCell(location, to, items));
            })
        )));
    }

    private void appendSummaryCell(Location location, StringBuilder to, List<DocumentationNode> items) {
        Map<String, List<DocumentationNode>> bySummary =
            groupBy(items, item -> renderText(location, item.summary()));
        bySummary.forEach((summary, signatures) -> {
            for (DocumentationNode signature : signatures) {
                appendBlockCode(to, renderText(location, languageService.render(signature)));
            }
            if (!summary.isEmpty()) {
                appendText(to, summary);
            }
        });
    }

    /**
     * Renders the documentation page of the given nodes.
     *
     * <p>Nodes sharing a breadcrumb trail are documented under one trail. Member tables
     * are then emitted for every input node, not only for the first of each group.
     *
     * @param location location of the page being rendered
     * @param to output buffer
     * @param nodes nodes documented on the page
     */
    @Override
    public void renderTree(Location location, StringBuilder to, List<DocumentationNode> nodes) {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(nodes, "nodes must not be null");
        log.debug("Rendering {} node(s) for {}", nodes.size(), location.path());

        Map<String, List<DocumentationNode>> byBreadcrumbs = groupBy(nodes, this::breadcrumbs);
        byBreadcrumbs.forEach((breadcrumbs, items) -> {
            appendLine(to, breadcrumbs);
            appendLine(to);
            renderLocationBlock(location, to, items);
        });

        for (DocumentationNode node : nodes) {
            for (MemberCategory category : MemberCategory.values()) {
                renderSection(location, category.caption(), category.select(node), node, to);
            }
        }
    }

    /**
     * Renders a page into a fresh buffer.
     *
     * @param location location of the page being rendered
     * @param nodes nodes documented on the page
     * @return page text
     */
    public String render(Location location, List<DocumentationNode> nodes) {
        StringBuilder to = new StringBuilder();
        renderTree(location, to, nodes);
        return to.toString();
    }

    @Override
    public void renderOutline(Location location, StringBuilder to, List<DocumentationNode> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        for (DocumentationNode node : nodes) {
            appendOutlineHeader(to, node);
            if (!node.members().isEmpty()) {
                appendOutlineChildren(to, node.members());
            }
        }
    }

    private String breadcrumbs(DocumentationNode node) {
        List<FormatLink> trail = node.path().stream()
            .map(ancestor -> crossLink(node, ancestor))
            .collect(Collectors.toList());
        return formatBreadcrumbs(trail);
    }

    private static boolean hasMemberNamed(DocumentationNode node, String name) {
        return node.members().stream().anyMatch(member -> member.name().equals(name));
    }

    private static <K> Map<K, List<DocumentationNode>> groupBy(List<DocumentationNode> nodes,
                                                               Function<DocumentationNode, K> key) {
        return nodes.stream()
            .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.toList()));
    }
}
