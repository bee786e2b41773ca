package com.docformat.core.format.html;

import com.docformat.core.format.FormatLink;
import com.docformat.core.format.StructuredFormatter;
import com.docformat.core.language.LanguageService;
import com.docformat.core.location.Location;
import com.docformat.core.location.LocationService;
import com.docformat.core.model.DocumentationNode;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes documentation pages as HTML.
 *
 * <p>The produced tag set ({@code h1..h6}, {@code p}, {@code br}, {@code table},
 * {@code thead}, {@code tbody}, {@code tr}, {@code td}, {@code a href}, {@code strong},
 * {@code emph}, {@code code}, {@code pre}, {@code ul}, {@code li} and
 * {@code span class="symbol|keyword|identifier"}) is what existing stylesheets target,
 * so it must stay stable.
 *
 * <p>Pages are wrapped in the header and footer of an {@link HtmlTemplateService}.
 * Outlines are not supported by this format; the outline hooks write nothing.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * HtmlFormatter formatter = new HtmlFormatter(locationService, languageService);
 * Location page = locationService.location(node, formatter.extension());
 * String html = formatter.render(page, List.of(node));
 * }</pre>
 */
public class HtmlFormatter extends StructuredFormatter {

    private static final String EXTENSION = "html";
    private static final String BREADCRUMB_SEPARATOR = "&nbsp;/&nbsp;";
    private static final String NEWLINE = "\n";

    private final HtmlTemplateService templateService;

    public HtmlFormatter(LocationService locationService, LanguageService languageService) {
        this(locationService, languageService, HtmlTemplateService.defaultTemplate());
    }

    public HtmlFormatter(LocationService locationService, LanguageService languageService,
                         HtmlTemplateService templateService) {
        super(locationService, languageService);
        this.templateService = Objects.requireNonNull(templateService, "templateService must not be null");
    }

    @Override
    public String extension() {
        return EXTENSION;
    }

    @Override
    public String formatText(String text) {
        return escapeHtml(text);
    }

    @Override
    public String formatSymbol(String text) {
        return "<span class=\"symbol\">" + formatText(text) + "</span>";
    }

    @Override
    public String formatKeyword(String text) {
        return "<span class=\"keyword\">" + formatText(text) + "</span>";
    }

    @Override
    public String formatIdentifier(String text) {
        return "<span class=\"identifier\">" + formatText(text) + "</span>";
    }

    @Override
    public void appendBlockCode(StringBuilder to, String line) {
        to.append("<pre><code>").append(line).append("</code></pre>");
    }

    @Override
    public void appendBlockCode(StringBuilder to, List<String> lines) {
        appendBlockCode(to, String.join(NEWLINE, lines));
    }

    @Override
    public void appendHeader(StringBuilder to, String text, int level) {
        to.append("<h").append(level).append('>')
            .append(text)
            .append("</h").append(level).append('>')
            .append(NEWLINE);
    }

    @Override
    public void appendText(StringBuilder to, String text) {
        to.append("<p>").append(text).append("</p>").append(NEWLINE);
    }

    @Override
    public void appendLine(StringBuilder to, String text) {
        to.append(text).append("<br/>").append(NEWLINE);
    }

    @Override
    public void appendLine(StringBuilder to) {
        to.append("<br/>").append(NEWLINE);
    }

    @Override
    public void appendTable(StringBuilder to, Runnable body) {
        appendElement(to, "table", body);
    }

    @Override
    public void appendTableHeader(StringBuilder to, Runnable body) {
        appendElement(to, "thead", body);
    }

    @Override
    public void appendTableBody(StringBuilder to, Runnable body) {
        appendElement(to, "tbody", body);
    }

    @Override
    public void appendTableRow(StringBuilder to, Runnable body) {
        appendElement(to, "tr", body);
    }

    @Override
    public void appendTableCell(StringBuilder to, Runnable body) {
        appendElement(to, "td", body);
    }

    @Override
    public String formatLink(String text, Location location) {
        return formatLink(text, location.path());
    }

    @Override
    public String formatLink(String text, String href) {
        return "<a href=\"" + href + "\">" + text + "</a>";
    }

    @Override
    public String formatStrong(String text) {
        return "<strong>" + text + "</strong>";
    }

    @Override
    public String formatEmphasis(String text) {
        return "<emph>" + text + "</emph>";
    }

    @Override
    public String formatCode(String code) {
        return "<code>" + code + "</code>";
    }

    @Override
    public String formatList(String text) {
        return "<ul>" + text + "</ul>";
    }

    @Override
    public String formatListItem(String text) {
        return "<li>" + text + "</li>";
    }

    @Override
    public String formatBreadcrumbs(List<FormatLink> items) {
        return items.stream()
            .map(this::formatLink)
            .collect(Collectors.joining(BREADCRUMB_SEPARATOR));
    }

    @Override
    public void renderTree(Location location, StringBuilder to, List<DocumentationNode> nodes) {
        templateService.appendHeader(to);
        super.renderTree(location, to, nodes);
        templateService.appendFooter(to);
    }

    @Override
    public void appendOutlineHeader(StringBuilder to, DocumentationNode node) {
        // not supported
    }

    @Override
    public void appendOutlineChildren(StringBuilder to, List<DocumentationNode> nodes) {
        // not supported
    }

    /**
     * Escapes the five HTML special characters.
     *
     * @param text raw text
     * @return escaped text, empty for null
     */
    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static void appendElement(StringBuilder to, String tag, Runnable body) {
        to.append('<').append(tag).append('>').append(NEWLINE);
        body.run();
        to.append("</").append(tag).append('>').append(NEWLINE);
    }
}
