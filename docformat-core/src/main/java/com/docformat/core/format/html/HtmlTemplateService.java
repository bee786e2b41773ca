package com.docformat.core.format.html;

import com.docformat.core.config.FormatterConfig;

/**
 * Supplies the markup surrounding every HTML page.
 */
public interface HtmlTemplateService {

    /**
     * Appends everything that precedes the page body.
     *
     * @param to output buffer
     */
    void appendHeader(StringBuilder to);

    /**
     * Appends everything that follows the page body.
     *
     * @param to output buffer
     */
    void appendFooter(StringBuilder to);

    /**
     * Returns a template with a bare {@code html/head/body} skeleton.
     *
     * @return default template
     */
    static HtmlTemplateService defaultTemplate() {
        return of(FormatterConfig.TemplateConfig.defaults());
    }

    /**
     * Returns a template configured with an optional page title and stylesheet.
     *
     * @param config template settings
     * @return template writing the configured head elements
     */
    static HtmlTemplateService of(FormatterConfig.TemplateConfig config) {
        return new HtmlTemplateService() {
            @Override
            public void appendHeader(StringBuilder to) {
                to.append("<html>\n");
                to.append("<head>\n");
                if (config.title() != null && !config.title().isBlank()) {
                    to.append("<title>").append(HtmlFormatter.escapeHtml(config.title())).append("</title>\n");
                }
                if (config.stylesheet() != null && !config.stylesheet().isBlank()) {
                    to.append("<link rel=\"stylesheet\" href=\"").append(config.stylesheet()).append("\">\n");
                }
                to.append("</head>\n");
                to.append("<body>\n");
            }

            @Override
            public void appendFooter(StringBuilder to) {
                to.append("</body>\n");
                to.append("</html>\n");
            }
        };
    }
}
