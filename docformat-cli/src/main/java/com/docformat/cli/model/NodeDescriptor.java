package com.docformat.cli.model;

import com.docformat.core.model.NodeKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON form of one documentation node.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "name": "com.example",
 *   "kind": "package",
 *   "summary": "Parsing utilities.",
 *   "members": [
 *     {
 *       "name": "parse",
 *       "kind": "function",
 *       "signature": "fun parse(input: String): Document",
 *       "summary": "Parses the input.",
 *       "description": "First paragraph.\n\nSecond paragraph.",
 *       "sections": { "Throws": "ParseException on malformed input" }
 *     }
 *   ],
 *   "links": [ "com.other.Document" ]
 * }
 * }</pre>
 *
 * @param name simple name
 * @param kind node kind, case-insensitive; defaults to {@link NodeKind#UNKNOWN}
 * @param signature declaration text shown in code blocks, optional
 * @param summary one-line summary, optional
 * @param description description text; blank lines separate paragraphs
 * @param sections named sections, in document order
 * @param members owned child nodes
 * @param extensions qualified names of extension nodes
 * @param inheritors qualified names of inheriting nodes
 * @param links qualified names of related nodes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("kind") NodeKind kind,
    @JsonProperty("signature") String signature,
    @JsonProperty("summary") String summary,
    @JsonProperty("description") String description,
    @JsonProperty("sections") Map<String, String> sections,
    @JsonProperty("members") List<NodeDescriptor> members,
    @JsonProperty("extensions") List<String> extensions,
    @JsonProperty("inheritors") List<String> inheritors,
    @JsonProperty("links") List<String> links
) {
    /**
     * Compact constructor applying defaults.
     */
    public NodeDescriptor {
        if (name == null) {
            name = "";
        }
        if (kind == null) {
            kind = NodeKind.UNKNOWN;
        }
        if (sections == null) {
            sections = Map.of();
        }
        if (members == null) {
            members = List.of();
        }
        if (extensions == null) {
            extensions = List.of();
        }
        if (inheritors == null) {
            inheritors = List.of();
        }
        if (links == null) {
            links = List.of();
        }
    }
}
