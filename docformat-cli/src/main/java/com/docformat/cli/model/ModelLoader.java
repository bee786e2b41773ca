package com.docformat.cli.model;

import com.docformat.core.model.Content;
import com.docformat.core.model.ContentNode;
import com.docformat.core.model.ContentNodes;
import com.docformat.core.model.ContentParagraph;
import com.docformat.core.model.DocumentationNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Builds a {@link DocumentationNode} tree from a JSON model file.
 *
 * <p>Loading happens in two passes: the owned member tree is built first, then the
 * extension, inheritor and link references, given as qualified names, are resolved
 * against it. References that match no node are logged and skipped.
 *
 * <p>Plain-text fields become content trees: the summary a single text node, the
 * description one paragraph per blank-line separated block, each section a text node.
 * A {@code signature} is stored as the reserved section {@value #SIGNATURE_SECTION}, which
 * descriptions never show.
 *
 * @see NodeDescriptor
 */
public class ModelLoader {

    /** Reserved section label holding a node's declared signature. */
    public static final String SIGNATURE_SECTION = "$signature";

    private static final Logger log = LoggerFactory.getLogger(ModelLoader.class);

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    /**
     * Loads a model file.
     *
     * @param modelPath path to the JSON model
     * @return root node of the documentation tree
     * @throws ModelLoadException if the file is missing, unreadable or malformed
     */
    public DocumentationNode load(Path modelPath) {
        if (!Files.isRegularFile(modelPath)) {
            throw new ModelLoadException("Model file not found: " + modelPath);
        }

        NodeDescriptor root;
        try {
            log.debug("Loading model from: {}", modelPath);
            root = JSON_MAPPER.readValue(modelPath.toFile(), NodeDescriptor.class);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to parse model file: " + modelPath, e);
        }
        if (root == null) {
            throw new ModelLoadException("Model file is empty: " + modelPath);
        }

        DocumentationNode node = build(root);
        log.info("Loaded model from: {}", modelPath);
        return node;
    }

    /**
     * Builds the documentation tree described by a root descriptor.
     *
     * @param root root descriptor
     * @return root node
     * @throws ModelLoadException if a member entry or a section text is null
     */
    public DocumentationNode build(NodeDescriptor root) {
        Map<DocumentationNode, NodeDescriptor> descriptors = new LinkedHashMap<>();
        DocumentationNode rootNode = buildTree(root, descriptors);

        Map<String, DocumentationNode> byQualifiedName = new HashMap<>();
        descriptors.keySet().forEach(node -> byQualifiedName.putIfAbsent(node.qualifiedName(), node));

        descriptors.forEach((node, descriptor) -> {
            resolve(node, descriptor.extensions(), byQualifiedName, DocumentationNode::addExtension);
            resolve(node, descriptor.inheritors(), byQualifiedName, DocumentationNode::addInheritor);
            resolve(node, descriptor.links(), byQualifiedName, DocumentationNode::addLink);
        });
        return rootNode;
    }

    private DocumentationNode buildTree(NodeDescriptor descriptor, Map<DocumentationNode, NodeDescriptor> descriptors) {
        DocumentationNode node = new DocumentationNode(descriptor.name(), descriptor.kind(), toContent(descriptor));
        descriptors.put(node, descriptor);
        for (NodeDescriptor member : descriptor.members()) {
            if (member == null) {
                throw new ModelLoadException("Null member in node '" + descriptor.name() + "'");
            }
            node.addMember(buildTree(member, descriptors));
        }
        return node;
    }

    private void resolve(DocumentationNode node, List<String> names, Map<String, DocumentationNode> byQualifiedName,
                         BiConsumer<DocumentationNode, DocumentationNode> add) {
        for (String name : names) {
            DocumentationNode target = byQualifiedName.get(name);
            if (target == null) {
                log.warn("Unresolved reference '{}' from {}", name, node.qualifiedName());
                continue;
            }
            add.accept(node, target);
        }
    }

    private static Content toContent(NodeDescriptor descriptor) {
        Map<String, ContentNode> sections = new LinkedHashMap<>();
        if (descriptor.signature() != null && !descriptor.signature().isBlank()) {
            sections.put(SIGNATURE_SECTION, ContentNodes.text(descriptor.signature()));
        }
        descriptor.sections().forEach((label, text) -> {
            if (text == null) {
                throw new ModelLoadException("Section '" + label + "' of node '" + descriptor.name() + "' has no text");
            }
            sections.put(label, ContentNodes.text(text));
        });

        ContentNode summary = descriptor.summary() == null
            ? ContentNodes.empty()
            : ContentNodes.text(descriptor.summary().strip());
        return new Content(summary, toParagraphs(descriptor.description()), sections);
    }

    private static ContentNode toParagraphs(String text) {
        if (text == null || text.isBlank()) {
            return ContentNodes.empty();
        }
        List<ContentNode> paragraphs = new ArrayList<>();
        for (String block : text.strip().split("\\n\\s*\\n")) {
            paragraphs.add(new ContentParagraph(List.of(ContentNodes.text(block.strip()))));
        }
        return ContentNodes.block(paragraphs.toArray(new ContentNode[0]));
    }
}
