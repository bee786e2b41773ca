package com.docformat.cli.pipeline;

import com.docformat.cli.model.ModelLoader;
import com.docformat.core.language.LanguageService;
import com.docformat.core.model.ContentBlock;
import com.docformat.core.model.ContentNode;
import com.docformat.core.model.ContentNodes;
import com.docformat.core.model.DocumentationNode;
import com.docformat.core.model.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders signatures from a node's declared signature text, or from its kind and name.
 *
 * <p>A declared signature (the {@value ModelLoader#SIGNATURE_SECTION} section) is used as
 * is. Otherwise the signature is the kind's keyword followed by the name, with {@code ()}
 * for constructors and functions: {@code fun parse()}, {@code class Parser}.
 */
public class KindSignatureService implements LanguageService {

    @Override
    public ContentNode render(DocumentationNode node) {
        ContentNode declared = node.content().sections().get(ModelLoader.SIGNATURE_SECTION);
        if (declared != null) {
            return declared;
        }

        List<ContentNode> parts = new ArrayList<>();
        String keyword = keyword(node.kind());
        if (!keyword.isEmpty()) {
            parts.add(ContentNodes.keyword(keyword));
            parts.add(ContentNodes.symbol(" "));
        }
        parts.add(ContentNodes.identifier(node.name()));
        if (node.kind() == NodeKind.FUNCTION || node.kind() == NodeKind.CONSTRUCTOR) {
            parts.add(ContentNodes.symbol("()"));
        }
        return new ContentBlock(parts);
    }

    static String keyword(NodeKind kind) {
        return switch (kind) {
            case MODULE -> "module";
            case PACKAGE -> "package";
            case CLASS -> "class";
            case INTERFACE -> "interface";
            case ENUM -> "enum class";
            case OBJECT -> "object";
            case CONSTRUCTOR -> "constructor";
            case PROPERTY -> "val";
            case FUNCTION -> "fun";
            case ANNOTATION -> "annotation class";
            case PROPERTY_ACCESSOR -> "get";
            case ENUM_ITEM, PARAMETER, TYPE_PARAMETER, UNKNOWN -> "";
        };
    }
}
