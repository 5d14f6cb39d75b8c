package com.techwriter.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterJava;

public class JavaGrammar extends LanguageGrammar {

    @Override
    public String name() {
        return "java";
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterJava();
    }

    @Override
    public Optional<NodeCategory> classify(TSNode node) {
        return switch (node.getType()) {
            case "method_declaration", "constructor_declaration" -> Optional.of(NodeCategory.FUNCTION);
            case "class_declaration", "interface_declaration", "enum_declaration", "record_declaration" ->
                    Optional.of(NodeCategory.CLASS);
            case "field_declaration" -> Optional.of(NodeCategory.MEMBER);
            case "import_declaration" -> Optional.of(NodeCategory.IMPORT);
            case "method_invocation", "object_creation_expression" -> Optional.of(NodeCategory.CALL);
            case "superclass", "extends_interfaces" -> Optional.of(NodeCategory.INHERIT);
            case "super_interfaces" -> Optional.of(NodeCategory.IMPLEMENTS);
            default -> Optional.empty();
        };
    }

    @Override
    protected TSNode nameNode(TSNode node, NodeCategory category) {
        if (category == NodeCategory.MEMBER) {
            TSNode declarator = field(node, "declarator");
            return declarator == null ? null : field(declarator, "name");
        }
        return field(node, "name");
    }

    @Override
    public String symbolKind(TSNode node, NodeCategory category, boolean insideClass) {
        return switch (node.getType()) {
            case "interface_declaration" -> "interface";
            case "enum_declaration" -> "enum";
            case "record_declaration" -> "record";
            case "class_declaration" -> "class";
            case "constructor_declaration" -> "constructor";
            case "field_declaration" -> "field";
            default -> "method";
        };
    }

    @Override
    public List<String> importedNames(TSNode node, SourceText source) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if ("scoped_identifier".equals(child.getType()) || "identifier".equals(child.getType())) {
                return List.of(source.text(child).strip());
            }
        }
        return List.of();
    }

    @Override
    public List<String> referencedNames(TSNode node, NodeCategory category, SourceText source) {
        if (category == NodeCategory.CALL) {
            TSNode target = "object_creation_expression".equals(node.getType()) ? field(node, "type") : field(node, "name");
            return target == null ? List.of() : List.of(lastSegment(source.text(target)));
        }
        if (category == NodeCategory.INHERIT || category == NodeCategory.IMPLEMENTS) {
            return new ArrayList<>(typeNames(node, source));
        }
        return List.of();
    }
}
