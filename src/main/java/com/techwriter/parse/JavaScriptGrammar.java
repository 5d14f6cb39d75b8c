package com.techwriter.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterJavascript;

public class JavaScriptGrammar extends LanguageGrammar {

    @Override
    public String name() {
        return "javascript";
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterJavascript();
    }

    @Override
    public Optional<NodeCategory> classify(TSNode node) {
        return switch (node.getType()) {
            case "function_declaration", "generator_function_declaration", "method_definition" ->
                    Optional.of(NodeCategory.FUNCTION);
            case "class_declaration" -> Optional.of(NodeCategory.CLASS);
            case "field_definition" -> Optional.of(NodeCategory.MEMBER);
            case "import_statement" -> Optional.of(NodeCategory.IMPORT);
            case "call_expression", "new_expression" -> Optional.of(NodeCategory.CALL);
            case "class_heritage" -> Optional.of(NodeCategory.INHERIT);
            case "export_statement" -> Optional.of(NodeCategory.EXPORT);
            default -> Optional.empty();
        };
    }

    @Override
    protected TSNode nameNode(TSNode node, NodeCategory category) {
        if (category == NodeCategory.MEMBER) {
            return field(node, "property");
        }
        return field(node, "name");
    }

    @Override
    public String symbolKind(TSNode node, NodeCategory category, boolean insideClass) {
        return switch (node.getType()) {
            case "class_declaration" -> "class";
            case "method_definition" -> "method";
            case "field_definition" -> "field";
            default -> "function";
        };
    }

    @Override
    public List<String> importedNames(TSNode node, SourceText source) {
        TSNode sourceNode = field(node, "source");
        if (sourceNode == null) {
            return List.of();
        }
        String module = source.text(sourceNode).strip().replaceAll("^['\"`]|['\"`]$", "");
        List<String> names = new ArrayList<>();
        collectSpecifiers(node, source, module, names);
        if (names.isEmpty()) {
            names.add(module);
        }
        return names;
    }

    @Override
    public List<String> referencedNames(TSNode node, NodeCategory category, SourceText source) {
        return switch (category) {
            case CALL -> {
                TSNode target = "new_expression".equals(node.getType()) ? field(node, "constructor") : field(node, "function");
                yield target == null ? List.of() : List.of(lastSegment(source.text(target)));
            }
            case INHERIT -> typeNames(node, source);
            case EXPORT -> exportedNames(node, source);
            default -> List.of();
        };
    }

    private static List<String> exportedNames(TSNode node, SourceText source) {
        List<String> names = new ArrayList<>();
        TSNode declaration = field(node, "declaration");
        if (declaration != null) {
            TSNode name = field(declaration, "name");
            if (name != null) {
                names.add(source.text(name).strip());
            }
            return names;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if ("export_clause".equals(child.getType())) {
                for (int j = 0; j < child.getNamedChildCount(); j++) {
                    TSNode name = field(child.getNamedChild(j), "name");
                    if (name != null) {
                        names.add(source.text(name).strip());
                    }
                }
            } else if ("identifier".equals(child.getType())) {
                names.add(source.text(child).strip());
            }
        }
        return names;
    }

    private static void collectSpecifiers(TSNode node, SourceText source, String module, List<String> names) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if ("import_specifier".equals(child.getType())) {
                TSNode name = field(child, "name");
                if (name != null) {
                    names.add(module + "." + source.text(name).strip());
                }
            } else if ("import_clause".equals(child.getType()) || "named_imports".equals(child.getType())) {
                collectSpecifiers(child, source, module, names);
            }
        }
    }
}
