package com.techwriter.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterPython;

public class PythonGrammar extends LanguageGrammar {

    @Override
    public String name() {
        return "python";
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterPython();
    }

    @Override
    public Optional<NodeCategory> classify(TSNode node) {
        return switch (node.getType()) {
            case "function_definition" -> Optional.of(NodeCategory.FUNCTION);
            case "class_definition" -> Optional.of(NodeCategory.CLASS);
            case "import_statement", "import_from_statement" -> Optional.of(NodeCategory.IMPORT);
            case "call" -> Optional.of(NodeCategory.CALL);
            case "argument_list" -> parentIs(node, "class_definition")
                    ? Optional.of(NodeCategory.INHERIT)
                    : Optional.empty();
            default -> Optional.empty();
        };
    }

    @Override
    protected TSNode nameNode(TSNode node, NodeCategory category) {
        return field(node, "name");
    }

    @Override
    public String symbolKind(TSNode node, NodeCategory category, boolean insideClass) {
        if (category == NodeCategory.CLASS) {
            return "class";
        }
        return insideClass ? "method" : "function";
    }

    @Override
    public List<String> importedNames(TSNode node, SourceText source) {
        List<String> names = new ArrayList<>();
        if ("import_statement".equals(node.getType())) {
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                names.add(moduleText(node.getNamedChild(i), source));
            }
            return names;
        }
        TSNode module = field(node, "module_name");
        String base = module == null ? "" : source.text(module).strip();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (module != null && child.getStartByte() == module.getStartByte()) {
                continue;
            }
            if ("wildcard_import".equals(child.getType())) {
                names.add(base);
                continue;
            }
            String member = moduleText(child, source);
            names.add(base.isEmpty() || base.endsWith(".") ? base + member : base + "." + member);
        }
        if (names.isEmpty() && !base.isEmpty()) {
            names.add(base);
        }
        return names;
    }

    @Override
    public List<String> referencedNames(TSNode node, NodeCategory category, SourceText source) {
        if (category == NodeCategory.CALL) {
            TSNode function = field(node, "function");
            return function == null ? List.of() : List.of(lastSegment(source.text(function)));
        }
        if (category == NodeCategory.INHERIT) {
            return typeNames(node, source);
        }
        return List.of();
    }

    @Override
    public String doc(TSNode node, SourceText source) {
        TSNode body = field(node, "body");
        if (body != null && body.getNamedChildCount() > 0) {
            TSNode first = body.getNamedChild(0);
            if ("expression_statement".equals(first.getType()) && first.getNamedChildCount() > 0
                    && "string".equals(first.getNamedChild(0).getType())) {
                return stripQuotes(source.text(first.getNamedChild(0)));
            }
        }
        return super.doc(node, source);
    }

    private static String moduleText(TSNode node, SourceText source) {
        if ("aliased_import".equals(node.getType())) {
            TSNode name = field(node, "name");
            return name == null ? source.text(node).strip() : source.text(name).strip();
        }
        return source.text(node).strip();
    }

    private static String stripQuotes(String literal) {
        String value = literal.strip();
        int start = 0;
        while (start < value.length() && Character.isLetter(value.charAt(start))) {
            start++;
        }
        value = value.substring(start);
        for (String quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (value.startsWith(quote) && value.endsWith(quote) && value.length() >= 2 * quote.length()) {
                return value.substring(quote.length(), value.length() - quote.length()).strip();
            }
        }
        return value;
    }
}
