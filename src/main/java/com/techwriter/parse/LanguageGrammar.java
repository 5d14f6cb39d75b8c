package com.techwriter.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;

/**
 * Per-language knowledge: which native node types map to which {@link NodeCategory}, and where a
 * node keeps its name.
 */
public abstract class LanguageGrammar {

    public abstract String name();

    /**
     * Loads the native grammar. May throw {@link LinkageError} where the bundled library does not load.
     */
    protected abstract TSLanguage createLanguage();

    public abstract Optional<NodeCategory> classify(TSNode node);

    /**
     * Identifier node naming a declaration, or null when the grammar has none for it.
     */
    protected abstract TSNode nameNode(TSNode node, NodeCategory category);

    public abstract String symbolKind(TSNode node, NodeCategory category, boolean insideClass);

    public abstract List<String> importedNames(TSNode node, SourceText source);

    /**
     * Names a reference node points at: the callee of a call, the supertypes of a heritage clause.
     */
    public abstract List<String> referencedNames(TSNode node, NodeCategory category, SourceText source);

    public String doc(TSNode node, SourceText source) {
        TSNode previous = node.getPrevNamedSibling();
        if (present(previous) && previous.getType().contains("comment")
                && SourceText.endLine(previous) >= SourceText.startLine(node) - 1) {
            return stripComment(source.text(previous));
        }
        return null;
    }

    public String declarationName(TSNode node, NodeCategory category, SourceText source) {
        TSNode name = nameNode(node, category);
        if (present(name)) {
            String text = source.text(name).strip();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return fallbackName(source.line(SourceText.startLine(node)));
    }

    public String signature(TSNode node, SourceText source) {
        String first = source.line(SourceText.startLine(node)).strip();
        if (first.endsWith("{") || first.endsWith(":")) {
            first = first.substring(0, first.length() - 1).strip();
        }
        return first;
    }

    static String fallbackName(String firstLine) {
        String name = firstLine.strip();
        int paren = name.indexOf('(');
        if (paren > 0) {
            name = name.substring(0, paren);
        }
        return name.isEmpty() ? "unknown" : name;
    }

    static boolean present(TSNode node) {
        return node != null && !node.isNull();
    }

    static TSNode field(TSNode node, String fieldName) {
        TSNode child = node.getChildByFieldName(fieldName);
        return present(child) ? child : null;
    }

    static boolean parentIs(TSNode node, String type) {
        TSNode parent = node.getParent();
        return present(parent) && type.equals(parent.getType());
    }

    /**
     * Last segment of a dotted or member access reference: {@code self.repo.save} gives {@code save}.
     */
    static String lastSegment(String reference) {
        String trimmed = reference.strip();
        int cut = Math.max(trimmed.lastIndexOf('.'), trimmed.lastIndexOf("::"));
        String segment = cut >= 0 ? trimmed.substring(cut + 1).replace(":", "") : trimmed;
        int generic = segment.indexOf('<');
        return generic > 0 ? segment.substring(0, generic) : segment;
    }

    /**
     * Type and identifier names under a heritage clause, skipping generic arguments.
     */
    static List<String> typeNames(TSNode node, SourceText source) {
        List<String> names = new ArrayList<>();
        collectTypeNames(node, source, names);
        return names;
    }

    private static void collectTypeNames(TSNode node, SourceText source, List<String> names) {
        String type = node.getType();
        if ("type_arguments".equals(type) || "keyword_argument".equals(type)) {
            return;
        }
        if ("identifier".equals(type) || "type_identifier".equals(type)
                || "scoped_type_identifier".equals(type) || "attribute".equals(type)
                || "member_expression".equals(type) || "scoped_identifier".equals(type)) {
            names.add(lastSegment(source.text(node)));
            return;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            collectTypeNames(node.getNamedChild(i), source, names);
        }
    }

    private static String stripComment(String comment) {
        StringBuilder out = new StringBuilder();
        for (String line : comment.split("\\R")) {
            String cleaned = line.strip()
                    .replaceFirst("^/\\*\\*?", "")
                    .replaceFirst("\\*/$", "")
                    .replaceFirst("^//+", "")
                    .replaceFirst("^\\*", "")
                    .replaceFirst("^#", "")
                    .strip();
            if (!cleaned.isEmpty()) {
                if (out.length() > 0) {
                    out.append('\n');
                }
                out.append(cleaned);
            }
        }
        return out.length() == 0 ? null : out.toString();
    }
}
