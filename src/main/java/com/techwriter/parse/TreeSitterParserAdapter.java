package com.techwriter.parse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import com.techwriter.store.EdgeType;

public class TreeSitterParserAdapter implements ParserAdapter {
    private static final Logger log = LoggerFactory.getLogger(TreeSitterParserAdapter.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final Map<String, LanguageGrammar> grammars = new LinkedHashMap<>();
    private final Map<String, TSLanguage> languages = new HashMap<>();
    private final ThreadLocal<Map<String, TSParser>> parsers = ThreadLocal.withInitial(HashMap::new);

    public TreeSitterParserAdapter() {
        this(List.of(new PythonGrammar(), new JavaGrammar(), new JavaScriptGrammar()));
    }

    public TreeSitterParserAdapter(List<LanguageGrammar> grammars) {
        for (LanguageGrammar grammar : grammars) {
            try {
                languages.put(grammar.name(), grammar.createLanguage());
                this.grammars.put(grammar.name(), grammar);
            } catch (LinkageError | RuntimeException e) {
                log.warn("parser.unavailable language={} reason={}", grammar.name(), e.toString());
            }
        }
    }

    @Override
    public boolean supports(String language) {
        return grammars.containsKey(language);
    }

    @Override
    public Optional<ParsedSource> parse(String text, String language) {
        LanguageGrammar grammar = grammars.get(language);
        if (grammar == null) {
            return Optional.empty();
        }
        try {
            TSTree tree = parser(language).parseString(null, text);
            if (tree == null || tree.getRootNode().isNull()) {
                return Optional.empty();
            }
            if (tree.getRootNode().hasError()) {
                log.debug("parser.partial language={}", language);
            }
            return Optional.of(new ParsedSource(grammar, new SourceText(text), tree));
        } catch (RuntimeException e) {
            log.warn("parser.failed language={} reason={}", language, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public List<ChunkCandidate> chunks(ParsedSource parsed) {
        List<ChunkCandidate> chunks = new ArrayList<>();
        for (Declaration declaration : declarations(parsed)) {
            if (declaration.category().isChunked()) {
                SymbolCandidate symbol = declaration.symbol();
                chunks.add(new ChunkCandidate(symbol.startLine(), symbol.endLine(),
                        parsed.source().lines(symbol.startLine(), symbol.endLine()), symbol.kind()));
            }
        }
        return chunks;
    }

    @Override
    public List<SymbolCandidate> symbols(ParsedSource parsed) {
        return declarations(parsed).stream().map(Declaration::symbol).toList();
    }

    @Override
    public List<ImportCandidate> imports(ParsedSource parsed) {
        List<ImportCandidate> imports = new ArrayList<>();
        collectImports(parsed.root(), parsed, imports);
        return imports;
    }

    /**
     * Walks the tree with the enclosing symbol threaded down as context. Reference nodes emit edges
     * from the enclosing symbol, and members nested in a class emit a member-of edge to it. Only
     * edges whose destination names a symbol in {@code symbols} are kept.
     */
    @Override
    public List<EdgeCandidate> edges(ParsedSource parsed, List<SymbolCandidate> symbols) {
        Set<String> names = new LinkedHashSet<>();
        symbols.forEach(symbol -> names.add(symbol.name()));
        return references(parsed, symbols).stream()
                .filter(edge -> names.contains(edge.dstName()))
                .toList();
    }

    @Override
    public List<EdgeCandidate> references(ParsedSource parsed, List<SymbolCandidate> symbols) {
        Map<String, SymbolCandidate> byPosition = new HashMap<>();
        for (SymbolCandidate symbol : symbols) {
            byPosition.putIfAbsent(symbol.name() + "@" + symbol.startLine(), symbol);
        }
        Set<EdgeCandidate> edges = new LinkedHashSet<>();
        visitEdges(parsed.root(), parsed, new WalkContext(null), byPosition, edges);
        return List.copyOf(edges);
    }

    private record WalkContext(SymbolCandidate enclosing) {
        WalkContext enter(SymbolCandidate symbol) {
            return new WalkContext(symbol);
        }
    }

    private record Declaration(SymbolCandidate symbol, NodeCategory category) {
    }

    private void visitEdges(TSNode node, ParsedSource parsed, WalkContext context,
            Map<String, SymbolCandidate> byPosition, Set<EdgeCandidate> edges) {
        LanguageGrammar grammar = parsed.grammar();
        WalkContext next = context;
        Optional<NodeCategory> category = grammar.classify(node);
        if (category.isPresent()) {
            NodeCategory value = category.get();
            if (value.declaresSymbol()) {
                String name = grammar.declarationName(node, value, parsed.source());
                SymbolCandidate symbol = byPosition.get(name + "@" + SourceText.startLine(node));
                if (symbol != null) {
                    if (context.enclosing() != null && context.enclosing().isClassLike()) {
                        edges.add(new EdgeCandidate(symbol.name(), symbol.startLine(),
                                context.enclosing().name(), EdgeType.MEMBER_OF));
                    }
                    next = context.enter(symbol);
                }
            } else if (context.enclosing() != null) {
                Optional<EdgeType> edgeType = value.referenceEdge();
                if (edgeType.isPresent()) {
                    SymbolCandidate source = context.enclosing();
                    for (String target : grammar.referencedNames(node, value, parsed.source())) {
                        if (IDENTIFIER.matcher(target).matches() && !target.equals(source.name())) {
                            edges.add(new EdgeCandidate(source.name(), source.startLine(), target, edgeType.get()));
                        }
                    }
                }
            }
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            visitEdges(node.getNamedChild(i), parsed, next, byPosition, edges);
        }
    }

    private List<Declaration> declarations(ParsedSource parsed) {
        List<Declaration> out = new ArrayList<>();
        collectDeclarations(parsed.root(), parsed, false, out);
        return out;
    }

    private void collectDeclarations(TSNode node, ParsedSource parsed, boolean insideClass, List<Declaration> out) {
        LanguageGrammar grammar = parsed.grammar();
        boolean childInsideClass = insideClass;
        Optional<NodeCategory> category = grammar.classify(node);
        if (category.isPresent() && category.get().declaresSymbol()) {
            NodeCategory value = category.get();
            SourceText source = parsed.source();
            int start = SourceText.startLine(node);
            int end = SourceText.endLine(node);
            SymbolCandidate symbol = new SymbolCandidate(
                    grammar.declarationName(node, value, source),
                    grammar.symbolKind(node, value, insideClass),
                    grammar.signature(node, source),
                    start,
                    end,
                    grammar.doc(node, source));
            out.add(new Declaration(symbol, value));
            childInsideClass = value == NodeCategory.CLASS;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            collectDeclarations(node.getNamedChild(i), parsed, childInsideClass, out);
        }
    }

    private void collectImports(TSNode node, ParsedSource parsed, List<ImportCandidate> out) {
        Optional<NodeCategory> category = parsed.grammar().classify(node);
        if (category.isPresent() && category.get() == NodeCategory.IMPORT) {
            int line = SourceText.startLine(node);
            for (String name : parsed.grammar().importedNames(node, parsed.source())) {
                if (!name.isBlank()) {
                    out.add(new ImportCandidate(name, line));
                }
            }
            return;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            collectImports(node.getNamedChild(i), parsed, out);
        }
    }

    private TSParser parser(String language) {
        return parsers.get().computeIfAbsent(language, key -> {
            TSParser parser = new TSParser();
            parser.setLanguage(languages.get(key));
            return parser;
        });
    }
}
