package com.javainsight.adapter.parse;

import com.javainsight.engine.cst.SyntaxNode;
import com.javainsight.engine.cst.SyntaxToken;
import com.javainsight.engine.parse.JavaGrammarParser;
import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.ToolFactory;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.compiler.IScanner;
import org.eclipse.jdt.core.compiler.ITerminalSymbols;
import org.eclipse.jdt.core.compiler.InvalidInputException;
import org.eclipse.jdt.core.dom.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link JavaGrammarParser} backed by Eclipse JDT's ASTParser.
 *
 * The JDT tree is projected onto named spans (class, field and method declarations and their
 * parts). Scanner tokens are then attached to the deepest span containing them, which yields a
 * concrete syntax tree whose every token sits at its source position.
 */
public class JdtCstParser implements JavaGrammarParser {

    static final String IDENTIFIER = "Identifier";
    static final String KEYWORD = "Keyword";
    static final String LITERAL = "Literal";
    static final String SEPARATOR = "Separator";
    static final String OPERATOR = "Operator";

    private static final Set<String> SEPARATORS =
        Set.of("(", ")", "{", "}", "[", "]", ";", ",", ".", "...", "@", "::");
    private static final Set<String> WORD_LITERALS = Set.of("true", "false", "null");

    @Override
    public SyntaxNode parse(String source) {
        try {
            return project(source);
        } catch (StackOverflowError e) {
            throw new ParseFailedException("nesting too deep to parse", e);
        } catch (ParseFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ParseFailedException("parser failure: " + e, e);
        }
    }

    private SyntaxNode project(String source) {
        char[] text = source.toCharArray();
        CompilationUnit unit = parseUnit(text);
        List<ScannedToken> tokens = scan(text);

        SpanCollector collector = new SpanCollector(tokens);
        int rootEnd = source.length();
        if (!tokens.isEmpty()) {
            rootEnd = Math.max(rootEnd, tokens.get(tokens.size() - 1).end());
        }
        collector.spans.add(new Span("compilationUnit", 0, rootEnd, 0));
        unit.accept(collector);
        return assemble(collector.spans, tokens);
    }

    private CompilationUnit parseUnit(char[] text) {
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(false);
        parser.setStatementsRecovery(false);

        Map<String, String> options = new HashMap<>();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        parser.setCompilerOptions(options);
        parser.setSource(text);

        CompilationUnit unit = (CompilationUnit) parser.createAST(null);
        for (IProblem problem : unit.getProblems()) {
            if (problem.isError()) {
                throw new ParseFailedException(
                    "line " + problem.getSourceLineNumber() + ": " + problem.getMessage());
            }
        }
        return unit;
    }

    // --- Tokens ---

    /**
     * @param end exclusive
     */
    private record ScannedToken(String kind, SyntaxToken token, int start, int end) {}

    private List<ScannedToken> scan(char[] text) {
        IScanner scanner = ToolFactory.createScanner(false, false, false, JavaCore.VERSION_17, JavaCore.VERSION_17);
        scanner.setSource(text);

        List<ScannedToken> tokens = new ArrayList<>();
        try {
            int type;
            while ((type = scanner.getNextToken()) != ITerminalSymbols.TokenNameEOF) {
                int start = scanner.getCurrentTokenStartPosition();
                int end = scanner.getCurrentTokenEndPosition();
                String image = new String(scanner.getCurrentTokenSource());
                tokens.add(new ScannedToken(kindOf(type, image), new SyntaxToken(image, start, end), start, end + 1));
            }
        } catch (InvalidInputException e) {
            throw new ParseFailedException("invalid token at offset "
                + scanner.getCurrentTokenStartPosition() + ": " + e.getMessage(), e);
        }
        return tokens;
    }

    static String kindOf(int tokenType, String image) {
        if (tokenType == ITerminalSymbols.TokenNameIdentifier) {
            return IDENTIFIER;
        }
        char first = image.charAt(0);
        if (WORD_LITERALS.contains(image)
            || Character.isDigit(first) || first == '"' || first == '\''
            || (first == '.' && image.length() > 1 && Character.isDigit(image.charAt(1)))) {
            return LITERAL;
        }
        if (Character.isJavaIdentifierStart(first)) {
            return KEYWORD;
        }
        return SEPARATORS.contains(image) ? SEPARATOR : OPERATOR;
    }

    // --- Spans ---

    private static final class Span {
        final String name;
        final int start;
        final int end;
        final int order;
        final List<Span> children = new ArrayList<>();
        final List<ScannedToken> tokens = new ArrayList<>();

        Span(String name, int start, int end, int order) {
            this.name = name;
            this.start = start;
            this.end = end;
            this.order = order;
        }

        boolean contains(Span other) {
            return start <= other.start && other.end <= end;
        }
    }

    /**
     * Records one span per projected JDT node. Spans are opened parent first, so equal ranges
     * nest in visit order.
     */
    private static final class SpanCollector extends ASTVisitor {

        private final List<ScannedToken> tokens;
        private final List<Span> spans = new ArrayList<>();

        SpanCollector(List<ScannedToken> tokens) {
            this.tokens = tokens;
        }

        void open(String name, int start, int end) {
            if (end > start) {
                spans.add(new Span(name, start, end, spans.size()));
            }
        }

        void open(String name, ASTNode node) {
            open(name, node.getStartPosition(), node.getStartPosition() + node.getLength());
        }

        private static int endOf(ASTNode node) {
            return node.getStartPosition() + node.getLength();
        }

        /** First token with the given image starting at or after {@code offset}, or null. */
        private ScannedToken tokenAtOrAfter(String image, int offset) {
            int low = 0;
            int high = tokens.size();
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (tokens.get(mid).start() < offset) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            for (int i = low; i < tokens.size(); i++) {
                if (tokens.get(i).token().image().equals(image)) {
                    return tokens.get(i);
                }
            }
            return null;
        }

        @Override
        public boolean visit(PackageDeclaration node) {
            // annotations stay outside so the text starts with the keyword
            ScannedToken keyword = tokenAtOrAfter("package", node.getStartPosition());
            int start = keyword != null ? keyword.start() : node.getStartPosition();
            open("packageDeclaration", start, endOf(node));
            return false;
        }

        @Override
        public boolean visit(ImportDeclaration node) {
            open("importDeclaration", node);
            return false;
        }

        @Override
        public boolean visit(TypeDeclaration node) {
            open(node.isInterface() ? "normalInterfaceDeclaration" : "normalClassDeclaration", node);
            open("typeIdentifier", node.getName());
            if (!node.isInterface()) {
                int headerEnd = endOf(node.getName());
                for (Object typeParameter : node.typeParameters()) {
                    headerEnd = Math.max(headerEnd, endOf((ASTNode) typeParameter));
                }
                if (node.getSuperclassType() != null) {
                    headerEnd = Math.max(headerEnd, endOf(node.getSuperclassType()));
                }
                for (Object superInterface : node.superInterfaceTypes()) {
                    headerEnd = Math.max(headerEnd, endOf((ASTNode) superInterface));
                }
                ScannedToken brace = tokenAtOrAfter("{", headerEnd);
                if (brace != null) {
                    open("classBody", brace.start(), endOf(node));
                }
            }
            return true;
        }

        @Override
        public boolean visit(EnumDeclaration node) {
            open("enumDeclaration", node);
            open("typeIdentifier", node.getName());
            return true;
        }

        @Override
        public boolean visit(RecordDeclaration node) {
            open("recordDeclaration", node);
            open("typeIdentifier", node.getName());
            return true;
        }

        @Override
        public boolean visit(AnonymousClassDeclaration node) {
            open("classBody", node);
            return true;
        }

        @Override
        public boolean visit(FieldDeclaration node) {
            open("fieldDeclaration", node);
            open("unannType", node.getType());
            return true;
        }

        @Override
        public boolean visit(VariableDeclarationFragment node) {
            // locals and lambda parameters are not declarators of interest
            if (node.getParent() instanceof FieldDeclaration) {
                open("variableDeclarator", node);
                open("variableDeclaratorId", node.getName());
            }
            return true;
        }

        @Override
        public boolean visit(MethodDeclaration node) {
            open(methodNodeName(node), node);
            if (!node.isConstructor() && node.getReturnType2() != null) {
                open("result", node.getReturnType2());
            }

            int parametersEnd = endOf(node.getName());
            for (Object parameter : node.parameters()) {
                parametersEnd = Math.max(parametersEnd, endOf((ASTNode) parameter));
            }
            Type receiverType = node.getReceiverType();
            if (receiverType != null) {
                ScannedToken receiverThis = tokenAtOrAfter("this", endOf(receiverType));
                if (receiverThis != null) {
                    open("receiverParameter", receiverType.getStartPosition(), receiverThis.end());
                    parametersEnd = Math.max(parametersEnd, receiverThis.end());
                }
            }
            ScannedToken closingParen = tokenAtOrAfter(")", parametersEnd);
            if (closingParen != null) {
                open("methodDeclarator", node.getName().getStartPosition(), closingParen.end());
            }
            return true;
        }

        @Override
        public boolean visit(SingleVariableDeclaration node) {
            if (node.getParent() instanceof MethodDeclaration
                && ((MethodDeclaration) node.getParent()).parameters().contains(node)) {
                open(node.isVarargs() ? "lastFormalParameter" : "formalParameter", node);
            }
            return true;
        }

        @Override
        public boolean visit(Block node) {
            if (node.getLocationInParent() == MethodDeclaration.BODY_PROPERTY) {
                open("methodBody", node);
            }
            return true;
        }

        private static String methodNodeName(MethodDeclaration node) {
            if (node.isConstructor()) {
                return "constructorDeclaration";
            }
            ASTNode parent = node.getParent();
            if (parent instanceof TypeDeclaration && ((TypeDeclaration) parent).isInterface()) {
                return "interfaceMethodDeclaration";
            }
            return "methodDeclaration";
        }
    }

    // --- Assembly ---

    private static final Comparator<Span> NESTING_ORDER = Comparator
        .comparingInt((Span span) -> span.start)
        .thenComparing(Comparator.comparingInt((Span span) -> span.end).reversed())
        .thenComparingInt(span -> span.order);

    private static SyntaxNode assemble(List<Span> spans, List<ScannedToken> tokens) {
        Span root = spans.get(0);
        List<Span> sorted = new ArrayList<>(spans.subList(1, spans.size()));
        sorted.sort(NESTING_ORDER);

        Deque<Span> open = new ArrayDeque<>();
        open.push(root);
        for (Span span : sorted) {
            while (open.size() > 1 && !open.peek().contains(span)) {
                open.pop();
            }
            open.peek().children.add(span);
            open.push(span);
        }

        for (ScannedToken token : tokens) {
            deepestContaining(root, token.start()).tokens.add(token);
        }
        return toSyntaxNode(root);
    }

    private static Span deepestContaining(Span span, int offset) {
        Span current = span;
        while (true) {
            List<Span> children = current.children;
            int low = 0;
            int high = children.size() - 1;
            Span candidate = null;
            while (low <= high) {
                int mid = (low + high) >>> 1;
                if (children.get(mid).start <= offset) {
                    candidate = children.get(mid);
                    low = mid + 1;
                } else {
                    high = mid - 1;
                }
            }
            if (candidate == null || candidate.end <= offset) {
                return current;
            }
            current = candidate;
        }
    }

    private static SyntaxNode toSyntaxNode(Span span) {
        SyntaxNode.Builder builder = SyntaxNode.builder(span.name);
        int c = 0;
        int t = 0;
        while (c < span.children.size() || t < span.tokens.size()) {
            boolean takeChild = t >= span.tokens.size()
                || (c < span.children.size() && span.children.get(c).start < span.tokens.get(t).start());
            if (takeChild) {
                builder.add(toSyntaxNode(span.children.get(c++)));
            } else {
                ScannedToken token = span.tokens.get(t++);
                builder.add(token.kind(), token.token());
            }
        }
        return builder.build();
    }
}
