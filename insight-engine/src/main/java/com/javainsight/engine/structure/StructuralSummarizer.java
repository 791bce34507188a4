package com.javainsight.engine.structure;

import com.javainsight.engine.cst.CstTrees;
import com.javainsight.engine.cst.SyntaxElement;
import com.javainsight.engine.cst.SyntaxNode;
import com.javainsight.engine.cst.SyntaxToken;
import com.javainsight.engine.model.InsightModel.ClassSummary;
import com.javainsight.engine.model.InsightModel.FieldSummary;
import com.javainsight.engine.model.InsightModel.MethodDecl;
import com.javainsight.engine.model.InsightModel.MethodSummary;
import com.javainsight.engine.model.InsightModel.TextRange;
import com.javainsight.engine.model.Visibility;
import com.javainsight.engine.text.LineIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts the class name, package, fields and methods of a file from its concrete syntax tree.
 * Constructors are never summarized. A declaration missing an expected sub-node is skipped;
 * the rest of the file is still summarized.
 */
public class StructuralSummarizer {

    private static final String CLASS_DECLARATION = "normalClassDeclaration";
    private static final String CLASS_BODY = "classBody";
    private static final String TYPE_IDENTIFIER = "typeIdentifier";
    private static final String PACKAGE_DECLARATION = "packageDeclaration";
    private static final String FIELD_DECLARATION = "fieldDeclaration";
    private static final String VARIABLE_DECLARATOR_ID = "variableDeclaratorId";
    private static final String METHOD_DECLARATION = "methodDeclaration";
    private static final String METHOD_DECLARATOR = "methodDeclarator";
    private static final String METHOD_BODY = "methodBody";
    private static final String RESULT = "result";

    /** Tried in order; the first one present under a field declaration holds its type. */
    private static final List<String> FIELD_TYPE_NODES = List.of("unannType", "typeType", "type");

    /** Parameter shapes counted toward a method's arity. */
    private static final List<String> PARAMETER_NODES =
        List.of("formalParameter", "lastFormalParameter", "receiverParameter");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Pattern PACKAGE_KEYWORD = Pattern.compile("^package\\s+");
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Output of one summarization pass.
     *
     * @param classHeader text of the primary class declaration up to its body, or null without a class
     */
    public record StructuralSummary(
        ClassSummary summary,
        List<MethodDecl> methodDecls,
        String classHeader
    ) {}

    public StructuralSummary summarize(SyntaxNode root, String source, String fallbackClassName) {
        LineIndex lines = LineIndex.build(source);
        return summarize(root, source, lines, fallbackClassName);
    }

    public StructuralSummary summarize(SyntaxNode root, String source, LineIndex lines, String fallbackClassName) {
        List<FieldSummary> fields = new ArrayList<>();
        for (SyntaxNode fieldNode : CstTrees.findAllNodes(root, FIELD_DECLARATION)) {
            fields.addAll(extractFields(fieldNode, source, lines));
        }

        List<MethodDecl> methodDecls = new ArrayList<>();
        for (SyntaxNode methodNode : CstTrees.findAllNodes(root, METHOD_DECLARATION)) {
            MethodDecl decl = extractMethod(methodNode, source, lines);
            if (decl != null) {
                methodDecls.add(decl);
            }
        }

        List<String> classNames = extractClassNames(root);
        String className = classNames.isEmpty() ? fallbackClassName : classNames.get(0);
        List<String> innerClasses = new ArrayList<>();
        for (String name : classNames.subList(Math.min(1, classNames.size()), classNames.size())) {
            if (!name.equals(className)) {
                innerClasses.add(name);
            }
        }

        List<MethodSummary> methods = new ArrayList<>();
        for (MethodDecl decl : methodDecls) {
            methods.add(decl.toSummary());
        }

        ClassSummary summary = new ClassSummary(
            className, extractPackageName(root, source), fields, methods, innerClasses);
        return new StructuralSummary(summary, methodDecls, extractClassHeader(root, source));
    }

    // --- Modifiers ---

    static Visibility visibilityOf(List<SyntaxToken> tokens) {
        for (SyntaxToken token : CstTrees.sortedBySource(tokens)) {
            Visibility visibility = Visibility.fromModifier(token.image());
            if (visibility != null) {
                return visibility;
            }
        }
        return Visibility.PACKAGE;
    }

    static boolean isStatic(List<SyntaxToken> tokens) {
        for (SyntaxToken token : tokens) {
            if ("static".equals(token.image())) {
                return true;
            }
        }
        return false;
    }

    // --- Fields ---

    private List<FieldSummary> extractFields(SyntaxNode fieldNode, String source, LineIndex lines) {
        List<SyntaxToken> tokens = CstTrees.collectTokens(fieldNode);
        Visibility visibility = visibilityOf(tokens);
        boolean isStatic = isStatic(tokens);

        String type = "";
        for (String typeNodeName : FIELD_TYPE_NODES) {
            SyntaxNode typeNode = CstTrees.findFirstNode(fieldNode, typeNodeName);
            if (typeNode != null) {
                type = CstTrees.tokensToText(CstTrees.collectTokens(typeNode), source);
                break;
            }
        }

        List<SyntaxNode> declaratorIds = new ArrayList<>();
        collectOwnDeclaratorIds(fieldNode, declaratorIds);

        List<FieldSummary> result = new ArrayList<>();
        for (SyntaxNode declaratorId : declaratorIds) {
            List<SyntaxToken> idTokens = CstTrees.sortedBySource(CstTrees.collectTokens(declaratorId));
            if (idTokens.isEmpty()) {
                continue;
            }
            SyntaxToken nameToken = idTokens.get(0);
            result.add(new FieldSummary(
                nameToken.image(), type, visibility, isStatic, lines.offsetToLine(nameToken.startOffset())));
        }
        return result;
    }

    /**
     * Declarator ids of this field only. Fields declared inside an initializer (anonymous classes)
     * are summarized from their own declaration node.
     */
    private void collectOwnDeclaratorIds(SyntaxNode node, List<SyntaxNode> out) {
        for (List<SyntaxElement> slot : node.children().values()) {
            for (SyntaxElement element : slot) {
                if (!(element instanceof SyntaxNode)) continue;
                SyntaxNode child = (SyntaxNode) element;
                if (child.name().equals(FIELD_DECLARATION)) continue;
                if (child.name().equals(VARIABLE_DECLARATOR_ID)) {
                    out.add(child);
                } else {
                    collectOwnDeclaratorIds(child, out);
                }
            }
        }
    }

    // --- Methods ---

    private MethodDecl extractMethod(SyntaxNode methodNode, String source, LineIndex lines) {
        SyntaxNode declarator = CstTrees.findFirstNode(methodNode, METHOD_DECLARATOR);
        if (declarator == null) {
            return null;
        }

        List<SyntaxToken> declaratorTokens = CstTrees.sortedBySource(CstTrees.collectTokens(declarator));
        SyntaxToken nameToken = null;
        for (SyntaxToken token : declaratorTokens) {
            if (!"(".equals(token.image()) && IDENTIFIER.matcher(token.image()).matches()) {
                nameToken = token;
                break;
            }
        }
        if (nameToken == null) {
            return null;
        }

        List<SyntaxToken> tokens = CstTrees.collectTokens(methodNode);
        TextRange range = CstTrees.nodeRange(methodNode);
        if (range == null) {
            return null;
        }

        int paramsCount = 0;
        for (String parameterNode : PARAMETER_NODES) {
            paramsCount += CstTrees.findAllNodes(declarator, parameterNode).size();
        }

        SyntaxNode resultNode = CstTrees.findFirstNode(methodNode, RESULT);
        String resultText = resultNode != null
            ? CstTrees.tokensToText(CstTrees.collectTokens(resultNode), source)
            : "";
        String declaratorText = WHITESPACE_RUN.matcher(CstTrees.tokensToText(declaratorTokens, source)).replaceAll(" ");
        String signature = resultText.isEmpty()
            ? declaratorText
            : WHITESPACE_RUN.matcher(resultText).replaceAll(" ") + " " + declaratorText;

        Integer bodyStart = null;
        Integer bodyEnd = null;
        SyntaxNode bodyNode = CstTrees.findFirstNode(methodNode, METHOD_BODY);
        TextRange bodyRange = bodyNode != null ? CstTrees.nodeRange(bodyNode) : null;
        if (bodyRange != null) {
            bodyStart = bodyRange.startOffset();
            bodyEnd = bodyRange.endOffset();
        }

        return new MethodDecl(
            nameToken.image(),
            paramsCount,
            visibilityOf(tokens),
            isStatic(tokens),
            lines.offsetToLine(nameToken.startOffset()),
            signature,
            range.startOffset(),
            range.endOffset(),
            bodyStart,
            bodyEnd
        );
    }

    // --- Class and package ---

    private List<String> extractClassNames(SyntaxNode root) {
        List<String> names = new ArrayList<>();
        for (SyntaxNode classNode : CstTrees.findAllNodes(root, CLASS_DECLARATION)) {
            SyntaxNode identifier = CstTrees.findFirstNode(classNode, TYPE_IDENTIFIER);
            if (identifier == null) {
                continue;
            }
            for (SyntaxToken token : CstTrees.sortedBySource(CstTrees.collectTokens(identifier))) {
                if (IDENTIFIER.matcher(token.image()).matches() && !"class".equals(token.image())) {
                    names.add(token.image());
                    break;
                }
            }
        }
        return names;
    }

    private String extractPackageName(SyntaxNode root, String source) {
        SyntaxNode packageNode = CstTrees.findFirstNode(root, PACKAGE_DECLARATION);
        if (packageNode == null) {
            return "";
        }
        String text = CstTrees.tokensToText(CstTrees.collectTokens(packageNode), source);
        text = PACKAGE_KEYWORD.matcher(text).replaceFirst("");
        return TRAILING_SEMICOLON.matcher(text).replaceFirst("").trim();
    }

    private String extractClassHeader(SyntaxNode root, String source) {
        SyntaxNode classNode = CstTrees.findFirstNode(root, CLASS_DECLARATION);
        if (classNode == null) {
            return null;
        }
        List<SyntaxToken> headerTokens = new ArrayList<>();
        for (List<SyntaxElement> slot : classNode.children().values()) {
            for (SyntaxElement element : slot) {
                if (element instanceof SyntaxToken) {
                    headerTokens.add((SyntaxToken) element);
                } else if (element instanceof SyntaxNode && !((SyntaxNode) element).name().equals(CLASS_BODY)) {
                    CstTrees.collectTokens((SyntaxNode) element, headerTokens);
                }
            }
        }
        return CstTrees.tokensToText(headerTokens, source);
    }
}
