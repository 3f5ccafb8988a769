package com.treewright.refactoring;

import com.treewright.ast.AstNode;
import com.treewright.ast.Attachment;
import com.treewright.ast.Attribute;
import com.treewright.ast.BlockStatement;
import com.treewright.ast.MethodDeclaration;
import com.treewright.ast.Roles;
import com.treewright.ast.SimpleType;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.TokenKind;
import com.treewright.ast.TokenNode;
import com.treewright.ast.Trivia;
import com.treewright.parser.SyntaxFactory;
import com.treewright.rewrite.Edit;
import com.treewright.rewrite.RewriteOptions;
import com.treewright.semantics.Symbol;
import com.treewright.semantics.SymbolResolver;
import com.treewright.visitor.DepthFirstAstVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reports test methods that a test runner would not discover because they are not public, and
 * offers to make them public.
 *
 * <p>A method counts as a test when one of its attributes is named in
 * {@link RewriteOptions#testAttributeNames()}, either directly, with an {@code Attribute} suffix,
 * or through the qualified name the {@link SymbolResolver} reports. Static and override methods
 * are left alone.</p>
 */
public final class NonPublicTestMethodAnalyzer implements DiagnosticAnalyzer {

    private static final Logger LOG = Logger.getLogger(NonPublicTestMethodAnalyzer.class.getName());

    public static final String ID = "NonPublicTestMethod";
    public static final String MESSAGE = "Test methods should be public";
    public static final String FIX_TITLE = "Make method public";

    private static final Set<String> REMOVED_MODIFIERS = Set.of("private", "protected", "internal");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public List<Diagnostic> analyze(RefactoringContext context) {
        SyntaxTree tree = context.getTree();
        List<MethodDeclaration> methods = new ArrayList<>();
        tree.getRoot().acceptVisitor(new MethodCollector(context), methods);

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (MethodDeclaration method : methods) {
            if (!isTestMethod(method, context) || method.hasModifier("public") || method.hasModifier("static")
                || method.hasModifier("override")) {
                continue;
            }
            TokenNode name = method.getNameToken();
            Edit fix = makePublic(tree, method);
            CodeAction action = new CodeAction(FIX_TITLE, tree, List.of(fix), context.newEditor());
            diagnostics.add(new Diagnostic(ID, MESSAGE, DiagnosticSeverity.INFO,
                name != null ? name.getSpan() : method.getSpan(), tree.pathOf(method), List.of(action)));
        }
        LOG.fine(() -> "Checked " + methods.size() + " method(s), " + diagnostics.size() + " not public");
        return diagnostics;
    }

    private static boolean isTestMethod(MethodDeclaration method, RefactoringContext context) {
        RewriteOptions options = context.getOptions();
        for (Attribute attribute : method.getAttributes()) {
            String name = attribute.getName();
            if (options.isTestAttribute(name)) {
                return true;
            }
            if (name != null && name.endsWith("Attribute")
                && options.isTestAttribute(name.substring(0, name.length() - "Attribute".length()))) {
                return true;
            }
            Symbol symbol = context.getResolver().resolve(attribute);
            if (symbol != null && options.isTestAttribute(symbol.getQualifiedName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops private, protected and internal, and puts {@code public} first among the modifiers.
     * The new keyword takes over the leading trivia of the first dropped modifier or, when there
     * is none, of the return type.
     */
    private static Edit makePublic(SyntaxTree tree, MethodDeclaration method) {
        List<TokenNode> kept = new ArrayList<>();
        TokenNode firstRemoved = null;
        for (TokenNode modifier : method.getModifierTokens()) {
            if (REMOVED_MODIFIERS.contains(modifier.getText())) {
                if (firstRemoved == null) {
                    firstRemoved = modifier;
                }
            } else {
                kept.add(modifier);
            }
        }
        AstNode returnType = method.getChildByRole(Roles.TYPE);
        List<Trivia> leading;
        if (firstRemoved != null) {
            leading = firstRemoved.getToken().leadingTrivia();
        } else if (returnType != null && returnType.getFirstToken() != null) {
            leading = returnType.getFirstToken().getToken().leadingTrivia();
        } else {
            leading = List.of();
        }

        MethodDeclaration result = new MethodDeclaration();
        for (Attachment attachment : method.getAttachments()) {
            if (attachment.role() == Roles.MODIFIER) {
                continue;
            }
            AstNode child = attachment.node();
            if (attachment.role() == Roles.TYPE && child instanceof SimpleType type && firstRemoved == null) {
                child = withoutLeadingTrivia(type);
            }
            result.addChild(attachment.role(), child);
        }
        result.addChild(Roles.MODIFIER, SyntaxFactory.token(TokenKind.KEYWORD, "public",
            leading, List.of(Trivia.space())));
        for (TokenNode modifier : kept) {
            result.addChild(Roles.MODIFIER, modifier);
        }

        TokenNode first = result.getFirstToken();
        TokenNode last = result.getLastToken();
        return Edit.replace(tree.pathOf(method), result)
            .withLeadingTrivia(first.getToken().leadingTrivia())
            .withTrailingTrivia(last.getToken().trailingTrivia());
    }

    private static SimpleType withoutLeadingTrivia(SimpleType type) {
        SimpleType copy = new SimpleType();
        TokenNode token = type.getFirstToken();
        copy.addChild(Roles.IDENTIFIER, token.withToken(token.getToken().withLeadingTrivia(List.of())));
        return copy;
    }

    /**
     * Collects method declarations without descending into method bodies.
     */
    private static final class MethodCollector extends DepthFirstAstVisitor<List<MethodDeclaration>, Void> {

        MethodCollector(RefactoringContext context) {
            super(null, (a, b) -> null, context.getCancellation());
        }

        @Override
        public Void visitMethodDeclaration(MethodDeclaration methodDeclaration, List<MethodDeclaration> methods) {
            methods.add(methodDeclaration);
            return visitChildren(methodDeclaration, methods);
        }

        @Override
        public Void visitBlockStatement(BlockStatement blockStatement, List<MethodDeclaration> methods) {
            return null;
        }
    }
}
