package com.treewright.rewrite;

import com.treewright.TreewrightLoggingConfig;
import com.treewright.ast.AstNode;
import com.treewright.ast.CompilationUnit;
import com.treewright.ast.ExpressionStatement;
import com.treewright.ast.InvocationExpression;
import com.treewright.ast.MethodDeclaration;
import com.treewright.ast.NodePath;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.Trivia;
import com.treewright.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeEditorTest extends TreewrightLoggingConfig {

    private static final String SOURCE = """
        class C {
          void M() {
            a = 1; // one
            b = 2;
            c = 3;
          }
        }
        """;

    private SyntaxTree tree;
    private TreeEditor editor;

    @BeforeEach
    void setUp() {
        tree = Parser.parse(SOURCE);
        editor = new TreeEditor();
    }

    private static MethodDeclaration method(SyntaxTree tree) {
        return ((CompilationUnit) tree.getRoot()).getTypes().get(0).getMethods().get(0);
    }

    private static AstNode statement(SyntaxTree tree, int index) {
        return method(tree).getBody().getStatements().get(index);
    }

    private static String withLines(String a, String b, String c) {
        return "class C {\n  void M() {\n" + a + b + c + "  }\n}\n";
    }

    @Test
    void testReplaceKeepsSurroundingTrivia() {
        SyntaxTree result = editor.apply(tree, Edit.replace(tree, statement(tree, 1), Parser.parseStatement("b = 20;")));
        assertEquals(withLines("    a = 1; // one\n", "    b = 20;\n", "    c = 3;\n"), result.getText());
    }

    @Test
    void testInputTreeIsUnchangedAndUntouchedSubtreesAreShared() {
        AstNode first = statement(tree, 0);
        AstNode returnType = method(tree).getReturnType();

        SyntaxTree result = editor.apply(tree, Edit.replace(tree, statement(tree, 1), Parser.parseStatement("b = 20;")));

        assertEquals(SOURCE, tree.getText());
        assertSame(first, statement(result, 0));
        assertSame(returnType, method(result).getReturnType());
        assertNotSame(method(tree), method(result));
        assertTrue(result.getRoot().isFrozen());
    }

    @Test
    void testBatchIsOrderIndependent() {
        Edit replaceFirst = Edit.replace(tree, statement(tree, 0), Parser.parseStatement("x();"));
        Edit removeLast = Edit.remove(tree, statement(tree, 2));

        SyntaxTree forward = editor.applyEdits(tree, List.of(replaceFirst, removeLast));
        SyntaxTree backward = editor.applyEdits(tree, List.of(removeLast, replaceFirst));

        String expected = withLines("    x(); // one\n", "    b = 2;\n", "");
        assertEquals(expected, forward.getText());
        assertEquals(expected, backward.getText());
        assertTrue(forward.getRoot().isStructurallyEqual(backward.getRoot()));
    }

    @Test
    void testEmptyBatchReturnsSameTree() {
        assertSame(tree, editor.applyEdits(tree, List.of()));
    }

    @Test
    void testSameTargetConflicts() {
        NodePath path = tree.pathOf(statement(tree, 1));
        ConflictingEditException e = assertThrows(ConflictingEditException.class, () -> editor.applyEdits(tree,
            List.of(Edit.replace(path, Parser.parseStatement("x();")), Edit.remove(path))));
        assertNotNull(e.getFirst());
        assertNotNull(e.getSecond());
        assertEquals(SOURCE, tree.getText());
    }

    @Test
    void testNestedTargetsConflict() {
        Edit outer = Edit.replace(tree, method(tree).getBody(), Parser.parseStatement("{ }"));
        Edit inner = Edit.remove(tree, statement(tree, 0));
        assertThrows(ConflictingEditException.class, () -> editor.applyEdits(tree, List.of(inner, outer)));
        assertEquals(SOURCE, tree.getText());
    }

    @Test
    void testEditAgainstChangedTreeIsStale() {
        Edit removeLast = Edit.remove(tree, statement(tree, 2));
        SyntaxTree changed = editor.apply(tree, removeLast);

        StaleEditException e = assertThrows(StaleEditException.class,
            () -> editor.apply(changed, Edit.replace(removeLast.getTarget(), Parser.parseStatement("d();"))));
        assertEquals(removeLast.getTarget(), e.getEdit().getTarget());
    }

    @Test
    void testPrecondition() {
        AstNode first = statement(tree, 0);
        Edit matching = Edit.replace(tree, first, Parser.parseStatement("x();")).when(Parser.parseStatement("a = 1;"));
        assertEquals(withLines("    x(); // one\n", "    b = 2;\n", "    c = 3;\n"), editor.apply(tree, matching).getText());

        Edit outdated = Edit.replace(tree, first, Parser.parseStatement("x();")).when(Parser.parseStatement("a = 2;"));
        assertThrows(StaleEditException.class, () -> editor.apply(tree, outdated));
    }

    @Test
    void testRemovingListElementDropsOneSeparator() {
        SyntaxTree calls = Parser.parse("class C { void M() { f(a, b, c); } }");
        ExpressionStatement statement = (ExpressionStatement) method(calls).getBody().getStatements().get(0);
        InvocationExpression invocation = (InvocationExpression) statement.getExpression();

        SyntaxTree middle = editor.apply(calls, Edit.remove(calls, invocation.getArguments().get(1)));
        assertEquals("class C { void M() { f(a, c); } }", middle.getText());

        SyntaxTree last = editor.apply(calls, Edit.remove(calls, invocation.getArguments().get(2)));
        assertEquals("class C { void M() { f(a, b); } }", last.getText());
    }

    @Test
    void testReplacementAliasingTheTreeIsCloned() {
        AstNode first = statement(tree, 0);
        SyntaxTree result = editor.apply(tree, Edit.replace(tree, statement(tree, 2), first));

        assertEquals(withLines("    a = 1; // one\n", "    b = 2;\n", "    a = 1;\n"), result.getText());
        assertSame(first, statement(result, 0));
        assertNotSame(first, statement(result, 2));
    }

    @Test
    void testSwappingTwoStatementsNeedsNoClone() {
        AstNode first = statement(tree, 0);
        AstNode last = statement(tree, 2);
        SyntaxTree result = editor.applyEdits(tree, List.of(
            Edit.replace(tree, first, last),
            Edit.replace(tree, last, first)));

        assertEquals(withLines("    c = 3; // one\n", "    b = 2;\n", "    a = 1;\n"), result.getText());
    }

    @Test
    void testTriviaPrecedenceModes() {
        AstNode target = statement(tree, 1);
        AstNode replacement = Parser.parseStatement("/* new */ b = 20; // mine");

        TreeEditor removedWins = new TreeEditor(RewriteOptions.defaults());
        assertEquals(withLines("    a = 1; // one\n", "    b = 20;\n", "    c = 3;\n"),
            removedWins.apply(tree, Edit.replace(tree, target, replacement)).getText());

        TreeEditor merge = new TreeEditor(RewriteOptions.defaults().withTriviaPrecedence(TriviaPrecedence.MERGE));
        assertEquals(withLines("    a = 1; // one\n", "    /* new */ b = 20; // mine\n", "    c = 3;\n"),
            merge.apply(tree, Edit.replace(tree, target, replacement)).getText());

        TreeEditor replacementWins = new TreeEditor(
            RewriteOptions.defaults().withTriviaPrecedence(TriviaPrecedence.REPLACEMENT));
        assertEquals(withLines("    a = 1; // one\n", "/* new */ b = 20; // mine", "    c = 3;\n"),
            replacementWins.apply(tree, Edit.replace(tree, target, replacement)).getText());
    }

    @Test
    void testTrailingTriviaInheritanceCanBeDisabled() {
        TreeEditor noTrailing = new TreeEditor(RewriteOptions.defaults().withInheritTrailingTrivia(false));
        SyntaxTree result = noTrailing.apply(tree, Edit.replace(tree, statement(tree, 1), Parser.parseStatement("b = 20;")));
        assertEquals(withLines("    a = 1; // one\n", "    b = 20;", "    c = 3;\n"), result.getText());
    }

    @Test
    void testExplicitEditTriviaOverridesPolicy() {
        Edit edit = Edit.replace(tree, statement(tree, 1), Parser.parseStatement("b = 20;"))
            .withLeadingTrivia(List.of(Trivia.whitespace("      ")))
            .withTrailingTrivia(List.of(Trivia.space(), Trivia.comment("// moved"), Trivia.endOfLine()));
        assertEquals(withLines("    a = 1; // one\n", "      b = 20; // moved\n", "    c = 3;\n"),
            editor.apply(tree, edit).getText());
    }

    @Test
    void testEditValidation() {
        assertThrows(IllegalArgumentException.class, () -> Edit.remove(NodePath.ROOT));
        Edit removal = Edit.remove(tree, statement(tree, 0));
        assertTrue(removal.isRemoval());
        assertThrows(IllegalStateException.class, () -> removal.withLeadingTrivia(List.of()));
    }

    @Test
    void testRewrittenTreeAcceptsAnotherBatch() {
        SyntaxTree first = editor.applyEdits(tree, List.of(
            Edit.replace(tree, statement(tree, 0), Parser.parseStatement("x();")),
            Edit.replace(tree, statement(tree, 2), Parser.parseStatement("y();"))));

        SyntaxTree second = editor.applyEdits(first, List.of(
            Edit.replace(first, statement(first, 0), Parser.parseStatement("p();")),
            Edit.replace(first, statement(first, 2), Parser.parseStatement("q();"))));

        assertEquals(withLines("    x(); // one\n", "    b = 2;\n", "    y();\n"), first.getText());
        assertEquals(withLines("    p(); // one\n", "    b = 2;\n", "    q();\n"), second.getText());
    }

    @Test
    void testDiagnosticsInsideReplacedNodesAreDropped() {
        SyntaxTree broken = Parser.parse("class C { void M() { x = ; y(); } }");
        assertEquals(1, broken.getDiagnostics().size());

        SyntaxTree fixed = editor.apply(broken, Edit.replace(broken, statement(broken, 0), Parser.parseStatement("z();")));
        assertEquals("class C { void M() { z(); y(); } }", fixed.getText());
        assertFalse(fixed.hasErrors());

        SyntaxTree stillBroken = editor.apply(broken, Edit.replace(broken, statement(broken, 1), Parser.parseStatement("z();")));
        assertEquals(broken.getDiagnostics(), stillBroken.getDiagnostics());
    }
}
