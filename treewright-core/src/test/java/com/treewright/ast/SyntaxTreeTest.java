package com.treewright.ast;

import com.treewright.TreewrightLoggingConfig;
import com.treewright.parser.Parser;
import com.treewright.parser.SyntaxFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxTreeTest extends TreewrightLoggingConfig {

    private static final String SOURCE = "class C {\n  void M() {\n    while (go) { step(); }\n  }\n}\n";

    @Test
    void testParentLookupAndAncestors() {
        SyntaxTree tree = Parser.parse(SOURCE);
        TokenNode step = tree.findTokenAt(SOURCE.indexOf("step"));
        assertEquals("step", step.getText());

        AstNode identifier = tree.getParent(step);
        assertInstanceOf(IdentifierExpression.class, identifier);
        assertInstanceOf(InvocationExpression.class, tree.getParent(identifier));
        assertNull(tree.getParent(tree.getRoot()));

        List<AstNode> ancestors = tree.ancestors(step);
        assertSame(tree.getRoot(), ancestors.get(ancestors.size() - 1));
        assertNotNull(tree.findEnclosing(step, WhileStatement.class));
        assertNotNull(tree.findEnclosing(step, MethodDeclaration.class));
        assertNull(tree.findEnclosing(step, DoWhileStatement.class));
    }

    @Test
    void testPathRoundTrip() {
        SyntaxTree tree = Parser.parse(SOURCE);
        WhileStatement loop = tree.findEnclosing(tree.findTokenAt(SOURCE.indexOf("go")), WhileStatement.class);

        NodePath path = tree.pathOf(loop);
        assertSame(loop, tree.nodeAt(path));
        assertEquals(4, path.depth());
        assertSame(Roles.STATEMENT, path.lastStep().role());
        assertSame(tree.getRoot(), tree.nodeAt(NodePath.ROOT));
        assertTrue(path.toString().startsWith("/Member[0]/"));
    }

    @Test
    void testPathOfForeignNodeFails() {
        SyntaxTree tree = Parser.parse(SOURCE);
        assertThrows(IllegalArgumentException.class, () -> tree.pathOf(SyntaxFactory.identifier("x")));
    }

    @Test
    void testStalePathResolvesToNull() {
        SyntaxTree tree = Parser.parse(SOURCE);
        NodePath missing = NodePath.ROOT.child(Roles.MEMBER, 7);
        NodePath wrongRole = NodePath.ROOT.child(Roles.STATEMENT, 0);
        assertNull(tree.nodeAt(missing));
        assertNull(tree.nodeAt(wrongRole));
    }

    @Test
    void testPathsSortInDocumentOrder() {
        SyntaxTree tree = Parser.parse("class C { void M() { a(); b(); } void N() { c(); } }");
        List<NodePath> paths = new ArrayList<>();
        for (TokenNode token : tree.getRoot().getTokens()) {
            paths.add(tree.pathOf(token));
        }
        List<NodePath> shuffled = new ArrayList<>(paths);
        Collections.reverse(shuffled);
        shuffled.sort(null);
        assertEquals(paths, shuffled);

        NodePath type = paths.get(0).parent();
        assertTrue(NodePath.ROOT.isAncestorOf(type));
        assertTrue(type.isAncestorOf(paths.get(0)));
        assertFalse(type.isAncestorOf(type));
        assertTrue(NodePath.ROOT.compareTo(type) < 0);
    }

    @Test
    void testFindTokenAtPrefersTokenUnderCaret() {
        SyntaxTree tree = Parser.parse("class C { }");
        assertEquals("class", tree.findTokenAt(0).getText());
        assertEquals("C", tree.findTokenAt(6).getText());
        // Right after "C", before the space
        assertEquals("C", tree.findTokenAt(7).getText());
        assertNull(tree.findTokenAt(100));
    }

    @Test
    void testSharedSubtreeIsRejected() {
        BlockStatement block = SyntaxFactory.block();
        ExpressionStatement statement = SyntaxFactory.expressionStatement(SyntaxFactory.identifier("x"));
        statement.freeze();
        block.addStatement(statement);
        block.addStatement(statement);
        assertThrows(IllegalStateException.class, () -> new SyntaxTree(block));
    }

    @Test
    void testDiagnosticsAreKept() {
        SyntaxTree tree = Parser.parse("class C { void M() { x = ; } }");
        assertTrue(tree.hasErrors());
        assertFalse(tree.getDiagnostics().isEmpty());
    }
}
