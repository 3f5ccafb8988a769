package com.treewright.parser;

import com.treewright.TreewrightLoggingConfig;
import com.treewright.ast.AstNode;
import com.treewright.ast.NodeKind;
import com.treewright.ast.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.treewright.parser.SyntaxFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class SyntaxFactoryTest extends TreewrightLoggingConfig {

    private static void assertPrintsAndReparses(String expected, AstNode built) {
        assertEquals(expected, SourcePrinter.print(built));
        AstNode reparsed = built instanceof Statement
            ? Parser.parseStatement(expected) : Parser.parseExpression(expected);
        assertTrue(reparsed.isStructurallyEqual(built), () -> "Reparsed text differs: " + expected);
    }

    @Test
    void testWhileWithBlock() {
        assertPrintsAndReparses("while (go) { step(); }",
            whileStatement(identifier("go"), block(expressionStatement(invocation(identifier("step"))))));
    }

    @Test
    void testIfElse() {
        assertPrintsAndReparses("if (a > 1) x = 1; else {}",
            ifStatement(binary(identifier("a"), ">", integerLiteral(1)),
                expressionStatement(assignment(identifier("x"), "=", integerLiteral(1))),
                block()));
        assertPrintsAndReparses("if (ok) return;", ifStatement(identifier("ok"), returnStatement(null), null));
    }

    @Test
    void testDoWhile() {
        assertPrintsAndReparses("do { i++; } while (i < 3);",
            doWhileStatement(block(expressionStatement(postfix(identifier("i"), "++"))),
                binary(identifier("i"), "<", integerLiteral(3))));
    }

    @Test
    void testLambdas() {
        assertPrintsAndReparses("x => x + 1", lambda(List.of("x"), binary(identifier("x"), "+", integerLiteral(1))));
        assertPrintsAndReparses("(a, b) => a", lambda(List.of("a", "b"), identifier("a")));
        assertPrintsAndReparses("() => { return true; }",
            lambda(List.of(), block(returnStatement(booleanLiteral(true)))));
    }

    @Test
    void testDeclarationsAndCalls() {
        assertPrintsAndReparses("var total = 0;", variableDeclaration("var", "total", integerLiteral(0)));
        assertPrintsAndReparses("return \"ok\";", returnStatement(stringLiteral("ok")));
        assertPrintsAndReparses("list.Add(1, 2)",
            invocation(memberReference(identifier("list"), "Add"), integerLiteral(1), integerLiteral(2)));
        assertPrintsAndReparses("!(a == null)",
            unary("!", parenthesized(binary(identifier("a"), "==", nullLiteral()))));
    }

    @Test
    void testBuiltNodesAreUnfrozenAndSynthesized() {
        AstNode statement = expressionStatement(identifier("x"));
        assertFalse(statement.isFrozen());
        assertTrue(statement.getFirstToken().getToken().isSynthesized());
        assertNull(statement.getSpan());
    }

    @Test
    void testCreateEmpty() {
        AstNode loop = createEmpty(NodeKind.WHILE_STATEMENT);
        assertEquals(NodeKind.WHILE_STATEMENT, loop.getKind());
        assertFalse(loop.hasChildren());
        assertThrows(IllegalArgumentException.class, () -> createEmpty(NodeKind.TOKEN));
        assertThrows(IllegalArgumentException.class, () -> createEmpty(NodeKind.REPEAT));
    }
}
