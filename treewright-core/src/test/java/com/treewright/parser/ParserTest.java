package com.treewright.parser;

import com.treewright.TreewrightLoggingConfig;
import com.treewright.ast.AssignmentExpression;
import com.treewright.ast.AstNode;
import com.treewright.ast.BinaryOperatorExpression;
import com.treewright.ast.BlockStatement;
import com.treewright.ast.CompilationUnit;
import com.treewright.ast.DoWhileStatement;
import com.treewright.ast.ErrorNode;
import com.treewright.ast.Expression;
import com.treewright.ast.ExpressionStatement;
import com.treewright.ast.IfElseStatement;
import com.treewright.ast.InvocationExpression;
import com.treewright.ast.LambdaExpression;
import com.treewright.ast.MemberReferenceExpression;
import com.treewright.ast.MethodDeclaration;
import com.treewright.ast.PostfixOperatorExpression;
import com.treewright.ast.PrimitiveExpression;
import com.treewright.ast.ReturnStatement;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.TypeDeclaration;
import com.treewright.ast.UnaryOperatorExpression;
import com.treewright.ast.VariableDeclarationStatement;
import com.treewright.ast.WhileStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest extends TreewrightLoggingConfig {

    private static final String SAMPLE = """
        // Sample
        #region tests
        public class Calculator {
            @Test
            private void Adds(int a, int b) {
                var sum = a + b * 2;   // precedence
                if (sum > 10) { Log(sum); } else Log(0);
                while (sum > 0) sum -= 1;
                do { sum++; } while(sum < 3);
                var f = (x, y) => x + y;
                items.Each(i => { Print(i); });
                return;
            }

            abstract int Count();
        }
        """;

    @Test
    void testRoundTripPreservesEveryCharacter() {
        SyntaxTree tree = Parser.parse(SAMPLE);
        assertFalse(tree.hasErrors(), () -> tree.getDiagnostics().toString());
        assertEquals(SAMPLE, tree.getText());
    }

    @Test
    void testDeclarationStructure() {
        SyntaxTree tree = Parser.parse(SAMPLE);
        CompilationUnit unit = (CompilationUnit) tree.getRoot();
        TypeDeclaration type = unit.getTypes().get(0);
        assertEquals("Calculator", type.getName());
        assertEquals(List.of("public"), type.getModifiers());

        List<MethodDeclaration> methods = type.getMethods();
        assertEquals(2, methods.size());
        MethodDeclaration adds = methods.get(0);
        assertEquals("Adds", adds.getName());
        assertEquals("Test", adds.getAttributes().get(0).getName());
        assertTrue(adds.hasModifier("private"));
        assertEquals("void", adds.getReturnType().getName());
        assertEquals(2, adds.getParameters().size());
        assertTrue(adds.hasBody());

        MethodDeclaration count = methods.get(1);
        assertFalse(count.hasBody());
    }

    @Test
    void testStatementKinds() {
        SyntaxTree tree = Parser.parse(SAMPLE);
        MethodDeclaration adds = ((CompilationUnit) tree.getRoot()).getTypes().get(0).getMethods().get(0);
        List<AstNode> statements = adds.getBody().getStatements();

        assertInstanceOf(VariableDeclarationStatement.class, statements.get(0));
        IfElseStatement ifElse = assertInstanceOf(IfElseStatement.class, statements.get(1));
        assertInstanceOf(BlockStatement.class, ifElse.getTrueStatement());
        assertInstanceOf(ExpressionStatement.class, ifElse.getFalseStatement());
        WhileStatement loop = assertInstanceOf(WhileStatement.class, statements.get(2));
        assertInstanceOf(AssignmentExpression.class, ((ExpressionStatement) loop.getEmbeddedStatement()).getExpression());
        assertInstanceOf(DoWhileStatement.class, statements.get(3));
        ReturnStatement ret = assertInstanceOf(ReturnStatement.class, statements.get(6));
        assertNull(ret.getExpression());
    }

    @Test
    void testBinaryPrecedence() {
        BinaryOperatorExpression sum = assertInstanceOf(BinaryOperatorExpression.class,
            Parser.parseExpression("a + b * c"));
        assertEquals("+", sum.getOperator());
        BinaryOperatorExpression product = assertInstanceOf(BinaryOperatorExpression.class, sum.getRight());
        assertEquals("*", product.getOperator());

        BinaryOperatorExpression difference = assertInstanceOf(BinaryOperatorExpression.class,
            Parser.parseExpression("a - b - c"));
        assertInstanceOf(BinaryOperatorExpression.class, difference.getLeft());

        BinaryOperatorExpression logical = assertInstanceOf(BinaryOperatorExpression.class,
            Parser.parseExpression("a < b && c == d || e"));
        assertEquals("||", logical.getOperator());
    }

    @Test
    void testAssignmentIsRightAssociative() {
        AssignmentExpression outer = assertInstanceOf(AssignmentExpression.class, Parser.parseExpression("a = b = c"));
        assertInstanceOf(AssignmentExpression.class, outer.getRight());
    }

    @Test
    void testPostfixCallsAndMemberAccess() {
        UnaryOperatorExpression not = assertInstanceOf(UnaryOperatorExpression.class,
            Parser.parseExpression("!list.Contains(x)"));
        InvocationExpression call = assertInstanceOf(InvocationExpression.class, not.getExpression());
        MemberReferenceExpression member = assertInstanceOf(MemberReferenceExpression.class, call.getTarget());
        assertEquals("Contains", member.getMemberName());
        assertEquals(1, call.getArguments().size());

        PostfixOperatorExpression increment = assertInstanceOf(PostfixOperatorExpression.class,
            Parser.parseExpression("counter++"));
        assertEquals("++", increment.getOperator());
    }

    @Test
    void testLambdaForms() {
        LambdaExpression single = assertInstanceOf(LambdaExpression.class, Parser.parseExpression("x => x + 1"));
        assertFalse(single.hasParentheses());
        assertFalse(single.hasBlockBody());
        assertEquals(1, single.getParameters().size());

        LambdaExpression pair = assertInstanceOf(LambdaExpression.class,
            Parser.parseExpression("(a, b) => { return a; }"));
        assertTrue(pair.hasParentheses());
        assertTrue(pair.hasBlockBody());
        assertEquals(2, pair.getParameters().size());

        LambdaExpression none = assertInstanceOf(LambdaExpression.class, Parser.parseExpression("() => 1"));
        assertTrue(none.getParameters().isEmpty());

        assertInstanceOf(BinaryOperatorExpression.class, Parser.parseExpression("(a) + b"));
    }

    @Test
    void testLiteralValues() {
        assertEquals(42L, ((PrimitiveExpression) Parser.parseExpression("42")).getValue());
        assertEquals("hi", ((PrimitiveExpression) Parser.parseExpression("\"hi\"")).getValue());
        assertEquals(Boolean.TRUE, ((PrimitiveExpression) Parser.parseExpression("true")).getValue());
        assertNull(((PrimitiveExpression) Parser.parseExpression("null")).getValue());
    }

    @Test
    void testStatementErrorIsRecovered() {
        String source = "class C { void M() { x = ; y(); } }";
        SyntaxTree tree = Parser.parse(source);

        assertEquals(1, tree.getDiagnostics().size());
        assertEquals(source, tree.getText());
        MethodDeclaration method = ((CompilationUnit) tree.getRoot()).getTypes().get(0).getMethods().get(0);
        List<AstNode> statements = method.getBody().getStatements();
        assertEquals(2, statements.size());
        ErrorNode error = assertInstanceOf(ErrorNode.class, statements.get(0));
        assertEquals(3, error.getErrorTokens().size());
        assertInstanceOf(ExpressionStatement.class, statements.get(1));
    }

    @Test
    void testMemberErrorIsRecovered() {
        String source = "class C { 42; void M() {} }";
        SyntaxTree tree = Parser.parse(source);

        assertTrue(tree.hasErrors());
        assertEquals(source, tree.getText());
        TypeDeclaration type = ((CompilationUnit) tree.getRoot()).getTypes().get(0);
        assertInstanceOf(ErrorNode.class, type.getMembers().get(0));
        assertEquals("M", type.getMethods().get(0).getName());
    }

    @Test
    void testUnbalancedInputStillRoundTrips() {
        String source = "class C { void M() { if (x { y(); }\n";
        SyntaxTree tree = Parser.parse(source);
        assertTrue(tree.hasErrors());
        assertEquals(source, tree.getText());
    }

    @Test
    void testFragmentParsing() {
        Expression expression = Parser.parseExpression("f(1, 2)");
        assertFalse(expression.isFrozen());
        assertInstanceOf(ExpressionStatement.class, Parser.parseStatement("x = 1;"));
        assertThrows(IllegalArgumentException.class, () -> Parser.parseExpression("a +"));
        assertThrows(IllegalArgumentException.class, () -> Parser.parseExpression("a b"));
        assertThrows(IllegalArgumentException.class, () -> Parser.parseStatement("x = ;"));
    }
}
