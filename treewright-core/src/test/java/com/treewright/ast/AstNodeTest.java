package com.treewright.ast;

import com.treewright.TreewrightLoggingConfig;
import com.treewright.parser.Parser;
import com.treewright.parser.SourcePrinter;
import com.treewright.parser.SyntaxFactory;
import com.treewright.pattern.Repeat;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstNodeTest extends TreewrightLoggingConfig {

    @Test
    void testSingleRoleAccess() {
        WhileStatement loop = new WhileStatement();
        IdentifierExpression condition = SyntaxFactory.identifier("running");
        loop.setCondition(condition);

        assertSame(condition, loop.getChildByRole(Roles.CONDITION));
        assertSame(condition, loop.getCondition());
        assertEquals(List.of(condition), loop.getChildrenByRole(Roles.CONDITION));
        assertSame(Roles.CONDITION, loop.getRoleOf(condition));

        loop.setCondition(null);
        assertNull(loop.getCondition());
        assertTrue(loop.getChildrenByRole(Roles.CONDITION).isEmpty());
    }

    @Test
    void testSingularGetterOnManyRoleFails() {
        BlockStatement block = SyntaxFactory.block();
        assertThrows(CardinalityException.class, () -> block.getChildByRole(Roles.STATEMENT));
        assertThrows(CardinalityException.class,
            () -> block.setChildByRole(Roles.STATEMENT, SyntaxFactory.expressionStatement(SyntaxFactory.identifier("x"))));
    }

    @Test
    void testPluralSetterOnSingleRoleFails() {
        WhileStatement loop = new WhileStatement();
        assertThrows(CardinalityException.class,
            () -> loop.setChildrenByRole(Roles.CONDITION, List.of(SyntaxFactory.identifier("x"))));
        assertTrue(loop.getAttachments().isEmpty());
    }

    @Test
    void testSettingSingleRoleTwiceKeepsOnlyTheSecondChild() {
        WhileStatement loop = new WhileStatement();
        IdentifierExpression first = SyntaxFactory.identifier("first");
        IdentifierExpression second = SyntaxFactory.identifier("second");
        loop.setCondition(first);
        loop.setCondition(second);

        assertEquals(List.of(second), loop.getChildrenByRole(Roles.CONDITION));
        assertEquals(1, loop.getAttachments().size());

        // the replaced child is detached and may be used elsewhere
        WhileStatement other = new WhileStatement();
        other.setCondition(first);
        assertSame(first, other.getCondition());
    }

    @Test
    void testUndeclaredRoleIsRejected() {
        BlockStatement block = new BlockStatement();
        InvalidRoleException e = assertThrows(InvalidRoleException.class,
            () -> block.setChildByRole(Roles.CONDITION, SyntaxFactory.identifier("x")));
        assertSame(Roles.CONDITION, e.getRole());
        assertEquals(NodeKind.BLOCK_STATEMENT, e.getKind());
    }

    @Test
    void testCategoryMismatchIsRejected() {
        WhileStatement loop = new WhileStatement();
        assertThrows(InvalidRoleException.class, () -> loop.setChildByRole(Roles.CONDITION, SyntaxFactory.block()));
        assertTrue(loop.getAttachments().isEmpty());
    }

    @Test
    void testRepeatUnderSingleRoleIsRejected() {
        WhileStatement loop = new WhileStatement();
        assertThrows(CardinalityException.class, () -> loop.setChildByRole(Roles.CONDITION, new Repeat("xs")));
    }

    @Test
    void testChildrenAreKeptInCanonicalOrder() {
        WhileStatement loop = new WhileStatement();
        loop.setEmbeddedStatement(SyntaxFactory.block());
        loop.setCondition(SyntaxFactory.identifier("running"));
        loop.addChild(Roles.WHILE_KEYWORD, SyntaxFactory.keyword("while"));

        List<Role> roles = new ArrayList<>();
        for (Attachment attachment : loop.getAttachments()) {
            roles.add(attachment.role());
        }
        assertEquals(List.of(Roles.WHILE_KEYWORD, Roles.CONDITION, Roles.EMBEDDED_STATEMENT), roles);
    }

    @Test
    void testNodeCannotHaveTwoParents() {
        IdentifierExpression shared = SyntaxFactory.identifier("x");
        WhileStatement first = new WhileStatement();
        first.setCondition(shared);
        WhileStatement second = new WhileStatement();
        assertThrows(IllegalArgumentException.class, () -> second.setCondition(shared));

        first.removeChild(shared);
        second.setCondition(shared);
        assertSame(shared, second.getCondition());
    }

    @Test
    void testSettingManyRoleRegeneratesSeparators() {
        InvocationExpression call = SyntaxFactory.invocation(SyntaxFactory.identifier("f"),
            SyntaxFactory.identifier("a"), SyntaxFactory.identifier("b"), SyntaxFactory.identifier("c"));
        assertEquals("f(a, b, c)", SourcePrinter.print(call));
        assertEquals(3, call.getArguments().size());

        call.setArguments(List.of(SyntaxFactory.identifier("x")));
        assertEquals("f(x)", SourcePrinter.print(call));
        assertTrue(call.getChildrenByRole(Roles.COMMA).isEmpty());
    }

    @Test
    void testFrozenNodeCannotBeModified() {
        SyntaxTree tree = Parser.parse("class C { void M() { x = 1; } }");
        CompilationUnit unit = (CompilationUnit) tree.getRoot();
        assertTrue(unit.isFrozen());
        assertThrows(IllegalStateException.class, () -> unit.addMember(new TypeDeclaration()));
    }

    @Test
    void testCloneIsUnfrozenAndStructurallyEqual() {
        SyntaxTree tree = Parser.parse("class C { void M() { f(a, b); } }");
        AstNode copy = tree.getRoot().cloneSubtree();

        assertFalse(copy.isFrozen());
        assertNotSame(tree.getRoot(), copy);
        assertTrue(copy.isStructurallyEqual(tree.getRoot()));
        assertEquals(tree.getText(), SourcePrinter.print(copy));
    }

    @Test
    void testMutatingCloneLeavesOriginalUnchanged() {
        InvocationExpression call = (InvocationExpression) Parser.parseExpression("f(a, b)");
        call.freeze();
        InvocationExpression copy = (InvocationExpression) call.cloneSubtree();

        copy.setTarget(SyntaxFactory.identifier("g"));
        copy.setArguments(List.of(SyntaxFactory.identifier("x")));

        assertEquals("g(x)", SourcePrinter.print(copy));
        assertEquals("f(a, b)", SourcePrinter.print(call));
        assertEquals(2, call.getArguments().size());
        assertFalse(copy.isStructurallyEqual(call));
    }

    @Test
    void testPersistentReplaceSharesUntouchedChildren() {
        InvocationExpression call = (InvocationExpression) Parser.parseExpression("f(a, b)");
        call.freeze();
        IdentifierExpression replacement = SyntaxFactory.identifier("z");
        replacement.freeze();

        AstNode updated = call.withAttachmentReplaced(2, replacement);

        assertEquals("f(a, b)", SourcePrinter.print(call));
        assertEquals("f(z, b)", SourcePrinter.print(updated));
        assertSame(call.getAttachments().get(0).node(), updated.getAttachments().get(0).node());
        assertSame(call.getAttachments().get(4).node(), updated.getAttachments().get(4).node());
    }

    @Test
    void testPersistentRemoveDropsAdjacentSeparator() {
        InvocationExpression call = (InvocationExpression) Parser.parseExpression("f(a, b)");
        call.freeze();

        assertEquals("f(a)", SourcePrinter.print(call.withAttachmentRemoved(4)));
        assertEquals("f(b)", SourcePrinter.print(call.withAttachmentRemoved(2)));
    }

    @Test
    void testPersistentUpdateRequiresFrozenNode() {
        InvocationExpression call = (InvocationExpression) Parser.parseExpression("f(a)");
        assertThrows(IllegalStateException.class, () -> call.withAttachmentRemoved(2));
    }

    @Test
    void testStructuralEqualityIgnoresTrivia() {
        Expression compact = Parser.parseExpression("a+b*c");
        Expression spaced = Parser.parseExpression("a + b * c /* note */");
        Expression different = Parser.parseExpression("a + b * d");

        assertTrue(compact.isStructurallyEqual(spaced));
        assertEquals(compact.structuralHashCode(), spaced.structuralHashCode());
        assertFalse(compact.isStructurallyEqual(different));
        assertNotEquals(compact, spaced);
    }

    @Test
    void testSpanCoversLexedTokensOnly() {
        SyntaxTree tree = Parser.parse("class C {\n  void M() { run(); }\n}\n");
        TypeDeclaration type = ((CompilationUnit) tree.getRoot()).getTypes().get(0);
        assertEquals(new TextSpan(0, tree.getText().length() - 1), type.getSpan());
        assertNull(SyntaxFactory.identifier("x").getSpan());
    }
}
