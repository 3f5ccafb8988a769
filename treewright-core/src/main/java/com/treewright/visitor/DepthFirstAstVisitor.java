package com.treewright.visitor;

import com.treewright.ast.AssignmentExpression;
import com.treewright.ast.AstNode;
import com.treewright.ast.Attribute;
import com.treewright.ast.BinaryOperatorExpression;
import com.treewright.ast.BlockStatement;
import com.treewright.ast.CompilationUnit;
import com.treewright.ast.DoWhileStatement;
import com.treewright.ast.ErrorNode;
import com.treewright.ast.ExpressionStatement;
import com.treewright.ast.IdentifierExpression;
import com.treewright.ast.IfElseStatement;
import com.treewright.ast.InvocationExpression;
import com.treewright.ast.LambdaExpression;
import com.treewright.ast.MemberReferenceExpression;
import com.treewright.ast.MethodDeclaration;
import com.treewright.ast.ParameterDeclaration;
import com.treewright.ast.ParenthesizedExpression;
import com.treewright.ast.PostfixOperatorExpression;
import com.treewright.ast.PrimitiveExpression;
import com.treewright.ast.ReturnStatement;
import com.treewright.ast.SimpleType;
import com.treewright.ast.TokenNode;
import com.treewright.ast.TypeDeclaration;
import com.treewright.ast.UnaryOperatorExpression;
import com.treewright.ast.VariableDeclarationStatement;
import com.treewright.ast.WhileStatement;
import com.treewright.pattern.AnyNode;
import com.treewright.pattern.Repeat;

import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Visitor that walks every child in source order and folds the child results together.
 *
 * <p>Each visit method defaults to {@link #visitChildren}, which starts from the seed and
 * combines the results of the children with the reducer. Subclasses override only the kinds
 * they care about and call {@code visitChildren} (or {@code super}) to keep descending. The
 * cancellation token is polled once per visited node.</p>
 *
 * @param <T> type of the data argument passed down the traversal
 * @param <S> type of the result
 */
public abstract class DepthFirstAstVisitor<T, S> implements AstVisitor<T, S> {

    private final S seed;
    private final BinaryOperator<S> reducer;
    private final CancellationToken cancellation;

    /**
     * Visitor whose result is always null; for walks run for their side effects.
     */
    protected DepthFirstAstVisitor() {
        this(null, (a, b) -> a, CancellationToken.NONE);
    }

    protected DepthFirstAstVisitor(S seed, BinaryOperator<S> reducer) {
        this(seed, reducer, CancellationToken.NONE);
    }

    protected DepthFirstAstVisitor(S seed, BinaryOperator<S> reducer, CancellationToken cancellation) {
        this.seed = seed;
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.cancellation = cancellation == null ? CancellationToken.NONE : cancellation;
    }

    protected final CancellationToken getCancellation() {
        return cancellation;
    }

    protected S visitChildren(AstNode node, T data) {
        cancellation.throwIfCancellationRequested();
        S result = seed;
        for (AstNode child : node.getChildren()) {
            result = reducer.apply(result, child.acceptVisitor(this, data));
        }
        return result;
    }

    @Override
    public S visitCompilationUnit(CompilationUnit unit, T data) {
        return visitChildren(unit, data);
    }

    @Override
    public S visitTypeDeclaration(TypeDeclaration typeDeclaration, T data) {
        return visitChildren(typeDeclaration, data);
    }

    @Override
    public S visitMethodDeclaration(MethodDeclaration methodDeclaration, T data) {
        return visitChildren(methodDeclaration, data);
    }

    @Override
    public S visitParameterDeclaration(ParameterDeclaration parameterDeclaration, T data) {
        return visitChildren(parameterDeclaration, data);
    }

    @Override
    public S visitAttribute(Attribute attribute, T data) {
        return visitChildren(attribute, data);
    }

    @Override
    public S visitSimpleType(SimpleType simpleType, T data) {
        return visitChildren(simpleType, data);
    }

    @Override
    public S visitBlockStatement(BlockStatement blockStatement, T data) {
        return visitChildren(blockStatement, data);
    }

    @Override
    public S visitExpressionStatement(ExpressionStatement expressionStatement, T data) {
        return visitChildren(expressionStatement, data);
    }

    @Override
    public S visitVariableDeclarationStatement(VariableDeclarationStatement variableDeclarationStatement, T data) {
        return visitChildren(variableDeclarationStatement, data);
    }

    @Override
    public S visitReturnStatement(ReturnStatement returnStatement, T data) {
        return visitChildren(returnStatement, data);
    }

    @Override
    public S visitIfElseStatement(IfElseStatement ifElseStatement, T data) {
        return visitChildren(ifElseStatement, data);
    }

    @Override
    public S visitWhileStatement(WhileStatement whileStatement, T data) {
        return visitChildren(whileStatement, data);
    }

    @Override
    public S visitDoWhileStatement(DoWhileStatement doWhileStatement, T data) {
        return visitChildren(doWhileStatement, data);
    }

    @Override
    public S visitIdentifierExpression(IdentifierExpression identifierExpression, T data) {
        return visitChildren(identifierExpression, data);
    }

    @Override
    public S visitPrimitiveExpression(PrimitiveExpression primitiveExpression, T data) {
        return visitChildren(primitiveExpression, data);
    }

    @Override
    public S visitBinaryOperatorExpression(BinaryOperatorExpression binaryOperatorExpression, T data) {
        return visitChildren(binaryOperatorExpression, data);
    }

    @Override
    public S visitUnaryOperatorExpression(UnaryOperatorExpression unaryOperatorExpression, T data) {
        return visitChildren(unaryOperatorExpression, data);
    }

    @Override
    public S visitPostfixOperatorExpression(PostfixOperatorExpression postfixOperatorExpression, T data) {
        return visitChildren(postfixOperatorExpression, data);
    }

    @Override
    public S visitAssignmentExpression(AssignmentExpression assignmentExpression, T data) {
        return visitChildren(assignmentExpression, data);
    }

    @Override
    public S visitInvocationExpression(InvocationExpression invocationExpression, T data) {
        return visitChildren(invocationExpression, data);
    }

    @Override
    public S visitMemberReferenceExpression(MemberReferenceExpression memberReferenceExpression, T data) {
        return visitChildren(memberReferenceExpression, data);
    }

    @Override
    public S visitParenthesizedExpression(ParenthesizedExpression parenthesizedExpression, T data) {
        return visitChildren(parenthesizedExpression, data);
    }

    @Override
    public S visitLambdaExpression(LambdaExpression lambdaExpression, T data) {
        return visitChildren(lambdaExpression, data);
    }

    @Override
    public S visitErrorNode(ErrorNode errorNode, T data) {
        return visitChildren(errorNode, data);
    }

    @Override
    public S visitToken(TokenNode token, T data) {
        return visitChildren(token, data);
    }

    @Override
    public S visitAnyNode(AnyNode anyNode, T data) {
        return visitChildren(anyNode, data);
    }

    @Override
    public S visitRepeat(Repeat repeat, T data) {
        return visitChildren(repeat, data);
    }
}
