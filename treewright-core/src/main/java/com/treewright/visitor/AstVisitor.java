package com.treewright.visitor;

import com.treewright.ast.AssignmentExpression;
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

/**
 * Operation over the syntax tree, with one method per {@link com.treewright.ast.NodeKind}.
 *
 * <p>{@code node.acceptVisitor(visitor, data)} calls the method matching the node's concrete kind.
 * New analyses implement this interface (usually by extending {@link DepthFirstAstVisitor}) without
 * touching the node classes.</p>
 *
 * @param <T> type of the data argument passed down the traversal
 * @param <S> type of the result
 */
public interface AstVisitor<T, S> {

    S visitCompilationUnit(CompilationUnit unit, T data);

    S visitTypeDeclaration(TypeDeclaration typeDeclaration, T data);

    S visitMethodDeclaration(MethodDeclaration methodDeclaration, T data);

    S visitParameterDeclaration(ParameterDeclaration parameterDeclaration, T data);

    S visitAttribute(Attribute attribute, T data);

    S visitSimpleType(SimpleType simpleType, T data);

    S visitBlockStatement(BlockStatement blockStatement, T data);

    S visitExpressionStatement(ExpressionStatement expressionStatement, T data);

    S visitVariableDeclarationStatement(VariableDeclarationStatement variableDeclarationStatement, T data);

    S visitReturnStatement(ReturnStatement returnStatement, T data);

    S visitIfElseStatement(IfElseStatement ifElseStatement, T data);

    S visitWhileStatement(WhileStatement whileStatement, T data);

    S visitDoWhileStatement(DoWhileStatement doWhileStatement, T data);

    S visitIdentifierExpression(IdentifierExpression identifierExpression, T data);

    S visitPrimitiveExpression(PrimitiveExpression primitiveExpression, T data);

    S visitBinaryOperatorExpression(BinaryOperatorExpression binaryOperatorExpression, T data);

    S visitUnaryOperatorExpression(UnaryOperatorExpression unaryOperatorExpression, T data);

    S visitPostfixOperatorExpression(PostfixOperatorExpression postfixOperatorExpression, T data);

    S visitAssignmentExpression(AssignmentExpression assignmentExpression, T data);

    S visitInvocationExpression(InvocationExpression invocationExpression, T data);

    S visitMemberReferenceExpression(MemberReferenceExpression memberReferenceExpression, T data);

    S visitParenthesizedExpression(ParenthesizedExpression parenthesizedExpression, T data);

    S visitLambdaExpression(LambdaExpression lambdaExpression, T data);

    S visitErrorNode(ErrorNode errorNode, T data);

    S visitToken(TokenNode token, T data);

    S visitAnyNode(AnyNode anyNode, T data);

    S visitRepeat(Repeat repeat, T data);
}
