package com.treewright.parser;

import com.treewright.ast.AssignmentExpression;
import com.treewright.ast.AstNode;
import com.treewright.ast.Attribute;
import com.treewright.ast.BinaryOperatorExpression;
import com.treewright.ast.BlockStatement;
import com.treewright.ast.CompilationUnit;
import com.treewright.ast.DoWhileStatement;
import com.treewright.ast.ErrorNode;
import com.treewright.ast.Expression;
import com.treewright.ast.ExpressionStatement;
import com.treewright.ast.IdentifierExpression;
import com.treewright.ast.IfElseStatement;
import com.treewright.ast.InvocationExpression;
import com.treewright.ast.LambdaExpression;
import com.treewright.ast.MemberReferenceExpression;
import com.treewright.ast.MethodDeclaration;
import com.treewright.ast.NodeKind;
import com.treewright.ast.ParameterDeclaration;
import com.treewright.ast.ParenthesizedExpression;
import com.treewright.ast.PostfixOperatorExpression;
import com.treewright.ast.PrimitiveExpression;
import com.treewright.ast.ReturnStatement;
import com.treewright.ast.Roles;
import com.treewright.ast.SimpleType;
import com.treewright.ast.Statement;
import com.treewright.ast.Token;
import com.treewright.ast.TokenKind;
import com.treewright.ast.TokenNode;
import com.treewright.ast.Trivia;
import com.treewright.ast.TypeDeclaration;
import com.treewright.ast.UnaryOperatorExpression;
import com.treewright.ast.VariableDeclarationStatement;
import com.treewright.ast.WhileStatement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds unfrozen nodes from scratch, with single spaces where a programmer would put them.
 * Nodes built here carry synthesized tokens (offset {@code -1}).
 */
public final class SyntaxFactory {

    private static final List<Trivia> SPACE = List.of(Trivia.space());

    private SyntaxFactory() {
    }

    // ==================== Tokens ====================

    public static TokenNode token(TokenKind kind, String text) {
        return TokenNode.of(kind, text);
    }

    public static TokenNode token(TokenKind kind, String text, List<Trivia> leading, List<Trivia> trailing) {
        return new TokenNode(new Token(kind, text, -1, leading, trailing));
    }

    public static TokenNode keyword(String text) {
        return token(TokenKind.KEYWORD, text);
    }

    /**
     * A modifier keyword followed by a space, e.g. {@code public }.
     */
    public static TokenNode modifier(String text) {
        return token(TokenKind.KEYWORD, text, List.of(), SPACE);
    }

    private static TokenNode punctuation(String text) {
        return token(TokenKind.PUNCTUATION, text);
    }

    private static TokenNode spaced(TokenKind kind, String text) {
        return token(kind, text, SPACE, SPACE);
    }

    private static TokenNode trailingSpace(TokenKind kind, String text) {
        return token(kind, text, List.of(), SPACE);
    }

    private static TokenNode identifierToken(String name) {
        return token(TokenKind.IDENTIFIER, name);
    }

    // ==================== Types and declarations ====================

    public static SimpleType simpleType(String name) {
        SimpleType type = new SimpleType();
        type.addChild(Roles.IDENTIFIER, identifierToken(name));
        return type;
    }

    public static ParameterDeclaration parameter(String type, String name) {
        ParameterDeclaration parameter = new ParameterDeclaration();
        if (type != null) {
            SimpleType simpleType = new SimpleType();
            simpleType.addChild(Roles.IDENTIFIER, trailingSpace(TokenKind.IDENTIFIER, type));
            parameter.setType(simpleType);
        }
        parameter.addChild(Roles.IDENTIFIER, identifierToken(name));
        return parameter;
    }

    public static Attribute attribute(String name) {
        Attribute attribute = new Attribute();
        attribute.addChild(Roles.AT, punctuation("@"));
        attribute.addChild(Roles.IDENTIFIER, trailingSpace(TokenKind.IDENTIFIER, name));
        return attribute;
    }

    // ==================== Expressions ====================

    public static IdentifierExpression identifier(String name) {
        IdentifierExpression identifier = new IdentifierExpression();
        identifier.addChild(Roles.IDENTIFIER, identifierToken(name));
        return identifier;
    }

    public static PrimitiveExpression integerLiteral(long value) {
        return literal(TokenKind.INTEGER_LITERAL, Long.toString(value));
    }

    /**
     * A string literal; {@code value} is written between quotes as is, without escaping.
     */
    public static PrimitiveExpression stringLiteral(String value) {
        return literal(TokenKind.STRING_LITERAL, "\"" + value + "\"");
    }

    public static PrimitiveExpression booleanLiteral(boolean value) {
        return literal(TokenKind.KEYWORD, Boolean.toString(value));
    }

    public static PrimitiveExpression nullLiteral() {
        return literal(TokenKind.KEYWORD, "null");
    }

    private static PrimitiveExpression literal(TokenKind kind, String text) {
        PrimitiveExpression literal = new PrimitiveExpression();
        literal.addChild(Roles.LITERAL, token(kind, text));
        return literal;
    }

    public static BinaryOperatorExpression binary(Expression left, String operator, Expression right) {
        BinaryOperatorExpression binary = new BinaryOperatorExpression();
        binary.setLeft(left);
        binary.addChild(Roles.OPERATOR, spaced(TokenKind.OPERATOR, operator));
        binary.setRight(right);
        return binary;
    }

    public static AssignmentExpression assignment(Expression left, String operator, Expression right) {
        AssignmentExpression assignment = new AssignmentExpression();
        assignment.setLeft(left);
        assignment.addChild(Roles.OPERATOR, spaced(TokenKind.OPERATOR, operator));
        assignment.setRight(right);
        return assignment;
    }

    public static UnaryOperatorExpression unary(String operator, Expression operand) {
        UnaryOperatorExpression unary = new UnaryOperatorExpression();
        unary.addChild(Roles.OPERATOR, token(TokenKind.OPERATOR, operator));
        unary.setExpression(operand);
        return unary;
    }

    public static PostfixOperatorExpression postfix(Expression operand, String operator) {
        PostfixOperatorExpression postfix = new PostfixOperatorExpression();
        postfix.setExpression(operand);
        postfix.addChild(Roles.OPERATOR, token(TokenKind.OPERATOR, operator));
        return postfix;
    }

    public static InvocationExpression invocation(Expression target, Expression... arguments) {
        return invocation(target, Arrays.asList(arguments));
    }

    /**
     * The target may be any node, so patterns can put a placeholder in the callee slot.
     */
    public static InvocationExpression invocation(AstNode target, List<? extends AstNode> arguments) {
        InvocationExpression invocation = new InvocationExpression();
        invocation.setChildByRole(Roles.TARGET, target);
        invocation.addChild(Roles.L_PAR, punctuation("("));
        invocation.setArguments(arguments);
        invocation.addChild(Roles.R_PAR, punctuation(")"));
        return invocation;
    }

    public static MemberReferenceExpression memberReference(Expression target, String member) {
        MemberReferenceExpression reference = new MemberReferenceExpression();
        reference.setTarget(target);
        reference.addChild(Roles.DOT, punctuation("."));
        reference.addChild(Roles.IDENTIFIER, identifierToken(member));
        return reference;
    }

    public static ParenthesizedExpression parenthesized(Expression expression) {
        ParenthesizedExpression parenthesized = new ParenthesizedExpression();
        parenthesized.addChild(Roles.L_PAR, punctuation("("));
        parenthesized.setExpression(expression);
        parenthesized.addChild(Roles.R_PAR, punctuation(")"));
        return parenthesized;
    }

    /**
     * {@code x => body} for a single parameter, {@code (a, b) => body} otherwise.
     */
    public static LambdaExpression lambda(List<String> parameterNames, AstNode body) {
        LambdaExpression lambda = new LambdaExpression();
        if (parameterNames.size() == 1) {
            lambda.addChild(Roles.PARAMETER, parameter(null, parameterNames.get(0)));
        } else {
            lambda.addChild(Roles.L_PAR, punctuation("("));
            List<ParameterDeclaration> parameters = new ArrayList<>();
            for (String name : parameterNames) {
                parameters.add(parameter(null, name));
            }
            lambda.setChildrenByRole(Roles.PARAMETER, parameters);
            lambda.addChild(Roles.R_PAR, punctuation(")"));
        }
        lambda.addChild(Roles.ARROW, spaced(TokenKind.OPERATOR, "=>"));
        lambda.setBody(body);
        return lambda;
    }

    // ==================== Statements ====================

    public static ExpressionStatement expressionStatement(Expression expression) {
        ExpressionStatement statement = new ExpressionStatement();
        statement.setExpression(expression);
        statement.addChild(Roles.SEMICOLON, punctuation(";"));
        return statement;
    }

    public static ReturnStatement returnStatement(Expression expression) {
        ReturnStatement statement = new ReturnStatement();
        statement.addChild(Roles.RETURN_KEYWORD, expression == null
            ? keyword("return") : trailingSpace(TokenKind.KEYWORD, "return"));
        statement.setExpression(expression);
        statement.addChild(Roles.SEMICOLON, punctuation(";"));
        return statement;
    }

    public static VariableDeclarationStatement variableDeclaration(String type, String name, Expression initializer) {
        VariableDeclarationStatement statement = new VariableDeclarationStatement();
        SimpleType simpleType = new SimpleType();
        simpleType.addChild(Roles.IDENTIFIER, trailingSpace(TokenKind.IDENTIFIER, type));
        statement.setType(simpleType);
        statement.addChild(Roles.IDENTIFIER, identifierToken(name));
        if (initializer != null) {
            statement.addChild(Roles.ASSIGN, spaced(TokenKind.OPERATOR, "="));
            statement.setInitializer(initializer);
        }
        statement.addChild(Roles.SEMICOLON, punctuation(";"));
        return statement;
    }

    /**
     * {@code { s1 s2 }} on one line; an empty block prints as {@code {}}.
     */
    public static BlockStatement block(AstNode... statements) {
        BlockStatement block = new BlockStatement();
        boolean empty = statements.length == 0;
        block.addChild(Roles.L_BRACE, empty ? punctuation("{") : trailingSpace(TokenKind.PUNCTUATION, "{"));
        for (AstNode statement : statements) {
            block.addStatement(statement);
        }
        block.addChild(Roles.R_BRACE, empty ? punctuation("}") : token(TokenKind.PUNCTUATION, "}", SPACE, List.of()));
        return block;
    }

    public static IfElseStatement ifStatement(Expression condition, Statement trueStatement, Statement falseStatement) {
        IfElseStatement statement = new IfElseStatement();
        statement.addChild(Roles.IF_KEYWORD, trailingSpace(TokenKind.KEYWORD, "if"));
        statement.addChild(Roles.L_PAR, punctuation("("));
        statement.setCondition(condition);
        statement.addChild(Roles.R_PAR, trailingSpace(TokenKind.PUNCTUATION, ")"));
        statement.setTrueStatement(trueStatement);
        if (falseStatement != null) {
            statement.addChild(Roles.ELSE_KEYWORD, spaced(TokenKind.KEYWORD, "else"));
            statement.setFalseStatement(falseStatement);
        }
        return statement;
    }

    public static WhileStatement whileStatement(Expression condition, Statement body) {
        WhileStatement statement = new WhileStatement();
        statement.addChild(Roles.WHILE_KEYWORD, trailingSpace(TokenKind.KEYWORD, "while"));
        statement.addChild(Roles.L_PAR, punctuation("("));
        statement.setCondition(condition);
        statement.addChild(Roles.R_PAR, trailingSpace(TokenKind.PUNCTUATION, ")"));
        statement.setEmbeddedStatement(body);
        return statement;
    }

    public static DoWhileStatement doWhileStatement(Statement body, Expression condition) {
        DoWhileStatement statement = new DoWhileStatement();
        statement.addChild(Roles.DO_KEYWORD, trailingSpace(TokenKind.KEYWORD, "do"));
        statement.setEmbeddedStatement(body);
        statement.addChild(Roles.WHILE_KEYWORD, spaced(TokenKind.KEYWORD, "while"));
        statement.addChild(Roles.L_PAR, punctuation("("));
        statement.setCondition(condition);
        statement.addChild(Roles.R_PAR, punctuation(")"));
        statement.addChild(Roles.SEMICOLON, punctuation(";"));
        return statement;
    }

    // ==================== Generic construction ====================

    /**
     * An empty node of {@code kind}, to be filled through the role setters. Tokens and pattern
     * placeholders carry leaf state and are constructed directly instead.
     *
     * @throws IllegalArgumentException for {@code TOKEN}, {@code ANY_NODE} and {@code REPEAT}
     */
    public static AstNode createEmpty(NodeKind kind) {
        return switch (kind) {
            case COMPILATION_UNIT -> new CompilationUnit();
            case TYPE_DECLARATION -> new TypeDeclaration();
            case METHOD_DECLARATION -> new MethodDeclaration();
            case PARAMETER_DECLARATION -> new ParameterDeclaration();
            case ATTRIBUTE -> new Attribute();
            case SIMPLE_TYPE -> new SimpleType();
            case BLOCK_STATEMENT -> new BlockStatement();
            case EXPRESSION_STATEMENT -> new ExpressionStatement();
            case VARIABLE_DECLARATION_STATEMENT -> new VariableDeclarationStatement();
            case RETURN_STATEMENT -> new ReturnStatement();
            case IF_ELSE_STATEMENT -> new IfElseStatement();
            case WHILE_STATEMENT -> new WhileStatement();
            case DO_WHILE_STATEMENT -> new DoWhileStatement();
            case IDENTIFIER_EXPRESSION -> new IdentifierExpression();
            case PRIMITIVE_EXPRESSION -> new PrimitiveExpression();
            case BINARY_OPERATOR_EXPRESSION -> new BinaryOperatorExpression();
            case UNARY_OPERATOR_EXPRESSION -> new UnaryOperatorExpression();
            case POSTFIX_OPERATOR_EXPRESSION -> new PostfixOperatorExpression();
            case ASSIGNMENT_EXPRESSION -> new AssignmentExpression();
            case INVOCATION_EXPRESSION -> new InvocationExpression();
            case MEMBER_REFERENCE_EXPRESSION -> new MemberReferenceExpression();
            case PARENTHESIZED_EXPRESSION -> new ParenthesizedExpression();
            case LAMBDA_EXPRESSION -> new LambdaExpression();
            case ERROR_NODE -> new ErrorNode();
            case TOKEN, ANY_NODE, REPEAT ->
                throw new IllegalArgumentException(kind.displayName() + " nodes cannot be created empty");
        };
    }
}
