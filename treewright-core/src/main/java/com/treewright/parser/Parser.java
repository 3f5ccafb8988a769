package com.treewright.parser;

import com.treewright.ast.AssignmentExpression;
import com.treewright.ast.AstNode;
import com.treewright.ast.Attribute;
import com.treewright.ast.BinaryOperatorExpression;
import com.treewright.ast.BlockStatement;
import com.treewright.ast.CompilationUnit;
import com.treewright.ast.DoWhileStatement;
import com.treewright.ast.EntityDeclaration;
import com.treewright.ast.ErrorNode;
import com.treewright.ast.Expression;
import com.treewright.ast.ExpressionStatement;
import com.treewright.ast.IdentifierExpression;
import com.treewright.ast.IfElseStatement;
import com.treewright.ast.InvocationExpression;
import com.treewright.ast.LambdaExpression;
import com.treewright.ast.MemberReferenceExpression;
import com.treewright.ast.MethodDeclaration;
import com.treewright.ast.ParameterDeclaration;
import com.treewright.ast.ParenthesizedExpression;
import com.treewright.ast.ParseDiagnostic;
import com.treewright.ast.PostfixOperatorExpression;
import com.treewright.ast.PrimitiveExpression;
import com.treewright.ast.ReturnStatement;
import com.treewright.ast.Roles;
import com.treewright.ast.SimpleType;
import com.treewright.ast.Statement;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.Token;
import com.treewright.ast.TokenKind;
import com.treewright.ast.TokenNode;
import com.treewright.ast.TypeDeclaration;
import com.treewright.ast.UnaryOperatorExpression;
import com.treewright.ast.VariableDeclarationStatement;
import com.treewright.ast.WhileStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Recursive descent parser for declarations and statements with a Pratt parser for expressions.
 *
 * <p>Every token ends up in the tree, so printing the result reproduces the input exactly.
 * Syntax errors do not abort the parse: the malformed statement or member is kept as an
 * {@link ErrorNode} holding its raw tokens, a {@link ParseDiagnostic} is recorded and parsing
 * resumes after it.</p>
 */
public final class Parser {

    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    // Binding powers (precedence levels) for Pratt parsing
    private static final int BP_NONE = 0;
    private static final int BP_ASSIGNMENT = 1;     // =, +=, -=, *=, /= - right-associative
    private static final int BP_OR = 2;             // ||
    private static final int BP_AND = 3;            // &&
    private static final int BP_EQUALITY = 4;       // ==, !=
    private static final int BP_RELATIONAL = 5;     // <, <=, >, >=
    private static final int BP_ADDITIVE = 6;       // +, -
    private static final int BP_MULTIPLICATIVE = 7; // *, /, %
    private static final int BP_UNARY = 8;          // prefix !, -, +, ++, --

    private final List<Token> tokens;
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
    private int current = 0;

    private Parser(String source) {
        Lexer lexer = new Lexer(source);
        this.tokens = lexer.tokenize();
        this.diagnostics.addAll(lexer.getDiagnostics());
    }

    /**
     * Parses a whole document into a frozen tree. Never throws for malformed input.
     */
    public static SyntaxTree parse(String source) {
        Parser parser = new Parser(source);
        CompilationUnit unit = parser.parseCompilationUnit();
        if (!parser.diagnostics.isEmpty()) {
            LOG.warning(() -> "Parsed with " + parser.diagnostics.size() + " diagnostic(s), first: "
                + parser.diagnostics.get(0));
        }
        return new SyntaxTree(unit, parser.diagnostics);
    }

    /**
     * Parses a single expression, e.g. for building patterns. The result is unfrozen.
     *
     * @throws IllegalArgumentException if the text is not exactly one well-formed expression
     */
    public static Expression parseExpression(String source) {
        Parser parser = new Parser(source);
        Expression expression;
        try {
            expression = parser.parseExpr(BP_ASSIGNMENT);
        } catch (SyntaxError e) {
            throw new IllegalArgumentException("Not an expression: " + source + " (" + e.getMessage() + ")");
        }
        parser.requireFullyConsumed(source);
        return expression;
    }

    /**
     * Parses a single statement. The result is unfrozen.
     *
     * @throws IllegalArgumentException if the text is not exactly one well-formed statement
     */
    public static AstNode parseStatement(String source) {
        Parser parser = new Parser(source);
        AstNode statement = parser.parseStatement();
        parser.requireFullyConsumed(source);
        return statement;
    }

    private void requireFullyConsumed(String source) {
        if (!isAtEnd() || !diagnostics.isEmpty()) {
            String reason = diagnostics.isEmpty() ? "unexpected '" + peek().text() + "'" : diagnostics.get(0).message();
            throw new IllegalArgumentException("Cannot parse fragment: " + source + " (" + reason + ")");
        }
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private CompilationUnit parseCompilationUnit() {
        CompilationUnit unit = new CompilationUnit();
        while (!isAtEnd()) {
            unit.addChild(Roles.MEMBER, parseMemberOrRecover());
        }
        unit.addChild(Roles.END_OF_FILE, token(peek()));
        return unit;
    }

    private AstNode parseMemberOrRecover() {
        int start = current;
        try {
            return parseMember();
        } catch (SyntaxError e) {
            return recover(start, e);
        }
    }

    private AstNode parseMember() {
        List<Attribute> attributes = new ArrayList<>();
        while (checkText("@")) {
            Attribute attribute = new Attribute();
            attribute.addChild(Roles.AT, token(advance()));
            attribute.addChild(Roles.IDENTIFIER, token(expectKind(TokenKind.IDENTIFIER, "attribute name")));
            attributes.add(attribute);
        }
        List<TokenNode> modifiers = new ArrayList<>();
        while (peek().kind() == TokenKind.KEYWORD && Lexer.isModifier(peek().text())) {
            modifiers.add(token(advance()));
        }
        EntityDeclaration declaration;
        if (checkText("class")) {
            declaration = new TypeDeclaration();
        } else if (peek().kind() == TokenKind.IDENTIFIER && peekAhead(1).kind() == TokenKind.IDENTIFIER
            && "(".equals(peekAhead(2).text())) {
            declaration = new MethodDeclaration();
        } else {
            throw new SyntaxError("Expected a class or method declaration", peek());
        }
        for (Attribute attribute : attributes) {
            declaration.addAttribute(attribute);
        }
        for (TokenNode modifier : modifiers) {
            declaration.addChild(Roles.MODIFIER, modifier);
        }
        if (declaration instanceof TypeDeclaration type) {
            parseTypeDeclarationRest(type);
        } else {
            parseMethodDeclarationRest((MethodDeclaration) declaration);
        }
        return declaration;
    }

    private void parseTypeDeclarationRest(TypeDeclaration type) {
        type.addChild(Roles.CLASS_KEYWORD, token(advance()));
        type.addChild(Roles.IDENTIFIER, token(expectKind(TokenKind.IDENTIFIER, "class name")));
        type.addChild(Roles.L_BRACE, token(expectText("{")));
        while (!isAtEnd() && !checkText("}")) {
            type.addMember(parseMemberOrRecover());
        }
        type.addChild(Roles.R_BRACE, token(expectText("}")));
    }

    private void parseMethodDeclarationRest(MethodDeclaration method) {
        method.setReturnType(parseType());
        method.addChild(Roles.IDENTIFIER, token(advance()));
        method.addChild(Roles.L_PAR, token(expectText("(")));
        parseParameterList(method, true);
        method.addChild(Roles.R_PAR, token(expectText(")")));
        if (checkText(";")) {
            method.addChild(Roles.SEMICOLON, token(advance()));
        } else {
            method.setBody(parseBlock());
        }
    }

    private void parseParameterList(AstNode owner, boolean typed) {
        if (checkText(")")) {
            return;
        }
        do {
            owner.addChild(Roles.PARAMETER, parseParameter(typed));
            if (!checkText(",")) {
                break;
            }
            owner.addChild(Roles.COMMA, token(advance()));
        } while (true);
    }

    private ParameterDeclaration parseParameter(boolean typed) {
        ParameterDeclaration parameter = new ParameterDeclaration();
        // Lambda parameters may leave out the type
        if (typed || peekAhead(1).kind() == TokenKind.IDENTIFIER) {
            parameter.setType(parseType());
        }
        parameter.addChild(Roles.IDENTIFIER, token(expectKind(TokenKind.IDENTIFIER, "parameter name")));
        return parameter;
    }

    private SimpleType parseType() {
        SimpleType type = new SimpleType();
        type.addChild(Roles.IDENTIFIER, token(expectKind(TokenKind.IDENTIFIER, "type name")));
        return type;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private AstNode parseStatement() {
        int start = current;
        try {
            return parseStatementUnchecked();
        } catch (SyntaxError e) {
            return recover(start, e);
        }
    }

    private Statement parseStatementUnchecked() {
        Token token = peek();
        if (token.kind() == TokenKind.KEYWORD) {
            return switch (token.text()) {
                case "if" -> parseIfStatement();
                case "while" -> parseWhileStatement();
                case "do" -> parseDoWhileStatement();
                case "return" -> parseReturnStatement();
                default -> parseExpressionStatement();
            };
        }
        if ("{".equals(token.text()) && token.kind() == TokenKind.PUNCTUATION) {
            return parseBlock();
        }
        if (token.kind() == TokenKind.IDENTIFIER && peekAhead(1).kind() == TokenKind.IDENTIFIER) {
            return parseVariableDeclaration();
        }
        return parseExpressionStatement();
    }

    private BlockStatement parseBlock() {
        BlockStatement block = new BlockStatement();
        block.addChild(Roles.L_BRACE, token(expectText("{")));
        while (!isAtEnd() && !checkText("}")) {
            block.addStatement(parseStatement());
        }
        block.addChild(Roles.R_BRACE, token(expectText("}")));
        return block;
    }

    private IfElseStatement parseIfStatement() {
        IfElseStatement statement = new IfElseStatement();
        statement.addChild(Roles.IF_KEYWORD, token(advance()));
        statement.addChild(Roles.L_PAR, token(expectText("(")));
        statement.setCondition(parseExpr(BP_ASSIGNMENT));
        statement.addChild(Roles.R_PAR, token(expectText(")")));
        statement.setTrueStatement(parseEmbeddedStatement());
        if (checkText("else")) {
            statement.addChild(Roles.ELSE_KEYWORD, token(advance()));
            statement.setFalseStatement(parseEmbeddedStatement());
        }
        return statement;
    }

    private WhileStatement parseWhileStatement() {
        WhileStatement statement = new WhileStatement();
        statement.addChild(Roles.WHILE_KEYWORD, token(advance()));
        statement.addChild(Roles.L_PAR, token(expectText("(")));
        statement.setCondition(parseExpr(BP_ASSIGNMENT));
        statement.addChild(Roles.R_PAR, token(expectText(")")));
        statement.setEmbeddedStatement(parseEmbeddedStatement());
        return statement;
    }

    private DoWhileStatement parseDoWhileStatement() {
        DoWhileStatement statement = new DoWhileStatement();
        statement.addChild(Roles.DO_KEYWORD, token(advance()));
        statement.setEmbeddedStatement(parseEmbeddedStatement());
        statement.addChild(Roles.WHILE_KEYWORD, token(expectText("while")));
        statement.addChild(Roles.L_PAR, token(expectText("(")));
        statement.setCondition(parseExpr(BP_ASSIGNMENT));
        statement.addChild(Roles.R_PAR, token(expectText(")")));
        statement.addChild(Roles.SEMICOLON, token(expectText(";")));
        return statement;
    }

    // A failure inside propagates so the whole enclosing statement is recovered
    private Statement parseEmbeddedStatement() {
        return parseStatementUnchecked();
    }

    private ReturnStatement parseReturnStatement() {
        ReturnStatement statement = new ReturnStatement();
        statement.addChild(Roles.RETURN_KEYWORD, token(advance()));
        if (!checkText(";")) {
            statement.setExpression(parseExpr(BP_ASSIGNMENT));
        }
        statement.addChild(Roles.SEMICOLON, token(expectText(";")));
        return statement;
    }

    private VariableDeclarationStatement parseVariableDeclaration() {
        VariableDeclarationStatement statement = new VariableDeclarationStatement();
        statement.setType(parseType());
        statement.addChild(Roles.IDENTIFIER, token(advance()));
        if (checkText("=")) {
            statement.addChild(Roles.ASSIGN, token(advance()));
            statement.setInitializer(parseExpr(BP_ASSIGNMENT));
        }
        statement.addChild(Roles.SEMICOLON, token(expectText(";")));
        return statement;
    }

    private ExpressionStatement parseExpressionStatement() {
        ExpressionStatement statement = new ExpressionStatement();
        statement.setExpression(parseExpr(BP_ASSIGNMENT));
        statement.addChild(Roles.SEMICOLON, token(expectText(";")));
        return statement;
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression parseExpr(int minBp) {
        Expression left = parsePrefix();
        while (true) {
            Token token = peek();
            String text = token.text();
            if (token.kind() == TokenKind.OPERATOR && (text.equals("++") || text.equals("--"))) {
                PostfixOperatorExpression postfix = new PostfixOperatorExpression();
                postfix.setExpression(left);
                postfix.addChild(Roles.OPERATOR, token(advance()));
                left = postfix;
                continue;
            }
            if (token.kind() == TokenKind.PUNCTUATION && text.equals("(")) {
                left = parseInvocation(left);
                continue;
            }
            if (token.kind() == TokenKind.PUNCTUATION && text.equals(".")) {
                MemberReferenceExpression member = new MemberReferenceExpression();
                member.setTarget(left);
                member.addChild(Roles.DOT, token(advance()));
                member.addChild(Roles.IDENTIFIER, token(expectKind(TokenKind.IDENTIFIER, "member name")));
                left = member;
                continue;
            }
            if (token.kind() != TokenKind.OPERATOR) {
                break;
            }
            int bp = infixBindingPower(text);
            if (bp == BP_NONE || bp < minBp) {
                break;
            }
            if (bp == BP_ASSIGNMENT) {
                AssignmentExpression assignment = new AssignmentExpression();
                assignment.setLeft(left);
                assignment.addChild(Roles.OPERATOR, token(advance()));
                assignment.setRight(parseExpr(BP_ASSIGNMENT));
                left = assignment;
            } else {
                BinaryOperatorExpression binary = new BinaryOperatorExpression();
                binary.setLeft(left);
                binary.addChild(Roles.OPERATOR, token(advance()));
                binary.setRight(parseExpr(bp + 1));
                left = binary;
            }
        }
        return left;
    }

    private static int infixBindingPower(String operator) {
        return switch (operator) {
            case "=", "+=", "-=", "*=", "/=" -> BP_ASSIGNMENT;
            case "||" -> BP_OR;
            case "&&" -> BP_AND;
            case "==", "!=" -> BP_EQUALITY;
            case "<", "<=", ">", ">=" -> BP_RELATIONAL;
            case "+", "-" -> BP_ADDITIVE;
            case "*", "/", "%" -> BP_MULTIPLICATIVE;
            default -> BP_NONE;
        };
    }

    private Expression parsePrefix() {
        Token token = peek();
        switch (token.kind()) {
            case IDENTIFIER -> {
                if ("=>".equals(peekAhead(1).text())) {
                    return parseLambda(false);
                }
                IdentifierExpression identifier = new IdentifierExpression();
                identifier.addChild(Roles.IDENTIFIER, token(advance()));
                return identifier;
            }
            case INTEGER_LITERAL, STRING_LITERAL -> {
                return literal();
            }
            case KEYWORD -> {
                if (token.text().equals("true") || token.text().equals("false") || token.text().equals("null")) {
                    return literal();
                }
            }
            case OPERATOR -> {
                if (token.text().equals("!") || token.text().equals("-") || token.text().equals("+")
                    || token.text().equals("++") || token.text().equals("--")) {
                    UnaryOperatorExpression unary = new UnaryOperatorExpression();
                    unary.addChild(Roles.OPERATOR, token(advance()));
                    unary.setExpression(parseExpr(BP_UNARY));
                    return unary;
                }
            }
            case PUNCTUATION -> {
                if (token.text().equals("(")) {
                    if (isLambdaParameterList()) {
                        return parseLambda(true);
                    }
                    ParenthesizedExpression parenthesized = new ParenthesizedExpression();
                    parenthesized.addChild(Roles.L_PAR, token(advance()));
                    parenthesized.setExpression(parseExpr(BP_ASSIGNMENT));
                    parenthesized.addChild(Roles.R_PAR, token(expectText(")")));
                    return parenthesized;
                }
            }
            default -> {
            }
        }
        throw new SyntaxError(token.kind() == TokenKind.END_OF_FILE
            ? "Unexpected end of input" : "Unexpected '" + token.text() + "'", token);
    }

    private PrimitiveExpression literal() {
        PrimitiveExpression literal = new PrimitiveExpression();
        literal.addChild(Roles.LITERAL, token(advance()));
        return literal;
    }

    private InvocationExpression parseInvocation(Expression target) {
        InvocationExpression invocation = new InvocationExpression();
        invocation.setTarget(target);
        invocation.addChild(Roles.L_PAR, token(advance()));
        if (!checkText(")")) {
            do {
                invocation.addChild(Roles.ARGUMENT, parseExpr(BP_ASSIGNMENT));
                if (!checkText(",")) {
                    break;
                }
                invocation.addChild(Roles.COMMA, token(advance()));
            } while (true);
        }
        invocation.addChild(Roles.R_PAR, token(expectText(")")));
        return invocation;
    }

    /**
     * Looks past a parenthesized list for a following {@code =>}.
     */
    private boolean isLambdaParameterList() {
        int depth = 0;
        for (int i = current; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.kind() == TokenKind.END_OF_FILE) {
                return false;
            }
            if (token.kind() == TokenKind.PUNCTUATION && token.text().equals("(")) {
                depth++;
            } else if (token.kind() == TokenKind.PUNCTUATION && token.text().equals(")")) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && "=>".equals(tokens.get(i + 1).text());
                }
            }
        }
        return false;
    }

    private LambdaExpression parseLambda(boolean parenthesized) {
        LambdaExpression lambda = new LambdaExpression();
        if (parenthesized) {
            lambda.addChild(Roles.L_PAR, token(advance()));
            parseParameterList(lambda, false);
            lambda.addChild(Roles.R_PAR, token(expectText(")")));
        } else {
            ParameterDeclaration parameter = new ParameterDeclaration();
            parameter.addChild(Roles.IDENTIFIER, token(advance()));
            lambda.addChild(Roles.PARAMETER, parameter);
        }
        lambda.addChild(Roles.ARROW, token(expectText("=>")));
        if (checkText("{")) {
            lambda.setBody(parseBlock());
        } else {
            lambda.setBody(parseExpr(BP_ASSIGNMENT));
        }
        return lambda;
    }

    // ========================================================================
    // Error recovery
    // ========================================================================

    /**
     * Rewinds to {@code start} and wraps the malformed region in an {@link ErrorNode}: everything up
     * to and including the next {@code ;} at brace depth zero, or up to the {@code }} closing the
     * enclosing block. At least one token is always consumed.
     */
    private ErrorNode recover(int start, SyntaxError error) {
        diagnostics.add(new ParseDiagnostic(error.getMessage(), Math.max(error.token.offset(), 0),
            error.token.length()));
        LOG.fine(() -> "Recovering from '" + error.getMessage() + "' at offset " + error.token.offset());
        current = start;
        ErrorNode node = new ErrorNode();
        int depth = 0;
        while (!isAtEnd()) {
            Token token = peek();
            boolean punctuation = token.kind() == TokenKind.PUNCTUATION;
            if (punctuation && token.text().equals("}")) {
                if (depth == 0 && node.hasChildren()) {
                    break;
                }
                depth = Math.max(0, depth - 1);
            } else if (punctuation && token.text().equals("{")) {
                depth++;
            }
            node.addErrorToken(token(advance()));
            if (depth == 0 && punctuation && (token.text().equals(";") || token.text().equals("}"))) {
                break;
            }
        }
        return node;
    }

    private static final class SyntaxError extends RuntimeException {
        private final Token token;

        SyntaxError(String message, Token token) {
            super(message, null, false, false);
            this.token = token;
        }
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private static TokenNode token(Token token) {
        return new TokenNode(token);
    }

    private Token expectText(String text) {
        if (checkText(text)) {
            return advance();
        }
        throw new SyntaxError("Expected '" + text + "' but found '" + peek().text() + "'", peek());
    }

    private Token expectKind(TokenKind kind, String what) {
        if (peek().kind() == kind) {
            return advance();
        }
        throw new SyntaxError("Expected " + what + " but found '" + peek().text() + "'", peek());
    }

    private boolean checkText(String text) {
        Token token = peek();
        return token.kind() != TokenKind.BAD && token.kind() != TokenKind.STRING_LITERAL && token.text().equals(text);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAhead(int offset) {
        int pos = current + offset;
        return pos < tokens.size() ? tokens.get(pos) : tokens.get(tokens.size() - 1);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
