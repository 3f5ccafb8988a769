package com.treewright.ast;

import static com.treewright.ast.Cardinality.MANY;
import static com.treewright.ast.Cardinality.ONE;

/**
 * The standard role registry. Initialized once, when this class is first loaded, before any
 * node can be created.
 */
public final class Roles {

    private static final RoleRegistry.Builder BUILDER = RoleRegistry.builder();

    // Tokens
    public static final Role IDENTIFIER = BUILDER.register("Identifier", NodeCategory.TOKEN, ONE);
    public static final Role LITERAL = BUILDER.register("Literal", NodeCategory.TOKEN, ONE);
    public static final Role OPERATOR = BUILDER.register("Operator", NodeCategory.TOKEN, ONE);
    public static final Role MODIFIER = BUILDER.register("Modifier", NodeCategory.TOKEN, MANY);
    public static final Role L_PAR = BUILDER.register("LPar", NodeCategory.TOKEN, ONE);
    public static final Role R_PAR = BUILDER.register("RPar", NodeCategory.TOKEN, ONE);
    public static final Role L_BRACE = BUILDER.register("LBrace", NodeCategory.TOKEN, ONE);
    public static final Role R_BRACE = BUILDER.register("RBrace", NodeCategory.TOKEN, ONE);
    public static final Role SEMICOLON = BUILDER.register("Semicolon", NodeCategory.TOKEN, ONE);
    public static final Role COMMA = BUILDER.register("Comma", NodeCategory.TOKEN, MANY);
    public static final Role DOT = BUILDER.register("Dot", NodeCategory.TOKEN, ONE);
    public static final Role ARROW = BUILDER.register("Arrow", NodeCategory.TOKEN, ONE);
    public static final Role ASSIGN = BUILDER.register("Assign", NodeCategory.TOKEN, ONE);
    public static final Role AT = BUILDER.register("At", NodeCategory.TOKEN, ONE);
    public static final Role CLASS_KEYWORD = BUILDER.register("ClassKeyword", NodeCategory.TOKEN, ONE);
    public static final Role IF_KEYWORD = BUILDER.register("IfKeyword", NodeCategory.TOKEN, ONE);
    public static final Role ELSE_KEYWORD = BUILDER.register("ElseKeyword", NodeCategory.TOKEN, ONE);
    public static final Role WHILE_KEYWORD = BUILDER.register("WhileKeyword", NodeCategory.TOKEN, ONE);
    public static final Role DO_KEYWORD = BUILDER.register("DoKeyword", NodeCategory.TOKEN, ONE);
    public static final Role RETURN_KEYWORD = BUILDER.register("ReturnKeyword", NodeCategory.TOKEN, ONE);
    public static final Role ERROR_TOKEN = BUILDER.register("ErrorToken", NodeCategory.TOKEN, MANY);
    public static final Role END_OF_FILE = BUILDER.register("EndOfFile", NodeCategory.TOKEN, ONE);

    // Declarations
    public static final Role MEMBER = BUILDER.register("Member", NodeCategory.DECLARATION, MANY);
    public static final Role ATTRIBUTE = BUILDER.register("Attribute", NodeCategory.OTHER, MANY);
    public static final Role TYPE = BUILDER.register("Type", NodeCategory.TYPE, ONE);
    public static final Role PARAMETER = BUILDER.registerSeparated("Parameter", NodeCategory.OTHER, COMMA, ",");
    public static final Role BODY = BUILDER.register("Body", NodeCategory.STATEMENT, ONE);

    // Statements
    public static final Role STATEMENT = BUILDER.register("Statement", NodeCategory.STATEMENT, MANY);
    public static final Role EMBEDDED_STATEMENT = BUILDER.register("EmbeddedStatement", NodeCategory.STATEMENT, ONE);
    public static final Role TRUE_STATEMENT = BUILDER.register("TrueStatement", NodeCategory.STATEMENT, ONE);
    public static final Role FALSE_STATEMENT = BUILDER.register("FalseStatement", NodeCategory.STATEMENT, ONE);

    // Expressions
    public static final Role CONDITION = BUILDER.register("Condition", NodeCategory.EXPRESSION, ONE);
    public static final Role EXPRESSION = BUILDER.register("Expression", NodeCategory.EXPRESSION, ONE);
    public static final Role LEFT = BUILDER.register("Left", NodeCategory.EXPRESSION, ONE);
    public static final Role RIGHT = BUILDER.register("Right", NodeCategory.EXPRESSION, ONE);
    public static final Role TARGET = BUILDER.register("Target", NodeCategory.EXPRESSION, ONE);
    public static final Role INITIALIZER = BUILDER.register("Initializer", NodeCategory.EXPRESSION, ONE);
    public static final Role ARGUMENT = BUILDER.registerSeparated("Argument", NodeCategory.EXPRESSION, COMMA, ",");
    public static final Role LAMBDA_BODY = BUILDER.register("LambdaBody", NodeCategory.ANY, ONE);

    private static final RoleRegistry REGISTRY = BUILDER
        .declare(NodeKind.COMPILATION_UNIT, MEMBER, END_OF_FILE)
        .declare(NodeKind.TYPE_DECLARATION, ATTRIBUTE, MODIFIER, CLASS_KEYWORD, IDENTIFIER, L_BRACE, MEMBER, R_BRACE)
        .declare(NodeKind.METHOD_DECLARATION, ATTRIBUTE, MODIFIER, TYPE, IDENTIFIER, L_PAR, PARAMETER, COMMA, R_PAR,
            BODY, SEMICOLON)
        .declare(NodeKind.PARAMETER_DECLARATION, TYPE, IDENTIFIER)
        .declare(NodeKind.ATTRIBUTE, AT, IDENTIFIER)
        .declare(NodeKind.SIMPLE_TYPE, IDENTIFIER)
        .declare(NodeKind.BLOCK_STATEMENT, L_BRACE, STATEMENT, R_BRACE)
        .declare(NodeKind.EXPRESSION_STATEMENT, EXPRESSION, SEMICOLON)
        .declare(NodeKind.VARIABLE_DECLARATION_STATEMENT, TYPE, IDENTIFIER, ASSIGN, INITIALIZER, SEMICOLON)
        .declare(NodeKind.RETURN_STATEMENT, RETURN_KEYWORD, EXPRESSION, SEMICOLON)
        .declare(NodeKind.IF_ELSE_STATEMENT, IF_KEYWORD, L_PAR, CONDITION, R_PAR, TRUE_STATEMENT, ELSE_KEYWORD,
            FALSE_STATEMENT)
        .declare(NodeKind.WHILE_STATEMENT, WHILE_KEYWORD, L_PAR, CONDITION, R_PAR, EMBEDDED_STATEMENT)
        .declare(NodeKind.DO_WHILE_STATEMENT, DO_KEYWORD, EMBEDDED_STATEMENT, WHILE_KEYWORD, L_PAR, CONDITION, R_PAR,
            SEMICOLON)
        .declare(NodeKind.IDENTIFIER_EXPRESSION, IDENTIFIER)
        .declare(NodeKind.PRIMITIVE_EXPRESSION, LITERAL)
        .declare(NodeKind.BINARY_OPERATOR_EXPRESSION, LEFT, OPERATOR, RIGHT)
        .declare(NodeKind.UNARY_OPERATOR_EXPRESSION, OPERATOR, EXPRESSION)
        .declare(NodeKind.POSTFIX_OPERATOR_EXPRESSION, EXPRESSION, OPERATOR)
        .declare(NodeKind.ASSIGNMENT_EXPRESSION, LEFT, OPERATOR, RIGHT)
        .declare(NodeKind.INVOCATION_EXPRESSION, TARGET, L_PAR, ARGUMENT, COMMA, R_PAR)
        .declare(NodeKind.MEMBER_REFERENCE_EXPRESSION, TARGET, DOT, IDENTIFIER)
        .declare(NodeKind.PARENTHESIZED_EXPRESSION, L_PAR, EXPRESSION, R_PAR)
        .declare(NodeKind.LAMBDA_EXPRESSION, L_PAR, PARAMETER, COMMA, R_PAR, ARROW, LAMBDA_BODY)
        .declare(NodeKind.ERROR_NODE, ERROR_TOKEN)
        .build();

    private Roles() {
    }

    public static RoleRegistry registry() {
        return REGISTRY;
    }
}
