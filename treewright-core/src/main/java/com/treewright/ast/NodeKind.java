package com.treewright.ast;

/**
 * The closed set of AST node kinds. Each kind has exactly one visit method on
 * {@link com.treewright.visitor.AstVisitor}.
 */
public enum NodeKind {
    COMPILATION_UNIT("CompilationUnit", NodeCategory.OTHER),
    TYPE_DECLARATION("TypeDeclaration", NodeCategory.DECLARATION),
    METHOD_DECLARATION("MethodDeclaration", NodeCategory.DECLARATION),
    PARAMETER_DECLARATION("ParameterDeclaration", NodeCategory.OTHER),
    ATTRIBUTE("Attribute", NodeCategory.OTHER),
    SIMPLE_TYPE("SimpleType", NodeCategory.TYPE),

    BLOCK_STATEMENT("BlockStatement", NodeCategory.STATEMENT),
    EXPRESSION_STATEMENT("ExpressionStatement", NodeCategory.STATEMENT),
    VARIABLE_DECLARATION_STATEMENT("VariableDeclarationStatement", NodeCategory.STATEMENT),
    RETURN_STATEMENT("ReturnStatement", NodeCategory.STATEMENT),
    IF_ELSE_STATEMENT("IfElseStatement", NodeCategory.STATEMENT),
    WHILE_STATEMENT("WhileStatement", NodeCategory.STATEMENT),
    DO_WHILE_STATEMENT("DoWhileStatement", NodeCategory.STATEMENT),

    IDENTIFIER_EXPRESSION("IdentifierExpression", NodeCategory.EXPRESSION),
    PRIMITIVE_EXPRESSION("PrimitiveExpression", NodeCategory.EXPRESSION),
    BINARY_OPERATOR_EXPRESSION("BinaryOperatorExpression", NodeCategory.EXPRESSION),
    UNARY_OPERATOR_EXPRESSION("UnaryOperatorExpression", NodeCategory.EXPRESSION),
    POSTFIX_OPERATOR_EXPRESSION("PostfixOperatorExpression", NodeCategory.EXPRESSION),
    ASSIGNMENT_EXPRESSION("AssignmentExpression", NodeCategory.EXPRESSION),
    INVOCATION_EXPRESSION("InvocationExpression", NodeCategory.EXPRESSION),
    MEMBER_REFERENCE_EXPRESSION("MemberReferenceExpression", NodeCategory.EXPRESSION),
    PARENTHESIZED_EXPRESSION("ParenthesizedExpression", NodeCategory.EXPRESSION),
    LAMBDA_EXPRESSION("LambdaExpression", NodeCategory.EXPRESSION),

    ERROR_NODE("ErrorNode", NodeCategory.ERROR),
    TOKEN("Token", NodeCategory.TOKEN),

    ANY_NODE("AnyNode", NodeCategory.PATTERN),
    REPEAT("Repeat", NodeCategory.PATTERN);

    private final String displayName;
    private final NodeCategory category;

    NodeKind(String displayName, NodeCategory category) {
        this.displayName = displayName;
        this.category = category;
    }

    public String displayName() {
        return displayName;
    }

    public NodeCategory category() {
        return category;
    }

    public static NodeKind fromDisplayName(String name) {
        for (NodeKind kind : values()) {
            if (kind.displayName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + name);
    }
}
