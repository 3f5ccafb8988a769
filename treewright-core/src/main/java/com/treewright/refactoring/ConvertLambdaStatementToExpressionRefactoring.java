package com.treewright.refactoring;

import com.treewright.ast.AstNode;
import com.treewright.ast.BlockStatement;
import com.treewright.ast.ExpressionStatement;
import com.treewright.ast.LambdaExpression;
import com.treewright.ast.ReturnStatement;
import com.treewright.ast.Roles;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.TokenKind;
import com.treewright.ast.TokenNode;
import com.treewright.parser.SyntaxFactory;
import com.treewright.pattern.AnyNode;
import com.treewright.pattern.MatchResult;
import com.treewright.pattern.PatternMatcher;
import com.treewright.rewrite.Edit;

import java.util.List;

/**
 * With the caret on {@code =>}, rewrites {@code x => { return e; }} and {@code x => { e; }} to
 * {@code x => e}.
 */
public final class ConvertLambdaStatementToExpressionRefactoring implements CodeRefactoringProvider {

    public static final String TITLE = "Convert to lambda expression";

    private static final String BODY = "body";

    // { return $body; }
    private static final AstNode RETURN_BLOCK;
    // { $body; }
    private static final AstNode EXPRESSION_BLOCK;

    static {
        ReturnStatement returnStatement = new ReturnStatement();
        returnStatement.addChild(Roles.RETURN_KEYWORD, SyntaxFactory.keyword("return"));
        returnStatement.setChildByRole(Roles.EXPRESSION, new AnyNode(BODY));
        returnStatement.addChild(Roles.SEMICOLON, SyntaxFactory.token(TokenKind.PUNCTUATION, ";"));
        RETURN_BLOCK = SyntaxFactory.block(returnStatement);
        RETURN_BLOCK.freeze();

        ExpressionStatement expressionStatement = new ExpressionStatement();
        expressionStatement.setChildByRole(Roles.EXPRESSION, new AnyNode(BODY));
        expressionStatement.addChild(Roles.SEMICOLON, SyntaxFactory.token(TokenKind.PUNCTUATION, ";"));
        EXPRESSION_BLOCK = SyntaxFactory.block(expressionStatement);
        EXPRESSION_BLOCK.freeze();
    }

    @Override
    public List<CodeAction> getActions(RefactoringContext context) {
        context.getCancellation().throwIfCancellationRequested();
        TokenNode token = context.getTokenAtCaret();
        if (token == null || !"=>".equals(token.getText())) {
            return List.of();
        }
        SyntaxTree tree = context.getTree();
        if (!(tree.getParent(token) instanceof LambdaExpression lambda)
            || !(lambda.getBody() instanceof BlockStatement body)) {
            return List.of();
        }
        AstNode pattern = RETURN_BLOCK;
        MatchResult match = PatternMatcher.match(pattern, body);
        if (!match.isSuccess()) {
            pattern = EXPRESSION_BLOCK;
            match = PatternMatcher.match(pattern, body);
        }
        if (!match.isSuccess()) {
            return List.of();
        }
        AstNode expression = match.get(BODY);
        Edit edit = Edit.replace(tree.pathOf(body), expression).when(pattern);
        return List.of(new CodeAction(TITLE, tree, List.of(edit), context.newEditor()));
    }
}
