package com.treewright.refactoring;

import com.treewright.ast.AstNode;
import com.treewright.ast.DoWhileStatement;
import com.treewright.ast.NodeKind;
import com.treewright.ast.Roles;
import com.treewright.ast.SyntaxTree;
import com.treewright.ast.TokenNode;
import com.treewright.ast.Trivia;
import com.treewright.ast.WhileStatement;
import com.treewright.pattern.AnyNode;
import com.treewright.rewrite.Edit;

import java.util.List;
import java.util.logging.Logger;

/**
 * Turns {@code do body while (cond);} into {@code while (cond) body}. This changes semantics when
 * the condition is false on entry, so it is only offered on request.
 *
 * <p>The keyword and parentheses of the original loop are kept, so the author's spacing inside
 * {@code while(...)} survives. Comments before the loop and after its semicolon move to the new
 * statement.</p>
 */
public final class ConvertDoWhileToWhileRefactoring implements CodeRefactoringProvider {

    private static final Logger LOG = Logger.getLogger(ConvertDoWhileToWhileRefactoring.class.getName());

    public static final String TITLE = "To 'while { ... }'";

    @Override
    public List<CodeAction> getActions(RefactoringContext context) {
        context.getCancellation().throwIfCancellationRequested();
        TokenNode token = context.getTokenAtCaret();
        if (token == null) {
            return List.of();
        }
        SyntaxTree tree = context.getTree();
        if (!(tree.getParent(token) instanceof DoWhileStatement loop)) {
            return List.of();
        }
        if (loop.getWhileToken() == null || loop.getChildByRole(Roles.L_PAR) == null
            || loop.getChildByRole(Roles.CONDITION) == null || loop.getChildByRole(Roles.EMBEDDED_STATEMENT) == null) {
            return List.of();
        }
        LOG.fine(() -> "Offering do-while conversion at " + loop.getSpan());
        Edit edit = Edit.replace(tree.pathOf(loop), toWhile(loop))
            .when(new AnyNode(null, NodeKind.DO_WHILE_STATEMENT));
        return List.of(new CodeAction(TITLE, tree, List.of(edit), context.newEditor()));
    }

    private static WhileStatement toWhile(DoWhileStatement loop) {
        WhileStatement result = new WhileStatement();
        result.addChild(Roles.WHILE_KEYWORD, loop.getWhileToken());
        result.addChild(Roles.L_PAR, loop.getChildByRole(Roles.L_PAR));
        result.setChildByRole(Roles.CONDITION, loop.getChildByRole(Roles.CONDITION));
        AstNode rPar = loop.getChildByRole(Roles.R_PAR);
        if (rPar instanceof TokenNode paren) {
            result.addChild(Roles.R_PAR, paren.withToken(paren.getToken().withTrailingTrivia(List.of(Trivia.space()))));
        }
        result.setChildByRole(Roles.EMBEDDED_STATEMENT, loop.getChildByRole(Roles.EMBEDDED_STATEMENT));
        return result;
    }
}
