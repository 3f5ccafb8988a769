package com.treewright.refactoring;

import com.treewright.TreewrightLoggingConfig;
import com.treewright.ast.DoWhileStatement;
import com.treewright.ast.MethodDeclaration;
import com.treewright.ast.SyntaxTree;
import com.treewright.parser.Parser;
import com.treewright.visitor.CancellationToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class ConvertDoWhileToWhileRefactoringTest extends TreewrightLoggingConfig {

    private final ConvertDoWhileToWhileRefactoring refactoring = new ConvertDoWhileToWhileRefactoring();

    private static String inMethod(String body) {
        return "class C {\n  void M() {\n" + body + "  }\n}\n";
    }

    @Test
    void testConvertsAndKeepsTrailingComment() {
        String source = inMethod("    do { x++; } while(cond); // trailing comment\n");
        SyntaxTree tree = Parser.parse(source);

        List<CodeAction> actions = refactoring.getActions(RefactoringContext.atOffset(tree, source.indexOf("do")));

        assertEquals(1, actions.size());
        assertEquals(ConvertDoWhileToWhileRefactoring.TITLE, actions.get(0).getTitle());
        SyntaxTree result = actions.get(0).apply();
        assertEquals(inMethod("    while(cond) { x++; } // trailing comment\n"), result.getText());
        assertEquals(source, tree.getText());
    }

    @Test
    void testCaretOnTrailingWhileKeyword() {
        String source = inMethod("    do {\n      step();\n    } while (more);\n");
        SyntaxTree tree = Parser.parse(source);

        List<CodeAction> actions = refactoring.getActions(RefactoringContext.atOffset(tree, source.indexOf("while")));

        assertEquals(1, actions.size());
        assertEquals(inMethod("    while (more) {\n      step();\n    }\n"), actions.get(0).apply().getText());
    }

    @Test
    void testNothingOfferedAwayFromTheLoopKeywords() {
        String source = inMethod("    do { x++; } while(cond);\n    y();\n");
        SyntaxTree tree = Parser.parse(source);

        assertTrue(refactoring.getActions(RefactoringContext.atOffset(tree, source.indexOf("x++"))).isEmpty());
        assertTrue(refactoring.getActions(RefactoringContext.atOffset(tree, source.indexOf("y()"))).isEmpty());
        assertTrue(refactoring.getActions(RefactoringContext.forDocument(tree)).isEmpty());
    }

    @Test
    void testNothingOfferedForWhileLoop() {
        String source = inMethod("    while (cond) { x++; }\n");
        SyntaxTree tree = Parser.parse(source);
        assertTrue(refactoring.getActions(RefactoringContext.atOffset(tree, source.indexOf("while"))).isEmpty());
    }

    @Test
    void testCancelledRequestThrows() {
        String source = inMethod("    do { x++; } while(cond);\n");
        SyntaxTree tree = Parser.parse(source);
        CancellationToken cancellation = new CancellationToken();
        cancellation.cancel();
        RefactoringContext context = new RefactoringContext(tree, source.indexOf("do"), cancellation, null, null);
        assertThrows(CancellationException.class, () -> refactoring.getActions(context));
    }

    @Test
    void testNodeAtCaretFindsEnclosingNode() {
        String source = inMethod("    do { x++; } while(cond);\n");
        SyntaxTree tree = Parser.parse(source);
        RefactoringContext context = RefactoringContext.atOffset(tree, source.indexOf("x++"));

        DoWhileStatement loop = context.getNodeAtCaret(DoWhileStatement.class);
        assertNotNull(loop);
        assertSame(loop, tree.findEnclosing(loop.getCondition(), DoWhileStatement.class));
        assertNotNull(context.getNodeAtCaret(MethodDeclaration.class));
        assertNull(RefactoringContext.forDocument(tree).getNodeAtCaret(DoWhileStatement.class));
    }
}
