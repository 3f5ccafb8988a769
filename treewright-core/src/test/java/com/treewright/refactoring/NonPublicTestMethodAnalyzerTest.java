package com.treewright.refactoring;

import com.treewright.TreewrightLoggingConfig;
import com.treewright.ast.AstNode;
import com.treewright.ast.Attribute;
import com.treewright.ast.SyntaxTree;
import com.treewright.parser.Parser;
import com.treewright.rewrite.RewriteOptions;
import com.treewright.semantics.Symbol;
import com.treewright.semantics.SymbolKind;
import com.treewright.semantics.SymbolResolver;
import com.treewright.semantics.TypeSymbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NonPublicTestMethodAnalyzerTest extends TreewrightLoggingConfig {

    private final NonPublicTestMethodAnalyzer analyzer = new NonPublicTestMethodAnalyzer();

    private static String inClass(String members) {
        return "class Tests {\n" + members + "}\n";
    }

    private List<Diagnostic> analyze(String source) {
        return analyzer.analyze(RefactoringContext.forDocument(Parser.parse(source)));
    }

    @Test
    void testPrivateTestMethodIsMadePublic() {
        String source = inClass("    @Test\n    private void Foo() {\n    }\n");

        List<Diagnostic> diagnostics = analyze(source);

        assertEquals(1, diagnostics.size());
        Diagnostic diagnostic = diagnostics.get(0);
        assertEquals(NonPublicTestMethodAnalyzer.ID, diagnostic.id());
        assertEquals(NonPublicTestMethodAnalyzer.MESSAGE, diagnostic.message());
        assertEquals(DiagnosticSeverity.INFO, diagnostic.severity());
        assertEquals(source.indexOf("Foo"), diagnostic.span().start());
        assertEquals(3, diagnostic.span().length());

        CodeAction fix = diagnostic.fixes().get(0);
        assertEquals(NonPublicTestMethodAnalyzer.FIX_TITLE, fix.getTitle());
        assertEquals(inClass("    @Test\n    public void Foo() {\n    }\n"), fix.apply().getText());
    }

    @Test
    void testMethodWithoutModifiersGetsPublicInFrontOfReturnType() {
        String source = inClass("    @Test\n    void Bar() {}\n");
        CodeAction fix = analyze(source).get(0).fixes().get(0);
        assertEquals(inClass("    @Test\n    public void Bar() {}\n"), fix.apply().getText());
    }

    @Test
    void testOtherModifiersAreKept() {
        String source = inClass("    @Test\n    protected virtual void Baz() {}\n");
        CodeAction fix = analyze(source).get(0).fixes().get(0);
        assertEquals(inClass("    @Test\n    public virtual void Baz() {}\n"), fix.apply().getText());
    }

    @Test
    void testCompliantAndUnmarkedMethodsAreIgnored() {
        String source = inClass("""
                @Test
                public void Ok() {}

                @Test
                static void Shared() {}

                @Test
                override void Inherited() {}

                private void Helper() {}

                @Ignore
                void Skipped() {}
            """);
        assertTrue(analyze(source).isEmpty());
    }

    @Test
    void testDiagnosticsComeInDocumentOrder() {
        String source = inClass("""
                @Test
                void First() {}

                @Fact
                internal void Second() {}

                @TestCaseAttribute
                private void Third() {}
            """);

        List<Diagnostic> diagnostics = analyze(source);

        assertEquals(3, diagnostics.size());
        assertTrue(diagnostics.get(0).path().compareTo(diagnostics.get(1).path()) < 0);
        assertTrue(diagnostics.get(1).path().compareTo(diagnostics.get(2).path()) < 0);
        assertEquals(source.indexOf("Third"), diagnostics.get(2).span().start());
    }

    @Test
    void testFixingOneDiagnosticLeavesTheOthers() {
        String source = inClass("    @Test\n    void A() {}\n    @Test\n    void B() {}\n");
        SyntaxTree fixed = analyze(source).get(1).fixes().get(0).apply();

        assertEquals(inClass("    @Test\n    void A() {}\n    @Test\n    public void B() {}\n"), fixed.getText());
        List<Diagnostic> remaining = analyzer.analyze(RefactoringContext.forDocument(fixed));
        assertEquals(1, remaining.size());
        assertEquals(source.indexOf("A()"), remaining.get(0).span().start());
    }

    @Test
    void testConfiguredAttributeNames() {
        String source = inClass("    @Scenario\n    void Flow() {}\n    @Test\n    void Plain() {}\n");
        RewriteOptions options = RewriteOptions.defaults().withTestAttributeNames(List.of("Scenario"));

        List<Diagnostic> diagnostics = analyzer.analyze(
            new RefactoringContext(Parser.parse(source), -1, null, null, options));

        assertEquals(1, diagnostics.size());
        assertEquals(source.indexOf("Flow"), diagnostics.get(0).span().start());
    }

    @Test
    void testAttributeResolvedThroughSemanticModel() {
        String source = inClass("    @Check\n    void Resolved() {}\n");
        SymbolResolver resolver = new SymbolResolver() {
            @Override
            public Symbol resolve(AstNode node) {
                if (!(node instanceof Attribute attribute) || !"Check".equals(attribute.getName())) {
                    return null;
                }
                return new Symbol() {
                    @Override
                    public String getName() {
                        return "TestAttribute";
                    }

                    @Override
                    public SymbolKind getKind() {
                        return SymbolKind.ATTRIBUTE;
                    }

                    @Override
                    public String getQualifiedName() {
                        return "NUnit.Framework.TestAttribute";
                    }
                };
            }

            @Override
            public TypeSymbol typeOf(AstNode node) {
                return null;
            }
        };
        RewriteOptions options = RewriteOptions.defaults().withTestAttributeNames(List.of("NUnit.Framework.TestAttribute"));

        assertEquals(1, analyzer.analyze(new RefactoringContext(Parser.parse(source), -1, null, resolver, options)).size());
        assertTrue(analyzer.analyze(new RefactoringContext(Parser.parse(source), -1, null, null, options)).isEmpty());
    }
}
