package com.treewright.jackson;

import com.treewright.ast.ConfigurationException;
import com.treewright.rewrite.RewriteOptions;
import com.treewright.rewrite.TriviaPrecedence;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RewriteOptionsLoaderTest {

    @Test
    void testParseAllSettings() {
        RewriteOptions options = RewriteOptionsLoader.parse("""
            rewrite:
              triviaPrecedence: merge
              inheritTrailingTrivia: false
            analyzers:
              testAttributeNames: [Fact, Theory]
            """);

        assertEquals(TriviaPrecedence.MERGE, options.triviaPrecedence());
        assertFalse(options.inheritTrailingTrivia());
        assertEquals(List.of("Fact", "Theory"), options.testAttributeNames());
        assertTrue(options.isTestAttribute("Theory"));
        assertFalse(options.isTestAttribute("Test"));
    }

    @Test
    void testMissingSectionsUseDefaults() {
        RewriteOptions options = RewriteOptionsLoader.parse("rewrite:\n  triviaPrecedence: REPLACEMENT\n");
        assertEquals(TriviaPrecedence.REPLACEMENT, options.triviaPrecedence());
        assertTrue(options.inheritTrailingTrivia());
        assertEquals(RewriteOptions.DEFAULT_TEST_ATTRIBUTES, options.testAttributeNames());
    }

    @Test
    void testInvalidValuesFallBack() {
        RewriteOptions options = RewriteOptionsLoader.parse("""
            rewrite:
              triviaPrecedence: LOUDEST
              inheritTrailingTrivia: sometimes
            analyzers:
              testAttributeNames: Test
            """);
        assertEquals(RewriteOptions.defaults(), options);

        assertEquals(RewriteOptions.defaults(), RewriteOptionsLoader.parse("rewrite: 42\n"));
    }

    @Test
    void testInvalidYamlIsAnError() {
        assertThrows(ConfigurationException.class, () -> RewriteOptionsLoader.parse("rewrite: [unclosed"));
    }

    @Test
    void testBundledDefaults() {
        RewriteOptions defaults = RewriteOptionsLoader.loadDefaults();
        assertEquals(RewriteOptions.defaults(), defaults);
        assertSame(defaults, RewriteOptionsLoader.loadDefaults());
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("treewright.yml");
        Files.writeString(config, "analyzers:\n  testAttributeNames:\n    - Scenario\n");

        RewriteOptions options = RewriteOptionsLoader.load(config);

        assertEquals(List.of("Scenario"), options.testAttributeNames());
        assertEquals(TriviaPrecedence.REMOVED_NODE, options.triviaPrecedence());
    }

    @Test
    void testUnusableFileFallsBackToDefaults(@TempDir Path dir) throws IOException {
        assertEquals(RewriteOptions.defaults(), RewriteOptionsLoader.load(null));
        assertEquals(RewriteOptions.defaults(), RewriteOptionsLoader.load(dir.resolve("missing.yml")));

        Path broken = dir.resolve("broken.yml");
        Files.writeString(broken, "rewrite: [unclosed");
        assertEquals(RewriteOptions.defaults(), RewriteOptionsLoader.load(broken));
    }
}
