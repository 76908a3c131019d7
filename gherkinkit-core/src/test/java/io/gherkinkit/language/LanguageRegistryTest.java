package io.gherkinkit.language;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LanguageRegistryTest {

    @Test
    void testBundledLanguages() {
        LanguageRegistry registry = LanguageRegistry.shared();
        List<String> codes = registry.getCodes();
        assertTrue(codes.size() >= 70, "registered: " + codes.size());
        for (String code : List.of("en", "fr", "de", "es", "ja", "ru", "zh-CN", "sr-Latn",
                "be", "ga", "tlh", "en-au", "sr-Cyrl", "mk-Cyrl", "ta", "uz")) {
            assertTrue(registry.isRegistered(code), code);
        }
        List<String> sorted = new ArrayList<>(codes);
        Collections.sort(sorted);
        assertEquals(sorted, codes);
        assertFalse(registry.isRegistered("qya"));
        assertFalse(registry.isRegistered(null));
    }

    @Test
    void testWildcardRemovedFromSteps() {
        LanguageKeywords en = LanguageRegistry.shared().getKeywords("en");
        assertEquals(List.of("Given "), en.getGiven());
        assertEquals(List.of("But "), en.getBut());
        for (String code : LanguageRegistry.shared().getCodes()) {
            assertFalse(LanguageRegistry.shared().getKeywords(code).getAnd().contains("* "), code);
        }
    }

    @Test
    void testUnknownCodeFallsBackToEnglish() {
        LanguageRegistry registry = LanguageRegistry.shared();
        assertEquals(registry.getKeywords("en"), registry.getKeywords("qya"));
        assertEquals(registry.getKeywords("en"), registry.getKeywords(null));
        assertNull(registry.getLanguage("qya"));
    }

    @Test
    void testLoadPartialResource() {
        LanguageRegistry registry = LanguageRegistry.load("languages/partial.json");
        assertEquals(List.of("en", "xx"), registry.getCodes());
        assertEquals(LanguageRegistry.FALLBACK_ENGLISH, registry.getKeywords("en"));
        assertEquals(List.of("Giv "), registry.getKeywords("xx").getGiven());
        assertEquals("Test", registry.getLanguage("xx").getName());
        assertFalse(registry.isRegistered("yy"));
        assertFalse(registry.isRegistered("zz"));
    }

    @Test
    void testLoadMissingOrBrokenResource() {
        for (String path : List.of("languages/missing.json", "languages/broken.json")) {
            LanguageRegistry registry = LanguageRegistry.load(path);
            assertEquals(List.of("en"), registry.getCodes(), path);
            assertEquals(LanguageRegistry.FALLBACK_ENGLISH, registry.getKeywords("fr"), path);
            assertEquals(GherkinLanguage.ENGLISH, registry.getLanguages().get(0), path);
        }
    }

    @Test
    void testStreamFailingOnRead() {
        boolean[] closed = {false};
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk went away");
            }

            @Override
            public void close() {
                closed[0] = true;
            }
        };
        LanguageRegistry registry = LanguageRegistry.load("failing.json", failing);
        assertEquals(List.of("en"), registry.getCodes());
        assertEquals(LanguageRegistry.FALLBACK_ENGLISH, registry.getKeywords("de"));
        assertTrue(closed[0]);
    }

}
