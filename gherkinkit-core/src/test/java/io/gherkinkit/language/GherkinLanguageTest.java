package io.gherkinkit.language;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GherkinLanguageTest {

    @Test
    void testRegistered() {
        GherkinLanguage fr = GherkinLanguage.of("fr");
        assertEquals("fr", fr.getCode());
        assertEquals("French", fr.getName());
        assertEquals("français", fr.getNativeName());
        assertTrue(fr.isRegistered());
        assertEquals("French (fr)", fr.toString());
        assertEquals(LanguageKeywords.keywords("fr"), fr.getKeywords());
        assertEquals(GherkinLanguage.ENGLISH, GherkinLanguage.of("en"));
    }

    @Test
    void testUnknown() {
        assertNull(GherkinLanguage.of("qya"));
        GherkinLanguage language = GherkinLanguage.forCode("qya");
        assertEquals("qya", language.getName());
        assertFalse(language.isRegistered());
        assertEquals(LanguageKeywords.english(), language.getKeywords());
        assertEquals(new GherkinLanguage("qya", "Quenya", null), language);
        assertThrows(IllegalArgumentException.class, () -> new GherkinLanguage("", "x", "x"));
    }

    @Test
    void testAll() {
        List<GherkinLanguage> all = GherkinLanguage.all();
        assertEquals(LanguageKeywords.registeredLanguages().size(), all.size());
        assertEquals("af", all.get(0).getCode());
        assertTrue(all.contains(GherkinLanguage.of("ja")));
    }

}
