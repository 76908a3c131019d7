package io.gherkinkit.language;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LanguageKeywordsTest {

    @Test
    void testEnglish() {
        LanguageKeywords kw = LanguageKeywords.english();
        assertEquals("Feature", kw.getFeature().get(0));
        assertTrue(kw.getScenario().contains("Scenario"));
        assertTrue(kw.getScenario().contains("Example"));
        assertEquals(List.of("Scenario Outline", "Scenario Template"), kw.getScenarioOutline());
        assertEquals(List.of("Rule"), kw.getRule());
        assertEquals(List.of("Background"), kw.getBackground());
        assertEquals(List.of("Examples", "Scenarios"), kw.getExamples());
        assertEquals(List.of("When "), kw.getWhen());
        assertEquals(List.of("Then "), kw.getThen());
        assertEquals(List.of("And "), kw.getAnd());
    }

    @Test
    void testLocalized() {
        LanguageKeywords fr = LanguageKeywords.keywords("fr");
        assertEquals(List.of("Fonctionnalité"), fr.getFeature());
        assertEquals("Soit ", fr.getGiven().get(0));
        assertEquals(List.of("Règle"), fr.getRule());
        LanguageKeywords ja = LanguageKeywords.keywords("ja");
        assertEquals("前提", ja.getGiven().get(0));
        LanguageKeywords ru = LanguageKeywords.keywords("ru");
        assertEquals(List.of("То ", "Затем ", "Тогда "), ru.getThen());
    }

    @Test
    void testTotalLookup() {
        assertEquals(LanguageKeywords.english(), LanguageKeywords.keywords("no-such-language"));
        assertNotEquals(LanguageKeywords.english(), LanguageKeywords.keywords("de"));
        assertTrue(LanguageKeywords.registeredLanguages().contains("ko"));
    }

    @Test
    void testImmutable() {
        LanguageKeywords kw = LanguageKeywords.keywords("es");
        assertThrows(UnsupportedOperationException.class, () -> kw.getGiven().add("Foo "));
    }

}
