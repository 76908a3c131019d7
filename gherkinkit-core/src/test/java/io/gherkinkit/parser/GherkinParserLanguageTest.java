package io.gherkinkit.parser;

import io.gherkinkit.gherkin.Feature;
import io.gherkinkit.gherkin.Scenario;
import io.gherkinkit.gherkin.Step;
import io.gherkinkit.gherkin.StepKeyword;
import io.gherkinkit.language.GherkinLanguage;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GherkinParserLanguageTest {

    Feature feature;

    private void feature(String text) {
        feature = GherkinParser.parse(text);
    }

    @Test
    void testFrench() {
        feature("# language: fr\nFonctionnalité: Authentification\n  Scénario: Connexion\n"
                + "    Soit un compte valide\n    Quand je me connecte\n    Alors je suis connecté\n");
        assertEquals("fr", feature.getLanguage().getCode());
        assertEquals("French", feature.getLanguage().getName());
        assertEquals("Authentification", feature.getTitle());
        assertTrue(feature.getComments().isEmpty());
        List<Step> steps = feature.getScenarios().get(0).getSteps();
        assertEquals(3, steps.size());
        assertEquals(StepKeyword.GIVEN, steps.get(0).getType());
        assertEquals(StepKeyword.WHEN, steps.get(1).getType());
        assertEquals(StepKeyword.THEN, steps.get(2).getType());
        assertEquals("Soit ", steps.get(0).getKeyword());
        assertEquals("je suis connecté", steps.get(2).getText());
    }

    @Test
    void testFrenchFixture() throws Exception {
        feature = Feature.read(Path.of(getClass().getResource("/features/payload.feature").toURI()));
        assertEquals("fr", feature.getLanguage().getCode());
        List<Step> steps = feature.getScenarios().get(0).getSteps();
        assertEquals("json", steps.get(0).getDocString().getMediaType());
        assertEquals("      {\"nom\": \"test\"}", steps.get(0).getDocString().getContent());
        assertEquals("je l'envoie", steps.get(1).getText());
        assertEquals(List.of("nom", "test"), steps.get(2).getTable().getRows().get(1));
    }

    @Test
    void testSameShapeInEveryLanguage() {
        Map<String, String> texts = new LinkedHashMap<>();
        texts.put("en", """
                Feature: Login
                  Background:
                    Given the application
                  Scenario: Sign in
                    Given an account
                    When signing in
                    Then it works
                """);
        texts.put("fr", """
                # language: fr
                Fonctionnalité: Connexion
                  Contexte:
                    Soit l'application
                  Scénario: Se connecter
                    Soit un compte
                    Quand je me connecte
                    Alors ça marche
                """);
        texts.put("de", """
                # language: de
                Funktionalität: Anmeldung
                  Grundlage:
                    Angenommen die Anwendung
                  Szenario: Anmelden
                    Gegeben sei ein Konto
                    Wenn ich mich anmelde
                    Dann klappt es
                """);
        texts.put("es", """
                # language: es
                Característica: Acceso
                  Antecedentes:
                    Dado la aplicación
                  Escenario: Entrar
                    Dado una cuenta
                    Cuando entro
                    Entonces funciona
                """);
        texts.put("ja", """
                # language: ja
                機能: ログイン
                  背景:
                    前提アプリが起動している
                  シナリオ: サインイン
                    前提アカウントがある
                    もしサインインする
                    ならば成功する
                """);
        texts.put("ru", """
                # language: ru
                Функция: Вход
                  Предыстория:
                    Дано приложение
                  Сценарий: Войти
                    Дано учётная запись
                    Когда я вхожу
                    Тогда всё работает
                """);
        for (Map.Entry<String, String> entry : texts.entrySet()) {
            String code = entry.getKey();
            feature(entry.getValue());
            assertEquals(code, feature.getLanguage().getCode());
            assertEquals(1, feature.getBackground().getSteps().size(), code);
            assertEquals(1, feature.getChildren().size(), code);
            Scenario scenario = feature.getScenarios().get(0);
            List<Step> steps = scenario.getSteps();
            assertEquals(3, steps.size(), code);
            assertEquals(StepKeyword.GIVEN, steps.get(0).getType(), code);
            assertEquals(StepKeyword.WHEN, steps.get(1).getType(), code);
            assertEquals(StepKeyword.THEN, steps.get(2).getType(), code);
            assertFalse(steps.get(0).getText().isEmpty(), code);
        }
        feature(texts.get("ja"));
        assertEquals("サインイン", feature.getScenarios().get(0).getTitle());
        assertEquals("アカウントがある", feature.getScenarios().get(0).getSteps().get(0).getText());
        feature(texts.get("de"));
        assertEquals("Gegeben sei ", feature.getScenarios().get(0).getSteps().get(0).getKeyword());
    }

    @Test
    void testLessCommonLanguages() {
        feature("# language: be\nФункцыянальнасць: f\n  Сцэнарый: s\n    Няхай x\n");
        assertEquals("Belarusian", feature.getLanguage().getName());
        Step step = feature.getScenarios().get(0).getSteps().get(0);
        assertEquals(StepKeyword.GIVEN, step.getType());
        assertEquals("x", step.getText());
        feature("# language: tlh\nQap: f\n  lut: s\n    ghu' noblu' x\n    vaj y\n");
        assertEquals(2, feature.getScenarios().get(0).getSteps().size());
        feature("# language: sr-Cyrl\nФункционалност: f\n  Сценарио: s\n    За дато x\n    Онда y\n");
        assertEquals(StepKeyword.THEN, feature.getScenarios().get(0).getSteps().get(1).getType());
    }

    @Test
    void testEnglishKeywordsNotRecognizedInOtherLanguage() {
        ParserException e = assertThrows(ParserException.class,
                () -> GherkinParser.parse("# language: fr\nFeature: anglais\n"));
        assertEquals(2, e.getLine());
    }

    @Test
    void testUnknownCodeReadsAsEnglish() {
        feature("""
                # language: xx-unknown
                Feature: f
                  Scenario: s
                    Given x
                """);
        GherkinLanguage language = feature.getLanguage();
        assertEquals("xx-unknown", language.getCode());
        assertEquals("xx-unknown", language.getName());
        assertEquals("xx-unknown", language.getNativeName());
        assertFalse(language.isRegistered());
        assertEquals(StepKeyword.GIVEN, feature.getScenarios().get(0).getSteps().get(0).getType());
    }

    @Test
    void testDetectLanguage() {
        assertEquals("en", GherkinParser.detectLanguage("").getCode());
        assertEquals("en", GherkinParser.detectLanguage("Feature: f\n").getCode());
        assertEquals("en", GherkinParser.detectLanguage("# a comment\nFeature: f\n").getCode());
        assertEquals("de", GherkinParser.detectLanguage("#language:de\nFunktionalität: f\n").getCode());
        assertEquals("de", GherkinParser.detectLanguage("   #   LANGUAGE:   de   \n").getCode());
        assertEquals("ja", GherkinParser.detectLanguage("# comment\n# language: ja\n# language: fr\n").getCode());
        assertEquals("en", GherkinParser.detectLanguage("# language:\nFeature: f\n").getCode());
        assertEquals("en", GherkinParser.detectLanguage("# langue: fr\n").getCode());
        GherkinLanguage unknown = GherkinParser.detectLanguage("# language: qya\n");
        assertEquals("qya", unknown.getCode());
        assertEquals(unknown, GherkinParser.detectLanguage("# language: qya\n"));
    }

    @Test
    void testDirectiveWindow() {
        String nine = "\n".repeat(9);
        assertEquals("fr", GherkinParser.detectLanguage(nine + "# language: fr\n").getCode());
        String ten = "\n".repeat(10);
        assertEquals("en", GherkinParser.detectLanguage(ten + "# language: fr\n").getCode());
        feature(ten + "# language: fr\nFeature: still english\n");
        assertEquals("en", feature.getLanguage().getCode());
        assertEquals("still english", feature.getTitle());
        assertTrue(feature.getComments().isEmpty());
    }

}
