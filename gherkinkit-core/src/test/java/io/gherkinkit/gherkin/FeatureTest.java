package io.gherkinkit.gherkin;

import io.gherkinkit.language.GherkinLanguage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureTest {

    @Test
    void testChildViews() {
        Scenario scenario = new Scenario(2, "s", List.of(), null, List.of(new Step(StepKeyword.GIVEN, "x")));
        ScenarioOutline outline = new ScenarioOutline(4, "o", List.of(), null, List.of(),
                List.of(new Examples(5, null, List.of(), new DataTable(List.of(List.of("a"), List.of("1"))))));
        Rule rule = new Rule(8, "r", List.of(), null, null, List.of(scenario));
        Feature feature = new Feature(1, "f", null, List.of(), null, null,
                List.of(scenario, outline, rule), List.of(new Comment(1, "# note")));
        assertEquals(GherkinLanguage.ENGLISH, feature.getLanguage());
        assertEquals(List.of(scenario), feature.getScenarios());
        assertEquals(List.of(outline), feature.getOutlines());
        assertEquals(List.of(rule), feature.getRules());
        assertEquals(1, outline.getExampleRowCount());
        assertEquals("note", feature.getComments().get(0).getText());
        assertEquals("Feature: f (en)", feature.toString());
    }

    @Test
    void testParseShortcut() {
        Feature feature = Feature.parse("Feature: quick\n  Scenario: s\n    Then done\n");
        assertEquals("quick", feature.getTitle());
        FeatureChild child = feature.getChildren().get(0);
        assertInstanceOf(Scenario.class, child);
        assertEquals(1, ((Scenario) child).getSteps().size());
    }

    @Test
    void testStructuralEquality() {
        Feature a = Feature.parse("# one\nFeature: f\n  Scenario: s\n    Given x\n");
        Feature b = Feature.parse("Feature: f\n\n\n  Scenario: s\n    # two\n    Given x\n");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, Feature.parse("Feature: f\n  Scenario: s\n    Given y\n"));
    }

}
