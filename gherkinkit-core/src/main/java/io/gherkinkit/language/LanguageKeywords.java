/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.gherkinkit.language;

import java.util.List;
import java.util.Objects;

/**
 * Localized spellings for every Gherkin construct of one language.
 * <p>
 * Each construct maps to an ordered list of synonyms. Any entry is accepted
 * when reading, the first entry is the canonical spelling used when writing.
 * Block keywords (feature, scenario, ...) are stored without the trailing
 * colon. Step keywords are stored with their trailing space where the
 * language uses one (for example "Given " but "前提"), and never contain the
 * "* " wildcard.
 */
public final class LanguageKeywords {

    private final List<String> feature;
    private final List<String> rule;
    private final List<String> background;
    private final List<String> scenario;
    private final List<String> scenarioOutline;
    private final List<String> examples;
    private final List<String> given;
    private final List<String> when;
    private final List<String> then;
    private final List<String> and;
    private final List<String> but;

    public LanguageKeywords(List<String> feature, List<String> rule, List<String> background,
                            List<String> scenario, List<String> scenarioOutline, List<String> examples,
                            List<String> given, List<String> when, List<String> then,
                            List<String> and, List<String> but) {
        this.feature = List.copyOf(feature);
        this.rule = List.copyOf(rule);
        this.background = List.copyOf(background);
        this.scenario = List.copyOf(scenario);
        this.scenarioOutline = List.copyOf(scenarioOutline);
        this.examples = List.copyOf(examples);
        this.given = List.copyOf(given);
        this.when = List.copyOf(when);
        this.then = List.copyOf(then);
        this.and = List.copyOf(and);
        this.but = List.copyOf(but);
    }

    /**
     * Never fails: unknown codes get the English table.
     */
    public static LanguageKeywords keywords(String code) {
        return LanguageRegistry.shared().getKeywords(code);
    }

    public static LanguageKeywords english() {
        return keywords(GherkinLanguage.DEFAULT_CODE);
    }

    /**
     * @return all language codes with a keyword table, sorted
     */
    public static List<String> registeredLanguages() {
        return LanguageRegistry.shared().getCodes();
    }

    public List<String> getFeature() {
        return feature;
    }

    public List<String> getRule() {
        return rule;
    }

    public List<String> getBackground() {
        return background;
    }

    public List<String> getScenario() {
        return scenario;
    }

    public List<String> getScenarioOutline() {
        return scenarioOutline;
    }

    public List<String> getExamples() {
        return examples;
    }

    public List<String> getGiven() {
        return given;
    }

    public List<String> getWhen() {
        return when;
    }

    public List<String> getThen() {
        return then;
    }

    public List<String> getAnd() {
        return and;
    }

    public List<String> getBut() {
        return but;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        LanguageKeywords other = (LanguageKeywords) obj;
        return feature.equals(other.feature) && rule.equals(other.rule)
                && background.equals(other.background) && scenario.equals(other.scenario)
                && scenarioOutline.equals(other.scenarioOutline) && examples.equals(other.examples)
                && given.equals(other.given) && when.equals(other.when) && then.equals(other.then)
                && and.equals(other.and) && but.equals(other.but);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feature, rule, background, scenario, scenarioOutline, examples, given, when, then, and, but);
    }

    @Override
    public String toString() {
        return "feature: " + feature + ", scenario: " + scenario + ", given: " + given;
    }

}
