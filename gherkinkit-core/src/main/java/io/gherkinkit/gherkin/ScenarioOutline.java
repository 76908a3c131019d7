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
package io.gherkinkit.gherkin;

import java.util.List;
import java.util.Objects;

/**
 * A templated scenario. Placeholders such as {@code <name>} are left in the
 * step text untouched and are not checked against the examples headers.
 */
public final class ScenarioOutline implements FeatureChild, RuleChild {

    private final int line;
    private final String title;
    private final List<Tag> tags;
    private final String description;
    private final List<Step> steps;
    private final List<Examples> examples;

    public ScenarioOutline(int line, String title, List<Tag> tags, String description,
                           List<Step> steps, List<Examples> examples) {
        this.line = line;
        this.title = title == null ? "" : title;
        this.tags = List.copyOf(tags);
        this.description = description;
        this.steps = List.copyOf(steps);
        this.examples = List.copyOf(examples);
    }

    @Override
    public int getLine() {
        return line;
    }

    @Override
    public String getTitle() {
        return title;
    }

    @Override
    public List<Tag> getTags() {
        return tags;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public List<Step> getSteps() {
        return steps;
    }

    public List<Examples> getExamples() {
        return examples;
    }

    /**
     * @return data rows across all examples blocks, headers excluded
     */
    public int getExampleRowCount() {
        int count = 0;
        for (Examples e : examples) {
            count += e.getTable().getDataRows().size();
        }
        return count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, tags, description, steps, examples);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        ScenarioOutline other = (ScenarioOutline) obj;
        return title.equals(other.title) && tags.equals(other.tags)
                && Objects.equals(description, other.description)
                && steps.equals(other.steps) && examples.equals(other.examples);
    }

    @Override
    public String toString() {
        return "Scenario Outline: " + title + " [line " + line + "]";
    }

}
