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

public final class Scenario implements FeatureChild, RuleChild {

    private final int line;
    private final String title;
    private final List<Tag> tags;
    private final String description;
    private final List<Step> steps;

    public Scenario(int line, String title, List<Tag> tags, String description, List<Step> steps) {
        this.line = line;
        this.title = title == null ? "" : title;
        this.tags = List.copyOf(tags);
        this.description = description;
        this.steps = List.copyOf(steps);
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

    public boolean hasTag(String name) {
        for (Tag tag : tags) {
            if (tag.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, tags, description, steps);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Scenario other = (Scenario) obj;
        return title.equals(other.title) && tags.equals(other.tags)
                && Objects.equals(description, other.description) && steps.equals(other.steps);
    }

    @Override
    public String toString() {
        return "Scenario: " + title + " [line " + line + "]";
    }

}
