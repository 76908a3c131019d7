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

import io.gherkinkit.language.GherkinLanguage;
import io.gherkinkit.parser.GherkinParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed document. Instances are immutable and safe to share
 * between threads.
 */
public final class Feature {

    private final int line;
    private final String title;
    private final GherkinLanguage language;
    private final List<Tag> tags;
    private final String description;
    private final Background background;
    private final List<FeatureChild> children;
    private final List<Comment> comments;

    public Feature(int line, String title, GherkinLanguage language, List<Tag> tags, String description,
                   Background background, List<FeatureChild> children, List<Comment> comments) {
        this.line = line;
        this.title = title == null ? "" : title;
        this.language = language == null ? GherkinLanguage.ENGLISH : language;
        this.tags = List.copyOf(tags);
        this.description = description;
        this.background = background;
        this.children = List.copyOf(children);
        this.comments = List.copyOf(comments);
    }

    public static Feature parse(String text) {
        return GherkinParser.parse(text);
    }

    public static Feature read(Path path) {
        return GherkinParser.parse(path);
    }

    public int getLine() {
        return line;
    }

    public String getTitle() {
        return title;
    }

    public GherkinLanguage getLanguage() {
        return language;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public String getDescription() {
        return description;
    }

    public Background getBackground() {
        return background;
    }

    public List<FeatureChild> getChildren() {
        return children;
    }

    public List<Comment> getComments() {
        return comments;
    }

    public List<Scenario> getScenarios() {
        return childrenOfType(Scenario.class);
    }

    public List<ScenarioOutline> getOutlines() {
        return childrenOfType(ScenarioOutline.class);
    }

    public List<Rule> getRules() {
        return childrenOfType(Rule.class);
    }

    private <T extends FeatureChild> List<T> childrenOfType(Class<T> type) {
        List<T> list = new ArrayList<>();
        for (FeatureChild child : children) {
            if (type.isInstance(child)) {
                list.add(type.cast(child));
            }
        }
        return list;
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, language, tags, description, background, children);
    }

    /**
     * Structural equality. Line numbers and comments are not compared.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Feature other = (Feature) obj;
        return title.equals(other.title) && language.equals(other.language) && tags.equals(other.tags)
                && Objects.equals(description, other.description)
                && Objects.equals(background, other.background) && children.equals(other.children);
    }

    @Override
    public String toString() {
        return "Feature: " + title + " (" + language.getCode() + ")";
    }

}
