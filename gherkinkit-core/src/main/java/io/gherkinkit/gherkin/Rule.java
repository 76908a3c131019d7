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

public final class Rule implements FeatureChild {

    private final int line;
    private final String title;
    private final List<Tag> tags;
    private final String description;
    private final Background background;
    private final List<RuleChild> children;

    public Rule(int line, String title, List<Tag> tags, String description,
                Background background, List<RuleChild> children) {
        this.line = line;
        this.title = title == null ? "" : title;
        this.tags = List.copyOf(tags);
        this.description = description;
        this.background = background;
        this.children = List.copyOf(children);
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

    /**
     * @return the background that applies only inside this rule, or null
     */
    public Background getBackground() {
        return background;
    }

    public List<RuleChild> getChildren() {
        return children;
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, tags, description, background, children);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Rule other = (Rule) obj;
        return title.equals(other.title) && tags.equals(other.tags)
                && Objects.equals(description, other.description)
                && Objects.equals(background, other.background) && children.equals(other.children);
    }

    @Override
    public String toString() {
        return "Rule: " + title + " [line " + line + "]";
    }

}
