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

public final class Background {

    private final int line;
    private final String name;
    private final String description;
    private final List<Step> steps;

    public Background(int line, String name, String description, List<Step> steps) {
        this.line = line;
        this.name = name;
        this.description = description;
        this.steps = List.copyOf(steps);
    }

    public int getLine() {
        return line;
    }

    /**
     * @return text after the keyword, or null when there is none
     */
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<Step> getSteps() {
        return steps;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, steps);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Background other = (Background) obj;
        return Objects.equals(name, other.name) && Objects.equals(description, other.description)
                && steps.equals(other.steps);
    }

    @Override
    public String toString() {
        return "Background: " + (name == null ? "" : name) + " " + steps.size() + " step(s)";
    }

}
