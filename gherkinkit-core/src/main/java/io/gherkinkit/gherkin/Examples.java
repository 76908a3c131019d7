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
 * One block of values for a {@link ScenarioOutline}. An examples block with
 * no rows carries an empty table, never null.
 */
public final class Examples {

    private final int line;
    private final String name;
    private final List<Tag> tags;
    private final DataTable table;

    public Examples(int line, String name, List<Tag> tags, DataTable table) {
        if (table == null) {
            throw new IllegalArgumentException("examples table must not be null");
        }
        this.line = line;
        this.name = name;
        this.tags = List.copyOf(tags);
        this.table = table;
    }

    public int getLine() {
        return line;
    }

    public String getName() {
        return name;
    }

    public List<Tag> getTags() {
        return tags;
    }

    public DataTable getTable() {
        return table;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tags, table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Examples other = (Examples) obj;
        return Objects.equals(name, other.name) && tags.equals(other.tags) && table.equals(other.table);
    }

    @Override
    public String toString() {
        return "Examples: " + (name == null ? "" : name) + " " + table;
    }

}
