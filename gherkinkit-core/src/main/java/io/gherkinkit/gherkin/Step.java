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

import java.util.Objects;

public final class Step {

    private final int line;
    private final StepKeyword type;
    private final String keyword;
    private final String text;
    private final DataTable table;
    private final DocString docString;

    /**
     * @param keyword the spelling that matched in the source, e.g. "Soit " or "* "
     */
    public Step(int line, StepKeyword type, String keyword, String text, DataTable table, DocString docString) {
        if (type == null) {
            throw new IllegalArgumentException("step keyword type must not be null");
        }
        if (table != null && docString != null) {
            throw new IllegalArgumentException("a step can have a data table or a doc string, not both");
        }
        this.line = line;
        this.type = type;
        this.keyword = keyword;
        this.text = text == null ? "" : text;
        this.table = table;
        this.docString = docString;
    }

    public Step(StepKeyword type, String text) {
        this(0, type, null, text, null, null);
    }

    public int getLine() {
        return line;
    }

    public StepKeyword getType() {
        return type;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getText() {
        return text;
    }

    public DataTable getTable() {
        return table;
    }

    public DocString getDocString() {
        return docString;
    }

    public Step withTable(DataTable table) {
        return new Step(line, type, keyword, text, table, docString);
    }

    public Step withDocString(DocString docString) {
        return new Step(line, type, keyword, text, table, docString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, table, docString);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Step other = (Step) obj;
        return type == other.type && text.equals(other.text)
                && Objects.equals(table, other.table) && Objects.equals(docString, other.docString);
    }

    @Override
    public String toString() {
        return (keyword == null ? type.name() + " " : keyword) + text;
    }

}
