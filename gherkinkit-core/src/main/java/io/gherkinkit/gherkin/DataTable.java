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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pipe-delimited rows attached to a step or an examples block. The first row
 * is usually a header but nothing here depends on that.
 */
public final class DataTable {

    private final int line;
    private final List<List<String>> rows;

    public DataTable(int line, List<List<String>> rows) {
        this.line = line;
        List<List<String>> temp = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            temp.add(List.copyOf(row));
        }
        this.rows = Collections.unmodifiableList(temp);
    }

    public DataTable(List<List<String>> rows) {
        this(0, rows);
    }

    /**
     * @return line of the first row, 0 if not parsed from text
     */
    public int getLine() {
        return line;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> getHeaders() {
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<List<String>> getDataRows() {
        return rows.size() > 1 ? rows.subList(1, rows.size()) : Collections.emptyList();
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return rows.equals(((DataTable) obj).rows);
    }

    @Override
    public String toString() {
        return rows.toString();
    }

}
