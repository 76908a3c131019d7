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
package io.gherkinkit.parser;

import io.gherkinkit.common.StringUtils;

import java.util.List;

/**
 * Forward-only position over the lines of one document. Owned by a single
 * parse call and never handed out of this package.
 */
class LineCursor {

    private final List<String> lines;
    private int position;

    LineCursor(String text) {
        this.lines = StringUtils.toStringLines(text == null ? "" : text);
    }

    boolean isAtEnd() {
        return position >= lines.size();
    }

    /**
     * @return the raw current line, or null at end of input
     */
    String current() {
        return isAtEnd() ? null : lines.get(position);
    }

    String peekTrimmed() {
        return isAtEnd() ? null : lines.get(position).strip();
    }

    /**
     * 1-based number of the current line. At end of input this is one past
     * the last line, or 1 when the text had no lines at all.
     */
    int currentLineNumber() {
        return position + 1;
    }

    void advance() {
        if (!isAtEnd()) {
            position++;
        }
    }

    /**
     * Up to n lines starting at the current one, without moving.
     */
    List<String> preview(int n) {
        int end = Math.min(lines.size(), position + Math.max(n, 0));
        return lines.subList(position, end);
    }

    int lineCount() {
        return lines.size();
    }

    @Override
    public String toString() {
        return "line " + currentLineNumber() + "/" + lines.size() + ": "
                + StringUtils.truncate(current(), 40, true);
    }

}
