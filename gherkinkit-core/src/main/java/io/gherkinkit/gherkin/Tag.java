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

import io.gherkinkit.common.StringUtils;

import java.util.Collections;
import java.util.List;

public final class Tag {

    private final int line;
    private final String text;
    private final String name;
    private final List<String> values;

    /**
     * @param text the tag as written, the leading '@' is optional
     */
    public Tag(int line, String text) {
        if (text == null) {
            throw new IllegalArgumentException("tag text must not be null");
        }
        this.line = line;
        this.text = text.startsWith("@") ? text.substring(1) : text;
        if (this.text.isEmpty()) {
            throw new IllegalArgumentException("tag must not be empty");
        }
        int pos = this.text.indexOf('=');
        if (pos != -1) {
            name = this.text.substring(0, pos);
            String temp = this.text.substring(pos + 1);
            if (temp.isEmpty()) { // edge case '@id='
                values = Collections.emptyList();
            } else {
                values = List.copyOf(StringUtils.split(temp, ',', false));
            }
        } else {
            name = this.text;
            values = Collections.emptyList();
        }
    }

    public Tag(String text) {
        this(0, text);
    }

    public int getLine() {
        return line;
    }

    /**
     * @return the full label without the '@' marker, e.g. "env=dev,qa"
     */
    public String getText() {
        return text;
    }

    public String getName() {
        return name;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return '@' + text;
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final Tag other = (Tag) obj;
        return text.equals(other.text);
    }

}
