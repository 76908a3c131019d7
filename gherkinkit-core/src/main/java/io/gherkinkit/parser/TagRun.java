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

import io.gherkinkit.gherkin.Tag;

import java.util.ArrayList;
import java.util.List;

/**
 * Tags waiting for the element they belong to. Tags on consecutive lines
 * accumulate, a tag line after any gap starts a new run that replaces the
 * pending one. One instance is shared by every production of a parse so that
 * a run collected at the end of a rule or an outline reaches the next element
 * of the enclosing block.
 */
class TagRun {

    private final List<Tag> tags = new ArrayList<>();
    private int lastLine = -1;

    void add(int line, List<Tag> lineTags) {
        if (line != lastLine + 1) {
            tags.clear();
        }
        tags.addAll(lineTags);
        lastLine = line;
    }

    List<Tag> take() {
        List<Tag> result = List.copyOf(tags);
        clear();
        return result;
    }

    void clear() {
        tags.clear();
        lastLine = -1;
    }

    boolean isEmpty() {
        return tags.isEmpty();
    }

    int getLastLine() {
        return lastLine;
    }

    @Override
    public String toString() {
        return tags.toString();
    }

}
