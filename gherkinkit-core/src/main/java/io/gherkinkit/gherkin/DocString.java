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

public final class DocString {

    private final int line;
    private final String content;
    private final String mediaType;

    public DocString(int line, String content, String mediaType) {
        this.line = line;
        this.content = content == null ? "" : content;
        this.mediaType = mediaType;
    }

    public DocString(String content, String mediaType) {
        this(0, content, mediaType);
    }

    /**
     * @return line of the opening fence
     */
    public int getLine() {
        return line;
    }

    public String getContent() {
        return content;
    }

    /**
     * @return text after the opening fence, e.g. "json", or null
     */
    public String getMediaType() {
        return mediaType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, mediaType);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        DocString other = (DocString) obj;
        return content.equals(other.content) && Objects.equals(mediaType, other.mediaType);
    }

    @Override
    public String toString() {
        return "\"\"\"" + (mediaType == null ? "" : mediaType) + "\n" + content + "\n\"\"\"";
    }

}
