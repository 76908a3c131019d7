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

import io.gherkinkit.language.GherkinLanguage;

import java.util.List;

/**
 * Finds the {@code # language: xx} directive.
 */
class LanguageResolver {

    static final int DIRECTIVE_WINDOW = 10;

    private static final String DIRECTIVE = "language:";

    private LanguageResolver() {
        // only static methods
    }

    static GherkinLanguage detect(LineCursor cursor) {
        List<String> head = cursor.preview(DIRECTIVE_WINDOW);
        for (String line : head) {
            String code = directiveCode(line);
            if (code != null) {
                return GherkinLanguage.forCode(code);
            }
        }
        return GherkinLanguage.ENGLISH;
    }

    static boolean isDirective(String line) {
        return directiveBody(line) != null;
    }

    /**
     * @return the trimmed code, or null if the line is not a directive or
     * names no code
     */
    static String directiveCode(String line) {
        String body = directiveBody(line);
        if (body == null) {
            return null;
        }
        String code = body.substring(DIRECTIVE.length()).strip();
        return code.isEmpty() ? null : code;
    }

    private static String directiveBody(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.strip();
        if (!trimmed.startsWith("#")) {
            return null;
        }
        String rest = trimmed.substring(1).strip();
        if (!rest.regionMatches(true, 0, DIRECTIVE, 0, DIRECTIVE.length())) {
            return null;
        }
        return rest;
    }

}
