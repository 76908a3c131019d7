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
package io.gherkinkit.language;

import java.util.List;

/**
 * A Gherkin dialect, identified by its code ("en", "fr", "zh-CN" ...).
 * <p>
 * Two languages are equal when their codes are equal. A language built from
 * an unknown code is still a valid value: it records the code as written and
 * reads with the English keywords.
 */
public final class GherkinLanguage {

    public static final String DEFAULT_CODE = "en";

    public static final GherkinLanguage ENGLISH = new GherkinLanguage(DEFAULT_CODE, "English", "English");

    private final String code;
    private final String name;
    private final String nativeName;

    public GherkinLanguage(String code, String name, String nativeName) {
        if (code == null || code.isEmpty()) {
            throw new IllegalArgumentException("language code must not be empty");
        }
        this.code = code;
        this.name = name == null ? code : name;
        this.nativeName = nativeName == null ? code : nativeName;
    }

    /**
     * @return the registered language, or null if the code is unknown
     */
    public static GherkinLanguage of(String code) {
        return LanguageRegistry.shared().getLanguage(code);
    }

    /**
     * Registered language for the code, or a language that carries the
     * literal code with the code standing in for both names.
     */
    public static GherkinLanguage forCode(String code) {
        GherkinLanguage language = of(code);
        return language == null ? new GherkinLanguage(code, code, code) : language;
    }

    public static List<GherkinLanguage> all() {
        return LanguageRegistry.shared().getLanguages();
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getNativeName() {
        return nativeName;
    }

    public boolean isRegistered() {
        return LanguageRegistry.shared().getLanguage(code) != null;
    }

    public LanguageKeywords getKeywords() {
        return LanguageKeywords.keywords(code);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return code.equals(((GherkinLanguage) obj).code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return name + " (" + code + ")";
    }

}
