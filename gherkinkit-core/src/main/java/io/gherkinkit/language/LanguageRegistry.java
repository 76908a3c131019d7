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

import io.gherkinkit.common.FileUtils;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All keyword tables, loaded once from a JSON classpath resource that has the
 * shape of the Cucumber "gherkin-languages.json" file:
 * <pre>
 * { "fr": { "name": "French", "native": "français",
 *           "feature": ["Fonctionnalité"], "given": ["* ", "Soit "], ... } }
 * </pre>
 * The location can be changed with the {@value #RESOURCE_PROPERTY} system
 * property. When the resource is missing or unreadable the registry holds
 * only the built-in English table.
 */
public class LanguageRegistry {

    static final Logger logger = LoggerFactory.getLogger(LanguageRegistry.class);

    public static final String RESOURCE_PROPERTY = "gherkinkit.languages";
    public static final String DEFAULT_RESOURCE = "gherkin-languages.json";

    private static final String WILDCARD = "* ";

    static final LanguageKeywords FALLBACK_ENGLISH = new LanguageKeywords(
            List.of("Feature"),
            List.of("Rule"),
            List.of("Background"),
            List.of("Scenario"),
            List.of("Scenario Outline", "Scenario Template"),
            List.of("Examples", "Scenarios"),
            List.of("Given "),
            List.of("When "),
            List.of("Then "),
            List.of("And "),
            List.of("But "));

    private final Map<String, LanguageKeywords> keywords;
    private final Map<String, GherkinLanguage> languages;

    private LanguageRegistry(Map<String, LanguageKeywords> keywords, Map<String, GherkinLanguage> languages) {
        this.keywords = Collections.unmodifiableMap(keywords);
        this.languages = Collections.unmodifiableMap(languages);
    }

    private static class Holder {
        static final LanguageRegistry INSTANCE = load(System.getProperty(RESOURCE_PROPERTY, DEFAULT_RESOURCE));
    }

    public static LanguageRegistry shared() {
        return Holder.INSTANCE;
    }

    public static LanguageRegistry load(String resourcePath) {
        InputStream is = LanguageRegistry.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            logger.warn("keyword resource not found on classpath: {}, only english will be available", resourcePath);
            return englishOnly();
        }
        return load(resourcePath, is);
    }

    /**
     * Reads and closes the stream. Read failures give the english-only registry.
     */
    static LanguageRegistry load(String resourcePath, InputStream is) {
        String json;
        try (is) {
            json = FileUtils.toString(is);
        } catch (IOException | UncheckedIOException e) {
            logger.error("failed to read keyword resource: {}", resourcePath, e);
            return englishOnly();
        }
        Object parsed;
        try {
            parsed = JSONValue.parseWithException(json);
        } catch (ParseException e) {
            logger.error("invalid json in keyword resource: {}", resourcePath, e);
            return englishOnly();
        }
        if (!(parsed instanceof Map)) {
            logger.error("keyword resource is not a json object: {}", resourcePath);
            return englishOnly();
        }
        Map<String, LanguageKeywords> keywordsMap = new TreeMap<>();
        Map<String, GherkinLanguage> languagesMap = new TreeMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) parsed).entrySet()) {
            String code = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map)) {
                logger.warn("skipping language '{}': entry is not a json object", code);
                continue;
            }
            Map<?, ?> map = (Map<?, ?>) entry.getValue();
            LanguageKeywords kw = toKeywords(code, map);
            if (kw == null) {
                continue;
            }
            keywordsMap.put(code, kw);
            languagesMap.put(code, new GherkinLanguage(code, asString(map.get("name")), asString(map.get("native"))));
        }
        if (!keywordsMap.containsKey(GherkinLanguage.DEFAULT_CODE)) {
            logger.warn("keyword resource {} has no english entry, using built-in", resourcePath);
            keywordsMap.put(GherkinLanguage.DEFAULT_CODE, FALLBACK_ENGLISH);
            languagesMap.put(GherkinLanguage.DEFAULT_CODE, GherkinLanguage.ENGLISH);
        }
        logger.debug("loaded {} languages from {}", keywordsMap.size(), resourcePath);
        return new LanguageRegistry(keywordsMap, languagesMap);
    }

    private static LanguageRegistry englishOnly() {
        Map<String, LanguageKeywords> keywordsMap = new TreeMap<>();
        keywordsMap.put(GherkinLanguage.DEFAULT_CODE, FALLBACK_ENGLISH);
        Map<String, GherkinLanguage> languagesMap = new TreeMap<>();
        languagesMap.put(GherkinLanguage.DEFAULT_CODE, GherkinLanguage.ENGLISH);
        return new LanguageRegistry(keywordsMap, languagesMap);
    }

    private static LanguageKeywords toKeywords(String code, Map<?, ?> map) {
        List<String> feature = toList(map.get("feature"));
        List<String> rule = toList(map.get("rule"));
        List<String> background = toList(map.get("background"));
        List<String> scenario = toList(map.get("scenario"));
        List<String> scenarioOutline = toList(map.get("scenarioOutline"));
        List<String> examples = toList(map.get("examples"));
        List<String> given = toList(map.get("given"));
        List<String> when = toList(map.get("when"));
        List<String> then = toList(map.get("then"));
        List<String> and = toList(map.get("and"));
        List<String> but = toList(map.get("but"));
        if (feature == null || rule == null || background == null || scenario == null || scenarioOutline == null
                || examples == null || given == null || when == null || then == null || and == null || but == null) {
            logger.warn("skipping language '{}': incomplete keyword set", code);
            return null;
        }
        return new LanguageKeywords(feature, rule, background, scenario, scenarioOutline, examples,
                withoutWildcard(given), withoutWildcard(when), withoutWildcard(then),
                withoutWildcard(and), withoutWildcard(but));
    }

    private static List<String> toList(Object value) {
        if (!(value instanceof List)) {
            return null;
        }
        List<String> list = new ArrayList<>();
        for (Object o : (List<?>) value) {
            if (o != null) {
                list.add(o.toString());
            }
        }
        return list;
    }

    private static List<String> withoutWildcard(List<String> keywords) {
        List<String> list = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            if (!WILDCARD.equals(keyword)) {
                list.add(keyword);
            }
        }
        return list;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    public LanguageKeywords getKeywords(String code) {
        LanguageKeywords kw = code == null ? null : keywords.get(code);
        if (kw != null) {
            return kw;
        }
        kw = keywords.get(GherkinLanguage.DEFAULT_CODE);
        return kw == null ? FALLBACK_ENGLISH : kw;
    }

    public GherkinLanguage getLanguage(String code) {
        return code == null ? null : languages.get(code);
    }

    public boolean isRegistered(String code) {
        return code != null && keywords.containsKey(code);
    }

    public List<String> getCodes() {
        return List.copyOf(keywords.keySet());
    }

    public List<GherkinLanguage> getLanguages() {
        return List.copyOf(languages.values());
    }

}
