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

import io.gherkinkit.common.FileUtils;
import io.gherkinkit.common.StringUtils;
import io.gherkinkit.gherkin.Background;
import io.gherkinkit.gherkin.Comment;
import io.gherkinkit.gherkin.DataTable;
import io.gherkinkit.gherkin.DocString;
import io.gherkinkit.gherkin.Examples;
import io.gherkinkit.gherkin.Feature;
import io.gherkinkit.gherkin.FeatureChild;
import io.gherkinkit.gherkin.Rule;
import io.gherkinkit.gherkin.RuleChild;
import io.gherkinkit.gherkin.Scenario;
import io.gherkinkit.gherkin.ScenarioOutline;
import io.gherkinkit.gherkin.Step;
import io.gherkinkit.gherkin.StepKeyword;
import io.gherkinkit.gherkin.Tag;
import io.gherkinkit.language.GherkinLanguage;
import io.gherkinkit.language.LanguageKeywords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line-oriented recursive descent parser for Gherkin documents.
 * <p>
 * Structure comes from keyword transitions and blank lines only, indentation
 * is ignored. The keyword table is chosen by the {@code # language:}
 * directive in the first ten lines, English when there is none. Every
 * production receives the cursor, the keyword table and the pending tag run
 * explicitly, nothing is kept between calls, so one parser can serve any
 * number of threads.
 */
public class GherkinParser {

    static final Logger logger = LoggerFactory.getLogger(GherkinParser.class);

    private static final String WILDCARD = "* ";
    private static final String FENCE = "\"\"\"";

    private static final StepKeyword[] STEP_ORDER = {
            StepKeyword.GIVEN, StepKeyword.WHEN, StepKeyword.THEN, StepKeyword.AND, StepKeyword.BUT
    };

    private GherkinParser() {
        // only static methods
    }

    public static Feature parse(String text) {
        LineCursor cursor = new LineCursor(text);
        GherkinLanguage language = LanguageResolver.detect(cursor);
        if (!language.isRegistered()) {
            logger.debug("unknown language '{}', reading with english keywords", language.getCode());
        }
        Feature feature = feature(cursor, language, language.getKeywords(), new TagRun());
        if (logger.isDebugEnabled()) {
            logger.debug("parsed feature '{}' ({}) with {} children from {} lines", feature.getTitle(),
                    language.getCode(), feature.getChildren().size(), cursor.lineCount());
        }
        return feature;
    }

    public static Feature parse(Path path) {
        String text;
        try {
            text = FileUtils.toString(path);
        } catch (CharacterCodingException e) {
            throw new ImportException(path.toString(), "content is not valid UTF-8", e);
        } catch (NoSuchFileException e) {
            throw new ImportException(path.toString(), "file not found", e);
        } catch (AccessDeniedException e) {
            throw new ImportException(path.toString(), "permission denied", e);
        } catch (IOException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw new ImportException(path.toString(), reason, e);
        }
        logger.debug("parsing file: {}", path);
        return parse(text);
    }

    /**
     * Never fails. An unknown code is returned as written, see
     * {@link GherkinLanguage#forCode(String)}.
     */
    public static GherkinLanguage detectLanguage(String text) {
        return LanguageResolver.detect(new LineCursor(text));
    }

    //==================================================================================================================
    //
    private static Feature feature(LineCursor cursor, GherkinLanguage language, LanguageKeywords kw, TagRun pending) {
        List<Comment> comments = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            String line = cursor.peekTrimmed();
            if (line.isEmpty() || LanguageResolver.isDirective(line)) {
                cursor.advance();
            } else if (line.startsWith("#")) {
                comments.add(new Comment(cursor.currentLineNumber(), line));
                cursor.advance();
            } else if (line.startsWith("@")) {
                pending.add(cursor.currentLineNumber(), tags(cursor.currentLineNumber(), line));
                cursor.advance();
            } else {
                break;
            }
        }
        if (cursor.isAtEnd()) {
            throw new ParserException("expected Feature keyword", cursor.currentLineNumber());
        }
        String header = cursor.peekTrimmed();
        String title = matchKeyword(header, kw.getFeature());
        if (title == null) {
            throw new ParserException("expected Feature keyword, found '"
                    + StringUtils.truncate(header, 60, true) + "'", cursor.currentLineNumber());
        }
        int featureLine = cursor.currentLineNumber();
        List<Tag> tags = pending.take();
        cursor.advance();
        String description = description(cursor, kw);
        Background background = null;
        List<FeatureChild> children = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            String line = cursor.peekTrimmed();
            int number = cursor.currentLineNumber();
            if (line.isEmpty()) {
                cursor.advance();
            } else if (line.startsWith("#")) {
                if (!LanguageResolver.isDirective(line)) {
                    comments.add(new Comment(number, line));
                }
                cursor.advance();
            } else if (line.startsWith("@")) {
                pending.add(number, tags(number, line));
                cursor.advance();
            } else if (matchKeyword(line, kw.getBackground()) != null) {
                if (background != null) {
                    throw duplicateBackground(background, number);
                }
                background = background(cursor, kw, pending);
            } else if (matchKeyword(line, kw.getScenarioOutline()) != null) {
                children.add(outline(cursor, kw, pending));
            } else if (matchKeyword(line, kw.getScenario()) != null) {
                children.add(scenario(cursor, kw, pending));
            } else if (matchKeyword(line, kw.getRule()) != null) {
                children.add(rule(cursor, kw, pending));
            } else {
                throw new ParserException("unexpected keyword, expected Background, Scenario, Scenario Outline or Rule: '"
                        + StringUtils.truncate(line, 60, true) + "'", number);
            }
        }
        if (!pending.isEmpty()) {
            logger.warn("line {}: tags not followed by any element: {}", pending.getLastLine(), pending);
        }
        return new Feature(featureLine, title, language, tags, description, background, children, comments);
    }

    private static Background background(LineCursor cursor, LanguageKeywords kw, TagRun pending) {
        int line = cursor.currentLineNumber();
        String name = matchKeyword(cursor.peekTrimmed(), kw.getBackground());
        if (!pending.isEmpty()) {
            logger.warn("line {}: tags before Background are ignored: {}", line, pending);
            pending.clear();
        }
        cursor.advance();
        String description = description(cursor, kw);
        List<Step> steps = steps(cursor, kw);
        return new Background(line, StringUtils.trimToNull(name), description, steps);
    }

    private static Scenario scenario(LineCursor cursor, LanguageKeywords kw, TagRun pending) {
        int line = cursor.currentLineNumber();
        String title = matchKeyword(cursor.peekTrimmed(), kw.getScenario());
        List<Tag> tags = pending.take();
        cursor.advance();
        String description = description(cursor, kw);
        List<Step> steps = steps(cursor, kw);
        return new Scenario(line, title, tags, description, steps);
    }

    private static ScenarioOutline outline(LineCursor cursor, LanguageKeywords kw, TagRun pending) {
        int line = cursor.currentLineNumber();
        String title = matchKeyword(cursor.peekTrimmed(), kw.getScenarioOutline());
        List<Tag> tags = pending.take();
        cursor.advance();
        String description = description(cursor, kw);
        List<Step> steps = steps(cursor, kw);
        List<Examples> examples = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            String text = cursor.peekTrimmed();
            int number = cursor.currentLineNumber();
            if (text.isEmpty() || text.startsWith("#")) {
                cursor.advance();
                continue;
            }
            if (text.startsWith("@")) {
                // if no examples follow, the run stays pending for the enclosing block
                pending.add(number, tags(number, text));
                cursor.advance();
                continue;
            }
            String name = matchKeyword(text, kw.getExamples());
            if (name == null) {
                break;
            }
            List<Tag> examplesTags = pending.take();
            cursor.advance();
            DataTable table = table(cursor);
            examples.add(new Examples(number, StringUtils.trimToNull(name), examplesTags, table));
        }
        return new ScenarioOutline(line, title, tags, description, steps, examples);
    }

    private static Rule rule(LineCursor cursor, LanguageKeywords kw, TagRun pending) {
        int line = cursor.currentLineNumber();
        String title = matchKeyword(cursor.peekTrimmed(), kw.getRule());
        List<Tag> tags = pending.take();
        cursor.advance();
        String description = description(cursor, kw);
        Background background = null;
        List<RuleChild> children = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            String text = cursor.peekTrimmed();
            int number = cursor.currentLineNumber();
            if (text.isEmpty() || text.startsWith("#")) {
                cursor.advance();
            } else if (text.startsWith("@")) {
                pending.add(number, tags(number, text));
                cursor.advance();
            } else if (matchKeyword(text, kw.getFeature()) != null || matchKeyword(text, kw.getRule()) != null) {
                break;
            } else if (matchKeyword(text, kw.getBackground()) != null) {
                if (background != null) {
                    throw duplicateBackground(background, number);
                }
                background = background(cursor, kw, pending);
            } else if (matchKeyword(text, kw.getScenarioOutline()) != null) {
                children.add(outline(cursor, kw, pending));
            } else if (matchKeyword(text, kw.getScenario()) != null) {
                children.add(scenario(cursor, kw, pending));
            } else {
                break; // reported by the feature loop
            }
        }
        return new Rule(line, title, tags, description, background, children);
    }

    private static ParserException duplicateBackground(Background first, int line) {
        return new ParserException("duplicate Background, already declared at line " + first.getLine(), line);
    }

    private static List<Step> steps(LineCursor cursor, LanguageKeywords kw) {
        List<Step> steps = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            String text = cursor.peekTrimmed();
            if (text.isEmpty() || text.startsWith("#")) {
                cursor.advance();
                continue;
            }
            Step step = step(cursor.currentLineNumber(), text, kw);
            if (step == null) {
                break;
            }
            cursor.advance();
            if (!cursor.isAtEnd()) {
                String next = cursor.peekTrimmed();
                if (next.startsWith(FENCE)) {
                    step = step.withDocString(docString(cursor));
                } else if (next.startsWith("|")) {
                    step = step.withTable(table(cursor));
                }
            }
            steps.add(step);
        }
        return steps;
    }

    private static Step step(int line, String text, LanguageKeywords kw) {
        if (text.startsWith(WILDCARD)) {
            return new Step(line, StepKeyword.WILDCARD, WILDCARD, text.substring(WILDCARD.length()).strip(), null, null);
        }
        for (StepKeyword type : STEP_ORDER) {
            for (String keyword : stepKeywords(type, kw)) {
                if (text.startsWith(keyword)) {
                    return new Step(line, type, keyword, text.substring(keyword.length()).strip(), null, null);
                }
            }
        }
        return null;
    }

    private static List<String> stepKeywords(StepKeyword type, LanguageKeywords kw) {
        return switch (type) {
            case GIVEN -> kw.getGiven();
            case WHEN -> kw.getWhen();
            case THEN -> kw.getThen();
            case AND -> kw.getAnd();
            case BUT -> kw.getBut();
            case WILDCARD -> Collections.emptyList();
        };
    }

    private static DocString docString(LineCursor cursor) {
        int line = cursor.currentLineNumber();
        String mediaType = StringUtils.trimToNull(cursor.peekTrimmed().substring(FENCE.length()));
        cursor.advance();
        List<String> content = new ArrayList<>();
        boolean closed = false;
        while (!cursor.isAtEnd()) {
            String raw = cursor.current();
            cursor.advance();
            if (raw.strip().startsWith(FENCE)) {
                closed = true;
                break;
            }
            content.add(raw);
        }
        if (!closed) {
            logger.warn("line {}: doc string not closed before end of input", line);
        }
        return new DocString(line, StringUtils.join(content, "\n"), mediaType);
    }

    private static DataTable table(LineCursor cursor) {
        int line = cursor.currentLineNumber();
        List<List<String>> rows = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            String text = cursor.peekTrimmed();
            if (!text.startsWith("|")) {
                break;
            }
            rows.add(row(cursor.currentLineNumber(), text));
            cursor.advance();
        }
        return new DataTable(rows.isEmpty() ? 0 : line, rows);
    }

    private static List<String> row(int line, String text) {
        if (!text.endsWith("|")) {
            logger.warn("line {}: table row does not end with '|', no cells read: {}", line, text);
            return Collections.emptyList();
        }
        // a lone '|' both opens and closes the row, giving one empty cell
        String inner = text.length() > 1 ? text.substring(1, text.length() - 1) : "";
        String[] parts = inner.split("\\|", -1);
        List<String> cells = new ArrayList<>(parts.length);
        for (String part : parts) {
            cells.add(part.strip());
        }
        return cells;
    }

    private static String description(LineCursor cursor, LanguageKeywords kw) {
        List<String> lines = new ArrayList<>();
        while (!cursor.isAtEnd()) {
            String text = cursor.peekTrimmed();
            if (text.isEmpty()) {
                if (lines.isEmpty()) {
                    cursor.advance();
                    continue;
                }
                break;
            }
            if (text.startsWith("@") || text.startsWith("#") || text.startsWith("|") || isKeywordLine(text, kw)) {
                break;
            }
            lines.add(text);
            cursor.advance();
        }
        return lines.isEmpty() ? null : StringUtils.join(lines, "\n");
    }

    private static List<Tag> tags(int line, String text) {
        List<Tag> tags = new ArrayList<>();
        for (String part : text.split("\\s+")) {
            if (part.length() > 1 && part.startsWith("@")) {
                tags.add(new Tag(line, part));
            }
        }
        return tags;
    }

    private static boolean isKeywordLine(String text, LanguageKeywords kw) {
        return matchKeyword(text, kw.getFeature()) != null
                || matchKeyword(text, kw.getScenario()) != null
                || matchKeyword(text, kw.getScenarioOutline()) != null
                || matchKeyword(text, kw.getBackground()) != null
                || matchKeyword(text, kw.getRule()) != null
                || matchKeyword(text, kw.getExamples()) != null
                || step(0, text, kw) != null;
    }

    /**
     * @return the trimmed text after the first matching "keyword:" prefix,
     * empty when the keyword stands alone, null when nothing matches
     */
    static String matchKeyword(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.startsWith(keyword) && text.length() > keyword.length()
                    && text.charAt(keyword.length()) == ':') {
                return text.substring(keyword.length() + 1).strip();
            }
        }
        return null;
    }

}
