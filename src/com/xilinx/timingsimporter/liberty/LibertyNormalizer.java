/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of TimingsImporter.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.timingsimporter.liberty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites Liberty text into JSON-compatible text that {@link LibertyParser}
 * can read. The file is first treated as a whole (comments, line
 * continuations) and then every line goes through an ordered list of named
 * {@link LibertyLineRule}s. Later rules rely on the output of earlier ones, so
 * the order of {@link #getRules()} is significant.
 * <p>
 * Malformed input is never rejected here; whatever cannot be rewritten is left
 * for the parser to report.
 *
 * Created on: Oct 2, 2026
 */
public class LibertyNormalizer {

    private static final String IDENT = "[A-Za-z_][A-Za-z_0-9]*";

    private static final String NUMBER = "-?[0-9]+(?:\\.[0-9]+)?";

    private static final String NUMBER_LIST = NUMBER + "(?:\\s*,\\s*" + NUMBER + ")*";

    /** A quoted list of numbers inside an array statement, e.g. "0.1, 0.2" */
    private static final Pattern SUB_ARRAY = Pattern.compile("\"\\s*(" + NUMBER_LIST + ")\\s*\"");

    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*,\\s*");

    private static final Pattern MISSING_SEPARATOR_DECL = Pattern.compile(
            "^(\\s*\"?" + IDENT + "\"?\\s*:\\s*(?:\"[^\"]*\"|[^\\s\"(),{}]+))\\s*$");

    private static final Pattern GROUP_DECL = Pattern.compile(
            "^(\\s*)(" + IDENT + ")\\s*\\(\\s*\"?([^\"(){}]*?)\"?\\s*\\)\\s*(\\{.*)?$");

    private static final Pattern DEFINE_DECL = Pattern.compile(
            "^(\\s*)define\\s*\\(\\s*\"?(" + IDENT + ")\"?\\s*,\\s*\"?(" + IDENT + ")\"?\\s*,\\s*\"?("
            + IDENT + ")\"?\\s*\\)\\s*,");

    private static final Pattern ATTRIBUTE_DECL = Pattern.compile(
            "^(\\s*)(" + IDENT + ")\\s*\\(\\s*\"?([^\"()]+?)\"?\\s*\\)\\s*,(.*)$");

    private static final Pattern ARRAY_DECL = Pattern.compile(
            "^(\\s*)(" + IDENT + ")\\s*\\(((?:\\s*\"\\s*" + NUMBER_LIST + "\\s*\"\\s*,?)+)\\s*\\)(.*)$");

    private static final Pattern INLINE_ARRAY_DECL = Pattern.compile(
            "^(\\s*)\"?(" + IDENT + ")\"?\\s*:\\s*\"\\s*(" + NUMBER + "(?:\\s*,\\s*" + NUMBER + ")+)\\s*\"(.*)$");

    private static final Pattern BARE_VALUE_DECL = Pattern.compile(
            "^(\\s*)(\"?)(" + IDENT + "(?:\\[[0-9]+\\])?)\\2\\s*:\\s*([^\"\\[{\\s,:][^\",:]*?)\\s*(,?)\\s*$");

    private static final Pattern NUMERIC_LITERAL = Pattern.compile(
            "[-+]?(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][-+]?[0-9]+)?");

    private static final Pattern TRAILING_SEPARATOR = Pattern.compile(",(\\s*})");

    /** Converts statement terminators to separators */
    public static final LibertyLineRule SEMICOLONS = line -> line.replace(';', ',');

    /** Adds the separator to a terminal {@code name : value} line that lacks one */
    public static final LibertyLineRule MISSING_SEPARATOR = line -> {
        Matcher m = MISSING_SEPARATOR_DECL.matcher(line);
        return m.matches() ? m.group(1) + "," : line;
    };

    /** A group header such as <code>type ( param ) {</code> becomes <code>"type param" : {</code> */
    public static final LibertyLineRule GROUP_HEADER = line -> {
        Matcher m = GROUP_DECL.matcher(line);
        if (!m.matches()) return line;
        String parameter = m.group(3).trim();
        String key = parameter.isEmpty() ? m.group(2) : m.group(2) + " " + parameter;
        String rest = m.group(4) == null ? "" : " " + m.group(4);
        return m.group(1) + "\"" + key + "\" :" + rest;
    };

    /** {@code define (a, g, t),} becomes an inline object under the "define" key */
    public static final LibertyLineRule DEFINE = line -> {
        Matcher m = DEFINE_DECL.matcher(line);
        if (!m.find()) return line;
        return m.group(1) + "\"" + LibertyNode.DEFINE_KEY + "\" : {\""
                + LibertyGroup.DEFINE_ATTRIBUTE_NAME + "\": \"" + m.group(2) + "\", \""
                + LibertyGroup.DEFINE_GROUP_NAME + "\": \"" + m.group(3) + "\", \""
                + LibertyGroup.DEFINE_ATTRIBUTE_TYPE + "\": \"" + m.group(4) + "\"}"
                + line.substring(m.end());
    };

    /** {@code name ( value ),} becomes {@code "comp_attribute name" : "value",} */
    public static final LibertyLineRule COMPLEX_ATTRIBUTE = line -> {
        if (ARRAY_DECL.matcher(line).matches()) return line;
        Matcher m = ATTRIBUTE_DECL.matcher(line);
        if (!m.matches()) return line;
        return m.group(1) + "\"" + LibertyNode.COMPLEX_ATTRIBUTE_PREFIX + m.group(2) + "\" : \""
                + m.group(3).trim() + "\"," + m.group(4);
    };

    /** {@code name ( "1, 2" ),} becomes a flat array, several quoted lists an array of arrays */
    public static final LibertyLineRule ARRAY_STATEMENT = line -> {
        Matcher m = ARRAY_DECL.matcher(line);
        if (!m.matches()) return line;
        List<String> lists = new ArrayList<>();
        Matcher sub = SUB_ARRAY.matcher(m.group(3));
        while (sub.find()) {
            lists.add("[" + String.join(", ", LIST_SEPARATOR.split(sub.group(1).trim())) + "]");
        }
        String array = lists.size() == 1 ? lists.get(0) : "[" + String.join(", ", lists) + "]";
        return m.group(1) + "\"" + m.group(2) + "\" : " + array + m.group(4);
    };

    /** {@code name : "1, 2, 3",} becomes a flat array */
    public static final LibertyLineRule INLINE_ARRAY = line -> {
        Matcher m = INLINE_ARRAY_DECL.matcher(line);
        if (!m.matches()) return line;
        return m.group(1) + "\"" + m.group(2) + "\" : ["
                + String.join(", ", LIST_SEPARATOR.split(m.group(3).trim())) + "]" + m.group(4);
    };

    /** Wraps every bare word that is not a number in quotes */
    public static final LibertyLineRule QUOTE_BARE_WORDS = LibertyNormalizer::quoteBareWords;

    /** Makes every closing brace be followed by a separator */
    public static final LibertyLineRule CLOSING_BRACE = line -> {
        if (line.indexOf('}') == -1) return line;
        StringBuilder sb = new StringBuilder(line.length() + 4);
        boolean inQuote = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            sb.append(c);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (c == '}' && !inQuote) {
                sb.append(',');
            }
        }
        return sb.toString();
    };

    private static final Map<String, LibertyLineRule> RULES;

    static {
        Map<String, LibertyLineRule> rules = new LinkedHashMap<>();
        rules.put("semicolons", SEMICOLONS);
        rules.put("missing-separator", MISSING_SEPARATOR);
        rules.put("group-header", GROUP_HEADER);
        rules.put("define", DEFINE);
        rules.put("complex-attribute", COMPLEX_ATTRIBUTE);
        rules.put("array-statement", ARRAY_STATEMENT);
        rules.put("inline-array", INLINE_ARRAY);
        rules.put("quote-bare-words", QUOTE_BARE_WORDS);
        rules.put("closing-brace", CLOSING_BRACE);
        RULES = Collections.unmodifiableMap(rules);
    }

    /**
     * @return The line rules by name, in the order they are applied.
     */
    public static Map<String, LibertyLineRule> getRules() {
        return RULES;
    }

    /**
     * Normalizes the lines of a Liberty file, wrapping the whole file in one
     * anonymous top level object.
     * @param lines Raw lines of the file
     * @return JSON-compatible lines
     */
    public static List<String> normalize(List<String> lines) {
        List<String> wrapped = new ArrayList<>(lines.size() + 2);
        wrapped.add("{");
        wrapped.addAll(lines);
        wrapped.add("}");
        return normalizeWrapped(wrapped);
    }

    /**
     * Normalizes lines that already start with an opening and end with a
     * closing brace.
     * @param lines Raw lines, wrapped in braces
     * @return JSON-compatible lines
     */
    public static List<String> normalizeWrapped(List<String> lines) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("ERROR: Cannot normalize an empty file");
        }
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            String trimmed = stripTrailing(line);
            if (trimmed.isEmpty()) continue;
            sb.append(trimmed).append('\n');
        }
        String text = removeComments(sb.toString());
        text = joinContinuations(text);

        List<String> out = new ArrayList<>();
        for (String line : text.split("\n")) {
            if (line.trim().isEmpty()) continue;
            out.add(applyRules(stripTrailing(line)));
        }

        text = TRAILING_SEPARATOR.matcher(String.join("\n", out)).replaceAll("$1");
        out = new ArrayList<>(List.of(text.split("\n")));
        int last = out.size() - 1;
        out.set(last, out.get(last).replaceAll(",\\s*$", ""));
        return out;
    }

    /**
     * Runs all line rules on one logical line.
     * @param line Line without comments and continuations
     * @return The rewritten line
     */
    public static String applyRules(String line) {
        for (LibertyLineRule rule : RULES.values()) {
            line = rule.apply(line);
        }
        return line;
    }

    /**
     * Removes C style block comments, line comments starting with two slashes
     * and script style comments starting with '#'. Quoted text is left alone. A block comment may span lines; its newlines are kept so the
     * line structure stays intact.
     * @param text The whole file
     * @return The text without comments
     */
    public static String removeComments(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inQuote = false;
        int i = 0;
        int len = text.length();
        while (i < len) {
            char c = text.charAt(i);
            if (inQuote) {
                sb.append(c);
                if (c == '"') inQuote = false;
                i++;
            } else if (c == '"') {
                inQuote = true;
                sb.append(c);
                i++;
            } else if (c == '/' && i + 1 < len && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                int stop = end == -1 ? len : end + 2;
                for (int j = i; j < stop; j++) {
                    if (text.charAt(j) == '\n') sb.append('\n');
                }
                i = stop;
            } else if ((c == '/' && i + 1 < len && text.charAt(i + 1) == '/') || c == '#') {
                while (i < len && text.charAt(i) != '\n') i++;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Removes every backslash followed by whitespace (newlines included), gluing
     * continued lines together.
     * @param text The whole file
     * @return The text with continuations joined
     */
    public static String joinContinuations(String text) {
        return text.replaceAll("\\\\\\s*", "");
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }

    /**
     * Checks if a bare token is a number literal the parser accepts.
     */
    static boolean isNumericLiteral(String token) {
        return NUMERIC_LITERAL.matcher(token).matches();
    }

    private static String quoteBareWords(String line) {
        Matcher m = BARE_VALUE_DECL.matcher(line);
        if (m.matches()) {
            String value = m.group(4);
            String quotedValue = isNumericLiteral(value) ? value : "\"" + value + "\"";
            return m.group(1) + "\"" + m.group(3) + "\" : " + quotedValue + m.group(5);
        }

        StringBuilder sb = new StringBuilder(line.length() + 8);
        int i = 0;
        int len = line.length();
        while (i < len) {
            char c = line.charAt(i);
            if (c == '"') {
                int end = line.indexOf('"', i + 1);
                int stop = end == -1 ? len : end + 1;
                sb.append(line, i, stop);
                i = stop;
            } else if (isDelimiter(c)) {
                sb.append(c);
                i++;
            } else {
                int start = i;
                while (i < len && !isDelimiter(line.charAt(i)) && line.charAt(i) != '"') i++;
                sb.append(quoteToken(line.substring(start, i)));
            }
        }
        return sb.toString();
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == ',' || c == ':' || c == '{' || c == '}';
    }

    private static String quoteToken(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '[') start++;
        while (end > start && token.charAt(end - 1) == ']') end--;
        String core = token.substring(start, end);
        if (core.isEmpty() || isNumericLiteral(core)) {
            return token;
        }
        return "\"" + token + "\"";
    }
}
