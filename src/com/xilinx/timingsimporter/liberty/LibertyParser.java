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

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.json.JSONException;
import org.json.JSONTokener;

import com.xilinx.timingsimporter.util.FileTools;

/**
 * Builds the Document tree out of JSON text, either produced by
 * {@link LibertyNormalizer} or read from a JSON interchange file. Lexing is
 * done by {@link JSONTokener}; object construction goes through
 * {@link LibertyGroup#add(String, LibertyNode)} so repeated keys are grouped
 * while reading.
 *
 * Created on: Oct 3, 2026
 */
public class LibertyParser {

    /** Characters that end an unquoted token, same set as {@link JSONTokener#nextValue()} */
    private static final String TOKEN_TERMINATORS = ",:]}/\\\"[{;=#";

    private static final Pattern LEXER_LINE = Pattern.compile("line (\\d+)\\]");

    private final JSONTokener tokenizer;

    private LibertyParser(String text) {
        this.tokenizer = new JSONTokener(text);
    }

    /**
     * Normalizes and parses the raw lines of a Liberty file.
     * @param rawLines Lines as read from the file
     * @return The anonymous root group holding the single top level group.
     * @throws LibertyParseException if the normalized text cannot be read.
     */
    public static LibertyGroup parseLiberty(List<String> rawLines) {
        List<String> normalized = LibertyNormalizer.normalize(rawLines);
        return parse(String.join("\n", normalized), normalized);
    }

    public static LibertyGroup parseLiberty(Path libFile) {
        return parseLiberty(readLines(libFile));
    }

    /**
     * Parses JSON interchange text.
     * @param json The JSON text
     * @return The anonymous root group holding the single top level group.
     * @throws LibertyParseException if the text cannot be read.
     */
    public static LibertyGroup parseJson(String json) {
        List<String> lines = new ArrayList<>(List.of(json.split("\n", -1)));
        return parse(json, lines);
    }

    public static LibertyGroup parseJson(Path jsonFile) {
        return parseJson(String.join("\n", readLines(jsonFile)));
    }

    private static List<String> readLines(Path path) {
        try {
            return FileTools.getLinesFromTextFile(path);
        } catch (UncheckedIOException e) {
            throw new LibertyParseException("ERROR: Failed to read " + path, e);
        }
    }

    private static LibertyGroup parse(String text, List<String> lines) {
        LibertyParser p = new LibertyParser(text);
        LibertyGroup root;
        try {
            root = p.parseDocument();
        } catch (JSONException e) {
            int lineNumber = extractLineNumber(e);
            String line = lineNumber >= 1 && lineNumber <= lines.size() ? lines.get(lineNumber - 1) : "";
            throw new LibertyParseException(lineNumber, line, e.getMessage(), e);
        }
        int roots = root.size();
        if (roots == 1) {
            LibertyNode only = root.getChildren().values().iterator().next();
            if (only.isAttributeList()) {
                roots = ((LibertyAttributeList) only).size();
            }
        }
        if (roots != 1) {
            throw LibertyParseException.multipleRootObjects(roots);
        }
        return root;
    }

    private static int extractLineNumber(JSONException e) {
        Matcher m = LEXER_LINE.matcher(String.valueOf(e.getMessage()));
        int lineNumber = -1;
        while (m.find()) {
            lineNumber = Integer.parseInt(m.group(1));
        }
        return lineNumber;
    }

    private LibertyGroup parseDocument() {
        char c = tokenizer.nextClean();
        if (c != '{') {
            throw tokenizer.syntaxError("Document must start with '{'");
        }
        LibertyGroup root = parseGroup();
        c = tokenizer.nextClean();
        if (c != 0) {
            throw tokenizer.syntaxError("Unexpected text '" + c + "' after the closing brace");
        }
        return root;
    }

    /**
     * Reads group members up to and including the closing brace. The opening
     * brace has already been consumed.
     */
    private LibertyGroup parseGroup() {
        LibertyGroup group = new LibertyGroup();
        char c = tokenizer.nextClean();
        if (c == '}') {
            return group;
        }
        while (true) {
            if (c != '"') {
                throw tokenizer.syntaxError("Expected a quoted key");
            }
            String key = tokenizer.nextString('"');
            c = tokenizer.nextClean();
            if (c != ':') {
                throw tokenizer.syntaxError("Expected a ':' after key \"" + key + "\"");
            }
            group.add(key, parseValue());

            c = tokenizer.nextClean();
            switch (c) {
                case ',':
                    c = tokenizer.nextClean();
                    if (c == '}') {
                        return group;
                    }
                    break;
                case '}':
                    return group;
                default:
                    throw tokenizer.syntaxError("Expected a ',' or '}'");
            }
        }
    }

    private LibertyNode parseValue() {
        char c = tokenizer.nextClean();
        switch (c) {
            case '"':
                return new LibertyScalar(tokenizer.nextString('"'));
            case '{':
                return parseGroup();
            case '[':
                return parseList();
            default:
                return parseUnquoted(c);
        }
    }

    private LibertyNode parseList() {
        List<LibertyNode> elements = new ArrayList<>();
        char c = tokenizer.nextClean();
        if (c != ']') {
            tokenizer.back();
            while (true) {
                elements.add(parseValue());
                c = tokenizer.nextClean();
                if (c == ']') break;
                if (c != ',') {
                    throw tokenizer.syntaxError("Expected a ',' or ']'");
                }
                c = tokenizer.nextClean();
                if (c == ']') break;
                tokenizer.back();
            }
        }
        return toListNode(elements);
    }

    /**
     * Decides what a bracketed list is: numbers form a flat array, lists of
     * numbers a two-dimensional array, everything else an attribute list.
     */
    static LibertyNode toListNode(List<LibertyNode> elements) {
        if (elements.isEmpty()) {
            return LibertyArray.of(new ArrayList<Number>());
        }
        boolean allNumbers = true;
        boolean allFlatArrays = true;
        for (LibertyNode n : elements) {
            if (!(n.isScalar() && ((LibertyScalar) n).isNumber())) {
                allNumbers = false;
            }
            if (n.getType() != LibertyNodeType.ARRAY) {
                allFlatArrays = false;
            }
        }
        if (allNumbers) {
            List<Number> values = new ArrayList<>(elements.size());
            for (LibertyNode n : elements) {
                values.add(((LibertyScalar) n).getNumber());
            }
            return LibertyArray.of(values);
        }
        if (allFlatArrays) {
            List<List<Number>> rows = new ArrayList<>(elements.size());
            for (LibertyNode n : elements) {
                rows.add(((LibertyArray) n).getValues());
            }
            return LibertyArray.ofRows(rows);
        }
        return new LibertyAttributeList(elements);
    }

    private LibertyScalar parseUnquoted(char first) {
        StringBuilder sb = new StringBuilder();
        char c = first;
        while (c >= ' ' && TOKEN_TERMINATORS.indexOf(c) < 0) {
            sb.append(c);
            c = tokenizer.next();
        }
        if (!tokenizer.end()) {
            tokenizer.back();
        }
        String token = sb.toString().trim();
        if (token.isEmpty()) {
            throw tokenizer.syntaxError("Missing value");
        }
        Number n = parseNumber(token);
        if (n == null) {
            throw tokenizer.syntaxError("Unquoted text '" + token + "' is not a number");
        }
        return new LibertyScalar(n);
    }

    /**
     * Reads a number literal, integral text as {@link Long} and everything else
     * as {@link Double}.
     * @param token Unquoted token text
     * @return The number or null if the token is not a number literal.
     */
    static Number parseNumber(String token) {
        if (!LibertyNormalizer.isNumericLiteral(token)) {
            return null;
        }
        boolean integral = token.indexOf('.') == -1 && token.indexOf('e') == -1 && token.indexOf('E') == -1;
        if (integral) {
            try {
                return Long.parseLong(token.startsWith("+") ? token.substring(1) : token);
            } catch (NumberFormatException e) {
                // Too large for a long, fall through to double
            }
        }
        return Double.parseDouble(token);
    }
}
