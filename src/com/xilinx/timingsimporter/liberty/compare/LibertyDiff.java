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

package com.xilinx.timingsimporter.liberty.compare;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.xilinx.timingsimporter.liberty.LibertyNormalizer;
import com.xilinx.timingsimporter.liberty.LibertyWriter;
import com.xilinx.timingsimporter.util.MessageGenerator;

/**
 * Compares two Liberty files after removing differences that carry no
 * meaning (comments, whitespace, quoting, number notation). Used to check that
 * a file written back from its Document still says the same thing as the
 * original.
 *
 * Created on: Oct 6, 2026
 */
public class LibertyDiff {

    /**
     * Ways of computing the similarity of two cleaned files. All give a value
     * between 0 (nothing in common) and 1 (identical).
     */
    public enum SimilarityMethod {
        /** Exact: twice the number of matched characters over the total length */
        NORMAL,
        /** Upper bound of {@link #NORMAL} from the character counts only */
        QUICK,
        /** Upper bound of {@link #QUICK} from the lengths only */
        REAL_QUICK;

        public static SimilarityMethod fromName(String name) {
            try {
                return valueOf(name.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("ERROR: Unknown similarity method '" + name
                        + "', expected one of normal, quick, real_quick", e);
            }
        }
    }

    /**
     * Cleaning steps applied by {@link #cleanLines(List, CleanOptions)}. All
     * are enabled by default.
     */
    public static class CleanOptions {
        public boolean removeComments = true;
        public boolean moveEntryToNewline = true;
        public boolean removeQuotes = true;
        public boolean removeWhitespaces = true;
        public boolean unifyNumbers = true;
        public boolean removeLineBreaks = true;
    }

    private static final Pattern CONTENT_AFTER_BRACE = Pattern.compile("\\}\\s*(?!\\n)");

    private static final Pattern LINE_BREAK = Pattern.compile("\\\\\\s*\\n");

    private static final Pattern FLOAT = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?");

    public static List<String> cleanLines(List<String> lines) {
        return cleanLines(lines, new CleanOptions());
    }

    /**
     * Prepares Liberty lines for comparison. Tabs are always turned into
     * spaces.
     * @param lines The lines of a Liberty file
     * @param options Which cleaning steps to apply
     * @return The cleaned lines
     */
    public static List<String> cleanLines(List<String> lines, CleanOptions options) {
        String text = String.join("\n", lines);
        if (options.removeComments) {
            text = LibertyNormalizer.removeComments(text);
        }
        text = text.replace('\t', ' ');
        if (options.moveEntryToNewline) {
            text = CONTENT_AFTER_BRACE.matcher(text).replaceAll("}\n");
        }
        if (options.removeQuotes) {
            text = text.replace("\"", "");
        }
        if (options.removeWhitespaces) {
            text = text.replace(" ", "");
        }
        if (options.removeLineBreaks) {
            text = LINE_BREAK.matcher(text).replaceAll("");
        }

        List<String> cleaned = new ArrayList<>();
        for (String line : text.split("\n")) {
            if (options.removeWhitespaces) {
                if (line.trim().isEmpty()) continue;
                line = line.replaceAll("\\s+$", "");
            }
            if (options.unifyNumbers) {
                line = unifyNumbers(line);
            }
            cleaned.add(line);
        }
        return cleaned;
    }

    private static String unifyNumbers(String line) {
        Matcher m = FLOAT.matcher(line);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String unified = LibertyWriter.formatNumber(Double.parseDouble(m.group()));
            m.appendReplacement(sb, Matcher.quoteReplacement(unified));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Computes how similar two cleaned files are, treating each as one long
     * string.
     * @param a Cleaned lines of the first file
     * @param b Cleaned lines of the second file
     * @param method How to compute the value
     * @return A value from 0 to 1, 1 meaning identical.
     */
    public static double similarity(List<String> a, List<String> b, SimilarityMethod method) {
        String sa = String.join("\n", a);
        String sb = String.join("\n", b);
        int total = sa.length() + sb.length();
        if (total == 0) {
            return 1.0;
        }
        int matches;
        switch (method) {
            case NORMAL:
                matches = countMatchingCharacters(sa, sb);
                break;
            case QUICK:
                matches = countCommonCharacters(sa, sb);
                break;
            case REAL_QUICK:
                matches = Math.min(sa.length(), sb.length());
                break;
            default:
                throw new RuntimeException("ERROR: Unhandled similarity method " + method);
        }
        return 2.0 * matches / total;
    }

    /**
     * Sums the sizes of the matching blocks: the longest common substring is
     * matched first, then the pieces to its left and right are matched the
     * same way.
     */
    static int countMatchingCharacters(String a, String b) {
        Map<Character, List<Integer>> positions = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            positions.computeIfAbsent(b.charAt(j), k -> new ArrayList<>()).add(j);
        }
        int matches = 0;
        List<int[]> queue = new ArrayList<>();
        queue.add(new int[] {0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] range = queue.remove(queue.size() - 1);
            int[] match = findLongestMatch(a, positions, range[0], range[1], range[2], range[3]);
            int size = match[2];
            if (size == 0) continue;
            matches += size;
            int i = match[0];
            int j = match[1];
            if (range[0] < i && range[2] < j) {
                queue.add(new int[] {range[0], i, range[2], j});
            }
            if (i + size < range[1] && j + size < range[3]) {
                queue.add(new int[] {i + size, range[1], j + size, range[3]});
            }
        }
        return matches;
    }

    /**
     * @return {start in a, start in b, length} of the longest common substring
     * of a[alo, ahi) and b[blo, bhi), earliest in a on ties.
     */
    private static int[] findLongestMatch(String a, Map<Character, List<Integer>> positions,
                                          int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;
        Map<Integer, Integer> lengths = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newLengths = new HashMap<>();
            List<Integer> js = positions.get(a.charAt(i));
            if (js != null) {
                for (int j : js) {
                    if (j < blo) continue;
                    if (j >= bhi) break;
                    int k = lengths.getOrDefault(j - 1, 0) + 1;
                    newLengths.put(j, k);
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            lengths = newLengths;
        }
        return new int[] {bestI, bestJ, bestSize};
    }

    static int countCommonCharacters(String a, String b) {
        Map<Character, Integer> available = new HashMap<>();
        for (int i = 0; i < b.length(); i++) {
            available.merge(b.charAt(i), 1, Integer::sum);
        }
        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            Integer count = available.get(a.charAt(i));
            if (count != null && count > 0) {
                available.put(a.charAt(i), count - 1);
                matches++;
            }
        }
        return matches;
    }

    /**
     * Computes a line diff. Every line of both inputs appears once, prefixed
     * with "- " (only in a), "+ " (only in b) or two spaces (in both). Within a
     * changed block the removed lines come before the added ones.
     * <p>
     * Common leading and trailing lines are matched first; the rest is aligned
     * with Hirschberg's algorithm, which needs memory linear in the number of
     * lines.
     * @param a Lines of the first file
     * @param b Lines of the second file
     * @return The diff lines
     */
    public static List<String> diff(List<String> a, List<String> b) {
        Map<String, Integer> ids = new HashMap<>();
        int[] x = toIds(a, ids);
        int[] y = toIds(b, ids);
        int n = x.length;
        int m = y.length;

        int prefix = 0;
        while (prefix < n && prefix < m && x[prefix] == y[prefix]) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < n - prefix && suffix < m - prefix && x[n - 1 - suffix] == y[m - 1 - suffix]) {
            suffix++;
        }

        List<String> ops = new ArrayList<>(n + m);
        for (int i = 0; i < prefix; i++) {
            ops.add("  " + a.get(i));
        }
        align(a, b, x, y, prefix, n - suffix, prefix, m - suffix, ops);
        for (int i = n - suffix; i < n; i++) {
            ops.add("  " + a.get(i));
        }
        return groupChanges(ops);
    }

    private static int[] toIds(List<String> lines, Map<String, Integer> ids) {
        int[] result = new int[lines.size()];
        for (int i = 0; i < result.length; i++) {
            Integer id = ids.get(lines.get(i));
            if (id == null) {
                id = ids.size();
                ids.put(lines.get(i), id);
            }
            result[i] = id;
        }
        return result;
    }

    /**
     * Appends the diff of x[aLo, aHi) and y[bLo, bHi) to ops.
     */
    private static void align(List<String> a, List<String> b, int[] x, int[] y,
                              int aLo, int aHi, int bLo, int bHi, List<String> ops) {
        if (aLo == aHi) {
            for (int j = bLo; j < bHi; j++) {
                ops.add("+ " + b.get(j));
            }
            return;
        }
        if (bLo == bHi) {
            for (int i = aLo; i < aHi; i++) {
                ops.add("- " + a.get(i));
            }
            return;
        }
        if (aHi - aLo == 1) {
            int match = -1;
            for (int j = bLo; j < bHi; j++) {
                if (x[aLo] == y[j]) {
                    match = j;
                    break;
                }
            }
            if (match == -1) {
                ops.add("- " + a.get(aLo));
                for (int j = bLo; j < bHi; j++) {
                    ops.add("+ " + b.get(j));
                }
                return;
            }
            for (int j = bLo; j < match; j++) {
                ops.add("+ " + b.get(j));
            }
            ops.add("  " + a.get(aLo));
            for (int j = match + 1; j < bHi; j++) {
                ops.add("+ " + b.get(j));
            }
            return;
        }

        int mid = (aLo + aHi) / 2;
        int[] forward = forwardLengths(x, y, aLo, mid, bLo, bHi);
        int[] backward = backwardLengths(x, y, mid, aHi, bLo, bHi);
        int split = 0;
        int best = -1;
        for (int k = 0; k <= bHi - bLo; k++) {
            int total = forward[k] + backward[k];
            if (total > best) {
                best = total;
                split = k;
            }
        }
        align(a, b, x, y, aLo, mid, bLo, bLo + split, ops);
        align(a, b, x, y, mid, aHi, bLo + split, bHi, ops);
    }

    /**
     * @return For every k, the LCS length of x[aLo, aHi) and y[bLo, bLo + k).
     */
    private static int[] forwardLengths(int[] x, int[] y, int aLo, int aHi, int bLo, int bHi) {
        int m = bHi - bLo;
        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int i = aLo; i < aHi; i++) {
            cur[0] = 0;
            for (int j = 1; j <= m; j++) {
                cur[j] = x[i] == y[bLo + j - 1] ? prev[j - 1] + 1 : Math.max(prev[j], cur[j - 1]);
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev;
    }

    /**
     * @return For every k, the LCS length of x[aLo, aHi) and y[bLo + k, bHi).
     */
    private static int[] backwardLengths(int[] x, int[] y, int aLo, int aHi, int bLo, int bHi) {
        int m = bHi - bLo;
        int[] prev = new int[m + 1];
        int[] cur = new int[m + 1];
        for (int i = aHi - 1; i >= aLo; i--) {
            cur[m] = 0;
            for (int j = m - 1; j >= 0; j--) {
                cur[j] = x[i] == y[bLo + j] ? prev[j + 1] + 1 : Math.max(prev[j], cur[j + 1]);
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev;
    }

    /**
     * Reorders every run of changed lines so removals precede additions.
     */
    private static List<String> groupChanges(List<String> ops) {
        List<String> out = new ArrayList<>(ops.size());
        List<String> added = new ArrayList<>();
        for (String op : ops) {
            if (op.startsWith("+ ")) {
                added.add(op);
            } else if (op.startsWith("- ")) {
                out.add(op);
            } else {
                out.addAll(added);
                added.clear();
                out.add(op);
            }
        }
        out.addAll(added);
        return out;
    }

    /**
     * @return True if the diff has at least one line not common to both inputs.
     */
    public static boolean hasDifferences(List<String> diff) {
        for (String line : diff) {
            if (!line.startsWith("  ")) return true;
        }
        return false;
    }

    /**
     * Renders a diff as two columns. Changed lines are marked with '|', lines
     * only on the left with '&lt;' and lines only on the right with '&gt;'.
     * @param a Lines of the first file
     * @param b Lines of the second file
     * @param width Width of each column; longer lines are cut
     * @return The rendered rows
     */
    public static List<String> sideBySide(List<String> a, List<String> b, int width) {
        List<String> diff = diff(a, b);
        List<String> rows = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> added = new ArrayList<>();
        for (String line : diff) {
            if (line.startsWith("- ")) {
                removed.add(line.substring(2));
            } else if (line.startsWith("+ ")) {
                added.add(line.substring(2));
            } else {
                flushChanges(removed, added, width, rows);
                rows.add(row(line.substring(2), ' ', line.substring(2), width));
            }
        }
        flushChanges(removed, added, width, rows);
        return rows;
    }

    private static void flushChanges(List<String> removed, List<String> added, int width, List<String> rows) {
        int count = Math.max(removed.size(), added.size());
        for (int k = 0; k < count; k++) {
            String left = k < removed.size() ? removed.get(k) : "";
            String right = k < added.size() ? added.get(k) : "";
            char mark = k >= removed.size() ? '>' : k >= added.size() ? '<' : '|';
            rows.add(row(left, mark, right, width));
        }
        removed.clear();
        added.clear();
    }

    private static String row(String left, char mark, String right, int width) {
        return fit(left, width) + " " + mark + " " + fit(right, width).replaceAll("\\s+$", "");
    }

    private static String fit(String s, int width) {
        if (s.length() >= width) {
            return s.substring(0, width);
        }
        return s + MessageGenerator.makeWhiteSpace(width - s.length());
    }
}
