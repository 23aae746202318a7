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

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.xilinx.timingsimporter.util.FileTools;
import com.xilinx.timingsimporter.util.MessageGenerator;
import com.xilinx.timingsimporter.util.Params;

/**
 * Writes a Document back out as Liberty text. Reading the produced text with
 * {@link LibertyParser#parseLiberty(List)} gives back an equal Document.
 *
 * Created on: Oct 4, 2026
 */
public class LibertyWriter {

    /** Quoted strings of this shape are written without quotes */
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("^\\d+\\.\\d+$");

    private final String indentUnit;

    public LibertyWriter() {
        this(Params.TI_INDENT_WIDTH);
    }

    /**
     * @param indentWidth Number of spaces per nesting level
     */
    public LibertyWriter(int indentWidth) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("ERROR: Negative indent width " + indentWidth);
        }
        this.indentUnit = MessageGenerator.makeWhiteSpace(indentWidth);
    }

    /**
     * Renders the document.
     * @param root Anonymous root group as returned by the parser
     * @return The Liberty lines
     * @throws LibertyWriteException if the root does not hold exactly one
     * top level entry or the document has a shape Liberty cannot express.
     */
    public List<String> write(LibertyGroup root) {
        if (root.size() != 1) {
            throw new LibertyWriteException("<root>", root,
                    "ERROR: The document root must hold exactly one entry, found " + root.size());
        }
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, LibertyNode> e : root.getChildren().entrySet()) {
            writeEntry(e.getKey(), e.getValue(), 0, lines);
        }
        return lines;
    }

    public void write(LibertyGroup root, Path libFile) {
        FileTools.makeParentDirs(libFile);
        FileTools.writeLinesToTextFile(write(root), libFile.toString());
    }

    private String indent(int depth) {
        StringBuilder sb = new StringBuilder(indentUnit.length() * depth);
        for (int i = 0; i < depth; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }

    private void writeEntry(String key, LibertyNode value, int depth, List<String> lines) {
        boolean complex = LibertyNode.isComplexAttributeKey(key);
        switch (value.getType()) {
            case SCALAR:
                if (complex) {
                    writeComplexAttribute(key, (LibertyScalar) value, depth, lines);
                } else {
                    writeSimpleAttribute(key, (LibertyScalar) value, depth, lines);
                }
                break;
            case ARRAY:
                writeArray(key, (LibertyArray) value, depth, lines);
                break;
            case ARRAY_2D:
                writeArray2D(key, (LibertyArray) value, depth, lines);
                break;
            case GROUP:
                if (complex) {
                    throw new LibertyWriteException(key, value,
                            "ERROR: A group cannot be stored under a complex attribute key");
                }
                writeGroup(key, (LibertyGroup) value, depth, lines);
                break;
            case ATTRIBUTE_LIST:
                for (LibertyNode element : (LibertyAttributeList) value) {
                    if (element.isAttributeList()) {
                        throw new LibertyWriteException(key, value, "ERROR: Nested attribute lists are not supported");
                    }
                    writeEntry(key, element, depth, lines);
                }
                break;
            default:
                throw new RuntimeException("ERROR: Unhandled node type " + value.getType());
        }
    }

    private void writeGroup(String key, LibertyGroup group, int depth, List<String> lines) {
        String ind = indent(depth);
        if (key.equals(LibertyNode.DEFINE_KEY)) {
            if (!group.isDefine()) {
                throw new LibertyWriteException(key, group,
                        "ERROR: A define needs exactly the fields " + LibertyGroup.DEFINE_ATTRIBUTE_NAME + ", "
                        + LibertyGroup.DEFINE_GROUP_NAME + " and " + LibertyGroup.DEFINE_ATTRIBUTE_TYPE);
            }
            lines.add(ind + "define (" + group.getString(LibertyGroup.DEFINE_ATTRIBUTE_NAME) + ","
                    + group.getString(LibertyGroup.DEFINE_GROUP_NAME) + ","
                    + group.getString(LibertyGroup.DEFINE_ATTRIBUTE_TYPE) + ");");
            return;
        }
        lines.add(ind + LibertyNode.getKeyType(key) + " (" + LibertyNode.getKeyParameter(key) + ") {");
        for (Map.Entry<String, LibertyNode> e : group.getChildren().entrySet()) {
            writeEntry(e.getKey(), e.getValue(), depth + 1, lines);
        }
        lines.add(ind + "}");
    }

    private void writeComplexAttribute(String key, LibertyScalar value, int depth, List<String> lines) {
        String name = key.substring(LibertyNode.COMPLEX_ATTRIBUTE_PREFIX.length());
        String text = value.isString() ? value.getString() : formatNumber(value.getNumber());
        lines.add(indent(depth) + name + " (" + text + ");");
    }

    private void writeSimpleAttribute(String key, LibertyScalar value, int depth, List<String> lines) {
        String text;
        if (value.isNumber()) {
            text = formatNumber(value.getNumber());
        } else if (PLAIN_DECIMAL.matcher(value.getString()).matches()) {
            text = value.getString();
        } else {
            text = "\"" + value.getString() + "\"";
        }
        lines.add(indent(depth) + key + " : " + text + ";");
    }

    private void writeArray(String key, LibertyArray array, int depth, List<String> lines) {
        lines.add(indent(depth) + key + " (\"" + joinRow(array.getValues()) + "\");");
    }

    private void writeArray2D(String key, LibertyArray array, int depth, List<String> lines) {
        String ind = indent(depth);
        String first = ind + key + " ( \\";
        lines.add(first);
        String rowIndent = MessageGenerator.makeWhiteSpace(first.length() - 2);
        List<List<Number>> rows = array.getRows();
        for (int i = 0; i < rows.size(); i++) {
            String separator = i < rows.size() - 1 ? ", \\" : " \\";
            lines.add(rowIndent + "\"" + joinRow(rows.get(i)) + "\"" + separator);
        }
        lines.add(ind + ");");
    }

    private static String joinRow(List<Number> row) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(formatNumber(row.get(i)));
        }
        return sb.toString();
    }

    /**
     * Formats a number the way Liberty files carry them. Integral values are
     * written as is; floating point values in plain decimal notation with at
     * least one fractional digit.
     * @param n The number
     * @return Its text form, e.g. "3", "0.5", "1.0", "0.00012"
     */
    public static String formatNumber(Number n) {
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return n.toString();
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        String s = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        if (s.indexOf('.') == -1) {
            s += ".0";
        }
        return s;
    }
}
