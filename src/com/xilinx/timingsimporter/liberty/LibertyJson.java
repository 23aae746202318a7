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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.google.gson.stream.JsonWriter;

import com.xilinx.timingsimporter.util.FileTools;
import com.xilinx.timingsimporter.util.MessageGenerator;

/**
 * JSON interchange form of a Document, written with Gson's {@link JsonWriter}
 * so keys keep their document order. Numbers use the Liberty writer's number
 * format.
 *
 * Created on: Oct 4, 2026
 */
public class LibertyJson {

    private static final int INDENT = 4;

    public static String toJson(LibertyGroup root) {
        StringWriter out = new StringWriter();
        try (JsonWriter writer = new JsonWriter(out)) {
            writer.setIndent(MessageGenerator.makeWhiteSpace(INDENT));
            writeNode(writer, root);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Failed to build the JSON form", e);
        }
        return out.toString() + "\n";
    }

    public static void writeJson(LibertyGroup root, Path jsonFile) {
        FileTools.makeParentDirs(jsonFile);
        FileTools.writeStringToTextFile(toJson(root), jsonFile.toString());
    }

    public static LibertyGroup readJson(Path jsonFile) {
        return LibertyParser.parseJson(jsonFile);
    }

    private static void writeNode(JsonWriter writer, LibertyNode node) throws IOException {
        switch (node.getType()) {
            case SCALAR:
                LibertyScalar s = (LibertyScalar) node;
                if (s.isString()) {
                    writer.value(s.getString());
                } else {
                    writer.jsonValue(LibertyWriter.formatNumber(s.getNumber()));
                }
                break;
            case ARRAY:
                writeRow(writer, ((LibertyArray) node).getValues());
                break;
            case ARRAY_2D:
                writer.beginArray();
                for (List<Number> row : ((LibertyArray) node).getRows()) {
                    writeRow(writer, row);
                }
                writer.endArray();
                break;
            case GROUP:
                writer.beginObject();
                for (Map.Entry<String, LibertyNode> e : ((LibertyGroup) node).getChildren().entrySet()) {
                    writer.name(e.getKey());
                    writeNode(writer, e.getValue());
                }
                writer.endObject();
                break;
            case ATTRIBUTE_LIST:
                writer.beginArray();
                for (LibertyNode value : ((LibertyAttributeList) node).getValues()) {
                    writeNode(writer, value);
                }
                writer.endArray();
                break;
            default:
                throw new RuntimeException("ERROR: Unhandled node type " + node.getType());
        }
    }

    private static void writeRow(JsonWriter writer, List<Number> row) throws IOException {
        writer.beginArray();
        for (Number n : row) {
            writer.jsonValue(LibertyWriter.formatNumber(n));
        }
        writer.endArray();
    }
}
