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

package com.xilinx.timingsimporter.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * A set of file reading and writing helpers used at the command line boundary.
 * All text is read and written as UTF-8.
 */
public class FileTools {

    /**
     * This is a simple method that writes the elements of a List of Strings
     * into lines in the text file fileName. Parent directories are created as
     * needed.
     * @param lines The List of Strings to be written
     * @param fileName Name of the text file to save the List to
     */
    public static void writeLinesToTextFile(List<String> lines, String fileName) {
        String nl = System.lineSeparator();
        makeParentDirs(Paths.get(fileName));
        try (BufferedWriter bw = Files.newBufferedWriter(Paths.get(fileName), StandardCharsets.UTF_8)) {
            for (String line : lines) {
                bw.write(line + nl);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " +
                fileName + File.separator + e.getMessage(), e);
        }
    }

    /**
     * This is a simple method that writes a String to a file and adds a new line.
     * @param text the String to write to the file
     * @param fileName Name of the text file to save the String to
     */
    public static void writeStringToTextFile(String text, String fileName) {
        String nl = System.lineSeparator();
        makeParentDirs(Paths.get(fileName));
        try (BufferedWriter bw = Files.newBufferedWriter(Paths.get(fileName), StandardCharsets.UTF_8)) {
            bw.write(text + nl);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " +
                fileName + File.separator + e.getMessage(), e);
        }
    }

    /**
     * This is a simple method that will read in a text file and put each line in a
     * string and put all the lines in a List.
     * @param fileName Name of the text file to load.
     * @return A List containing strings of each line in the file.
     */
    public static List<String> getLinesFromTextFile(String fileName) {
        String line;

        List<String> lines = new ArrayList<String>();
        try (BufferedReader br = Files.newBufferedReader(Paths.get(fileName), StandardCharsets.UTF_8)) {
            while ((line = br.readLine()) != null) {
                lines.add(line);
            }
        }
        catch (NoSuchFileException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        }
        catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + fileName, e);
        }

        return lines;
    }

    public static List<String> getLinesFromTextFile(Path fileName) {
        return getLinesFromTextFile(fileName.toString());
    }

    /**
     * Reads a whole text file into one String.
     * @param fileName Name of the text file to load.
     * @return The file contents
     */
    public static String getStringFromTextFile(String fileName) {
        try {
            return new String(Files.readAllBytes(Paths.get(fileName)), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not read from file: " + fileName, e);
        }
    }

    /**
     * Takes a file name and removes everything after the last '.' inclusive
     * @param fileName The input file name
     * @return the substring of fileName if it contains a '.', it returns fileName otherwise
     */
    public static String removeFileExtension(String fileName) {
        int endIndex = fileName.lastIndexOf('.');
        if (endIndex != -1) {
            return fileName.substring(0, endIndex);
        }
        return fileName;
    }

    /**
     * Creates the parent directories of the provided path if they do not exist.
     * @param path The file whose parent directories are needed
     */
    public static void makeParentDirs(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not create directory: " + parent, e);
        }
    }
}
