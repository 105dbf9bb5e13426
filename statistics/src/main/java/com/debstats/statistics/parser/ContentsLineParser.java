package com.debstats.statistics.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts package names from a single Contents index line.
 *
 * <p>A line reads {@code <file name> <whitespace> <pkg>[,<pkg>...]}. File
 * names may contain spaces but the package list never does, so the list
 * starts after the last space or tab.</p>
 */
public final class ContentsLineParser {

    private ContentsLineParser() {
    }

    /**
     * Returns the packages listed on {@code line}. Empty tokens, e.g. from a
     * trailing comma, are dropped.
     *
     * @throws MalformedLineException if the line contains no space or tab
     */
    public static List<String> parsePackages(String line) {
        int separator = lastSeparator(line);
        if (separator < 0) {
            throw new MalformedLineException(line);
        }

        List<String> packages = new ArrayList<>(2);
        int start = separator + 1;
        int length = line.length();
        for (int i = start; i <= length; i++) {
            if (i == length || line.charAt(i) == ',') {
                if (i > start) {
                    packages.add(line.substring(start, i));
                }
                start = i + 1;
            }
        }
        return packages;
    }

    /**
     * Index of the last space or tab in {@code line}, or -1 if there is none.
     */
    static int lastSeparator(String line) {
        for (int i = line.length() - 1; i >= 0; i--) {
            char ch = line.charAt(i);
            if (ch == ' ' || ch == '\t') {
                return i;
            }
        }
        return -1;
    }
}
