package org.logsplit;

import java.util.List;

/**
 * Default output prefix for an input log: the input path without its log extensions,
 * so {@code app.json.1} is split into {@code app-2021-03-01}, {@code app-2021-03-02}, ...
 */
final class OutputPrefixes {

    private static final List<String> LOG_EXTENSIONS = List.of(".json.1", ".jsonl", ".json");

    private OutputPrefixes() {}

    static String derive(String inputPath) {
        String prefix = inputPath;
        if (prefix.endsWith(".gz")) {
            prefix = prefix.substring(0, prefix.length() - ".gz".length());
        }
        for (String extension : LOG_EXTENSIONS) {
            if (prefix.endsWith(extension) && prefix.length() > extension.length()) {
                return prefix.substring(0, prefix.length() - extension.length());
            }
        }
        return prefix;
    }
}
