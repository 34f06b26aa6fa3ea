package com.flowuml.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Splits document text into significant lines. Drops blank lines, {@code @startuml}/{@code @enduml}
 * wrappers, single-line comments ({@code '} and {@code //}) and {@code /' ... '/} block comments.
 */
final class DiagramLexer {

    private DiagramLexer() {
    }

    static List<SourceLine> lines(String documentText) {
        Objects.requireNonNull(documentText, "documentText");
        String[] raw = documentText.split("\r\n|\r|\n", -1);
        List<SourceLine> result = new ArrayList<>();
        boolean inBlockComment = false;
        for (int i = 0; i < raw.length; i++) {
            String line = raw[i].trim();
            if (inBlockComment) {
                if (line.contains("'/")) {
                    inBlockComment = false;
                }
                continue;
            }
            if (line.startsWith("/'")) {
                inBlockComment = !line.substring(2).contains("'/");
                continue;
            }
            if (line.isEmpty() || line.startsWith("'") || line.startsWith("//")) continue;
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.startsWith("@startuml") || lower.startsWith("@enduml")) continue;
            result.add(new SourceLine(i + 1, line));
        }
        return result;
    }
}
