package com.formula.conversion.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the part of a LaTeX log that explains an error.
 */
public final class LatexLogParser {

    private static final String ERROR_MARKER = "! ";

    private LatexLogParser() {
    }

    /**
     * Returns the error message and the lines following it, up to LaTeX's
     * closing summary. Returns an empty string if the log contains no error.
     */
    public static String extractError(String log) {
        if (log == null || log.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        boolean copying = false;
        for (String line : log.split("\\r?\\n")) {
            if (copying && isSummary(line)) {
                break;
            }
            if (line.startsWith(ERROR_MARKER)) {
                lines.add(line.substring(ERROR_MARKER.length()));
                copying = true;
            } else if (copying) {
                lines.add(line);
            }
        }
        return String.join("\n", lines).strip();
    }

    private static boolean isSummary(String line) {
        return line.startsWith("No pages of") || line.startsWith("Output written")
                || line.startsWith("!  ==> Fatal error o");
    }
}
