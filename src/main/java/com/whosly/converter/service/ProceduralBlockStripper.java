package com.whosly.converter.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes {@code BEGIN ... END} bodies line by line, keeping whatever surrounds them.
 */
public final class ProceduralBlockStripper {

    private static final Pattern BEGIN = Pattern.compile("^\\s*BEGIN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern END = Pattern.compile("^\\s*END\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);

    private ProceduralBlockStripper() {
    }

    public static String strip(String sql) {
        List<String> kept = new ArrayList<>();
        int depth = 0;
        for (String line : sql.split("\\r?\\n|\\r", -1)) {
            if (BEGIN.matcher(line).find()) {
                depth++;
                continue;
            }
            if (depth > 0 && END.matcher(line).find()) {
                depth--;
                continue;
            }
            if (depth == 0) {
                kept.add(line);
            }
        }
        return String.join("\n", kept);
    }
}
