package com.whosly.converter.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level cleanup of a rendered CREATE TABLE.
 */
public class OutputCleaner {

    private static final Pattern ZONED_TIMESTAMP = Pattern.compile(
            "TIMESTAMP WITH (LOCAL )?TIME ZONE\\((\\d+)\\)", Pattern.CASE_INSENSITIVE);

    private final List<String> disallowedClauses;
    private final Map<String, String> outputAliases;

    /**
     * @param disallowedClauses upper-cased clause keywords; lines containing one are dropped
     * @param outputAliases     short type spelling to verbose spelling
     */
    public OutputCleaner(List<String> disallowedClauses, Map<String, String> outputAliases) {
        this.disallowedClauses = disallowedClauses;
        this.outputAliases = outputAliases;
    }

    public String clean(String sql) {
        String out = dropDisallowedLines(sql);
        out = applyAliases(out);
        return reorderTimestampPrecision(out);
    }

    String dropDisallowedLines(String sql) {
        if (disallowedClauses.isEmpty()) {
            return sql;
        }
        List<String> kept = new ArrayList<>();
        for (String line : sql.split("\n", -1)) {
            String upper = line.toUpperCase(Locale.ROOT);
            boolean disallowed = false;
            for (String clause : disallowedClauses) {
                if (upper.contains(clause)) {
                    disallowed = true;
                    break;
                }
            }
            if (!disallowed) {
                kept.add(line);
            }
        }
        return String.join("\n", kept);
    }

    String applyAliases(String sql) {
        String out = sql;
        for (Map.Entry<String, String> alias : outputAliases.entrySet()) {
            Pattern word = Pattern.compile("(?<![A-Za-z0-9_])" + Pattern.quote(alias.getKey()) + "(?![A-Za-z0-9_])");
            out = word.matcher(out).replaceAll(Matcher.quoteReplacement(alias.getValue()));
        }
        return out;
    }

    // the target wants the precision before the zone words; the printer puts it after
    static String reorderTimestampPrecision(String sql) {
        Matcher m = ZONED_TIMESTAMP.matcher(sql);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String local = m.group(1) != null ? "LOCAL " : "";
            m.appendReplacement(sb, "TIMESTAMP(" + m.group(2) + ") WITH " + local + "TIME ZONE");
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
