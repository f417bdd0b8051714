package com.whosly.converter.review;

import com.whosly.converter.parser.ParsedStatement;
import com.whosly.converter.parser.SqlScriptSplitter;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the detectable {@link ReviewPattern}s over each statement's source text.
 */
public class ManualReviewDetector {

    private static final Pattern CREATED_OBJECT = Pattern.compile(
            "^\\s*CREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:(?:SECURE|TEMPORARY|TEMP|TRANSIENT|VOLATILE|MATERIALIZED)\\s+)*"
                    + "(TABLE|VIEW|FUNCTION|PROCEDURE|SEQUENCE|PACKAGE)\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?([\\w\"\\.$]+)",
            Pattern.CASE_INSENSITIVE);

    private final ManualReviewCollector collector;

    public ManualReviewDetector(ManualReviewCollector collector) {
        this.collector = collector;
    }

    /**
     * @return number of items recorded for the statement
     */
    public int inspect(ParsedStatement statement, String fileName) {
        String code = SqlScriptSplitter.stripComments(statement.getSqlText());
        ObjectRef ref = ObjectRef.of(code, statement.getStartLine());
        int recorded = 0;
        for (ReviewPattern pattern : ReviewPattern.values()) {
            if (pattern.isDetectable() && pattern.matches(code)) {
                collector.record(pattern, fileName, ref.name, ref.type,
                        pattern.name() + " detected in statement at line " + statement.getStartLine(),
                        statement.getStartLine());
                recorded++;
            }
        }
        return recorded;
    }

    /**
     * Name and type of the object a statement creates, as far as its text tells.
     */
    public static final class ObjectRef {
        private final String name;
        private final String type;

        private ObjectRef(String name, String type) {
            this.name = name;
            this.type = type;
        }

        public static ObjectRef of(String code, int line) {
            Matcher m = CREATED_OBJECT.matcher(code);
            if (m.find()) {
                return new ObjectRef(m.group(2), m.group(1).toUpperCase(Locale.ROOT));
            }
            return new ObjectRef("statement@line" + line, null);
        }

        public String getName() {
            return name;
        }

        public String getType() {
            return type;
        }
    }
}
