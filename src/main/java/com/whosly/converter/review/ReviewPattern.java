package com.whosly.converter.review;

import java.util.regex.Pattern;

/**
 * Issue types recorded for manual review. Patterns with a regex are detected on statement text;
 * the others are recorded by the pipeline stage that hits them.
 */
public enum ReviewPattern {

    UPDATE_FROM_SYNTAX(ReviewSeverity.ERROR,
            "Convert UPDATE...FROM to a MERGE statement or correlated subquery",
            "^\\s*UPDATE\\b[^;]*?\\bSET\\b[^;]*?\\bFROM\\b"),
    LATERAL_FLATTEN(ReviewSeverity.WARNING,
            "Replace LATERAL FLATTEN with JSON_TABLE or XMLTABLE",
            "\\bLATERAL\\s+FLATTEN\\b"),
    QUALIFY_CLAUSE(ReviewSeverity.WARNING,
            "Replace QUALIFY with a nested query filtering on ROW_NUMBER()",
            "\\bQUALIFY\\b"),
    DYNAMIC_SQL(ReviewSeverity.WARNING,
            "Review EXECUTE IMMEDIATE statements for target syntax compatibility",
            "\\bEXECUTE\\s+IMMEDIATE\\b"),
    COMPLEX_DATA_TYPES(ReviewSeverity.INFO,
            "Review complex data types (ARRAY, VARIANT, OBJECT, GEOGRAPHY) for target equivalents",
            "\\b(VARIANT|ARRAY|OBJECT|GEOGRAPHY)\\b"),
    EXTERNAL_LANGUAGE(ReviewSeverity.ERROR,
            "Replace external language routines (JavaScript, Python) with PL/SQL or Java",
            "\\bLANGUAGE\\s+(JAVASCRIPT|PYTHON|JAVA|SCALA)\\b"),
    UNPARSED_STATEMENT(ReviewSeverity.WARNING,
            "Convert the statement by hand; it was copied unchanged", null),
    DDL_REWRITE_FAILED(ReviewSeverity.ERROR,
            "Rewrite the table definition by hand; the output contains an error marker", null);

    private final ReviewSeverity severity;
    private final String suggestedAction;
    private final Pattern pattern;

    ReviewPattern(ReviewSeverity severity, String suggestedAction, String regex) {
        this.severity = severity;
        this.suggestedAction = suggestedAction;
        this.pattern = regex == null ? null : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public ReviewSeverity getSeverity() {
        return severity;
    }

    public String getSuggestedAction() {
        return suggestedAction;
    }

    public boolean isDetectable() {
        return pattern != null;
    }

    public boolean matches(String text) {
        return pattern != null && pattern.matcher(text).find();
    }
}
