package com.whosly.converter.convert;

import com.alibaba.druid.sql.SQLUtils;
import com.whosly.converter.ast.CreateTableNode;
import com.whosly.converter.parser.CreateTableStatement;
import com.whosly.converter.parser.DruidSqlParser;
import com.whosly.converter.parser.DruidStatement;
import com.whosly.converter.parser.OpaqueStatement;
import com.whosly.converter.parser.ParsedStatement;
import com.whosly.converter.parser.SqlDialect;
import com.whosly.converter.parser.SqlParseException;
import com.whosly.converter.parser.SqlParser;
import com.whosly.converter.parser.SqlScriptSplitter;
import com.whosly.converter.review.ManualReviewCollector;
import com.whosly.converter.review.ManualReviewDetector;
import com.whosly.converter.review.ReviewPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Sends CREATE TABLE statements to the {@link DdlRewriter} and re-prints everything else
 * with the target dialect's Druid printer.
 */
public class StatementRouter {

    private static final Logger log = LoggerFactory.getLogger(StatementRouter.class);

    private static final Pattern ROW_ACCESS_POLICY = Pattern.compile(
            "\\s+WITH\\s+ROW\\s+ACCESS\\s+POLICY\\s+[A-Za-z0-9_\"\\.]+\\s+ON\\s*\\([^)]*\\)",
            Pattern.CASE_INSENSITIVE);

    private final SqlParser sourceParser;
    private final SqlDialect target;
    private final DdlRewriter rewriter;
    private final ManualReviewCollector reviews;
    private final ManualReviewDetector detector;

    public StatementRouter(SqlParser sourceParser, SqlDialect target, DdlRewriter rewriter,
                           ManualReviewCollector reviews, ManualReviewDetector detector) {
        this.sourceParser = sourceParser;
        this.target = target;
        this.rewriter = rewriter;
        this.reviews = reviews;
        this.detector = detector;
    }

    public StatementConversion route(ParsedStatement statement, String fileName) {
        if (detector != null) {
            detector.inspect(statement, fileName);
        }
        int line = statement.getStartLine();

        if (statement instanceof CreateTableStatement) {
            CreateTableNode table = ((CreateTableStatement) statement).getTable();
            return rewriter.rewrite(table, statement.getSqlText(), fileName, line);
        }
        if (statement instanceof DruidStatement) {
            return transpile((DruidStatement) statement, fileName);
        }
        if (DruidSqlParser.isCreateTable(statement.getSqlText())) {
            return recover(statement, fileName);
        }
        String reason = statement instanceof OpaqueStatement
                ? ((OpaqueStatement) statement).getParseError() : statement.describe();
        return unparsed(statement, fileName, "Could not parse statement, emitted unchanged: " + reason);
    }

    /**
     * Strips the row access policy clause from the text and parses it again.
     */
    private StatementConversion recover(ParsedStatement statement, String fileName) {
        String code = SqlScriptSplitter.stripComments(statement.getSqlText()).trim();
        String repaired = ROW_ACCESS_POLICY.matcher(code).replaceFirst("");
        try {
            CreateTableNode table = sourceParser.parseCreateTable(repaired);
            log.info("Recovered CREATE TABLE '{}' at line {} by reparsing", table.getName(), statement.getStartLine());
            return rewriter.rewrite(table, statement.getSqlText(), fileName, statement.getStartLine())
                    .withLeadingLog(new ConversionLogEntry(ConversionAction.RECOVERY_REPARSE,
                            "Reparsed CREATE TABLE '" + table.getName() + "' after stripping unsupported clauses.",
                            fileName, statement.getStartLine()));
        } catch (SqlParseException e) {
            return unparsed(statement, fileName, "CREATE TABLE could not be parsed, emitted unchanged: " + e.getMessage());
        }
    }

    private StatementConversion transpile(DruidStatement statement, String fileName) {
        List<ConversionLogEntry> logs = new ArrayList<>();
        try {
            String sql = SQLUtils.toSQLString(statement.getStatement(), target.getDbType());
            logs.add(new ConversionLogEntry(ConversionAction.TRANSPILE_FALLBACK,
                    "Used basic transpiler for statement type: " + statement.describe(),
                    fileName, statement.getStartLine()));
            return new StatementConversion(Collections.singletonList(sql), logs);
        } catch (RuntimeException e) {
            log.warn("Printing {} for {} failed, emitting source text", statement.describe(), target.getDisplayName(), e);
            return unparsed(statement, fileName, "Could not print statement for " + target.getDisplayName()
                    + ", emitted unchanged: " + e.getMessage());
        }
    }

    private StatementConversion unparsed(ParsedStatement statement, String fileName, String details) {
        int line = statement.getStartLine();
        log.warn("{} line {}: {}", fileName, line, details);
        if (reviews != null) {
            ManualReviewDetector.ObjectRef ref = ManualReviewDetector.ObjectRef.of(
                    SqlScriptSplitter.stripComments(statement.getSqlText()), line);
            reviews.record(ReviewPattern.UNPARSED_STATEMENT, fileName, ref.getName(), ref.getType(), details, line);
        }
        List<ConversionLogEntry> logs = Collections.singletonList(
                new ConversionLogEntry(ConversionAction.UNPARSED_FALLBACK, details, fileName, line));
        return new StatementConversion(Collections.singletonList(statement.getSqlText()), logs);
    }
}
