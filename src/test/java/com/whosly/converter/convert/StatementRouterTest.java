package com.whosly.converter.convert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whosly.converter.grammar.DialectGrammar;
import com.whosly.converter.grammar.GrammarRegistry;
import com.whosly.converter.parser.DruidSqlParser;
import com.whosly.converter.parser.DruidStatement;
import com.whosly.converter.parser.OpaqueStatement;
import com.whosly.converter.parser.ParsedStatement;
import com.whosly.converter.parser.SqlDialect;
import com.whosly.converter.review.ManualReviewCollector;
import com.whosly.converter.review.ManualReviewDetector;
import com.whosly.converter.review.ManualReviewItem;
import com.whosly.converter.review.ReviewPattern;
import com.whosly.converter.rules.RuleSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StatementRouterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path outputDir;

    private ManualReviewCollector reviews;

    @BeforeEach
    void setUp() {
        reviews = new ManualReviewCollector(outputDir, objectMapper);
    }

    private StatementRouter router(DruidSqlParser parser, DialectGrammar source) {
        DialectGrammar oracle = new GrammarRegistry().grammarFor(SqlDialect.ORACLE);
        DdlRewriter rewriter = new DdlRewriter(source, oracle, RuleSet.empty(), reviews);
        return new StatementRouter(parser, SqlDialect.ORACLE, rewriter, reviews, new ManualReviewDetector(reviews));
    }

    private static boolean hasIssue(ManualReviewCollector reviews, ReviewPattern pattern) {
        for (ManualReviewItem item : reviews.getItems()) {
            if (item.getIssueType().equals(pattern.name())) {
                return true;
            }
        }
        return false;
    }

    @Test
    void testCreateTableGoesToRewriter() {
        DialectGrammar snowflake = GrammarRegistry.withDefaultExtensions().grammarFor(SqlDialect.SNOWFLAKE);
        DruidSqlParser parser = new DruidSqlParser(SqlDialect.SNOWFLAKE, snowflake);

        StatementConversion conversion = router(parser, snowflake)
                .route(parser.parseStatement("CREATE OR REPLACE TABLE t (a VARIANT)", 4, 0), "a.sql");

        assertThat(conversion.getStatements()).hasSize(1);
        assertThat(conversion.getStatements().get(0)).startsWith("CREATE TABLE t (");
        assertThat(conversion.getLogs().get(0).getAction()).isEqualTo(ConversionAction.REMOVE_REPLACE);
        assertThat(hasIssue(reviews, ReviewPattern.COMPLEX_DATA_TYPES)).isTrue();
    }

    @Test
    void testOtherStatementsArePrintedForTarget() {
        DialectGrammar snowflake = GrammarRegistry.withDefaultExtensions().grammarFor(SqlDialect.SNOWFLAKE);
        DruidSqlParser parser = new DruidSqlParser(SqlDialect.SNOWFLAKE, snowflake);
        ParsedStatement statement = parser.parseStatement("select a, b from t where a = 1", 1, 0);
        assertThat(statement).isInstanceOf(DruidStatement.class);

        StatementConversion conversion = router(parser, snowflake).route(statement, "a.sql");

        assertThat(conversion.getStatements()).hasSize(1);
        assertThat(conversion.getStatements().get(0).toUpperCase()).contains("SELECT").contains("FROM T");
        assertThat(conversion.getLogs()).hasSize(1);
        assertThat(conversion.getLogs().get(0).getAction()).isEqualTo(ConversionAction.TRANSPILE_FALLBACK);
        assertThat(conversion.getLogs().get(0).getDetails()).startsWith("Used basic transpiler for statement type: ");
    }

    @Test
    void testCreateTableAsSelectIsPrintedForTarget() {
        DialectGrammar snowflake = GrammarRegistry.withDefaultExtensions().grammarFor(SqlDialect.SNOWFLAKE);
        DruidSqlParser parser = new DruidSqlParser(SqlDialect.SNOWFLAKE, snowflake);

        StatementConversion conversion = router(parser, snowflake)
                .route(parser.parseStatement("CREATE TABLE t2 AS SELECT * FROM t1", 1, 0), "a.sql");

        assertThat(conversion.hasErrors()).isFalse();
        assertThat(conversion.getLogs().get(0).getAction()).isEqualTo(ConversionAction.TRANSPILE_FALLBACK);
        assertThat(conversion.getStatements().get(0).toUpperCase()).startsWith("CREATE TABLE T2").contains("SELECT");
        assertThat(hasIssue(reviews, ReviewPattern.UNPARSED_STATEMENT)).isFalse();
    }

    @Test
    void testRecoveryReparseStripsRowAccessPolicy() {
        DialectGrammar plain = new GrammarRegistry().grammarFor(SqlDialect.SNOWFLAKE);
        DruidSqlParser parser = new DruidSqlParser(SqlDialect.SNOWFLAKE, plain);
        ParsedStatement statement = parser.parseStatement(
                "CREATE OR REPLACE TABLE t (a NUMBER, region VARCHAR) WITH ROW ACCESS POLICY gov.rap ON (region)", 2, 0);
        assertThat(statement).isInstanceOf(OpaqueStatement.class);

        StatementConversion conversion = router(parser, plain).route(statement, "a.sql");

        assertThat(conversion.getLogs().get(0).getAction()).isEqualTo(ConversionAction.RECOVERY_REPARSE);
        assertThat(conversion.getStatements().get(0)).startsWith("CREATE TABLE t (").doesNotContain("ROW ACCESS");
        assertThat(conversion.hasErrors()).isFalse();
    }

    @Test
    void testUnrecoverableCreateTableIsEmittedUnchanged() {
        DialectGrammar plain = new GrammarRegistry().grammarFor(SqlDialect.SNOWFLAKE);
        DruidSqlParser parser = new DruidSqlParser(SqlDialect.SNOWFLAKE, plain);
        String sql = "CREATE TABLE my_table (a NUMBER) WITH TAG (owner = 'x')";

        StatementConversion conversion = router(parser, plain).route(parser.parseStatement(sql, 3, 0), "a.sql");

        assertThat(conversion.getStatements()).containsExactly(sql);
        assertThat(conversion.getLogs().get(0).getAction()).isEqualTo(ConversionAction.UNPARSED_FALLBACK);
        assertThat(conversion.hasErrors()).isTrue();
        assertThat(reviews.getItems()).hasSize(1);
        ManualReviewItem item = reviews.getItems().get(0);
        assertThat(item.getIssueType()).isEqualTo(ReviewPattern.UNPARSED_STATEMENT.name());
        assertThat(item.getObjectName()).isEqualTo("my_table");
        assertThat(item.getObjectType()).isEqualTo("TABLE");
        assertThat(item.getLineNumber()).isEqualTo(3);
    }

    @Test
    void testUnparsedStatementIsEmittedUnchanged() {
        DialectGrammar snowflake = GrammarRegistry.withDefaultExtensions().grammarFor(SqlDialect.SNOWFLAKE);
        DruidSqlParser parser = new DruidSqlParser(SqlDialect.SNOWFLAKE, snowflake);

        StatementConversion conversion = router(parser, snowflake)
                .route(new OpaqueStatement("MERGE SOMETHING ODD", 9, 0, "syntax error"), "b.sql");

        assertThat(conversion.getStatements()).containsExactly("MERGE SOMETHING ODD");
        assertThat(conversion.getLogs().get(0).getAction()).isEqualTo(ConversionAction.UNPARSED_FALLBACK);
        assertThat(conversion.getLogs().get(0).getDetails()).contains("syntax error");
        assertThat(hasIssue(reviews, ReviewPattern.UNPARSED_STATEMENT)).isTrue();
    }

    @Test
    void testDetectorsRunOnEveryStatement() {
        DialectGrammar snowflake = GrammarRegistry.withDefaultExtensions().grammarFor(SqlDialect.SNOWFLAKE);
        DruidSqlParser parser = new DruidSqlParser(SqlDialect.SNOWFLAKE, snowflake);

        router(parser, snowflake).route(new OpaqueStatement(
                "UPDATE t SET a = s.a FROM s WHERE t.id = s.id", 1, 0, "unsupported"), "c.sql");

        assertThat(hasIssue(reviews, ReviewPattern.UPDATE_FROM_SYNTAX)).isTrue();
        assertThat(hasIssue(reviews, ReviewPattern.UNPARSED_STATEMENT)).isTrue();
    }
}
