package com.whosly.converter.parser;

import com.alibaba.druid.sql.ast.statement.SQLCreateTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.whosly.converter.grammar.GrammarRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DruidSqlParserTest {

    private final GrammarRegistry registry = GrammarRegistry.withDefaultExtensions();

    private final DruidSqlParser parser = new DruidSqlParser(SqlDialect.MYSQL, registry.grammarFor(SqlDialect.MYSQL));

    private final DruidSqlParser snowflake =
            new DruidSqlParser(SqlDialect.SNOWFLAKE, registry.grammarFor(SqlDialect.SNOWFLAKE));

    @Test
    void testValidSqlParsing() {
        ParsedStatement statement = parser.parseStatement("SELECT * FROM users WHERE id = 1", 1, 0);

        assertThat(statement).isInstanceOf(DruidStatement.class);
        assertThat(((DruidStatement) statement).getStatement()).isInstanceOf(SQLSelectStatement.class);
        assertThat(statement.isOpaque()).isFalse();
    }

    @Test
    void testInvalidSqlParsing() {
        ParsedStatement statement = parser.parseStatement("INVALID SQL STATEMENT", 3, 2);

        assertThat(statement).isInstanceOf(OpaqueStatement.class);
        assertThat(statement.isOpaque()).isTrue();
        assertThat(statement.getSqlText()).isEqualTo("INVALID SQL STATEMENT");
        assertThat(statement.getStartLine()).isEqualTo(3);
        assertThat(statement.getOrdinal()).isEqualTo(2);
        assertThat(((OpaqueStatement) statement).getParseError()).isNotBlank();
    }

    @Test
    void testCreateTableUsesDialectGrammar() {
        ParsedStatement statement = snowflake.parseStatement(
                "CREATE OR REPLACE TRANSIENT TABLE s.t (id NUMBER(38,0), name VARCHAR(10))", 1, 0);

        assertThat(statement).isInstanceOf(CreateTableStatement.class);
        CreateTableStatement create = (CreateTableStatement) statement;
        assertThat(create.getTable().getName()).isEqualTo("s.t");
        assertThat(create.getTable().isReplace()).isTrue();
        assertThat(create.getTable().getModifiers()).containsExactly("TRANSIENT");
        assertThat(create.getTable().getColumns()).hasSize(2);
    }

    @Test
    void testCreateTableAsSelectFallsBackToDruid() {
        ParsedStatement statement = snowflake.parseStatement("CREATE TABLE t2 AS SELECT * FROM t1", 4, 0);

        assertThat(statement).isInstanceOf(DruidStatement.class);
        SQLCreateTableStatement create = (SQLCreateTableStatement) ((DruidStatement) statement).getStatement();
        assertThat(create.getSelect()).isNotNull();
        assertThat(statement.getStartLine()).isEqualTo(4);
    }

    @Test
    void testScriptParsingIsLenient() {
        String script = "\uFEFFCREATE TABLE a (id INT);\r\n"
                + "SELECT * FROM (;\r\n"
                + "-- just a comment\r\n"
                + "SELECT 1;";

        List<ParsedStatement> statements = snowflake.parseScript(script);

        assertThat(statements).hasSize(3);
        assertThat(statements.get(0)).isInstanceOf(CreateTableStatement.class);
        assertThat(statements.get(1)).isInstanceOf(OpaqueStatement.class);
        assertThat(statements.get(2)).isInstanceOf(DruidStatement.class);
        assertThat(statements.get(1).getStartLine()).isEqualTo(2);
        assertThat(statements.get(2).getStartLine()).isEqualTo(4);
        assertThat(statements.get(2).getOrdinal()).isEqualTo(2);
    }

    @Test
    void testStrictCreateTableParsing() {
        assertThrows(SqlParseException.class, () -> snowflake.parseCreateTable("CREATE TABLE t"));
    }

    @Test
    void testCreateTableDetection() {
        assertThat(DruidSqlParser.isCreateTable("/* header */ create or replace table t (a int)")).isTrue();
        assertThat(DruidSqlParser.isCreateTable("CREATE LOCAL TEMPORARY TABLE t (a int)")).isTrue();
        assertThat(DruidSqlParser.isCreateTable("CREATE VIEW v AS SELECT 1")).isFalse();
        assertThat(DruidSqlParser.isCreateTable("CREATE TABLESPACE ts")).isFalse();
    }
}
