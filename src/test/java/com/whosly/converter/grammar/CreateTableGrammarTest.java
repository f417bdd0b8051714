package com.whosly.converter.grammar;

import com.whosly.converter.ast.ColumnDefinition;
import com.whosly.converter.ast.CommentConstraint;
import com.whosly.converter.ast.ComputedColumnConstraint;
import com.whosly.converter.ast.CreateTableNode;
import com.whosly.converter.ast.DataTypeNode;
import com.whosly.converter.ast.GroupingClause;
import com.whosly.converter.ast.IdentityConstraint;
import com.whosly.converter.ast.MaskingPolicyConstraint;
import com.whosly.converter.ast.NamedProperty;
import com.whosly.converter.ast.RawTableElement;
import com.whosly.converter.ast.RowAccessPolicyProperty;
import com.whosly.converter.ast.TableCommentProperty;
import com.whosly.converter.ast.TagConstraint;
import com.whosly.converter.ast.TagProperty;
import com.whosly.converter.parser.SqlDialect;
import com.whosly.converter.parser.SqlParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CreateTableGrammarTest {

    private final DialectGrammar snowflake = GrammarRegistry.withDefaultExtensions().grammarFor(SqlDialect.SNOWFLAKE);

    @Test
    void testParseColumnsAndClauses() throws SqlParseException {
        CreateTableNode table = snowflake.parseCreateTable(
                "CREATE OR REPLACE TABLE db.s.orders (\n"
                        + "  id NUMBER(38,0) NOT NULL AUTOINCREMENT START 1 INCREMENT 1,\n"
                        + "  amount NUMBER(10,2) DEFAULT 0,\n"
                        + "  total NUMBER AS (amount * 2),\n"
                        + "  note VARCHAR COMMENT 'it''s',\n"
                        + "  CONSTRAINT pk PRIMARY KEY (id)\n"
                        + ") CLUSTER BY (id) COMMENT = 'Orders' DATA_RETENTION_TIME_IN_DAYS = 1;");

        assertThat(table.isReplace()).isTrue();
        assertThat(table.getName()).isEqualTo("db.s.orders");
        assertThat(table.getElements()).hasSize(5);
        assertThat(table.getElements().get(4)).isInstanceOf(RawTableElement.class);
        assertThat(((RawTableElement) table.getElements().get(4)).getText()).isEqualTo("CONSTRAINT pk PRIMARY KEY (id)");

        ColumnDefinition id = table.getColumns().get(0);
        assertThat(id.getDataType().toString()).isEqualTo("NUMBER(38,0)");
        assertThat(id.isIdentity()).isTrue();
        assertThat(id.getConstraints().get(1)).isInstanceOf(IdentityConstraint.class);

        ColumnDefinition total = table.getColumns().get(2);
        assertThat(total.getConstraints()).hasSize(1);
        assertThat(((ComputedColumnConstraint) total.getConstraints().get(0)).getExpression()).isEqualTo("amount * 2");

        ColumnDefinition note = table.getColumns().get(3);
        assertThat(((CommentConstraint) note.getConstraints().get(0)).getText()).isEqualTo("it's");

        assertThat(table.getClauses()).hasSize(3);
        assertThat(((GroupingClause) table.getClauses().get(0)).getKeyword()).isEqualTo("CLUSTER BY");
        assertThat(((TableCommentProperty) table.getClauses().get(1)).getText()).isEqualTo("Orders");
        NamedProperty retention = (NamedProperty) table.getClauses().get(2);
        assertThat(retention.getName()).isEqualTo("DATA_RETENTION_TIME_IN_DAYS");
        assertThat(retention.getValue()).isEqualTo("1");
    }

    @Test
    void testPrintOneElementAndClausePerLine() throws SqlParseException {
        CreateTableNode table = snowflake.parseCreateTable(
                "create table t (a varchar(10) not null comment 'x', b number as (a || 'y')) cluster by linear (a) copy grants");

        assertThat(snowflake.print(table)).isEqualTo(
                "CREATE TABLE t (\n"
                        + "  a VARCHAR(10) NOT NULL COMMENT 'x',\n"
                        + "  b NUMBER AS (a || 'y')\n"
                        + ")\n"
                        + "CLUSTER BY linear (a)\n"
                        + "COPY GRANTS");
    }

    @Test
    void testTimestampPrecisionBeforeZone() throws SqlParseException {
        CreateTableNode table = snowflake.parseCreateTable(
                "CREATE TABLE t (a TIMESTAMP(9) WITH LOCAL TIME ZONE, b TIMESTAMP WITH TIME ZONE(3), c DOUBLE PRECISION)");

        DataTypeNode a = table.getColumns().get(0).getDataType();
        assertThat(a.getName()).isEqualTo("TIMESTAMP WITH LOCAL TIME ZONE");
        assertThat(a.getArguments()).containsExactly("9");
        assertThat(table.getColumns().get(1).getDataType().toString()).isEqualTo("TIMESTAMP WITH TIME ZONE(3)");
        assertThat(table.getColumns().get(2).getDataType().getName()).isEqualTo("DOUBLE PRECISION");
    }

    @Test
    void testParseDataType() throws SqlParseException {
        DataTypeNode type = snowflake.parseDataType("varchar2(100 CHAR)");

        assertThat(type.getName()).isEqualTo("VARCHAR2");
        assertThat(type.getArguments()).containsExactly("100 CHAR");
        assertThat(type.getSize()).isEqualTo(100L);
        assertThrows(SqlParseException.class, () -> snowflake.parseDataType("VARCHAR2(10) extra"));
    }

    @Test
    void testGeneratedColumnForms() throws SqlParseException {
        CreateTableNode table = snowflake.parseCreateTable(
                "CREATE TABLE t (id NUMBER GENERATED BY DEFAULT ON NULL AS IDENTITY, v NUMBER GENERATED ALWAYS AS (id + 1) VIRTUAL)");

        assertThat(table.getColumns().get(0).isIdentity()).isTrue();
        assertThat(table.getColumns().get(1).getConstraints().get(0)).isInstanceOf(ComputedColumnConstraint.class);
    }

    @Test
    void testSnowflakeExtensionClauses() throws SqlParseException {
        String sql = "CREATE TABLE t (\n"
                + "  email VARCHAR WITH MASKING POLICY gov.mask_email USING (email, region) TAG (pii = 'yes'),\n"
                + "  region VARCHAR\n"
                + ") WITH ROW ACCESS POLICY gov.rap ON (region) WITH TAG (cost_center = 'it''s')";

        CreateTableNode table = snowflake.parseCreateTable(sql);

        ColumnDefinition email = table.getColumns().get(0);
        MaskingPolicyConstraint masking = (MaskingPolicyConstraint) email.getConstraints().get(0);
        assertThat(masking.getPolicyName()).isEqualTo("gov.mask_email");
        assertThat(masking.getUsingColumns()).containsExactly("email", "region");
        assertThat(email.getConstraints().get(1)).isInstanceOf(TagConstraint.class);

        RowAccessPolicyProperty policy = (RowAccessPolicyProperty) table.getClauses().get(0);
        assertThat(policy.getPolicyName()).isEqualTo("gov.rap");
        assertThat(policy.getColumns()).containsExactly("region");
        TagProperty tags = (TagProperty) table.getClauses().get(1);
        assertThat(tags.getTags().get(0).getValue()).isEqualTo("it's");

        assertThat(snowflake.print(table)).isEqualTo(
                "CREATE TABLE t (\n"
                        + "  email VARCHAR WITH MASKING POLICY gov.mask_email USING (email, region) TAG (pii = 'yes'),\n"
                        + "  region VARCHAR\n"
                        + ")\n"
                        + "WITH ROW ACCESS POLICY gov.rap ON (region)\n"
                        + "WITH TAG (cost_center = 'it''s')");
    }

    @Test
    void testVendorClauseFailsWithoutExtension() {
        DialectGrammar plain = new GrammarRegistry().grammarFor(SqlDialect.SNOWFLAKE);

        assertThrows(SqlParseException.class,
                () -> plain.parseCreateTable("CREATE TABLE t (a INT) WITH ROW ACCESS POLICY p ON (a)"));
    }

    @Test
    void testExtensionRegistrationIsIdempotent() {
        DialectGrammar grammar = new GrammarRegistry().grammarFor(SqlDialect.SNOWFLAKE);

        assertThat(grammar.extend(new SnowflakeGrammarExtension())).isTrue();
        int rules = grammar.getRuleCount();
        assertThat(grammar.extend(new SnowflakeGrammarExtension())).isFalse();

        assertThat(grammar.getRuleCount()).isEqualTo(rules);
        assertThat(grammar.isExtendedWith(SnowflakeGrammarExtension.NAME)).isTrue();
        assertThat(grammar.getRules(ClauseScope.TABLE)).hasSize(2);
        assertThat(grammar.getRules(ClauseScope.COLUMN)).hasSize(2);
    }

    @Test
    void testMalformedStatements() {
        assertThrows(SqlParseException.class, () -> snowflake.parseCreateTable("CREATE TABLE t"));
        assertThrows(SqlParseException.class, () -> snowflake.parseCreateTable("CREATE TABLE t (a INT"));
        assertThrows(SqlParseException.class, () -> snowflake.parseCreateTable("CREATE TABLE t (a INT) GARBAGE"));
        assertThrows(SqlParseException.class, () -> snowflake.parseCreateTable("CREATE VIEW v AS SELECT 1"));
    }
}
