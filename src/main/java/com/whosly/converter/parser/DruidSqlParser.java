package com.whosly.converter.parser;

import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.parser.ParserException;
import com.whosly.converter.ast.CreateTableNode;
import com.whosly.converter.grammar.DialectGrammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Implementation of SqlParser using Alibaba Druid for generic statements and the dialect's
 * CREATE TABLE grammar for table definitions.
 */
public class DruidSqlParser implements SqlParser {

    private static final Logger log = LoggerFactory.getLogger(DruidSqlParser.class);

    private static final Pattern CREATE_TABLE = Pattern.compile(
            "^CREATE\\s+(OR\\s+REPLACE\\s+)?((LOCAL|GLOBAL)\\s+)?((TEMPORARY|TEMP|VOLATILE|TRANSIENT)\\s+)?TABLE\\b",
            Pattern.CASE_INSENSITIVE);

    private final SqlDialect dialect;
    private final DialectGrammar grammar;

    public DruidSqlParser(SqlDialect dialect, DialectGrammar grammar) {
        this.dialect = dialect;
        this.grammar = grammar;
    }

    @Override
    public SqlDialect getDialect() {
        return dialect;
    }

    @Override
    public List<ParsedStatement> parseScript(String script) {
        String normalized = normalize(script);
        List<ParsedStatement> statements = new ArrayList<>();
        int ordinal = 0;
        int opaque = 0;
        for (SqlScriptSplitter.Segment segment : SqlScriptSplitter.split(normalized)) {
            ParsedStatement statement = parseStatement(segment.getText(), segment.getStartLine(), ordinal++);
            if (statement.isOpaque()) {
                opaque++;
            }
            statements.add(statement);
        }
        log.debug("Parsed {} {} statements ({} opaque)", statements.size(), dialect.getDisplayName(), opaque);
        return statements;
    }

    @Override
    public ParsedStatement parseStatement(String sql, int startLine, int ordinal) {
        try {
            if (isCreateTable(sql)) {
                try {
                    return new CreateTableStatement(sql, startLine, ordinal, grammar.parseCreateTable(sql));
                } catch (SqlParseException e) {
                    // CREATE TABLE ... AS SELECT and friends have no column list
                    log.debug("CREATE TABLE at line {} not handled by the {} grammar, trying Druid: {}",
                            startLine, dialect.getDisplayName(), e.getMessage());
                }
            }
            return new DruidStatement(sql, startLine, ordinal, parseWithDruid(sql));
        } catch (SqlParseException e) {
            log.debug("Statement at line {} left unparsed: {}", startLine, e.getMessage());
            return new OpaqueStatement(sql, startLine, ordinal, e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Parser failed on statement at line {}", startLine, e);
            return new OpaqueStatement(sql, startLine, ordinal, String.valueOf(e.getMessage()));
        }
    }

    @Override
    public CreateTableNode parseCreateTable(String sql) throws SqlParseException {
        return grammar.parseCreateTable(sql);
    }

    /**
     * @return true if the statement, comments ignored, starts a CREATE TABLE
     */
    public static boolean isCreateTable(String sql) {
        return CREATE_TABLE.matcher(SqlScriptSplitter.stripComments(sql).trim()).find();
    }

    private SQLStatement parseWithDruid(String sql) throws SqlParseException {
        List<SQLStatement> statements;
        try {
            statements = SQLUtils.parseStatements(sql, dialect.getDbType());
        } catch (ParserException e) {
            throw new SqlParseException("Failed to parse SQL statement: " + e.getMessage(), e);
        }
        if (statements.size() != 1) {
            throw new SqlParseException("Expected one statement but parsed " + statements.size());
        }
        return statements.get(0);
    }

    static String normalize(String script) {
        String text = script;
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
