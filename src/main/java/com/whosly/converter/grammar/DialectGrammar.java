package com.whosly.converter.grammar;

import com.whosly.converter.ast.CreateTableNode;
import com.whosly.converter.ast.DataTypeNode;
import com.whosly.converter.ast.DdlNode;
import com.whosly.converter.ast.ExtensionClause;
import com.whosly.converter.parser.SqlDialect;
import com.whosly.converter.parser.SqlParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The CREATE TABLE grammar and printer of one dialect, plus the clause rules registered on it.
 */
public class DialectGrammar {
    private static final Logger log = LoggerFactory.getLogger(DialectGrammar.class);

    private final SqlDialect dialect;
    private final Set<String> appliedExtensions = ConcurrentHashMap.newKeySet();
    private final List<ClauseRule> rules = new CopyOnWriteArrayList<>();
    private final Map<String, ClauseRule> rulesByName = new ConcurrentHashMap<>();

    public DialectGrammar(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    /**
     * Registers an extension's rules. Applying the same extension again is a no-op.
     *
     * @return true if the rules were registered by this call
     */
    public boolean extend(GrammarExtension extension) {
        if (!appliedExtensions.add(extension.getName())) {
            log.debug("Extension {} already registered on {} grammar", extension.getName(), dialect);
            return false;
        }
        for (ClauseRule rule : extension.getRules()) {
            rulesByName.put(rule.getName(), rule);
            rules.add(rule);
        }
        log.info("Registered grammar extension {} on {} ({} rules)",
                extension.getName(), dialect.getDisplayName(), extension.getRules().size());
        return true;
    }

    public boolean isExtendedWith(String extensionName) {
        return appliedExtensions.contains(extensionName);
    }

    public List<ClauseRule> getRules(ClauseScope scope) {
        List<ClauseRule> scoped = new ArrayList<>();
        for (ClauseRule rule : rules) {
            if (rule.getScopes().contains(scope)) {
                scoped.add(rule);
            }
        }
        return scoped;
    }

    public int getRuleCount() {
        return rules.size();
    }

    String printExtension(ExtensionClause node) {
        ClauseRule rule = rulesByName.get(node.getRuleName());
        if (rule == null) {
            throw new IllegalStateException("No print rule '" + node.getRuleName() + "' registered on " + dialect);
        }
        return rule.print(node);
    }

    /**
     * Parses a single CREATE TABLE statement.
     *
     * @param sql statement text, optionally terminated by ';'
     * @return the table node
     * @throws SqlParseException if the text is not a CREATE TABLE this grammar accepts
     */
    public CreateTableNode parseCreateTable(String sql) throws SqlParseException {
        return new CreateTableGrammar(TokenStream.of(sql), this).parseCreateTable();
    }

    /**
     * Parses a type string such as {@code VARCHAR2(100)} or {@code TIMESTAMP WITH LOCAL TIME ZONE}.
     */
    public DataTypeNode parseDataType(String typeText) throws SqlParseException {
        return new CreateTableGrammar(TokenStream.of(typeText), this).parseStandaloneDataType();
    }

    public String print(CreateTableNode table) {
        return new DdlPrinter(this).print(table);
    }

    /**
     * Renders a single node, e.g. one table property, the way it appears in a full statement.
     */
    public String print(DdlNode node) {
        return new DdlPrinter(this).printNode(node);
    }
}
