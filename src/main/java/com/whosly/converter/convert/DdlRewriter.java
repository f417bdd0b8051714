package com.whosly.converter.convert;

import com.whosly.converter.ast.ColumnConstraint;
import com.whosly.converter.ast.ColumnDefinition;
import com.whosly.converter.ast.CommentConstraint;
import com.whosly.converter.ast.ComputedColumnConstraint;
import com.whosly.converter.ast.CreateTableNode;
import com.whosly.converter.ast.DataTypeNode;
import com.whosly.converter.ast.GeneratedColumnConstraint;
import com.whosly.converter.ast.GroupingClause;
import com.whosly.converter.ast.MaskingPolicyConstraint;
import com.whosly.converter.ast.NamedProperty;
import com.whosly.converter.ast.RowAccessPolicyProperty;
import com.whosly.converter.ast.TableClause;
import com.whosly.converter.ast.TableCommentProperty;
import com.whosly.converter.ast.TableProperty;
import com.whosly.converter.ast.TagConstraint;
import com.whosly.converter.ast.TagProperty;
import com.whosly.converter.grammar.DialectGrammar;
import com.whosly.converter.parser.SqlParseException;
import com.whosly.converter.review.ManualReviewCollector;
import com.whosly.converter.review.ReviewPattern;
import com.whosly.converter.rules.BehaviorSettings;
import com.whosly.converter.rules.DynamicSizingRule;
import com.whosly.converter.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Rewrites one CREATE TABLE tree into target-dialect DDL plus COMMENT statements.
 *
 * Steps run in a fixed order: types, virtual columns, clause removal, property removal,
 * comment extraction, header normalization, rendering, text cleanup.
 */
public class DdlRewriter {

    private static final Logger log = LoggerFactory.getLogger(DdlRewriter.class);

    private final DialectGrammar sourceGrammar;
    private final DialectGrammar targetGrammar;
    private final RuleSet rules;
    private final ManualReviewCollector reviews;
    private final OutputCleaner cleaner;

    public DdlRewriter(DialectGrammar sourceGrammar, DialectGrammar targetGrammar, RuleSet rules,
                       ManualReviewCollector reviews) {
        this.sourceGrammar = sourceGrammar;
        this.targetGrammar = targetGrammar;
        this.rules = rules;
        this.reviews = reviews;
        BehaviorSettings behaviors = rules.getBehaviors();
        this.cleaner = new OutputCleaner(
                behaviors.isClauseRemoval() ? behaviors.getRemovedClauses() : Collections.<String>emptyList(),
                rules.getOutputAliases());
    }

    /**
     * Never throws: a failure turns the output into a single {@code -- ERROR:} line.
     *
     * @param table     parsed table; mutated in place
     * @param sourceSql statement text, used in error reports
     * @param fileName  owning file, for logs
     * @param line      start line of the statement
     */
    public StatementConversion rewrite(CreateTableNode table, String sourceSql, String fileName, int line) {
        List<ConversionLogEntry> logs = new ArrayList<>();
        BehaviorSettings behaviors = rules.getBehaviors();
        try {
            String tableName = table.getName();
            log.debug("Handling DDL for table: {}", tableName);

            convertDataTypes(table, logs, fileName, line);
            if (behaviors.isVirtualColumnConversion()) {
                convertVirtualColumns(table, logs, fileName, line);
            }
            if (behaviors.isClauseRemoval()) {
                removeClauses(table, behaviors, logs, fileName, line);
            }
            if (behaviors.isWithPropertyRemoval()) {
                removeProperties(table, behaviors, logs, fileName, line);
            }

            String tableComment = extractTableComment(table);
            List<String[]> columnComments = extractColumnComments(table);

            if (table.isReplace()) {
                table.setReplace(false);
                logs.add(new ConversionLogEntry(ConversionAction.REMOVE_REPLACE,
                        "Changed 'CREATE OR REPLACE' to 'CREATE' for '" + tableName + "'.", fileName, line));
            }
            if (behaviors.isTableModifierRemoval()) {
                removeModifiers(table, behaviors, logs, fileName, line);
            }

            List<String> statements = new ArrayList<>();
            statements.add(cleaner.clean(sourceGrammar.print(table)));
            statements.addAll(commentStatements(behaviors, tableName, tableComment, columnComments));
            log.info("Converted table '{}' ({} statement(s))", tableName, statements.size());
            return new StatementConversion(statements, logs);
        } catch (RuntimeException e) {
            String message = "Error handling statement: " + e.getMessage() + ". SQL: " + sourceSql;
            log.error(message, e);
            logs.add(new ConversionLogEntry(ConversionAction.ERROR, message, fileName, line));
            if (reviews != null) {
                reviews.record(ReviewPattern.DDL_REWRITE_FAILED, fileName, table.getName(), "TABLE",
                        "CREATE TABLE could not be rewritten: " + e.getMessage(), line);
            }
            // keep the marker on one line so the statement stays commented out
            return new StatementConversion(
                    Collections.singletonList("-- ERROR: " + message.replaceAll("\\s+", " ")), logs);
        }
    }

    private void convertDataTypes(CreateTableNode table, List<ConversionLogEntry> logs, String fileName, int line) {
        for (ColumnDefinition column : table.getColumns()) {
            DataTypeNode sourceType = column.getDataType();
            String mapped = rules.lookupType(sourceType.getName());
            if (mapped == null) {
                continue;
            }
            try {
                String targetText = mapped;
                boolean dropSourceArguments = false;
                DynamicSizingRule dynamic = rules.lookupDynamicRule(sourceType.getName());
                Long size = sourceType.getSize();
                if (dynamic != null && size != null) {
                    targetText = dynamic.resolve(size, mapped);
                    dropSourceArguments = dynamic.overflows(size);
                }

                DataTypeNode targetType = targetGrammar.parseDataType(targetText);
                // declared size/precision wins over the default written in the mapping
                List<String> arguments;
                if (rules.isParamless(targetType.getName()) || dropSourceArguments) {
                    arguments = Collections.emptyList();
                } else if (sourceType.hasArguments()) {
                    arguments = sourceType.getArguments();
                } else {
                    arguments = targetType.getArguments();
                }
                DataTypeNode converted = targetType.withArguments(arguments);
                column.setDataType(converted);
                log.debug("Data Type: Replaced '{}' with '{}'", sourceType, converted);
            } catch (SqlParseException e) {
                String details = "Cannot convert type " + sourceType + " of column " + column.getName()
                        + " to '" + mapped + "': " + e.getMessage();
                log.error(details);
                logs.add(new ConversionLogEntry(ConversionAction.TYPE_CONVERSION_ERROR, details, fileName, line));
            }
        }
    }

    private void convertVirtualColumns(CreateTableNode table, List<ConversionLogEntry> logs, String fileName, int line) {
        for (ColumnDefinition column : table.getColumns()) {
            if (column.isIdentity()) {
                continue;
            }
            List<ColumnConstraint> constraints = column.getConstraints();
            for (int i = 0; i < constraints.size(); i++) {
                if (constraints.get(i) instanceof ComputedColumnConstraint) {
                    ComputedColumnConstraint computed = (ComputedColumnConstraint) constraints.remove(i);
                    // the generated clause has to come before any inline constraint
                    constraints.add(0, new GeneratedColumnConstraint(computed.getExpression()));
                    logs.add(new ConversionLogEntry(ConversionAction.VIRTUAL_COLUMN,
                            "Converted computed column '" + column.getName() + "' to a virtual column.", fileName, line));
                    log.debug("Converted virtual column '{}'", column.getName());
                    break;
                }
            }
        }
    }

    private void removeClauses(CreateTableNode table, BehaviorSettings behaviors, List<ConversionLogEntry> logs,
                               String fileName, int line) {
        Iterator<TableClause> it = table.getClauses().iterator();
        while (it.hasNext()) {
            TableClause clause = it.next();
            if (!(clause instanceof GroupingClause)) {
                continue;
            }
            GroupingClause grouping = (GroupingClause) clause;
            if (grouping.getKeyword().equals("CLUSTER BY") || behaviors.getRemovedClauses().contains(grouping.getKeyword())) {
                it.remove();
                logs.add(new ConversionLogEntry(ConversionAction.CLAUSE_REMOVED,
                        "Removed " + grouping.getKeyword() + " clause from '" + table.getName() + "'.", fileName, line));
            }
        }
    }

    private void removeProperties(CreateTableNode table, BehaviorSettings behaviors, List<ConversionLogEntry> logs,
                                  String fileName, int line) {
        Iterator<TableClause> it = table.getClauses().iterator();
        while (it.hasNext()) {
            TableClause clause = it.next();
            // comments are extracted later, their text is not a property name
            if (!(clause instanceof TableProperty) || clause instanceof TableCommentProperty) {
                continue;
            }
            String rendered = sourceGrammar.print(clause);
            boolean remove;
            if (clause instanceof RowAccessPolicyProperty || clause instanceof TagProperty) {
                remove = true;
            } else if (rendered.toUpperCase(Locale.ROOT).contains("TAG")) {
                // substring match; also hits names like STAGE_FILE_FORMAT
                remove = true;
            } else {
                remove = clause instanceof NamedProperty
                        && behaviors.getRemovedProperties().contains(((NamedProperty) clause).getName());
            }
            if (remove) {
                it.remove();
                logs.add(new ConversionLogEntry(ConversionAction.PROPERTY_REMOVED,
                        "Removed table property: " + rendered, fileName, line));
                log.debug("Removed WITH property: {}", rendered);
            }
        }

        for (ColumnDefinition column : table.getColumns()) {
            Iterator<ColumnConstraint> constraints = column.getConstraints().iterator();
            while (constraints.hasNext()) {
                ColumnConstraint constraint = constraints.next();
                if (constraint instanceof TagConstraint || constraint instanceof MaskingPolicyConstraint) {
                    constraints.remove();
                    logs.add(new ConversionLogEntry(ConversionAction.PROPERTY_REMOVED,
                            "Removed column property from '" + column.getName() + "': " + sourceGrammar.print(constraint),
                            fileName, line));
                }
            }
        }
    }

    private String extractTableComment(CreateTableNode table) {
        String comment = null;
        Iterator<TableClause> it = table.getClauses().iterator();
        while (it.hasNext()) {
            TableClause clause = it.next();
            if (clause instanceof TableCommentProperty) {
                if (comment == null) {
                    comment = ((TableCommentProperty) clause).getText();
                }
                it.remove();
            }
        }
        return comment;
    }

    private List<String[]> extractColumnComments(CreateTableNode table) {
        List<String[]> comments = new ArrayList<>();
        for (ColumnDefinition column : table.getColumns()) {
            Iterator<ColumnConstraint> it = column.getConstraints().iterator();
            while (it.hasNext()) {
                ColumnConstraint constraint = it.next();
                if (constraint instanceof CommentConstraint) {
                    comments.add(new String[]{column.getName(), ((CommentConstraint) constraint).getText()});
                    it.remove();
                }
            }
        }
        return comments;
    }

    private void removeModifiers(CreateTableNode table, BehaviorSettings behaviors, List<ConversionLogEntry> logs,
                                 String fileName, int line) {
        Iterator<String> it = table.getModifiers().iterator();
        while (it.hasNext()) {
            String modifier = it.next();
            if (behaviors.getRemovedModifiers().contains(modifier)) {
                it.remove();
                logs.add(new ConversionLogEntry(ConversionAction.CLAUSE_REMOVED,
                        "Removed table modifier " + modifier + " from '" + table.getName() + "'.", fileName, line));
            }
        }
    }

    private List<String> commentStatements(BehaviorSettings behaviors, String tableName, String tableComment,
                                           List<String[]> columnComments) {
        List<String> statements = new ArrayList<>();
        if (!behaviors.isCommentConversion()) {
            return statements;
        }
        String tableTemplate = behaviors.getTableCommentTemplate();
        String columnTemplate = behaviors.getColumnCommentTemplate();
        if (tableComment != null && !tableComment.isEmpty() && tableTemplate != null) {
            statements.add(tableTemplate
                    .replace("{table_name}", tableName)
                    .replace("{comment_text}", escape(tableComment)));
        }
        if (columnTemplate != null) {
            for (String[] comment : columnComments) {
                statements.add(columnTemplate
                        .replace("{table_name}", tableName)
                        .replace("{column_name}", comment[0])
                        .replace("{comment_text}", escape(comment[1])));
            }
        }
        return statements;
    }

    private static String escape(String text) {
        return text.replace("'", "''");
    }
}
