package com.whosly.converter.parser;

import com.alibaba.druid.DbType;

import java.util.Locale;

/**
 * Enum representing the SQL dialects the converter can read or write.
 *
 * Each dialect names the Druid grammar used to parse and print generic statements
 * in it. Snowflake has no grammar of its own in Druid, so its generic statements go
 * through the PostgreSQL grammar and CREATE TABLE goes through the extensible grammar.
 */
public enum SqlDialect {
    SNOWFLAKE("Snowflake", "snowflake", DbType.postgresql, ""),
    ORACLE("Oracle", "oracle", DbType.oracle, " CASCADE CONSTRAINTS"),
    POSTGRESQL("PostgreSQL", "postgresql", DbType.postgresql, " CASCADE"),
    MYSQL("MySQL", "mysql", DbType.mysql, ""),
    SQLSERVER("SQL Server", "sqlserver", DbType.sqlserver, "");

    private final String displayName;
    private final String configKey;
    private final DbType dbType;
    private final String dropTableSuffix;

    SqlDialect(String displayName, String configKey, DbType dbType, String dropTableSuffix) {
        this.displayName = displayName;
        this.configKey = configKey;
        this.dbType = dbType;
        this.dropTableSuffix = dropTableSuffix;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Lower-case key used in rule bundle directory names, e.g. {@code snowflake_oracle}.
     */
    public String getConfigKey() {
        return configKey;
    }

    public DbType getDbType() {
        return dbType;
    }

    public String getDropTableSuffix() {
        return dropTableSuffix;
    }

    /**
     * Resolve a dialect from a user supplied name.
     *
     * @param name dialect name, case-insensitive; {@code postgres} is accepted for PostgreSQL
     * @return the dialect
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public static SqlDialect fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dialect name must not be empty");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if ("postgres".equals(key)) {
            return POSTGRESQL;
        }
        for (SqlDialect dialect : values()) {
            if (dialect.configKey.equals(key) || dialect.name().equalsIgnoreCase(key)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unsupported SQL dialect: " + name);
    }
}
