package com.whosly.converter.service;

import com.whosly.converter.parser.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@code 00_cleanup.sql}: one DROP per object the converted scripts create.
 */
public class CleanupScriptGenerator {

    private static final Logger log = LoggerFactory.getLogger(CleanupScriptGenerator.class);

    public static final String FILE_NAME = "00_cleanup.sql";

    private static final Pattern CREATED_OBJECT = Pattern.compile(
            "^\\s*CREATE\\s+(?:OR\\s+REPLACE\\s+)?(TABLE|VIEW|SEQUENCE|PROCEDURE|FUNCTION|PACKAGE|MATERIALIZED\\s+VIEW)"
                    + "\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?([\\w\"\\.]+)",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private final SqlDialect target;

    public CleanupScriptGenerator(SqlDialect target) {
        this.target = target;
    }

    /**
     * @return DROP statements sorted by type then name, one per distinct object
     */
    public List<String> dropStatements(Collection<String> convertedStatements) {
        TreeSet<String[]> objects = new TreeSet<>((a, b) -> {
            int byType = a[0].compareTo(b[0]);
            return byType != 0 ? byType : a[1].compareTo(b[1]);
        });
        for (String statement : convertedStatements) {
            Matcher m = CREATED_OBJECT.matcher(statement);
            if (m.find()) {
                String type = m.group(1).toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
                objects.add(new String[]{type, m.group(2).replace("\"", "")});
            }
        }
        List<String> drops = new ArrayList<>();
        for (String[] object : objects) {
            String suffix = "TABLE".equals(object[0]) ? target.getDropTableSuffix() : "";
            drops.add("DROP " + object[0] + " " + object[1] + suffix + ";");
        }
        return drops;
    }

    /**
     * Writes the script into the output directory.
     *
     * @return the script path, or null when no object was created
     * @throws IOException if the file cannot be written
     */
    public Path write(Path outputDir, Collection<String> convertedStatements) throws IOException {
        List<String> drops = dropStatements(convertedStatements);
        if (drops.isEmpty()) {
            log.info("No created objects found, cleanup script not written");
            return null;
        }
        Path script = outputDir.resolve(FILE_NAME);
        Files.write(script, (String.join("\n", drops) + "\n").getBytes(StandardCharsets.UTF_8));
        log.info("Cleanup script written: {} ({} DROP statement(s))", script, drops.size());
        return script;
    }
}
