package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs one SQL statement against a SQLite database file in the workspace.
 *
 * Queries return {columns, rows, truncated}; other statements return the
 * update count. Statements that destroy data are refused, and so are
 * statements that name another database file (ATTACH, VACUUM INTO), since
 * their file names never pass through the sandbox.
 */
@Component
public class SqlQueryCapability implements Capability {

    static final int MAX_ROWS = 500;

    private static final Pattern DESTRUCTIVE = Pattern.compile(
            "\\b(DELETE|DROP|TRUNCATE)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern OTHER_FILE = Pattern.compile(
            "\\b(ATTACH|DETACH|VACUUM)\\b", Pattern.CASE_INSENSITIVE);

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "sql_query", "1.0.0",
            "Run one SQL statement against a SQLite database file in the workspace (created if missing). "
                    + "SELECT returns rows as JSON (at most 500). DELETE, DROP, TRUNCATE, ATTACH and VACUUM are refused.",
            ArgumentSchema.of(
                    ArgumentSpec.required("database", ArgumentType.PATH, "SQLite database file"),
                    ArgumentSpec.required("query", ArgumentType.STRING, "a single SQL statement")),
            SideEffectClass.FILESYSTEM_WRITE);

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        String rawDb = CapabilityArgs.string(arguments, "database");
        String query = CapabilityArgs.string(arguments, "query").trim();

        if (query.isEmpty()) {
            throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT, "empty query");
        }
        if (DESTRUCTIVE.matcher(query).find()) {
            throw new CapabilityException(CapabilityException.Kind.POLICY_VIOLATION,
                    "destructive statements are not permitted");
        }
        if (OTHER_FILE.matcher(query).find()) {
            throw new CapabilityException(CapabilityException.Kind.POLICY_VIOLATION,
                    "statements that open other database files are not permitted");
        }

        Path db = ctx.sandbox().resolve(rawDb);
        if (Files.isDirectory(db)) {
            return CapabilityResult.failure("database path is a directory: " + rawDb);
        }

        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + db,
                connectionConfig().toProperties());
             Statement stmt = conn.createStatement()) {
            if (stmt.execute(query)) {
                try (ResultSet rs = stmt.getResultSet()) {
                    return CapabilityResult.ok(readRows(rs));
                }
            }
            return CapabilityResult.ok(Map.of("updated", stmt.getUpdateCount()));
        } catch (SQLException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "SQL error: " + e.getMessage(), e);
        }
    }

    // No attached databases: ATTACH and VACUUM INTO fail even if the text check misses them.
    static SQLiteConfig connectionConfig() {
        SQLiteConfig config = new SQLiteConfig();
        config.setPragma(SQLiteConfig.Pragma.LIMIT_ATTACHED, "0");
        return config;
    }

    private static Map<String, Object> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<String> columns = new ArrayList<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (rows.size() == MAX_ROWS) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns.size(); i++) {
                row.put(columns.get(i - 1), rs.getObject(i));
            }
            rows.add(row);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("columns", columns);
        payload.put("rows", rows);
        payload.put("truncated", truncated);
        return payload;
    }
}
