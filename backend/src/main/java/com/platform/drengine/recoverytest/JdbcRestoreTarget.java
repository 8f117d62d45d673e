package com.platform.drengine.recoverytest;

import com.platform.drengine.backup.RowValues;
import com.platform.drengine.core.SqlIdentifiers;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.replication.RegionDataSources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Restore target writing into an environment's MySQL clone.
 */
@Slf4j
@Component
public class JdbcRestoreTarget implements RestoreTarget {
    
    private static final Pattern ISO_INSTANT = Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?Z");
    private static final int BATCH_SIZE = 500;
    
    private final RegionDataSources dataSources;
    
    public JdbcRestoreTarget(RegionDataSources dataSources) {
        this.dataSources = dataSources;
    }
    
    @Override
    public void clear(String environment, Collection<String> tables) {
        try (Connection conn = dataSources.forEnvironment(environment).getConnection();
             Statement stmt = conn.createStatement()) {
            conn.setAutoCommit(false);
            for (String table : tables) {
                stmt.executeUpdate("DELETE FROM " + qualified(table));
            }
            conn.commit();
        } catch (SQLException e) {
            throw failure(environment, "clear tables", e);
        }
    }
    
    @Override
    public void load(String environment, String table, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return;
        }
        try (Connection conn = dataSources.forEnvironment(environment).getConnection()) {
            conn.setAutoCommit(false);
            // rows of one table can carry different column sets after schema changes
            Map<List<String>, List<Map<String, Object>>> byColumns = rows.stream()
                .collect(Collectors.groupingBy(row -> new ArrayList<>(row.keySet()), LinkedHashMap::new, Collectors.toList()));
            
            for (Map.Entry<List<String>, List<Map<String, Object>>> group : byColumns.entrySet()) {
                List<String> columns = group.getKey();
                columns.forEach(SqlIdentifiers::require);
                String sql = "REPLACE INTO " + qualified(table)
                    + " (" + columns.stream().map(c -> "`" + c + "`").collect(Collectors.joining(", ")) + ")"
                    + " VALUES (" + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
                
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    int pending = 0;
                    for (Map<String, Object> row : group.getValue()) {
                        for (int i = 0; i < columns.size(); i++) {
                            stmt.setObject(i + 1, toJdbc(row.get(columns.get(i))));
                        }
                        stmt.addBatch();
                        if (++pending == BATCH_SIZE) {
                            stmt.executeBatch();
                            pending = 0;
                        }
                    }
                    if (pending > 0) {
                        stmt.executeBatch();
                    }
                }
            }
            conn.commit();
            log.debug("Loaded {} rows into {} on {}", rows.size(), table, environment);
        } catch (SQLException e) {
            throw failure(environment, "load " + table, e);
        }
    }
    
    @Override
    public List<Map<String, Object>> read(String environment, String table) {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (Connection conn = dataSources.forEnvironment(environment).getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT * FROM " + qualified(table))) {
            ResultSetMetaData meta = rs.getMetaData();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int c = 1; c <= meta.getColumnCount(); c++) {
                    row.put(meta.getColumnLabel(c).toLowerCase(), RowValues.normalize(rs.getObject(c)));
                }
                rows.add(row);
            }
        } catch (SQLException e) {
            throw failure(environment, "read " + table, e);
        }
        return rows;
    }
    
    private static Object toJdbc(Object value) {
        if (value instanceof String text && ISO_INSTANT.matcher(text).matches()) {
            try {
                return Timestamp.from(Instant.parse(text));
            } catch (DateTimeParseException e) {
                return text;
            }
        }
        return value;
    }
    
    private static String qualified(String table) {
        int dot = table.indexOf('.');
        if (dot <= 0) {
            return "`" + SqlIdentifiers.require(table) + "`";
        }
        return SqlIdentifiers.qualified(table.substring(0, dot), table.substring(dot + 1));
    }
    
    private static ExternalSystemException failure(String environment, String action, SQLException e) {
        return new ExternalSystemException(ErrorCode.RESTORE_FAILED, environment,
            "Restore target failed to " + action + ": " + e.getMessage(), e);
    }
}
