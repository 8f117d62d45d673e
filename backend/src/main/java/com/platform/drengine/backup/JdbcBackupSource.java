package com.platform.drengine.backup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.drengine.core.SqlIdentifiers;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ExternalSystemException;
import com.platform.drengine.replication.RegionDataSources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Backup source reading MySQL tables over JDBC.
 * 
 * Full backups copy every row. Incremental backups copy rows whose {@code updated_at}
 * falls in the change window. Log archives copy the {@code dr_change_log} table, which
 * holds one row per committed change: {@code (table_name, operation, key_json, row_json, changed_at)}.
 */
@Slf4j
@Component
public class JdbcBackupSource implements BackupSource {
    
    static final String CHANGE_LOG_TABLE = "dr_change_log";
    static final String UPDATED_AT_COLUMN = "updated_at";
    static final String TENANT_COLUMN = "tenant_id";
    
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    
    private final RegionDataSources dataSources;
    private final ObjectMapper objectMapper;
    
    public JdbcBackupSource(RegionDataSources dataSources, ObjectMapper objectMapper) {
        this.dataSources = dataSources;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public CaptureResult capture(String sourceRegion, BackupScope scope, BackupType type, Instant since, Instant until) {
        try (Connection conn = dataSources.forRegion(sourceRegion).getConnection()) {
            conn.setReadOnly(true);
            List<TableRef> tables = resolveTables(conn, scope);
            List<BackupRecord> records = switch (type) {
                case FULL -> captureRows(conn, tables, scope, null, until);
                case INCREMENTAL -> captureRows(conn, tables, scope, since, until);
                case LOG_ARCHIVE -> captureChangeLog(conn, tables, scope, since, until);
            };
            List<String> names = tables.stream().map(TableRef::qualifiedName).toList();
            log.debug("Captured {} records from {} tables on {} ({})", records.size(), names.size(), sourceRegion, type);
            return new CaptureResult(names, records);
        } catch (SQLException e) {
            throw new ExternalSystemException(ErrorCode.REGION_UNREACHABLE, sourceRegion,
                "Backup capture failed: " + e.getMessage(), e);
        }
    }
    
    private List<TableRef> resolveTables(Connection conn, BackupScope scope) throws SQLException {
        Set<TableRef> tables = new LinkedHashSet<>();
        DatabaseMetaData metaData = conn.getMetaData();
        List<String> schemas = scope.schemas().isEmpty() ? List.of(conn.getCatalog()) : scope.schemas();
        
        if (scope.tables().isEmpty()) {
            for (String schema : schemas) {
                try (ResultSet rs = metaData.getTables(SqlIdentifiers.require(schema), null, "%", new String[]{"TABLE"})) {
                    while (rs.next()) {
                        String table = rs.getString("TABLE_NAME");
                        if (!CHANGE_LOG_TABLE.equalsIgnoreCase(table)) {
                            tables.add(new TableRef(schema, table));
                        }
                    }
                }
            }
        } else {
            for (String table : scope.tables()) {
                int dot = table.indexOf('.');
                if (dot > 0) {
                    tables.add(new TableRef(SqlIdentifiers.require(table.substring(0, dot)),
                        SqlIdentifiers.require(table.substring(dot + 1))));
                } else {
                    for (String schema : schemas) {
                        tables.add(new TableRef(SqlIdentifiers.require(schema), SqlIdentifiers.require(table)));
                    }
                }
            }
        }
        return new ArrayList<>(tables);
    }
    
    private List<BackupRecord> captureRows(Connection conn, List<TableRef> tables, BackupScope scope,
                                           Instant since, Instant until) throws SQLException {
        List<BackupRecord> records = new ArrayList<>();
        for (TableRef table : tables) {
            List<String> keyColumns = primaryKey(conn, table);
            Set<String> columns = columns(conn, table);
            boolean hasUpdatedAt = columns.contains(UPDATED_AT_COLUMN);
            boolean tenantFiltered = scope.isTenantScoped() && columns.contains(TENANT_COLUMN);
            
            StringBuilder sql = new StringBuilder("SELECT * FROM ")
                .append(SqlIdentifiers.qualified(table.schema(), table.table()))
                .append(" WHERE 1 = 1");
            List<Object> params = new ArrayList<>();
            if (since != null) {
                if (!hasUpdatedAt) {
                    // no change tracking column: the whole table is the change set
                    log.warn("Table {} has no {} column, copying it in full", table.qualifiedName(), UPDATED_AT_COLUMN);
                } else {
                    sql.append(" AND ").append(UPDATED_AT_COLUMN).append(" > ?");
                    params.add(Timestamp.from(since));
                }
            }
            if (hasUpdatedAt && until != null) {
                sql.append(" AND ").append(UPDATED_AT_COLUMN).append(" <= ?");
                params.add(Timestamp.from(until));
            }
            if (tenantFiltered) {
                sql.append(" AND ").append(TENANT_COLUMN).append(" = ?");
                params.add(scope.tenantId());
            }
            
            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    ResultSetMetaData meta = rs.getMetaData();
                    while (rs.next()) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        for (int c = 1; c <= meta.getColumnCount(); c++) {
                            row.put(meta.getColumnLabel(c).toLowerCase(), RowValues.normalize(rs.getObject(c)));
                        }
                        Map<String, Object> key = new LinkedHashMap<>();
                        for (String keyColumn : keyColumns) {
                            key.put(keyColumn, row.get(keyColumn));
                        }
                        Instant changedAt = hasUpdatedAt && rs.getTimestamp(UPDATED_AT_COLUMN) != null
                            ? rs.getTimestamp(UPDATED_AT_COLUMN).toInstant()
                            : null;
                        records.add(BackupRecord.upsert(table.qualifiedName(), key, row, changedAt));
                    }
                }
            }
        }
        return records;
    }
    
    private List<BackupRecord> captureChangeLog(Connection conn, List<TableRef> tables, BackupScope scope,
                                                Instant since, Instant until) throws SQLException {
        Set<String> wanted = new LinkedHashSet<>();
        tables.forEach(t -> wanted.add(t.qualifiedName().toLowerCase()));
        
        String sql = "SELECT table_name, operation, key_json, row_json, changed_at FROM " + CHANGE_LOG_TABLE
            + " WHERE changed_at > ? AND changed_at <= ?"
            + (scope.isTenantScoped() ? " AND " + TENANT_COLUMN + " = ?" : "")
            + " ORDER BY changed_at, id";
        
        List<BackupRecord> records = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setTimestamp(1, Timestamp.from(since != null ? since : Instant.EPOCH));
            stmt.setTimestamp(2, Timestamp.from(until));
            if (scope.isTenantScoped()) {
                stmt.setString(3, scope.tenantId());
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String table = rs.getString("table_name");
                    if (!wanted.isEmpty() && !wanted.contains(table.toLowerCase())) {
                        continue;
                    }
                    Map<String, Object> key = parse(rs.getString("key_json"));
                    Instant changedAt = rs.getTimestamp("changed_at").toInstant();
                    if ("DELETE".equalsIgnoreCase(rs.getString("operation"))) {
                        records.add(BackupRecord.delete(table, key, changedAt));
                    } else {
                        records.add(BackupRecord.upsert(table, key, parse(rs.getString("row_json")), changedAt));
                    }
                }
            }
        }
        return records;
    }
    
    private List<String> primaryKey(Connection conn, TableRef table) throws SQLException {
        List<String> keys = new ArrayList<>();
        try (ResultSet rs = conn.getMetaData().getPrimaryKeys(table.schema(), null, table.table())) {
            while (rs.next()) {
                keys.add(rs.getString("COLUMN_NAME").toLowerCase());
            }
        }
        if (keys.isEmpty()) {
            throw new ExternalSystemException(ErrorCode.BACKUP_FAILED, table.qualifiedName(),
                "Table " + table.qualifiedName() + " has no primary key");
        }
        return keys;
    }
    
    private Set<String> columns(Connection conn, TableRef table) throws SQLException {
        Set<String> columns = new LinkedHashSet<>();
        try (ResultSet rs = conn.getMetaData().getColumns(table.schema(), null, table.table(), "%")) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME").toLowerCase());
            }
        }
        return columns;
    }
    
    private Map<String, Object> parse(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ExternalSystemException(ErrorCode.SERIALIZATION_ERROR, CHANGE_LOG_TABLE,
                "Malformed change log payload: " + e.getOriginalMessage(), e);
        }
    }
    
    private record TableRef(String schema, String table) {
        String qualifiedName() {
            return schema + "." + table;
        }
    }
}
