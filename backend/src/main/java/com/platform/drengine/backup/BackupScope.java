package com.platform.drengine.backup;

import java.util.List;

/**
 * What a backup job copies. Tables are either schema qualified ({@code billing.invoices})
 * or bare names looked up in every listed schema. No tables means every table of the schemas.
 * A tenant restricts rows to those whose {@code tenant_id} matches.
 */
public record BackupScope(
    List<String> schemas,
    List<String> tables,
    String tenantId
) {
    public BackupScope {
        schemas = schemas == null ? List.of() : List.copyOf(schemas);
        tables = tables == null ? List.of() : List.copyOf(tables);
    }
    
    public boolean isTenantScoped() {
        return tenantId != null && !tenantId.isBlank();
    }
}
