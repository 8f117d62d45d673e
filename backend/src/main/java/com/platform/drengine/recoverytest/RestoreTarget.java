package com.platform.drengine.recoverytest;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Database of a non-production environment that restores are loaded into.
 * Tables are schema qualified ({@code schema.table}).
 */
public interface RestoreTarget {
    
    /**
     * Empty the tables before a restore.
     */
    void clear(String environment, Collection<String> tables);
    
    /**
     * Insert or replace the rows of one table.
     */
    void load(String environment, String table, List<Map<String, Object>> rows);
    
    List<Map<String, Object>> read(String environment, String table);
}
