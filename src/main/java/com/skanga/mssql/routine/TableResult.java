package com.skanga.mssql.routine;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by a table-valued function, each keyed by column label.
 */
public record TableResult(List<Map<String, Object>> rows) implements RoutineResult {
    public TableResult {
        rows = List.copyOf(rows);
    }

    @Override
    public List<Map<String, Object>> toData() {
        return rows;
    }
}
