package org.iceforge.hugin.semantic.service;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by the warehouse gateway. Each row keeps the column order of the result set.
 */
public record WarehouseResult(long totalRows, List<Map<String, Object>> rows) {

    public WarehouseResult {
        rows = List.copyOf(rows);
    }
}
