package org.iceforge.hugin.semantic.web;

import java.util.List;
import java.util.Map;

public record QueryResponse(String sql, long totalRows, List<Map<String, Object>> rows) {
}
