package org.iceforge.hugin.semantic.compiler;

import java.util.List;

/**
 * @param tables            physical tables the query reads, in first-reference order
 * @param anchorTable       table named in the FROM clause
 * @param omittedDimensions requested dimensions dropped because the layer does not define them
 */
public record CompiledQuery(String sql, List<String> tables, String anchorTable, List<String> omittedDimensions) {

    public CompiledQuery {
        tables = List.copyOf(tables);
        omittedDimensions = List.copyOf(omittedDimensions);
    }
}
