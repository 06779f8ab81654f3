package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Dimension;

/**
 * A requested dimension after resolution: the query-facing alias, the SQL expression
 * grouped on, and the table it reads from.
 */
public record DimensionExpression(String name, String expression, String table) {

    static DimensionExpression of(String name, Dimension dimension) {
        return new DimensionExpression(name, dimension.qualifiedSql(), dimension.table());
    }

    public String selectItem() {
        return expression + " AS " + name;
    }
}
