package org.iceforge.hugin.semantic.compiler;

import java.util.ArrayList;
import java.util.List;

/**
 * FROM/JOIN section of a compiled query: the anchor table plus rendered
 * {@code JOIN <table> ON <condition>} clauses in emission order.
 */
public record JoinPlan(String anchor, List<String> joins) {

    public JoinPlan {
        joins = List.copyOf(joins);
    }

    public static JoinPlan single(String table) {
        return new JoinPlan(table, List.of());
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>(joins.size() + 1);
        lines.add("FROM " + anchor);
        lines.addAll(joins);
        return lines;
    }
}
