package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Join;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the anchor table of a multi-table query and the joins that attach the rest.
 * <p>
 * The anchor is the first required table, in query order (metrics, then dimensions),
 * that appears as an endpoint of any declared join. Every declared join touching a
 * required table is emitted, in declaration order, whether or not it connects to the
 * anchor: {@code JOIN <many>} when the anchor is its "one" side, {@code JOIN <one>} otherwise.
 */
public final class JoinPlanner {

    private static final Logger log = LoggerFactory.getLogger(JoinPlanner.class);

    /**
     * @param requiredTables tables referenced by the query, in first-reference order; must not be empty
     */
    public JoinPlan plan(Set<String> requiredTables, List<Join> joins) {
        if (requiredTables.isEmpty()) {
            throw new IllegalArgumentException("requiredTables must not be empty");
        }
        String first = requiredTables.iterator().next();
        if (joins.isEmpty() || requiredTables.size() == 1) {
            return JoinPlan.single(first);
        }

        Set<String> joinTables = new HashSet<>();
        for (Join j : joins) {
            joinTables.add(j.one());
            joinTables.add(j.many());
        }

        String anchor = null;
        for (String table : requiredTables) {
            if (joinTables.contains(table)) {
                anchor = table;
                break;
            }
        }
        if (anchor == null) {
            log.warn("Tables {} are not covered by any declared join; selecting from {} only", requiredTables, first);
            return JoinPlan.single(first);
        }

        List<String> clauses = new ArrayList<>();
        for (Join j : joins) {
            if (anchor.equals(j.one())) {
                clauses.add("JOIN " + j.many() + " ON " + j.join());
            } else if (requiredTables.contains(j.one()) || requiredTables.contains(j.many())) {
                clauses.add("JOIN " + j.one() + " ON " + j.join());
            }
        }
        return new JoinPlan(anchor, clauses);
    }
}
