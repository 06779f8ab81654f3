package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Filter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Renders filter predicates. All literal values written into compiled SQL go through here.
 * <p>
 * Under {@link LiteralPolicy#ESCAPED} only the operators in {@link #ALLOWED_OPERATORS} are accepted,
 * WHERE fields must resolve against the layer, and string literals use BigQuery backslash escapes.
 */
public final class FilterRenderer {

    public static final Set<String> ALLOWED_OPERATORS =
            Set.of("=", "!=", "<>", "<", "<=", ">", ">=", "LIKE", "NOT LIKE");

    private static final DateTimeFormatter CALENDAR_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private final LiteralPolicy policy;
    private final FieldResolver resolver;

    public FilterRenderer(LiteralPolicy policy, FieldResolver resolver) {
        this.policy = Objects.requireNonNull(policy);
        this.resolver = Objects.requireNonNull(resolver);
    }

    /**
     * WHERE predicate. Date strings on known dimensions compare as {@code DATE(...)},
     * numbers are unquoted, everything else is a quoted string literal.
     */
    public String renderWhere(Filter filter, SchemaModel schema) {
        FieldResolution resolution = resolver.qualify(filter.field(), schema);
        if (policy == LiteralPolicy.ESCAPED && !resolution.isQualified()) {
            throw new MalformedConfigurationException("query",
                    List.of("filters: field '" + filter.field() + "' is not a metric or dimension of the semantic layer"));
        }
        String field = resolution.text();
        String operator = operator(filter);
        Object value = filter.value();

        if (value instanceof String s && schema.hasDimension(filter.field()) && isCalendarDate(s)) {
            return "DATE(" + field + ") " + operator + " DATE('" + s + "')";
        }
        if (value instanceof Number n) {
            return field + " " + operator + " " + number(n);
        }
        return field + " " + operator + " " + quote(String.valueOf(value));
    }

    /**
     * HAVING predicate against the metric's SELECT alias.
     */
    public String renderHaving(Filter filter) {
        String operator = operator(filter);
        Object value = filter.value();
        String rendered;
        if (value instanceof Number n) {
            rendered = number(n);
        } else if (policy == LiteralPolicy.ESCAPED) {
            rendered = quote(String.valueOf(value));
        } else {
            rendered = String.valueOf(value);
        }
        return filter.field() + " " + operator + " " + rendered;
    }

    static boolean isCalendarDate(String s) {
        try {
            LocalDate.parse(s, CALENDAR_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private String operator(Filter filter) {
        if (policy == LiteralPolicy.TRUSTED) {
            return filter.operator();
        }
        String normalized = filter.operator().strip().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        if (!ALLOWED_OPERATORS.contains(normalized)) {
            throw new MalformedConfigurationException("query",
                    List.of("filters: operator '" + filter.operator() + "' is not allowed"));
        }
        return normalized;
    }

    private String quote(String s) {
        if (policy == LiteralPolicy.ESCAPED) {
            // backslash first, so the escapes added for quotes are not doubled
            return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        return "'" + s + "'";
    }

    private static String number(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue()).toPlainString();
        }
        return n.toString();
    }
}
