package org.iceforge.hugin.semantic.compiler;

import org.iceforge.hugin.semantic.model.Dimension;
import org.iceforge.hugin.semantic.model.Filter;
import org.iceforge.hugin.semantic.model.Metric;
import org.iceforge.hugin.semantic.model.SemanticLayer;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterRendererTest {

    private final SchemaModel schema = new SchemaModel(new SemanticLayer(
            List.of(new Metric("total_revenue", "SUM(sale_price)", "order_items")),
            List.of(new Dimension("ordered_date", "created_at", "orders"),
                    new Dimension("customer", "last_name", "users")),
            null));

    private final FilterRenderer trusted = new FilterRenderer(LiteralPolicy.TRUSTED, new FieldResolver());
    private final FilterRenderer escaped = new FilterRenderer(LiteralPolicy.ESCAPED, new FieldResolver());

    @Test
    void dateStringOnKnownDimensionComparesAsDate() {
        assertThat(trusted.renderWhere(new Filter("ordered_date", ">=", "2024-01-01"), schema))
                .isEqualTo("DATE(orders.created_at) >= DATE('2024-01-01')");
    }

    @Test
    void invalidOrLooseDatesAreOrdinaryStrings() {
        assertThat(trusted.renderWhere(new Filter("ordered_date", "=", "2024-02-30"), schema))
                .isEqualTo("orders.created_at = '2024-02-30'");
        assertThat(trusted.renderWhere(new Filter("ordered_date", "=", "2024-1-1"), schema))
                .isEqualTo("orders.created_at = '2024-1-1'");
    }

    @Test
    void dateStringOnUnknownFieldIsNotCast() {
        assertThat(trusted.renderWhere(new Filter("shipped_at", "<", "2024-01-01"), schema))
                .isEqualTo("shipped_at < '2024-01-01'");
    }

    @Test
    void numbersAreUnquoted() {
        assertThat(trusted.renderWhere(new Filter("customer", ">", 1), schema)).isEqualTo("users.last_name > 1");
        assertThat(trusted.renderWhere(new Filter("customer", ">", 2.5), schema)).isEqualTo("users.last_name > 2.5");
        assertThat(trusted.renderWhere(new Filter("customer", ">", new BigDecimal("1E+3")), schema))
                .isEqualTo("users.last_name > 1000");
    }

    @Test
    void largeAndSmallDoublesRenderWithoutExponent() {
        assertThat(trusted.renderWhere(new Filter("customer", ">", 1e7), schema)).isEqualTo("users.last_name > 10000000");
        assertThat(trusted.renderWhere(new Filter("customer", ">", 1.0E-4), schema)).isEqualTo("users.last_name > 0.0001");
        assertThat(trusted.renderHaving(new Filter("total_revenue", ">", 2.5e10))).isEqualTo("total_revenue > 25000000000");
    }

    @Test
    void trustedPolicyQuotesStringsVerbatim() {
        assertThat(trusted.renderWhere(new Filter("customer", "=", "O'Brien"), schema))
                .isEqualTo("users.last_name = 'O'Brien'");
    }

    @Test
    void escapedPolicyBackslashEscapesEmbeddedQuotes() {
        assertThat(escaped.renderWhere(new Filter("customer", "=", "O'Brien"), schema))
                .isEqualTo("users.last_name = 'O\\'Brien'");
    }

    @Test
    void escapedPolicyEscapesBackslashBeforeQuote() {
        // a trailing backslash must not swallow the escape for the following quote
        assertThat(escaped.renderWhere(new Filter("customer", "=", "x\\' OR 1=1 --"), schema))
                .isEqualTo("users.last_name = 'x\\\\\\' OR 1=1 --'");
    }

    @Test
    void escapedPolicyRejectsOperatorsOutsideAllowlist() {
        assertThatThrownBy(() -> escaped.renderWhere(new Filter("customer", "= 1 OR 1 =", "x"), schema))
                .isInstanceOf(MalformedConfigurationException.class)
                .hasMessageContaining("operator '= 1 OR 1 =' is not allowed");
        assertThatThrownBy(() -> escaped.renderHaving(new Filter("total_revenue", "> 0; DROP TABLE orders; --", 1)))
                .isInstanceOf(MalformedConfigurationException.class);
    }

    @Test
    void escapedPolicyNormalizesAllowedOperators() {
        assertThat(escaped.renderWhere(new Filter("customer", " not   like ", "Sm%"), schema))
                .isEqualTo("users.last_name NOT LIKE 'Sm%'");
        assertThat(escaped.renderHaving(new Filter("total_revenue", "<>", 0))).isEqualTo("total_revenue <> 0");
    }

    @Test
    void escapedPolicyRejectsUnresolvedWhereField() {
        assertThatThrownBy(() -> escaped.renderWhere(new Filter("1=1 OR shipped_at", "=", "x"), schema))
                .isInstanceOf(MalformedConfigurationException.class)
                .hasMessageContaining("field '1=1 OR shipped_at' is not a metric or dimension");
    }

    @Test
    void havingUsesMetricAliasAndRawValue() {
        assertThat(trusted.renderHaving(new Filter("total_revenue", ">", 1000))).isEqualTo("total_revenue > 1000");
        assertThat(trusted.renderHaving(new Filter("total_revenue", ">", "AVG(x)"))).isEqualTo("total_revenue > AVG(x)");
    }

    @Test
    void escapedPolicyQuotesStringHavingValues() {
        assertThat(escaped.renderHaving(new Filter("total_revenue", ">", 1000))).isEqualTo("total_revenue > 1000");
        assertThat(escaped.renderHaving(new Filter("total_revenue", ">", "1' OR '1'='1")))
                .isEqualTo("total_revenue > '1\\' OR \\'1\\'=\\'1'");
    }
}
