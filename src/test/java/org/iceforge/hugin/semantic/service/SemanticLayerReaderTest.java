package org.iceforge.hugin.semantic.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.iceforge.hugin.semantic.compiler.MalformedConfigurationException;
import org.iceforge.hugin.semantic.model.Filter;
import org.iceforge.hugin.semantic.model.Join;
import org.iceforge.hugin.semantic.model.Query;
import org.iceforge.hugin.semantic.model.SemanticLayer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SemanticLayerReaderTest {

    static final ObjectMapper json = new ObjectMapper();
    static ValidatorFactory validatorFactory;
    static SemanticLayerReader reader;

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        reader = new SemanticLayerReader(json, validatorFactory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    private static Query query(String body) throws Exception {
        return reader.validate(json.readValue(body, Query.class), "query");
    }

    @Test
    void readsJsonLayer() {
        SemanticLayer layer = reader.readLayer("""
                {
                  "metrics": [{"name": "total_revenue", "sql": "SUM(sale_price)", "table": "order_items"}],
                  "dimensions": [{"name": "status", "sql": "status", "table": "orders"}],
                  "joins": [{"one": "orders", "many": "order_items", "join": "order_items.order_id = orders.order_id"}]
                }
                """);

        assertThat(layer.metrics()).singleElement().satisfies(m -> assertThat(m.sql()).isEqualTo("SUM(sale_price)"));
        assertThat(layer.dimensions()).hasSize(1);
        assertThat(layer.joins()).containsExactly(new Join("orders", "order_items", "order_items.order_id = orders.order_id"));
    }

    @Test
    void readsYamlLayerAndDefaultsOptionalSections() {
        SemanticLayer layer = reader.readLayer("""
                metrics:
                  - name: order_count
                    sql: COUNT(*)
                    table: orders
                """);

        assertThat(layer.metrics()).hasSize(1);
        assertThat(layer.dimensions()).isEmpty();
        assertThat(layer.joins()).isEmpty();
    }

    @Test
    void readsQueryWithStringAndNumericFilterValues() throws Exception {
        Query query = query("""
                {
                  "metrics": ["total_revenue"],
                  "dimensions": ["ordered_date__week"],
                  "filters": [
                    {"field": "ordered_date", "operator": ">=", "value": "2024-01-01"},
                    {"field": "total_revenue", "operator": ">", "value": 1000}
                  ]
                }
                """);

        assertThat(query.metrics()).containsExactly("total_revenue");
        assertThat(query.dimensions()).containsExactly("ordered_date__week");
        assertThat(query.filters()).extracting(Filter::value).containsExactly("2024-01-01", 1000);
    }

    @Test
    void missingMetricFieldsAreRejected() {
        MalformedConfigurationException e = catchThrowableOfType(() -> reader.readLayer("""
                {"metrics": [{"name": "total_revenue", "table": "order_items"}]}
                """), MalformedConfigurationException.class);

        assertThat(e).isNotNull();
        assertThat(e.errorCode()).isEqualTo("MALFORMED_CONFIGURATION");
        assertThat(e.getViolations()).singleElement().asString().startsWith("metrics[0].sql");
    }

    @Test
    void missingJoinConditionIsRejected() {
        assertThatThrownBy(() -> reader.readLayer("""
                metrics:
                  - {name: order_count, sql: "COUNT(*)", table: orders}
                joins:
                  - {one: orders, many: order_items}
                """))
                .isInstanceOf(MalformedConfigurationException.class)
                .hasMessageContaining("joins[0].join");
    }

    @Test
    void missingMetricsSectionIsRejected() {
        assertThatThrownBy(() -> reader.readLayer("dimensions: []"))
                .isInstanceOf(MalformedConfigurationException.class)
                .hasMessageContaining("metrics");
    }

    @Test
    void filterWithoutValueOrWithNonScalarValueIsRejected() {
        MalformedConfigurationException missing = catchThrowableOfType(() -> query("""
                {"metrics": ["total_revenue"], "filters": [{"field": "status", "operator": "="}]}
                """), MalformedConfigurationException.class);
        assertThat(missing.getViolations()).anyMatch(v -> v.startsWith("filters[0].value"));

        MalformedConfigurationException bool = catchThrowableOfType(() -> query("""
                {"metrics": ["total_revenue"], "filters": [{"field": "status", "operator": "=", "value": true}]}
                """), MalformedConfigurationException.class);
        assertThat(bool.getViolations()).anyMatch(v -> v.contains("must be a string or a number"));
    }

    @Test
    void queryWithoutMetricsIsAccepted() throws Exception {
        Query query = query("""
                {"metrics": [], "dimensions": ["status"]}
                """);

        assertThat(query.metrics()).isEmpty();
        assertThat(query.dimensions()).containsExactly("status");
    }

    @Test
    void queryWithoutMetricsListIsRejected() {
        assertThatThrownBy(() -> query("{\"dimensions\": [\"status\"]}"))
                .isInstanceOf(MalformedConfigurationException.class)
                .hasMessageContaining("metrics");
    }

    @Test
    void unparsableDocumentIsRejected() {
        assertThatThrownBy(() -> reader.readLayer("{\"metrics\": [{\"name\": \"total_revenue\""))
                .isInstanceOf(MalformedConfigurationException.class)
                .hasMessageStartingWith("Malformed semantic layer");
        assertThatThrownBy(() -> reader.readLayer("  "))
                .isInstanceOf(MalformedConfigurationException.class);
    }

    @Test
    void validateAcceptsProgrammaticLayer() {
        SemanticLayer layer = SemanticLayer.of(List.of());

        assertThat(reader.validate(layer, "semantic layer")).isSameAs(layer);
    }
}
