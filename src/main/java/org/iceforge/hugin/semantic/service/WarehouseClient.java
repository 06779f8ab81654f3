package org.iceforge.hugin.semantic.service;

import org.iceforge.hugin.semantic.config.HuginProperties;
import org.iceforge.hugin.semantic.web.WarehouseJobRequest;
import org.iceforge.hugin.semantic.web.WarehouseSubmitResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Runs compiled SQL on the warehouse gateway against the configured default dataset.
 */
@Component
public class WarehouseClient {

    private static final Logger log = LoggerFactory.getLogger(WarehouseClient.class);

    private final WebClient webClient;
    private final HuginProperties props;

    public WarehouseClient(WebClient warehouseWebClient, HuginProperties props) {
        this.webClient = Objects.requireNonNull(warehouseWebClient);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Submit SQL to the gateway.
     * If the submit response already carries rows, those are the result.
     * Otherwise it must carry a jobId, and rows are fetched from the results endpoint.
     */
    public Mono<WarehouseResult> execute(String sql) {
        WarehouseJobRequest body = new WarehouseJobRequest(sql, props.getDefaultDataset());
        return webClient.post()
                .uri(props.getWarehouseSubmitPath())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(WarehouseSubmitResponse.class)
                .flatMap(this::handleSubmitResponse)
                .onErrorMap(WebClientResponseException.class, e -> new IllegalStateException(
                        "Warehouse gateway returned " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e))
                .onErrorMap(WebClientRequestException.class, e -> new IllegalStateException(
                        "Warehouse gateway unreachable at " + e.getUri() + ": " + e.getMessage(), e));
    }

    private Mono<WarehouseResult> handleSubmitResponse(WarehouseSubmitResponse r) {
        if (r.getRows() != null) {
            return Mono.just(toResult(r));
        }
        if (!StringUtils.hasText(r.getJobId())) {
            return Mono.error(new IllegalStateException("Warehouse submit returned neither rows nor a jobId."));
        }
        String path = props.getWarehouseResultPathTemplate().replace("{jobId}", r.getJobId());
        log.debug("Warehouse job {} accepted, fetching results from {}", r.getJobId(), path);
        return fetchResult(path);
    }

    private Mono<WarehouseResult> fetchResult(String uriPath) {
        return webClient.get()
                .uri(uriPath)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(WarehouseSubmitResponse.class)
                .flatMap(r -> r.getRows() == null
                        ? Mono.error(new IllegalStateException("Warehouse results for " + uriPath + " carried no rows."))
                        : Mono.just(toResult(r)));
    }

    private static WarehouseResult toResult(WarehouseSubmitResponse r) {
        long total = r.getTotalRows() != null ? r.getTotalRows() : r.getRows().size();
        return new WarehouseResult(total, r.getRows());
    }
}
