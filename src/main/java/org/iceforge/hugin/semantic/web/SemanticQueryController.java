package org.iceforge.hugin.semantic.web;

import jakarta.validation.Valid;
import org.iceforge.hugin.semantic.compiler.CompiledQuery;
import org.iceforge.hugin.semantic.compiler.MalformedConfigurationException;
import org.iceforge.hugin.semantic.compiler.SemanticException;
import org.iceforge.hugin.semantic.service.SemanticQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.bind.support.WebExchangeBindException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api/semantic")
public class SemanticQueryController {

    private static final Logger log = LoggerFactory.getLogger(SemanticQueryController.class);

    private final SemanticQueryService service;

    public SemanticQueryController(SemanticQueryService service) {
        this.service = Objects.requireNonNull(service);
    }

    /**
     * Compiles a semantic request to SQL without running it.
     */
    @PostMapping(value = "/compile", produces = MediaType.APPLICATION_JSON_VALUE)
    public CompiledQuery compile(@Valid @RequestBody CompileRequest req) {
        return service.compile(req);
    }

    /**
     * Compiles a semantic request, executes it on the warehouse, and returns all rows.
     */
    @PostMapping(value = "/query", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryResponse> query(@Valid @RequestBody CompileRequest req) {
        return service.run(req);
    }

    /**
     * Same as {@link #query} but renders a bounded grid preview of the rows.
     */
    @PostMapping(value = "/preview", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> preview(@Valid @RequestBody CompileRequest req) {
        return service.preview(req);
    }

    @PostMapping("/layer/reload")
    public ResponseEntity<Void> reloadLayer() {
        service.reloadLayer();
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(SemanticException.class)
    public ResponseEntity<ErrorResponse> badRequest(SemanticException e) {
        List<String> violations = e instanceof MalformedConfigurationException m ? m.getViolations() : List.of();
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(e.errorCode(), e.getMessage(), violations));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(WebExchangeBindException e) {
        List<String> violations = e.getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .sorted()
                .toList();
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("VALIDATION_ERROR", "Request validation failed", violations));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> serverError(IllegalStateException e) {
        log.error("Semantic query failed", e);
        return ResponseEntity.internalServerError().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("SERVER_ERROR", e.getMessage()));
    }
}
