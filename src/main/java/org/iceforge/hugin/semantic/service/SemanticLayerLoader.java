package org.iceforge.hugin.semantic.service;

import org.iceforge.hugin.semantic.config.HuginProperties;
import org.iceforge.hugin.semantic.model.SemanticLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Loads the default semantic layer from the classpath once and caches it until {@link #reload()}.
 */
@Component
public class SemanticLayerLoader {

    private static final Logger log = LoggerFactory.getLogger(SemanticLayerLoader.class);

    private final SemanticLayerReader reader;
    private final HuginProperties props;

    private volatile SemanticLayer cached;

    public SemanticLayerLoader(SemanticLayerReader reader, HuginProperties props) {
        this.reader = Objects.requireNonNull(reader);
        this.props = Objects.requireNonNull(props);
    }

    public SemanticLayer load() {
        SemanticLayer local = cached;
        if (local != null) return local;

        synchronized (this) {
            if (cached != null) return cached;
            String resource = props.getLayerResource();
            try (InputStream in = new ClassPathResource(resource).getInputStream()) {
                SemanticLayer layer = reader.readLayer(StreamUtils.copyToString(in, StandardCharsets.UTF_8));
                log.info("Loaded semantic layer {}: {} metrics, {} dimensions, {} joins",
                        resource, layer.metrics().size(), layer.dimensions().size(), layer.joins().size());
                cached = layer;
                return cached;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load semantic layer resource: " + resource, e);
            }
        }
    }

    public void reload() {
        log.info("Dropping cached semantic layer {}", props.getLayerResource());
        cached = null;
    }
}
