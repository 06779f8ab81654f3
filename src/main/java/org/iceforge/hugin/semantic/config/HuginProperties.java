package org.iceforge.hugin.semantic.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.iceforge.hugin.semantic.compiler.LiteralPolicy;
import org.iceforge.hugin.semantic.compiler.UnresolvedDimensionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "hugin")
public class HuginProperties {

    /**
     * Base URL of the warehouse gateway, e.g. http://localhost:9050
     */
    @NotBlank
    private String warehouseBaseUrl = "http://localhost:9050";

    /**
     * Path used to submit SQL to the gateway.
     */
    @NotBlank
    private String warehouseSubmitPath = "/api/v1/jobs";

    /**
     * Path template used to fetch rows when the submit call only returns a job id.
     *
     * Use {jobId} token, e.g. /api/v1/jobs/{jobId}/results
     */
    @NotBlank
    private String warehouseResultPathTemplate = "/api/v1/jobs/{jobId}/results";

    /**
     * Bearer credential for the gateway. Sent only when set.
     */
    private String warehouseToken;

    /**
     * Dataset unqualified table names in compiled SQL resolve against.
     */
    @NotBlank
    private String defaultDataset;

    /**
     * Rows shown by the preview endpoint.
     */
    @Min(1)
    private int maxResults = 10;

    /**
     * Location of the default semantic layer (YAML or JSON) on the classpath.
     */
    @NotBlank
    private String layerResource = "semantic-layer.yml";

    @NotNull
    private UnresolvedDimensionPolicy unresolvedDimensionPolicy = UnresolvedDimensionPolicy.OMIT;

    /**
     * Request bodies are untrusted, so string literals are escaped unless configured otherwise.
     */
    @NotNull
    private LiteralPolicy literalPolicy = LiteralPolicy.ESCAPED;

    public String getWarehouseBaseUrl() {
        return warehouseBaseUrl;
    }

    public void setWarehouseBaseUrl(String warehouseBaseUrl) {
        this.warehouseBaseUrl = warehouseBaseUrl;
    }

    public String getWarehouseSubmitPath() {
        return warehouseSubmitPath;
    }

    public void setWarehouseSubmitPath(String warehouseSubmitPath) {
        this.warehouseSubmitPath = warehouseSubmitPath;
    }

    public String getWarehouseResultPathTemplate() {
        return warehouseResultPathTemplate;
    }

    public void setWarehouseResultPathTemplate(String warehouseResultPathTemplate) {
        this.warehouseResultPathTemplate = warehouseResultPathTemplate;
    }

    public String getWarehouseToken() {
        return warehouseToken;
    }

    public void setWarehouseToken(String warehouseToken) {
        this.warehouseToken = warehouseToken;
    }

    public String getDefaultDataset() {
        return defaultDataset;
    }

    public void setDefaultDataset(String defaultDataset) {
        this.defaultDataset = defaultDataset;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public String getLayerResource() {
        return layerResource;
    }

    public void setLayerResource(String layerResource) {
        this.layerResource = layerResource;
    }

    public UnresolvedDimensionPolicy getUnresolvedDimensionPolicy() {
        return unresolvedDimensionPolicy;
    }

    public void setUnresolvedDimensionPolicy(UnresolvedDimensionPolicy unresolvedDimensionPolicy) {
        this.unresolvedDimensionPolicy = unresolvedDimensionPolicy;
    }

    public LiteralPolicy getLiteralPolicy() {
        return literalPolicy;
    }

    public void setLiteralPolicy(LiteralPolicy literalPolicy) {
        this.literalPolicy = literalPolicy;
    }
}
