package org.iceforge.hugin.semantic.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Conservative shape: the gateway either answers with rows straight away, or with a jobId to poll.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WarehouseSubmitResponse {
    private String jobId;
    private Long totalRows;
    private List<Map<String, Object>> rows;

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public Long getTotalRows() {
        return totalRows;
    }

    public void setTotalRows(Long totalRows) {
        this.totalRows = totalRows;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public void setRows(List<Map<String, Object>> rows) {
        this.rows = rows;
    }
}
