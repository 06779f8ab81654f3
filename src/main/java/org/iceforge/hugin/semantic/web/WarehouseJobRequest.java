package org.iceforge.hugin.semantic.web;

public class WarehouseJobRequest {
    private String sql;
    private String defaultDataset;

    public WarehouseJobRequest() {
    }

    public WarehouseJobRequest(String sql, String defaultDataset) {
        this.sql = sql;
        this.defaultDataset = defaultDataset;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public String getDefaultDataset() {
        return defaultDataset;
    }

    public void setDefaultDataset(String defaultDataset) {
        this.defaultDataset = defaultDataset;
    }
}
