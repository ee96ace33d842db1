package com.formulagrid.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sheet sizing limits and startup data, bound from "formulagrid.sheets.*".
 */
@ConfigurationProperties(prefix = "formulagrid.sheets")
public class SheetProperties {

    // Extent used when a create request leaves rows/cols out
    private int defaultRows = 100;
    private int defaultCols = 26;

    private int maxRows = 10000;
    // 702 = column ZZ
    private int maxCols = 702;

    // Load the "Budget Calculator" sample sheet on startup
    private boolean seedEnabled = true;

    public int getDefaultRows() {
        return defaultRows;
    }

    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultCols() {
        return defaultCols;
    }

    public void setDefaultCols(int defaultCols) {
        this.defaultCols = defaultCols;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxCols() {
        return maxCols;
    }

    public void setMaxCols(int maxCols) {
        this.maxCols = maxCols;
    }

    public boolean isSeedEnabled() {
        return seedEnabled;
    }

    public void setSeedEnabled(boolean seedEnabled) {
        this.seedEnabled = seedEnabled;
    }
}
