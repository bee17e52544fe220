package com.newsflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime settings of the graph engine, bound from {@code newsflow.engine.*}.
 */
@Component
@ConfigurationProperties(prefix = "newsflow.engine")
public class EngineProperties {

    /** Upper bound on fan-out branches executing at once. */
    private int maxParallel = 4;

    /** Append field that collects failed node invocations. */
    private String errorField = "errorLog";

    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    public String getErrorField() { return errorField; }
    public void setErrorField(String errorField) { this.errorField = errorField; }
}
