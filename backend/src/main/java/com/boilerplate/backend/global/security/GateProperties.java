package com.boilerplate.backend.global.security;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.security")
public class GateProperties {

    /**
     * Path prefixes served without a token, matched case-insensitively in declaration order.
     */
    private List<String> excludedPaths = new ArrayList<>(ExcludedPathMatcher.DEFAULT_PREFIXES);

    public List<String> getExcludedPaths() {
        return excludedPaths;
    }

    public void setExcludedPaths(List<String> excludedPaths) {
        this.excludedPaths = excludedPaths;
    }
}
