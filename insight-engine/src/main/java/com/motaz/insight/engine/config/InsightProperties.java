package com.motaz.insight.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "insight")
public record InsightProperties(Runner runner, PipelineConfig pipeline) {

    public Runner runner() {
        return runner != null ? runner : new Runner(false, Map.of(), null);
    }

    public record Runner(Boolean enabled, Map<String, String> sources, String reportDir) {
        public Runner {
            sources = sources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        }
    }
}
