package com.genai.anomaly.config;

import com.genai.anomaly.exception.UnknownAlgorithmVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * All known algorithm versions, frozen at startup. Live detection uses the
 * active version; replay may pin any version in the catalog.
 */
@Component
public class AlgorithmCatalog {

    private static final Logger log = LoggerFactory.getLogger(AlgorithmCatalog.class);

    private final Map<String, AlgorithmConfig> versions;
    private final AlgorithmConfig active;

    public AlgorithmCatalog(AnomalyProperties properties) {
        Map<String, AlgorithmConfig> built = new LinkedHashMap<>();
        properties.getAlgorithms().forEach((version, props) ->
                built.put(version, AlgorithmConfig.from(version, props)));
        this.versions = Collections.unmodifiableMap(built);

        this.active = versions.get(properties.getActiveVersion());
        if (active == null) {
            throw new IllegalStateException("Active algorithm version " + properties.getActiveVersion()
                    + " is not configured (known: " + versions.keySet() + ")");
        }
        log.info("Algorithm catalog loaded: versions={}, active={}", versions.keySet(), active.getVersion());
    }

    public AlgorithmConfig active() {
        return active;
    }

    /**
     * @param version a version string, or null for the active version
     * @throws UnknownAlgorithmVersionException if the version is not configured
     */
    public AlgorithmConfig resolve(String version) {
        if (version == null || version.isBlank()) {
            return active;
        }
        AlgorithmConfig config = versions.get(version);
        if (config == null) {
            throw new UnknownAlgorithmVersionException(version, versions.keySet());
        }
        return config;
    }

    public Set<String> versions() {
        return versions.keySet();
    }
}
