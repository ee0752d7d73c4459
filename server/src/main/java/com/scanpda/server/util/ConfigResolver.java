package com.scanpda.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanpda.server.service.PdaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

public class ConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigResolver.class);

    public static final String CONFIG_PROPERTY = "scanpda.config";
    public static final String GRAMMAR_PROPERTY = "scanpda.grammar";
    public static final String DEFAULT_CONFIG_RESOURCE = "/pda_config.json";

    public static PdaConfig loadConfig() {
        String resource = System.getProperty(CONFIG_PROPERTY);
        if (resource == null || resource.isEmpty()) {
            resource = DEFAULT_CONFIG_RESOURCE;
        }
        return loadConfig(resource);
    }

    public static PdaConfig loadConfig(String resource) {
        try {
            ObjectMapper mapper = new ObjectMapper();
            try (InputStream is = ConfigResolver.class.getResourceAsStream(resource)) {
                if (is != null) {
                    return mapper.readValue(is, PdaConfig.class);
                }
            }
            logger.warn("Config resource {} not found, using defaults", resource);
        } catch (Exception e) {
            logger.error("Failed to read config from {}, using defaults", resource, e);
        }
        return PdaConfig.defaults();
    }

    public static String resolveGrammarResource(PdaConfig config) {
        // 1. System property
        String sysProp = System.getProperty(GRAMMAR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Config file
        if (config != null && config.grammarResource != null && !config.grammarResource.isEmpty()) {
            return config.grammarResource;
        }

        // 3. Default
        return PdaConfig.defaults().grammarResource;
    }
}
