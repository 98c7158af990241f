package com.example.crosstab.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:crosstab-coordinator-0}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "crosstab")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        // everything else under crosstab.* is bound by @ConfigurationProperties
        properties.setPodName(podName);
        return properties;
    }
}
