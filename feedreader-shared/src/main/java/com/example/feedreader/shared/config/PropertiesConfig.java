package com.example.feedreader.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:feedreader-0}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "feedreader")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();

        // Pod identity comes from the environment; everything else binds from feedreader.*
        properties.getPod().setId(podName);
        return properties;
    }
}
