package com.codemigration.metagraph.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes.
 */
@Configuration
@EnableConfigurationProperties({
    RetryProperties.class,
    Neo4jProperties.class
})
public class PropertiesConfig {
}
