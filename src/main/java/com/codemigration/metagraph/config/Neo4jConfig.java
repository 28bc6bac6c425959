package com.codemigration.metagraph.config;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The one Neo4j driver of the process. Its connection pool is shared by all projects and
 * handed to the store through its constructor.
 */
@Slf4j
@Configuration
public class Neo4jConfig {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(Neo4jProperties properties) {
        log.info("Connecting to Neo4j at: {}", properties.getUri());
        Config config = Config.builder()
            .withMaxConnectionPoolSize(properties.getMaxConnectionPoolSize())
            .build();
        return GraphDatabase.driver(properties.getUri(),
            AuthTokens.basic(properties.getUsername(), properties.getPassword()), config);
    }
}
