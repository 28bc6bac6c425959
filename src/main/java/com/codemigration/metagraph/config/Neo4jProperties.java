package com.codemigration.metagraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "neo4j")
@Data
public class Neo4jProperties {

    private String uri = "bolt://localhost:7687";

    private String username = "neo4j";

    private String password = "password";

    private int maxConnectionPoolSize = 50;
}
