package com.codemigration.metagraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class MetagraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetagraphApplication.class, args);
    }
}
