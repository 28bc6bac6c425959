package com.codemigration.metagraph.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class MigrationProperties {

    @NotBlank(message = "Storage directory path is required")
    private String storageDir = "./storage";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExtractionProperties extraction = new ExtractionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ResolverProperties resolver = new ResolverProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private InferenceProperties inference = new InferenceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private TargetProperties target = new TargetProperties();
}
