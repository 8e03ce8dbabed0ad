package com.purchasingpower.docqa.configuration;

import jakarta.validation.Valid;
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
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private IngestionProperties ingestion = new IngestionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetrievalProperties retrieval = new RetrievalProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ContextProperties context = new ContextProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private MemoryProperties memory = new MemoryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LlmProperties llm = new LlmProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ConcurrencyProperties concurrency = new ConcurrencyProperties();
}
