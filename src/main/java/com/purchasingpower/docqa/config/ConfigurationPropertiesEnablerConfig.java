package com.purchasingpower.docqa.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes that are not
 * themselves Spring components.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link GlobalRetryConfig} - retry and backoff settings for provider calls
 * </ul>
 *
 * <p>{@link com.purchasingpower.docqa.configuration.AppProperties} is a
 * {@code @Configuration} of its own and is bound without being listed here.
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
