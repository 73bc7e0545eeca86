package com.purchasingpower.tendermatch.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code app.*} tuning classes with Spring's property binding.
 *
 * <ul>
 *   <li>{@link ChunkingConfig} - legal document chunk sizes
 *   <li>{@link ScoringConfig} - match scoring weights and constants
 *   <li>{@link RankingConfig} - batch ranking and digest settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    ChunkingConfig.class,
    ScoringConfig.class,
    RankingConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
