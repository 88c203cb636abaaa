package cex.oceanbook.matching.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Metrics configuration
 *
 * Configures:
 * - Common metric tags for all metrics
 * - In-process MeterRegistry the engine records into
 */
@Slf4j
@Configuration
public class MetricsConfig {

    /**
     * Common tags for all metrics
     */
    @Bean
    public List<Tag> commonTags() {
        return List.of(
            Tag.of("service", "oceanbook-matching"),
            Tag.of("component", "matching-engine")
        );
    }

    @Bean
    public MeterRegistry meterRegistry(List<Tag> commonTags) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags(commonTags);
        log.info("Registered common metric tags: {}", commonTags);
        return registry;
    }
}
