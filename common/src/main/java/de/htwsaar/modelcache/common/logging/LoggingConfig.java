package de.htwsaar.modelcache.common.logging;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gemeinsame Logging-Verdrahtung für HTTP-Anwendungen.
 */
@Configuration
public class LoggingConfig {

    @Bean
    public TraceIdFilter traceIdFilter() {
        return new TraceIdFilter();
    }
}
