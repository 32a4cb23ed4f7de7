package com.tessera.controlplane.config;

import com.tessera.controlplane.infrastructure.web.RequestIdFilter;
import com.tessera.security.ratelimit.RateLimitDecision;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for browser clients of {@code /api/**}. Origins come from
 * {@code tessera.cors.allowed-origins}; the request id and rate-limit headers are exposed so the
 * client can read them.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ControlPlaneProperties properties;

    public WebConfig(ControlPlaneProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.cors().allowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(
                        RequestIdFilter.REQUEST_ID_HEADER,
                        RateLimitDecision.HEADER_LIMIT,
                        RateLimitDecision.HEADER_REMAINING,
                        RateLimitDecision.HEADER_RESET,
                        RateLimitDecision.HEADER_RETRY_AFTER)
                .allowCredentials(true)
                .maxAge(3600);
    }
}
