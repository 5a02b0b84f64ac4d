package com.mintledger.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * WebFlux settings: CORS and the mintledger.* properties.
 */
@Configuration
@EnableConfigurationProperties({ ApiProperties.class, CorsProperties.class, RateLimitProperties.class })
@RequiredArgsConstructor
public class WebConfig implements WebFluxConfigurer {

    private final CorsProperties corsProperties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(corsProperties.getAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowCredentials(true);
    }
}
