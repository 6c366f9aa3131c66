package com.georep.lookup.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Cross-origin access for the browser map frontend.
 *
 * The frontend is served from its own origin and only reads from the API,
 * so only GET is allowed cross-origin. Cache administration stays same-origin.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    @Value("${lookup.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(allowedOrigins) // wildcards allowed, e.g. http://localhost:[*]
                .allowedMethods("GET")
                .allowedHeaders("*");
    }
}
