package com.copilot.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * 跨域配置，默认放行所有来源（浏览器端客户端直连网关）
 */
@Configuration
public class CorsConfig {

    @Bean
    public CorsWebFilter corsWebFilter(
            @Value("${copilot.cors.path-pattern:/**}") String pathPattern,
            @Value("${copilot.cors.allowed-origin-patterns:*}") List<String> allowedOriginPatterns,
            @Value("${copilot.cors.allowed-methods:*}") List<String> allowedMethods,
            @Value("${copilot.cors.allowed-headers:*}") List<String> allowedHeaders,
            @Value("${copilot.cors.max-age-seconds:3600}") long maxAgeSeconds
    ) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(allowedOriginPatterns);
        configuration.setAllowedMethods(allowedMethods);
        configuration.setAllowedHeaders(allowedHeaders);
        configuration.setMaxAge(maxAgeSeconds);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(pathPattern, configuration);
        return new CorsWebFilter(source);
    }
}
