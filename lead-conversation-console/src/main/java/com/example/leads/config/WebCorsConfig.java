package com.example.leads.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    private final LeadConsoleSecurityProperties securityProperties;

    public WebCorsConfig(LeadConsoleSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = securityProperties.getConsoleOrigins().toArray(String[]::new);
        registry.addMapping("/api/conversations/**")
                .allowedOrigins(origins)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("Content-Type")
                .exposedHeaders("Retry-After")
                .maxAge(3600);
        registry.addMapping("/api/organizations/*/leads/**")
                .allowedOrigins(origins)
                .allowedMethods("GET", "DELETE", "OPTIONS")
                .exposedHeaders("Retry-After")
                .maxAge(3600);
    }
}
