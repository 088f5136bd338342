/**
 * Web MVC settings for the catalog API
 *
 * Features:
 * - Allows the browser frontend to call {@code /api/**} across origins
 * - Origins come from {@code catalog.cors-allowed-origins}
 */
package net.neurod3.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final CatalogProperties catalogProperties;

    public WebConfig(CatalogProperties catalogProperties) {
        this.catalogProperties = catalogProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
            .allowedOrigins(catalogProperties.getCorsAllowedOrigins().toArray(String[]::new))
            .allowedMethods("GET", "POST", "OPTIONS")
            .allowedHeaders("Authorization", "Content-Type", "Accept")
            .allowCredentials(true);
    }
}
