package dev.sitedigest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the site digest service.
 *
 * <p>Serves the REST API and the MCP tools over the same web server (port 8080 by default).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class SiteDigestApplication {
    public static void main(String[] args) {
        SpringApplication.run(SiteDigestApplication.class, args);
    }
}
