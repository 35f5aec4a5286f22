package dev.pmsignal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the PM Signal feedback analysis application.
 *
 * <p>Supports two Spring profiles: {@code web} (MCP SSE on port 8080) and {@code stdio} (MCP stdio
 * transport, no web server).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PmSignalApplication {
    public static void main(String[] args) {
        SpringApplication.run(PmSignalApplication.class, args);
    }
}
