package dev.webfetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the webfetch retrieval server.
 *
 * <p>Two Spring profiles: {@code web} serves REST plus MCP over SSE on port 8080, {@code stdio}
 * serves MCP over standard input/output with no web server.
 */
@SpringBootApplication
public class WebFetchApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebFetchApplication.class, args);
    }
}
