package dev.webfetch.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@link McpToolService} methods with the Spring AI MCP server, which exposes them
 * over whichever transport the active profile enables.
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider webFetchTools(McpToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
