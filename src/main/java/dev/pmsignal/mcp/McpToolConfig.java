package dev.pmsignal.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link McpToolService} methods as MCP tools via Spring AI auto-configuration.
 *
 * <p>Spring AI's MCP server auto-configuration picks up the {@link ToolCallbackProvider} bean and
 * exposes each {@code @Tool} method over the active transport (stdio or SSE).
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider pmSignalTools(McpToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
