package org.vmapconv.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * 只有在 {@code mcp} profile 下 MCP Server 才会启用（见 application-mcp.yml），
 * 命令行模式下这些回调不会被对外暴露。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> conversionToolCallbacks(ConversionMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
