package com.tessera.tool;

import com.tessera.model.HealthReport;
import com.tessera.model.ToolContext;
import com.tessera.model.ToolResult;
import com.tessera.model.dto.ToolDescriptor;
import com.tessera.service.error.ErrorCategory;
import com.tessera.service.error.ErrorSeverity;
import com.tessera.service.error.ToolErrorHandler;
import com.tessera.service.error.ToolException;
import com.tessera.service.error.ToolFailureException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Looks up tools by name and dispatches calls to them.
 */
@Slf4j
public class ToolRegistry {

    private final List<ResilientToolAdapter<?, ?>> tools;
    private final ToolErrorHandler errorHandler;

    public ToolRegistry(List<ResilientToolAdapter<?, ?>> tools, ToolErrorHandler errorHandler) {
        this.tools = List.copyOf(tools);
        this.errorHandler = errorHandler;
        log.info("Initialized ToolRegistry with {} tools: {}",
                tools.size(),
                tools.stream().map(ResilientToolAdapter::getName).toList());
    }

    public Optional<ResilientToolAdapter<?, ?>> get(String name) {
        return tools.stream()
                .filter(tool -> tool.getName().equals(name))
                .findFirst();
    }

    public List<ResilientToolAdapter<?, ?>> list() {
        return tools;
    }

    public List<ToolDescriptor> describe() {
        return tools.stream()
                .map(tool -> ToolDescriptor.builder()
                        .name(tool.getName())
                        .description(tool.getDescription())
                        .cacheLayer(tool.getOperation().getCacheLayer().getId())
                        .available(errorHandler.isServiceAvailable(tool.getName()))
                        .fallbackConfig(tool.getFallbackConfig())
                        .build())
                .toList();
    }

    /**
     * Execute the named tool.
     * An unknown name fails with a RESOURCE {@link ToolFailureException}.
     */
    public Mono<ToolResult<?>> execute(String name, Object parameters, ToolContext context) {
        Optional<ResilientToolAdapter<?, ?>> tool = get(name);
        if (tool.isEmpty()) {
            log.warn("Unknown tool requested: {}", name);
            ToolException error = new ToolException("Unknown tool: " + name, ErrorCategory.RESOURCE,
                    ErrorSeverity.MEDIUM, name, "execute", Map.of("availableTools", names()), null);
            String requestId = context != null ? context.getRequestId() : null;
            return Mono.error(new ToolFailureException(errorHandler.handleError(error, name, "execute", requestId),
                    error));
        }
        return tool.get().execute(parameters, context).map(result -> (ToolResult<?>) result);
    }

    public Mono<Optional<HealthReport>> healthCheck(String name) {
        return get(name)
                .map(tool -> tool.healthCheck().map(Optional::of))
                .orElseGet(() -> Mono.just(Optional.empty()));
    }

    /**
     * Health of every tool, keyed by tool name.
     */
    public Mono<Map<String, HealthReport>> healthCheck() {
        return Flux.fromIterable(tools)
                .flatMap(ResilientToolAdapter::healthCheck)
                .collectMap(HealthReport::getToolName, report -> report, TreeMap::new);
    }

    private List<String> names() {
        return tools.stream().map(ResilientToolAdapter::getName).toList();
    }
}
