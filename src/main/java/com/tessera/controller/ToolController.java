package com.tessera.controller;

import com.tessera.model.HealthReport;
import com.tessera.model.ToolContext;
import com.tessera.model.ToolHeaders;
import com.tessera.model.ToolResult;
import com.tessera.model.dto.ErrorResponse;
import com.tessera.model.dto.ToolDescriptor;
import com.tessera.service.ToolContextParser;
import com.tessera.service.error.ToolFailureException;
import com.tessera.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Tool execution controller with result provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;
    private final ToolContextParser contextParser;

    public ToolController(ToolRegistry toolRegistry, ToolContextParser contextParser) {
        this.toolRegistry = toolRegistry;
        this.contextParser = contextParser;
    }

    @GetMapping
    public ResponseEntity<List<ToolDescriptor>> listTools() {
        return ResponseEntity.ok(toolRegistry.describe());
    }

    /**
     * Execute a tool. The body holds the raw tool parameters.
     */
    @PostMapping("/{name}")
    public Mono<ResponseEntity<ToolResult<?>>> execute(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> parameters,
            @RequestHeader HttpHeaders headers) {

        ToolContext context = contextParser.parse(headers);
        log.info("Received execution request for tool: {} (bypassCache={}, store={})",
                name, context.isBypassCache(), context.isStore());

        return toolRegistry.execute(name, parameters, context)
                .map(result -> {
                    HttpHeaders responseHeaders = new HttpHeaders();
                    responseHeaders.add(ToolHeaders.CACHE_HIT, String.valueOf(result.isCacheHit()));
                    responseHeaders.add(ToolHeaders.TOOL_STATUS, result.getStatus().name());
                    responseHeaders.add(ToolHeaders.DURATION_MS, String.valueOf(result.getDurationMs()));
                    responseHeaders.add(ToolHeaders.SESSION_ID, result.getSessionId());
                    responseHeaders.add(ToolHeaders.TRACE_ID, result.getTraceId());
                    if (result.getFallbackStrategy() != null) {
                        responseHeaders.add(ToolHeaders.FALLBACK_STRATEGY, result.getFallbackStrategy().name());
                    }

                    return ResponseEntity.ok()
                            .headers(responseHeaders)
                            .body(result);
                });
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, HealthReport>>> healthCheckAll() {
        return toolRegistry.healthCheck()
                .map(reports -> {
                    boolean healthy = reports.values().stream().allMatch(HealthReport::isHealthy);
                    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                            .body(reports);
                });
    }

    @GetMapping("/{name}/health")
    public Mono<ResponseEntity<HealthReport>> healthCheck(@PathVariable String name) {
        return toolRegistry.healthCheck(name)
                .map(report -> report
                        .map(health -> ResponseEntity
                                .status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                                .body(health))
                        .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    /**
     * Render tool failures with a status matching their category.
     */
    @ExceptionHandler(ToolFailureException.class)
    public ResponseEntity<ErrorResponse> handleToolFailure(ToolFailureException e) {
        return ResponseEntity.status(statusFor(e))
                .body(e.getResponse());
    }

    static HttpStatus statusFor(ToolFailureException e) {
        return switch (e.getCategory()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case RESOURCE -> HttpStatus.NOT_FOUND;
            case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
            case EXTERNAL -> HttpStatus.SERVICE_UNAVAILABLE;
            case PERFORMANCE -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
