package com.tessera.tool.analysis;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parameters of a project analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectAnalysisRequest {

    @NotBlank(message = "Project path is required")
    private String projectPath;

    /**
     * Walk the whole tree and count lines; otherwise the walk is depth-limited.
     */
    private boolean deep;

    /**
     * Glob patterns relative to the project root; empty includes everything.
     */
    private List<String> include;

    private List<String> exclude;

    /**
     * Ignore any cached analysis and compute a fresh one.
     */
    private boolean forceFresh;
}
