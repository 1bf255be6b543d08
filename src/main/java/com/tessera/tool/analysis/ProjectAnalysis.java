package com.tessera.tool.analysis;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Summary of a project's layout.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProjectAnalysis {

    public enum Strategy {
        FULL,
        SIMPLIFIED,
        PARTIAL,
        FALLBACK
    }

    String projectPath;

    /**
     * Language name to number of files, ordered by name.
     */
    Map<String, Long> languages;

    List<String> buildFiles;
    List<String> testDirectories;
    long totalFiles;

    /**
     * Only counted by deep analyses.
     */
    long totalLines;

    List<FileStat> largestFiles;
    Strategy strategy;
    String cacheKey;

    @Value
    @Builder
    @Jacksonized
    public static class FileStat {
        String path;
        long sizeBytes;
    }

    public static ProjectAnalysis empty(String projectPath, Strategy strategy) {
        return ProjectAnalysis.builder()
                .projectPath(projectPath)
                .languages(Map.of())
                .buildFiles(List.of())
                .testDirectories(List.of())
                .largestFiles(List.of())
                .strategy(strategy)
                .build();
    }
}
