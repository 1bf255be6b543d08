package com.tessera.tool.analysis;

import com.tessera.service.error.ErrorCategory;
import com.tessera.service.error.ToolException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileSystem;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Walks a project directory and summarizes languages, build files and test directories.
 */
@Slf4j
public class ProjectAnalyzer {

    static final int DEFAULT_MAX_DEPTH = 8;
    static final int LARGEST_FILES = 5;
    private static final long MAX_LINE_COUNT_BYTES = 5L * 1024 * 1024;

    private static final Set<String> IGNORED_DIRECTORIES = Set.of(
            ".git", ".hg", ".svn", ".idea", ".vscode", "node_modules", "target", "build", "dist",
            "out", "coverage", "__pycache__", ".venv", "venv", ".gradle");

    private static final Set<String> BUILD_FILES = Set.of(
            "pom.xml", "build.gradle", "build.gradle.kts", "settings.gradle", "package.json",
            "pyproject.toml", "setup.py", "requirements.txt", "Pipfile", "Cargo.toml", "go.mod",
            "Makefile", "CMakeLists.txt", "tsconfig.json");

    private static final Set<String> TEST_DIRECTORIES = Set.of("test", "tests", "__tests__", "spec", "specs");

    private static final Map<String, String> LANGUAGES_BY_EXTENSION = Map.ofEntries(
            Map.entry("java", "Java"),
            Map.entry("kt", "Kotlin"),
            Map.entry("scala", "Scala"),
            Map.entry("groovy", "Groovy"),
            Map.entry("js", "JavaScript"),
            Map.entry("jsx", "JavaScript"),
            Map.entry("mjs", "JavaScript"),
            Map.entry("cjs", "JavaScript"),
            Map.entry("ts", "TypeScript"),
            Map.entry("tsx", "TypeScript"),
            Map.entry("py", "Python"),
            Map.entry("rb", "Ruby"),
            Map.entry("go", "Go"),
            Map.entry("rs", "Rust"),
            Map.entry("c", "C"),
            Map.entry("h", "C"),
            Map.entry("cpp", "C++"),
            Map.entry("cc", "C++"),
            Map.entry("hpp", "C++"),
            Map.entry("cs", "C#"),
            Map.entry("php", "PHP"),
            Map.entry("swift", "Swift"));

    public enum Mode {
        /**
         * Depth-limited walk, or the whole tree for deep analyses.
         */
        FULL,

        /**
         * Top-level entries only.
         */
        SHALLOW
    }

    /**
     * Analyze the project at {@code projectPath}.
     *
     * @throws ToolException RESOURCE if the path does not exist, VALIDATION if it is not a directory
     */
    public ProjectAnalysis analyze(ProjectAnalysisRequest request, Mode mode) {
        Path root = Path.of(request.getProjectPath()).toAbsolutePath().normalize();
        if (!Files.exists(root)) {
            throw new ToolException("Project path does not exist: " + root, ErrorCategory.RESOURCE,
                    new NoSuchFileException(root.toString()));
        }
        if (!Files.isDirectory(root)) {
            throw new ToolException("Invalid project path, not a directory: " + root, ErrorCategory.VALIDATION);
        }

        int maxDepth = mode == Mode.SHALLOW ? 1 : request.isDeep() ? Integer.MAX_VALUE : DEFAULT_MAX_DEPTH;
        boolean countLines = mode == Mode.FULL && request.isDeep();
        Collector collector = new Collector(root, matchers(root.getFileSystem(), request.getInclude()),
                matchers(root.getFileSystem(), request.getExclude()), countLines);

        long start = System.currentTimeMillis();
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, collector);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to analyze " + root, e);
        }
        log.debug("Analyzed {} in {}ms: mode={}, files={}", root, System.currentTimeMillis() - start, mode,
                collector.totalFiles);

        return ProjectAnalysis.builder()
                .projectPath(root.toString())
                .languages(collector.languages)
                .buildFiles(sorted(collector.buildFiles))
                .testDirectories(sorted(collector.testDirectories))
                .totalFiles(collector.totalFiles)
                .totalLines(collector.totalLines)
                .largestFiles(collector.largestFiles())
                .strategy(mode == Mode.SHALLOW ? ProjectAnalysis.Strategy.SIMPLIFIED : ProjectAnalysis.Strategy.FULL)
                .build();
    }

    private static List<PathMatcher> matchers(FileSystem fileSystem, List<String> globs) {
        if (globs == null) {
            return List.of();
        }
        return globs.stream()
                .filter(glob -> glob != null && !glob.isBlank())
                .map(glob -> fileSystem.getPathMatcher("glob:" + glob))
                .collect(Collectors.toList());
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values);
        copy.sort(Comparator.naturalOrder());
        return copy;
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static long countLines(Path file) {
        long lines = 0;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            int read;
            int last = -1;
            while ((read = in.read()) != -1) {
                if (read == '\n') {
                    lines++;
                }
                last = read;
            }
            if (last != -1 && last != '\n') {
                lines++;
            }
        } catch (IOException e) {
            log.debug("Could not count lines of {}: {}", file, e.getMessage());
        }
        return lines;
    }

    private static final class Collector extends SimpleFileVisitor<Path> {
        private final Path root;
        private final List<PathMatcher> includes;
        private final List<PathMatcher> excludes;
        private final boolean countLines;

        private final Map<String, Long> languages = new TreeMap<>();
        private final List<String> buildFiles = new ArrayList<>();
        private final List<String> testDirectories = new ArrayList<>();
        private final List<ProjectAnalysis.FileStat> files = new ArrayList<>();
        private long totalFiles;
        private long totalLines;

        private Collector(Path root, List<PathMatcher> includes, List<PathMatcher> excludes, boolean countLines) {
            this.root = root;
            this.includes = includes;
            this.excludes = excludes;
            this.countLines = countLines;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            String name = dir.getFileName().toString();
            Path relative = root.relativize(dir);
            if (IGNORED_DIRECTORIES.contains(name) || matchesAny(excludes, relative)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (TEST_DIRECTORIES.contains(name)) {
                testDirectories.add(toUnix(relative));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isDirectory()) {
                // directories at the depth limit are reported as files
                String name = file.getFileName().toString();
                if (TEST_DIRECTORIES.contains(name) && !IGNORED_DIRECTORIES.contains(name)) {
                    testDirectories.add(toUnix(root.relativize(file)));
                }
                return FileVisitResult.CONTINUE;
            }
            Path relative = root.relativize(file);
            if (matchesAny(excludes, relative) || (!includes.isEmpty() && !matchesAny(includes, relative))) {
                return FileVisitResult.CONTINUE;
            }

            String name = file.getFileName().toString();
            totalFiles++;
            if (BUILD_FILES.contains(name)) {
                buildFiles.add(toUnix(relative));
            }
            String language = LANGUAGES_BY_EXTENSION.get(extension(name));
            if (language != null) {
                languages.merge(language, 1L, Long::sum);
            }
            files.add(ProjectAnalysis.FileStat.builder()
                    .path(toUnix(relative))
                    .sizeBytes(attrs.size())
                    .build());
            if (countLines && attrs.size() <= MAX_LINE_COUNT_BYTES) {
                totalLines += countLines(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        private List<ProjectAnalysis.FileStat> largestFiles() {
            return files.stream()
                    .sorted(Comparator.comparingLong(ProjectAnalysis.FileStat::getSizeBytes).reversed()
                            .thenComparing(ProjectAnalysis.FileStat::getPath))
                    .limit(LARGEST_FILES)
                    .collect(Collectors.toList());
        }

        private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
            return matchers.stream().anyMatch(matcher -> matcher.matches(relative));
        }

        private static String toUnix(Path relative) {
            return relative.toString().replace('\\', '/');
        }
    }
}
