package com.flowgraph.analyzer.config;

import com.google.gson.annotations.SerializedName;

import java.nio.file.Path;
import java.util.List;

/**
 * Deserialized form of the analysis configuration file. Every key is optional.
 */
public class AnalysisConfig {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".cpp", ".hpp", ".h", ".cc", ".cxx");

    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
            "**/build/**", "**/cmake-build/**", "**/.git/**", "**/node_modules/**", "**/test/**", "**/tests/**");

    @SerializedName("project_name")
    private String projectName;

    @SerializedName("extensions")
    private List<String> extensions;

    @SerializedName("exclude_patterns")
    private List<String> excludePatterns;

    /** Worker pool size for per-file analysis (default: available processors). */
    @SerializedName("worker_threads")
    private Integer workerThreads;

    /** Where IR and graph caches go (default: {@code <project>/.flowgraph_cache}). */
    @SerializedName("cache_dir")
    private String cacheDir;

    /** Print low-severity diagnostics such as unresolved references (default: false). */
    @SerializedName("verbose")
    private Boolean verbose;

    public String getProjectName(Path projectRoot) {
        if (projectName != null && !projectName.isBlank()) return projectName;
        Path name = projectRoot.toAbsolutePath().normalize().getFileName();
        return name != null ? name.toString() : "project";
    }

    public List<String> getExtensions()      { return extensions != null ? extensions : DEFAULT_EXTENSIONS; }
    public List<String> getExcludePatterns() { return excludePatterns != null ? excludePatterns : DEFAULT_EXCLUDE_PATTERNS; }
    public boolean isVerbose()               { return verbose != null && verbose; }

    public int getWorkerThreads() {
        if (workerThreads != null && workerThreads > 0) return workerThreads;
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public Path getCacheDir(Path projectRoot) {
        if (cacheDir == null || cacheDir.isBlank()) return projectRoot.resolve(".flowgraph_cache");
        return projectRoot.resolve(cacheDir);
    }
}
