package com.vidnyan.guard.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalized, project-relative path of a source file.
 * Always uses forward slashes and never starts with "./" or "/".
 */
public record SourcePath(String value) {

    private static final Set<String> COMPONENT_EXTENSIONS = Set.of("tsx", "jsx");
    private static final Set<String> SOURCE_EXTENSIONS = Set.of("ts", "tsx", "js", "jsx", "mjs", "cjs");

    public SourcePath {
        value = normalize(value);
    }

    public static SourcePath of(String path) {
        return new SourcePath(path);
    }

    /**
     * Normalize separators and strip leading "./" and "/".
     */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    /**
     * Directory segments, excluding the file name.
     */
    public List<String> directories() {
        String[] parts = value.split("/");
        if (parts.length <= 1) {
            return List.of();
        }
        return List.of(parts).subList(0, parts.length - 1);
    }

    public boolean inDirectory(String directory) {
        return directories().contains(directory);
    }

    public boolean startsWithDirectory(String directory) {
        return value.startsWith(directory + "/");
    }

    public String fileName() {
        int slash = value.lastIndexOf('/');
        return slash >= 0 ? value.substring(slash + 1) : value;
    }

    /**
     * File name without the (last) extension, e.g. "button" for "button.tsx".
     * Declaration files keep their ".d" part stripped too.
     */
    public String baseName() {
        String name = fileName();
        if (name.endsWith(".d.ts")) {
            return name.substring(0, name.length() - 5);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public String extension() {
        String name = fileName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public boolean isSourceFile() {
        return SOURCE_EXTENSIONS.contains(extension());
    }

    /**
     * JSX-bearing file (.tsx / .jsx).
     */
    public boolean isComponentFile() {
        return COMPONENT_EXTENSIONS.contains(extension());
    }

    public boolean isDeclarationFile() {
        return fileName().endsWith(".d.ts");
    }

    public boolean isTestFile() {
        String name = fileName();
        return name.contains(".test.") || name.contains(".spec.")
                || inDirectory("__tests__") || inDirectory("tests");
    }

    /**
     * Next.js App Router special file (page, layout, loading, ...) under app/.
     */
    public boolean isRouteModule() {
        if (!startsWithDirectory("app") || !isComponentFile()) {
            return false;
        }
        return switch (baseName()) {
            case "page", "layout", "loading", "error", "not-found", "template", "global-error" -> true;
            default -> false;
        };
    }

    /**
     * Page or layout, the two route modules that render data.
     */
    public boolean isPageOrLayout() {
        return isRouteModule() && ("page".equals(baseName()) || "layout".equals(baseName()));
    }

    @Override
    public String toString() {
        return value;
    }
}
