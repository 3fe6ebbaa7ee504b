package com.vidnyan.guard.adapter.out.parser;

import com.vidnyan.guard.domain.model.SourcePath;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Resolves import specifiers to project module paths or package names.
 */
public final class ModuleResolver {
    
    private static final List<String> EXTENSIONS = List.of(".d.ts", ".tsx", ".ts", ".jsx", ".js", ".mjs", ".cjs");
    
    private ModuleResolver() {
    }
    
    /**
     * Resolved import target.
     *
     * @param path     module path relative to the project root, or a package name
     * @param external true for packages
     */
    public record ModuleRef(String path, boolean external) {}
    
    public static ModuleRef resolve(SourcePath importer, String specifier) {
        if (isRelative(specifier)) {
            String base = String.join("/", importer.directories());
            String joined = base.isEmpty() ? specifier : base + "/" + specifier;
            return new ModuleRef(stripModuleSuffix(normalizeSegments(joined)), false);
        }
        if (specifier.startsWith("@/") || specifier.startsWith("~/")) {
            return new ModuleRef(stripModuleSuffix(normalizeSegments(specifier.substring(2))), false);
        }
        if (specifier.startsWith("/")) {
            return new ModuleRef(stripModuleSuffix(normalizeSegments(specifier.substring(1))), false);
        }
        return new ModuleRef(packageRoot(specifier), true);
    }
    
    /**
     * Module identity of a project file: path without extension or trailing {@code /index}.
     */
    public static String moduleOf(SourcePath file) {
        return stripModuleSuffix(file.value());
    }
    
    /**
     * Package name of a bare specifier: {@code @scope/name} or the first segment.
     */
    public static String packageRoot(String specifier) {
        String bare = specifier.startsWith("node:") ? specifier.substring(5) : specifier;
        String[] parts = bare.split("/");
        if (bare.startsWith("@") && parts.length > 1) {
            return parts[0] + "/" + parts[1];
        }
        return parts[0];
    }
    
    /**
     * Specifiers that point into the project: relative, {@code @/}, {@code ~/} or root-absolute.
     */
    public static boolean isProjectSpecifier(String specifier) {
        return isRelative(specifier) || specifier.startsWith("@/") || specifier.startsWith("~/")
                || specifier.startsWith("/");
    }
    
    private static boolean isRelative(String specifier) {
        return specifier.equals(".") || specifier.equals("..")
                || specifier.startsWith("./") || specifier.startsWith("../");
    }
    
    private static String normalizeSegments(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                // imports escaping the root stay at the root
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }
    
    /**
     * Strip a source extension and a trailing {@code /index}.
     */
    public static String stripModuleSuffix(String path) {
        String stripped = path;
        for (String extension : EXTENSIONS) {
            if (stripped.endsWith(extension)) {
                stripped = stripped.substring(0, stripped.length() - extension.length());
                break;
            }
        }
        if (stripped.endsWith("/index")) {
            stripped = stripped.substring(0, stripped.length() - "/index".length());
        }
        return stripped;
    }
}
