package com.vidnyan.guard.adapter.in.tool;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of tools exposed over HTTP and stdio.
 */
public enum ToolKind {
    ARCHITECTURE_CHECK("architecture_check",
            "Run the architecture rules over a project tree",
            List.of()),
    VALIDATE_FILE("validate_file",
            "Run the architecture rules over one file's proposed content",
            List.of("filePath", "content")),
    DEPENDENCY_CHECK("dependency_check",
            "Check every import in a project tree against the dependency policy",
            List.of()),
    CHECK_IMPORT_ALLOWED("check_import_allowed",
            "Check whether one module may import another",
            List.of("source", "target"));
    
    private final String wireName;
    private final String description;
    private final List<String> requiredParams;
    
    ToolKind(String wireName, String description, List<String> requiredParams) {
        this.wireName = wireName;
        this.description = description;
        this.requiredParams = requiredParams;
    }
    
    public String wireName() {
        return wireName;
    }
    
    public String description() {
        return description;
    }
    
    public List<String> requiredParams() {
        return requiredParams;
    }
    
    public static Optional<ToolKind> fromName(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(name))
                .findFirst();
    }
}
