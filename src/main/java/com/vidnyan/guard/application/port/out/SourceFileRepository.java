package com.vidnyan.guard.application.port.out;

import com.vidnyan.guard.domain.model.SourcePath;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Port for reading the project tree.
 */
public interface SourceFileRepository {
    
    /**
     * List source files under {@code root}, sorted, relative to {@code root}.
     */
    List<SourcePath> listSourceFiles(Path root, List<String> ignorePatterns) throws IOException;
    
    String read(Path root, SourcePath file) throws IOException;
    
    /**
     * Read a project file that may legitimately be missing, e.g. {@code package.json}.
     */
    Optional<String> readIfExists(Path root, String relativePath) throws IOException;
}
