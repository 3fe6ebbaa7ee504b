package com.vidnyan.guard.application.port.in;

import com.vidnyan.guard.domain.model.DependencyCheckResult;
import com.vidnyan.guard.domain.model.ValidationOptions;
import com.vidnyan.guard.domain.model.ValidationResult;

import java.nio.file.Path;

/**
 * Dependency policy checks: whole project or a single hypothetical edge.
 */
public interface CheckDependencyUseCase {
    
    /**
     * Evaluate every import in the project, plus manifest dependencies.
     */
    ValidationResult validateDependencies(Path root, ValidationOptions options);
    
    /**
     * Decide whether {@code source} may import {@code target}. Pure, never touches the filesystem.
     */
    DependencyCheckResult checkDependency(String source, String target, ValidationOptions options);
}
