package com.vidnyan.guard.application.port.in;

import com.vidnyan.guard.domain.model.ValidationOptions;
import com.vidnyan.guard.domain.model.ValidationResult;

import java.nio.file.Path;

/**
 * Primary use case: validate a source tree against the architecture rules.
 */
public interface ValidateProjectUseCase {
    
    /**
     * Validate every source file under the request root.
     * Never throws for caller mistakes; configuration problems come back as a failed result.
     */
    ValidationResult validate(ValidationRequest request);
    
    /**
     * Validate caller-supplied content as if it lived at {@code filePath}.
     */
    ValidationResult validateContent(String filePath, String content, ValidationOptions options);
    
    /**
     * Validation request parameters.
     *
     * @param root file or directory to validate, null when the caller gave none
     */
    record ValidationRequest(Path root, ValidationOptions options) {
        public static ValidationRequest forPath(Path root) {
            return new ValidationRequest(root, ValidationOptions.defaults());
        }
    }
}
