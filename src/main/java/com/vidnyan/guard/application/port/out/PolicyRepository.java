package com.vidnyan.guard.application.port.out;

import com.vidnyan.guard.domain.policy.DependencyPolicy;

/**
 * Port for loading the dependency policy.
 */
public interface PolicyRepository {
    
    /**
     * The active policy. Loaded once; implementations fail fast on a malformed document.
     */
    DependencyPolicy load();
    
    /**
     * Where the policy came from, for logging.
     */
    String location();
}
