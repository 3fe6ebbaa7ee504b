package com.vidnyan.guard.application.port.out;

import com.vidnyan.guard.domain.graph.ImportEdge;
import com.vidnyan.guard.domain.model.SourcePath;

import java.util.List;

/**
 * Port for extracting import edges from source text.
 * Implemented by adapters that parse (or approximate parsing of) module syntax.
 */
public interface ImportScanner {
    
    /**
     * Static and dynamic imports of one file, resolved to module paths or package names.
     */
    List<ImportEdge> scan(SourcePath file, String content);
    
    /**
     * Module identity of a project file, as used on both ends of an {@link ImportEdge}.
     */
    String moduleOf(SourcePath file);
    
    /**
     * Canonical readings of a single caller-supplied target. Relative and aliased
     * specifiers resolve against {@code importer} to one module. A bare target is
     * ambiguous: it is returned as written (a project path) and, when different,
     * as its package root, the form a project scan records for package imports.
     */
    List<String> resolveTargets(SourcePath importer, String target);
    
    /**
     * Package names declared in a package manifest ({@code dependencies}, {@code devDependencies}, ...).
     */
    List<String> declaredDependencies(String manifest);
}
