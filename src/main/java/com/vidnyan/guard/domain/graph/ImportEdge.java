package com.vidnyan.guard.domain.graph;

/**
 * A static import from one project module to a module or package.
 *
 * @param source    importing module, project-relative without extension
 * @param target    resolved module path or package name
 * @param specifier specifier as written in the source
 * @param external  true when the target is a package rather than a project module
 */
public record ImportEdge(String source, String target, String specifier, boolean external) {
    
    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
