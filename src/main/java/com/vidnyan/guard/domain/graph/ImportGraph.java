package com.vidnyan.guard.domain.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Module-level import graph of a project.
 * Only edges between project modules take part in cycle detection.
 */
public final class ImportGraph {
    
    private final Map<String, Set<String>> imports; // module → project modules it imports
    private final Set<String> modules;
    private final int edgeCount;
    
    private ImportGraph(Map<String, Set<String>> imports, Set<String> modules, int edgeCount) {
        this.imports = Collections.unmodifiableMap(imports);
        this.modules = Collections.unmodifiableSet(modules);
        this.edgeCount = edgeCount;
    }
    
    /**
     * Build the graph from extracted edges. Sorted collections keep cycle output stable.
     */
    public static ImportGraph build(Set<String> modules, List<ImportEdge> edges) {
        Map<String, Set<String>> deps = new TreeMap<>();
        Set<String> known = new TreeSet<>(modules);
        int count = 0;
        
        for (ImportEdge edge : edges) {
            if (edge.external() || !known.contains(edge.target()) || edge.source().equals(edge.target())) {
                continue;
            }
            if (deps.computeIfAbsent(edge.source(), k -> new TreeSet<>()).add(edge.target())) {
                count++;
            }
        }
        
        return new ImportGraph(deps, known, count);
    }
    
    public Set<String> getImports(String module) {
        return imports.getOrDefault(module, Set.of());
    }
    
    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }
    
    /**
     * Find import cycles. Each cycle starts and ends with the same module.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();
        
        for (String module : modules) {
            if (!visited.contains(module)) {
                findCyclesRecursive(module, visited, inStack, new ArrayList<>(), cycles);
            }
        }
        
        return cycles;
    }
    
    private void findCyclesRecursive(
            String current,
            Set<String> visited,
            Set<String> inStack,
            List<String> path,
            List<List<String>> cycles
    ) {
        visited.add(current);
        inStack.add(current);
        path.add(current);
        
        for (String dep : getImports(current)) {
            if (!visited.contains(dep)) {
                findCyclesRecursive(dep, visited, inStack, path, cycles);
            } else if (inStack.contains(dep)) {
                int cycleStart = path.indexOf(dep);
                List<String> cycle = new ArrayList<>(path.subList(cycleStart, path.size()));
                cycle.add(dep);
                cycles.add(cycle);
            }
        }
        
        path.remove(path.size() - 1);
        inStack.remove(current);
    }
    
    public Stats stats() {
        return new Stats(modules.size(), edgeCount);
    }
    
    public record Stats(int moduleCount, int edgeCount) {}
}
