package com.vidnyan.guard.application.service;

import com.vidnyan.guard.application.port.in.CheckDependencyUseCase;
import com.vidnyan.guard.application.port.out.ImportScanner;
import com.vidnyan.guard.application.port.out.PolicyRepository;
import com.vidnyan.guard.application.port.out.SourceFileRepository;
import com.vidnyan.guard.domain.graph.ImportEdge;
import com.vidnyan.guard.domain.graph.ImportGraph;
import com.vidnyan.guard.domain.model.DependencyCheckResult;
import com.vidnyan.guard.domain.model.DependencyReport;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.model.ValidationOptions;
import com.vidnyan.guard.domain.model.ValidationResult;
import com.vidnyan.guard.domain.policy.DependencyPolicy;
import com.vidnyan.guard.domain.policy.EdgeDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates imports against the dependency policy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DependencyPolicyService implements CheckDependencyUseCase {
    
    static final String MANIFEST = "package.json";
    
    private final SourceFileRepository sourceFileRepository;
    private final ImportScanner importScanner;
    private final PolicyRepository policyRepository;
    
    @Override
    public ValidationResult validateDependencies(Path root, ValidationOptions options) {
        if (root == null) {
            return ValidationResult.failure("Configuration error: no project path given",
                    "Dependency check could not run: no project path given");
        }
        if (!Files.exists(root)) {
            return ValidationResult.failure("Configuration error: path does not exist: " + root,
                    "Dependency check could not run: " + root + " does not exist");
        }
        log.info("Starting dependency check of: {}", root);
        DependencyPolicy policy = policyRepository.load();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        
        // Step 1: Collect imports
        log.info("Step 1: Extracting imports...");
        List<SourcePath> files;
        try {
            files = sourceFileRepository.listSourceFiles(root, options.ignorePatterns());
        } catch (IOException e) {
            log.error("Failed to scan {}: {}", root, e.getMessage());
            return ValidationResult.failure("Failed to scan " + root + ": " + e.getMessage(),
                    "Dependency check could not run: " + e.getMessage());
        }
        
        Set<String> modules = new LinkedHashSet<>();
        List<ImportEdge> edges = new ArrayList<>();
        for (SourcePath file : files) {
            modules.add(importScanner.moduleOf(file));
            try {
                edges.addAll(importScanner.scan(file, sourceFileRepository.read(root, file)));
            } catch (IOException e) {
                log.warn("Could not read {}: {}", file, e.getMessage());
                errors.add(file + ": could not read file: " + e.getMessage());
            }
        }
        log.info("Extracted {} imports from {} files", edges.size(), files.size());
        
        // Step 2: Evaluate edges
        log.info("Step 2: Evaluating imports against policy from {}...", policyRepository.location());
        Set<String> allowed = new LinkedHashSet<>();
        Set<String> denied = new LinkedHashSet<>();
        for (ImportEdge edge : edges) {
            tally(policy.evaluate(edge.source(), edge.target()), allowed, denied, errors);
        }
        
        // Step 3: Manifest dependencies
        log.info("Step 3: Checking {} dependencies...", MANIFEST);
        for (String dependency : manifestDependencies(root, errors)) {
            tally(policy.evaluate(MANIFEST, dependency), allowed, denied, errors);
        }
        
        // Step 4: Cycles
        log.info("Step 4: Detecting import cycles...");
        ImportGraph graph = ImportGraph.build(modules, edges);
        List<List<String>> cycles = graph.findCycles();
        for (List<String> cycle : cycles) {
            warnings.add("Import cycle: " + String.join(" -> ", cycle));
        }
        log.info("Graph: {} modules, {} internal edges, {} cycles",
                graph.stats().moduleCount(), graph.stats().edgeCount(), cycles.size());
        
        if (options.strict()) {
            errors.addAll(warnings);
            warnings.clear();
        }
        
        int checked = allowed.size() + denied.size();
        DependencyReport report = new DependencyReport(
                List.copyOf(allowed), List.copyOf(denied), checked, cycles);
        String summary = String.format("Dependency check %s: %d imports checked, %d denied, %d cycles",
                errors.isEmpty() ? "passed" : "failed", checked, denied.size(), cycles.size());
        log.info(summary);
        return ValidationResult.of(errors, warnings, summary, report);
    }
    
    @Override
    public DependencyCheckResult checkDependency(String source, String target, ValidationOptions options) {
        if (source == null || source.isBlank() || target == null || target.isBlank()) {
            return DependencyCheckResult.failed("Missing source or target dependency");
        }
        SourcePath importer = SourcePath.of(source.trim());
        String sourceModule = importScanner.moduleOf(importer);
        DependencyPolicy policy = policyRepository.load();
        List<EdgeDecision> decisions = importScanner.resolveTargets(importer, target.trim()).stream()
                .map(candidate -> policy.evaluate(sourceModule, candidate))
                .toList();
        
        EdgeDecision decision = decide(decisions);
        log.debug("{}: {}", decision.edge(), decision.allowed() ? "allowed" : "denied");
        String message = options.verbose() ? decision.explanation() : decision.message();
        return DependencyCheckResult.decided(decision.allowed(), message);
    }
    
    /**
     * An explicit deny on any reading wins, then an explicit allow, then the
     * default decision of the first reading.
     */
    private static EdgeDecision decide(List<EdgeDecision> decisions) {
        return decisions.stream()
                .filter(d -> !d.byDefault() && !d.allowed())
                .findFirst()
                .or(() -> decisions.stream().filter(d -> !d.byDefault()).findFirst())
                .orElse(decisions.get(0));
    }
    
    private static void tally(EdgeDecision decision, Set<String> allowed, Set<String> denied,
                               List<String> errors) {
        if (decision.allowed()) {
            allowed.add(decision.edge());
        } else if (denied.add(decision.edge())) {
            errors.add(decision.explanation());
        }
    }
    
    private List<String> manifestDependencies(Path root, List<String> errors) {
        try {
            Optional<String> manifest = sourceFileRepository.readIfExists(root, MANIFEST);
            return manifest.map(importScanner::declaredDependencies).orElse(List.of());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Skipping {}: {}", MANIFEST, e.getMessage());
            errors.add(MANIFEST + ": " + e.getMessage());
            return List.of();
        }
    }
}
