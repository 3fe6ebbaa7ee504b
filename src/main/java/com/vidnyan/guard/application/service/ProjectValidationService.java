package com.vidnyan.guard.application.service;

import com.vidnyan.guard.application.port.in.CheckDependencyUseCase;
import com.vidnyan.guard.application.port.in.ValidateProjectUseCase;
import com.vidnyan.guard.application.port.out.SourceFileRepository;
import com.vidnyan.guard.domain.model.DependencyReport;
import com.vidnyan.guard.domain.model.FileIssues;
import com.vidnyan.guard.domain.model.ProjectReport;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.RuleResult;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.model.ValidationOptions;
import com.vidnyan.guard.domain.model.ValidationResult;
import com.vidnyan.guard.domain.rule.ArchitectureRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Orchestrates a validation run: selects rules, walks the tree, runs every
 * applicable rule on every file and aggregates the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectValidationService implements ValidateProjectUseCase {
    
    private final SourceFileRepository sourceFileRepository;
    private final List<ArchitectureRule> rules;
    private final CheckDependencyUseCase dependencyCheck;
    
    @Override
    public ValidationResult validate(ValidationRequest request) {
        Path root = request.root();
        ValidationOptions options = request.options();
        if (root == null) {
            return ValidationResult.failure("Configuration error: no project path given",
                    "Architecture validation could not run: no project path given");
        }
        if (!Files.exists(root)) {
            return ValidationResult.failure("Configuration error: path does not exist: " + root,
                    "Architecture validation could not run: " + root + " does not exist");
        }
        Instant startTime = Instant.now();
        log.info("Starting validation of: {}", root);
        
        // Step 1: Select rules
        List<String> configErrors = new ArrayList<>();
        List<ArchitectureRule> selected = selectRules(options.validators(), configErrors);
        log.info("Step 1: Selected {} rules: {}", selected.size(), names(selected));
        
        // Step 2: Enumerate files
        log.info("Step 2: Scanning source files...");
        List<SourcePath> files;
        try {
            files = sourceFileRepository.listSourceFiles(root, options.ignorePatterns());
        } catch (IOException e) {
            log.error("Failed to scan {}: {}", root, e.getMessage());
            return ValidationResult.failure("Failed to scan " + root + ": " + e.getMessage(),
                    "Architecture validation could not run: " + e.getMessage());
        }
        log.info("Found {} source files", files.size());
        
        // Step 3: Run rules
        log.info("Step 3: Running rules...");
        Map<String, FileOutcome> outcomes = new TreeMap<>();
        for (SourcePath file : files) {
            FileOutcome outcome;
            try {
                outcome = checkFile(file, sourceFileRepository.read(root, file), selected, options.ruleOptions());
            } catch (IOException e) {
                log.warn("Could not read {}: {}", file, e.getMessage());
                outcome = new FileOutcome(List.of(file + ": could not read file: " + e.getMessage()), List.of());
            }
            outcomes.put(file.value(), outcome);
        }
        
        // Step 4: Dependencies
        ValidationResult dependencies = null;
        if (options.includeDependencies()) {
            log.info("Step 4: Checking dependency policy...");
            dependencies = dependencyCheck.validateDependencies(root, options.withStrict(false));
        }
        
        ValidationResult result = aggregate(files.size(), outcomes, configErrors, selected, dependencies,
                options.strict());
        log.info("Validation complete in {}ms: {}",
                Duration.between(startTime, Instant.now()).toMillis(), result.summary());
        return result;
    }
    
    @Override
    public ValidationResult validateContent(String filePath, String content, ValidationOptions options) {
        if (filePath == null || filePath.isBlank()) {
            return ValidationResult.failure("Configuration error: filePath is required",
                    "File validation could not run: filePath is required");
        }
        SourcePath file = SourcePath.of(filePath);
        List<String> configErrors = new ArrayList<>();
        List<ArchitectureRule> selected = selectRules(options.validators(), configErrors);
        log.info("Validating content of {} with {} rules", file, selected.size());
        
        FileOutcome outcome = checkFile(file, content == null ? "" : content, selected, options.ruleOptions());
        Map<String, FileOutcome> outcomes = new TreeMap<>(Map.of(file.value(), outcome));
        return aggregate(1, outcomes, configErrors, selected, null, options.strict());
    }
    
    /**
     * Run each applicable rule on one file. A rule that throws becomes one error entry.
     */
    private FileOutcome checkFile(SourcePath file, String content, List<ArchitectureRule> selected,
                                  RuleOptions ruleOptions) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (ArchitectureRule rule : selected) {
            if (!rule.appliesTo(file)) {
                continue;
            }
            try {
                RuleResult result = rule.check(file, content, ruleOptions);
                result.errors().forEach(message -> errors.add(format(file, message, rule)));
                result.warnings().forEach(message -> warnings.add(format(file, message, rule)));
            } catch (Exception e) {
                log.error("Error running rule {} on {}: {}", rule.name(), file, e.getMessage());
                errors.add(file + ": rule '" + rule.name() + "' failed: " + e.getMessage());
            }
        }
        return new FileOutcome(errors, warnings);
    }
    
    private ValidationResult aggregate(int filesScanned, Map<String, FileOutcome> outcomes,
                                       List<String> configErrors, List<ArchitectureRule> selected,
                                       ValidationResult dependencies, boolean strict) {
        List<String> errors = new ArrayList<>(configErrors);
        List<String> warnings = new ArrayList<>();
        List<FileIssues> componentIssues = new ArrayList<>();
        int filesFailed = 0;
        
        for (Map.Entry<String, FileOutcome> entry : outcomes.entrySet()) {
            FileOutcome outcome = strict ? entry.getValue().promoted() : entry.getValue();
            errors.addAll(outcome.errors());
            warnings.addAll(outcome.warnings());
            if (!outcome.errors().isEmpty() || !outcome.warnings().isEmpty()) {
                componentIssues.add(new FileIssues(entry.getKey(), outcome.errors(), outcome.warnings()));
            }
            if (!outcome.errors().isEmpty()) {
                filesFailed++;
            }
        }
        
        DependencyReport dependencyReport = null;
        if (dependencies != null) {
            errors.addAll(dependencies.errors());
            if (strict) {
                errors.addAll(dependencies.warnings());
            } else {
                warnings.addAll(dependencies.warnings());
            }
            if (dependencies.extra() instanceof DependencyReport report) {
                dependencyReport = report;
            }
        }
        
        int filesPassed = filesScanned - filesFailed;
        ProjectReport report = new ProjectReport(componentIssues, filesScanned, filesPassed, filesFailed,
                names(selected), dependencyReport);
        String summary = String.format("Architecture validation %s: %d files checked, %d passed, %d failed, "
                        + "%d errors, %d warnings",
                errors.isEmpty() ? "passed" : "failed", filesScanned, filesPassed, filesFailed,
                errors.size(), warnings.size());
        return ValidationResult.of(errors, warnings, summary, report);
    }
    
    private List<ArchitectureRule> selectRules(List<String> validators, List<String> configErrors) {
        List<ArchitectureRule> available = rules.stream()
                .sorted(Comparator.comparing(ArchitectureRule::name))
                .toList();
        if (validators.isEmpty()) {
            return available;
        }
        List<ArchitectureRule> selected = new ArrayList<>();
        for (String validator : validators) {
            available.stream()
                    .filter(rule -> rule.name().equals(validator))
                    .findFirst()
                    .ifPresentOrElse(rule -> {
                        if (!selected.contains(rule)) {
                            selected.add(rule);
                        }
                    }, () -> configErrors.add("Configuration error: unknown validator '" + validator
                            + "'; available: " + String.join(", ", names(available))));
        }
        return selected;
    }
    
    private static String format(SourcePath file, String message, ArchitectureRule rule) {
        return file + ": " + message + " [" + rule.name() + "]";
    }
    
    private static List<String> names(List<ArchitectureRule> rules) {
        return rules.stream().map(ArchitectureRule::name).toList();
    }
    
    private record FileOutcome(List<String> errors, List<String> warnings) {
        
        FileOutcome promoted() {
            List<String> all = new ArrayList<>(errors);
            all.addAll(warnings);
            return new FileOutcome(all, List.of());
        }
    }
}
