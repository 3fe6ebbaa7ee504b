package com.vidnyan.guard.adapter.in.cli;

import com.vidnyan.guard.application.port.in.ValidateProjectUseCase;
import com.vidnyan.guard.application.port.in.ValidateProjectUseCase.ValidationRequest;
import com.vidnyan.guard.config.GuardProperties;
import com.vidnyan.guard.domain.model.FileIssues;
import com.vidnyan.guard.domain.model.ProjectReport;
import com.vidnyan.guard.domain.model.RuleOptions;
import com.vidnyan.guard.domain.model.ValidationOptions;
import com.vidnyan.guard.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * One-shot validation for CI. Runs when {@code guard.analyze.path} is set,
 * logs a report and exits with 0 on success, 1 on failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidationCliRunner implements CommandLineRunner {
    
    private static final int MAX_LISTED = 100;
    
    private final ValidateProjectUseCase validateProject;
    private final GuardProperties properties;
    private final ConfigurableApplicationContext context;
    
    @Override
    public void run(String... args) {
        String sourcePath = properties.getAnalyze().getPath();
        if (sourcePath == null || sourcePath.isBlank()) {
            log.debug("No analyze path specified. Set guard.analyze.path to run a one-shot validation.");
            return;
        }
        
        int exitCode = 1;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                 Architecture Guard                           ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Validating: {}", truncatePath(sourcePath, 48));
            log.info("╚══════════════════════════════════════════════════════════════╝");
            
            ValidationOptions options = new ValidationOptions(List.of(),
                    new RuleOptions(properties.getRules().getMaxLines(), properties.getRules().getWarnLines()),
                    true, Boolean.parseBoolean(System.getenv("CI")), List.of(), false);
            ValidationResult result = validateProject.validate(new ValidationRequest(Path.of(sourcePath), options));
            
            printResults(result);
            exitCode = result.success() ? 0 : 1;
        } finally {
            int code = exitCode;
            System.exit(SpringApplication.exit(context, () -> code));
        }
    }
    
    private void printResults(ValidationResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" VALIDATION RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        ProjectReport report = result.extra() instanceof ProjectReport r ? r : null;
        if (report != null) {
            log.info(" Files scanned: {}", report.filesScanned());
            log.info(" Files passed:  {}", report.filesPassed());
            log.info(" Files failed:  {}", report.filesFailed());
            log.info(" Rules:         {}", String.join(", ", report.validators()));
        }
        log.info(" Errors:        {}", result.errors().size());
        log.info(" Warnings:      {}", result.warnings().size());
        log.info("═══════════════════════════════════════════════════════════════");
        
        if (result.errors().isEmpty() && result.warnings().isEmpty()) {
            log.info("");
            log.info("✅ No issues found.");
            return;
        }
        
        if (report == null) {
            result.errors().forEach(e -> log.info("   🟠 {}", e));
        } else {
            printFileIssues(report.componentIssues());
            if (report.dependencies() != null && !report.dependencies().denied().isEmpty()) {
                log.info("");
                log.info(" Denied imports:");
                report.dependencies().denied().forEach(edge -> log.info("   🟠 {}", edge));
            }
        }
        log.info("");
        log.info(result.summary());
    }
    
    private void printFileIssues(List<FileIssues> componentIssues) {
        int count = 0;
        for (FileIssues issues : componentIssues) {
            if (++count > MAX_LISTED) {
                log.info(" ... and {} more files", componentIssues.size() - MAX_LISTED);
                break;
            }
            log.info("");
            log.info(" {} {}", issues.passed() ? "⚠️" : "❌", issues.file());
            issues.errors().forEach(e -> log.info("   🟠 {}", e));
            issues.warnings().forEach(w -> log.info("   🟡 {}", w));
        }
    }
    
    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
