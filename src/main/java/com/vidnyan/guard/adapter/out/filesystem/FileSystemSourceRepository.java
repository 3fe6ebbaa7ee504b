package com.vidnyan.guard.adapter.out.filesystem;

import com.vidnyan.guard.application.port.out.SourceFileRepository;
import com.vidnyan.guard.config.GuardProperties;
import com.vidnyan.guard.domain.model.SourcePath;
import com.vidnyan.guard.domain.policy.PathPattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Scans a project directory for TS/JS source files.
 * Skips build output, dependency folders and hidden directories.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemSourceRepository implements SourceFileRepository {
    
    private final GuardProperties properties;
    
    @Override
    public List<SourcePath> listSourceFiles(Path root, List<String> ignorePatterns) throws IOException {
        List<PathPattern> ignored = ignorePatterns.stream().map(PathPattern::of).toList();
        
        if (Files.isRegularFile(root)) {
            SourcePath single = singleFile(root);
            return hasSourceExtension(single) ? List.of(single) : List.of();
        }
        
        List<SourcePath> sourceFiles = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || properties.getScan().getExcludedDirectories().contains(name)
                        || isIgnored(relativize(root, dir), ignored)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }
            
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                SourcePath path = SourcePath.of(relativize(root, file));
                if (attrs.isRegularFile() && hasSourceExtension(path) && !isIgnored(path.value(), ignored)) {
                    sourceFiles.add(path);
                }
                return FileVisitResult.CONTINUE;
            }
            
            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        
        sourceFiles.sort(Comparator.comparing(SourcePath::value));
        log.debug("Found {} source files under {}", sourceFiles.size(), root);
        return sourceFiles;
    }
    
    @Override
    public String read(Path root, SourcePath file) throws IOException {
        Path resolved = Files.isRegularFile(root) ? root : root.resolve(file.value());
        return Files.readString(resolved, StandardCharsets.UTF_8);
    }
    
    @Override
    public Optional<String> readIfExists(Path root, String relativePath) throws IOException {
        if (!Files.isDirectory(root)) {
            return Optional.empty();
        }
        Path file = root.resolve(relativePath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    }
    
    /**
     * Path of a file scanned on its own: relative to the configured project root
     * when the file lies under it, so path-based rules see {@code app/page.tsx}
     * rather than {@code page.tsx}. Falls back to the bare file name.
     */
    private SourcePath singleFile(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path projectRoot = Path.of(properties.getProjectRoot()).toAbsolutePath().normalize();
        if (absolute.startsWith(projectRoot) && !absolute.equals(projectRoot)) {
            return SourcePath.of(relativize(projectRoot, absolute));
        }
        return SourcePath.of(file.getFileName().toString());
    }
    
    private boolean hasSourceExtension(SourcePath path) {
        String name = path.fileName();
        return properties.getScan().getExtensions().stream().anyMatch(name::endsWith);
    }
    
    private static boolean isIgnored(String relativePath, List<PathPattern> ignored) {
        return ignored.stream().anyMatch(p -> p.matches(relativePath));
    }
    
    private static String relativize(Path root, Path path) {
        return root.relativize(path).toString();
    }
}
