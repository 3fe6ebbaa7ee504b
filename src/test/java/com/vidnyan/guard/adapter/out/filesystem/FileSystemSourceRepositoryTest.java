package com.vidnyan.guard.adapter.out.filesystem;

import com.vidnyan.guard.config.GuardProperties;
import com.vidnyan.guard.domain.model.SourcePath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemSourceRepositoryTest {

    @TempDir
    Path tempDir;

    private final FileSystemSourceRepository repository = new FileSystemSourceRepository(new GuardProperties());

    @BeforeEach
    void createProject() throws IOException {
        write("app/page.tsx", "export default function Page() { return null; }");
        write("components/button.tsx", "export function Button() { return null; }");
        write("lib/utils.ts", "export const noop = () => {};");
        write("styles/globals.css", "body {}");
        write("README.md", "# project");
        write("node_modules/react/index.js", "module.exports = {};");
        write(".next/server/page.js", "module.exports = {};");
        write("dist/bundle.js", "");
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void listSourceFiles_ShouldReturnSortedSourcesOutsideExcludedDirectories() throws IOException {
        // Act
        List<SourcePath> files = repository.listSourceFiles(tempDir, List.of());

        // Assert
        assertEquals(List.of(
                SourcePath.of("app/page.tsx"),
                SourcePath.of("components/button.tsx"),
                SourcePath.of("lib/utils.ts")
        ), files);
    }

    @Test
    void listSourceFiles_ShouldHonourIgnorePatterns() throws IOException {
        List<SourcePath> files = repository.listSourceFiles(tempDir, List.of("lib/**", "**/button.tsx"));

        assertEquals(List.of(SourcePath.of("app/page.tsx")), files);
    }

    @Test
    void listSourceFiles_ShouldUseTheFileNameForASingleFileOutsideTheProject() throws IOException {
        Path single = tempDir.resolve("lib/utils.ts");

        List<SourcePath> files = repository.listSourceFiles(single, List.of());

        assertEquals(List.of(SourcePath.of("utils.ts")), files);
        assertEquals("export const noop = () => {};", repository.read(single, files.get(0)));
    }

    @Test
    void readIfExists_ShouldReturnEmptyForMissingFiles() throws IOException {
        write("package.json", "{\"dependencies\":{}}");

        assertTrue(repository.readIfExists(tempDir, "package.json").isPresent());
        assertEquals(Optional.empty(), repository.readIfExists(tempDir, "tsconfig.json"));
    }

    @Test
    void listSourceFiles_ShouldKeepProjectRelativePathOfASingleFileRoot() throws IOException {
        // Arrange
        GuardProperties properties = new GuardProperties();
        properties.setProjectRoot(tempDir.toString());
        FileSystemSourceRepository projectRepository = new FileSystemSourceRepository(properties);
        Path page = tempDir.resolve("app/page.tsx");

        // Act
        List<SourcePath> files = projectRepository.listSourceFiles(page, List.of());

        // Assert
        assertEquals(List.of(SourcePath.of("app/page.tsx")), files);
        assertEquals("export default function Page() { return null; }", projectRepository.read(page, files.get(0)));
    }
}
