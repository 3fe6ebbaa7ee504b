package com.vidnyan.guard.adapter.in.tool;

import com.vidnyan.guard.domain.model.DependencyCheckResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    static ToolDefinition definition(ToolKind kind) {
        return new ToolDefinition(kind, kind.description(), Map.of("type", "object"), kind.requiredParams(),
                args -> DependencyCheckResult.decided(true, kind.wireName()));
    }

    @Test
    void register_ShouldRejectDuplicateTools() {
        ToolRegistry.Builder builder = ToolRegistry.builder()
                .register(definition(ToolKind.ARCHITECTURE_CHECK));

        DuplicateToolException e = assertThrows(DuplicateToolException.class,
                () -> builder.register(definition(ToolKind.ARCHITECTURE_CHECK)));
        assertTrue(e.getMessage().contains("architecture_check"));
    }

    @Test
    void find_ShouldReturnOnlyEnabledTools() {
        // Arrange
        ToolRegistry registry = ToolRegistry.builder()
                .register(definition(ToolKind.ARCHITECTURE_CHECK))
                .register(definition(ToolKind.CHECK_IMPORT_ALLOWED))
                .disable(ToolKind.CHECK_IMPORT_ALLOWED)
                .build();

        // Act & Assert
        assertTrue(registry.find("architecture_check").isPresent());
        assertTrue(registry.find("check_import_allowed").isEmpty());
        assertTrue(registry.find("dependency_check").isEmpty());
        assertTrue(registry.find("nope").isEmpty());
        assertEquals(2, registry.size());
    }

    @Test
    void setEnabled_ShouldToggleRegisteredTools() {
        ToolRegistry registry = ToolRegistry.builder()
                .register(definition(ToolKind.VALIDATE_FILE))
                .build();

        registry.setEnabled(ToolKind.VALIDATE_FILE, false);
        assertFalse(registry.isEnabled(ToolKind.VALIDATE_FILE));
        assertTrue(registry.find("validate_file").isEmpty());

        registry.setEnabled(ToolKind.VALIDATE_FILE, true);
        assertTrue(registry.find("validate_file").isPresent());

        assertThrows(IllegalArgumentException.class,
                () -> registry.setEnabled(ToolKind.DEPENDENCY_CHECK, true));
    }

    @Test
    void all_ShouldListToolsInDeclarationOrder() {
        ToolRegistry registry = ToolRegistry.builder()
                .register(definition(ToolKind.CHECK_IMPORT_ALLOWED))
                .register(definition(ToolKind.ARCHITECTURE_CHECK))
                .disable(ToolKind.ARCHITECTURE_CHECK)
                .build();

        List<String> names = registry.all().stream().map(ToolDefinition::name).toList();

        assertEquals(List.of("architecture_check", "check_import_allowed"), names);
    }
}
