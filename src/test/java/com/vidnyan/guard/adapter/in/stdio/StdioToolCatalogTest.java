package com.vidnyan.guard.adapter.in.stdio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.guard.adapter.in.tool.ToolKind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Round trip of every registered tool through the stdio binding and the real catalog.
 */
@SpringBootTest
class StdioToolCatalogTest {

    private static final Path PROJECT = createProject();

    @Autowired
    private StdioTransport transport;

    @Autowired
    private ObjectMapper objectMapper;

    @DynamicPropertySource
    static void projectRoot(DynamicPropertyRegistry registry) {
        registry.add("guard.project-root", PROJECT::toString);
    }

    private static Path createProject() {
        try {
            Path root = Files.createTempDirectory("guard-stdio");
            Path utils = root.resolve("lib/utils.ts");
            Files.createDirectories(utils.getParent());
            Files.writeString(utils, "export const add = (a: number, b: number) => a + b;\n");
            return root;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ObjectNode params(ToolKind kind) {
        ObjectNode params = objectMapper.createObjectNode();
        switch (kind) {
            case VALIDATE_FILE -> params.put("filePath", "lib/utils.ts").put("content", "export const a = 1;\n");
            case CHECK_IMPORT_ALLOWED -> params.put("source", "app/page.tsx").put("target", "lib/utils");
            default -> params.put("path", ".");
        }
        return params;
    }

    @ParameterizedTest
    @EnumSource(ToolKind.class)
    void handleLine_ShouldEchoTheIdForEveryTool(ToolKind kind) throws Exception {
        // Arrange
        String id = "req-" + kind.ordinal();
        ObjectNode request = objectMapper.createObjectNode()
                .put("id", id)
                .put("type", "request")
                .put("name", kind.wireName());
        request.set("params", params(kind));

        // Act
        String line = transport.handleLine(objectMapper.writeValueAsString(request));

        // Assert
        assertFalse(line.contains("\n"));
        JsonNode response = objectMapper.readTree(line);
        assertEquals(id, response.get("id").asText());
        assertEquals(id, response.get("request_id").asText());
        assertEquals("response", response.get("type").asText());
        assertEquals(kind.wireName(), response.get("name").asText());
        JsonNode content = response.get("content");
        assertTrue(content.has("results"), () -> "not a tool result: " + content);
        assertTrue(content.get("success").asBoolean(), () -> "tool failed: " + content);
    }
}
