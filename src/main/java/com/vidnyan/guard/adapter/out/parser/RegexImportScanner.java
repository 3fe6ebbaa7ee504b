package com.vidnyan.guard.adapter.out.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.guard.application.port.out.ImportScanner;
import com.vidnyan.guard.domain.graph.ImportEdge;
import com.vidnyan.guard.domain.model.SourcePath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link ImportScanner} backed by {@link ImportExtractor} and {@link ModuleResolver}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegexImportScanner implements ImportScanner {
    
    private static final List<String> MANIFEST_SECTIONS = List.of(
            "dependencies", "devDependencies", "peerDependencies", "optionalDependencies");
    
    private final ObjectMapper objectMapper;
    
    @Override
    public List<ImportEdge> scan(SourcePath file, String content) {
        String source = moduleOf(file);
        List<ImportEdge> edges = new ArrayList<>();
        for (String specifier : ImportExtractor.extract(content)) {
            ModuleResolver.ModuleRef ref = ModuleResolver.resolve(file, specifier);
            if (!ref.path().isEmpty()) {
                edges.add(new ImportEdge(source, ref.path(), specifier, ref.external()));
            }
        }
        log.debug("{}: {} imports", file, edges.size());
        return edges;
    }
    
    @Override
    public String moduleOf(SourcePath file) {
        return ModuleResolver.moduleOf(file);
    }
    
    @Override
    public List<String> resolveTargets(SourcePath importer, String target) {
        if (ModuleResolver.isProjectSpecifier(target) || target.startsWith("node:")) {
            return List.of(ModuleResolver.resolve(importer, target).path());
        }
        String asWritten = ModuleResolver.stripModuleSuffix(SourcePath.normalize(target));
        String packageRoot = ModuleResolver.packageRoot(asWritten);
        return packageRoot.equals(asWritten) ? List.of(asWritten) : List.of(asWritten, packageRoot);
    }
    
    @Override
    public List<String> declaredDependencies(String manifest) {
        JsonNode root;
        try {
            root = objectMapper.readTree(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("package.json is not valid JSON: " + e.getOriginalMessage(), e);
        }
        Set<String> names = new LinkedHashSet<>();
        for (String section : MANIFEST_SECTIONS) {
            JsonNode deps = root.path(section);
            Iterator<String> fields = deps.fieldNames();
            while (fields.hasNext()) {
                names.add(fields.next());
            }
        }
        return List.copyOf(names);
    }
}
