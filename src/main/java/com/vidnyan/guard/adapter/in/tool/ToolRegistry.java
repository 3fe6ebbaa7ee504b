package com.vidnyan.guard.adapter.in.tool;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools available to both transports. The set of tools is fixed once built;
 * only the enabled flags can change afterwards.
 */
public final class ToolRegistry {
    
    private final Map<ToolKind, ToolDefinition> tools;
    private final Set<ToolKind> disabled;
    
    private ToolRegistry(Map<ToolKind, ToolDefinition> tools, Set<ToolKind> disabled) {
        this.tools = Collections.unmodifiableMap(new EnumMap<>(tools));
        this.disabled = ConcurrentHashMap.newKeySet();
        this.disabled.addAll(disabled);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Enabled tool registered under {@code name}.
     */
    public Optional<ToolDefinition> find(String name) {
        return ToolKind.fromName(name)
                .filter(this::isEnabled)
                .map(tools::get);
    }
    
    public boolean isEnabled(ToolKind kind) {
        return tools.containsKey(kind) && !disabled.contains(kind);
    }
    
    public void setEnabled(ToolKind kind, boolean enabled) {
        if (!tools.containsKey(kind)) {
            throw new IllegalArgumentException("Tool not registered: " + kind.wireName());
        }
        if (enabled) {
            disabled.remove(kind);
        } else {
            disabled.add(kind);
        }
    }
    
    /**
     * All registered tools, enabled or not, in {@link ToolKind} order.
     */
    public List<ToolDefinition> all() {
        return List.copyOf(tools.values());
    }
    
    public int size() {
        return tools.size();
    }
    
    /**
     * Builder that rejects duplicate registrations.
     */
    public static final class Builder {
        
        private final Map<ToolKind, ToolDefinition> tools = new EnumMap<>(ToolKind.class);
        private final Set<ToolKind> disabled = new HashSet<>();
        
        private Builder() {
        }
        
        public Builder register(ToolDefinition definition) {
            if (tools.containsKey(definition.kind())) {
                throw new DuplicateToolException(definition.name());
            }
            tools.put(definition.kind(), definition);
            return this;
        }
        
        public Builder disable(ToolKind kind) {
            disabled.add(kind);
            return this;
        }
        
        public ToolRegistry build() {
            return new ToolRegistry(tools, disabled);
        }
    }
}
