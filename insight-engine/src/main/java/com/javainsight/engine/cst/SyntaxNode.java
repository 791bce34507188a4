package com.javainsight.engine.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named interior node of a concrete syntax tree.
 *
 * Children are grouped by slot name; slots keep insertion order and each slot keeps its
 * elements in the order they were added. Instances are immutable once built.
 */
public final class SyntaxNode implements SyntaxElement {

    private final String name;
    private final Map<String, List<SyntaxElement>> children;

    public SyntaxNode(String name, Map<String, List<SyntaxElement>> children) {
        this.name = name;
        Map<String, List<SyntaxElement>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<SyntaxElement>> slot : children.entrySet()) {
            copy.put(slot.getKey(), Collections.unmodifiableList(new ArrayList<>(slot.getValue())));
        }
        this.children = Collections.unmodifiableMap(copy);
    }

    public String name() { return name; }

    public Map<String, List<SyntaxElement>> children() { return children; }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return "SyntaxNode[" + name + ", slots=" + children.keySet() + "]";
    }

    /**
     * Collects children slot by slot. Adding an element to an existing slot appends to it.
     */
    public static final class Builder {
        private final String name;
        private final Map<String, List<SyntaxElement>> children = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder add(String slot, SyntaxElement element) {
            children.computeIfAbsent(slot, k -> new ArrayList<>()).add(element);
            return this;
        }

        public Builder add(SyntaxNode child) {
            return add(child.name(), child);
        }

        public SyntaxNode build() {
            return new SyntaxNode(name, children);
        }
    }
}
