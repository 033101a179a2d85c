package com.materialport.converter.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node of a parsed Unity YAML document. Tags and anchors are not kept.
 */
public abstract class YamlNode {

    public Optional<YamlNode> get(String key) {
        return Optional.empty();
    }

    public Optional<String> text(String key) {
        return get(key).flatMap(YamlNode::asText);
    }

    public Optional<String> asText() {
        return Optional.empty();
    }

    public List<YamlNode> items() {
        return List.of();
    }

    public Map<String, YamlNode> entries() {
        return Map.of();
    }

    public static final class Scalar extends YamlNode {
        private final String value;

        public Scalar(String value) {
            this.value = value;
        }

        @Override
        public Optional<String> asText() {
            return Optional.of(value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * Key order is first appearance; a repeated key keeps its last value.
     */
    public static final class Mapping extends YamlNode {
        private final Map<String, YamlNode> entries = new LinkedHashMap<>();

        public void put(String key, YamlNode value) {
            entries.put(key, value);
        }

        @Override
        public Optional<YamlNode> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        @Override
        public Map<String, YamlNode> entries() {
            return Collections.unmodifiableMap(entries);
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }

    public static final class Sequence extends YamlNode {
        private final List<YamlNode> items;

        public Sequence(List<YamlNode> items) {
            this.items = List.copyOf(items);
        }

        @Override
        public List<YamlNode> items() {
            return items;
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }
}
