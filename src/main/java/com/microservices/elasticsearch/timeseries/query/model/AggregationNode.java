package com.microservices.elasticsearch.timeseries.query.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scope of an aggregation tree. The root scope has no type and only holds the top-level
 * aggregations; every other node renders as {@code {"<type>": body, "aggs": {...}}}.
 * Adding a child returns the child, so callers thread the current nesting level explicitly.
 */
public final class AggregationNode {

    private final String key;
    private final String type;
    private final Map<String, Object> body;
    private final Map<String, AggregationNode> children = new LinkedHashMap<>();

    private AggregationNode(String key, String type, Map<String, Object> body) {
        this.key = key;
        this.type = type;
        this.body = body;
    }

    public static AggregationNode root() {
        return new AggregationNode(null, null, Map.of());
    }

    /**
     * Add (or replace) the child aggregation stored under {@code key} and return it
     */
    public AggregationNode addChild(String key, String type, Map<String, Object> body) {
        AggregationNode child = new AggregationNode(key, type, new LinkedHashMap<>(body));
        children.put(key, child);
        return child;
    }

    public boolean isRoot() {
        return type == null;
    }

    public String getKey() {
        return key;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getBody() {
        return Collections.unmodifiableMap(body);
    }

    public Map<String, AggregationNode> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public AggregationNode getChild(String key) {
        return children.get(key);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Render the children of this scope as an {@code aggs} object
     */
    public Map<String, Object> toAggs() {
        Map<String, Object> aggs = new LinkedHashMap<>();
        children.forEach((childKey, child) -> aggs.put(childKey, child.toDsl()));
        return aggs;
    }

    /**
     * Render this node as query DSL
     */
    public Map<String, Object> toDsl() {
        if (isRoot()) {
            return toAggs();
        }
        Map<String, Object> dsl = new LinkedHashMap<>();
        dsl.put(type, new LinkedHashMap<>(body));
        if (hasChildren()) {
            dsl.put("aggs", toAggs());
        }
        return dsl;
    }

    @Override
    public String toString() {
        return "AggregationNode{key='" + key + "', type='" + type + "', children=" + children.keySet() + '}';
    }
}
