package com.microservices.elasticsearch.timeseries.query.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.microservices.elasticsearch.timeseries.query.interval.Interval;
import com.microservices.elasticsearch.timeseries.query.model.AggregationNode;

/**
 * Builds the body of one search: size, sort, bool filter query and the aggregation tree
 */
public class SearchRequestBuilder {

    public static final String HIGHLIGHT_PRE_TAG = "@HIGHLIGHT@";
    public static final String HIGHLIGHT_POST_TAG = "@/HIGHLIGHT@";

    private final Interval interval;
    private final AggregationNode aggregations = AggregationNode.root();
    private final List<Map<String, Object>> sort = new ArrayList<>();
    private final List<Map<String, Object>> filters = new ArrayList<>();
    private final Map<String, Object> customProps = new LinkedHashMap<>();
    private int size;

    public SearchRequestBuilder(Interval interval) {
        this.interval = interval;
    }

    public Interval getInterval() {
        return interval;
    }

    public SearchRequestBuilder size(int size) {
        this.size = size;
        return this;
    }

    public SearchRequestBuilder sortDesc(String field, String unmappedType) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("order", "desc");
        if (unmappedType != null && !unmappedType.isEmpty()) {
            props.put("unmapped_type", unmappedType);
        }
        sort.add(Map.of(field, props));
        return this;
    }

    public SearchRequestBuilder addDocValueField(String field) {
        customProps.put("docvalue_fields", List.of(field));
        customProps.put("script_fields", Map.of());
        return this;
    }

    public SearchRequestBuilder addHighlight() {
        Map<String, Object> highlight = new LinkedHashMap<>();
        highlight.put("fields", Map.of("*", Map.of()));
        highlight.put("pre_tags", List.of(HIGHLIGHT_PRE_TAG));
        highlight.put("post_tags", List.of(HIGHLIGHT_POST_TAG));
        highlight.put("fragment_size", Integer.MAX_VALUE);
        customProps.put("highlight", highlight);
        return this;
    }

    /**
     * Inclusive range filter on {@code field}
     */
    public SearchRequestBuilder addDateRangeFilter(String field, long from, long to, String format) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("gte", from);
        range.put("lte", to);
        range.put("format", format);
        filters.add(Map.of("range", Map.of(field, range)));
        return this;
    }

    /**
     * Query string filter; blank queries add nothing
     */
    public SearchRequestBuilder addQueryStringFilter(String query, boolean analyzeWildcard) {
        if (query == null || query.isBlank()) {
            return this;
        }
        Map<String, Object> queryString = new LinkedHashMap<>();
        queryString.put("query", query);
        queryString.put("analyze_wildcard", analyzeWildcard);
        filters.add(Map.of("query_string", queryString));
        return this;
    }

    /**
     * Root scope of the aggregation tree of this search
     */
    public AggregationNode aggregations() {
        return aggregations;
    }

    public Map<String, Object> build() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", size);
        if (!sort.isEmpty()) {
            body.put("sort", new ArrayList<>(sort));
        }
        body.putAll(customProps);
        body.put("query", Map.of("bool", Map.of("filter", new ArrayList<>(filters))));
        if (aggregations.hasChildren()) {
            body.put("aggs", aggregations.toAggs());
        }
        return body;
    }
}
