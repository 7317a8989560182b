package com.microservices.elasticsearch.timeseries.query.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.microservices.elasticsearch.timeseries.query.model.BucketAgg;
import com.microservices.elasticsearch.timeseries.query.model.MetricAggTypes;
import com.microservices.elasticsearch.timeseries.query.model.Query;
import com.microservices.elasticsearch.timeseries.query.model.settings.DateHistogramSettings;
import com.microservices.elasticsearch.timeseries.query.model.settings.FiltersSettings;
import com.microservices.elasticsearch.timeseries.query.model.settings.GeoHashGridSettings;
import com.microservices.elasticsearch.timeseries.query.model.settings.HistogramSettings;
import com.microservices.elasticsearch.timeseries.query.model.settings.TermsSettings;
import com.microservices.elasticsearch.timeseries.query.util.SettingsValues;

/**
 * Coerces editor settings into the types the query DSL expects and migrates legacy shapes.
 * Every method returns new objects; the input is never modified, and applying a normalization
 * to its own output changes nothing.
 */
@Component
public class SettingsNormalizer {

    private static final List<List<String>> MOVING_AVG_FLOAT_PATHS = List.of(
            List.of("window"),
            List.of("predict"),
            List.of("settings", "alpha"),
            List.of("settings", "beta"),
            List.of("settings", "gamma"),
            List.of("settings", "period"));

    private static final List<List<String>> SERIAL_DIFF_FLOAT_PATHS = List.of(List.of("lag"));

    /**
     * Copy of the query with every bucket and metric settings document normalized
     */
    public Query normalize(Query query) {
        return query.toBuilder()
                .bucketAggs(query.getBucketAggs().stream()
                        .map(agg -> agg.toBuilder().settings(normalizeBucketSettings(agg.getSettings())).build())
                        .toList())
                .metrics(query.getMetrics().stream()
                        .map(metric -> metric.toBuilder()
                                .settings(normalizeMetricSettings(metric.getType(), metric.getSettings()))
                                .build())
                        .toList())
                .build();
    }

    public Map<String, Object> normalizeMetricSettings(String metricType, Map<String, Object> settings) {
        Map<String, Object> normalized = SettingsValues.object(settings);

        if (MetricAggTypes.MOVING_AVG.equals(metricType)) {
            MOVING_AVG_FLOAT_PATHS.forEach(path -> setFloatPath(normalized, path));
        } else if (MetricAggTypes.SERIAL_DIFF.equals(metricType)) {
            SERIAL_DIFF_FLOAT_PATHS.forEach(path -> setFloatPath(normalized, path));
        }

        if (MetricAggTypes.supportsInlineScript(metricType)) {
            Object script = normalized.get("script");
            if (script instanceof Map<?, ?> legacy && legacy.get("inline") instanceof String inline) {
                // legacy shape: {"script": {"inline": "..."}}
                normalized.put("script", inline);
            }
        }
        return normalized;
    }

    public Map<String, Object> normalizeBucketSettings(Map<String, Object> settings) {
        Map<String, Object> normalized = SettingsValues.object(settings);
        if (normalized.get("min_doc_count") instanceof String minDocCount && SettingsValues.isInteger(minDocCount)) {
            normalized.put("min_doc_count", Integer.parseInt(minDocCount));
        }
        return normalized;
    }

    public DateHistogramSettings dateHistogram(BucketAgg agg) {
        Map<String, Object> settings = normalizeBucketSettings(agg.getSettings());
        return DateHistogramSettings.builder()
                .interval(SettingsValues.string(settings, "interval", DateHistogramSettings.AUTO_INTERVAL))
                .minDocCount(SettingsValues.integer(settings, "min_doc_count", 0))
                .offset(SettingsValues.string(settings, "offset").orElse(null))
                .missing(SettingsValues.string(settings, "missing").orElse(null))
                .timeZone(SettingsValues.string(settings, "timeZone").orElse(null))
                .build();
    }

    public HistogramSettings histogram(BucketAgg agg) {
        Map<String, Object> settings = normalizeBucketSettings(agg.getSettings());
        return HistogramSettings.builder()
                .interval(SettingsValues.integer(settings, "interval", HistogramSettings.DEFAULT_INTERVAL))
                .minDocCount(SettingsValues.integer(settings, "min_doc_count", 0))
                .missing(SettingsValues.integer(settings, "missing").orElse(null))
                .build();
    }

    /**
     * Terms settings; a size that is absent, not numeric or zero falls back to 500
     */
    public TermsSettings terms(BucketAgg agg) {
        Map<String, Object> settings = normalizeBucketSettings(agg.getSettings());
        int size = SettingsValues.integer(settings, "size", TermsSettings.DEFAULT_SIZE);
        return TermsSettings.builder()
                .size(size == 0 ? TermsSettings.DEFAULT_SIZE : size)
                .minDocCount(SettingsValues.integer(settings, "min_doc_count").orElse(null))
                .missing(SettingsValues.string(settings, "missing").orElse(null))
                .orderBy(SettingsValues.string(settings, "orderBy").orElse(null))
                .order(SettingsValues.string(settings, "order", TermsSettings.DEFAULT_ORDER))
                .build();
    }

    public FiltersSettings filters(BucketAgg agg) {
        FiltersSettings.FiltersSettingsBuilder builder = FiltersSettings.builder();
        for (Object entry : SettingsValues.array(SettingsValues.object(agg.getSettings()).get("filters"))) {
            Map<String, Object> filter = SettingsValues.object(entry);
            builder.filter(new FiltersSettings.Filter(
                    SettingsValues.string(filter, "label", ""),
                    SettingsValues.string(filter, "query", "")));
        }
        return builder.build();
    }

    public GeoHashGridSettings geoHashGrid(BucketAgg agg) {
        return GeoHashGridSettings.builder()
                .precision(SettingsValues.integer(agg.getSettings(), "precision", GeoHashGridSettings.DEFAULT_PRECISION))
                .build();
    }

    @SuppressWarnings("unchecked")
    private static void setFloatPath(Map<String, Object> settings, List<String> path) {
        Map<String, Object> parent = settings;
        for (String segment : path.subList(0, path.size() - 1)) {
            if (!(parent.get(segment) instanceof Map<?, ?> child)) {
                return;
            }
            parent = (Map<String, Object>) child;
        }
        String leaf = path.get(path.size() - 1);
        if (parent.get(leaf) instanceof String value) {
            Optional<Double> number = SettingsValues.decimal(value);
            if (number.isPresent()) {
                parent.put(leaf, number.get());
            }
        }
    }
}
