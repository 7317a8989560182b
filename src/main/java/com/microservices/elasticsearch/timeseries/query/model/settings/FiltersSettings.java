package com.microservices.elasticsearch.timeseries.query.model.settings;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class FiltersSettings {
    @Singular
    List<Filter> filters;

    @Value
    public static class Filter {
        String label;
        String query;

        /**
         * Label used as bucket key, falling back to the query text
         */
        public String effectiveLabel() {
            return label == null || label.isEmpty() ? query : label;
        }
    }
}
