package com.game.metadata.provider.wikidata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * SPARQL 1.1 JSON results, reduced to the parts the adapter reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record SparqlResults(Results results) {

    List<Map<String, Binding>> bindings() {
        return results == null || results.bindings() == null ? List.of() : results.bindings();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Results(List<Map<String, Binding>> bindings) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Binding(String type, String value) {}

    static String value(Map<String, Binding> row, String variable) {
        Binding binding = row.get(variable);
        return binding == null || binding.value() == null || binding.value().isBlank() ? null : binding.value();
    }
}
