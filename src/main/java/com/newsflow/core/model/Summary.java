package com.newsflow.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * One newsletter item produced by the summarize step.
 */
public record Summary(
    String headline,
    String body,
    String category,
    List<String> sourceUrls,
    double credibilityScore
) implements Serializable {

    @SuppressWarnings("unchecked")
    public static Summary fromMap(Map<?, ?> map) {
        return new Summary(
                (String) map.get("headline"),
                (String) map.get("body"),
                (String) map.get("category"),
                map.get("sourceUrls") instanceof List<?> l ? (List<String>) l : List.of(),
                map.get("credibilityScore") instanceof Number n ? n.doubleValue() : 0.0);
    }
}
