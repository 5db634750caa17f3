package org.helena.ast.parser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generator configuration options.
 *
 * @param maxLeafing how many times each kind may appear as an independent top-level production; 0 means the kind
 *                   needs the context of another production to be valid. Kinds left out are unlimited.
 */
public record GeneratorConfig(Map<TopLevelKind, Integer> maxLeafing) {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    public static final GeneratorConfig DEFAULT = new GeneratorConfig(Map.of());

    public GeneratorConfig {
        Objects.requireNonNull(maxLeafing, "maxLeafing");
        var limits = new EnumMap<TopLevelKind, Integer>(TopLevelKind.class);
        for (var kind : TopLevelKind.values()) {
            int limit = maxLeafing.getOrDefault(kind, UNLIMITED);
            if (limit < 0) {
                throw new IllegalArgumentException("Max leafing of " + kind.displayName() + " cannot be negative: " + limit);
            }
            limits.put(kind, limit);
        }
        maxLeafing = Collections.unmodifiableMap(limits);
    }

    public int maxLeafing(TopLevelKind kind) {
        return maxLeafing.get(kind);
    }

    public GeneratorConfig withMaxLeafing(TopLevelKind kind, int limit) {
        var limits = new EnumMap<>(maxLeafing);
        limits.put(kind, limit);
        return new GeneratorConfig(limits);
    }
}
