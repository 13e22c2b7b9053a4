// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.attributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies an {@link AttributeConfig} to attribute keys and projects candidate attributes onto the three
 * {@link AttributeDestination}s.
 *
 * <p>For every key the default membership from {@link AttributeCatalog} is the baseline. Include and exclude rules
 * are then matched against the normalized key; when several rules match, the most specific one decides (an exact rule
 * beats a wildcard rule with the same prefix, a longer prefix beats a shorter one, and exclude beats include on a
 * tie). An include rule makes the key visible in every destination, an exclude rule removes it from all of them.
 *
 * <p>Instances are immutable. Decisions are cached per normalized key, up to {@value #MAX_CACHED_DECISIONS} keys;
 * header and parameter names come from requests, so keys beyond that are decided on every lookup.
 */
public class AttributeFilter {
    static final int MAX_CACHED_DECISIONS = 1_000;

    private final AttributeConfig config;
    private final List<Rule> rules;
    private final Map<String, Set<AttributeDestination>> decisions = new ConcurrentHashMap<>();

    public AttributeFilter(AttributeConfig config) {
        this.config = config;
        var compiled = new ArrayList<Rule>();
        config.include().forEach(pattern -> compiled.add(Rule.of(pattern, true)));
        config.effectiveExcludes().forEach(pattern -> compiled.add(Rule.of(pattern, false)));
        this.rules = List.copyOf(compiled);
    }

    public AttributeConfig getConfig() {
        return config;
    }

    /**
     * Normalizes an attribute key. Header derived keys get their header name converted with
     * {@link HeaderNames#toCamelCase(String)}; other keys are returned unchanged.
     */
    public static String normalize(String key) {
        if (key.startsWith(AttributeKeys.REQUEST_HEADERS_PREFIX)) {
            return AttributeKeys.REQUEST_HEADERS_PREFIX
                    + HeaderNames.toCamelCase(key.substring(AttributeKeys.REQUEST_HEADERS_PREFIX.length()));
        }
        if (key.startsWith(AttributeKeys.RESPONSE_HEADERS_PREFIX)) {
            return AttributeKeys.RESPONSE_HEADERS_PREFIX
                    + HeaderNames.toCamelCase(key.substring(AttributeKeys.RESPONSE_HEADERS_PREFIX.length()));
        }
        return key;
    }

    /**
     * Returns the destinations a key is visible in.
     *
     * @param key the attribute key, normalized or not
     * @return an unmodifiable set, empty when attributes are disabled
     */
    public Set<AttributeDestination> destinationsFor(String key) {
        if (!config.enabled()) {
            return Set.of();
        }
        var normalized = normalize(key);
        var cached = decisions.get(normalized);
        if (cached != null) {
            return cached;
        }
        if (decisions.size() >= MAX_CACHED_DECISIONS) {
            return decide(normalized);
        }
        return decisions.computeIfAbsent(normalized, this::decide);
    }

    int cachedDecisionCount() {
        return decisions.size();
    }

    public boolean isVisible(String key, AttributeDestination destination) {
        return destinationsFor(key).contains(destination);
    }

    /**
     * Projects candidate attributes onto every destination.
     *
     * @param candidates the flat candidate attributes, in insertion order
     * @return one insertion-ordered map per destination; all empty when attributes are disabled
     */
    public Map<AttributeDestination, Map<String, Object>> project(Map<String, Object> candidates) {
        var projection = new EnumMap<AttributeDestination, Map<String, Object>>(AttributeDestination.class);
        for (AttributeDestination destination : AttributeDestination.values()) {
            projection.put(destination, new LinkedHashMap<>());
        }
        if (!config.enabled()) {
            return projection;
        }
        candidates.forEach((key, value) -> {
            var normalized = normalize(key);
            for (AttributeDestination destination : destinationsFor(normalized)) {
                projection.get(destination).put(normalized, value);
            }
        });
        return projection;
    }

    /** Projects candidate attributes onto a single destination. */
    public Map<String, Object> project(Map<String, Object> candidates, AttributeDestination destination) {
        return project(candidates).get(destination);
    }

    private Set<AttributeDestination> decide(String key) {
        Set<AttributeDestination> destinations = AttributeCatalog.defaultDestinations(key);
        Rule winner = null;
        for (Rule rule : rules) {
            if (rule.matches(key) && (winner == null || rule.outranks(winner))) {
                winner = rule;
            }
        }
        if (winner != null) {
            destinations = winner.include()
                    ? EnumSet.allOf(AttributeDestination.class)
                    : EnumSet.noneOf(AttributeDestination.class);
        }
        destinations.retainAll(config.destinations());
        return Collections.unmodifiableSet(destinations);
    }

    private record Rule(String prefix, boolean wildcard, boolean include) {
        static Rule of(String pattern, boolean include) {
            var wildcard = pattern.endsWith("*");
            var prefix = wildcard ? pattern.substring(0, pattern.length() - 1) : pattern;
            return new Rule(prefix, wildcard, include);
        }

        boolean matches(String key) {
            return wildcard ? key.startsWith(prefix) : key.equals(prefix);
        }

        int specificity() {
            return prefix.length() * 2 + (wildcard ? 0 : 1);
        }

        boolean outranks(Rule other) {
            if (specificity() != other.specificity()) {
                return specificity() > other.specificity();
            }
            return !include && other.include;
        }
    }
}
