// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.attributes;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Attribute collection policy.
 *
 * <p>The default exclude rules are always applied in addition to the configured ones; they keep credentials and
 * proxy headers out of every destination.
 *
 * @param enabled whether attributes are collected at all
 * @param include include patterns (exact, or prefix when ending with {@code *})
 * @param exclude exclude patterns (exact, or prefix when ending with {@code *})
 * @param destinations the destinations attributes are reported to
 */
public record AttributeConfig(
        boolean enabled, List<String> include, List<String> exclude, Set<AttributeDestination> destinations) {

    public static final List<String> DEFAULT_EXCLUDES = List.of(
            "request.headers.cookie",
            "request.headers.authorization",
            "request.headers.proxyAuthorization",
            "request.headers.setCookie*",
            "request.headers.x*",
            "response.headers.cookie",
            "response.headers.authorization",
            "response.headers.proxyAuthorization",
            "response.headers.setCookie*",
            "response.headers.x*");

    public AttributeConfig {
        include = List.copyOf(Objects.requireNonNull(include, "include cannot be null"));
        exclude = List.copyOf(Objects.requireNonNull(exclude, "exclude cannot be null"));
        destinations = Set.copyOf(Objects.requireNonNull(destinations, "destinations cannot be null"));
    }

    /** Default policy: enabled for every destination, no include rules, only the default exclude rules. */
    public static AttributeConfig defaults() {
        return builder().build();
    }

    /** Policy that collects nothing. */
    public static AttributeConfig disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .include(include)
                .exclude(exclude)
                .destinations(destinations);
    }

    /** Returns the effective exclude rules: the defaults followed by the configured ones. */
    public List<String> effectiveExcludes() {
        var rules = new ArrayList<String>(DEFAULT_EXCLUDES);
        rules.addAll(exclude);
        return rules;
    }

    public static final class Builder {
        private boolean enabled = true;
        private List<String> include = List.of();
        private List<String> exclude = List.of();
        private Set<AttributeDestination> destinations = EnumSet.allOf(AttributeDestination.class);

        private Builder() {}

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder include(List<String> include) {
            this.include = Objects.requireNonNull(include, "include cannot be null");
            return this;
        }

        public Builder exclude(List<String> exclude) {
            this.exclude = Objects.requireNonNull(exclude, "exclude cannot be null");
            return this;
        }

        public Builder destinations(Set<AttributeDestination> destinations) {
            this.destinations = Objects.requireNonNull(destinations, "destinations cannot be null");
            return this;
        }

        public AttributeConfig build() {
            return new AttributeConfig(enabled, include, exclude, destinations);
        }
    }
}
