// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.errors;

import java.util.Objects;
import java.util.Set;
import software.amazon.lambda.monitoring.validation.ParameterValidator;

/**
 * Error capture policy.
 *
 * @param enabled whether errors are captured at all
 * @param maxErrors how many errors are retained between two harvests; later errors are dropped
 * @param ignoreClasses error classes that are never captured, by simple or qualified name
 * @param expectedClasses error classes captured with {@code error.expected = true}
 * @param ignoreStatusCodes server error status codes that never produce an error; codes below 500 never do anyway
 * @param expectedStatusCodes HTTP status codes whose errors are marked expected
 */
public record ErrorCollectorConfig(
        boolean enabled,
        int maxErrors,
        Set<String> ignoreClasses,
        Set<String> expectedClasses,
        Set<Integer> ignoreStatusCodes,
        Set<Integer> expectedStatusCodes) {

    public static final int DEFAULT_MAX_ERRORS = 20;

    public ErrorCollectorConfig {
        ParameterValidator.validatePositiveInteger(maxErrors, "maxErrors");
        ignoreClasses = Set.copyOf(Objects.requireNonNull(ignoreClasses, "ignoreClasses cannot be null"));
        expectedClasses = Set.copyOf(Objects.requireNonNull(expectedClasses, "expectedClasses cannot be null"));
        ignoreStatusCodes = Set.copyOf(Objects.requireNonNull(ignoreStatusCodes, "ignoreStatusCodes cannot be null"));
        expectedStatusCodes =
                Set.copyOf(Objects.requireNonNull(expectedStatusCodes, "expectedStatusCodes cannot be null"));
    }

    /** Default policy: enabled, 20 errors per harvest, every 5xx response captured. */
    public static ErrorCollectorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .maxErrors(maxErrors)
                .ignoreClasses(ignoreClasses)
                .expectedClasses(expectedClasses)
                .ignoreStatusCodes(ignoreStatusCodes)
                .expectedStatusCodes(expectedStatusCodes);
    }

    public static final class Builder {
        private boolean enabled = true;
        private int maxErrors = DEFAULT_MAX_ERRORS;
        private Set<String> ignoreClasses = Set.of();
        private Set<String> expectedClasses = Set.of();
        private Set<Integer> ignoreStatusCodes = Set.of();
        private Set<Integer> expectedStatusCodes = Set.of();

        private Builder() {}

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder maxErrors(int maxErrors) {
            this.maxErrors = maxErrors;
            return this;
        }

        public Builder ignoreClasses(Set<String> ignoreClasses) {
            this.ignoreClasses = ignoreClasses;
            return this;
        }

        public Builder expectedClasses(Set<String> expectedClasses) {
            this.expectedClasses = expectedClasses;
            return this;
        }

        public Builder ignoreStatusCodes(Set<Integer> ignoreStatusCodes) {
            this.ignoreStatusCodes = ignoreStatusCodes;
            return this;
        }

        public Builder expectedStatusCodes(Set<Integer> expectedStatusCodes) {
            this.expectedStatusCodes = expectedStatusCodes;
            return this;
        }

        public ErrorCollectorConfig build() {
            return new ErrorCollectorConfig(
                    enabled, maxErrors, ignoreClasses, expectedClasses, ignoreStatusCodes, expectedStatusCodes);
        }
    }
}
