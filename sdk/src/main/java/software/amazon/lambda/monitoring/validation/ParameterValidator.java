// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.validation;

import java.time.Duration;

/**
 * Utility class for validating configuration parameters of the monitoring SDK.
 *
 * <p>Provides common validation methods to ensure consistent error messages across the configuration builders.
 */
public final class ParameterValidator {

    private ParameterValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates that a duration is strictly positive.
     *
     * @param duration the duration to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if duration is null, zero or negative
     */
    public static void validatePositiveDuration(Duration duration, String parameterName) {
        if (duration == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + duration);
        }
    }

    /**
     * Validates that an integer value is positive (greater than 0).
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or not positive
     */
    public static void validatePositiveInteger(Integer value, String parameterName) {
        if (value == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (value <= 0) {
            throw new IllegalArgumentException(parameterName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a string is neither null nor blank.
     *
     * @param value the value to validate
     * @param parameterName the name of the parameter (for error messages)
     * @throws IllegalArgumentException if value is null or blank
     */
    public static void validateNotBlank(String value, String parameterName) {
        if (value == null) {
            throw new IllegalArgumentException(parameterName + " cannot be null");
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException(parameterName + " cannot be blank");
        }
    }
}
