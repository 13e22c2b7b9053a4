// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.errors;

import java.util.Objects;

/**
 * An error-shaped value that is not a {@link Throwable}, for instrumentation that receives failures from outside the
 * JVM (for example an error object decoded from a response payload).
 *
 * @param className the error class name
 * @param message the error message
 * @param stack the printed stack, or null
 */
public record CapturedError(String className, String message, String stack) {
    public CapturedError {
        Objects.requireNonNull(className, "className cannot be null");
    }
}
