// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.errors;

import java.util.List;
import java.util.Set;
import software.amazon.lambda.monitoring.util.ExceptionHelper;

/**
 * Class name, message and stack of a value a handler failed with.
 *
 * <ul>
 *   <li>a {@link Throwable} yields its simple class name, its message and its printed stack trace
 *   <li>a {@link CapturedError} yields its own fields
 *   <li>any other value yields the class name {@value #GENERIC_CLASS_NAME}, its string form as message and a stack
 *       synthesized at the capture site
 * </ul>
 */
record ErrorDetails(String className, String message, List<String> stackTrace) {
    static final String GENERIC_CLASS_NAME = "Error";

    static ErrorDetails of(Object error) {
        if (error instanceof Throwable throwable) {
            var unwrapped = ExceptionHelper.unwrap(throwable);
            return new ErrorDetails(
                    unwrapped.getClass().getSimpleName(),
                    unwrapped.getMessage() != null ? unwrapped.getMessage() : "",
                    ExceptionHelper.stackLines(unwrapped));
        }
        if (error instanceof CapturedError captured) {
            return new ErrorDetails(
                    captured.className(),
                    captured.message() != null ? captured.message() : "",
                    ExceptionHelper.stackLines(captured.stack()));
        }
        var message = String.valueOf(error);
        return new ErrorDetails(
                GENERIC_CLASS_NAME, message, ExceptionHelper.synthesizedStackLines(GENERIC_CLASS_NAME, message));
    }

    /** Details of an error derived from an HTTP status code; such errors carry no stack. */
    static ErrorDetails ofStatusCode(int statusCode) {
        return new ErrorDetails(GENERIC_CLASS_NAME, "HttpError " + statusCode, null);
    }

    /** Returns whether a class name matches an entry of a configured class list, by simple or qualified name. */
    static boolean matchesClass(Object error, String className, Set<String> configured) {
        if (configured.contains(className)) {
            return true;
        }
        return error instanceof Throwable throwable
                && configured.contains(ExceptionHelper.unwrap(throwable).getClass().getName());
    }
}
