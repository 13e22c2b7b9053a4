// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Utility class for handling exceptions and their printed stacks. */
public final class ExceptionHelper {

    private ExceptionHelper() {}

    /**
     * unwrap the exception that is wrapped by CompletionException or ExecutionException
     *
     * @param throwable the throwable to unwrap
     * @return the original Throwable
     */
    public static Throwable unwrap(Throwable throwable) {
        while ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
                && throwable.getCause() != null) {
            throwable = throwable.getCause();
        }
        return throwable;
    }

    /**
     * Splits a printed stack into one entry per line, dropping empty lines.
     *
     * @param stack the stack text, may be null
     * @return the lines, or null when there is no stack text
     */
    public static List<String> stackLines(String stack) {
        if (stack == null || stack.isEmpty()) {
            return null;
        }
        return Arrays.stream(stack.split("\\r?\\n")).filter(line -> !line.isBlank()).toList();
    }

    /** Returns the printed stack trace of a throwable, one entry per line. */
    public static List<String> stackLines(Throwable throwable) {
        var writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return stackLines(writer.toString());
    }

    /**
     * Builds the stack of a synthesized error: a header line followed by the frames of the current thread, skipping
     * the frames that belong to the SDK itself.
     */
    public static List<String> synthesizedStackLines(String className, String message) {
        var builder = new StringBuilder(className).append(": ").append(message);
        for (StackTraceElement element : new Throwable().getStackTrace()) {
            if (element.getClassName().startsWith("software.amazon.lambda.monitoring.util.")) {
                continue;
            }
            builder.append('\n').append("\tat ").append(element);
        }
        return stackLines(builder.toString());
    }
}
