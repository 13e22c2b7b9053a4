// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.attributes;

/** Canonical form of HTTP header names used in attribute keys. */
public final class HeaderNames {

    private HeaderNames() {}

    /**
     * Converts a header name to lowerCamel form: dash separated segments are joined, the first character of the first
     * segment is lower-cased and the first character of every later segment is upper-cased. {@code X-Forwarded-For},
     * {@code xForwardedFor} and {@code XForwardedFor} all become {@code xForwardedFor}.
     *
     * @param headerName the header name as received
     * @return the canonical name
     */
    public static String toCamelCase(String headerName) {
        var builder = new StringBuilder(headerName.length());
        for (String segment : headerName.split("-")) {
            if (segment.isEmpty()) {
                continue;
            }
            char first = segment.charAt(0);
            builder.append(builder.length() == 0 ? Character.toLowerCase(first) : Character.toUpperCase(first));
            builder.append(segment, 1, segment.length());
        }
        return builder.toString();
    }
}
