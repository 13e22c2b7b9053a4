// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import software.amazon.lambda.monitoring.exception.SerializationException;

/**
 * Shared Jackson configuration of the collector payloads.
 *
 * <p>Payloads are built from lists and insertion-ordered maps; map entries are written in insertion order so the
 * output is byte-stable.
 */
public final class ProtocolMapper {
    private static final ObjectMapper MAPPER = createObjectMapper();

    private ProtocolMapper() {}

    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .addModule(new JavaTimeModule())
                .build();
    }

    /** Writes a payload tree as compact JSON. */
    static String write(Object payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (Exception e) {
            throw new SerializationException(
                    "Serialization failed for payload of type: " + payload.getClass().getName(), e);
        }
    }
}
