// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

public class TestUtils {
    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static Clock fixedClock() {
        return Clock.fixed(START, ZoneOffset.UTC);
    }

    /** Loads a sample event from {@code src/test/resources/events}. */
    public static Map<String, Object> loadEvent(String name) {
        try (var stream = TestUtils.class.getResourceAsStream("/events/" + name + ".json")) {
            if (stream == null) {
                throw new IllegalArgumentException("No sample event named " + name);
            }
            return MAPPER.readValue(stream, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static AgentConfig.Builder testConfig() {
        return AgentConfig.builder().withClock(fixedClock()).withRegion("nr-test");
    }
}
