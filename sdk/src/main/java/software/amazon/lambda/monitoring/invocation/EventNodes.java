// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.invocation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.datatype.joda.JodaModule;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import software.amazon.lambda.monitoring.protocol.ProtocolMapper;

/**
 * Read-only navigation over events and responses of any Java type.
 *
 * <p>Values are converted to a Jackson tree. Field lookup ignores case, so a JSON map with {@code Records} and an
 * {@code aws-lambda-java-events} object serialized with {@code records} are read alike. Lookups never fail: a field
 * that is absent, or a step through a non-object, yields a missing node. Joda date fields, as used by the SNS, S3
 * and DynamoDB event classes, are converted as ISO strings.
 */
final class EventNodes {
    private static final ObjectMapper MAPPER = ProtocolMapper.createObjectMapper().registerModule(new JodaModule());

    private EventNodes() {}

    /**
     * Converts a value to a tree; null becomes a missing node.
     *
     * @throws IllegalArgumentException if the value cannot be converted
     */
    static JsonNode toTree(Object value) {
        if (value == null) {
            return MissingNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        return MAPPER.valueToTree(value);
    }

    /** Returns the named field of an object node, matched exactly first and then ignoring case. */
    static JsonNode field(JsonNode node, String name) {
        if (node == null || !node.isObject()) {
            return MissingNode.getInstance();
        }
        var exact = node.get(name);
        if (exact != null) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return MissingNode.getInstance();
    }

    /** Follows a path of field names. */
    static JsonNode path(JsonNode node, String... names) {
        var current = node;
        for (var name : names) {
            current = field(current, name);
        }
        return current;
    }

    /** Returns the first element of an array node. */
    static JsonNode first(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return MissingNode.getInstance();
        }
        return node.get(0);
    }

    /** Returns whether a node holds a value, i.e. is neither missing nor JSON null. */
    static boolean isPresent(JsonNode node) {
        return node != null && !node.isMissingNode() && !node.isNull();
    }

    /** Returns the text of a scalar node. */
    static Optional<String> text(JsonNode node) {
        if (!isPresent(node) || node.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }
}
