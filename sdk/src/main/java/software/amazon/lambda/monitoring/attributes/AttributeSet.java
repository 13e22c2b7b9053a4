// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.attributes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Candidate attributes of a transaction and their per-destination projection.
 *
 * <p>While the set is open, {@link #get(AttributeDestination)} projects through the filter that is current at the time
 * of the call. {@link #freeze()} computes the projection once; later writes are ignored and later policy changes do not
 * affect it.
 */
public class AttributeSet {
    private static final Logger logger = LoggerFactory.getLogger(AttributeSet.class);

    /** Maximum length of a string attribute value. */
    public static final int MAX_VALUE_LENGTH = 255;

    private final Supplier<AttributeFilter> filter;
    private final int maxAttributes;
    private final Map<String, Object> candidates = new LinkedHashMap<>();
    private Map<AttributeDestination, Map<String, Object>> frozen;

    /**
     * @param filter supplies the filter to project with
     * @param maxAttributes the maximum number of attributes the set accepts
     */
    public AttributeSet(Supplier<AttributeFilter> filter, int maxAttributes) {
        this.filter = filter;
        this.maxAttributes = maxAttributes;
    }

    /**
     * Adds or replaces an attribute. Null keys or values are ignored, as are writes after {@link #freeze()} and new
     * keys beyond the size limit.
     *
     * @return true if the attribute was stored
     */
    public synchronized boolean add(String key, Object value) {
        if (key == null || value == null) {
            return false;
        }
        if (frozen != null) {
            logger.debug("Ignoring attribute '{}' written after the transaction ended", key);
            return false;
        }
        if (!candidates.containsKey(key) && candidates.size() >= maxAttributes) {
            logger.debug("Attribute limit of {} reached, dropping '{}'", maxAttributes, key);
            return false;
        }
        candidates.put(key, truncate(value));
        return true;
    }

    /** Returns whether a key has been written, regardless of its visibility. */
    public synchronized boolean has(String key) {
        return candidates.containsKey(key) || candidates.containsKey(AttributeFilter.normalize(key));
    }

    /** Returns the attributes visible in a destination. */
    public synchronized Map<String, Object> get(AttributeDestination destination) {
        if (frozen != null) {
            return frozen.get(destination);
        }
        return Collections.unmodifiableMap(filter.get().project(candidates, destination));
    }

    /** Computes the final projection. Calling it again has no effect. */
    public synchronized void freeze() {
        if (frozen != null) {
            return;
        }
        var projection = filter.get().project(candidates);
        projection.replaceAll((destination, attributes) -> Collections.unmodifiableMap(attributes));
        frozen = projection;
    }

    public synchronized boolean isFrozen() {
        return frozen != null;
    }

    public synchronized int size() {
        return candidates.size();
    }

    private static Object truncate(Object value) {
        if (value instanceof String string && string.length() > MAX_VALUE_LENGTH) {
            return string.substring(0, MAX_VALUE_LENGTH);
        }
        return value;
    }
}
