// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.attributes;

import java.util.EnumSet;
import java.util.Set;

/**
 * Default destination membership of attribute keys.
 *
 * <ul>
 *   <li>broad keys are visible in every destination (the default for unknown keys)
 *   <li>limited keys are kept out of transaction events
 *   <li>opt-in keys are visible nowhere until an include rule names them
 * </ul>
 */
public final class AttributeCatalog {

    private static final Set<AttributeDestination> BROAD = EnumSet.allOf(AttributeDestination.class);
    private static final Set<AttributeDestination> LIMITED =
            EnumSet.of(AttributeDestination.TRANS_TRACE, AttributeDestination.ERROR_EVENT);

    private static final Set<String> LIMITED_KEYS = Set.of(
            AttributeKeys.FUNCTION_NAME,
            AttributeKeys.FUNCTION_VERSION,
            AttributeKeys.MEMORY_LIMIT,
            AttributeKeys.EVENT_SOURCE_ARN);

    private AttributeCatalog() {}

    /**
     * Returns the destinations a key is visible in before include and exclude rules are applied.
     *
     * @param key the normalized attribute key
     * @return a fresh, mutable set of destinations
     */
    public static Set<AttributeDestination> defaultDestinations(String key) {
        if (key.startsWith(AttributeKeys.REQUEST_PARAMETERS_PREFIX)) {
            return EnumSet.noneOf(AttributeDestination.class);
        }
        if (LIMITED_KEYS.contains(key)) {
            return EnumSet.copyOf(LIMITED);
        }
        return EnumSet.copyOf(BROAD);
    }
}
