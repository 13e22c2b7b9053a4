// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.examples;

import java.util.Map;
import software.amazon.lambda.monitoring.Callback;
import software.amazon.lambda.monitoring.InvocationContext;
import software.amazon.lambda.monitoring.LambdaHandler;

/**
 * Handler that completes through the context rather than the callback: {@code succeed} for items in stock,
 * {@code done} with a result for items that are short, and {@code fail} for requests without a SKU.
 */
public class InventoryCheckExample implements LambdaHandler<Map<String, Object>, Map<String, Object>> {

    private final Map<String, Integer> stock;

    public InventoryCheckExample(Map<String, Integer> stock) {
        this.stock = Map.copyOf(stock);
    }

    @Override
    public void handle(
            Map<String, Object> event,
            InvocationContext<Map<String, Object>> context,
            Callback<Map<String, Object>> callback) {
        var sku = event.get("sku");
        if (!(sku instanceof String skuName) || skuName.isBlank()) {
            context.fail(new IllegalArgumentException("sku is required"));
            return;
        }
        var requested = event.get("quantity") instanceof Number number ? number.intValue() : 1;
        var available = stock.getOrDefault(skuName, 0);
        if (available >= requested) {
            context.succeed(Map.of("sku", skuName, "available", true));
        } else {
            context.done(null, Map.of("sku", skuName, "available", false, "shortBy", requested - available));
        }
    }
}
