// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.examples;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.lambda.monitoring.testing.LocalTracingTestRunner;
import software.amazon.lambda.monitoring.transaction.CompletionSignal;

class InventoryCheckExampleTest {

    private final LocalTracingTestRunner<Map<String, Object>, Map<String, Object>> runner =
            LocalTracingTestRunner.create(new InventoryCheckExample(Map.of("widget", 10)));

    @Test
    void succeedsWhenInStock() {
        var result = runner.run(Map.of("sku", "widget", "quantity", 3));

        assertEquals(CompletionSignal.SUCCEED, result.getSignal());
        assertEquals(true, result.getResult().get("available"));
        assertEquals(CompletionSignal.SUCCEED, result.getTransaction().getCompletionSignal());
    }

    @Test
    void completesWithDoneWhenShort() {
        var result = runner.run(Map.of("sku", "widget", "quantity", 12));

        assertEquals(CompletionSignal.DONE, result.getSignal());
        assertEquals(2, result.getResult().get("shortBy"));
        assertTrue(result.getErrorTraces().isEmpty());
    }

    @Test
    void failsWithoutSku() {
        var result = runner.run(Map.of("quantity", 1));

        assertEquals(CompletionSignal.FAIL, result.getSignal());
        assertInstanceOf(IllegalArgumentException.class, result.getError().orElseThrow());
        assertEquals("IllegalArgumentException", result.getErrorTraces().get(0).className());
        assertTrue(result.getMetricNames().contains("Errors/all"));
    }
}
