// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.metrics;

import java.time.Duration;

/** Apdex score buckets of one metric. */
public class ApdexStats {
    private final double apdexT;
    private long satisfying;
    private long tolerating;
    private long frustrating;

    public ApdexStats(Duration apdexT) {
        this.apdexT = apdexT.toNanos() / 1e9;
    }

    /**
     * Classifies one response: satisfying up to apdexT, tolerating up to four times apdexT, frustrating beyond that or
     * when the transaction failed.
     */
    public synchronized void recordValue(Duration duration, boolean failed) {
        var seconds = duration.toNanos() / 1e9;
        if (failed || seconds > 4 * apdexT) {
            frustrating++;
        } else if (seconds > apdexT) {
            tolerating++;
        } else {
            satisfying++;
        }
    }

    public synchronized void merge(ApdexStats other) {
        long s;
        long t;
        long f;
        synchronized (other) {
            s = other.satisfying;
            t = other.tolerating;
            f = other.frustrating;
        }
        satisfying += s;
        tolerating += t;
        frustrating += f;
    }

    public synchronized long getSatisfying() {
        return satisfying;
    }

    public synchronized long getTolerating() {
        return tolerating;
    }

    public synchronized long getFrustrating() {
        return frustrating;
    }

    public double getApdexT() {
        return apdexT;
    }

    /** Returns the wire form {@code [satisfying, tolerating, frustrating, apdexT, apdexT, 0]}. */
    public synchronized Object[] toArray() {
        return new Object[] {satisfying, tolerating, frustrating, apdexT, apdexT, 0};
    }
}
