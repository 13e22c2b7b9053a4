// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.metrics;

/** Call count and timing statistics of one metric. Times are in seconds. */
public class MetricStats {
    private long callCount;
    private double total;
    private double totalExclusive;
    private double min;
    private double max;
    private double sumOfSquares;

    /** Records one call that took {@code totalSeconds}, of which {@code exclusiveSeconds} were its own. */
    public synchronized void recordValue(double totalSeconds, double exclusiveSeconds) {
        if (callCount == 0) {
            min = totalSeconds;
            max = totalSeconds;
        } else {
            min = Math.min(min, totalSeconds);
            max = Math.max(max, totalSeconds);
        }
        callCount++;
        total += totalSeconds;
        totalExclusive += exclusiveSeconds;
        sumOfSquares += totalSeconds * totalSeconds;
    }

    /** Records one call that took {@code seconds}, all of it exclusive. */
    public void recordValue(double seconds) {
        recordValue(seconds, seconds);
    }

    /** Counts calls without timing information. */
    public synchronized void incrementCallCount(long count) {
        callCount += count;
    }

    public synchronized void merge(MetricStats other) {
        long otherCount;
        double otherTotal;
        double otherExclusive;
        double otherMin;
        double otherMax;
        double otherSquares;
        synchronized (other) {
            otherCount = other.callCount;
            otherTotal = other.total;
            otherExclusive = other.totalExclusive;
            otherMin = other.min;
            otherMax = other.max;
            otherSquares = other.sumOfSquares;
        }
        if (otherCount == 0) {
            return;
        }
        min = callCount == 0 ? otherMin : Math.min(min, otherMin);
        max = callCount == 0 ? otherMax : Math.max(max, otherMax);
        callCount += otherCount;
        total += otherTotal;
        totalExclusive += otherExclusive;
        sumOfSquares += otherSquares;
    }

    public synchronized long getCallCount() {
        return callCount;
    }

    public synchronized double getTotal() {
        return total;
    }

    public synchronized double getTotalExclusive() {
        return totalExclusive;
    }

    public synchronized double getMin() {
        return min;
    }

    public synchronized double getMax() {
        return max;
    }

    public synchronized double getSumOfSquares() {
        return sumOfSquares;
    }

    /** Returns the wire form {@code [callCount, total, exclusive, min, max, sumOfSquares]}. */
    public synchronized Object[] toArray() {
        return new Object[] {callCount, total, totalExclusive, min, max, sumOfSquares};
    }
}
