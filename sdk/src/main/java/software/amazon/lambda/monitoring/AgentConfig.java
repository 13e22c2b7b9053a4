// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkSystemSetting;
import software.amazon.lambda.monitoring.attributes.AttributeConfig;
import software.amazon.lambda.monitoring.errors.ErrorCollectorConfig;
import software.amazon.lambda.monitoring.events.TransactionEventAggregator;
import software.amazon.lambda.monitoring.harvest.CollectorClient;
import software.amazon.lambda.monitoring.validation.ParameterValidator;

/**
 * Configuration of a {@link MonitoringAgent}. This class provides a builder pattern for configuring transaction naming,
 * attribute and error policies, and the collector transport.
 *
 * <p>Configuration is created once when the agent starts and is immutable afterwards. Only the attribute policy can be
 * replaced at runtime, see {@link MonitoringAgent#reconfigure(AttributeConfig)}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * AgentConfig config = AgentConfig.builder()
 *     .withAttributeConfig(AttributeConfig.builder().include(List.of("request.parameters.*")).build())
 *     .withCollectorClient(client)
 *     .build();
 * }</pre>
 */
public final class AgentConfig {
    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);

    /** Default transaction group: transactions are named {@code Function/<function name>}. */
    public static final String DEFAULT_TRANSACTION_GROUP = "Function";

    /** Default Apdex threshold. */
    public static final Duration DEFAULT_APDEX_T = Duration.ofMillis(100);

    private final String transactionGroup;
    private final String region;
    private final Duration apdexT;
    private final Clock clock;
    private final AttributeConfig attributeConfig;
    private final ErrorCollectorConfig errorCollectorConfig;
    private final int eventCapacity;
    private final boolean harvestOnTransactionEnd;
    private final CollectorClient collectorClient;

    private AgentConfig(Builder builder) {
        this.transactionGroup =
                builder.transactionGroup != null ? builder.transactionGroup : DEFAULT_TRANSACTION_GROUP;
        this.region = builder.region != null ? builder.region : readRegionFromEnvironment();
        this.apdexT = builder.apdexT != null ? builder.apdexT : DEFAULT_APDEX_T;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.attributeConfig = builder.attributeConfig != null ? builder.attributeConfig : AttributeConfig.defaults();
        this.errorCollectorConfig =
                builder.errorCollectorConfig != null ? builder.errorCollectorConfig : ErrorCollectorConfig.defaults();
        this.eventCapacity =
                builder.eventCapacity != null ? builder.eventCapacity : TransactionEventAggregator.DEFAULT_CAPACITY;
        this.harvestOnTransactionEnd = builder.harvestOnTransactionEnd;
        this.collectorClient = builder.collectorClient;
    }

    /**
     * Creates an AgentConfig with default settings and no collector client.
     *
     * @return AgentConfig with default configuration
     */
    public static AgentConfig defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the first segment of transaction names. */
    public String getTransactionGroup() {
        return transactionGroup;
    }

    /** Returns the region reported as {@code aws.region}, or null when unknown. */
    public String getRegion() {
        return region;
    }

    public Duration getApdexT() {
        return apdexT;
    }

    public Clock getClock() {
        return clock;
    }

    public AttributeConfig getAttributeConfig() {
        return attributeConfig;
    }

    public ErrorCollectorConfig getErrorCollectorConfig() {
        return errorCollectorConfig;
    }

    /** Returns the maximum number of transaction events kept per harvest cycle. */
    public int getEventCapacity() {
        return eventCapacity;
    }

    /** Returns whether data is harvested after every finished transaction. */
    public boolean isHarvestOnTransactionEnd() {
        return harvestOnTransactionEnd;
    }

    /** Returns the collector transport, or null when data is only aggregated locally. */
    public CollectorClient getCollectorClient() {
        return collectorClient;
    }

    private static String readRegionFromEnvironment() {
        var region = SdkSystemSetting.AWS_REGION.getStringValue().orElse(null);
        if (region == null || region.isEmpty()) {
            logger.debug("AWS_REGION not set, aws.region will not be reported");
            return null;
        }
        return region;
    }

    /** Builder for AgentConfig. */
    public static final class Builder {
        private String transactionGroup;
        private String region;
        private Duration apdexT;
        private Clock clock;
        private AttributeConfig attributeConfig;
        private ErrorCollectorConfig errorCollectorConfig;
        private Integer eventCapacity;
        private boolean harvestOnTransactionEnd = true;
        private CollectorClient collectorClient;

        private Builder() {}

        /**
         * Sets the first segment of transaction names. Defaults to {@value #DEFAULT_TRANSACTION_GROUP}.
         *
         * @param transactionGroup the group name
         * @return This builder
         */
        public Builder withTransactionGroup(String transactionGroup) {
            ParameterValidator.validateNotBlank(transactionGroup, "transactionGroup");
            this.transactionGroup = transactionGroup;
            return this;
        }

        /**
         * Sets the region reported as {@code aws.region}. If not set, the {@code AWS_REGION} setting is used.
         *
         * @param region the region name
         * @return This builder
         */
        public Builder withRegion(String region) {
            this.region = Objects.requireNonNull(region, "region cannot be null");
            return this;
        }

        /**
         * Sets the Apdex threshold of web transactions. Defaults to 100 milliseconds.
         *
         * @param apdexT the threshold
         * @return This builder
         */
        public Builder withApdexT(Duration apdexT) {
            ParameterValidator.validatePositiveDuration(apdexT, "apdexT");
            this.apdexT = apdexT;
            return this;
        }

        /**
         * Sets the clock transactions are timed with.
         *
         * @param clock the clock
         * @return This builder
         */
        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public Builder withAttributeConfig(AttributeConfig attributeConfig) {
            this.attributeConfig = Objects.requireNonNull(attributeConfig, "attributeConfig cannot be null");
            return this;
        }

        public Builder withErrorCollectorConfig(ErrorCollectorConfig errorCollectorConfig) {
            this.errorCollectorConfig =
                    Objects.requireNonNull(errorCollectorConfig, "errorCollectorConfig cannot be null");
            return this;
        }

        /**
         * Sets how many transaction events are kept per harvest cycle. Defaults to 10000.
         *
         * @param eventCapacity the capacity
         * @return This builder
         */
        public Builder withEventCapacity(int eventCapacity) {
            ParameterValidator.validatePositiveInteger(eventCapacity, "eventCapacity");
            this.eventCapacity = eventCapacity;
            return this;
        }

        /**
         * Sets whether data is harvested after every finished transaction. Defaults to true: a function instance may be
         * frozen between invocations, so data is sent while the invocation is still running.
         *
         * @param harvestOnTransactionEnd whether to harvest on transaction end
         * @return This builder
         */
        public Builder withHarvestOnTransactionEnd(boolean harvestOnTransactionEnd) {
            this.harvestOnTransactionEnd = harvestOnTransactionEnd;
            return this;
        }

        /**
         * Sets the collector transport. Without one, data is aggregated but never sent.
         *
         * @param collectorClient the client
         * @return This builder
         */
        public Builder withCollectorClient(CollectorClient collectorClient) {
            this.collectorClient = Objects.requireNonNull(collectorClient, "collectorClient cannot be null");
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }
}
