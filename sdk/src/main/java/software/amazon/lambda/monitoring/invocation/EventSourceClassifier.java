// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.invocation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the ARN of the system that triggered an invocation from the shape of its event.
 *
 * <table>
 *   <caption>Recognized events</caption>
 *   <tr><th>Event</th><th>ARN</th></tr>
 *   <tr><td>SNS</td><td>{@code Records[0].EventSubscriptionArn}</td></tr>
 *   <tr><td>S3</td><td>{@code Records[0].s3.bucket.arn}</td></tr>
 *   <tr><td>Kinesis, DynamoDB, SQS, CodeCommit</td><td>{@code Records[0].eventSourceARN}</td></tr>
 *   <tr><td>Kinesis Data Firehose</td><td>{@code deliveryStreamArn}</td></tr>
 *   <tr><td>Application Load Balancer</td><td>{@code requestContext.elb.targetGroupArn}</td></tr>
 * </table>
 *
 * <p>ARNs are returned as they appear in the event. Any other shape, CloudFront events included, yields nothing.
 */
public final class EventSourceClassifier {
    private static final Logger logger = LoggerFactory.getLogger(EventSourceClassifier.class);

    private EventSourceClassifier() {}

    /** Classifies an event of any type. An event that cannot be read as a tree yields nothing. */
    public static Optional<String> classify(Object event) {
        JsonNode tree;
        try {
            tree = EventNodes.toTree(event);
        } catch (IllegalArgumentException e) {
            logger.debug("Event of type {} cannot be inspected", event.getClass().getName(), e);
            return Optional.empty();
        }
        return classify(tree);
    }

    public static Optional<String> classify(JsonNode event) {
        var record = EventNodes.first(EventNodes.field(event, "Records"));
        if (EventNodes.isPresent(record)) {
            if (EventNodes.isPresent(EventNodes.field(record, "Sns"))) {
                return EventNodes.text(EventNodes.field(record, "EventSubscriptionArn"));
            }
            if (EventNodes.isPresent(EventNodes.field(record, "s3"))) {
                return EventNodes.text(EventNodes.path(record, "s3", "bucket", "arn"));
            }
            var eventSourceArn = EventNodes.text(EventNodes.field(record, "eventSourceARN"));
            if (eventSourceArn.isPresent()) {
                return eventSourceArn;
            }
        }
        var deliveryStreamArn = EventNodes.text(EventNodes.field(event, "deliveryStreamArn"));
        if (deliveryStreamArn.isPresent()) {
            return deliveryStreamArn;
        }
        return EventNodes.text(EventNodes.path(event, "requestContext", "elb", "targetGroupArn"));
    }
}
