package com.bbthechange.watchtracker.config;

import com.bbthechange.watchtracker.util.TrackingKeyFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Health indicator for DynamoDB connectivity and the tracking table's status.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final String region;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient, @Value("${aws.region:us-east-1}") String region) {
        this.dynamoDbClient = dynamoDbClient;
        this.region = region;
    }

    @Override
    public Health health() {
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(TrackingKeyFactory.TABLE_NAME).build()
            );

            TableStatus status = response.table().tableStatus();
            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("trackingTable", "ACTIVE")
                    .withDetail("itemCount", response.table().itemCount())
                    .withDetail("region", region)
                    .build();
            }
            return Health.down()
                .withDetail("trackingTable", String.valueOf(status))
                .withDetail("reason", TrackingKeyFactory.TABLE_NAME + " not active")
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
