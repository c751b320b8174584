package com.bbthechange.watchtracker.config;

import com.bbthechange.watchtracker.model.EpisodeTrackingItem;
import com.bbthechange.watchtracker.util.TrackingKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the WatchTrackerTable on startup when it does not exist.
 * Disable with dynamodb.table.init.enabled=false where the table is managed elsewhere.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Autowired
    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(TrackingKeyFactory.TABLE_NAME);
    }

    private void createTableIfNotExists(String tableName) {
        DynamoDbTable<EpisodeTrackingItem> table =
            dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(EpisodeTrackingItem.class));
        try {
            // Throws ResourceNotFoundException when the table is missing
            table.describeTable();
            logger.info("Table {} already exists", tableName);

        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(ProvisionedThroughput.builder()
                    .readCapacityUnits(5L)
                    .writeCapacityUnits(5L)
                    .build())
                .build());
            logger.info("Table {} created successfully", tableName);
        } catch (RuntimeException e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }
}
