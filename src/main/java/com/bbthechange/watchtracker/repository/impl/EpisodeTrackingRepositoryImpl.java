package com.bbthechange.watchtracker.repository.impl;

import com.bbthechange.watchtracker.exception.RepositoryException;
import com.bbthechange.watchtracker.model.EpisodeTrackingItem;
import com.bbthechange.watchtracker.model.EpisodeTrackingMetadata;
import com.bbthechange.watchtracker.model.MetadataPatch;
import com.bbthechange.watchtracker.model.NextEpisode;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.bbthechange.watchtracker.repository.EpisodeTrackingRepository;
import com.bbthechange.watchtracker.util.QueryPerformanceTracker;
import com.bbthechange.watchtracker.util.TrackingKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * DynamoDB implementation of EpisodeTrackingRepository.
 * Uses the single-table design pattern with the WatchTrackerTable.
 */
@Repository
public class EpisodeTrackingRepositoryImpl implements EpisodeTrackingRepository {

    private static final Logger logger = LoggerFactory.getLogger(EpisodeTrackingRepositoryImpl.class);

    private static final String TABLE_NAME = TrackingKeyFactory.TABLE_NAME;
    private static final String DOCUMENT_EXISTS = "attribute_exists(pk)";
    private static final String DOCUMENT_ABSENT = "attribute_not_exists(pk)";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<EpisodeTrackingItem> trackingSchema;
    private final TableSchema<WatchedEpisode> episodeSchema;
    private final TableSchema<NextEpisode> nextEpisodeSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public EpisodeTrackingRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.trackingSchema = TableSchema.fromBean(EpisodeTrackingItem.class);
        this.episodeSchema = TableSchema.fromBean(WatchedEpisode.class);
        this.nextEpisodeSchema = TableSchema.fromBean(NextEpisode.class);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<EpisodeTrackingItem> findByUserAndShow(String userId, Integer showId) {
        return performanceTracker.trackQuery("findTrackingByUserAndShow", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(key(userId, showId))
                    .consistentRead(true)
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return mapItem(response.item());

            } catch (DynamoDbException e) {
                logger.error("Failed to find tracking for user {} show {}", userId, showId, e);
                throw new RepositoryException("Failed to retrieve episode tracking", e);
            }
        });
    }

    @Override
    public List<EpisodeTrackingItem> findAllByUser(String userId) {
        return performanceTracker.trackQuery("findAllTrackingByUser", TABLE_NAME, () -> {
            try {
                List<EpisodeTrackingItem> items = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;
                do {
                    QueryRequest.Builder request = QueryRequest.builder()
                        .tableName(TABLE_NAME)
                        .keyConditionExpression("pk = :pk AND begins_with(sk, :skPrefix)")
                        .expressionAttributeValues(Map.of(
                            ":pk", AttributeValue.builder().s(TrackingKeyFactory.getUserPk(userId)).build(),
                            ":skPrefix", AttributeValue.builder().s(TrackingKeyFactory.getShowTrackingSkPrefix()).build()
                        ))
                        .consistentRead(true);
                    if (startKey != null) {
                        request.exclusiveStartKey(startKey);
                    }

                    QueryResponse response = dynamoDbClient.query(request.build());
                    for (Map<String, AttributeValue> raw : response.items()) {
                        mapItem(raw).ifPresent(items::add);
                    }
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey()
                        : null;
                } while (startKey != null);

                logger.debug("Found {} tracked shows for user {}", items.size(), userId);
                return items;

            } catch (DynamoDbException e) {
                logger.error("Failed to query tracking for user {}", userId, e);
                throw new RepositoryException("Failed to query episode tracking by user", e);
            }
        });
    }

    @Override
    public void upsertEpisodes(String userId, Integer showId, Map<String, WatchedEpisode> episodes,
                               MetadataPatch patch, long now) {
        performanceTracker.trackQuery("upsertEpisodes", TABLE_NAME, () -> {
            try {
                try {
                    dynamoDbClient.updateItem(buildUpsert(userId, showId, episodes, patch, now));
                } catch (ConditionalCheckFailedException missing) {
                    createDocument(userId, showId, episodes, patch, now);
                }
                logger.debug("Upserted {} episodes for user {} show {}", episodes.size(), userId, showId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to upsert episodes {} for user {} show {}", episodes.keySet(), userId, showId, e);
                throw new RepositoryException("Failed to save watched episodes", e);
            }
        });
    }

    @Override
    public boolean removeEpisodes(String userId, Integer showId, Set<String> episodeKeys,
                                  MetadataPatch patch, long now) {
        return performanceTracker.trackQuery("removeEpisodes", TABLE_NAME, () -> {
            try {
                UpdateParts parts = new UpdateParts();
                int i = 0;
                for (String episodeKey : episodeKeys) {
                    String name = "#k" + i++;
                    parts.names.put("#eps", "episodes");
                    parts.names.put(name, episodeKey);
                    parts.removes.add("#eps." + name);
                }
                parts.applyMetadata(patch, now);

                dynamoDbClient.updateItem(parts.toRequest(key(userId, showId), DOCUMENT_EXISTS));
                logger.debug("Removed episodes {} for user {} show {}", episodeKeys, userId, showId);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.debug("No tracking document for user {} show {}; nothing to remove", userId, showId);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to remove episodes {} for user {} show {}", episodeKeys, userId, showId, e);
                throw new RepositoryException("Failed to remove watched episodes", e);
            }
        });
    }

    @Override
    public void delete(String userId, Integer showId) {
        performanceTracker.trackQuery("deleteTracking", TABLE_NAME, () -> {
            try {
                DeleteItemRequest request = DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(key(userId, showId))
                    .build();

                dynamoDbClient.deleteItem(request);

                logger.debug("Deleted tracking for user {} show {}", userId, showId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete tracking for user {} show {}", userId, showId, e);
                throw new RepositoryException("Failed to delete episode tracking", e);
            }
        });
    }

    private UpdateItemRequest buildUpsert(String userId, Integer showId, Map<String, WatchedEpisode> episodes,
                                          MetadataPatch patch, long now) {
        UpdateParts parts = new UpdateParts();
        int i = 0;
        for (Map.Entry<String, WatchedEpisode> entry : episodes.entrySet()) {
            parts.names.put("#eps", "episodes");
            String name = "#k" + i;
            String value = ":ep" + i;
            i++;
            parts.names.put(name, entry.getKey());
            parts.values.put(value, AttributeValue.builder().m(episodeSchema.itemToMap(entry.getValue(), true)).build());
            parts.sets.add("#eps." + name + " = " + value);
        }
        parts.applyMetadata(patch, now);
        return parts.toRequest(key(userId, showId), DOCUMENT_EXISTS);
    }

    /**
     * First write for a show. Loses gracefully to a concurrent creator by
     * falling back to the entry-level update.
     */
    private void createDocument(String userId, Integer showId, Map<String, WatchedEpisode> episodes,
                                MetadataPatch patch, long now) {
        EpisodeTrackingItem item = new EpisodeTrackingItem(userId, showId, patch.applyTo(new EpisodeTrackingMetadata(), now));
        item.setEpisodes(new HashMap<>(episodes));
        item.setCreatedAt(now);
        item.setUpdatedAt(now);

        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                .tableName(TABLE_NAME)
                .item(trackingSchema.itemToMap(item, true))
                .conditionExpression(DOCUMENT_ABSENT)
                .build());
            logger.info("Started tracking show {} for user {}", showId, userId);
        } catch (ConditionalCheckFailedException raced) {
            logger.debug("Tracking document for user {} show {} created concurrently; retrying update", userId, showId);
            dynamoDbClient.updateItem(buildUpsert(userId, showId, episodes, patch, now));
        }
    }

    private Optional<EpisodeTrackingItem> mapItem(Map<String, AttributeValue> raw) {
        try {
            return Optional.of(trackingSchema.mapToItem(raw));
        } catch (RuntimeException e) {
            logger.warn("Skipping unreadable tracking item pk={} sk={}: {}",
                attr(raw, "pk"), attr(raw, "sk"), e.getMessage());
            return Optional.empty();
        }
    }

    private static String attr(Map<String, AttributeValue> raw, String name) {
        AttributeValue value = raw.get(name);
        return value != null ? value.s() : null;
    }

    private static Map<String, AttributeValue> key(String userId, Integer showId) {
        return Map.of(
            "pk", AttributeValue.builder().s(TrackingKeyFactory.getUserPk(userId)).build(),
            "sk", AttributeValue.builder().s(TrackingKeyFactory.getShowTrackingSk(showId)).build()
        );
    }

    /**
     * Accumulates SET/REMOVE clauses with their placeholder maps.
     */
    private final class UpdateParts {
        private final List<String> sets = new ArrayList<>();
        private final List<String> removes = new ArrayList<>();
        private final Map<String, String> names = new LinkedHashMap<>();
        private final Map<String, AttributeValue> values = new LinkedHashMap<>();

        void applyMetadata(MetadataPatch patch, long now) {
            names.put("#md", "metadata");
            values.put(":now", AttributeValue.builder().n(Long.toString(now)).build());
            sets.add("#md.lastUpdated = :now");
            sets.add("updatedAt = :now");

            setString("tvShowName", ":showName", patch.getTvShowName());
            setString("posterPath", ":posterPath", patch.getPosterPath());
            setNumber("totalEpisodes", ":totalEpisodes", patch.getTotalEpisodes());
            setNumber("avgRuntime", ":avgRuntime", patch.getAvgRuntime());

            if (patch.touchesNextEpisode()) {
                values.put(":nextStatus", AttributeValue.builder().s(patch.getNextEpisodeStatus()).build());
                sets.add("#md.nextEpisodeStatus = :nextStatus");
                if (EpisodeTrackingMetadata.NEXT_AVAILABLE.equals(patch.getNextEpisodeStatus())
                        && patch.getNextEpisode() != null) {
                    values.put(":next", AttributeValue.builder()
                        .m(nextEpisodeSchema.itemToMap(patch.getNextEpisode(), true)).build());
                    sets.add("#md.nextEpisode = :next");
                } else {
                    removes.add("#md.nextEpisode");
                }
            }
        }

        private void setString(String field, String placeholder, String value) {
            if (value != null) {
                values.put(placeholder, AttributeValue.builder().s(value).build());
                sets.add("#md." + field + " = " + placeholder);
            }
        }

        private void setNumber(String field, String placeholder, Integer value) {
            if (value != null) {
                values.put(placeholder, AttributeValue.builder().n(value.toString()).build());
                sets.add("#md." + field + " = " + placeholder);
            }
        }

        UpdateItemRequest toRequest(Map<String, AttributeValue> key, String condition) {
            StringBuilder expression = new StringBuilder("SET ").append(String.join(", ", sets));
            if (!removes.isEmpty()) {
                expression.append(" REMOVE ").append(String.join(", ", removes));
            }
            return UpdateItemRequest.builder()
                .tableName(TABLE_NAME)
                .key(key)
                .updateExpression(expression.toString())
                .conditionExpression(condition)
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .build();
        }
    }
}
