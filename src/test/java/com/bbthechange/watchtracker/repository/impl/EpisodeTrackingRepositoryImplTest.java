package com.bbthechange.watchtracker.repository.impl;

import com.bbthechange.watchtracker.exception.RepositoryException;
import com.bbthechange.watchtracker.model.EpisodeTrackingItem;
import com.bbthechange.watchtracker.model.EpisodeTrackingMetadata;
import com.bbthechange.watchtracker.model.MetadataPatch;
import com.bbthechange.watchtracker.model.NextEpisode;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.bbthechange.watchtracker.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EpisodeTrackingRepositoryImplTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private EpisodeTrackingRepositoryImpl repository;

    private final TableSchema<EpisodeTrackingItem> schema = TableSchema.fromBean(EpisodeTrackingItem.class);

    private static final long NOW = 1_718_452_800_000L;

    @BeforeEach
    void setUp() {
        when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });

        repository = new EpisodeTrackingRepositoryImpl(dynamoDbClient, performanceTracker);
    }

    private static WatchedEpisode episode(int season, int number) {
        return new WatchedEpisode(63056, 1399, season, number, NOW, "Winter Is Coming", "2011-04-17");
    }

    private static EpisodeTrackingItem storedItem() {
        EpisodeTrackingItem item = new EpisodeTrackingItem("user-1", 1399,
                new EpisodeTrackingMetadata("Game of Thrones", "/got.jpg", NOW));
        item.putEpisode(episode(1, 1));
        return item;
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        void findByUserAndShow_ExistingItem_MapsIt() {
            // Given
            when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                    .thenReturn(GetItemResponse.builder().item(schema.itemToMap(storedItem(), true)).build());

            // When
            Optional<EpisodeTrackingItem> result = repository.findByUserAndShow("user-1", 1399);

            // Then
            assertThat(result).isPresent();
            assertThat(result.get().getEpisodes()).containsOnlyKeys("1_1");
            assertThat(result.get().getMetadata().getTvShowName()).isEqualTo("Game of Thrones");

            ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
            verify(dynamoDbClient).getItem(captor.capture());
            assertThat(captor.getValue().tableName()).isEqualTo("WatchTrackerTable");
            assertThat(captor.getValue().key().get("pk").s()).isEqualTo("USER#user-1");
            assertThat(captor.getValue().key().get("sk").s()).isEqualTo("TRACKING#SHOW#1399");
            assertThat(captor.getValue().consistentRead()).isTrue();
        }

        @Test
        void findByUserAndShow_Missing_ReturnsEmpty() {
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

            assertThat(repository.findByUserAndShow("user-1", 1399)).isEmpty();
        }

        @Test
        void findByUserAndShow_DynamoFailure_ThrowsRepositoryException() {
            when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                    .thenThrow(DynamoDbException.builder().message("boom").build());

            assertThatThrownBy(() -> repository.findByUserAndShow("user-1", 1399))
                    .isInstanceOf(RepositoryException.class);
        }

        @Test
        @DisplayName("findAllByUser follows pagination")
        void findAllByUser_MultiplePages_CollectsAll() {
            // Given
            EpisodeTrackingItem second = new EpisodeTrackingItem("user-1", 1396,
                    new EpisodeTrackingMetadata("Breaking Bad", null, NOW));
            Map<String, AttributeValue> lastKey = Map.of("pk", AttributeValue.builder().s("USER#user-1").build());
            when(dynamoDbClient.query(any(QueryRequest.class)))
                    .thenReturn(QueryResponse.builder().items(List.of(schema.itemToMap(storedItem(), true)))
                            .lastEvaluatedKey(lastKey).build())
                    .thenReturn(QueryResponse.builder().items(List.of(schema.itemToMap(second, true))).build());

            // When
            List<EpisodeTrackingItem> result = repository.findAllByUser("user-1");

            // Then
            assertThat(result).extracting(EpisodeTrackingItem::getShowId).containsExactly(1399, 1396);
            ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
            verify(dynamoDbClient, times(2)).query(captor.capture());
            assertThat(captor.getAllValues().get(0).expressionAttributeValues().get(":skPrefix").s())
                    .isEqualTo("TRACKING#SHOW#");
            assertThat(captor.getAllValues().get(1).exclusiveStartKey()).isEqualTo(lastKey);
        }
    }

    @Nested
    @DisplayName("upsertEpisodes")
    class Upsert {

        @Test
        @DisplayName("updates only the written entries on an existing document")
        void existingDocument_UpdatesEntries() {
            // Given
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());
            MetadataPatch patch = MetadataPatch.builder()
                    .tvShowName("Game of Thrones")
                    .nextEpisode(NextEpisode.exact(1, 3, "Lord Snow", "2011-05-01"))
                    .build();

            // When
            repository.upsertEpisodes("user-1", 1399, Map.of("1_2", episode(1, 2)), patch, NOW);

            // Then
            ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
            verify(dynamoDbClient).updateItem(captor.capture());
            UpdateItemRequest request = captor.getValue();
            assertThat(request.conditionExpression()).isEqualTo("attribute_exists(pk)");
            assertThat(request.updateExpression())
                    .contains("#eps.#k0 = :ep0")
                    .contains("#md.lastUpdated = :now")
                    .contains("#md.tvShowName = :showName")
                    .contains("#md.nextEpisode = :next")
                    .doesNotContain("REMOVE");
            assertThat(request.expressionAttributeNames()).containsEntry("#k0", "1_2").containsEntry("#eps", "episodes");
            assertThat(request.expressionAttributeValues().get(":nextStatus").s()).isEqualTo("AVAILABLE");
            verify(dynamoDbClient, never()).putItem(any(PutItemRequest.class));
        }

        @Test
        @DisplayName("creates the document when it does not exist yet")
        void missingDocument_FallsBackToConditionalPut() {
            // Given
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
                    .thenThrow(ConditionalCheckFailedException.builder().message("missing").build());
            when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

            // When
            repository.upsertEpisodes("user-1", 1399, Map.of("1_1", episode(1, 1)),
                    MetadataPatch.builder().tvShowName("Game of Thrones").build(), NOW);

            // Then
            ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
            verify(dynamoDbClient).putItem(captor.capture());
            PutItemRequest put = captor.getValue();
            assertThat(put.conditionExpression()).isEqualTo("attribute_not_exists(pk)");

            EpisodeTrackingItem written = schema.mapToItem(put.item());
            assertThat(written.getPk()).isEqualTo("USER#user-1");
            assertThat(written.getSk()).isEqualTo("TRACKING#SHOW#1399");
            assertThat(written.getEpisodes()).containsOnlyKeys("1_1");
            assertThat(written.getMetadata().getTvShowName()).isEqualTo("Game of Thrones");
            assertThat(written.getMetadata().getLastUpdated()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("retries the update when another writer created the document first")
        void concurrentCreate_RetriesUpdate() {
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
                    .thenThrow(ConditionalCheckFailedException.builder().message("missing").build())
                    .thenReturn(UpdateItemResponse.builder().build());
            when(dynamoDbClient.putItem(any(PutItemRequest.class)))
                    .thenThrow(ConditionalCheckFailedException.builder().message("exists").build());

            repository.upsertEpisodes("user-1", 1399, Map.of("1_1", episode(1, 1)), MetadataPatch.none(), NOW);

            verify(dynamoDbClient, times(2)).updateItem(any(UpdateItemRequest.class));
        }

        @Test
        void dynamoFailure_ThrowsRepositoryException() {
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
                    .thenThrow(DynamoDbException.builder().message("throttled").build());

            assertThatThrownBy(() -> repository.upsertEpisodes("user-1", 1399, Map.of("1_1", episode(1, 1)),
                    MetadataPatch.none(), NOW))
                    .isInstanceOf(RepositoryException.class);
        }
    }

    @Nested
    @DisplayName("removeEpisodes")
    class Remove {

        @Test
        void existingDocument_RemovesKeyAndResetsNextEpisode() {
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

            boolean removed = repository.removeEpisodes("user-1", 1399, Set.of("2_5"),
                    MetadataPatch.builder().resetNextEpisode().build(), NOW);

            assertThat(removed).isTrue();
            ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
            verify(dynamoDbClient).updateItem(captor.capture());
            assertThat(captor.getValue().updateExpression())
                    .contains("REMOVE #eps.#k0, #md.nextEpisode")
                    .contains("#md.nextEpisodeStatus = :nextStatus");
            assertThat(captor.getValue().expressionAttributeNames()).containsEntry("#k0", "2_5");
            assertThat(captor.getValue().expressionAttributeValues().get(":nextStatus").s()).isEqualTo("UNKNOWN");
        }

        @Test
        @DisplayName("missing document is a no-op")
        void missingDocument_ReturnsFalse() {
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
                    .thenThrow(ConditionalCheckFailedException.builder().message("missing").build());

            assertThat(repository.removeEpisodes("user-1", 1399, Set.of("2_5"), MetadataPatch.none(), NOW)).isFalse();
            verify(dynamoDbClient, never()).putItem(any(PutItemRequest.class));
        }
    }

    @Test
    void delete_IssuesDeleteItem() {
        when(dynamoDbClient.deleteItem(any(DeleteItemRequest.class))).thenReturn(DeleteItemResponse.builder().build());

        repository.delete("user-1", 1399);

        ArgumentCaptor<DeleteItemRequest> captor = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(dynamoDbClient).deleteItem(captor.capture());
        assertThat(captor.getValue().key().get("sk").s()).isEqualTo("TRACKING#SHOW#1399");
    }
}
