package io.github.tripaggregation.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.github.tripaggregation.converter.TripSummaryConverter;
import io.github.tripaggregation.exception.TripAggregationException;
import io.github.tripaggregation.exception.TripNotFoundException;
import io.github.tripaggregation.model.ImmutableTripSummary;
import io.github.tripaggregation.model.TripSummary;
import io.github.tripaggregation.testutil.TripFixtures;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactionConflictException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

@ExtendWith(MockitoExtension.class)
class DynamoDbTripSummaryStoreTest {

  @Mock private DynamoDbClient dynamoDbClient;

  @Captor private ArgumentCaptor<UpdateItemRequest> updateCaptor;
  @Captor private ArgumentCaptor<GetItemRequest> getCaptor;

  private TripSummaryConverter converter;
  private DynamoDbTripSummaryStore store;

  @BeforeEach
  void setUp() {
    converter = new TripSummaryConverter();
    store = new DynamoDbTripSummaryStore(dynamoDbClient, converter, TripFixtures.configuration());
  }

  @Test
  void get_withStoredItem_returnsSummary() {
    // Given
    final TripSummary summary = TripFixtures.summary("trip-1");
    when(dynamoDbClient.getItem(any(GetItemRequest.class)))
        .thenReturn(GetItemResponse.builder().item(converter.toItem(summary)).build());

    // When
    final Optional<TripSummary> result = store.get("trip-1");

    // Then
    assertThat(result).contains(summary);
    verify(dynamoDbClient).getItem(getCaptor.capture());
    assertThat(getCaptor.getValue().tableName()).isEqualTo("TripSummaries");
    assertThat(getCaptor.getValue().consistentRead()).isTrue();
    assertThat(getCaptor.getValue().key()).isEqualTo(converter.key("trip-1"));
  }

  @Test
  void get_withoutItem_returnsEmpty() {
    // Given
    when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

    // When / Then
    assertThat(store.get("unknown")).isEmpty();
  }

  @Test
  void refreshDerivedFields_withBatch_updatesEachSummary() {
    // Given
    when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

    // When
    store.refreshDerivedFields(List.of(TripFixtures.summary("trip-1"), TripFixtures.summary("trip-2")));

    // Then
    verify(dynamoDbClient, times(2)).updateItem(updateCaptor.capture());
    assertThat(updateCaptor.getAllValues())
        .extracting(UpdateItemRequest::key)
        .containsExactly(converter.key("trip-1"), converter.key("trip-2"));
    assertThat(updateCaptor.getAllValues()).allSatisfy(request -> {
      assertThat(request.conditionExpression()).isNull();
      assertThat(request.updateExpression()).contains("if_not_exists(#aggregation_executed");
    });
  }

  @Test
  void refreshDerivedFields_withConflictingSummary_stillWritesTheRest() {
    // Given
    when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
        .thenReturn(UpdateItemResponse.builder().build())
        .thenThrow(TransactionConflictException.builder().message("conflict").build())
        .thenReturn(UpdateItemResponse.builder().build());
    final List<TripSummary> batch = List.of(
        TripFixtures.summary("trip-1"), TripFixtures.summary("trip-2"), TripFixtures.summary("trip-3"));

    // When / Then
    assertThatThrownBy(() -> store.refreshDerivedFields(batch))
        .isInstanceOf(TripAggregationException.class)
        .hasMessageContaining("1 of 3")
        .hasCauseInstanceOf(TransactionConflictException.class);
    verify(dynamoDbClient, times(3)).updateItem(updateCaptor.capture());
    assertThat(updateCaptor.getAllValues())
        .extracting(UpdateItemRequest::key)
        .containsExactly(converter.key("trip-1"), converter.key("trip-2"), converter.key("trip-3"));
  }

  @Test
  void refreshDerivedFields_neverAssignsAggregationFlagUnconditionally() {
    // Given
    final TripSummary aggregated = ImmutableTripSummary.builder()
        .from(TripFixtures.summary("trip-1"))
        .aggregationExecuted(true)
        .build();

    // When
    final UpdateItemRequest update = store.derivedFieldsUpdate(aggregated);

    // Then
    assertThat(update.updateExpression())
        .contains("#aggregation_executed = if_not_exists(#aggregation_executed, :not_aggregated)")
        .doesNotContain(":aggregated")
        .doesNotContain("REMOVE");
    assertThat(update.expressionAttributeValues().get(":not_aggregated").bool()).isFalse();
    assertThat(update.expressionAttributeValues()).containsKeys(":device_id", ":end_date", ":event_count");
    assertThat(update.key()).isEqualTo(converter.key("trip-1"));
    assertThat(update.tableName()).isEqualTo("TripSummaries");
  }

  @Test
  void derivedFieldsUpdate_withoutEngineStart_removesStaleFields() {
    // Given
    final TripSummary summary = ImmutableTripSummary.builder()
        .from(TripFixtures.summary("trip-1"))
        .startDate(Optional.empty())
        .durationSeconds(Optional.empty())
        .dataIntegrityRate(Optional.empty())
        .build();

    // When
    final UpdateItemRequest update = store.derivedFieldsUpdate(summary);

    // Then
    assertThat(update.updateExpression())
        .endsWith(" REMOVE #start_date, #duration_seconds, #data_integrity_rate");
    assertThat(update.expressionAttributeNames()).containsEntry("#start_date", "start_date");
  }

  @Test
  void derivedFieldsUpdate_calledTwice_isIdentical() {
    assertThat(store.derivedFieldsUpdate(TripFixtures.summary("trip-1")))
        .isEqualTo(store.derivedFieldsUpdate(TripFixtures.summary("trip-1")));
  }

  @Test
  void refreshDerivedFields_withEmptyBatch_doesNothing() {
    // When
    store.refreshDerivedFields(List.of());

    // Then
    verifyNoInteractions(dynamoDbClient);
  }

  @Test
  void refreshDerivedFields_withOversizedBatch_throwsException() {
    // Given
    final List<TripSummary> batch = IntStream.range(0, TripSummaryRefresher.MAX_BATCH_SIZE + 1)
        .mapToObj(i -> TripFixtures.summary("trip-" + i))
        .collect(Collectors.toList());

    // When / Then
    assertThatThrownBy(() -> store.refreshDerivedFields(batch))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(dynamoDbClient);
  }

  @Test
  void markAggregated_withExistingTrip_setsOnlyFlag() {
    // Given
    when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

    // When
    store.markAggregated("trip-1");

    // Then
    verify(dynamoDbClient, times(1)).updateItem(updateCaptor.capture());
    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.updateExpression()).isEqualTo("SET #aggregation_executed = :aggregated");
    assertThat(request.conditionExpression()).isEqualTo("attribute_exists(#trip_id)");
    assertThat(request.expressionAttributeValues().get(":aggregated").bool()).isTrue();
  }

  @Test
  void markAggregated_withUnknownTrip_throwsTripNotFoundException() {
    // Given
    when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
        .thenThrow(ConditionalCheckFailedException.builder().message("condition failed").build());

    // When / Then
    assertThatThrownBy(() -> store.markAggregated("unknown"))
        .isInstanceOf(TripNotFoundException.class)
        .satisfies(e -> assertThat(((TripNotFoundException) e).tripId()).isEqualTo("unknown"));
  }
}
