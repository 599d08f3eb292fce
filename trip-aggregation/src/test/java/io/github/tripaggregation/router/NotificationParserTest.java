package io.github.tripaggregation.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.tripaggregation.model.BatchFileNotification;
import io.github.tripaggregation.testutil.TripFixtures;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationParserTest {

  private NotificationParser parser;

  @BeforeEach
  void setUp() {
    parser = new NotificationParser(TripFixtures.objectMapper());
  }

  @Test
  void parse_withBareNotification_returnsBucketAndKey() {
    // When
    final BatchFileNotification notification =
        parser.parse("{\"bucketName\":\"raw-events\",\"key\":\"year=2023/month=01/x.csv\"}");

    // Then
    assertThat(notification.bucketName()).isEqualTo("raw-events");
    assertThat(notification.key()).isEqualTo("year=2023/month=01/x.csv");
  }

  @Test
  void parse_withEventEnvelope_readsRequestParameters() {
    // Given
    final String json =
        """
        {
          "source": "aws.s3",
          "detail-type": "AWS API Call via CloudTrail",
          "detail": {
            "eventName": "PutObject",
            "requestParameters": {"bucketName": "raw-events", "key": "year=2023/x.csv", "Host": "s3"}
          }
        }
        """;

    // When
    final BatchFileNotification notification = parser.parse(json);

    // Then
    assertThat(notification.bucketName()).isEqualTo("raw-events");
    assertThat(notification.key()).isEqualTo("year=2023/x.csv");
  }

  @Test
  void parse_withoutKey_throwsException() {
    assertThatThrownBy(() -> parser.parse("{\"bucketName\":\"raw-events\"}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_withInvalidJson_throwsException() {
    assertThatThrownBy(() -> parser.parse("{not json"))
        .isInstanceOf(UncheckedIOException.class);
  }
}
