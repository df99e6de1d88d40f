package com.scholary.mediacache.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.scholary.mediacache.connection.ConnectionStatus;
import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
class ObjectStoreHealthIndicatorTest {

  @Mock private ObjectStoreConnectionManager connectionManager;

  @Test
  void health_shouldBeUpWhenStoreAnswers() {
    when(connectionManager.healthCheck()).thenReturn(true);
    when(connectionManager.status())
        .thenReturn(new ConnectionStatus(true, "media", 1, 0, null, null));

    Health health = new ObjectStoreHealthIndicator(connectionManager).health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("bucket", "media")
        .doesNotContainKey("lastResetAt");
  }

  @Test
  void health_shouldBeDownAndShowLastResetWhenStoreFails() {
    Instant resetAt = Instant.parse("2024-05-01T10:00:00Z");
    when(connectionManager.healthCheck()).thenReturn(false);
    when(connectionManager.status())
        .thenReturn(new ConnectionStatus(false, "media", 2, 1, resetAt, "credential expired"));

    Health health = new ObjectStoreHealthIndicator(connectionManager).health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails())
        .containsEntry("resetCount", 1L)
        .containsEntry("lastResetReason", "credential expired");
  }
}
