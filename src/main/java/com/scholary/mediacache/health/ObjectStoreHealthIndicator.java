package com.scholary.mediacache.health;

import com.scholary.mediacache.connection.ConnectionStatus;
import com.scholary.mediacache.connection.ObjectStoreConnectionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health contribution for the object store, published as {@code objectStore}.
 *
 * <p>Probes connectivity through the connection manager, so a stale credential is renewed by the
 * probe itself.
 */
@Component("objectStore")
public class ObjectStoreHealthIndicator implements HealthIndicator {

  private final ObjectStoreConnectionManager connectionManager;

  public ObjectStoreHealthIndicator(ObjectStoreConnectionManager connectionManager) {
    this.connectionManager = connectionManager;
  }

  @Override
  public Health health() {
    boolean reachable = connectionManager.healthCheck();
    ConnectionStatus status = connectionManager.status();

    Health.Builder builder = reachable ? Health.up() : Health.down();
    builder
        .withDetail("bucket", String.valueOf(status.bucket()))
        .withDetail("handlesCreated", status.handlesCreated())
        .withDetail("resetCount", status.resetCount());
    if (status.lastResetAt() != null) {
      builder
          .withDetail("lastResetAt", status.lastResetAt().toString())
          .withDetail("lastResetReason", status.lastResetReason());
    }
    return builder.build();
  }
}
