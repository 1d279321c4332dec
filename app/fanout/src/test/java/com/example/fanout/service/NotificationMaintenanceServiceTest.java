package com.example.fanout.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import com.example.fanout.config.NotificationMaintenanceProperties;
import com.example.fanout.repository.DeliveryStateRepository;
import com.example.fanout.repository.NotificationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationMaintenanceServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-08T00:00:00Z");

  @Mock private NotificationRepository notificationRepository;
  @Mock private DeliveryStateRepository deliveryStateRepository;

  private SimpleMeterRegistry registry;
  private NotificationMaintenanceService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new NotificationMaintenanceService(
            notificationRepository,
            deliveryStateRepository,
            new NotificationMaintenanceProperties(true, Duration.ofHours(1), Duration.ofDays(7)),
            new NotificationMetrics(registry),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void purgeExpiredUsesGraceBeforeNow() {
    when(notificationRepository.deleteExpiredBefore(Instant.parse("2026-03-01T00:00:00Z")))
        .thenReturn(2);

    assertThat(service.purgeExpired()).isEqualTo(2);
    assertThat(
            registry
                .get("fanout.maintenance.deleted.total")
                .tag("kind", "expired")
                .counter()
                .count())
        .isEqualTo(2.0d);
  }

  @Test
  void pruneOrphansReturnsDeletedCount() {
    when(deliveryStateRepository.pruneOrphans()).thenReturn(1);

    assertThat(service.pruneOrphans()).isEqualTo(1);
  }

  @Test
  void scheduledCleanupPurgesBeforePruning() {
    service.runScheduledCleanup();

    final InOrder order = inOrder(notificationRepository, deliveryStateRepository);
    order.verify(notificationRepository).deleteExpiredBefore(Instant.parse("2026-03-01T00:00:00Z"));
    order.verify(deliveryStateRepository).pruneOrphans();
  }
}
