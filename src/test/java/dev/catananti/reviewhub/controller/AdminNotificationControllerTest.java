package dev.catananti.reviewhub.controller;

import dev.catananti.reviewhub.entity.UserRole;
import dev.catananti.reviewhub.event.SubmittedEvent;
import dev.catananti.reviewhub.notification.NotificationHub;
import dev.catananti.reviewhub.notification.NotificationMessage;
import dev.catananti.reviewhub.security.Identity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminNotificationControllerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 15, 10, 0);

    @Mock
    private NotificationHub notificationHub;

    @InjectMocks
    private AdminNotificationController controller;

    @Test
    @DisplayName("should name each event by its type and key it by post and sequence")
    void shouldMapMessagesToServerSentEvents() {
        NotificationMessage snapshot = NotificationMessage.snapshot(List.of(1L), NOW);
        NotificationMessage submitted = NotificationMessage.from(new SubmittedEvent(4L, 5L, false, 1L, NOW));
        when(notificationHub.connect(anyString(), eq(UserRole.ADMIN))).thenReturn(Flux.just(snapshot, submitted));

        StepVerifier.create(controller.stream(new Identity(1L, UserRole.ADMIN)))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("SNAPSHOT");
                    assertThat(event.id()).isNull();
                    assertThat(event.data()).isEqualTo(snapshot);
                })
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("SUBMITTED");
                    assertThat(event.id()).isEqualTo("4:1");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should return a post's recent notifications")
    void shouldReturnHistory() {
        NotificationMessage submitted = NotificationMessage.from(new SubmittedEvent(4L, 5L, false, 1L, NOW));
        when(notificationHub.history(4L)).thenReturn(List.of(submitted));

        assertThat(controller.history(4L)).containsExactly(submitted);
    }
}
