package app.clipvault.catalog.storage;

import app.clipvault.catalog.config.StorageResilienceProps;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResilientStorageGatewayTest {

    @Mock
    ObjectStorage storage;

    @Test
    void exists_retriesTransientFailuresThenSucceeds() {
        ResilientStorageGateway gateway = gateway(5);
        when(storage.objectExists(eq("k"), any(Duration.class)))
                .thenThrow(SdkClientException.create("connection reset"))
                .thenThrow(SdkClientException.create("connection reset"))
                .thenReturn(true);

        assertThat(gateway.exists("k", Deadline.none())).isTrue();
        verify(storage, times(3)).objectExists(eq("k"), any(Duration.class));
    }

    @Test
    void exists_absentObjectIsFalseAndNotAFailure() {
        ResilientStorageGateway gateway = gateway(1);
        when(storage.objectExists(eq("k"), any(Duration.class))).thenReturn(false);

        assertThat(gateway.exists("k", Deadline.none())).isFalse();
        assertThat(gateway.circuitBreakerState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void deleteObject_exhaustedRetriesSurfaceAsStorageOperationException() {
        ResilientStorageGateway gateway = gateway(5);
        doThrow(SdkClientException.create("timeout")).when(storage).deleteObject(eq("k"), any(Duration.class));

        assertThatThrownBy(() -> gateway.deleteObject("k", Deadline.none()))
                .isInstanceOf(StorageOperationException.class)
                .isNotInstanceOf(BreakerOpenException.class)
                .hasCauseInstanceOf(SdkClientException.class);
        verify(storage, times(3)).deleteObject(eq("k"), any(Duration.class));
    }

    @Test
    void breaker_opensAfterConsecutiveFailuresAndFailsFast() {
        ResilientStorageGateway gateway = gateway(3);
        doThrow(SdkClientException.create("timeout")).when(storage).deleteObject(anyString(), any(Duration.class));

        assertThatThrownBy(() -> gateway.deleteObject("a", Deadline.none()))
                .isInstanceOf(StorageOperationException.class);
        assertThat(gateway.circuitBreakerState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> gateway.deleteObject("b", Deadline.none()))
                .isInstanceOf(BreakerOpenException.class);
        verify(storage, never()).deleteObject(eq("b"), any(Duration.class));
    }

    @Test
    void breaker_openDuringCallStopsRemainingRetries() {
        ResilientStorageGateway gateway = gateway(5);
        doThrow(SdkClientException.create("timeout")).when(storage).deleteObject(anyString(), any(Duration.class));

        assertThatThrownBy(() -> gateway.deleteObject("a", Deadline.none()))
                .isInstanceOf(StorageOperationException.class);
        assertThatThrownBy(() -> gateway.deleteObject("b", Deadline.none()))
                .isInstanceOf(BreakerOpenException.class);

        verify(storage, times(3)).deleteObject(eq("a"), any(Duration.class));
        verify(storage, times(2)).deleteObject(eq("b"), any(Duration.class));
    }

    @Test
    void breaker_letsProbeThroughAfterCooldownAndClosesOnSuccess() throws InterruptedException {
        ResilientStorageGateway gateway = gateway(3);
        when(storage.objectExists(eq("k"), any(Duration.class)))
                .thenThrow(SdkClientException.create("timeout"))
                .thenThrow(SdkClientException.create("timeout"))
                .thenThrow(SdkClientException.create("timeout"))
                .thenReturn(true);

        assertThatThrownBy(() -> gateway.exists("k", Deadline.none())).isInstanceOf(StorageOperationException.class);
        assertThat(gateway.circuitBreakerState()).isEqualTo(CircuitBreaker.State.OPEN);

        Thread.sleep(250);

        assertThat(gateway.exists("k", Deadline.none())).isTrue();
        assertThat(gateway.circuitBreakerState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void expiredDeadline_failsWithoutCallingStorage() {
        ResilientStorageGateway gateway = gateway(5);

        assertThatThrownBy(() -> gateway.exists("k", Deadline.at(Instant.now().minusSeconds(1))))
                .isInstanceOf(DeadlineExceededException.class);
        verifyNoInteractions(storage);
    }

    @Test
    void attemptTimeout_isCappedByRemainingDeadline() {
        ResilientStorageGateway gateway = new ResilientStorageGateway(storage, new StorageResilienceProps(
                Duration.ofSeconds(3), 0, Duration.ofMillis(1), Duration.ofMillis(5), 5, Duration.ofSeconds(1)));
        when(storage.objectExists(eq("k"), any(Duration.class))).thenReturn(true);

        gateway.exists("k", Deadline.in(Duration.ofSeconds(1)));

        ArgumentCaptor<Duration> timeout = ArgumentCaptor.forClass(Duration.class);
        verify(storage).objectExists(eq("k"), timeout.capture());
        assertThat(timeout.getValue()).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void backoff_isCutShortByDeadline() {
        ResilientStorageGateway gateway = new ResilientStorageGateway(storage, new StorageResilienceProps(
                Duration.ofMillis(500), 2, Duration.ofSeconds(2), Duration.ofSeconds(4), 5, Duration.ofSeconds(1)));
        when(storage.objectExists(eq("k"), any(Duration.class))).thenThrow(SdkClientException.create("connection reset"));

        long started = System.nanoTime();
        assertThatThrownBy(() -> gateway.exists("k", Deadline.in(Duration.ofMillis(150))))
                .isInstanceOf(DeadlineExceededException.class);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(elapsed).isLessThan(Duration.ofSeconds(1));
        verify(storage, atMost(2)).objectExists(eq("k"), any(Duration.class));
    }

    @Test
    void deleteByPrefix_walksEveryPage() {
        ResilientStorageGateway gateway = gateway(5);
        when(storage.listObjects(eq("hls/o/e/"), isNull(), any(Duration.class)))
                .thenReturn(new ObjectListing(List.of("hls/o/e/a.ts", "hls/o/e/b.ts"), "next"));
        when(storage.listObjects(eq("hls/o/e/"), eq("next"), any(Duration.class)))
                .thenReturn(new ObjectListing(List.of("hls/o/e/master.m3u8"), null));

        int deleted = gateway.deleteByPrefix("hls/o/e/", Deadline.none());

        assertThat(deleted).isEqualTo(3);
        verify(storage).deleteObject(eq("hls/o/e/a.ts"), any(Duration.class));
        verify(storage).deleteObject(eq("hls/o/e/b.ts"), any(Duration.class));
        verify(storage).deleteObject(eq("hls/o/e/master.m3u8"), any(Duration.class));
    }

    @Test
    void deleteByPrefix_continuesPastSingleObjectFailureThenReportsPrefixFailed() {
        ResilientStorageGateway gateway = gateway(5);
        when(storage.listObjects(eq("videos/o/e/"), isNull(), any(Duration.class)))
                .thenReturn(new ObjectListing(List.of("videos/o/e/1", "videos/o/e/2", "videos/o/e/3"), null));
        lenient().doThrow(SdkClientException.create("timeout"))
                .when(storage).deleteObject(eq("videos/o/e/2"), any(Duration.class));

        assertThatThrownBy(() -> gateway.deleteByPrefix("videos/o/e/", Deadline.none()))
                .isInstanceOf(StorageOperationException.class)
                .hasMessageContaining("1 of 3");
        verify(storage).deleteObject(eq("videos/o/e/3"), any(Duration.class));
    }

    @Test
    void deleteByPrefix_emptyPrefixDeletesNothing() {
        ResilientStorageGateway gateway = gateway(5);
        when(storage.listObjects(eq("videos/o/e/"), isNull(), any(Duration.class)))
                .thenReturn(new ObjectListing(List.of(), null));

        assertThat(gateway.deleteByPrefix("videos/o/e/", Deadline.none())).isZero();
        verify(storage, never()).deleteObject(anyString(), any(Duration.class));
    }

    private ResilientStorageGateway gateway(int breakerThreshold) {
        return new ResilientStorageGateway(storage, new StorageResilienceProps(
                Duration.ofMillis(500),
                2,
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                breakerThreshold,
                Duration.ofMillis(200)
        ));
    }
}
