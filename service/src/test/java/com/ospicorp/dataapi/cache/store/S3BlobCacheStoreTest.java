package com.ospicorp.dataapi.cache.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ospicorp.dataapi.support.MutableClock;
import com.ospicorp.dataapi.trace.DependencyTracer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

class S3BlobCacheStoreTest {

  private static final String KEY = "2021-03-01/nation/complete/abc.csv";
  private static final String LEASE_KEY = "_leases/" + KEY;
  private static final Instant NOW = Instant.parse("2021-03-01T12:00:00Z");

  private final S3Client s3 = mock(S3Client.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private S3BlobCacheStore store;

  @BeforeEach
  void setUp() {
    store = new S3BlobCacheStore(s3, "apiv2cache", "_leases", new MutableClock(NOW),
        new DependencyTracer(registry), key -> URI.create("https://cdn.test/apiv2cache/" + key));
  }

  @Test
  void createEmptyReportsLostRaceOnPreconditionFailure() {
    when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().statusCode(412).build());

    assertThat(store.createEmpty(KEY)).isFalse();
  }

  @Test
  void createEmptyIsConditional() {
    when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().build());

    assertThat(store.createEmpty(KEY)).isTrue();

    ArgumentCaptor<PutObjectRequest> put = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3).putObject(put.capture(), any(RequestBody.class));
    assertThat(put.getValue().key()).isEqualTo(KEY);
    assertThat(put.getValue().ifNoneMatch()).isEqualTo("*");
  }

  @Test
  void firstLeaseIsCreatedWithIfNoneMatch() {
    headReturns(KEY, HeadObjectResponse.builder().contentLength(0L).build());
    headMissing(LEASE_KEY);
    when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().build());

    LeaseHandle lease = store.acquireLease(KEY, Duration.ofSeconds(60)).orElseThrow();

    ArgumentCaptor<PutObjectRequest> put = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3).putObject(put.capture(), any(RequestBody.class));
    assertThat(put.getValue().key()).isEqualTo(LEASE_KEY);
    assertThat(put.getValue().ifNoneMatch()).isEqualTo("*");
    assertThat(put.getValue().metadata())
        .containsEntry(S3BlobCacheStore.LEASE_ID, lease.leaseId())
        .containsEntry(S3BlobCacheStore.EXPIRES_AT,
            Long.toString(NOW.plusSeconds(60).toEpochMilli()));
  }

  @Test
  void activeLeaseIsNotTakenOver() {
    headReturns(KEY, HeadObjectResponse.builder().contentLength(0L).build());
    headReturns(LEASE_KEY, lease("other", NOW.plusSeconds(30), "\"etag-1\""));

    assertThat(store.acquireLease(KEY, Duration.ofSeconds(60))).isEmpty();
    verify(s3, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void expiredLeaseIsTakenOverWithIfMatch() {
    headReturns(KEY, HeadObjectResponse.builder().contentLength(0L).build());
    headReturns(LEASE_KEY, lease("crashed", NOW.minusSeconds(1), "\"etag-1\""));
    when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().build());

    assertThat(store.acquireLease(KEY, Duration.ofSeconds(60))).isPresent();

    ArgumentCaptor<PutObjectRequest> put = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3).putObject(put.capture(), any(RequestBody.class));
    assertThat(put.getValue().ifMatch()).isEqualTo("\"etag-1\"");
  }

  @Test
  void concurrentTakeoverLosesTheRace() {
    headReturns(KEY, HeadObjectResponse.builder().contentLength(0L).build());
    headReturns(LEASE_KEY, lease("crashed", NOW.minusSeconds(1), "\"etag-1\""));
    when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().statusCode(412).build());

    assertThat(store.acquireLease(KEY, Duration.ofSeconds(60))).isEmpty();
  }

  @Test
  void deleteIsRefusedWhileLeased() {
    headReturns(LEASE_KEY, lease("producer", NOW.plusSeconds(30), "\"etag-1\""));

    assertThatThrownBy(() -> store.delete(KEY)).isInstanceOf(LeaseConflictException.class);
    verify(s3, never()).deleteObject(any(DeleteObjectRequest.class));
  }

  @Test
  void deleteByHolderRemovesEntryAndLease() {
    headReturns(LEASE_KEY, lease("mine", NOW.plusSeconds(30), "\"etag-1\""));

    store.delete(KEY, new LeaseHandle(KEY, "mine", Duration.ofSeconds(60)));

    ArgumentCaptor<DeleteObjectRequest> delete = ArgumentCaptor.forClass(DeleteObjectRequest.class);
    verify(s3, times(2)).deleteObject(delete.capture());
    assertThat(delete.getAllValues().get(0).key()).isEqualTo(KEY);
    assertThat(delete.getAllValues().get(0).ifMatch()).isNull();
    assertThat(delete.getAllValues().get(1).key()).isEqualTo(LEASE_KEY);
    assertThat(delete.getAllValues().get(1).ifMatch()).isEqualTo("\"etag-1\"");
  }

  @Test
  void expiredLeaseIsDeletedOnlyIfUnchanged() {
    headReturns(LEASE_KEY, lease("crashed", NOW.minusSeconds(1), "\"etag-7\""));

    store.delete(KEY);

    ArgumentCaptor<DeleteObjectRequest> delete = ArgumentCaptor.forClass(DeleteObjectRequest.class);
    verify(s3, times(2)).deleteObject(delete.capture());
    assertThat(delete.getAllValues().get(1).ifMatch()).isEqualTo("\"etag-7\"");
  }

  @Test
  void releaseLeavesALeaseTakenOverInTheMeantime() {
    headReturns(LEASE_KEY, lease("mine", NOW.plusSeconds(30), "\"etag-1\""));
    when(s3.deleteObject(any(DeleteObjectRequest.class)))
        .thenThrow(S3Exception.builder().statusCode(412).build());

    store.release(new LeaseHandle(KEY, "mine", Duration.ofSeconds(60)));

    ArgumentCaptor<DeleteObjectRequest> delete = ArgumentCaptor.forClass(DeleteObjectRequest.class);
    verify(s3).deleteObject(delete.capture());
    assertThat(delete.getValue().key()).isEqualTo(LEASE_KEY);
    assertThat(delete.getValue().ifMatch()).isEqualTo("\"etag-1\"");
  }

  @Test
  void propertiesReportLeaseState() {
    headReturns(KEY, HeadObjectResponse.builder().contentLength(42L).build());
    headReturns(LEASE_KEY, lease("producer", NOW.plusSeconds(30), "\"etag-1\""));

    BlobProperties properties = store.getProperties(KEY).orElseThrow();

    assertThat(properties.size()).isEqualTo(42L);
    assertThat(properties.leaseState()).isEqualTo(LeaseState.LOCKED);
  }

  @Test
  void callsAreTimed() {
    headMissing(KEY);

    assertThat(store.exists(KEY)).isFalse();

    assertThat(registry.find(DependencyTracer.METRIC)
        .tag("dependency", DependencyTracer.BLOB_STORE)
        .tag("operation", "head")
        .timer()).isNotNull();
  }

  @Test
  void locationComesFromLocator() {
    assertThat(store.locationOf(KEY))
        .isEqualTo(URI.create("https://cdn.test/apiv2cache/" + KEY));
  }

  private void headReturns(String key, HeadObjectResponse response) {
    when(s3.headObject(argThat((HeadObjectRequest request) -> request != null && key.equals(request.key()))))
        .thenReturn(response);
  }

  private void headMissing(String key) {
    when(s3.headObject(argThat((HeadObjectRequest request) -> request != null && key.equals(request.key()))))
        .thenThrow(NoSuchKeyException.builder().statusCode(404).build());
  }

  private static HeadObjectResponse lease(String leaseId, Instant expiresAt, String etag) {
    return HeadObjectResponse.builder()
        .eTag(etag)
        .contentLength(0L)
        .metadata(Map.of(
            S3BlobCacheStore.LEASE_ID, leaseId,
            S3BlobCacheStore.EXPIRES_AT, Long.toString(expiresAt.toEpochMilli())))
        .build();
  }
}
