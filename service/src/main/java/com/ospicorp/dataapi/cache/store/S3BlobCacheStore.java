package com.ospicorp.dataapi.cache.store;

import com.ospicorp.dataapi.trace.DependencyTracer;
import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.Tag;
import software.amazon.awssdk.services.s3.model.Tagging;

/**
 * S3 backed cache store.
 *
 * <p>S3 has no native object lease, so a lease is a sibling object under {@code leasePrefix}
 * whose user metadata carries the lease id and its expiry. Leases are created with
 * {@code If-None-Match: *} and taken over or renewed with {@code If-Match} on the lease object's
 * ETag, so two parties can never both believe they hold it.
 *
 * <p>Lease objects are only ever deleted with {@code If-Match} on the ETag that was inspected, so
 * a lease taken over in the meantime survives. Deleting the entry itself is not conditional: an
 * unleased {@link #delete(String)} that races a reclaim can remove the new placeholder, and its
 * producer then fails on its next write and discards the entry.
 */
public class S3BlobCacheStore implements BlobCacheStore {

  private static final Logger log = LoggerFactory.getLogger(S3BlobCacheStore.class);

  static final String LEASE_ID = "lease-id";
  static final String EXPIRES_AT = "expires-at";

  private final S3Client s3;
  private final String bucket;
  private final String leasePrefix;
  private final Clock clock;
  private final DependencyTracer tracer;
  private final Function<String, URI> locator;

  public S3BlobCacheStore(S3Client s3, String bucket, String leasePrefix, Clock clock,
      DependencyTracer tracer, Function<String, URI> locator) {
    this.s3 = Objects.requireNonNull(s3);
    this.bucket = Objects.requireNonNull(bucket);
    this.leasePrefix = leasePrefix.endsWith("/") ? leasePrefix : leasePrefix + '/';
    this.clock = Objects.requireNonNull(clock);
    this.tracer = Objects.requireNonNull(tracer);
    this.locator = Objects.requireNonNull(locator);
  }

  @Override
  public boolean exists(String key) {
    return head(key).isPresent();
  }

  @Override
  public boolean createEmpty(String key) {
    PutObjectRequest put = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .ifNoneMatch("*")
        .build();
    try {
      traced("createEmpty", () -> s3.putObject(put, RequestBody.empty()));
      return true;
    } catch (S3Exception e) {
      if (isPreconditionFailure(e)) {
        return false;
      }
      throw new BlobStoreException("Unable to create " + key, e);
    }
  }

  @Override
  public void upload(String key, InputStream content, long length, String contentType,
      LeaseHandle lease) {
    checkWritable(key, lease);
    PutObjectRequest put = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType(contentType)
        .contentLength(length)
        .build();
    try {
      traced("upload", () -> s3.putObject(put, RequestBody.fromInputStream(content, length)));
    } catch (S3Exception e) {
      throw new BlobStoreException("Unable to upload " + key, e);
    }
    log.debug("Uploaded {} bytes to s3://{}/{}", length, bucket, key);
  }

  @Override
  public byte[] download(String key) {
    GetObjectRequest get = GetObjectRequest.builder().bucket(bucket).key(key).build();
    try {
      return traced("download", () -> s3.getObjectAsBytes(get).asByteArray());
    } catch (NoSuchKeyException e) {
      throw new BlobNotFoundException(key, e);
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        throw new BlobNotFoundException(key, e);
      }
      throw new BlobStoreException("Unable to download " + key, e);
    }
  }

  @Override
  public void delete(String key) {
    Optional<HeadObjectResponse> current = head(leaseKey(key));
    if (current.isPresent() && stateOf(current.get()) == LeaseState.LOCKED) {
      throw new LeaseConflictException(key);
    }
    deleteEntry(key);
    current.ifPresent(expired -> deleteLease(key, expired.eTag()));
  }

  @Override
  public void delete(String key, LeaseHandle lease) {
    Optional<HeadObjectResponse> current = head(leaseKey(key));
    if (current.isPresent() && !lease.leaseId().equals(current.get().metadata().get(LEASE_ID))) {
      log.info("Not deleting {}: lease {} was taken over", key, lease.leaseId());
      return;
    }
    deleteEntry(key);
    current.ifPresent(held -> deleteLease(key, held.eTag()));
  }

  @Override
  public Optional<LeaseHandle> acquireLease(String key, Duration duration) {
    if (!exists(key)) {
      return Optional.empty();
    }
    Optional<HeadObjectResponse> current = head(leaseKey(key));
    PutObjectRequest.Builder put = leaseWrite(key, UUID.randomUUID().toString(), duration);
    if (current.isEmpty()) {
      put.ifNoneMatch("*");
    } else if (stateOf(current.get()) == LeaseState.LOCKED) {
      return Optional.empty();
    } else {
      put.ifMatch(current.get().eTag());
    }
    PutObjectRequest request = put.build();
    try {
      traced("acquireLease", () -> s3.putObject(request, RequestBody.empty()));
    } catch (S3Exception e) {
      if (isPreconditionFailure(e)) {
        log.debug("Lost lease race on {}", key);
        return Optional.empty();
      }
      throw new BlobStoreException("Unable to lease " + key, e);
    }
    return Optional.of(new LeaseHandle(key, request.metadata().get(LEASE_ID), duration));
  }

  @Override
  public void renew(LeaseHandle lease) {
    HeadObjectResponse current = head(leaseKey(lease.key()))
        .filter(head -> lease.leaseId().equals(head.metadata().get(LEASE_ID)))
        .orElseThrow(() -> new LeaseLostException(lease));
    PutObjectRequest request = leaseWrite(lease.key(), lease.leaseId(), lease.duration())
        .ifMatch(current.eTag())
        .build();
    try {
      traced("renewLease", () -> s3.putObject(request, RequestBody.empty()));
    } catch (S3Exception e) {
      if (isPreconditionFailure(e)) {
        throw new LeaseLostException(lease);
      }
      throw new BlobStoreException("Unable to renew lease on " + lease.key(), e);
    }
  }

  @Override
  public void release(LeaseHandle lease) {
    Optional<HeadObjectResponse> current = head(leaseKey(lease.key()));
    if (current.isPresent() && lease.leaseId().equals(current.get().metadata().get(LEASE_ID))) {
      deleteLease(lease.key(), current.get().eTag());
    }
  }

  @Override
  public Map<String, String> getTags(String key) {
    GetObjectTaggingRequest request = GetObjectTaggingRequest.builder()
        .bucket(bucket)
        .key(key)
        .build();
    try {
      Map<String, String> tags = new HashMap<>();
      traced("getTags", () -> s3.getObjectTagging(request))
          .tagSet()
          .forEach(tag -> tags.put(tag.key(), tag.value()));
      return tags;
    } catch (NoSuchKeyException e) {
      return Map.of();
    }
  }

  @Override
  public void setTags(String key, Map<String, String> tags, LeaseHandle lease) {
    checkWritable(key, lease);
    List<Tag> tagSet = tags.entrySet().stream()
        .map(entry -> Tag.builder().key(entry.getKey()).value(entry.getValue()).build())
        .toList();
    PutObjectTaggingRequest request = PutObjectTaggingRequest.builder()
        .bucket(bucket)
        .key(key)
        .tagging(Tagging.builder().tagSet(tagSet).build())
        .build();
    try {
      traced("setTags", () -> s3.putObjectTagging(request));
    } catch (NoSuchKeyException e) {
      throw new BlobNotFoundException(key, e);
    }
  }

  @Override
  public Optional<BlobProperties> getProperties(String key) {
    return head(key).map(head -> new BlobProperties(
        head.contentLength() == null ? 0L : head.contentLength(), leaseState(key)));
  }

  @Override
  public URI locationOf(String key) {
    return locator.apply(key);
  }

  String leaseKey(String key) {
    return leasePrefix + key;
  }

  private PutObjectRequest.Builder leaseWrite(String key, String leaseId, Duration duration) {
    Instant expiresAt = clock.instant().plus(duration);
    return PutObjectRequest.builder()
        .bucket(bucket)
        .key(leaseKey(key))
        .metadata(Map.of(
            LEASE_ID, leaseId,
            EXPIRES_AT, Long.toString(expiresAt.toEpochMilli())));
  }

  private void checkWritable(String key, LeaseHandle lease) {
    Optional<HeadObjectResponse> current = head(leaseKey(key));
    if (current.isEmpty() || stateOf(current.get()) != LeaseState.LOCKED) {
      return;
    }
    if (lease == null || !lease.leaseId().equals(current.get().metadata().get(LEASE_ID))) {
      throw new LeaseConflictException(key);
    }
  }

  private LeaseState leaseState(String key) {
    return head(leaseKey(key)).map(this::stateOf).orElse(LeaseState.UNLOCKED);
  }

  private LeaseState stateOf(HeadObjectResponse lease) {
    String expiresAt = lease.metadata().get(EXPIRES_AT);
    if (expiresAt == null) {
      return LeaseState.EXPIRED;
    }
    Instant expiry = Instant.ofEpochMilli(Long.parseLong(expiresAt));
    return expiry.isAfter(clock.instant()) ? LeaseState.LOCKED : LeaseState.EXPIRED;
  }

  private void deleteEntry(String key) {
    DeleteObjectRequest request = DeleteObjectRequest.builder().bucket(bucket).key(key).build();
    traced("delete", () -> s3.deleteObject(request));
  }

  private void deleteLease(String key, String eTag) {
    DeleteObjectRequest request = DeleteObjectRequest.builder()
        .bucket(bucket)
        .key(leaseKey(key))
        .ifMatch(eTag)
        .build();
    try {
      traced("releaseLease", () -> s3.deleteObject(request));
    } catch (S3Exception e) {
      if (isPreconditionFailure(e) || e.statusCode() == 404) {
        log.info("Lease on {} changed before it was deleted; leaving it", key);
        return;
      }
      throw new BlobStoreException("Unable to delete lease on " + key, e);
    }
  }

  private Optional<HeadObjectResponse> head(String key) {
    HeadObjectRequest request = HeadObjectRequest.builder().bucket(bucket).key(key).build();
    try {
      return Optional.of(traced("head", () -> s3.headObject(request)));
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (S3Exception e) {
      if (e.statusCode() != 404) {
        throw new BlobStoreException("Unable to inspect " + key, e);
      }
      return Optional.empty();
    }
  }

  private <T> T traced(String operation, Supplier<T> call) {
    return tracer.trace(DependencyTracer.BLOB_STORE, operation, call);
  }

  private static boolean isPreconditionFailure(S3Exception e) {
    return e.statusCode() == 412 || e.statusCode() == 409;
  }
}
