package com.servicevault.identifier.app.service;

import java.time.Duration;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/** Presigned S3 GET links for documents stored in the document bucket. */
@Log4j2
public class S3DocumentLinkSigner implements DocumentLinkSigner {

  private final S3Presigner presigner;
  private final String bucket;
  private final Duration ttl;

  public S3DocumentLinkSigner(S3Presigner presigner, String bucket, Duration ttl) {
    this.presigner = Objects.requireNonNull(presigner, "S3Presigner must not be null");
    this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
    this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
  }

  @Override
  public String downloadUrl(String path) {
    if (path == null || path.isBlank()) return null;
    String key = path.startsWith("/") ? path.substring(1) : path;

    GetObjectRequest get = GetObjectRequest.builder().bucket(bucket).key(key).build();
    GetObjectPresignRequest presign =
        GetObjectPresignRequest.builder().signatureDuration(ttl).getObjectRequest(get).build();
    try {
      return presigner.presignGetObject(presign).url().toString();
    } catch (SdkException e) {
      // documents stay listed without a link
      log.warn("s3.presign failed bucket={} key={} err={}", bucket, key, e.getMessage());
      return null;
    }
  }
}
