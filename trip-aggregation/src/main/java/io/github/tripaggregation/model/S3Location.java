package io.github.tripaggregation.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Location of an object in the object store.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableS3Location.class)
@JsonDeserialize(as = ImmutableS3Location.class)
public interface S3Location {

  /**
   * The URI scheme of object store locations.
   */
  String SCHEME = "s3://";

  /**
   * Bucket name.
   *
   * @return the bucket
   */
  String bucket();

  /**
   * Object key.
   *
   * @return the key
   */
  String key();

  /**
   * Location from bucket and key.
   *
   * @param bucket the bucket
   * @param key    the key
   * @return the location
   */
  static S3Location of(final String bucket, final String key) {
    return ImmutableS3Location.builder().bucket(bucket).key(key).build();
  }

  /**
   * Parse a location of the form {@code s3://bucket/path/to/key}.
   *
   * @param uri the uri
   * @return the location
   */
  static S3Location parse(final String uri) {
    if (uri == null || !uri.startsWith(SCHEME)) {
      throw new IllegalArgumentException("Not an s3 location: " + uri);
    }
    final String path = uri.substring(SCHEME.length());
    final int slash = path.indexOf('/');
    if (slash <= 0 || slash == path.length() - 1) {
      throw new IllegalArgumentException("Location has no bucket or key: " + uri);
    }
    return of(path.substring(0, slash), path.substring(slash + 1));
  }

  /**
   * Uri string.
   *
   * @return the uri
   */
  default String toUri() {
    return SCHEME + bucket() + "/" + key();
  }
}
