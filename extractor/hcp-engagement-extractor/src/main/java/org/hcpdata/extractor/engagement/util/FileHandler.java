package org.hcpdata.extractor.engagement.util;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;

/**
 * File handling operations interface.
 * Reads source tables and writes outputs on the local filesystem or S3, retrying transient read failures.
 */
public interface FileHandler {

    String S3_PREFIX = "s3://";

    /**
     * Reads the content of a file from the specified source URI.
     * Missing files are not retried.
     *
     * @param source The URI of the source file to read.
     * @return The byte array content of the file.
     * @throws NoSuchFileException If the file or object does not exist.
     * @throws IOException If an I/O error occurs during the read operation.
     */
    @Retryable(retryFor = IOException.class, noRetryFor = NoSuchFileException.class,
        maxAttempts = 5, backoff = @Backoff(delay = 1000, multiplier = 2))
    byte[] read(URI source) throws IOException;

    /**
     * Writes byte data to the specified destination, replacing any existing file.
     * Parent directories of local destinations are created.
     *
     * @param data        The byte array data to write.
     * @param destination The URI of the destination.
     * @return The URI of the written data.
     * @throws IOException If an I/O error occurs during the write.
     */
    String put(byte[] data, URI destination) throws IOException;

    /**
     * Turns a configured location into a URI. {@code s3://bucket/key} locations are taken verbatim, so keys may
     * contain characters such as spaces; other locations with a scheme must already be valid URIs;
     * anything else is a local path, resolved against the working directory.
     *
     * @param location A path or URI string.
     * @return The location as a URI.
     * @throws IllegalArgumentException If the location is not a valid URI.
     */
    static URI toUri(String location) {
        if (location.startsWith(S3_PREFIX)) {
            String bucketAndKey = location.substring(S3_PREFIX.length());
            String bucket = StringUtils.substringBefore(bucketAndKey, "/");
            String key = StringUtils.substringAfter(bucketAndKey, "/");
            try {
                return new URI("s3", bucket, "/" + key, null);
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Invalid S3 location " + location, e);
            }
        }
        if (location.contains("://")) {
            return URI.create(location);
        }
        return Path.of(location).toAbsolutePath().normalize().toUri();
    }
}
