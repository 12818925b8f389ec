package org.hcpdata.extractor.engagement.util;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetrySynchronizationManager;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

@Component
public class FileHandlerImpl implements FileHandler {

    private static final Logger logger = LoggerFactory.getLogger(FileHandlerImpl.class);

    private static final String S3 = "s3";
    private final S3Client s3Client;

    public FileHandlerImpl(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public byte[] read(URI source) throws IOException {
        retryLogging();
        if (S3.equals(source.getScheme())) {
            String bucket = source.getHost();
            String key = objectKey(source);
            logger.debug("Reading file from S3 bucket {} key {}", bucket, key);
            try {
                return s3Client.getObjectAsBytes(builder -> builder.bucket(bucket).key(key)).asByteArray();
            } catch (NoSuchKeyException e) {
                NoSuchFileException missing = new NoSuchFileException(source.toString());
                missing.initCause(e);
                throw missing;
            } catch (SdkException e) {
                throw new IOException("Error reading " + source + " from S3", e);
            }
        } else {
            Path sourcePath = Path.of(source);
            logger.debug("Reading local file {}", sourcePath);
            return Files.readAllBytes(sourcePath);
        }
    }

    @Override
    public String put(byte[] data, URI destination) throws IOException {
        if (S3.equals(destination.getScheme())) {
            String bucket = destination.getHost();
            String key = objectKey(destination);
            logger.debug("Uploading {} bytes to S3 bucket {} key {}", data.length, bucket, key);
            try {
                s3Client.putObject(builder -> builder.bucket(bucket).key(key), RequestBody.fromBytes(data));
            } catch (SdkException e) {
                throw new IOException("Error writing " + destination + " to S3", e);
            }
        } else {
            Path destinationPath = Path.of(destination);
            if (destinationPath.getParent() != null) {
                Files.createDirectories(destinationPath.getParent());
            }
            logger.debug("Writing {} bytes to {}", data.length, destinationPath);
            Files.write(destinationPath, data);
        }
        return destination.toString();
    }

    private static String objectKey(URI uri) {
        return StringUtils.removeStart(uri.getPath(), "/");
    }

    private void retryLogging() {
        if (logger.isDebugEnabled()) {
            RetryContext context = RetrySynchronizationManager.getContext();
            if (context != null) {
                logger.debug("Retry number {}", context.getRetryCount());
            }
        }
    }
}
