package com.costguard.anomaly.report;

import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.DetectionRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Writes each run as a JSON document under {@code {prefix}/{yyyy-MM-dd_HH-mm-ss}-{runId}.json}.
 * Keys sort chronologically, which {@link #findLatest()} relies on.
 */
public class S3AnomalyReportRepository implements AnomalyReportRepository {

    private static final Logger log = LoggerFactory.getLogger(S3AnomalyReportRepository.class);
    private static final DateTimeFormatter KEY_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss").withZone(ZoneOffset.UTC);

    private final S3Client client;
    private final ObjectMapper objectMapper;
    private final String bucket;
    private final String prefix;

    public S3AnomalyReportRepository(S3Client client, ObjectMapper objectMapper, CostGuardProperties.Storage storage) {
        if (!storage.hasBucket()) {
            throw new IllegalArgumentException("bucket must be provided");
        }
        this.client = client;
        this.objectMapper = objectMapper;
        this.bucket = storage.bucket();
        this.prefix = storage.prefix().endsWith("/") ? storage.prefix().substring(0, storage.prefix().length() - 1) : storage.prefix();
    }

    @Override
    public void append(DetectionRun run) {
        String key = keyFor(run);
        String body;
        try {
            body = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(run);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize detection run " + run.runId(), ex);
        }
        try {
            client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType("application/json")
                            .build(),
                    RequestBody.fromString(body));
        } catch (SdkException ex) {
            throw new IllegalStateException("Failed to store detection run at s3://" + bucket + "/" + key, ex);
        }
        log.info("anomaly_report stored location=s3://{}/{}", bucket, key);
    }

    @Override
    public Optional<DetectionRun> findLatest() {
        try {
            Optional<String> latestKey = client.listObjectsV2Paginator(ListObjectsV2Request.builder()
                            .bucket(bucket)
                            .prefix(prefix + "/")
                            .build())
                    .contents()
                    .stream()
                    .map(S3Object::key)
                    .filter(key -> key.endsWith(".json"))
                    .max(Comparator.naturalOrder());
            if (latestKey.isEmpty()) {
                return Optional.empty();
            }
            ResponseBytes<GetObjectResponse> bytes = client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(latestKey.get())
                    .build());
            return Optional.of(objectMapper.readValue(bytes.asByteArray(), DetectionRun.class));
        } catch (SdkException ex) {
            throw new IllegalStateException("Failed to read detection runs from s3://" + bucket + "/" + prefix, ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to parse stored detection run", ex);
        }
    }

    String keyFor(DetectionRun run) {
        return prefix + "/" + KEY_TIMESTAMP.format(run.detectedAt()) + "-" + run.runId() + ".json";
    }
}
