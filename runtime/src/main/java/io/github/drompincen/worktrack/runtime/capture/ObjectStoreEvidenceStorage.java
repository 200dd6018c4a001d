package io.github.drompincen.worktrack.runtime.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Uploads evidence frames to an object-store bucket over its REST API.
 * Objects are named {@code {prefix}_{userId}_{epochMillis}.jpg}; one attempt, no retry.
 */
public class ObjectStoreEvidenceStorage implements EvidenceStorage {

    private static final Logger log = LoggerFactory.getLogger(ObjectStoreEvidenceStorage.class);
    static final int MIN_UPLOAD_BYTES = 100;

    private final HttpClient client;
    private final String baseUrl;
    private final String bucket;
    private final String apiKey;
    private final Duration requestTimeout;
    private final Clock clock;

    public ObjectStoreEvidenceStorage(String baseUrl, String bucket, String apiKey, Duration requestTimeout, Clock clock) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                baseUrl, bucket, apiKey, requestTimeout, clock);
    }

    ObjectStoreEvidenceStorage(HttpClient client, String baseUrl, String bucket, String apiKey,
                               Duration requestTimeout, Clock clock) {
        this.client = client;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.bucket = bucket;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
    }

    @Override
    public Optional<String> upload(byte[] jpeg, String prefix, String userId) {
        if (jpeg == null || jpeg.length < MIN_UPLOAD_BYTES) {
            log.warn("Skipping {} upload for {}: {} bytes", prefix, userId, jpeg == null ? 0 : jpeg.length);
            return Optional.empty();
        }
        String name = objectName(prefix, userId);
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/storage/v1/object/" + bucket + "/" + name))
                .timeout(requestTimeout)
                .header("Content-Type", "image/jpeg")
                .header("x-upsert", "true")
                .POST(HttpRequest.BodyPublishers.ofByteArray(jpeg));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
            request.header("apikey", apiKey);
        }
        try {
            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.warn("Upload of {} failed with HTTP {}: {}", name, response.statusCode(), response.body());
                return Optional.empty();
            }
            log.debug("Uploaded {} ({} bytes)", name, jpeg.length);
            return Optional.of(publicUrl(name));
        } catch (IOException e) {
            log.warn("Upload of {} failed: {}", name, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Upload of {} interrupted", name);
            return Optional.empty();
        }
    }

    String objectName(String prefix, String userId) {
        return prefix + "_" + userId + "_" + clock.millis() + ".jpg";
    }

    String publicUrl(String name) {
        return baseUrl + "/storage/v1/object/public/" + bucket + "/" + name;
    }
}
