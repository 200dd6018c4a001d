package io.github.drompincen.worktrack.runtime.guard;

import io.github.drompincen.worktrack.protocol.api.EmergencyCheckoutRequest;
import io.github.drompincen.worktrack.protocol.api.PresenceUpdateRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Bare HTTP writes against the gateway's store endpoints, authenticated with a credential
 * obtained earlier. Nothing here touches the Mongo client or the Spring context, which may
 * already be shutting down when these calls run.
 */
public class EmergencyCheckoutTransport {

    private static final Logger log = LoggerFactory.getLogger(EmergencyCheckoutTransport.class);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String gatewayUrl;

    public EmergencyCheckoutTransport(String gatewayUrl, ObjectMapper mapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(), gatewayUrl, mapper);
    }

    EmergencyCheckoutTransport(HttpClient client, String gatewayUrl, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
        this.gatewayUrl = gatewayUrl.endsWith("/") ? gatewayUrl.substring(0, gatewayUrl.length() - 1) : gatewayUrl;
    }

    public boolean completeSession(String sessionId, String credential, EmergencyCheckoutRequest body,
                                   Duration timeout) throws IOException, InterruptedException {
        return patch("/api/store/work-sessions/" + encode(sessionId) + "/emergency-checkout",
                credential, body, timeout);
    }

    public boolean markOffline(String userId, String credential, PresenceUpdateRequest body,
                               Duration timeout) throws IOException, InterruptedException {
        return patch("/api/store/presence/" + encode(userId), credential, body, timeout);
    }

    private boolean patch(String path, String credential, Object body, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(gatewayUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + credential)
                .method("PATCH", HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            log.warn("PATCH {} returned HTTP {}", path, response.statusCode());
            return false;
        }
        return true;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
