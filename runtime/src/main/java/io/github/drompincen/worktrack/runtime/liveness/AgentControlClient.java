package io.github.drompincen.worktrack.runtime.liveness;

import io.github.drompincen.worktrack.protocol.api.AgentResponse;
import io.github.drompincen.worktrack.protocol.api.AgentStatusResponse;
import io.github.drompincen.worktrack.protocol.api.CheckInRequest;
import io.github.drompincen.worktrack.protocol.api.RefreshRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/** HTTP client for the desktop agent's loopback control API. */
public class AgentControlClient {

    private static final Logger log = LoggerFactory.getLogger(AgentControlClient.class);
    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(2);
    static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public AgentControlClient(String baseUrl, ObjectMapper mapper) {
        this(HttpClient.newBuilder().connectTimeout(PROBE_TIMEOUT).build(), baseUrl, mapper);
    }

    AgentControlClient(HttpClient client, String baseUrl, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public Optional<AgentStatusResponse> status() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/status"))
                .timeout(PROBE_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) return Optional.empty();
            return Optional.of(mapper.readValue(response.body(), AgentStatusResponse.class));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (Exception e) {
            log.debug("Agent probe failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean probe() {
        return status().map(AgentStatusResponse::running).orElse(false);
    }

    public AgentResponse checkIn(CheckInRequest body) {
        return post("/checkin", body);
    }

    public AgentResponse refresh(String credential) {
        return post("/refresh", new RefreshRequest(credential));
    }

    private AgentResponse post(String path, Object body) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(COMMAND_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.body() == null || response.body().isBlank()) {
                return AgentResponse.failure("HTTP " + response.statusCode());
            }
            return mapper.readValue(response.body(), AgentResponse.class);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AgentResponse.failure("interrupted");
        } catch (Exception e) {
            log.warn("Agent call {} failed: {}", path, e.getMessage());
            return AgentResponse.failure(e.getMessage());
        }
    }
}
