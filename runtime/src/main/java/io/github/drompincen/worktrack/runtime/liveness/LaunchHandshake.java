package io.github.drompincen.worktrack.runtime.liveness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code worktrack://checkin?...} link that starts the desktop agent and signs it in.
 * The browser side builds and opens it; the agent parses it from its program arguments.
 */
public class LaunchHandshake {

    private static final Logger log = LoggerFactory.getLogger(LaunchHandshake.class);
    public static final String SCHEME = "worktrack";
    public static final String ACTION = "checkin";

    @FunctionalInterface
    public interface Launcher {
        /** Hands the link to the operating system. Returns false when nothing could open it. */
        boolean open(URI link);
    }

    private final Launcher launcher;

    public LaunchHandshake() {
        this(LaunchHandshake::openWithDesktop);
    }

    public LaunchHandshake(Launcher launcher) {
        this.launcher = launcher;
    }

    public boolean send(LaunchRequest request) {
        URI link = buildLink(request);
        try {
            boolean opened = launcher.open(link);
            if (!opened) log.warn("No handler accepted the launch link");
            return opened;
        } catch (RuntimeException e) {
            log.warn("Launch link could not be opened: {}", e.getMessage());
            return false;
        }
    }

    public static URI buildLink(LaunchRequest request) {
        StringBuilder query = new StringBuilder();
        append(query, "credential", request.credential());
        append(query, "userId", request.userId());
        append(query, "name", request.name());
        append(query, "email", request.email());
        append(query, "photoUrl", request.photoUrl());
        return URI.create(SCHEME + "://" + ACTION + "?" + query);
    }

    /** Parses a launch link; anything that is not a check-in link with a credential and user yields empty. */
    public static Optional<LaunchRequest> parse(String link) {
        if (link == null || !link.startsWith(SCHEME + "://")) return Optional.empty();
        URI uri;
        try {
            uri = URI.create(link.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Malformed launch link: {}", e.getMessage());
            return Optional.empty();
        }
        if (!ACTION.equals(uri.getHost()) || uri.getRawQuery() == null) return Optional.empty();

        Map<String, String> params = new HashMap<>();
        for (String pair : uri.getRawQuery().split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) continue;
            params.put(pair.substring(0, eq), URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        String credential = params.get("credential");
        String userId = params.get("userId");
        if (credential == null || credential.isBlank() || userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new LaunchRequest(credential, userId,
                params.getOrDefault("name", ""), params.get("email"), params.get("photoUrl")));
    }

    private static void append(StringBuilder query, String key, String value) {
        if (value == null) return;
        if (query.length() > 0) query.append('&');
        query.append(key).append('=').append(URLEncoder.encode(value, StandardCharsets.UTF_8));
    }

    private static boolean openWithDesktop(URI link) {
        if (!Desktop.isDesktopSupported() || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            return false;
        }
        try {
            Desktop.getDesktop().browse(link);
            return true;
        } catch (Exception e) {
            log.warn("Desktop browse failed: {}", e.getMessage());
            return false;
        }
    }
}
