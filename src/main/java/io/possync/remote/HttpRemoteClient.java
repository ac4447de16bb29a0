package io.possync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.possync.config.EngineSettings;
import io.possync.model.Identity;
import io.possync.model.Source;
import io.possync.util.Jsons;
import io.possync.util.RetryPolicy;
import io.possync.util.Sleeper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link RemoteClient} over {@link HttpClient}. Only idempotent reads ({@code /auth/profile},
 * {@code /sync/all}) are retried, on network errors and 502/503/504, with the request retry policy
 * from {@link EngineSettings}.
 */
public final class HttpRemoteClient implements RemoteClient {
    static final String INVALID_RESPONSE = "Invalid response from server";

    private final String baseUrl;
    private final EngineSettings settings;
    private final HttpClient http;
    private final Sleeper sleeper;
    private volatile Runnable unauthorizedListener = () -> {
    };

    public HttpRemoteClient(EngineSettings settings, Sleeper sleeper) {
        this.settings = settings;
        this.baseUrl = settings.baseUrl();
        this.sleeper = sleeper;
        this.http = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public void setUnauthorizedListener(Runnable listener) {
        this.unauthorizedListener = Objects.requireNonNullElse(listener, () -> {
        });
    }

    @Override
    public LoginResponse login(String email, String password) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("email", Identity.normalizeEmail(email));
        body.put("password", password == null ? "" : password.trim());
        HttpResponse<String> response = execute(post("/auth/login", body, null, settings.requestTimeout()),
                RetryPolicy.none(), true);
        JsonNode root = parse(response);
        JsonNode user = root.path("user");
        String token = root.path("token").asText("");
        if (!user.isObject() || token.isBlank()) {
            throw new AuthorityException(response.statusCode(), INVALID_RESPONSE, response.body());
        }
        return new LoginResponse(identityOf(response, user), token, Source.REMOTE);
    }

    @Override
    public RegistrationResult register(RegistrationRequest request) {
        request.requireValid();
        HttpResponse<String> response;
        try {
            response = execute(post("/auth/register", request.toWire(), null, settings.requestTimeout()),
                    RetryPolicy.none(), true);
        } catch (AuthorityException e) {
            throw new AuthorityException(e.status(), registrationMessage(e), e.body());
        } catch (NetworkException e) {
            String message = e.getCause() instanceof HttpTimeoutException
                    ? "Request timeout. Please try again."
                    : "Cannot connect to server. Registration requires internet connection.";
            throw new NetworkException(message, e.getCause());
        }
        JsonNode root = parse(response);
        JsonNode user = root.path("user");
        if (!user.isObject()) {
            throw new AuthorityException(response.statusCode(), INVALID_RESPONSE, response.body());
        }
        String message = root.path("message").asText("");
        return new RegistrationResult(identityOf(response, user).withoutCredential(),
                message.isBlank() ? RegistrationResult.DEFAULT_MESSAGE : message);
    }

    private static String registrationMessage(AuthorityException e) {
        String fromBody = WireCodec.errorMessage(readTreeOrNull(e.body()));
        return switch (e.status()) {
            case 400 -> fromBody == null ? "Invalid registration data" : fromBody;
            case 409 -> fromBody == null
                    ? "An account with this email already exists. Please use a different email or try signing in."
                    : fromBody;
            case 503 -> "Server is temporarily unavailable. Please try again in a moment.";
            case 500 -> "Server error. Please try again later.";
            default -> fromBody == null ? "Server error (" + e.status() + ")" : fromBody;
        };
    }

    @Override
    public void logout(String token) {
        execute(post("/auth/logout", Jsons.mapper().createObjectNode(), token, settings.logoutTimeout()),
                RetryPolicy.none(), false);
    }

    @Override
    public Identity getProfile(String token) {
        HttpResponse<String> response = execute(get("/auth/profile", token, settings.requestTimeout()),
                settings.requestRetryPolicy(), true);
        JsonNode root = parse(response);
        JsonNode user = root.has("user") ? root.path("user") : root;
        if (!user.isObject()) {
            throw new AuthorityException(response.statusCode(), INVALID_RESPONSE, response.body());
        }
        return identityOf(response, user).withoutCredential();
    }

    @Override
    public HealthResponse health() {
        HttpResponse<String> response = execute(get("/health", null, settings.healthTimeout()),
                RetryPolicy.none(), false);
        JsonNode root = parse(response);
        return new HealthResponse(
                root.path("status").asText(""),
                root.path("database").asText(""),
                root.path("timestamp").asText("")
        );
    }

    @Override
    public SyncPayload pullAll(String token) {
        HttpResponse<String> response = execute(get("/sync/all", token, settings.requestTimeout()),
                settings.requestRetryPolicy(), true);
        JsonNode root = parse(response);
        try {
            return WireCodec.payload(root);
        } catch (IllegalArgumentException e) {
            throw new AuthorityException(response.statusCode(), INVALID_RESPONSE + ": " + e.getMessage(), response.body());
        }
    }

    private HttpRequest get(String path, String token, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        bearer(builder, token);
        return builder.build();
    }

    private HttpRequest post(String path, JsonNode body, String token, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8));
        bearer(builder, token);
        return builder.build();
    }

    private static void bearer(HttpRequest.Builder builder, String token) {
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
    }

    private HttpResponse<String> execute(HttpRequest request, RetryPolicy policy, boolean notifyUnauthorized) {
        String label = request.method() + " " + request.uri().getPath();
        int attempt = 0;
        while (true) {
            attempt++;
            HttpResponse<String> response;
            try {
                response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (IOException e) {
                if (policy.hasAttemptAfter(attempt)) {
                    pause(policy.delayAfterAttempt(attempt), label);
                    continue;
                }
                throw new NetworkException(label + " failed: " + describe(e), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException(label + " interrupted", e);
            }
            int status = response.statusCode();
            if (status / 100 == 2) {
                return response;
            }
            if ((status == 401 || status == 403) && notifyUnauthorized) {
                unauthorizedListener.run();
            }
            if (isTransientStatus(status) && policy.hasAttemptAfter(attempt)) {
                pause(policy.delayAfterAttempt(attempt), label);
                continue;
            }
            String message = WireCodec.errorMessage(readTreeOrNull(response.body()));
            throw new AuthorityException(status, message == null ? label + " returned HTTP " + status : message,
                    response.body());
        }
    }

    private void pause(long millis, String label) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(label + " interrupted during backoff", e);
        }
    }

    private static boolean isTransientStatus(int status) {
        return status == 502 || status == 503 || status == 504;
    }

    private static String describe(IOException e) {
        if (e instanceof HttpTimeoutException) {
            return "timed out";
        }
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static JsonNode parse(HttpResponse<String> response) {
        JsonNode root = readTreeOrNull(response.body());
        if (root == null || !root.isObject()) {
            throw new AuthorityException(response.statusCode(), INVALID_RESPONSE, response.body());
        }
        return root;
    }

    private static JsonNode readTreeOrNull(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return Jsons.mapper().readTree(body);
        } catch (IOException e) {
            return null;
        }
    }

    private static Identity identityOf(HttpResponse<String> response, JsonNode user) {
        try {
            return WireCodec.identity(user);
        } catch (IllegalArgumentException e) {
            throw new AuthorityException(response.statusCode(), INVALID_RESPONSE + ": " + e.getMessage(), response.body());
        }
    }
}
