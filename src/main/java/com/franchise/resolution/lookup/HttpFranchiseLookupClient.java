package com.franchise.resolution.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.franchise.resolution.api.FranchiseLookup;
import com.franchise.resolution.core.model.ResolutionResult;
import com.franchise.resolution.rules.KeyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@link FranchiseLookup} backed by the franchise HTTP API.
 *
 * <p>Authenticates with e-mail and password against {@code POST /api/login} and caches the
 * returned token until one minute before it expires. Lookups call
 * {@code GET /api/franchise-retrieve/{fid}/{oid}}; a 401 drops the token and retries once.</p>
 *
 * <ul>
 *   <li>404 - {@link ResolutionResult#notFound()}</li>
 *   <li>other non-2xx, I/O error, missing credentials - {@link LookupException}</li>
 * </ul>
 *
 * <pre>
 * HttpFranchiseLookupClient client = HttpFranchiseLookupClient.builder()
 *     .baseUrl("https://franchise.example.com")
 *     .email(email)
 *     .password(password)
 *     .build();
 * </pre>
 */
public class HttpFranchiseLookupClient implements FranchiseLookup {
    private static final Logger log = LoggerFactory.getLogger(HttpFranchiseLookupClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration TOKEN_REFRESH_MARGIN = Duration.ofSeconds(60);
    private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-]\\d{2})(\\d{2})$");

    private final String baseUrl;
    private final String email;
    private final String password;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final KeyNormalizer normalizer;
    private final Clock clock;

    private CachedToken cachedToken;

    private HttpFranchiseLookupClient(Builder builder) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(builder.baseUrl, "baseUrl is required"));
        this.email = builder.email;
        this.password = builder.password;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
        this.normalizer = builder.normalizer != null ? builder.normalizer : KeyNormalizer.digitsOnly();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    @Override
    public ResolutionResult lookup(String franchiseId, String outletId) {
        String fid = normalizer.cleanId(franchiseId);
        String oid = normalizer.cleanId(outletId);
        if (fid.isEmpty() || oid.isEmpty()) {
            return ResolutionResult.notFound();
        }
        return fetch(fid, oid, false);
    }

    @Override
    public boolean isAvailable() {
        try {
            currentToken();
            return true;
        } catch (LookupException e) {
            log.debug("Franchise API not available: {}", e.getMessage());
            return false;
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private ResolutionResult fetch(String fid, String oid, boolean retrying) {
        String token = currentToken();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/franchise-retrieve/" + encode(fid) + "/" + encode(oid)
                        + "?api_token=" + encode(token)))
                .timeout(timeout)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response = send(request);
        int status = response.statusCode();

        if (status == 401) {
            invalidateToken();
            if (!retrying) {
                log.debug("Franchise API token rejected, retrying with a fresh token");
                return fetch(fid, oid, true);
            }
            throw new LookupException("Franchise API rejected the refreshed token", status);
        }
        if (status == 404) {
            return ResolutionResult.notFound();
        }
        if (status < 200 || status >= 300) {
            throw new LookupException("Franchise lookup returned status " + status, status);
        }

        try {
            return parseLookupResponse(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            throw new LookupException("Malformed franchise lookup response", e);
        }
    }

    /**
     * Extracts names from a lookup response: {@code name} is the franchise name; the outlet
     * name comes from the first element of {@code outlets} carrying a {@code name} field, or
     * from {@code outlets.name} when {@code outlets} is an object.
     */
    static ResolutionResult parseLookupResponse(JsonNode root) {
        if (root == null || !root.isObject()) {
            return ResolutionResult.notFound();
        }
        String franchiseName = textOrNull(root.get("name"));

        String outletName = null;
        JsonNode outlets = root.get("outlets");
        if (outlets != null && outlets.isArray()) {
            for (JsonNode outlet : outlets) {
                if (outlet.isObject() && outlet.has("name")) {
                    outletName = textOrNull(outlet.get("name"));
                    break;
                }
            }
        } else if (outlets != null && outlets.isObject()) {
            outletName = textOrNull(outlets.get("name"));
        }

        return ResolutionResult.of(franchiseName, outletName);
    }

    private synchronized String currentToken() {
        if (isBlank(email) || isBlank(password)) {
            throw new LookupException("Franchise API credentials missing");
        }
        if (cachedToken != null && clock.instant().isBefore(cachedToken.expiresAt().minus(TOKEN_REFRESH_MARGIN))) {
            return cachedToken.token();
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(new LoginRequest(email, password));
        } catch (JsonProcessingException e) {
            throw new LookupException("Unable to encode login request", e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/login"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response = send(request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new LookupException("Franchise API login failed with status " + response.statusCode(),
                    response.statusCode());
        }

        LoginResponse login;
        try {
            login = objectMapper.readValue(response.body(), LoginResponse.class);
        } catch (JsonProcessingException e) {
            throw new LookupException("Malformed franchise API login response", e);
        }
        if (isBlank(login.apiToken()) || isBlank(login.expiresAt())) {
            throw new LookupException("Franchise API login response missing api_token or expires_at");
        }

        cachedToken = new CachedToken(login.apiToken(), parseExpiry(login.expiresAt()));
        log.debug("Franchise API token refreshed, expires at {}", cachedToken.expiresAt());
        return cachedToken.token();
    }

    private synchronized void invalidateToken() {
        cachedToken = null;
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LookupException("Franchise API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LookupException("Franchise API call interrupted", e);
        }
    }

    static Instant parseExpiry(String value) {
        String cleaned = COMPACT_OFFSET.matcher(value.trim()).replaceFirst("$1:$2");
        try {
            return OffsetDateTime.parse(cleaned).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(cleaned.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw new LookupException("Unable to parse franchise API token expiry: " + value, inner);
            }
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String trimmed = node.asText().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String email;
        private String password;
        private Duration timeout;
        private HttpClient httpClient;
        private KeyNormalizer normalizer;
        private Clock clock;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder normalizer(KeyNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public HttpFranchiseLookupClient build() {
            return new HttpFranchiseLookupClient(this);
        }
    }

    private record CachedToken(String token, Instant expiresAt) {}

    private record LoginRequest(String email, String password) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record LoginResponse(
            @JsonProperty("api_token") String apiToken,
            @JsonProperty("expires_at") String expiresAt
    ) {}
}
