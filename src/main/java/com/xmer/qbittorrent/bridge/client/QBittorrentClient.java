package com.xmer.qbittorrent.bridge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xmer.qbittorrent.bridge.domain.TorrentStatus;
import com.xmer.qbittorrent.bridge.error.ApiContractException;
import com.xmer.qbittorrent.bridge.error.ErrorCodes;
import com.xmer.qbittorrent.bridge.error.NonRetryableException;
import com.xmer.qbittorrent.bridge.error.RetryableException;
import com.xmer.qbittorrent.bridge.util.InfoHash;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Client for the qBittorrent Web API (v2).
 * <p>
 * Holds one session cookie for all calls. When qBittorrent answers 403 the session has expired:
 * the client logs in again once and retries the call once.
 */
@ApplicationScoped
public class QBittorrentClient implements TorrentClient {

    private static final Logger LOG = Logger.getLogger(QBittorrentClient.class);

    static final String LOGIN_PATH = "/api/v2/auth/login";
    static final String ADD_PATH = "/api/v2/torrents/add";
    static final String INFO_PATH = "/api/v2/torrents/info";

    private static final Pattern SID_COOKIE = Pattern.compile("SID=([^;]+)");
    private static final int SESSION_EXPIRED = 403;
    private static final TypeReference<List<TorrentStatus>> STATUS_LIST = new TypeReference<>() {
    };

    private final String baseUrl;
    private final String username;
    private final String password;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    // guarded by this
    private String sid;

    public QBittorrentClient(
            @ConfigProperty(name = "qbittorrent.url") String baseUrl,
            @ConfigProperty(name = "qbittorrent.username") String username,
            @ConfigProperty(name = "qbittorrent.password") String password,
            @ConfigProperty(name = "qbittorrent.request-timeout", defaultValue = "PT10S") Duration requestTimeout,
            ObjectMapper objectMapper
    ) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.username = username;
        this.password = password;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(requestTimeout)
                .build();
    }

    /**
     * Log in and keep the session cookie for subsequent calls.
     *
     * @throws RetryableException    if qBittorrent cannot be reached
     * @throws ApiContractException  if the login call fails or returns no session cookie
     * @throws NonRetryableException if the credentials are rejected
     */
    public synchronized void login() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + LOGIN_PATH))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(formBody(Map.of("username", username, "password", password)))
                .build();

        HttpResponse<String> response;
        try {
            response = send(request);
        } catch (IOException e) {
            throw new RetryableException("Failed to connect to qBittorrent: " + e.getMessage(),
                    ErrorCodes.QBITTORRENT_CONNECTION, Map.of(), e);
        }

        if (!isSuccess(response.statusCode())) {
            throw new ApiContractException("Login request failed", ErrorCodes.LOGIN_FAILED,
                    Map.of("status", response.statusCode()));
        }

        if (!"Ok.".equals(response.body())) {
            throw new NonRetryableException("Invalid qBittorrent credentials", ErrorCodes.INVALID_CREDENTIALS);
        }

        String session = response.headers().allValues("set-cookie").stream()
                .map(SID_COOKIE::matcher)
                .filter(Matcher::find)
                .map(m -> m.group(1))
                .findFirst()
                .orElseThrow(() -> new ApiContractException("No SID cookie in login response", ErrorCodes.NO_SID));

        this.sid = session;
        LOG.info("Logged in to qBittorrent");
    }

    /**
     * Submit a magnet link. The info-hash is derived before any network call, so a malformed link
     * fails without touching qBittorrent.
     *
     * @return the lower-case info-hash of the added torrent
     */
    @Override
    public String addTorrent(String magnetLink, String category) {
        String hash = InfoHash.fromMagnet(magnetLink);

        Map<String, String> form = new LinkedHashMap<>();
        form.put("urls", magnetLink);
        form.put("category", category);

        HttpResponse<String> response = authenticatedRequest(session ->
                HttpRequest.newBuilder(URI.create(baseUrl + ADD_PATH))
                        .timeout(requestTimeout)
                        .header("Cookie", "SID=" + session)
                        .header("Content-Type", "application/x-www-form-urlencoded")
                        .POST(formBody(form))
                        .build());

        if (!isSuccess(response.statusCode())) {
            throw new RetryableException("Failed to add torrent: HTTP " + response.statusCode(),
                    ErrorCodes.ADD_TORRENT, Map.of("status", response.statusCode(), "hash", hash));
        }

        LOG.infof("Torrent added: hash=%s, category=%s", hash, category);
        return hash;
    }

    /**
     * Fetch the current status of the given torrents in one call.
     * Torrents qBittorrent no longer knows are simply missing from the result.
     */
    @Override
    public List<TorrentStatus> getTorrentsInfo(List<String> hashes) {
        if (hashes.isEmpty()) {
            return List.of();
        }

        String hashesParam = URLEncoder.encode(String.join("|", hashes), StandardCharsets.UTF_8);
        URI uri = URI.create(baseUrl + INFO_PATH + "?hashes=" + hashesParam);

        HttpResponse<String> response = authenticatedRequest(session ->
                HttpRequest.newBuilder(uri)
                        .timeout(requestTimeout)
                        .header("Cookie", "SID=" + session)
                        .GET()
                        .build());

        if (!isSuccess(response.statusCode())) {
            throw new RetryableException("Failed to get torrents info: HTTP " + response.statusCode(),
                    ErrorCodes.GET_TORRENTS, Map.of("status", response.statusCode()));
        }

        try {
            return objectMapper.readValue(response.body(), STATUS_LIST);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ApiContractException("Malformed torrents info response", ErrorCodes.MALFORMED_RESPONSE,
                    Map.of(), e);
        }
    }

    synchronized boolean hasSession() {
        return sid != null;
    }

    private HttpResponse<String> authenticatedRequest(Function<String, HttpRequest> requestFactory) {
        String session = currentSession();

        HttpResponse<String> response;
        try {
            response = send(requestFactory.apply(session));
        } catch (IOException e) {
            throw new RetryableException("qBittorrent request failed: " + e.getMessage(),
                    ErrorCodes.QBITTORRENT_CONNECTION, Map.of(), e);
        }

        if (response.statusCode() != SESSION_EXPIRED) {
            return response;
        }

        LOG.warn("Session expired, re-authenticating");
        String renewed = renewSession(session);
        try {
            return send(requestFactory.apply(renewed));
        } catch (IOException e) {
            throw new RetryableException("qBittorrent request failed after re-auth: " + e.getMessage(),
                    ErrorCodes.QBITTORRENT_CONNECTION, Map.of(), e);
        }
    }

    private synchronized String currentSession() {
        if (sid == null) {
            login();
        }
        return sid;
    }

    /**
     * Log in again unless another caller already replaced the expired session.
     */
    private synchronized String renewSession(String expired) {
        if (sid == null || sid.equals(expired)) {
            sid = null;
            login();
        }
        return sid;
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling qBittorrent", e);
        }
    }

    private static HttpRequest.BodyPublisher formBody(Map<String, String> fields) {
        String body = fields.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
