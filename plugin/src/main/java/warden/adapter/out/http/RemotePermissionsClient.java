package warden.adapter.out.http;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.exception.DownstreamApiException;
import warden.core.model.auth.UserPermissions;
import warden.core.port.out.Metrics;
import warden.core.port.out.PermissionsClient;

/**
 * Fetches a caller's customers, roles and permissions from the permissions API.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * GET /customer
 * x-api-key: <api key>
 * Accept: application/json
 * Authorization: Bearer <caller token>
 * }</pre>
 *
 * <p>A 403 means the caller has no customer access and yields empty permissions. Any other
 * non-2xx status, a timeout or a transport failure raises {@link DownstreamApiException}.
 */
public class RemotePermissionsClient implements PermissionsClient {

    private static final Logger LOG = Logger.getLogger(RemotePermissionsClient.class);

    static final String CUSTOMER_PATH = "/customer";
    static final String API_KEY_HEADER = "x-api-key";
    private static final int MAX_LOGGED_BODY_CHARS = 200;

    private final WebClient webClient;
    private final String endpoint;
    private final String apiKey;
    private final Duration timeout;
    private final PermissionsResponseParser parser;
    private final Metrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RemotePermissionsClient(Vertx vertx, WardenConfig config, Metrics metrics) {
        this.webClient = WebClient.create(vertx);
        this.endpoint = stripTrailingSlash(config.permissionsApiUrl()) + CUSTOMER_PATH;
        this.apiKey = config.permissionsApiKey();
        this.timeout = config.permissionsApiTimeout();
        this.parser = new PermissionsResponseParser(config.defaultPermissions());
        this.metrics = metrics;
    }

    @Override
    public Uni<UserPermissions> getUserPermissions(String email, String forwardedToken) {
        final var startTime = System.currentTimeMillis();

        LOG.debugv("Fetching permissions for {0} from {1}", email, endpoint);

        final var request = webClient
                .getAbs(endpoint)
                .putHeader(API_KEY_HEADER, apiKey)
                .putHeader("Accept", "application/json")
                .putHeader("Content-Type", "application/json");
        if (forwardedToken != null && !forwardedToken.isBlank()) {
            request.putHeader("Authorization", "Bearer " + forwardedToken);
        }

        return request.send()
                .ifNoItem()
                .after(timeout)
                .failWith(() -> DownstreamApiException.timeout("Permissions API timeout after " + timeout))
                .onFailure(error -> !(error instanceof DownstreamApiException))
                .transform(RemotePermissionsClient::toDownstreamException)
                .onFailure()
                .invoke(error -> {
                    final var duration = System.currentTimeMillis() - startTime;
                    metrics.recordPermissionsApiCall(0, duration);
                    LOG.warnv("Permissions API call failed for {0} after {1}ms: {2}", email, duration, error.getMessage());
                })
                .map(response -> handleResponse(email, response, startTime));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.debug("Closing permissions API web client");
            webClient.close();
        }
    }

    private UserPermissions handleResponse(String email, HttpResponse<Buffer> response, long startTime) {
        final var status = response.statusCode();
        final var duration = System.currentTimeMillis() - startTime;
        metrics.recordPermissionsApiCall(status, duration);

        if (status == 403) {
            LOG.warnv("Permissions API denied access for {0}, continuing without customers", email);
            return UserPermissions.empty(email);
        }
        if (status < 200 || status >= 300) {
            final var body = truncate(response.bodyAsString());
            LOG.warnv("Permissions API returned status {0} for {1}: {2}", status, email, body);
            if (status == 401) {
                throw DownstreamApiException.status(status, "Permissions API authentication failed");
            }
            throw DownstreamApiException.status(status, "Permissions API returned status " + status);
        }

        final var permissions = parser.parse(email, response.bodyAsString());
        LOG.debugv(
                "Fetched permissions for {0}: customers={1}, roles={2}, permissions={3}, duration={4}ms",
                email,
                permissions.customers().size(),
                permissions.roles().size(),
                permissions.permissions().size(),
                duration);
        return permissions;
    }

    private static Throwable toDownstreamException(Throwable error) {
        if (error instanceof TimeoutException) {
            return DownstreamApiException.timeout("Permissions API timeout: " + error.getMessage());
        }
        return DownstreamApiException.failure("Permissions API request failed: " + error.getMessage(), error);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_LOGGED_BODY_CHARS ? body.substring(0, MAX_LOGGED_BODY_CHARS) + "..." : body;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
