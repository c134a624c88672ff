package warden.adapter.in.plugin;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.config.WardenConfig.FailMode;
import warden.core.exception.AuthenticationException;
import warden.core.exception.DownstreamApiException;
import warden.core.exception.KeyNotFoundException;
import warden.core.exception.KeySetFetchException;
import warden.core.exception.TokenExpiredException;
import warden.core.exception.TokenValidationException;
import warden.core.model.auth.AuthenticatedIdentity;
import warden.core.model.auth.Credentials;
import warden.core.model.auth.HookContext;
import warden.core.model.auth.PluginResult;
import warden.core.port.out.IdentityCacheStore;
import warden.core.port.out.JwksCache;
import warden.core.port.out.Metrics;
import warden.core.port.out.PermissionsClient;
import warden.core.service.auth.HeaderPropagationService;
import warden.core.service.auth.IdentityResolutionService;

/**
 * Gateway-facing entry point of the identity plugin.
 *
 * <p>Hooks:
 * <ul>
 *   <li>{@link #resolveIdentity(Map)} - authenticate the bearer token and attach the caller's
 *       customers, roles and permissions</li>
 *   <li>{@link #injectHeaders(Map, Map)} - propagate the identity to downstream invocations</li>
 * </ul>
 *
 * <p>Every hook completes with a {@link PluginResult}; failures never escape to the host.
 * Invalid tokens abort the host's authentication chain. Permission lookup failures follow
 * {@code warden.fail-mode}.
 */
public class WardenAuthPlugin {

    private static final Logger LOG = Logger.getLogger(WardenAuthPlugin.class);

    static final String PERMISSIONS_UNAVAILABLE = "Permissions unavailable";
    static final String TOKEN_EXPIRED = "Token expired";
    static final String SHUT_DOWN_CODE = "PLUGIN_SHUT_DOWN";

    private final WardenConfig config;
    private final JwksCache jwksCache;
    private final PermissionsClient permissionsClient;
    private final IdentityCacheStore cacheStore;
    private final IdentityResolutionService identityResolutionService;
    private final HeaderPropagationService headerPropagationService;
    private final Metrics metrics;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shutDown = new AtomicBoolean(false);
    private final AtomicReference<Uni<Void>> pendingInitialization = new AtomicReference<>();

    public WardenAuthPlugin(
            WardenConfig config,
            JwksCache jwksCache,
            PermissionsClient permissionsClient,
            IdentityCacheStore cacheStore,
            IdentityResolutionService identityResolutionService,
            HeaderPropagationService headerPropagationService,
            Metrics metrics) {
        this.config = config;
        this.jwksCache = jwksCache;
        this.permissionsClient = permissionsClient;
        this.cacheStore = cacheStore;
        this.identityResolutionService = identityResolutionService;
        this.headerPropagationService = headerPropagationService;
        this.metrics = metrics;
    }

    /**
     * Load the first key set and check the identity cache.
     *
     * <p>Fails if no key set can be loaded. An unreachable cache is only logged.
     * Concurrent callers share one initialization.
     */
    public Uni<Void> initialize() {
        if (shutDown.get()) {
            return Uni.createFrom().failure(new IllegalStateException("Plugin has been shut down"));
        }
        if (initialized.get()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom()
                .deferred(() -> pendingInitialization.updateAndGet(
                        existing -> existing != null ? existing : createInitialization()));
    }

    private Uni<Void> createInitialization() {
        LOG.infov("Initializing identity plugin for issuer {0}", config.issuer());
        return jwksCache
                .refresh()
                .invoke(keySet -> LOG.infov("Loaded {0} signing keys", keySet.size()))
                .flatMap(keySet -> pingCache())
                .invoke(() -> {
                    initialized.set(true);
                    LOG.infov("Identity plugin initialized (cache: {0}, fail mode: {1})",
                            cacheStore.name(), config.failMode());
                })
                .onFailure()
                .invoke(error -> {
                    pendingInitialization.set(null);
                    LOG.errorv(error, "Identity plugin initialization failed");
                })
                .replaceWithVoid()
                .memoize()
                .indefinitely();
    }

    private Uni<Boolean> pingCache() {
        return cacheStore
                .ping()
                .ifNoItem()
                .after(config.cacheOperationTimeout())
                .recoverWithItem(false)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Identity cache ping failed: {0}", error.getMessage());
                    return false;
                })
                .invoke(reachable -> {
                    if (!reachable) {
                        LOG.warnv("Identity cache {0} unreachable, continuing without it", cacheStore.name());
                    }
                });
    }

    /**
     * Release HTTP clients and the cache connection. Safe to call more than once.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Shutting down identity plugin");
        jwksCache.close();
        permissionsClient.close();
        cacheStore.close();
        initialized.set(false);
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * Resolve the caller's identity from a host payload carrying {@code credentials}.
     */
    public Uni<PluginResult> resolveIdentity(Map<String, ?> payload) {
        return resolveIdentity(Credentials.fromPayload(payload));
    }

    public Uni<PluginResult> resolveIdentity(Credentials credentials) {
        final var token = credentials != null ? credentials.bearerToken() : Optional.<String>empty();
        if (token.isEmpty()) {
            LOG.debug("No bearer token, continuing authentication chain");
            return Uni.createFrom().item(PluginResult.proceed());
        }
        if (shutDown.get()) {
            LOG.warn("Identity requested after shutdown, applying fail mode");
            return Uni.createFrom().item(degrade(SHUT_DOWN_CODE));
        }

        return initialize()
                .flatMap(ignored -> identityResolutionService.resolve(token.get()))
                .map(this::authenticated)
                .onFailure()
                .recoverWithItem(this::handleFailure);
    }

    private PluginResult authenticated(AuthenticatedIdentity identity) {
        metrics.recordAuthSuccess(identity.authMethod());
        LOG.infov("Authenticated {0} with {1} customers", identity.email(), identity.customers().size());
        return PluginResult.authenticated(identity.toGatewayUser(), identity.toMetadata());
    }

    private PluginResult handleFailure(Throwable error) {
        if (error instanceof TokenExpiredException expired) {
            LOG.warn("Token expired");
            metrics.recordAuthFailure(expired.getCode());
            return PluginResult.abort(TOKEN_EXPIRED, expired.getCode());
        }
        if (error instanceof TokenValidationException
                || error instanceof KeySetFetchException
                || error instanceof KeyNotFoundException) {
            final var authError = (AuthenticationException) error;
            LOG.warnv("Authentication rejected: {0}", authError.getMessage());
            metrics.recordAuthFailure(authError.getCode());
            return PluginResult.abort(authError.getMessage(), authError.getCode());
        }
        if (error instanceof DownstreamApiException downstream) {
            LOG.errorv("Permissions API error: {0}", downstream.getMessage());
            return degrade(downstream.getCode());
        }

        LOG.errorv(error, "Unexpected authentication error");
        final var code = error instanceof AuthenticationException authError
                ? authError.getCode()
                : AuthenticationException.DEFAULT_CODE;
        return degrade(code);
    }

    private PluginResult degrade(String code) {
        metrics.recordAuthFailure(code);
        if (config.failMode() == FailMode.CLOSED) {
            return PluginResult.abort(PERMISSIONS_UNAVAILABLE, code);
        }
        LOG.debugv("Continuing without identity due to fail mode: {0}", config.failMode());
        return PluginResult.proceed();
    }

    /**
     * Add identity headers to a downstream invocation payload.
     *
     * @param payload the invocation payload with optional {@code headers}
     * @param context the host request context with {@code metadata}, {@code user} and {@code request_id}
     */
    public Uni<PluginResult> injectHeaders(Map<String, Object> payload, Map<String, ?> context) {
        return injectHeaders(payload, HookContext.fromMap(context));
    }

    public Uni<PluginResult> injectHeaders(Map<String, Object> payload, HookContext context) {
        return Uni.createFrom().item(() -> headerPropagationService
                .inject(payload, context != null ? context : HookContext.fromMap(null))
                .map(PluginResult::modified)
                .orElseGet(PluginResult::proceed));
    }

    /**
     * Tool invocation hook; same behaviour as {@link #injectHeaders(Map, Map)}.
     */
    public Uni<PluginResult> toolPreInvoke(Map<String, Object> payload, Map<String, ?> context) {
        return injectHeaders(payload, context);
    }
}
