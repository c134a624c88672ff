package warden.core.service.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.model.auth.AuthenticatedIdentity;
import warden.core.model.auth.HookContext;

/**
 * Adds identity headers to downstream invocation payloads.
 *
 * <h2>Headers</h2>
 * <ul>
 *   <li>{@code X-User-Email} - the authenticated email</li>
 *   <li>{@code X-User-Customers} - JSON array of customer ids, e.g. {@code ["cloud-001","cloud-002"]}</li>
 *   <li>{@code X-Request-ID} - the request id, when the context carries one</li>
 * </ul>
 *
 * <p>Only requests authenticated by this plugin are touched. Existing payload headers are kept;
 * injected headers replace entries with the same name.
 */
public class HeaderPropagationService {

    private static final Logger LOG = Logger.getLogger(HeaderPropagationService.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String EMAIL_HEADER = "X-User-Email";
    public static final String CUSTOMERS_HEADER = "X-User-Customers";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String HEADERS_KEY = "headers";

    private final boolean enabled;

    public HeaderPropagationService(WardenConfig config) {
        this.enabled = config.enableHeaderPropagation();
    }

    /**
     * Build the payload with identity headers merged in.
     *
     * @param payload the invocation payload, may be null
     * @param context the request context
     * @return the replacement payload, or empty when nothing should be injected
     */
    public Optional<Map<String, Object>> inject(Map<String, Object> payload, HookContext context) {
        if (!enabled) {
            return Optional.empty();
        }
        if (!context.authMethod().map(AuthenticatedIdentity.AUTH_METHOD::equals).orElse(false)) {
            return Optional.empty();
        }
        final var email = context.userEmail();
        if (email.isEmpty()) {
            LOG.debug("No user email in context, skipping header propagation");
            return Optional.empty();
        }

        final var headers = new LinkedHashMap<String, Object>();
        if (payload != null && payload.get(HEADERS_KEY) instanceof Map<?, ?> existing) {
            existing.forEach((name, value) -> headers.put(String.valueOf(name), value));
        }
        headers.put(EMAIL_HEADER, email.get());
        headers.put(CUSTOMERS_HEADER, encode(context));
        context.requestIdValue().ifPresent(requestId -> headers.put(REQUEST_ID_HEADER, requestId));

        final Map<String, Object> modified = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        modified.put(HEADERS_KEY, headers);
        LOG.debugv("Injected identity headers for {0}", email.get());
        return Optional.of(modified);
    }

    private static String encode(HookContext context) {
        try {
            return OBJECT_MAPPER.writeValueAsString(context.customers());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode customer ids", e);
        }
    }
}
