package warden.config;

import java.util.Map;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jboss.logging.Logger;

/**
 * Builds {@link WardenConfig} from SmallRye Config sources.
 *
 * <p>Default sources are system properties, environment variables and
 * {@code META-INF/microprofile-config.properties}. Environment variables follow the
 * MicroProfile mapping, so {@code WARDEN_CACHE_URL} sets {@code warden.cache-url}.
 */
public final class WardenConfigLoader {

    private static final Logger LOG = Logger.getLogger(WardenConfigLoader.class);
    private static final int OVERRIDE_ORDINAL = 500;

    private WardenConfigLoader() {}

    /**
     * Load configuration from the default sources.
     *
     * @return the validated configuration
     */
    public static WardenConfig fromEnvironment() {
        return load(new SmallRyeConfigBuilder().addDefaultSources());
    }

    /**
     * Load configuration from the default sources with explicit overrides on top.
     *
     * @param overrides property names (e.g., {@code warden.cache-url}) to values
     * @return the validated configuration
     */
    public static WardenConfig fromProperties(Map<String, String> overrides) {
        return load(new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "warden-overrides", OVERRIDE_ORDINAL)));
    }

    private static WardenConfig load(SmallRyeConfigBuilder builder) {
        final SmallRyeConfig config = builder.withMapping(WardenConfig.class).build();
        final var mapping = config.getConfigMapping(WardenConfig.class);
        LOG.infov(
                "Loaded warden configuration (issuer: {0}, cache: {1}, failMode: {2})",
                mapping.issuer(), redact(mapping.cacheUrl()), mapping.failMode());
        return mapping;
    }

    private static String redact(String url) {
        final var at = url.lastIndexOf('@');
        final var scheme = url.indexOf("://");
        if (at < 0 || scheme < 0 || at < scheme) {
            return url;
        }
        return url.substring(0, scheme + 3) + "***" + url.substring(at);
    }
}
