package io.github.drompincen.shopbench.runtime.config;

import io.github.drompincen.shopbench.protocol.api.PlatformConfig;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link PlatformConfig} from {@code <PLATFORM>_BASE_URL},
 * {@code <PLATFORM>_API_KEY} and {@code <PLATFORM>_MODEL} env entries.
 */
@Component
public class PlatformConfigResolver {

    public static final String GEMINI = "GEMINI";
    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Empty when no API key is set, or when a platform other than Gemini has
     * no base URL.
     */
    public Optional<PlatformConfig> resolve(String platformId, Map<String, String> env) {
        if (platformId == null || platformId.isBlank()) return Optional.empty();
        String prefix = platformId.strip().toUpperCase(Locale.ROOT);
        String baseUrl = clean(env.get(prefix + "_BASE_URL"));
        String apiKey = clean(env.get(prefix + "_API_KEY"));
        String model = clean(env.get(prefix + "_MODEL"));

        if (apiKey.isEmpty()) return Optional.empty();
        if (requiresBaseUrl(prefix) && baseUrl.isEmpty()) return Optional.empty();
        if (apiKey.startsWith(BEARER_PREFIX)) {
            apiKey = apiKey.substring(BEARER_PREFIX.length());
        }
        return Optional.of(new PlatformConfig(baseUrl, apiKey, model));
    }

    static String clean(String value) {
        if (value == null) return "";
        String v = value.strip();
        if (v.length() >= 2 && v.charAt(0) == v.charAt(v.length() - 1)
                && (v.charAt(0) == '"' || v.charAt(0) == '\'')) {
            return v.substring(1, v.length() - 1).strip();
        }
        return v;
    }

    private boolean requiresBaseUrl(String platformId) {
        return !GEMINI.equals(platformId);
    }
}
