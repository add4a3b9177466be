package io.github.drompincen.shopbench.protocol.api;

public record PlatformConfig(
        String baseUrl,
        String apiKey,
        String model
) {
    public boolean hasBaseUrl() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }

    /** Masks the key so configs can be logged. */
    @Override
    public String toString() {
        String masked = apiKey == null || apiKey.length() < 8
                ? "****"
                : apiKey.substring(0, 4) + "****";
        return "PlatformConfig[baseUrl=" + baseUrl + ", apiKey=" + masked + ", model=" + model + "]";
    }
}
