package cloud.keyvault.sdk.auth;

/**
 * Audience a token must be valid for, e.g. {@code https://vault.azure.net}.
 *
 * @param resource resource identifier as configured
 */
public record ResourceScope(String resource) {

    static final String DEFAULT_SUFFIX = "/.default";

    public static final ResourceScope AZURE_KEY_VAULT = new ResourceScope("https://vault.azure.net");

    public ResourceScope {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must be non-empty");
        }
        resource = resource.trim();
    }

    public static ResourceScope of(String resource) {
        return new ResourceScope(resource);
    }

    /**
     * @return the {@code scope} parameter understood by v2.0 token endpoints
     */
    public String toScopeParameter() {
        if (resource.endsWith(DEFAULT_SUFFIX)) {
            return resource;
        }
        String base = resource.endsWith("/") ? resource.substring(0, resource.length() - 1) : resource;
        return base + DEFAULT_SUFFIX;
    }

    @Override
    public String toString() {
        return resource;
    }
}
