package cloud.keyvault.sdk.encryption;

import cloud.keyvault.sdk.CredentialsConfigurationException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable string option bag handed to a {@link KeyProviderFactory}. Two bags are equal when they hold the same
 * trimmed entries, whatever the insertion order, so a bag can key a provider cache.
 */
public final class KeyProviderOptions {

    private final Map<String, String> values;

    private KeyProviderOptions(Map<String, String> values) {
        this.values = values;
    }

    public static KeyProviderOptions of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        Map<String, String> copy = new TreeMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key.trim(), value.trim());
            }
        });
        return new KeyProviderOptions(Collections.unmodifiableMap(copy));
    }

    /**
     * @return the trimmed value, empty when absent or blank
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key)).filter(value -> !value.isEmpty());
    }

    public String require(String key) {
        return get(key).orElseThrow(() -> new CredentialsConfigurationException("missing option " + key));
    }

    public Optional<Long> getLong(String key) {
        Optional<String> value = get(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.get()));
        } catch (NumberFormatException ex) {
            throw new CredentialsConfigurationException("option " + key + " must be a number: " + value.get(), ex);
        }
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyProviderOptions)) {
            return false;
        }
        return values.equals(((KeyProviderOptions) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.keySet().toString();
    }
}
