package io.chatflow.core.credential;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// Credential resolver backed by an immutable in-memory map.
///
/// ### Flat key layout
/// {@link #fromFlatCredentials(Map)} groups flat keys into credentials:
/// - `weather.api_key=abc` becomes credential `weather` with field `api_key`
/// - `OPENWEATHER_API_KEY=abc` (no dot) becomes credential `OPENWEATHER_API_KEY`
///   with the single field `api_key`
///
/// @implNote Immutable and thread-safe.
public final class InMemoryCredentialResolver implements CredentialResolver {

    private final Map<String, Map<String, String>> credentials;

    public InMemoryCredentialResolver(Map<String, Map<String, String>> credentials) {
        Map<String, Map<String, String>> copy = new HashMap<>();
        credentials.forEach((id, material) -> copy.put(id, Map.copyOf(material)));
        this.credentials = Map.copyOf(copy);
    }

    /// Groups flat `id.field=value` entries into credentials.
    ///
    /// @param flat flat credential entries, not null
    /// @return resolver over the grouped credentials, never null
    public static InMemoryCredentialResolver fromFlatCredentials(Map<String, String> flat) {
        Map<String, Map<String, String>> grouped = new HashMap<>();
        flat.forEach(
                (key, value) -> {
                    int dot = key.indexOf('.');
                    if (dot > 0 && dot < key.length() - 1) {
                        grouped.computeIfAbsent(key.substring(0, dot), id -> new HashMap<>())
                                .put(key.substring(dot + 1), value);
                    } else {
                        grouped.computeIfAbsent(key, id -> new HashMap<>()).put("api_key", value);
                    }
                });
        return new InMemoryCredentialResolver(grouped);
    }

    @Override
    public Map<String, String> resolve(String credentialId) throws CredentialResolutionException {
        Objects.requireNonNull(credentialId, "credentialId must not be null");
        Map<String, String> material = credentials.get(credentialId);
        if (material == null) {
            throw new CredentialResolutionException("Credential not found: " + credentialId);
        }
        return material;
    }

    public boolean contains(String credentialId) {
        return credentials.containsKey(credentialId);
    }
}
