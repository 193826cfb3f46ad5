package io.chatflow.core.credential;

import java.util.Map;

/// Resolves a credential reference from node configuration into auth material.
///
/// Decryption and storage are owned by the surrounding application. The HTTP
/// node only understands the material keys `api_key`, `username`/`password`
/// and `header_name`/`header_value`.
///
/// @see InMemoryCredentialResolver
@FunctionalInterface
public interface CredentialResolver {

    /// Returns the auth material for a credential.
    ///
    /// @param credentialId the credential reference, not null
    /// @return auth material keyed by field name, never null
    /// @throws CredentialResolutionException if the credential is unknown or unavailable
    Map<String, String> resolve(String credentialId) throws CredentialResolutionException;
}
