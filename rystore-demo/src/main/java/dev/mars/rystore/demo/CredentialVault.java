/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.rystore.demo;

import dev.mars.rystore.storage.RecordStore;
import dev.mars.rystore.storage.StorageKey;
import dev.mars.rystore.storage.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider credentials kept in the {@code auth} namespace of a {@link RecordStore}.
 * <p>
 * The store writes this namespace owner-only and, when a master key is
 * configured, encrypted.
 */
public final class CredentialVault {

    private static final Logger LOG = LoggerFactory.getLogger(CredentialVault.class);

    static final String NAMESPACE = "auth";

    private final RecordStore store;

    public CredentialVault(RecordStore store) {
        this.store = store;
    }

    public Optional<AuthCredential> get(String providerId) {
        return store.read(keyOf(providerId), AuthCredential.class);
    }

    /**
     * All stored credentials by provider id, in provider order.
     */
    public Map<String, AuthCredential> all() {
        Map<String, AuthCredential> result = new LinkedHashMap<>();
        for (StorageKey key : store.list(List.of(NAMESPACE))) {
            if (key.segments().size() != 2) {
                continue;
            }
            // A record removed between list and read is simply skipped
            store.read(key, AuthCredential.class).ifPresent(c -> result.put(key.name(), c));
        }
        return result;
    }

    public void set(String providerId, AuthCredential credential) {
        store.write(keyOf(providerId), credential);
        LOG.info("Stored {} credential for {}", typeOf(credential), providerId);
    }

    public void remove(String providerId) {
        store.remove(keyOf(providerId));
        LOG.info("Removed credential for {}", providerId);
    }

    /**
     * Replaces the credentials of several providers at once: either every
     * entry is stored or none is.
     */
    public void setAll(Map<String, AuthCredential> credentials) {
        try (Transaction tx = store.beginTransaction()) {
            for (Map.Entry<String, AuthCredential> e : credentials.entrySet()) {
                tx.stageWrite(keyOf(e.getKey()), e.getValue());
            }
            tx.commit();
        }
        LOG.info("Stored {} credential(s) in one transaction", credentials.size());
    }

    /**
     * Swaps in a new access token for an OAuth credential, keeping its refresh token.
     *
     * @return the updated credential, or empty if the provider has no credential
     * @throws IllegalStateException if the stored credential is not OAuth
     */
    public Optional<AuthCredential.OAuth> refreshAccess(String providerId, String access, long expires) {
        return store.update(keyOf(providerId), AuthCredential.class, current -> {
            if (!(current instanceof AuthCredential.OAuth)) {
                throw new IllegalStateException(providerId + " has a " + typeOf(current) + " credential, not oauth");
            }
            AuthCredential.OAuth oauth = (AuthCredential.OAuth) current;
            return new AuthCredential.OAuth(oauth.refresh(), access, expires);
        }).map(AuthCredential.OAuth.class::cast);
    }

    static StorageKey keyOf(String providerId) {
        return StorageKey.of(NAMESPACE, providerId);
    }

    static String typeOf(AuthCredential credential) {
        if (credential instanceof AuthCredential.OAuth) {
            return "oauth";
        } else if (credential instanceof AuthCredential.Api) {
            return "api";
        } else if (credential instanceof AuthCredential.WellKnown) {
            return "wellknown";
        }
        throw new IllegalArgumentException("Unknown credential type: " + credential);
    }
}
