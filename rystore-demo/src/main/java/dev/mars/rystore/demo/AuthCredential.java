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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Credentials for one AI provider, stored under {@code auth/<providerId>}.
 * <p>
 * Serialized with a {@code type} discriminator:
 * <pre>
 * {"type":"oauth","refresh":"...","access":"...","expires":1767225600000}
 * {"type":"api","key":"sk-..."}
 * {"type":"wellknown","key":"...","token":"..."}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AuthCredential.OAuth.class, name = "oauth"),
        @JsonSubTypes.Type(value = AuthCredential.Api.class, name = "api"),
        @JsonSubTypes.Type(value = AuthCredential.WellKnown.class, name = "wellknown")
})
public sealed interface AuthCredential permits AuthCredential.OAuth, AuthCredential.Api, AuthCredential.WellKnown {

    /**
     * OAuth refresh/access token pair.
     *
     * @param refresh refresh token
     * @param access  current access token
     * @param expires access token expiry, epoch millis
     */
    record OAuth(String refresh, String access, long expires) implements AuthCredential {
        public OAuth {
            Objects.requireNonNull(refresh, "refresh");
            Objects.requireNonNull(access, "access");
        }

        public boolean isExpired(long nowMillis) {
            return nowMillis >= expires;
        }
    }

    /** Static API key. */
    record Api(String key) implements AuthCredential {
        public Api {
            Objects.requireNonNull(key, "key");
        }
    }

    /** Key and token obtained from a provider's well-known endpoint. */
    record WellKnown(String key, String token) implements AuthCredential {
        public WellKnown {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(token, "token");
        }
    }
}
