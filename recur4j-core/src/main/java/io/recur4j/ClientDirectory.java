package io.recur4j;

import io.recur4j.core.ClientInfo;
import io.recur4j.core.PropertyInfo;

import java.util.Optional;

/**
 * Client and property lookups used to seed converted jobs.
 */
public interface ClientDirectory {

    Optional<ClientInfo> findClient(String clientId);

    Optional<PropertyInfo> findProperty(String propertyId);

    /**
     * Directory that knows nothing; drafts fall back to placeholder names.
     */
    static ClientDirectory none() {
        return new ClientDirectory() {
            @Override
            public Optional<ClientInfo> findClient(String clientId) {
                return Optional.empty();
            }

            @Override
            public Optional<PropertyInfo> findProperty(String propertyId) {
                return Optional.empty();
            }
        };
    }
}
