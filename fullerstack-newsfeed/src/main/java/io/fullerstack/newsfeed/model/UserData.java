package io.fullerstack.newsfeed.model;

import java.util.Objects;

/**
 * User profile returned by a {@link io.fullerstack.newsfeed.repository.UserRepository}.
 *
 * @param name display name
 */
public record UserData(String name) {

    public UserData {
        Objects.requireNonNull(name, "name cannot be null");
    }
}
