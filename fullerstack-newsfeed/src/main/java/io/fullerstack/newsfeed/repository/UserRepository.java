package io.fullerstack.newsfeed.repository;

import io.fullerstack.newsfeed.model.UserData;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous source of the current user's data.
 */
public interface UserRepository {

    /**
     * Fetches the user.
     *
     * @return stage completed with the user, or exceptionally when the fetch fails
     */
    CompletionStage<UserData> getUser();
}
