package io.fullerstack.newsfeed.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A news entry. Two items are equal when they were published at the same instant.
 *
 * @param publishedAt publication timestamp
 */
public record NewsItem(Instant publishedAt) {

    /** Newest first. */
    public static final Comparator<NewsItem> NEWEST_FIRST =
        Comparator.comparing(NewsItem::publishedAt).reversed();

    public NewsItem {
        Objects.requireNonNull(publishedAt, "publishedAt cannot be null");
    }
}
