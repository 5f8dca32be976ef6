package io.fullerstack.newsfeed.repository;

import io.fullerstack.newsfeed.model.NewsItem;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Asynchronous source of news items, in no particular order.
 */
public interface NewsRepository {

    CompletionStage<List<NewsItem>> getNews();
}
