package com.nextride.backend.client;

public interface FeedApi {

    /**
     * Downloads the raw protobuf payload published at {@code url}.
     *
     * @throws com.nextride.backend.exception.FeedFetchException when the feed cannot be retrieved
     */
    byte[] getFeed(String url);
}
