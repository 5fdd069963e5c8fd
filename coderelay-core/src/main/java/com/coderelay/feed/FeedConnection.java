package com.coderelay.feed;

import java.io.IOException;

/**
 * One live listener connection, as seen by a {@link FeedSession}. Implemented by the
 * transport (e.g. a websocket endpoint).
 */
public interface FeedConnection {

    void send(String text) throws IOException;

    /**
     * Closes the connection. Must tolerate being called more than once.
     */
    void close();
}
