package com.scriptdeck.runner.stream;

import java.io.IOException;

/**
 * One live viewer connection, reduced to what the broadcaster needs:
 * send a text message, close the connection.
 */
public interface ViewerChannel {

    String id();

    void send(String message) throws IOException;

    void close() throws IOException;
}
