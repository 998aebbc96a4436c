package com.mailboxcopy.exception;

/**
 * An established session was dropped by the server or the network
 */
public class SessionLostException extends ConnectionException {

    public SessionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
