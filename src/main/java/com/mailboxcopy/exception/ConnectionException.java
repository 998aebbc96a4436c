package com.mailboxcopy.exception;

/**
 * Authentication failure or unreachable server
 */
public class ConnectionException extends MailboxCopyException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
