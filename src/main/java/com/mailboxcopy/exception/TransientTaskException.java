package com.mailboxcopy.exception;

/**
 * Fetch, append or timeout failure affecting a single message
 */
public class TransientTaskException extends MailboxCopyException {

    public TransientTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
