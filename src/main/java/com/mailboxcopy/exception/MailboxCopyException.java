package com.mailboxcopy.exception;

/**
 * Base of all mailbox-copy failures
 */
public class MailboxCopyException extends RuntimeException {

    public MailboxCopyException(String message) {
        super(message);
    }

    public MailboxCopyException(String message, Throwable cause) {
        super(message, cause);
    }
}
