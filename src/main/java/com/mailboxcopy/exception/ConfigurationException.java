package com.mailboxcopy.exception;

/**
 * Malformed mapping rule, exclusion or account URL.
 * Raised before any mailbox is modified.
 */
public class ConfigurationException extends MailboxCopyException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
