package com.mailboxcopy.domain;

/**
 * Transport security of an IMAP connection
 */
public enum SecurityMode {
    PLAIN(143),
    IMPLICIT_TLS(993),
    STARTTLS(143);

    private final int defaultPort;

    SecurityMode(int defaultPort) {
        this.defaultPort = defaultPort;
    }

    public int getDefaultPort() {
        return defaultPort;
    }
}
