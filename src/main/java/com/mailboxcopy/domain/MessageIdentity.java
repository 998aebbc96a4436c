package com.mailboxcopy.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Stable identity of a message inside a folder.
 * Derived from the Message-ID header, or from a digest of header fields and size
 * when the header is missing. Never based on IMAP sequence numbers.
 */
@Value
public class MessageIdentity implements Comparable<MessageIdentity> {

    @NonNull
    String value;

    @Override
    public int compareTo(MessageIdentity other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
