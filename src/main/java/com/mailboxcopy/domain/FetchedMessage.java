package com.mailboxcopy.domain;

import jakarta.mail.Flags;
import lombok.ToString;
import lombok.Value;

import java.util.Date;

/**
 * Raw message content fetched from the source, with the attributes kept on append
 */
@Value
public class FetchedMessage {

    MessageInfo info;
    @ToString.Exclude
    byte[] content;
    Flags flags;          // Without \Recent
    Date internalDate;
}
