package com.mailboxcopy.domain;

import lombok.Value;

/**
 * One listed message
 */
@Value
public class MessageInfo {

    MessageIdentity identity;
    long uid;    // Only meaningful in the listed folder, during this run
    long size;   // RFC822 size in bytes
}
