package com.mailboxcopy.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything one run needs, resolved from the command line
 */
@Value
@Builder
public class CopyRequest {

    Account source;
    Account destination;
    @Singular
    List<String> mappings;      // SRC:DST
    @Singular
    List<String> exclusions;
    Long maxSize;               // Bytes, null for no limit
    boolean dryRun;
    Integer bufferSize;         // Overrides mailboxcopy.transfer.buffer-size when set
}
