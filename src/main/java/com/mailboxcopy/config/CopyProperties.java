package com.mailboxcopy.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * mailbox-copy configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "mailboxcopy")
public class CopyProperties {

    /**
     * Mapping rules (SRC:DST) applied after the ones given on the command line
     */
    private List<String> defaultMappings = new ArrayList<>();

    private Imap imap = new Imap();
    private Transfer transfer = new Transfer();

    @Data
    public static class Imap {
        private long connectionTimeout = 30000L;
        private long timeout = 120000L;
        private long writeTimeout = 120000L;
        private boolean checkServerIdentity = true;
        private boolean debug = false;
    }

    @Data
    public static class Transfer {
        private int bufferSize = 10;        // Fetched messages waiting for append
        private int fetchChunkSize = 1000;  // Messages per header FETCH while listing
        private int reconnectAttempts = 1;  // Per connection loss
        private long shutdownGraceMs = 30000L;
    }
}
