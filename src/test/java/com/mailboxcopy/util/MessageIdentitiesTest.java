package com.mailboxcopy.util;

import com.mailboxcopy.domain.MessageIdentity;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MessageIdentities unit tests
 */
class MessageIdentitiesTest {

    @Test
    @DisplayName("Message-ID is used trimmed and unfolded")
    void testMessageId() {
        MessageIdentity identity = MessageIdentities.of(" <abc@\r\n example.com> ", "d", "f", "s", 10);

        assertThat(identity.getValue()).isEqualTo("<abc@ example.com>");
        assertThat(MessageIdentities.of("<abc@ example.com>", null, null, null, 99)).isEqualTo(identity);
    }

    @Test
    @DisplayName("Without Message-ID a digest of headers and size is used")
    void testFallbackDigest() {
        MessageIdentity first = MessageIdentities.of(null, "Mon, 1 Jan 2024 10:00:00 +0000", "a@b.c", "Hello\r\n world", 42);
        MessageIdentity same = MessageIdentities.of("  ", "Mon, 1 Jan 2024 10:00:00 +0000", "a@b.c", "Hello world", 42);
        MessageIdentity otherSize = MessageIdentities.of(null, "Mon, 1 Jan 2024 10:00:00 +0000", "a@b.c", "Hello world", 43);

        assertThat(first.getValue()).startsWith("sha256:");
        assertThat(first).isEqualTo(same);
        assertThat(first).isNotEqualTo(otherSize);
    }

    @Test
    @DisplayName("Identity read from parsed message headers")
    void testFromMessage() throws Exception {
        String eml = "Message-ID: <m1@test>\r\nFrom: a@b.c\r\nSubject: Hi\r\n\r\nBody\r\n";
        MimeMessage message = EmlParser.parseForAppend(eml.getBytes(StandardCharsets.US_ASCII), null, null);

        assertThat(MessageIdentities.of(message, eml.length()).getValue()).isEqualTo("<m1@test>");
    }
}
