package com.mailboxcopy.util;

import com.mailboxcopy.domain.MessageIdentity;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;

/**
 * Derives the identity used to detect messages already copied.
 * Message-ID when present, otherwise a digest of Date, From, Subject and size.
 */
public final class MessageIdentities {

    public static final String MESSAGE_ID = "Message-ID";
    public static final String[] FALLBACK_HEADERS = {"Date", "From", "Subject"};

    private static final String DIGEST_PREFIX = "sha256:";

    private MessageIdentities() {}

    public static MessageIdentity of(String messageId, String date, String from, String subject, long size) {
        if (messageId != null && !messageId.isBlank()) {
            return new MessageIdentity(unfold(messageId));
        }
        String material = String.join("\n",
                nullToEmpty(date), nullToEmpty(from), nullToEmpty(subject), Long.toString(size));
        return new MessageIdentity(DIGEST_PREFIX + CryptoUtil.sha256(material));
    }

    /**
     * Identity of a message whose headers were prefetched
     */
    public static MessageIdentity of(Message message, long size) throws MessagingException {
        return of(EmlParser.firstHeader(message, MESSAGE_ID),
                EmlParser.firstHeader(message, FALLBACK_HEADERS[0]),
                EmlParser.firstHeader(message, FALLBACK_HEADERS[1]),
                EmlParser.firstHeader(message, FALLBACK_HEADERS[2]),
                size);
    }

    // Folded header values keep their CRLF + whitespace; collapse so both servers agree.
    private static String unfold(String value) {
        return value.replaceAll("\\s+", " ").trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : unfold(value);
    }
}
