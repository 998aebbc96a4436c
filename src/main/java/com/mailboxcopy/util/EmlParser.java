package com.mailboxcopy.util;

import jakarta.mail.Flags;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Date;
import java.util.Properties;

/**
 * Raw message (EML) conversions based on Jakarta Mail
 */
public final class EmlParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a message ready for IMAP APPEND, carrying flags and internal date.
     * IMAP APPEND takes the internal date from getReceivedDate().
     */
    public static MimeMessage parseForAppend(byte[] emlData, Flags flags, Date internalDate)
            throws MessagingException, IOException {
        MimeMessage message;
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            message = new MimeMessage(SESSION, is) {
                @Override
                public Date getReceivedDate() {
                    return internalDate;
                }
            };
        }
        if (flags != null) {
            message.setFlags(flags, true);
        }
        return message;
    }

    /**
     * Serialize a message to bytes
     */
    public static byte[] toBytes(Message message) throws MessagingException, IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        message.writeTo(outputStream);
        return outputStream.toByteArray();
    }

    /**
     * Return the first value of a header, or null
     */
    public static String firstHeader(Message message, String name) throws MessagingException {
        String[] values = message.getHeader(name);
        if (values == null || values.length == 0) {
            return null;
        }
        return values[0];
    }
}
