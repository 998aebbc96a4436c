package com.mailboxcopy.imap;

import com.mailboxcopy.config.CopyProperties;
import com.mailboxcopy.domain.Account;
import com.mailboxcopy.domain.SecurityMode;
import com.mailboxcopy.exception.ConnectionException;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Opens IMAP sessions through Jakarta Mail (Eclipse Angus provider)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JakartaMailConnector implements MailboxConnector {

    private final CopyProperties properties;

    @Override
    public MailboxSession connect(Account account) {
        String protocol = protocol(account);
        Session session = Session.getInstance(sessionProperties(account));
        session.setDebug(properties.getImap().isDebug());

        try {
            Store store = session.getStore(protocol);
            store.connect(account.getHost(), account.getPort(), account.getUsername(), account.getPassword());
            log.info("Connected to {}", account.describe());
            return new JakartaMailSession(store, account, properties.getTransfer().getFetchChunkSize());
        } catch (AuthenticationFailedException e) {
            throw new ConnectionException("Authentication failed for " + account.describe(), e);
        } catch (MessagingException e) {
            throw new ConnectionException("Cannot connect to " + account.describe() + ": " + e.getMessage(), e);
        }
    }

    static String protocol(Account account) {
        return account.getSecurityMode() == SecurityMode.IMPLICIT_TLS ? "imaps" : "imap";
    }

    /**
     * Session properties for the account's protocol (mail.imap.* or mail.imaps.*)
     */
    Properties sessionProperties(Account account) {
        String prefix = "mail." + protocol(account) + ".";
        CopyProperties.Imap imap = properties.getImap();

        Properties props = new Properties();
        props.put(prefix + "host", account.getHost());
        props.put(prefix + "port", String.valueOf(account.getPort()));
        props.put(prefix + "connectiontimeout", String.valueOf(imap.getConnectionTimeout()));
        props.put(prefix + "timeout", String.valueOf(imap.getTimeout()));
        props.put(prefix + "writetimeout", String.valueOf(imap.getWriteTimeout()));
        props.put(prefix + "peek", "true"); // Leave \Seen untouched on the source
        props.put(prefix + "partialfetch", "false");

        switch (account.getSecurityMode()) {
            case IMPLICIT_TLS -> props.put(prefix + "ssl.checkserveridentity", String.valueOf(imap.isCheckServerIdentity()));
            case STARTTLS -> {
                props.put(prefix + "starttls.enable", "true");
                props.put(prefix + "starttls.required", "true");
                props.put(prefix + "ssl.checkserveridentity", String.valueOf(imap.isCheckServerIdentity()));
            }
            case PLAIN -> props.put(prefix + "starttls.enable", "false");
        }
        return props;
    }
}
