package com.mailboxcopy.service;

import com.mailboxcopy.domain.Account;
import com.mailboxcopy.exception.ConnectionException;
import com.mailboxcopy.exception.SessionLostException;
import com.mailboxcopy.imap.MailboxConnector;
import com.mailboxcopy.imap.MailboxSession;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Session of one account with reconnect-and-retry.
 * Each connection loss gets up to reconnectAttempts reconnects; the call that hit the
 * drop is retried once on the new session. The allowance is restored once a call succeeds,
 * so separate drops during a long run are each recovered.
 */
@Slf4j
public class AccountConnection implements AutoCloseable {

    private final String label;
    private final Account account;
    private final MailboxConnector connector;
    private final int reconnectAttempts;
    private int reconnectsLeft;
    private MailboxSession session;
    private volatile boolean broken;

    private AccountConnection(String label, Account account, MailboxConnector connector,
                              int reconnectAttempts, MailboxSession session) {
        this.label = label;
        this.account = account;
        this.connector = connector;
        this.reconnectAttempts = reconnectAttempts;
        this.reconnectsLeft = reconnectAttempts;
        this.session = session;
    }

    /**
     * Connect; a failure here is fatal for the run
     */
    public static AccountConnection open(String label, Account account, MailboxConnector connector, int reconnectAttempts) {
        MailboxSession session = connector.connect(account);
        return new AccountConnection(label, account, connector, reconnectAttempts, session);
    }

    public String getLabel() {
        return label;
    }

    /**
     * True once the session was lost and could not be restored
     */
    public boolean isBroken() {
        return broken;
    }

    public synchronized <T> T call(Function<MailboxSession, T> operation) {
        if (broken) {
            throw new ConnectionException(label + " connection is not available", null);
        }
        if (!session.isConnected()) {
            reconnect(new SessionLostException(label + " session was closed by the server", null));
        }
        T result;
        try {
            result = operation.apply(session);
        } catch (SessionLostException e) {
            reconnect(e);
            try {
                result = operation.apply(session);
            } catch (SessionLostException again) {
                broken = true;
                throw again;
            }
        }
        reconnectsLeft = reconnectAttempts;
        return result;
    }

    public void run(Consumer<MailboxSession> operation) {
        call(s -> {
            operation.accept(s);
            return null;
        });
    }

    private void reconnect(SessionLostException cause) {
        if (reconnectsLeft <= 0) {
            broken = true;
            throw new ConnectionException(label + " connection lost, no reconnect attempt left: " + cause.getMessage(), cause);
        }
        reconnectsLeft--;
        log.warn("{} connection lost ({}), reconnecting to {}", label, cause.getMessage(), account.describe());
        closeSession();
        try {
            session = connector.connect(account);
        } catch (ConnectionException e) {
            broken = true;
            throw new ConnectionException(label + " reconnect failed: " + e.getMessage(), e);
        }
        log.info("{} connection restored", label);
    }

    private void closeSession() {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.debug("Error while closing {} session: {}", label, e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        closeSession();
    }
}
