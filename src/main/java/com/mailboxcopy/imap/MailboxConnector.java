package com.mailboxcopy.imap;

import com.mailboxcopy.domain.Account;
import com.mailboxcopy.exception.ConnectionException;

/**
 * Opens authenticated IMAP sessions
 */
public interface MailboxConnector {

    MailboxSession connect(Account account) throws ConnectionException;
}
