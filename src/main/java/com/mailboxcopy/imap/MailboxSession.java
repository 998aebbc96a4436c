package com.mailboxcopy.imap;

import com.mailboxcopy.domain.FetchedMessage;
import com.mailboxcopy.domain.MessageInfo;

import java.util.List;

/**
 * Narrow view of one authenticated IMAP session.
 * Folder paths are the server's own full names (server separator).
 * A session is not thread-safe: use it from one thread at a time.
 *
 * Implementations throw SessionLostException when the connection is gone,
 * TransientTaskException for failures limited to one call.
 */
public interface MailboxSession extends AutoCloseable {

    enum CreateResult {
        CREATED,
        ALREADY_EXISTS
    }

    char getSeparator();

    /**
     * All folders of the account, sorted by full name
     */
    List<String> listFolders();

    int countMessages(String folder);

    /**
     * Messages of a folder, sorted by UID
     */
    List<MessageInfo> listMessages(String folder);

    FetchedMessage fetchMessage(String folder, MessageInfo message);

    /**
     * Create a folder; an existing folder is not an error
     */
    CreateResult createFolder(String folder);

    void appendMessage(String folder, FetchedMessage message);

    boolean isConnected();

    @Override
    void close();
}
