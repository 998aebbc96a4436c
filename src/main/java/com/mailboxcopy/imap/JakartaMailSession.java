package com.mailboxcopy.imap;

import com.mailboxcopy.domain.Account;
import com.mailboxcopy.domain.FetchedMessage;
import com.mailboxcopy.domain.MessageIdentity;
import com.mailboxcopy.domain.MessageInfo;
import com.mailboxcopy.exception.FolderCreateException;
import com.mailboxcopy.exception.SessionLostException;
import com.mailboxcopy.exception.TransientTaskException;
import com.mailboxcopy.util.EmlParser;
import com.mailboxcopy.util.MessageIdentities;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.StoreClosedException;
import jakarta.mail.UIDFolder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * MailboxSession over a connected Jakarta Mail Store.
 * Keeps the last read folder open so consecutive fetches reuse the selection.
 */
@Slf4j
class JakartaMailSession implements MailboxSession {

    private final Store store;
    private final Account account;
    private final int fetchChunkSize;

    private Folder selected;
    private Character separator;

    JakartaMailSession(Store store, Account account, int fetchChunkSize) {
        this.store = store;
        this.account = account;
        this.fetchChunkSize = Math.max(1, fetchChunkSize);
    }

    @Override
    public char getSeparator() {
        if (separator == null) {
            try {
                separator = store.getDefaultFolder().getSeparator();
            } catch (MessagingException e) {
                throw translate("read folder separator", null, e);
            }
        }
        return separator;
    }

    @Override
    public List<String> listFolders() {
        try {
            Folder[] folders = store.getDefaultFolder().list("*");
            List<String> names = new ArrayList<>(folders.length);
            for (Folder folder : folders) {
                names.add(folder.getFullName());
            }
            names.sort(Comparator.naturalOrder());
            log.debug("{}: {} folders", account.describe(), names.size());
            return names;
        } catch (MessagingException e) {
            throw translate("list folders", null, e);
        }
    }

    @Override
    public int countMessages(String folderName) {
        try {
            Folder folder = store.getFolder(folderName);
            if (!holdsMessages(folder)) {
                return 0;
            }
            return Math.max(0, folder.getMessageCount());
        } catch (MessagingException e) {
            throw translate("count messages", folderName, e);
        }
    }

    @Override
    public List<MessageInfo> listMessages(String folderName) {
        try {
            Folder folder = select(folderName);
            if (folder == null) {
                return List.of();
            }
            Message[] messages = folder.getMessages();
            UIDFolder uidFolder = (UIDFolder) folder;

            FetchProfile profile = new FetchProfile();
            profile.add(UIDFolder.FetchProfileItem.UID);
            profile.add(FetchProfile.Item.SIZE);
            profile.add(MessageIdentities.MESSAGE_ID);
            for (String header : MessageIdentities.FALLBACK_HEADERS) {
                profile.add(header);
            }

            List<MessageInfo> result = new ArrayList<>(messages.length);
            for (int from = 0; from < messages.length; from += fetchChunkSize) {
                Message[] chunk = Arrays.copyOfRange(messages, from, Math.min(messages.length, from + fetchChunkSize));
                folder.fetch(chunk, profile);
                for (Message message : chunk) {
                    if (message.isExpunged()) {
                        continue;
                    }
                    long size = Math.max(0, message.getSize());
                    MessageIdentity identity = MessageIdentities.of(message, size);
                    result.add(new MessageInfo(identity, uidFolder.getUID(message), size));
                }
            }
            result.sort(Comparator.comparingLong(MessageInfo::getUid));
            log.debug("{}: fetched {} message ids from {}", account.describe(), result.size(), folderName);
            return result;
        } catch (MessagingException e) {
            throw translate("list messages", folderName, e);
        }
    }

    @Override
    public FetchedMessage fetchMessage(String folderName, MessageInfo info) {
        try {
            Folder folder = select(folderName);
            Message message = folder == null ? null : ((UIDFolder) folder).getMessageByUID(info.getUid());
            if (message == null) {
                throw new TransientTaskException("Message " + info.getIdentity() + " (uid " + info.getUid()
                        + ") no longer exists in " + folderName, null);
            }
            byte[] content = EmlParser.toBytes(message);
            Flags flags = new Flags(message.getFlags());
            flags.remove(Flags.Flag.RECENT);
            return new FetchedMessage(info, content, flags, message.getReceivedDate());
        } catch (MessagingException e) {
            throw translate("fetch message " + info.getIdentity(), folderName, e);
        } catch (IOException e) {
            throw translate("fetch message " + info.getIdentity(), folderName, e);
        }
    }

    @Override
    public CreateResult createFolder(String folderName) {
        try {
            Folder folder = store.getFolder(folderName);
            if (folder.exists()) {
                return CreateResult.ALREADY_EXISTS;
            }
            if (folder.create(Folder.HOLDS_MESSAGES)) {
                log.debug("{}: created folder {}", account.describe(), folderName);
                return CreateResult.CREATED;
            }
            // Lost a race with another client, or the server refused
            if (folder.exists()) {
                return CreateResult.ALREADY_EXISTS;
            }
            throw new FolderCreateException(folderName, "Server refused to create folder " + folderName, null);
        } catch (StoreClosedException | FolderClosedException e) {
            throw new SessionLostException("Connection to " + account.describe() + " lost while creating " + folderName, e);
        } catch (MessagingException e) {
            if (!store.isConnected()) {
                throw new SessionLostException("Connection to " + account.describe() + " lost while creating " + folderName, e);
            }
            throw new FolderCreateException(folderName, "Cannot create folder " + folderName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void appendMessage(String folderName, FetchedMessage message) {
        try {
            Message mime = EmlParser.parseForAppend(message.getContent(), message.getFlags(), message.getInternalDate());
            store.getFolder(folderName).appendMessages(new Message[]{mime});
        } catch (MessagingException e) {
            throw translate("append message " + message.getInfo().getIdentity(), folderName, e);
        } catch (IOException e) {
            throw translate("append message " + message.getInfo().getIdentity(), folderName, e);
        }
    }

    @Override
    public boolean isConnected() {
        return store.isConnected();
    }

    @Override
    public void close() {
        closeSelected();
        try {
            if (store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.warn("Error while closing connection to {}: {}", account.describe(), e.getMessage());
        }
    }

    /**
     * Open a folder read-only, reusing the current selection when possible.
     * Returns null for folders that cannot hold messages (\Noselect).
     */
    private Folder select(String folderName) throws MessagingException {
        if (selected != null && selected.isOpen() && selected.getFullName().equals(folderName)) {
            return selected;
        }
        closeSelected();
        Folder folder = store.getFolder(folderName);
        if (!holdsMessages(folder)) {
            return null;
        }
        folder.open(Folder.READ_ONLY);
        selected = folder;
        return folder;
    }

    private void closeSelected() {
        if (selected == null) {
            return;
        }
        try {
            if (selected.isOpen()) {
                selected.close(false);
            }
        } catch (MessagingException e) {
            log.debug("Error while closing folder {}: {}", selected.getFullName(), e.getMessage());
        } finally {
            selected = null;
        }
    }

    private static boolean holdsMessages(Folder folder) throws MessagingException {
        return (folder.getType() & Folder.HOLDS_MESSAGES) != 0;
    }

    private RuntimeException translate(String action, String folderName, Exception e) {
        String where = folderName == null ? account.describe() : account.describe() + " " + folderName;
        if (e instanceof StoreClosedException || e instanceof FolderClosedException || !store.isConnected()) {
            selected = null;
            return new SessionLostException("Connection lost during " + action + " on " + where, e);
        }
        return new TransientTaskException("Cannot " + action + " on " + where + ": " + e.getMessage(), e);
    }
}
