package com.mailboxcopy.imap;

import com.mailboxcopy.domain.Account;
import com.mailboxcopy.domain.FetchedMessage;
import com.mailboxcopy.domain.MessageIdentity;
import com.mailboxcopy.domain.MessageInfo;
import com.mailboxcopy.domain.SecurityMode;
import com.mailboxcopy.exception.FolderCreateException;
import com.mailboxcopy.exception.SessionLostException;
import com.mailboxcopy.exception.TransientTaskException;
import com.mailboxcopy.util.EmlParser;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.StoreClosedException;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * JakartaMailSession tests over a mocked Store
 */
@ExtendWith(MockitoExtension.class)
class JakartaMailSessionTest {

    @Mock
    private Store store;

    @Mock
    private Folder root;

    @Mock(extraInterfaces = UIDFolder.class)
    private Folder folder;

    @Mock
    private Folder other;

    private JakartaMailSession session;

    @BeforeEach
    void setUp() {
        Account account = Account.builder()
                .host("mail.test")
                .port(993)
                .securityMode(SecurityMode.IMPLICIT_TLS)
                .username("user")
                .password("secret")
                .build();
        session = new JakartaMailSession(store, account, 2);
    }

    private static MimeMessage message(String headers, Flags flags, Date internalDate) throws Exception {
        String eml = headers + "\r\nBody text\r\n";
        return EmlParser.parseForAppend(eml.getBytes(StandardCharsets.US_ASCII), flags, internalDate);
    }

    private static MessageInfo info(String id, long uid) {
        return new MessageInfo(new MessageIdentity(id), uid, 100);
    }

    @Test
    @DisplayName("Folder listing is sorted by full name")
    void testListFolders() throws Exception {
        when(store.getDefaultFolder()).thenReturn(root);
        when(root.list("*")).thenReturn(new Folder[]{folder, other});
        when(folder.getFullName()).thenReturn("Sent");
        when(other.getFullName()).thenReturn("INBOX");

        assertThat(session.listFolders()).containsExactly("INBOX", "Sent");
    }

    @Test
    @DisplayName("Closed store is reported as a lost session")
    void testStoreClosedIsSessionLost() throws Exception {
        when(store.getDefaultFolder()).thenReturn(root);
        when(root.list("*")).thenThrow(new StoreClosedException(store, "BYE"));

        assertThatThrownBy(() -> session.listFolders())
                .isInstanceOf(SessionLostException.class)
                .hasMessageContaining("list folders");
    }

    @Test
    @DisplayName("Other errors on a live connection only fail the current task")
    void testErrorWhileConnectedIsTransient() throws Exception {
        when(store.getDefaultFolder()).thenReturn(root);
        when(root.list("*")).thenThrow(new MessagingException("NO server busy"));
        when(store.isConnected()).thenReturn(true);

        assertThatThrownBy(() -> session.listFolders())
                .isInstanceOf(TransientTaskException.class)
                .hasMessageContaining("server busy");
    }

    @Test
    @DisplayName("Errors after the connection dropped are reported as a lost session")
    void testErrorWhileDisconnectedIsSessionLost() throws Exception {
        when(store.getDefaultFolder()).thenReturn(root);
        when(root.list("*")).thenThrow(new MessagingException("read timed out"));
        when(store.isConnected()).thenReturn(false);

        assertThatThrownBy(() -> session.listFolders())
                .isInstanceOf(SessionLostException.class);
    }

    @Test
    @DisplayName("Folder that cannot hold messages lists as empty and is never selected")
    void testNoselectFolder() throws Exception {
        when(store.getFolder("Projects")).thenReturn(folder);
        when(folder.getType()).thenReturn(Folder.HOLDS_FOLDERS);

        assertThat(session.listMessages("Projects")).isEmpty();
        assertThat(session.countMessages("Projects")).isZero();
        verify(folder, never()).open(anyInt());
    }

    @Test
    @DisplayName("Message listing is fetched in chunks and ordered by UID")
    void testListMessagesInChunks() throws Exception {
        MimeMessage first = message("Message-ID: <a@test>\r\n", null, null);
        MimeMessage second = message("Message-ID: <b@test>\r\n", null, null);
        MimeMessage third = message("From: x@test\r\nSubject: no id\r\n", null, null);
        when(store.getFolder("INBOX")).thenReturn(folder);
        when(folder.getType()).thenReturn(Folder.HOLDS_MESSAGES | Folder.HOLDS_FOLDERS);
        when(folder.getMessages()).thenReturn(new Message[]{first, second, third});
        UIDFolder uidFolder = (UIDFolder) folder;
        when(uidFolder.getUID(first)).thenReturn(30L);
        when(uidFolder.getUID(second)).thenReturn(10L);
        when(uidFolder.getUID(third)).thenReturn(20L);

        List<MessageInfo> messages = session.listMessages("INBOX");

        assertThat(messages).extracting(MessageInfo::getUid).containsExactly(10L, 20L, 30L);
        assertThat(messages.get(0).getIdentity().getValue()).isEqualTo("<b@test>");
        assertThat(messages.get(1).getIdentity().getValue()).startsWith("sha256:");
        verify(folder).open(Folder.READ_ONLY);
        verify(folder, times(2)).fetch(any(Message[].class), any(FetchProfile.class));
    }

    @Test
    @DisplayName("Fetched message keeps its flags and internal date, without \\Recent")
    void testFetchDropsRecent() throws Exception {
        Flags flags = new Flags(Flags.Flag.SEEN);
        flags.add(Flags.Flag.RECENT);
        Date internalDate = new Date(1_700_000_000_000L);
        MimeMessage stored = message("Message-ID: <a@test>\r\nSubject: Hello\r\n", flags, internalDate);
        when(store.getFolder("INBOX")).thenReturn(folder);
        when(folder.getType()).thenReturn(Folder.HOLDS_MESSAGES);
        when(((UIDFolder) folder).getMessageByUID(7L)).thenReturn(stored);

        FetchedMessage fetched = session.fetchMessage("INBOX", info("<a@test>", 7));

        assertThat(fetched.getFlags().contains(Flags.Flag.SEEN)).isTrue();
        assertThat(fetched.getFlags().contains(Flags.Flag.RECENT)).isFalse();
        assertThat(fetched.getInternalDate()).isEqualTo(internalDate);
        assertThat(new String(fetched.getContent(), StandardCharsets.US_ASCII)).contains("Subject: Hello");
    }

    @Test
    @DisplayName("Message expunged since the listing fails only that task")
    void testFetchExpungedMessage() throws Exception {
        when(store.getFolder("INBOX")).thenReturn(folder);
        when(folder.getType()).thenReturn(Folder.HOLDS_MESSAGES);
        when(((UIDFolder) folder).getMessageByUID(7L)).thenReturn(null);

        assertThatThrownBy(() -> session.fetchMessage("INBOX", info("<a@test>", 7)))
                .isInstanceOf(TransientTaskException.class)
                .hasMessageContaining("no longer exists");
    }

    @Test
    @DisplayName("Folder closed by the server during a fetch is a lost session")
    void testFolderClosedIsSessionLost() throws Exception {
        when(store.getFolder("INBOX")).thenReturn(folder);
        when(folder.getType()).thenReturn(Folder.HOLDS_MESSAGES);
        when(((UIDFolder) folder).getMessageByUID(7L)).thenThrow(new FolderClosedException(folder, "BYE"));

        assertThatThrownBy(() -> session.fetchMessage("INBOX", info("<a@test>", 7)))
                .isInstanceOf(SessionLostException.class);
    }

    @Test
    @DisplayName("Existing folder is reported, not created again")
    void testCreateExistingFolder() throws Exception {
        when(store.getFolder("Archive")).thenReturn(folder);
        when(folder.exists()).thenReturn(true);

        assertThat(session.createFolder("Archive")).isEqualTo(MailboxSession.CreateResult.ALREADY_EXISTS);
        verify(folder, never()).create(anyInt());
    }

    @Test
    @DisplayName("Refused create raises FolderCreateException")
    void testCreateRefused() throws Exception {
        when(store.getFolder("Archive")).thenReturn(folder);
        when(folder.exists()).thenReturn(false);
        when(folder.create(Folder.HOLDS_MESSAGES)).thenReturn(false);

        assertThatThrownBy(() -> session.createFolder("Archive"))
                .isInstanceOf(FolderCreateException.class)
                .hasMessageContaining("Archive");
    }

    @Test
    @DisplayName("Create that lost the race with another client counts as existing")
    void testCreateRace() throws Exception {
        when(store.getFolder("Archive")).thenReturn(folder);
        when(folder.exists()).thenReturn(false, true);
        when(folder.create(Folder.HOLDS_MESSAGES)).thenReturn(false);

        assertThat(session.createFolder("Archive")).isEqualTo(MailboxSession.CreateResult.ALREADY_EXISTS);
    }

    @Test
    @DisplayName("Create error depends on whether the connection survived")
    void testCreateError() throws Exception {
        when(store.getFolder("Archive")).thenReturn(folder);
        when(folder.exists()).thenReturn(false);
        when(folder.create(Folder.HOLDS_MESSAGES)).thenThrow(new MessagingException("NO permission denied"));
        when(store.isConnected()).thenReturn(true, false);

        assertThatThrownBy(() -> session.createFolder("Archive"))
                .isInstanceOf(FolderCreateException.class)
                .hasMessageContaining("permission denied");
        assertThatThrownBy(() -> session.createFolder("Archive"))
                .isInstanceOf(SessionLostException.class);
    }

    @Test
    @DisplayName("Close shuts the connected store")
    void testClose() throws Exception {
        when(store.isConnected()).thenReturn(true);

        session.close();

        verify(store).close();
    }
}
