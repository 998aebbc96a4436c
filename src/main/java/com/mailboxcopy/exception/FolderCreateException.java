package com.mailboxcopy.exception;

/**
 * Destination folder could not be created
 */
public class FolderCreateException extends MailboxCopyException {

    private final String folder;

    public FolderCreateException(String folder, String message, Throwable cause) {
        super(message, cause);
        this.folder = folder;
    }

    public String getFolder() {
        return folder;
    }
}
