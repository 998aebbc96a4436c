package com.mailboxcopy.domain;

import lombok.Value;

/**
 * A pending message copy
 */
@Value
public class CopyTask {

    FolderPair folderPair;
    MessageIdentity identity;
    long uid;
    long sizeBytes;

    public static CopyTask of(FolderPair pair, MessageInfo message) {
        return new CopyTask(pair, message.getIdentity(), message.getUid(), message.getSize());
    }

    public MessageInfo toMessageInfo() {
        return new MessageInfo(identity, uid, sizeBytes);
    }
}
