package com.mailboxcopy.domain;

import lombok.Value;

import java.util.List;

/**
 * Diff result of one folder pair
 */
@Value
public class FolderDiff {

    FolderPair folderPair;
    List<CopyTask> tasks;          // Source UID order
    int alreadyPresent;
    List<MessageInfo> oversize;
}
