package com.mailboxcopy.domain;

import lombok.Value;

/**
 * Resolved source folder -> destination folder
 */
@Value
public class FolderPair {

    String sourcePath;        // Source separator
    String destinationPath;   // Destination separator

    @Override
    public String toString() {
        return sourcePath + " -> " + destinationPath;
    }
}
