package com.mailboxcopy.service;

import lombok.Value;

import java.util.Set;

/**
 * Outcome of the folder creation step
 */
@Value
public class FolderCreation {

    Set<String> failed;           // Their subtree must not receive copies
    Set<String> alreadyExisting;  // Missing from the listing but found on create, may hold messages
}
