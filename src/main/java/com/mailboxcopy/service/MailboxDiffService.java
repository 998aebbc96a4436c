package com.mailboxcopy.service;

import com.mailboxcopy.domain.CopyTask;
import com.mailboxcopy.domain.FolderDiff;
import com.mailboxcopy.domain.FolderPair;
import com.mailboxcopy.domain.MessageIdentity;
import com.mailboxcopy.domain.MessageInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mailbox diff engine
 * - Folder plan: missing destination folders, parents before children
 * - Message plan: source minus destination by MessageIdentity, after the size filter
 *
 * Output order only depends on the input values, never on hash iteration order.
 */
@Slf4j
@Service
public class MailboxDiffService {

    /**
     * Order folder paths by depth, then lexicographically
     */
    public static Comparator<String> folderOrder(char separator) {
        return Comparator.<String>comparingInt(path -> depth(path, separator))
                .thenComparing(Comparator.naturalOrder());
    }

    /**
     * Destination folders to create, parents before children
     */
    public List<String> planFolders(Collection<FolderPair> pairs, Set<String> existingFolders, char separator) {
        TreeSet<String> missing = new TreeSet<>(folderOrder(separator));
        for (FolderPair pair : pairs) {
            if (!existingFolders.contains(pair.getDestinationPath())) {
                missing.add(pair.getDestinationPath());
            }
        }
        return new ArrayList<>(missing);
    }

    /**
     * Pairs ordered by destination folder, so copies follow the folder plan
     */
    public List<FolderPair> orderPairs(Collection<FolderPair> pairs, char separator) {
        Comparator<String> order = folderOrder(separator);
        List<FolderPair> ordered = new ArrayList<>(pairs);
        ordered.sort(Comparator.comparing(FolderPair::getDestinationPath, order)
                .thenComparing(FolderPair::getSourcePath));
        return ordered;
    }

    /**
     * Diff one folder pair.
     *
     * @param sourceMessages         source listing
     * @param destinationIdentities  identities already in the destination folder
     * @param maxSize                size limit in bytes, null for none
     */
    public FolderDiff diffFolder(FolderPair pair, List<MessageInfo> sourceMessages,
                                 Set<MessageIdentity> destinationIdentities, Long maxSize) {
        List<MessageInfo> ordered = new ArrayList<>(sourceMessages);
        ordered.sort(Comparator.comparingLong(MessageInfo::getUid).thenComparing(MessageInfo::getIdentity));

        List<MessageInfo> oversize = new ArrayList<>();
        Set<MessageIdentity> planned = new LinkedHashSet<>();
        List<CopyTask> tasks = new ArrayList<>();
        int alreadyPresent = 0;

        for (MessageInfo message : ordered) {
            if (maxSize != null && message.getSize() > maxSize) {
                oversize.add(message);
                continue;
            }
            if (destinationIdentities.contains(message.getIdentity())) {
                alreadyPresent++;
                continue;
            }
            // Same identity twice in the source: copy it once
            if (planned.add(message.getIdentity())) {
                tasks.add(CopyTask.of(pair, message));
            } else {
                alreadyPresent++;
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("{}: {} to copy, {} already present, {} oversize",
                    pair, tasks.size(), alreadyPresent, oversize.size());
        }
        return new FolderDiff(pair, List.copyOf(tasks), alreadyPresent, List.copyOf(oversize));
    }

    private static int depth(String path, char separator) {
        int depth = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == separator) depth++;
        }
        return depth;
    }

    /**
     * Identities known per destination folder during one run
     */
    public static class DestinationIndex {

        private final Map<String, Set<MessageIdentity>> planned = new HashMap<>();

        /**
         * Listed identities plus the ones already planned for this folder
         */
        public Set<MessageIdentity> known(String destinationFolder, Set<MessageIdentity> listed) {
            Set<MessageIdentity> extra = planned.get(destinationFolder);
            if (extra == null || extra.isEmpty()) {
                return listed;
            }
            Set<MessageIdentity> merged = new HashSet<>(listed);
            merged.addAll(extra);
            return merged;
        }

        public void record(FolderDiff diff) {
            Set<MessageIdentity> set = planned.computeIfAbsent(diff.getFolderPair().getDestinationPath(), k -> new HashSet<>());
            diff.getTasks().forEach(task -> set.add(task.getIdentity()));
        }
    }
}
