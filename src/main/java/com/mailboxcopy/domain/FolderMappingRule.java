package com.mailboxcopy.domain;

import com.mailboxcopy.exception.ConfigurationException;
import lombok.Value;

/**
 * Folder mapping rule parsed from "SRC:DST".
 * A source written with a trailing '/' maps the folder and all of its descendants.
 */
@Value
public class FolderMappingRule {

    public static final char SEPARATOR = '/';

    String sourcePath;          // Without trailing separator
    String destinationPrefix;   // Empty maps RECURSIVE rules to the destination root
    MatchMode matchMode;

    public enum MatchMode {
        EXACT,
        RECURSIVE
    }

    public static FolderMappingRule parse(String rule) {
        if (rule == null) {
            throw new ConfigurationException("Folder mapping rule is missing");
        }
        int colon = rule.lastIndexOf(':');
        if (colon < 0) {
            throw new ConfigurationException("Folder mapping rule '" + rule + "' has no ':' between source and destination");
        }

        String source = rule.substring(0, colon).trim();
        String destination = rule.substring(colon + 1).trim();

        MatchMode mode = MatchMode.EXACT;
        if (source.endsWith(String.valueOf(SEPARATOR))) {
            mode = MatchMode.RECURSIVE;
            source = source.substring(0, source.length() - 1);
        }
        if (destination.endsWith(String.valueOf(SEPARATOR))) {
            destination = destination.substring(0, destination.length() - 1);
        }

        if (source.isEmpty()) {
            throw new ConfigurationException("Folder mapping rule '" + rule + "' has an empty source folder");
        }
        if (mode == MatchMode.EXACT && destination.isEmpty()) {
            throw new ConfigurationException("Folder mapping rule '" + rule + "' maps a single folder to an empty destination");
        }
        checkSegments(rule, source);
        checkSegments(rule, destination);

        return new FolderMappingRule(source, destination, mode);
    }

    private static void checkSegments(String rule, String path) {
        if (path.isEmpty()) {
            return;
        }
        for (String segment : path.split(String.valueOf(SEPARATOR), -1)) {
            if (segment.isBlank()) {
                throw new ConfigurationException("Folder mapping rule '" + rule + "' contains an empty folder name");
            }
        }
    }

    /**
     * Returns true when the normalized folder path is covered by this rule.
     */
    public boolean matches(String folderPath) {
        if (folderPath.equals(sourcePath)) {
            return true;
        }
        return matchMode == MatchMode.RECURSIVE && folderPath.startsWith(sourcePath + SEPARATOR);
    }

    @Override
    public String toString() {
        return sourcePath + (matchMode == MatchMode.RECURSIVE ? "/" : "") + ":" + destinationPrefix;
    }
}
