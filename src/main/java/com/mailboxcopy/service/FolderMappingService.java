package com.mailboxcopy.service;

import com.mailboxcopy.domain.FolderMappingRule;
import com.mailboxcopy.domain.FolderPair;
import com.mailboxcopy.exception.ConfigurationException;
import com.mailboxcopy.exception.FolderCreateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Folder mapping service
 * - Exclusions first: an excluded folder and its descendants produce no pair
 * - Longest matching rule wins, ties go to the rule declared first
 * - Unmatched folders keep their path
 *
 * Rules and exclusions are written with '/', whatever the servers use.
 */
@Slf4j
@Service
public class FolderMappingService {

    private static final char SEPARATOR = FolderMappingRule.SEPARATOR;

    /**
     * Parse rules given as SRC:DST
     */
    public List<FolderMappingRule> parseRules(List<String> rules) {
        List<FolderMappingRule> parsed = new ArrayList<>();
        if (rules != null) {
            for (String rule : rules) {
                parsed.add(FolderMappingRule.parse(rule));
            }
        }
        return parsed;
    }

    /**
     * Normalize exclusion paths: trailing '/' removed, empty names rejected
     */
    public List<String> parseExclusions(List<String> exclusions) {
        List<String> parsed = new ArrayList<>();
        if (exclusions == null) {
            return parsed;
        }
        for (String exclusion : exclusions) {
            String path = exclusion == null ? "" : exclusion.trim();
            while (path.endsWith(String.valueOf(SEPARATOR))) {
                path = path.substring(0, path.length() - 1);
            }
            if (path.isEmpty()) {
                throw new ConfigurationException("Excluded folder name is empty");
            }
            parsed.add(path);
        }
        return parsed;
    }

    /**
     * Reject rules whose destination cannot be expressed on the destination server
     */
    public void validateForDestination(List<FolderMappingRule> rules, char destinationSeparator) {
        for (FolderMappingRule rule : rules) {
            if (rule.getDestinationPrefix().isEmpty()) {
                continue;
            }
            for (String segment : rule.getDestinationPrefix().split(String.valueOf(SEPARATOR))) {
                if (destinationSeparator != SEPARATOR && segment.indexOf(destinationSeparator) >= 0) {
                    throw new ConfigurationException("Folder mapping rule '" + rule + "': destination folder name '"
                            + segment + "' contains the destination separator '" + destinationSeparator + "'");
                }
                if (".".equals(segment) || "..".equals(segment)) {
                    throw new ConfigurationException("Folder mapping rule '" + rule + "': destination folder name '"
                            + segment + "' is reserved");
                }
            }
        }
    }

    public boolean isExcluded(String folderPath, List<String> exclusions) {
        for (String excluded : exclusions) {
            if (folderPath.equals(excluded) || folderPath.startsWith(excluded + SEPARATOR)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolve one source folder.
     *
     * @param sourceFolder         source full name, in the source separator
     * @param sourceSeparator      source server separator
     * @param destinationSeparator destination server separator
     * @return the pair, or empty when the folder is excluded
     * @throws FolderCreateException when a source folder name would be split into nested destination folders
     */
    public Optional<FolderPair> resolve(String sourceFolder, List<FolderMappingRule> rules, List<String> exclusions,
                                        char sourceSeparator, char destinationSeparator) {
        String normalized = sourceFolder.replace(sourceSeparator, SEPARATOR);
        if (isExcluded(normalized, exclusions)) {
            return Optional.empty();
        }

        FolderMappingRule best = null;
        for (FolderMappingRule rule : rules) {
            if (rule.matches(normalized)
                    && (best == null || rule.getSourcePath().length() > best.getSourcePath().length())) {
                best = rule;
            }
        }

        String destination;
        int carriedFrom;   // First source segment taken over into the destination name
        if (best == null) {
            destination = normalized;
            carriedFrom = 0;
        } else if (best.getMatchMode() == FolderMappingRule.MatchMode.EXACT || normalized.equals(best.getSourcePath())) {
            destination = best.getDestinationPrefix().isEmpty() ? normalized : best.getDestinationPrefix();
            carriedFrom = best.getDestinationPrefix().isEmpty() ? 0 : Integer.MAX_VALUE;
        } else {
            String relative = normalized.substring(best.getSourcePath().length() + 1);
            destination = best.getDestinationPrefix().isEmpty() ? relative : best.getDestinationPrefix() + SEPARATOR + relative;
            carriedFrom = best.getSourcePath().split(String.valueOf(SEPARATOR)).length;
        }

        String[] segments = sourceFolder.split(Pattern.quote(String.valueOf(sourceSeparator)), -1);
        for (int i = carriedFrom; i < segments.length; i++) {
            boolean clash = (destinationSeparator != sourceSeparator && segments[i].indexOf(destinationSeparator) >= 0)
                    || (sourceSeparator != SEPARATOR && segments[i].indexOf(SEPARATOR) >= 0);
            if (clash) {
                log.warn("Source folder {} cannot be mapped: '{}' would be split into nested destination folders",
                        sourceFolder, segments[i]);
                throw new FolderCreateException(sourceFolder, "Source folder name '" + segments[i]
                        + "' contains a folder separator of the destination", null);
            }
        }

        return Optional.of(new FolderPair(sourceFolder, destination.replace(SEPARATOR, destinationSeparator)));
    }
}
