package com.mailboxcopy.service;

import com.mailboxcopy.config.CopyProperties;
import com.mailboxcopy.domain.CopyRequest;
import com.mailboxcopy.domain.FolderDiff;
import com.mailboxcopy.domain.FolderMappingRule;
import com.mailboxcopy.domain.FolderPair;
import com.mailboxcopy.domain.MessageIdentity;
import com.mailboxcopy.domain.MessageInfo;
import com.mailboxcopy.domain.RunReport;
import com.mailboxcopy.domain.RunReport.FailureKind;
import com.mailboxcopy.exception.ConfigurationException;
import com.mailboxcopy.exception.ConnectionException;
import com.mailboxcopy.exception.FolderCreateException;
import com.mailboxcopy.exception.TransientTaskException;
import com.mailboxcopy.imap.MailboxConnector;
import com.mailboxcopy.imap.MailboxSession;
import com.mailboxcopy.util.SizeFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Mailbox copy run: enumerate -> diff -> execute, one folder at a time.
 * Nothing is persisted between runs; every run re-diffs live server state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxCopyService {

    private final MailboxConnector connector;
    private final FolderMappingService mappingService;
    private final MailboxDiffService diffService;
    private final CopyExecutionService executionService;
    private final CopyProperties properties;

    /**
     * Run one copy.
     *
     * @throws ConfigurationException invalid rules, exclusions or limits (nothing touched)
     * @throws ConnectionException    an account cannot be reached or authenticated at start
     */
    public RunReport run(CopyRequest request, BooleanSupplier cancelled) {
        List<String> ruleTexts = new ArrayList<>(request.getMappings());
        ruleTexts.addAll(properties.getDefaultMappings());
        List<FolderMappingRule> rules = mappingService.parseRules(ruleTexts);
        List<String> exclusions = mappingService.parseExclusions(request.getExclusions());
        if (request.getMaxSize() != null && request.getMaxSize() < 0) {
            throw new ConfigurationException("Size limit must not be negative: " + request.getMaxSize());
        }
        int bufferSize = request.getBufferSize() != null ? request.getBufferSize() : executionService.defaultBufferSize();
        if (bufferSize < 1) {
            throw new ConfigurationException("Buffer size must be at least 1: " + bufferSize);
        }

        RunReport report = new RunReport(request.isDryRun());
        RunContext ctx = RunContext.of(report, cancelled);
        int reconnects = properties.getTransfer().getReconnectAttempts();

        try (AccountConnection source = AccountConnection.open("source", request.getSource(), connector, reconnects);
             AccountConnection destination = AccountConnection.open("destination", request.getDestination(), connector, reconnects)) {
            if (request.isDryRun()) {
                log.info("Dry run: no folder or message will be written to {}", request.getDestination().describe());
            }
            try {
                copy(request, rules, exclusions, bufferSize, source, destination, ctx);
            } catch (ConnectionException e) {
                report.addFailure(FailureKind.CONNECTION, null, null, e.getMessage());
                report.markIncomplete("connection lost");
                log.error("Run aborted: {}", e.getMessage());
            }
        }

        if (cancelled.getAsBoolean()) {
            report.markIncomplete("interrupted");
        }
        log.info("{} {} messages ({})", request.isDryRun() ? "Would copy" : "Copied",
                report.getMessagesCopied(), SizeFormatter.format(report.getBytesCopied()));
        return report;
    }

    private void copy(CopyRequest request, List<FolderMappingRule> rules, List<String> exclusions, int bufferSize,
                      AccountConnection source, AccountConnection destination, RunContext ctx) {
        RunReport report = ctx.getReport();
        char sourceSeparator = source.call(MailboxSession::getSeparator);
        char destinationSeparator = destination.call(MailboxSession::getSeparator);
        mappingService.validateForDestination(rules, destinationSeparator);

        if (request.getDestination().getInitialFolder() != null) {
            log.warn("Destination folder '{}' in the URL is ignored, use --map to place folders",
                    request.getDestination().getInitialFolder());
        }

        List<String> sourceFolders = restrictTo(source.call(MailboxSession::listFolders),
                request.getSource().getInitialFolder(), sourceSeparator);
        Set<String> destinationFolders = new HashSet<>(destination.call(MailboxSession::listFolders));

        List<FolderPair> pairs = new ArrayList<>();
        for (String folder : sourceFolders) {
            Optional<FolderPair> pair;
            try {
                pair = mappingService.resolve(folder, rules, exclusions, sourceSeparator, destinationSeparator);
            } catch (FolderCreateException e) {
                report.addFailure(FailureKind.FOLDER_CREATE, folder, null, e.getMessage());
                continue;
            }
            if (pair.isPresent()) {
                pairs.add(pair.get());
            } else {
                log.info("Skipped source folder {}", folder);
                report.folderExcluded(countExcluded(source, folder));
            }
        }

        List<String> toCreate = diffService.planFolders(pairs, destinationFolders, destinationSeparator);
        FolderCreation creation = executionService.createFolders(toCreate, destination, ctx, destinationSeparator);
        Set<String> failedFolders = creation.getFailed();
        destinationFolders.addAll(creation.getAlreadyExisting());

        MailboxDiffService.DestinationIndex index = new MailboxDiffService.DestinationIndex();
        for (FolderPair pair : diffService.orderPairs(pairs, destinationSeparator)) {
            if (ctx.shouldStop()) {
                break;
            }
            if (CopyExecutionService.findAncestor(pair.getDestinationPath(), failedFolders, destinationSeparator) != null) {
                log.warn("Skipped {}: destination folder is missing", pair);
                continue;
            }
            copyFolder(pair, request.getMaxSize(), bufferSize, destinationFolders.contains(pair.getDestinationPath()),
                    index, source, destination, ctx);
        }
    }

    private void copyFolder(FolderPair pair, Long maxSize, int bufferSize, boolean destinationExists,
                            MailboxDiffService.DestinationIndex index,
                            AccountConnection source, AccountConnection destination, RunContext ctx) {
        RunReport report = ctx.getReport();
        log.debug("Processing source folder {}", pair.getSourcePath());

        List<MessageInfo> sourceMessages;
        Set<MessageIdentity> destinationIdentities;
        try {
            sourceMessages = source.call(s -> s.listMessages(pair.getSourcePath()));
            if (sourceMessages.isEmpty()) {
                log.debug("{} is empty, skipped", pair.getSourcePath());
                return;
            }
            // A folder created in this run is empty
            destinationIdentities = destinationExists
                    ? destination.call(s -> s.listMessages(pair.getDestinationPath())).stream()
                            .map(MessageInfo::getIdentity)
                            .collect(Collectors.toSet())
                    : Set.of();
        } catch (TransientTaskException e) {
            log.warn("Cannot list {}: {}", pair, e.getMessage());
            report.addFailure(FailureKind.LIST, pair.getSourcePath(), null, e.getMessage());
            return;
        }

        FolderDiff diff = diffService.diffFolder(pair, sourceMessages,
                index.known(pair.getDestinationPath(), destinationIdentities), maxSize);
        index.record(diff);

        report.alreadyPresent(diff.getAlreadyPresent());
        report.skippedOversize(diff.getOversize().size());
        for (MessageInfo message : diff.getOversize()) {
            log.info("Skipped message {} in {} ({} > limit-size)",
                    message.getIdentity(), pair.getSourcePath(), SizeFormatter.format(message.getSize()));
        }
        if (diff.getAlreadyPresent() > 0) {
            log.debug("Skipped {} previously copied messages", diff.getAlreadyPresent());
        }

        int copiedBefore = report.getMessagesCopied();
        long bytesBefore = report.getBytesCopied();
        executionService.copy(diff, source, destination, ctx, bufferSize);

        int copied = report.getMessagesCopied() - copiedBefore;
        if (copied > 0) {
            log.info("{} {} messages ({}) from source {} to destination {}",
                    ctx.isDryRun() ? "Would copy" : "Copied", copied,
                    SizeFormatter.format(report.getBytesCopied() - bytesBefore), pair.getSourcePath(), pair.getDestinationPath());
        }
    }

    private int countExcluded(AccountConnection source, String folder) {
        try {
            return source.call(s -> s.countMessages(folder));
        } catch (TransientTaskException e) {
            log.debug("Cannot count messages of excluded folder {}: {}", folder, e.getMessage());
            return 0;
        }
    }

    /**
     * Keep the folder given in the source URL and its descendants; everything when null
     */
    static List<String> restrictTo(List<String> folders, String root, char separator) {
        if (root == null) {
            return folders;
        }
        String nativeRoot = root.replace(FolderMappingRule.SEPARATOR, separator);
        List<String> kept = new ArrayList<>();
        for (String folder : folders) {
            if (folder.equals(nativeRoot) || folder.startsWith(nativeRoot + separator)) {
                kept.add(folder);
            }
        }
        if (kept.isEmpty()) {
            log.warn("Source folder '{}' not found", root);
        }
        return kept;
    }
}
