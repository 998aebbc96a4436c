package com.mailboxcopy.service;

import com.mailboxcopy.config.CopyProperties;
import com.mailboxcopy.domain.CopyTask;
import com.mailboxcopy.domain.FetchedMessage;
import com.mailboxcopy.domain.FolderDiff;
import com.mailboxcopy.domain.RunReport;
import com.mailboxcopy.domain.RunReport.FailureKind;
import com.mailboxcopy.exception.ConnectionException;
import com.mailboxcopy.exception.FolderCreateException;
import com.mailboxcopy.exception.TransientTaskException;
import com.mailboxcopy.imap.MailboxSession;
import com.mailboxcopy.util.SizeFormatter;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies planned operations
 * - Folder creation, failures isolated to the folder subtree
 * - Message copy: fetch and append pipelined on one thread per session;
 *   on stop no new fetch starts, fetched messages are still written
 * - Dry run: counts only, no fetch and no mutation
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CopyExecutionService {

    private final CopyProperties properties;

    /**
     * Create the planned destination folders.
     * A folder another client or an earlier run created meanwhile is reported as already existing.
     */
    public FolderCreation createFolders(List<String> folders, AccountConnection destination,
                                     RunContext ctx, char separator) {
        RunReport report = ctx.getReport();
        Set<String> failed = new LinkedHashSet<>();
        Set<String> existing = new LinkedHashSet<>();

        for (String folder : folders) {
            if (ctx.shouldStop()) {
                break;
            }
            String failedParent = findAncestor(folder, failed, separator);
            if (failedParent != null) {
                failed.add(folder);
                report.addFailure(FailureKind.FOLDER_CREATE, folder, null,
                        "parent folder " + failedParent + " could not be created");
                continue;
            }
            if (ctx.isDryRun()) {
                log.info("Would create destination folder {}", folder);
                report.folderCreated();
                continue;
            }
            try {
                MailboxSession.CreateResult result = destination.call(s -> s.createFolder(folder));
                if (result == MailboxSession.CreateResult.CREATED) {
                    log.info("Created destination folder {}", folder);
                    report.folderCreated();
                } else {
                    log.debug("Destination folder {} already exists", folder);
                    existing.add(folder);
                }
            } catch (ConnectionException e) {
                connectionLost(ctx, destination, folder, e);
                break;
            } catch (FolderCreateException | TransientTaskException e) {
                log.warn("Cannot create destination folder {}: {}", folder, e.getMessage());
                failed.add(folder);
                report.addFailure(FailureKind.FOLDER_CREATE, folder, null, e.getMessage());
            }
        }
        return new FolderCreation(failed, existing);
    }

    /**
     * Returns the folder itself or its nearest recorded ancestor found in the given set, or null
     */
    public static String findAncestor(String folder, Set<String> candidates, char separator) {
        for (String candidate : candidates) {
            if (folder.equals(candidate) || folder.startsWith(candidate + separator)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Copy the messages of one folder diff
     */
    public void copy(FolderDiff diff, AccountConnection source, AccountConnection destination,
                     RunContext ctx, int bufferSize) {
        List<CopyTask> tasks = diff.getTasks();
        if (tasks.isEmpty()) {
            return;
        }
        if (ctx.isDryRun()) {
            simulate(tasks, ctx);
            return;
        }

        String destinationFolder = diff.getFolderPair().getDestinationPath();
        AtomicInteger settled = new AtomicInteger();
        Scheduler fetchScheduler = Schedulers.newSingle("fetch-" + source.getLabel());
        Scheduler appendScheduler = Schedulers.newSingle("append-" + destination.getLabel());
        try {
            Flux.fromIterable(tasks)
                    .takeWhile(task -> !ctx.shouldStop())
                    .concatMap(task -> fetch(task, source, ctx, settled).subscribeOn(fetchScheduler), 1)
                    .publishOn(appendScheduler, Math.max(1, bufferSize))
                    .concatMap(transfer -> append(transfer, destinationFolder, destination, ctx, settled), 1)
                    .blockLast();
        } finally {
            fetchScheduler.dispose();
            appendScheduler.dispose();
        }

        int remaining = tasks.size() - settled.get();
        if (remaining > 0) {
            log.warn("{} messages for {} were not attempted", remaining, destinationFolder);
            ctx.getReport().notAttempted(remaining);
        }
    }

    public int defaultBufferSize() {
        return properties.getTransfer().getBufferSize();
    }

    private void simulate(List<CopyTask> tasks, RunContext ctx) {
        int settled = 0;
        for (CopyTask task : tasks) {
            if (ctx.shouldStop()) {
                break;
            }
            log.debug("Would copy {} ({}) to {}", task.getIdentity(), SizeFormatter.format(task.getSizeBytes()),
                    task.getFolderPair().getDestinationPath());
            ctx.getReport().messageCopied(task.getSizeBytes());
            settled++;
        }
        if (settled < tasks.size()) {
            ctx.getReport().notAttempted(tasks.size() - settled);
        }
    }

    private Mono<Transfer> fetch(CopyTask task, AccountConnection source, RunContext ctx, AtomicInteger settled) {
        return Mono.fromCallable(() -> {
                    if (ctx.shouldStop()) {
                        return null;
                    }
                    log.debug("Read {} ({}) from source {}", task.getIdentity(), SizeFormatter.format(task.getSizeBytes()),
                            task.getFolderPair().getSourcePath());
                    FetchedMessage message = source.call(s -> s.fetchMessage(task.getFolderPair().getSourcePath(), task.toMessageInfo()));
                    return new Transfer(task, message);
                })
                .onErrorResume(e -> {
                    settled.incrementAndGet();
                    failed(FailureKind.FETCH, task.getFolderPair().getSourcePath(), task, source, ctx, e);
                    return Mono.empty();
                });
    }

    private Mono<Void> append(Transfer transfer, String folder, AccountConnection destination,
                              RunContext ctx, AtomicInteger settled) {
        CopyTask task = transfer.getTask();
        return Mono.<Void>fromRunnable(() -> {
                    // Already fetched: finish it unless the destination is gone
                    if (destination.isBroken()) {
                        return;
                    }
                    log.debug("Write {} ({}) to destination folder {}", task.getIdentity(),
                            SizeFormatter.format(task.getSizeBytes()), folder);
                    destination.run(s -> s.appendMessage(folder, transfer.getMessage()));
                    settled.incrementAndGet();
                    ctx.getReport().messageCopied(task.getSizeBytes());
                })
                .onErrorResume(e -> {
                    settled.incrementAndGet();
                    failed(FailureKind.APPEND, folder, task, destination, ctx, e);
                    return Mono.empty();
                });
    }

    private void failed(FailureKind kind, String folder, CopyTask task, AccountConnection connection,
                        RunContext ctx, Throwable e) {
        ctx.getReport().addFailure(kind, folder, task.getIdentity(), String.valueOf(e.getMessage()));
        if (e instanceof ConnectionException connectionException) {
            connectionLost(ctx, connection, folder, connectionException);
            return;
        }
        log.warn("{} error for {} in {}: {}", kind == FailureKind.FETCH ? "Read" : "Write",
                task.getIdentity(), folder, e.getMessage());
    }

    private void connectionLost(RunContext ctx, AccountConnection connection, String folder, ConnectionException e) {
        ctx.getReport().addFailure(FailureKind.CONNECTION, folder, null, e.getMessage());
        log.error("{} connection could not be recovered while working on {}: {}",
                connection.getLabel(), folder, e.getMessage());
        ctx.getReport().markIncomplete(connection.getLabel() + " connection lost");
    }

    @Value
    private static class Transfer {
        CopyTask task;
        FetchedMessage message;
    }
}
