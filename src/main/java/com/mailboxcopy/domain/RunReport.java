package com.mailboxcopy.domain;

import com.mailboxcopy.util.SizeFormatter;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate outcome of one run.
 * Updated from the fetch and append threads, so every mutator is synchronized.
 */
public class RunReport {

    public enum Status {
        COMPLETE,
        INCOMPLETE
    }

    public enum FailureKind {
        CONNECTION,
        LIST,
        FOLDER_CREATE,
        FETCH,
        APPEND
    }

    @Value
    public static class Failure {

        FailureKind kind;
        String folder;
        MessageIdentity identity;   // Null for folder and connection failures
        String cause;

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(kind).append(' ').append(folder);
            if (identity != null) {
                sb.append(' ').append(identity);
            }
            return sb.append(": ").append(cause).toString();
        }
    }

    private final boolean dryRun;
    private Status status = Status.COMPLETE;
    private String incompleteReason;

    private int foldersCreated;
    private int foldersExcluded;
    private int messagesCopied;
    private long bytesCopied;
    private int messagesAlreadyPresent;
    private int messagesSkippedExcluded;
    private int messagesSkippedOversize;
    private int messagesNotAttempted;
    private final List<Failure> failures = new ArrayList<>();

    public RunReport(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public synchronized void folderCreated() {
        foldersCreated++;
    }

    public synchronized void folderExcluded(int messageCount) {
        foldersExcluded++;
        messagesSkippedExcluded += messageCount;
    }

    public synchronized void messageCopied(long size) {
        messagesCopied++;
        bytesCopied += size;
    }

    public synchronized void alreadyPresent(int count) {
        messagesAlreadyPresent += count;
    }

    public synchronized void skippedOversize(int count) {
        messagesSkippedOversize += count;
    }

    public synchronized void notAttempted(int count) {
        messagesNotAttempted += count;
    }

    public synchronized void addFailure(FailureKind kind, String folder, MessageIdentity identity, String cause) {
        failures.add(new Failure(kind, folder, identity, cause));
    }

    public synchronized void markIncomplete(String reason) {
        if (status == Status.COMPLETE) {
            status = Status.INCOMPLETE;
            incompleteReason = reason;
        }
    }

    public synchronized Status getStatus() {
        return status;
    }

    public synchronized boolean isIncomplete() {
        return status == Status.INCOMPLETE;
    }

    public synchronized String getIncompleteReason() {
        return incompleteReason;
    }

    public synchronized int getFoldersCreated() {
        return foldersCreated;
    }

    public synchronized int getFoldersExcluded() {
        return foldersExcluded;
    }

    public synchronized int getMessagesCopied() {
        return messagesCopied;
    }

    public synchronized long getBytesCopied() {
        return bytesCopied;
    }

    public synchronized int getMessagesAlreadyPresent() {
        return messagesAlreadyPresent;
    }

    public synchronized int getMessagesSkippedExcluded() {
        return messagesSkippedExcluded;
    }

    public synchronized int getMessagesSkippedOversize() {
        return messagesSkippedOversize;
    }

    public synchronized int getMessagesNotAttempted() {
        return messagesNotAttempted;
    }

    public synchronized int getMessagesFailed() {
        return (int) failures.stream()
                .filter(f -> f.getKind() == FailureKind.FETCH || f.getKind() == FailureKind.APPEND)
                .count();
    }

    public synchronized List<Failure> getFailures() {
        return Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public synchronized boolean isSuccessful() {
        return status == Status.COMPLETE && failures.isEmpty();
    }

    /**
     * Text printed at the end of a run
     */
    public synchronized String render() {
        String verb = dryRun ? "would be " : "";
        StringBuilder sb = new StringBuilder();
        sb.append(dryRun ? "=== mailbox-copy report (DRY RUN, nothing was changed) ===" : "=== mailbox-copy report ===")
                .append(System.lineSeparator());
        line(sb, "status", status + (incompleteReason != null ? " (" + incompleteReason + ")" : ""));
        line(sb, "folders " + verb + "created", foldersCreated);
        line(sb, "folders excluded", foldersExcluded);
        line(sb, "messages " + verb + "copied", messagesCopied + " (" + SizeFormatter.format(bytesCopied) + ")");
        line(sb, "messages already present", messagesAlreadyPresent);
        line(sb, "messages skipped (excluded)", messagesSkippedExcluded);
        line(sb, "messages skipped (oversize)", messagesSkippedOversize);
        line(sb, "messages failed", getMessagesFailed());
        if (messagesNotAttempted > 0) {
            line(sb, "messages not attempted", messagesNotAttempted);
        }
        if (!failures.isEmpty()) {
            sb.append("failures:").append(System.lineSeparator());
            for (Failure failure : failures) {
                sb.append("  - ").append(failure).append(System.lineSeparator());
            }
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, Object value) {
        sb.append(String.format("%-30s %s", label + ":", value)).append(System.lineSeparator());
    }
}
