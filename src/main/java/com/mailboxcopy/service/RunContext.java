package com.mailboxcopy.service;

import com.mailboxcopy.domain.RunReport;
import lombok.Value;

import java.util.function.BooleanSupplier;

/**
 * State shared by the steps of one run
 */
@Value
public class RunContext {

    RunReport report;
    boolean dryRun;
    BooleanSupplier cancelled;

    public static RunContext of(RunReport report, BooleanSupplier cancelled) {
        return new RunContext(report, report.isDryRun(), cancelled);
    }

    /**
     * No new task may start: interrupted, or a connection could not be recovered
     */
    public boolean shouldStop() {
        return cancelled.getAsBoolean() || report.isIncomplete();
    }
}
