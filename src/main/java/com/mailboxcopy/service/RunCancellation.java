package com.mailboxcopy.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator interrupt handling.
 * The shutdown hook stops new transfers and waits for the run to print its partial report.
 */
@Slf4j
@Component
public class RunCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Interrupted: no new transfer will be started");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Called once the report has been emitted
     */
    public void finished() {
        finished.countDown();
    }

    public boolean awaitFinished(long timeoutMs) throws InterruptedException {
        return finished.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public Thread installShutdownHook(long graceMs) {
        Thread hook = new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            cancel();
            try {
                if (!awaitFinished(graceMs)) {
                    log.error("In-flight transfers did not finish within {}ms", graceMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "mailbox-copy-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }
}
