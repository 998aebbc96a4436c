package com.mailboxcopy;

import com.mailboxcopy.cli.CopyCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import picocli.CommandLine;

/**
 * mailbox-copy
 *
 * Idempotent IMAP account copy
 * - Jakarta Mail IMAP client
 * - Folder mapping, exclusion and size limit
 * - Reactor fetch/append pipeline
 * - Dry-run report
 */
@SpringBootApplication
@EnableConfigurationProperties
@RequiredArgsConstructor
public class MailboxCopyApplication implements CommandLineRunner, ExitCodeGenerator {

    private final CopyCommand copyCommand;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(copyCommand).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MailboxCopyApplication.class, args)));
    }
}
