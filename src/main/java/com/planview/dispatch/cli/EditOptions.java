package com.planview.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Options shared by the commands that modify the plan.
 */
public class EditOptions {

    @Option(names = {"-q", "--quiet"}, description = "Suppress output on success")
    boolean quiet;

    @Option(names = {"-d", "--dry-run"}, description = "Show what would change without writing")
    boolean dryRun;
}
