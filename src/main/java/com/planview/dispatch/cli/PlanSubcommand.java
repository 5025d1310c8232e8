package com.planview.dispatch.cli;

import com.planview.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.IntSupplier;

/**
 * Base for every subcommand that works on the plan file.
 * <p>
 * Runtime failures are reported as {@code Error: <message>} on stderr and
 * turn into exit status 1.
 */
abstract class PlanSubcommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlanSubcommand.class);

    @ParentCommand
    protected PlanViewCommand root;

    @Override
    public Integer call() {
        Path planFile = root.planFile();
        return guard(planFile, () -> execute(planFile));
    }

    protected abstract int execute(Path planFile);

    protected boolean json() {
        return root.isJson();
    }

    static int guard(Path planFile, IntSupplier body) {
        MdcContext.setPlanFile(planFile);
        try {
            return body.getAsInt();
        } catch (RuntimeException e) {
            log.debug("Command failed", e);
            ConsoleOutput.error(e.getMessage());
            return 1;
        } finally {
            MdcContext.clear();
        }
    }
}
