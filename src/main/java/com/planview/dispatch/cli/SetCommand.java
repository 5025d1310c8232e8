package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * CLI command: pv set &lt;task-id&gt; &lt;field&gt; &lt;value&gt;
 */
@Command(name = "set", mixinStandardHelpOptions = true,
        description = "Set a task field (status, agent, title, skill)")
@Component
public class SetCommand extends PlanEditCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Parameters(index = "1", description = "Field: status, agent, title, skill")
    private String field;

    @Parameters(index = "2", description = "New value; 'none' clears agent or skill")
    private String value;

    public SetCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine);
    }

    @Override
    protected int execute(Path planFile) {
        return edit(planFile, plan -> {
            planEngine.setField(plan, taskId, field, value);
            return "[" + taskId + "] " + field + " → " + value;
        });
    }
}
