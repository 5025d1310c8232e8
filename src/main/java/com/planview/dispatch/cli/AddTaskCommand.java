package com.planview.dispatch.cli;

import com.planview.core.engine.PlanEngine;
import com.planview.core.model.Task;
import com.planview.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: pv add-task &lt;phase&gt; &lt;title&gt; [--agent A] [--skill S] [--deps ID,ID]
 */
@Command(name = "add-task", mixinStandardHelpOptions = true, description = "Add a new task to a phase")
@Component
public class AddTaskCommand extends PlanEditCommand {

    @Parameters(index = "0", description = "Phase ID")
    private String phaseId;

    @Parameters(index = "1", description = "Task title")
    private String title;

    @Option(names = "--agent", description = "Agent type")
    private String agent;

    @Option(names = "--skill", description = "Skill to apply")
    private String skill;

    @Option(names = "--deps", split = ",", description = "Comma-separated dependency IDs")
    private List<String> deps = new ArrayList<>();

    public AddTaskCommand(PlanStore planStore, PlanEngine planEngine) {
        super(planStore, planEngine);
    }

    @Override
    protected int execute(Path planFile) {
        return edit(planFile, plan -> {
            Task task = planEngine.addTask(plan, phaseId, title, agent, skill, deps);
            return "Added [" + task.getId() + "] " + title;
        });
    }
}
