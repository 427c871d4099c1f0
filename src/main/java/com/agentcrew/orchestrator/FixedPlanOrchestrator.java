package com.agentcrew.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.agentcrew.oracle.Action;
import com.agentcrew.oracle.OracleFailureException;
import com.agentcrew.oracle.PlanDrafter;
import com.agentcrew.oracle.PlanStep;
import com.agentcrew.persistence.TaskStore;
import com.agentcrew.persistence.TelemetryStore;
import com.agentcrew.telemetry.CostEstimator;
import com.agentcrew.telemetry.CrewMetrics;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drafts the whole plan up front, runs every step in order, then asks the oracle to merge
 * the replies. Used for tasks in {@code FIXED_PLAN} mode.
 */
public class FixedPlanOrchestrator extends AbstractTaskOrchestrator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PlanDrafter drafter;

    public FixedPlanOrchestrator(PlanDrafter drafter, TaskStore tasks, TelemetryStore telemetryStore,
                                 CrewMetrics metrics, CostEstimator costEstimator, OrchestratorSettings settings) {
        this(drafter, tasks, telemetryStore, metrics, costEstimator, settings, Clock.systemUTC());
    }

    public FixedPlanOrchestrator(PlanDrafter drafter, TaskStore tasks, TelemetryStore telemetryStore,
                                 CrewMetrics metrics, CostEstimator costEstimator, OrchestratorSettings settings,
                                 Clock clock) {
        super(tasks, telemetryStore, metrics, costEstimator, settings, clock);
        this.drafter = drafter;
    }

    @Override
    protected String execute(TaskRun run) {
        var planning = run.planningRequest();
        var draft = consult(run, () -> drafter.draft(planning));
        var steps = draft.steps();
        run.appendSystem("Task plan created:\n" + render(steps));

        for (var step : steps) {
            invoke(run, new Action.Invoke(step.capability(), step.message(), step.reasoning()));
        }

        var merging = run.planningRequest();
        var decision = consult(run, () -> drafter.aggregate(merging));
        if (!(decision.action() instanceof Action.Conclude conclude)) {
            throw new OracleFailureException("Aggregation did not produce an answer");
        }
        run.transition(RunState.CONCLUDING);
        return conclude.answer();
    }

    private static String render(List<PlanStep> steps) {
        var plan = steps.stream().map(s -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("agent", s.capability());
            m.put("subtask", s.message());
            m.put("reasoning", s.reasoning());
            return m;
        }).toList();
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(Map.of("plan", plan));
        } catch (JsonProcessingException e) {
            return plan.toString();
        }
    }
}
