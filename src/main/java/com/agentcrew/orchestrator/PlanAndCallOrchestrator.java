package com.agentcrew.orchestrator;

import com.agentcrew.oracle.Action;
import com.agentcrew.oracle.OracleFailureException;
import com.agentcrew.oracle.PlanningOracle;
import com.agentcrew.persistence.TaskStore;
import com.agentcrew.persistence.TelemetryStore;
import com.agentcrew.telemetry.CostEstimator;
import com.agentcrew.telemetry.CrewMetrics;

import java.time.Clock;

/**
 * Lets the oracle pick one capability call at a time, feeding every reply back before the
 * next decision, until it concludes or the iteration limit is hit.
 */
public class PlanAndCallOrchestrator extends AbstractTaskOrchestrator {

    private final PlanningOracle oracle;

    public PlanAndCallOrchestrator(PlanningOracle oracle, TaskStore tasks, TelemetryStore telemetryStore,
                                   CrewMetrics metrics, CostEstimator costEstimator, OrchestratorSettings settings) {
        this(oracle, tasks, telemetryStore, metrics, costEstimator, settings, Clock.systemUTC());
    }

    public PlanAndCallOrchestrator(PlanningOracle oracle, TaskStore tasks, TelemetryStore telemetryStore,
                                   CrewMetrics metrics, CostEstimator costEstimator, OrchestratorSettings settings,
                                   Clock clock) {
        super(tasks, telemetryStore, metrics, costEstimator, settings, clock);
        this.oracle = oracle;
    }

    @Override
    protected String execute(TaskRun run) {
        for (int step = 0; step < settings.maxIterations(); step++) {
            var request = run.planningRequest();
            var decision = consult(run, () -> oracle.plan(request));
            if (decision.action() instanceof Action.Conclude conclude) {
                run.transition(RunState.CONCLUDING);
                return conclude.answer();
            }
            if (decision.action() instanceof Action.Invoke invoke) {
                invoke(run, invoke);
            } else {
                throw new OracleFailureException("Oracle returned no usable action: " + decision.action());
            }
        }
        throw new PlanningIterationLimitExceededException(settings.maxIterations());
    }
}
