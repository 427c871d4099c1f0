package com.agentcrew.orchestrator;

import com.agentcrew.capability.CapabilityBinder;
import com.agentcrew.context.ExecutionContextCache;
import com.agentcrew.oracle.OracleDecision;
import com.agentcrew.oracle.PlanningOracle;
import com.agentcrew.oracle.PlanningRequest;
import com.agentcrew.persistence.InMemoryCrewRepository;
import com.agentcrew.persistence.InMemoryTaskStore;
import com.agentcrew.persistence.InMemoryTelemetryStore;
import com.agentcrew.shared.model.Agent;
import com.agentcrew.shared.model.AgentConnection;
import com.agentcrew.shared.model.ExecutionMode;
import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.Task;
import com.agentcrew.shared.model.TaskMessage;
import com.agentcrew.shared.retry.RetryPolicy;
import com.agentcrew.telemetry.CostEstimator;
import com.agentcrew.telemetry.CrewMetrics;
import com.agentcrew.transport.FakeAgentTransport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory crew "c1" with a researcher and a writer, wired to a fake transport.
 */
class CrewFixture {

    final FakeAgentTransport transport = new FakeAgentTransport();
    final InMemoryCrewRepository crews = new InMemoryCrewRepository();
    final InMemoryTaskStore tasks = new InMemoryTaskStore();
    final InMemoryTelemetryStore telemetry = new InMemoryTelemetryStore();
    final CrewMetrics metrics = new CrewMetrics();
    final CostEstimator costs = new CostEstimator();
    final ExecutionContextCache contexts;

    CrewFixture() {
        crews.registerAgent(agent("researcher", "Researcher"));
        crews.registerAgent(agent("writer", "Writer"));
        crews.createCrew("c1", "Analysts", null);
        crews.addMember("c1", "researcher", "finds facts");
        crews.addMember("c1", "writer", "writes prose");
        contexts = new ExecutionContextCache(crews, new CapabilityBinder(transport, RetryPolicy.none()));
        crews.addListener(contexts);
    }

    static Agent agent(String id, String name) {
        return new Agent(id, name, null, null, new AgentConnection(null, id, "secret"), true);
    }

    Task task(ExecutionMode mode) {
        return tasks.create("Market report", "Summarise the EV market", "c1", mode);
    }

    List<TaskMessage> messages(Task task) {
        return tasks.messages(task.id());
    }

    static long agentReplies(PlanningRequest request) {
        return request.transcript().stream().filter(m -> m.author() == MessageAuthor.AGENT).count();
    }

    /** Answers planning requests from a queue of steps; records every request it saw. */
    static class ScriptedOracle implements PlanningOracle {
        final List<PlanningRequest> seen = new CopyOnWriteArrayList<>();
        private final Deque<Function<PlanningRequest, OracleDecision>> steps = new ArrayDeque<>();

        ScriptedOracle then(Function<PlanningRequest, OracleDecision> step) {
            steps.add(step);
            return this;
        }

        @Override
        public synchronized OracleDecision plan(PlanningRequest request) {
            seen.add(request);
            var step = steps.size() > 1 ? steps.poll() : steps.peek();
            if (step == null) throw new IllegalStateException("no scripted step");
            return step.apply(request);
        }
    }
}
