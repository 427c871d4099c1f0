package com.agentcrew.oracle;

import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.TaskMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class PromptBuilder {

    private static final String ORCHESTRATOR_PROMPT = """
            You are an AI task orchestrator responsible for solving complex tasks by using specialized AI agents.

            CREW NAME:
            %s

            Solve the task by calling the available agent functions. Each agent has specific capabilities. \
            You can ask agents questions, give them subtasks, and use their responses to build a comprehensive solution.

            Think step by step:
            1. Break the task into logical steps.
            2. For each step, decide which agent is best suited to handle it.
            3. Call exactly one agent function at a time with a clear, specific request.
            4. Use the agent's response to move forward.
            5. If needed, ask follow-up questions to the same or different agents.

            When you have enough information, reply without calling a function. \
            That reply is the final answer and must fully address the original task.""";

    private static final String PLANNER_PROMPT = """
            You are an AI task orchestrator. Break the task down into subtasks that can be assigned to specialized AI agents.

            AVAILABLE AGENTS:
            %s

            Create a plan of 3-7 sequential subtasks. For each subtask specify:
            1. the subtask description, specific about what information you need
            2. which agent should handle it, by its function name
            3. why this agent is best suited for it

            Your output must be valid JSON only, with no markdown and no explanatory text:
            {"plan": [{"subtask": "...", "agent": "<function name>", "reasoning": "..."}]}""";

    private static final String AGGREGATOR_PROMPT = """
            You are a result aggregator for a multi-agent task execution system. \
            Compile the results from the agents into one coherent final result that addresses the original task. \
            Integrate all the information the agents provided into a clear, actionable answer. \
            Keep your response concise but thorough.""";

    public List<Map<String, Object>> orchestrate(PlanningRequest request) {
        var messages = new ArrayList<Map<String, Object>>();
        messages.add(message("system", ORCHESTRATOR_PROMPT.formatted(nonNull(request.crewName()))));
        messages.add(message("user", taskText(request)));
        for (var m : request.transcript()) {
            messages.add(message("user", render(m)));
        }
        return messages;
    }

    public List<Map<String, Object>> draft(PlanningRequest request) {
        var agents = new StringBuilder();
        for (var c : request.capabilities()) {
            agents.append("- ").append(c.name()).append(": ").append(c.description()).append('\n');
        }
        return List.of(
                message("system", PLANNER_PROMPT.formatted(agents.toString().trim())),
                message("user", taskText(request)));
    }

    public List<Map<String, Object>> aggregate(PlanningRequest request) {
        var responses = new StringBuilder();
        for (var m : request.transcript()) {
            if (m.author() != MessageAuthor.AGENT) continue;
            responses.append("[").append(m.authorName()).append("]\n").append(m.content()).append("\n\n");
        }
        return List.of(
                message("system", AGGREGATOR_PROMPT),
                message("user", taskText(request) + "\n\nAGENT RESPONSES:\n"
                        + (responses.length() == 0 ? "(none)" : responses.toString().trim())));
    }

    static String render(TaskMessage m) {
        return switch (m.author()) {
            case AGENT -> "Response from " + m.authorName() + ":\n" + m.content();
            case SYSTEM -> "[system] " + m.content();
            case USER -> m.content();
        };
    }

    private static String taskText(PlanningRequest request) {
        var sb = new StringBuilder("TASK: ").append(nonNull(request.taskTitle()));
        if (request.taskDescription() != null && !request.taskDescription().isBlank()) {
            sb.append("\n\nTASK DESCRIPTION:\n").append(request.taskDescription());
        }
        return sb.toString();
    }

    private static Map<String, Object> message(String role, String content) {
        return Map.of("role", role, "content", content);
    }

    private static String nonNull(String s) {
        return s == null ? "" : s;
    }
}
