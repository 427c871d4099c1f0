package com.agentcrew.gateway.http;

import com.agentcrew.persistence.TelemetryStore;
import com.agentcrew.shared.model.TaskStatus;
import com.agentcrew.telemetry.CrewMetrics;
import com.agentcrew.telemetry.TelemetryAggregator;
import com.agentcrew.telemetry.TelemetryKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Usage and performance across tasks, folded from stored telemetry. Windows are
 * {@code [from, to)} as ISO-8601 instants; the default window is the last seven days.
 */
@RestController
public class MetricsController {

    private static final Duration DEFAULT_WINDOW = Duration.ofDays(7);

    private final TelemetryStore telemetry;
    private final CrewMetrics metrics;
    private final Clock clock;

    @Autowired
    public MetricsController(TelemetryStore telemetry, CrewMetrics metrics) {
        this(telemetry, metrics, Clock.systemUTC());
    }

    MetricsController(TelemetryStore telemetry, CrewMetrics metrics, Clock clock) {
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.clock = clock;
    }

    @GetMapping("/v1/metrics/usage")
    public Map<String, Object> usage(@RequestParam(required = false) String from,
                                     @RequestParam(required = false) String to) {
        var window = window(from, to);
        var events = telemetry.findBetween(window.from(), window.to());
        var out = window.describe();
        out.put("usage", TelemetryAggregator.usage(events));
        out.put("byModel", TelemetryAggregator.usageByModel(events));
        return out;
    }

    @GetMapping("/v1/metrics/agents")
    public Map<String, Object> agents(@RequestParam(required = false) String from,
                                      @RequestParam(required = false) String to) {
        var window = window(from, to);
        var events = telemetry.findBetween(window.from(), window.to());
        var out = window.describe();
        out.put("agents", TelemetryAggregator.byTarget(events, TelemetryKind.AGENT_CALL).values());
        return out;
    }

    @GetMapping("/v1/metrics/summary")
    public Map<String, Object> summary() {
        var now = clock.instant();
        var today = now.truncatedTo(ChronoUnit.DAYS);
        var month = now.atOffset(ZoneOffset.UTC).withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).toInstant();
        var tasks = new LinkedHashMap<String, Object>();
        tasks.put("inProgress", metrics.tasksInProgress());
        tasks.put("completed", (long) metrics.tasks(TaskStatus.COMPLETED).count());
        tasks.put("failed", (long) metrics.tasks(TaskStatus.FAILED).count());

        var out = new LinkedHashMap<String, Object>();
        out.put("today", TelemetryAggregator.usage(telemetry.findBetween(today, now.plusMillis(1))));
        out.put("month", TelemetryAggregator.usage(telemetry.findBetween(month, now.plusMillis(1))));
        out.put("tasks", tasks);
        return out;
    }

    private Window window(String from, String to) {
        var end = to != null ? parse("to", to) : clock.instant();
        var start = from != null ? parse("from", from) : end.minus(DEFAULT_WINDOW);
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("from must be before to");
        }
        return new Window(start, end);
    }

    private static Instant parse(String name, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + " instant: " + value, e);
        }
    }

    private record Window(Instant from, Instant to) {
        Map<String, Object> describe() {
            var out = new LinkedHashMap<String, Object>();
            out.put("from", from);
            out.put("to", to);
            return out;
        }
    }
}
