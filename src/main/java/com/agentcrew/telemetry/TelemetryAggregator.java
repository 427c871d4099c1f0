package com.agentcrew.telemetry;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds any collection of events into per-(kind, target) statistics. Works on events
 * alone, so it can be applied to a single run or to whatever a store returns.
 */
public final class TelemetryAggregator {

    private TelemetryAggregator() {}

    public static List<TargetStats> aggregate(Collection<TelemetryEvent> events) {
        var stats = new LinkedHashMap<String, TargetStats>();
        for (var e : events) {
            stats.compute(key(e.kind(), e.target()),
                    (k, s) -> (s != null ? s : TargetStats.empty(e.kind(), e.target())).plus(e));
        }
        return List.copyOf(stats.values());
    }

    public static Map<String, TargetStats> byTarget(Collection<TelemetryEvent> events, TelemetryKind kind) {
        var result = new LinkedHashMap<String, TargetStats>();
        for (var s : aggregate(events)) {
            if (s.kind() == kind) result.put(s.target(), s);
        }
        return result;
    }

    /** Oracle usage across {@code events}; agent calls carry no tokens and are skipped. */
    public static UsageSummary usage(Collection<TelemetryEvent> events) {
        var total = UsageSummary.EMPTY;
        for (var e : events) {
            if (e.kind() == TelemetryKind.ORACLE_CALL) total = total.plus(e);
        }
        return total;
    }

    /** Oracle usage per model, in first-seen order. Calls that failed before a model answered count under "unknown". */
    public static Map<String, UsageSummary> usageByModel(Collection<TelemetryEvent> events) {
        var result = new LinkedHashMap<String, UsageSummary>();
        for (var e : events) {
            if (e.kind() != TelemetryKind.ORACLE_CALL) continue;
            var model = e.model() != null ? e.model() : "unknown";
            result.compute(model, (k, u) -> (u != null ? u : UsageSummary.EMPTY).plus(e));
        }
        return result;
    }

    private static String key(TelemetryKind kind, String target) {
        return kind.tag() + ":" + target;
    }
}
