package com.agentcrew.context;

import com.agentcrew.capability.CapabilityBinder;
import com.agentcrew.persistence.CrewNotFoundException;
import com.agentcrew.persistence.CrewRepository;
import com.agentcrew.persistence.MembershipListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Read-through cache of one {@link ExecutionContext} per crew.
 *
 * <p>An entry is served only while its membership version matches the crew's current
 * version, so a lost invalidation costs a rebuild and never a stale capability set.
 * Concurrent misses for the same crew share one rebuild, and invalidations of a crew wait
 * for its rebuild; different crews use different locks.
 */
public class ExecutionContextCache implements MembershipListener {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContextCache.class);

    private final CrewRepository crews;
    private final CapabilityBinder binder;
    private final Clock clock;
    private final Map<String, ExecutionContext> contexts = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ExecutionContextCache(CrewRepository crews, CapabilityBinder binder) {
        this(crews, binder, Clock.systemUTC());
    }

    public ExecutionContextCache(CrewRepository crews, CapabilityBinder binder, Clock clock) {
        this.crews = crews;
        this.binder = binder;
        this.clock = clock;
    }

    public ExecutionContext get(String crewId) {
        var crew = crews.findCrew(crewId).orElseThrow(() -> new CrewNotFoundException(crewId));
        var cached = contexts.get(crewId);
        if (cached != null && cached.membershipVersion() == crew.membershipVersion()) {
            return cached;
        }

        var lock = locks.computeIfAbsent(crewId, id -> new ReentrantLock());
        lock.lock();
        try {
            // membership may have moved on while waiting for the lock
            var current = crews.findCrew(crewId).orElseThrow(() -> new CrewNotFoundException(crewId));
            cached = contexts.get(crewId);
            if (cached != null && cached.membershipVersion() == current.membershipVersion()) {
                return cached;
            }
            var capabilities = binder.bind(crewId, current.members());
            var context = new ExecutionContext(crewId, current.name(), current.membershipVersion(),
                    capabilities, clock.instant());
            contexts.put(crewId, context);
            log.info("Built execution context for crew {} at version {} with {} capabilities",
                    crewId, current.membershipVersion(), capabilities.size());
            return context;
        } finally {
            lock.unlock();
        }
    }

    /** Drops the crew's entry; waits for a rebuild of that crew in progress to finish first. */
    public void invalidate(String crewId) {
        var lock = locks.computeIfAbsent(crewId, id -> new ReentrantLock());
        lock.lock();
        try {
            if (contexts.remove(crewId) != null) {
                log.debug("Invalidated execution context for crew {}", crewId);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void membershipChanged(String crewId, long newVersion) {
        invalidate(crewId);
    }

    public Set<String> cachedCrewIds() {
        return new TreeSet<>(contexts.keySet());
    }

    /** Function name to description for the cached context; empty when nothing is cached. */
    public Map<String, String> describe(String crewId) {
        var context = contexts.get(crewId);
        var out = new LinkedHashMap<String, String>();
        if (context == null) return out;
        for (var c : context.template().all()) {
            out.put(c.functionName(), c.description());
        }
        return out;
    }
}
