package io.governance.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class GovernanceMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter pollsCreated = registry.counter("gov.polls.created");
    private static final Counter votesCast = registry.counter("gov.votes.cast");
    private static final Counter pollsExecuted = registry.counter("gov.polls.executed");
    private static final Counter pollsExpired = registry.counter("gov.polls.expired");
    private static final Counter dispatchFailures = registry.counter("gov.dispatch.failures");

    private GovernanceMetrics() {}

    public static <T> T recordInvocation(String action, Supplier<T> invocation) {
        return registry.timer("gov.invocation.time", "action", action).record(invocation);
    }

    public static void incrementPollsCreated() { pollsCreated.increment(); }
    public static void incrementVotesCast() { votesCast.increment(); }
    public static void incrementPollsExecuted() { pollsExecuted.increment(); }
    public static void incrementPollsExpired() { pollsExpired.increment(); }
    public static void incrementDispatchFailures() { dispatchFailures.increment(); }

    public static void recordPollEnded(boolean passed) {
        registry.counter("gov.polls.ended", "outcome", passed ? "passed" : "rejected").increment();
    }

    public static void recordFailure(String action, String error) {
        registry.counter("gov.invocation.failures", "action", action, "error", error).increment();
    }

    /** Starts timing one RPC request; finish with {@link #stopRequest}. */
    public static Timer.Sample startRequest() {
        return Timer.start(registry);
    }

    public static void stopRequest(Timer.Sample sample, String method, String path, int status) {
        sample.stop(registry.timer("gov.rpc.requests", "method", method, "path", path, "status", Integer.toString(status)));
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                m.getId().getTags().forEach(t -> sb.append(',').append(t.getKey()).append('=').append(t.getValue()));
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
