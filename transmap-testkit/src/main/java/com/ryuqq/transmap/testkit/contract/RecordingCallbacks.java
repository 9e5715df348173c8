package com.ryuqq.transmap.testkit.contract;

import com.ryuqq.transmap.application.runner.Fixture;
import com.ryuqq.transmap.core.model.State;
import com.ryuqq.transmap.core.synth.ActionCallbacks;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Callbacks and fixture that record every invocation as a trace entry.
 *
 * <p><strong>Trace Format:</strong></p>
 * <ul>
 *   <li>{@code setup}, {@code stop}, {@code teardown}</li>
 *   <li>{@code before}, {@code after}</li>
 *   <li>{@code prepare(0,Slow)}, {@code action}, {@code check(0,Ok)}</li>
 * </ul>
 *
 * <p>A failure can be injected for any trace entry with {@link #failOn(String, RuntimeException)};
 * the entry is recorded before the failure is thrown.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public class RecordingCallbacks implements ActionCallbacks, Fixture {

    private final List<String> trace = new ArrayList<>();
    private final List<String> actionScopes = new ArrayList<>();
    private final Map<String, RuntimeException> failures = new HashMap<>();
    private Supplier<String> scopeProbe = () -> "";
    private int actions;

    /**
     * Makes the given trace entry throw.
     *
     * @param entry trace entry, e.g. {@code check(0,Error)}
     * @param failure the exception to throw
     * @return this recorder
     */
    public RecordingCallbacks failOn(String entry, RuntimeException failure) {
        failures.put(entry, failure);
        return this;
    }

    /**
     * Samples the given supplier at every {@code action()} call.
     *
     * @param probe scope supplier, typically {@code runner::scope}
     * @return this recorder
     */
    public RecordingCallbacks probeScope(Supplier<String> probe) {
        this.scopeProbe = probe;
        return this;
    }

    @Override
    public void setup() {
        record("setup");
    }

    @Override
    public void stop() {
        record("stop");
    }

    @Override
    public void teardown() {
        record("teardown");
    }

    @Override
    public void beforeVariant() {
        record("before");
    }

    @Override
    public void prepare(int preCondition, State state) {
        record("prepare(" + preCondition + "," + state.getName() + ")");
    }

    @Override
    public void action() {
        actions++;
        actionScopes.add(scopeProbe.get());
        record("action");
    }

    @Override
    public void check(int postCondition, State expected) {
        record("check(" + postCondition + "," + expected.getName() + ")");
    }

    @Override
    public void afterVariant() {
        record("after");
    }

    private void record(String entry) {
        trace.add(entry);
        RuntimeException failure = failures.get(entry);
        if (failure != null) {
            throw failure;
        }
    }

    public List<String> getTrace() {
        return List.copyOf(trace);
    }

    /**
     * Returns the trace entries starting with the given prefix.
     *
     * @param prefix entry prefix, e.g. {@code prepare}
     * @return matching entries in call order
     */
    public List<String> traceOf(String prefix) {
        List<String> matching = new ArrayList<>();
        for (String entry : trace) {
            if (entry.startsWith(prefix)) {
                matching.add(entry);
            }
        }
        return matching;
    }

    public List<String> getActionScopes() {
        return List.copyOf(actionScopes);
    }

    public int getActionCount() {
        return actions;
    }

    public void clear() {
        trace.clear();
        actionScopes.clear();
        failures.clear();
        actions = 0;
    }
}
