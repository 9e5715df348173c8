package com.ryuqq.transmap.adapter.inmemory.framework;

import com.ryuqq.transmap.core.spi.TestFramework;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link TestFramework} that records every notification.
 *
 * <p><strong>Recorded Data:</strong></p>
 * <ul>
 *   <li><strong>events:</strong> notifications in call order, e.g. {@code plan(4)}, {@code pass(Slow/Empty)}</li>
 *   <li><strong>plans:</strong> declared plan per test case</li>
 *   <li><strong>failures:</strong> failures keyed by scope</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong> not thread-safe, single test case at a time.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public class InMemoryTestFramework implements TestFramework {

    private final List<String> events = new ArrayList<>();
    private final Map<String, Integer> plans = new LinkedHashMap<>();
    private final Map<String, Throwable> failures = new LinkedHashMap<>();
    private final List<String> passed = new ArrayList<>();
    private String currentCase;
    private String currentScope = "";

    @Override
    public void caseBegin(String name) {
        if (currentCase != null) {
            throw new IllegalStateException("Test case already running: " + currentCase);
        }
        currentCase = name;
        events.add("begin(" + name + ")");
    }

    @Override
    public void plan(int steps) {
        if (currentCase == null) {
            throw new IllegalStateException("plan() outside of a test case");
        }
        plans.put(currentCase, steps);
        events.add("plan(" + steps + ")");
    }

    @Override
    public void scopeChanged(String scope) {
        currentScope = scope;
        events.add("scope(" + scope + ")");
    }

    @Override
    public void stepPassed(String scope) {
        passed.add(scope);
        events.add("pass(" + scope + ")");
    }

    @Override
    public void stepFailed(String scope, Throwable failure) {
        failures.put(scope, failure);
        events.add("fail(" + scope + ")");
    }

    @Override
    public void caseEnd(String name) {
        if (currentCase == null || !currentCase.equals(name)) {
            throw new IllegalStateException("caseEnd(" + name + ") does not match running case " + currentCase);
        }
        currentCase = null;
        currentScope = "";
        events.add("end(" + name + ")");
    }

    public List<String> getEvents() {
        return List.copyOf(events);
    }

    /**
     * Returns the declared plan of a test case.
     *
     * @param caseName test case identifier
     * @return declared steps, or -1 when no plan was declared
     */
    public int getPlan(String caseName) {
        return plans.getOrDefault(caseName, -1);
    }

    public List<String> getPassed() {
        return List.copyOf(passed);
    }

    public Map<String, Throwable> getFailures() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public String getCurrentScope() {
        return currentScope;
    }

    public boolean isCaseRunning() {
        return currentCase != null;
    }

    public void clear() {
        events.clear();
        plans.clear();
        failures.clear();
        passed.clear();
        currentCase = null;
        currentScope = "";
    }
}
