package com.ryuqq.transmap.core.spi;

/**
 * External test-execution framework SPI.
 *
 * <p>The runner reports the planned step count, the scope of the combination
 * currently executing and the outcome of each executed combination. Interpreting
 * pass/fail semantics of individual checks is the framework's business: the
 * synthesizer only forwards what the callbacks report.</p>
 *
 * <p><strong>Call Sequence:</strong></p>
 * <pre>
 * caseBegin(name)
 * plan(n)                      // before the action phase (upfront plan mode)
 * for each dispatched combination:
 *   scopeChanged(scope)
 *   stepPassed(scope) | stepFailed(scope, failure)
 * plan(n)                      // after the run (lazy plan mode)
 * caseEnd(name)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Single-threaded use per test item</li>
 *   <li>Must not reorder or buffer-and-reorder notifications</li>
 * </ul>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public interface TestFramework {

    /**
     * Marks the beginning of a test case.
     *
     * @param name the test case identifier
     */
    void caseBegin(String name);

    /**
     * Declares the number of planned steps.
     *
     * @param steps total number of dispatched combinations
     */
    void plan(int steps);

    /**
     * Publishes the printable scope of the combination about to execute.
     *
     * @param scope state names joined by {@code /}, empty outside the action loop
     */
    void scopeChanged(String scope);

    /**
     * Records a combination that completed all its callbacks.
     *
     * @param scope the combination scope
     */
    void stepPassed(String scope);

    /**
     * Records a combination whose callback failed.
     *
     * @param scope the combination scope
     * @param failure the failure raised by the callback
     */
    void stepFailed(String scope, Throwable failure);

    /**
     * Marks the end of a test case.
     *
     * @param name the test case identifier
     */
    void caseEnd(String name);
}
