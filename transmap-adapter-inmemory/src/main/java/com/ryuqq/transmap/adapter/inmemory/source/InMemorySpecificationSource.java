package com.ryuqq.transmap.adapter.inmemory.source;

import com.ryuqq.transmap.application.item.ActionRequirementSpec;
import com.ryuqq.transmap.application.item.TestItem;
import com.ryuqq.transmap.application.port.SpecificationSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link SpecificationSource} for testing and reference purposes.
 *
 * <p>Specifications are registered programmatically and returned in registration order.
 * Action requirements are kept unvalidated, so a broken declaration only fails when a
 * runner compiles it.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No document parsing: callers build specifications in code</li>
 *   <li>Not thread-safe: populate before handing to a runner</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemorySpecificationSource source = new InMemorySpecificationSource()
 *     .register(actionRequirementSpec)
 *     .register(testSuiteItem);
 *
 * new SuiteRunner(source, bindings, runner).runAll();
 * </pre>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public class InMemorySpecificationSource implements SpecificationSource {

    private final Map<String, ActionRequirementSpec> actionRequirements = new LinkedHashMap<>();
    private final Map<String, TestItem> items = new LinkedHashMap<>();

    /**
     * Registers an action requirement declaration.
     *
     * @param spec the declaration
     * @return this source
     * @throws IllegalArgumentException if spec is null or its uid is already registered
     */
    public InMemorySpecificationSource register(ActionRequirementSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        checkUnique(spec.uid());
        actionRequirements.put(spec.uid(), spec);
        return this;
    }

    /**
     * Registers an already validated item.
     *
     * @param item the item
     * @return this source
     * @throws IllegalArgumentException if item is null or its uid is already registered
     */
    public InMemorySpecificationSource register(TestItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        checkUnique(item.uid());
        items.put(item.uid(), item);
        return this;
    }

    private void checkUnique(String uid) {
        if (actionRequirements.containsKey(uid) || items.containsKey(uid)) {
            throw new IllegalArgumentException("uid already registered: " + uid);
        }
    }

    @Override
    public List<ActionRequirementSpec> actionRequirements() {
        return List.copyOf(actionRequirements.values());
    }

    @Override
    public Optional<ActionRequirementSpec> findActionRequirement(String uid) {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        return Optional.ofNullable(actionRequirements.get(uid));
    }

    @Override
    public List<TestItem> items() {
        return List.copyOf(items.values());
    }

    /**
     * Removes every registered specification.
     */
    public void clear() {
        actionRequirements.clear();
        items.clear();
    }
}
