package com.ryuqq.transmap.adapter.inmemory.emitter;

import com.ryuqq.transmap.application.item.EmittedItem;
import com.ryuqq.transmap.application.port.ItemEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of {@link ItemEmitter} that keeps every emitted item.
 *
 * <p>Useful to inspect what a generator would hand to a source-text writer.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public class InMemoryItemEmitter implements ItemEmitter {

    private final List<EmittedItem> emitted = new ArrayList<>();

    @Override
    public void emit(EmittedItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        emitted.add(item);
    }

    /**
     * Returns the emitted items in emission order.
     *
     * @return immutable snapshot
     */
    public List<EmittedItem> getEmitted() {
        return List.copyOf(emitted);
    }

    /**
     * Finds an emitted item by uid.
     *
     * @param uid item uid
     * @return the first emitted item with that uid
     */
    public Optional<EmittedItem> find(String uid) {
        return emitted.stream()
            .filter(item -> item.description().name().equals(uid))
            .findFirst();
    }

    public void clear() {
        emitted.clear();
    }
}
