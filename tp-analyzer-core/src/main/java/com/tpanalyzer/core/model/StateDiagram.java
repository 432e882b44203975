package com.tpanalyzer.core.model;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * State diagram of one program, one state per label.
 *
 * <p>The diagram is a lazy sequence: every call to {@link #iterator()} starts a fresh walk
 * over the states in label order and builds each {@link StateEntry} only when it is reached.
 *
 * @param program program name
 * @param labels state labels in numeric order
 * @param initialTransitions transitions taken from the program start
 * @param entryFactory builds the entry for a label
 */
public record StateDiagram(
    String program,
    List<Integer> labels,
    List<Transition> initialTransitions,
    Function<Integer, StateEntry> entryFactory
) implements Iterable<StateEntry> {

    /**
     * Compact constructor with validation.
     */
    public StateDiagram {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(entryFactory, "entryFactory must not be null");
        labels = labels == null ? List.of() : labels.stream().sorted().toList();
        initialTransitions = initialTransitions == null ? List.of() : List.copyOf(initialTransitions);
    }

    @Override
    public Iterator<StateEntry> iterator() {
        Iterator<Integer> remaining = labels.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return remaining.hasNext();
            }

            @Override
            public StateEntry next() {
                return entryFactory.apply(remaining.next());
            }
        };
    }

    public Stream<StateEntry> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public int size() {
        return labels.size();
    }
}
