package com.cadence.features;

import com.cadence.config.EngineConfig;
import com.cadence.domain.BehavioralEvent;
import com.cadence.domain.FeatureWindow;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Turns ordered behavioral events into feature windows.
 *
 * Two entry points share the same {@link WindowAssembler} logic: live sessions
 * push events through {@link #newAssembler(String)}, while {@link #windows}
 * exposes a lazy sequence over a replayable event source. Identical event
 * sequences always yield identical windows.
 */
public class FeatureExtractor {

    private final EngineConfig config;

    public FeatureExtractor(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public WindowAssembler newAssembler(String sessionId) {
        return new WindowAssembler(sessionId, config);
    }

    /**
     * Lazy, restartable window sequence. Every call to {@code iterator()} starts
     * over from the first event with a fresh assembler; events are only pulled
     * from the source as windows are requested.
     */
    public Iterable<FeatureWindow> windows(String sessionId, Iterable<BehavioralEvent> events) {
        Objects.requireNonNull(events, "events");
        return () -> new WindowIterator(newAssembler(sessionId), events.iterator());
    }

    private static final class WindowIterator implements Iterator<FeatureWindow> {

        private final WindowAssembler assembler;
        private final Iterator<BehavioralEvent> source;
        private final Deque<FeatureWindow> ready = new ArrayDeque<>();

        private WindowIterator(WindowAssembler assembler, Iterator<BehavioralEvent> source) {
            this.assembler = assembler;
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty() && source.hasNext()) {
                ready.addAll(assembler.accept(source.next()));
            }
            if (ready.isEmpty()) {
                assembler.discardPartial();
                return false;
            }
            return true;
        }

        @Override
        public FeatureWindow next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No further complete window");
            }
            return ready.poll();
        }
    }
}
