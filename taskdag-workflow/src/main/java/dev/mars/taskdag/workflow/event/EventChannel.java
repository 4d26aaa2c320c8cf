/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.taskdag.workflow.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered fan-out of orchestrator events to listeners.
 *
 * <p>Events published while a delivery is already in progress (a listener calling back into the
 * orchestrator) are queued and delivered once the current event has reached every listener, so
 * all listeners observe the same order. A listener that throws is logged and skipped; delivery to
 * the others continues.</p>
 *
 * <p>Publishing is not thread-safe. The owning orchestrator serializes calls under its own lock;
 * subscribing and unsubscribing are safe from any thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class EventChannel {

    private static final Logger logger = LoggerFactory.getLogger(EventChannel.class);

    private final CopyOnWriteArrayList<OrchestratorListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<OrchestratorEvent> pending = new ArrayDeque<>();
    private boolean dispatching;

    /**
     * Registers a listener.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(OrchestratorListener listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publish(OrchestratorEvent event) {
        pending.addLast(Objects.requireNonNull(event, "Event cannot be null"));
        drain();
    }

    /**
     * Publishes a batch; nested events raised while delivering it queue behind the whole batch.
     */
    public void publishAll(Collection<? extends OrchestratorEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        pending.addAll(events);
        drain();
    }

    private void drain() {
        if (dispatching) {
            return;
        }
        dispatching = true;
        try {
            OrchestratorEvent event;
            while ((event = pending.pollFirst()) != null) {
                logger.debug("Delivering {} for execution {}", event.type(), event.executionId());
                for (OrchestratorListener listener : listeners) {
                    deliverSafely(listener, event);
                }
            }
        } finally {
            dispatching = false;
        }
    }

    private void deliverSafely(OrchestratorListener listener, OrchestratorEvent event) {
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            logger.warn("Listener threw exception processing event {} for execution {}: {}",
                    event.type(), event.executionId(), e.getMessage(), e);
        }
    }
}
