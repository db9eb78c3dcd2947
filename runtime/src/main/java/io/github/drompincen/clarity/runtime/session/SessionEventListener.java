package io.github.drompincen.clarity.runtime.session;

import io.github.drompincen.clarity.runtime.analysis.RabbitholeEvent;

/**
 * Callbacks from background tangent analysis. Invoked on an analysis thread, never while the
 * engine holds its own lock.
 */
public interface SessionEventListener {

    void onRabbitholeDetected(String sessionId, RabbitholeEvent event);

    default void onRabbitholeReturned(String sessionId, RabbitholeEvent event) {}
}
