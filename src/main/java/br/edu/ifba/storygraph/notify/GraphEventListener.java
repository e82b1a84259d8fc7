package br.edu.ifba.storygraph.notify;

import org.jetbrains.annotations.NotNull;

/**
 * Receives events for the projects it is subscribed to.
 * Called on the notifier's dispatch thread, never on the publisher's.
 */
@FunctionalInterface
public interface GraphEventListener {

    void onEvent(@NotNull GraphEvent event);
}
