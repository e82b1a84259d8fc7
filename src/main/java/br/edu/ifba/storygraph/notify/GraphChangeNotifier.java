package br.edu.ifba.storygraph.notify;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes graph and job events to listeners subscribed per project.
 *
 * <p>Delivery is best-effort and at-most-once: events are handed to a dispatch executor, a
 * listener that throws is logged and skipped, and events published while the executor is
 * shutting down are dropped. Events of one publisher reach a listener in publish order when the
 * default single-threaded dispatcher is used; nothing is guaranteed across publishers.</p>
 */
@ApplicationScoped
public class GraphChangeNotifier {

    private static final Logger LOG = Logger.getLogger(GraphChangeNotifier.class);

    private final Map<String, List<ListenerSubscription>> subscriptions = new ConcurrentHashMap<>();
    private final Executor dispatcher;
    private final ExecutorService ownedExecutor;

    public GraphChangeNotifier() {
        this.ownedExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "storygraph-events");
            thread.setDaemon(true);
            return thread;
        });
        this.dispatcher = ownedExecutor;
    }

    /**
     * Uses the caller's executor; tests pass {@code Runnable::run} for synchronous delivery.
     */
    public GraphChangeNotifier(@NotNull Executor dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.ownedExecutor = null;
    }

    @NotNull
    public Subscription subscribe(@NotNull String projectId, @NotNull GraphEventListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        ListenerSubscription subscription = new ListenerSubscription(projectId, listener);
        subscriptions.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(subscription);
        LOG.debugf("Listener subscribed to project %s", projectId);
        return subscription;
    }

    public void publish(@NotNull GraphEvent event) {
        List<ListenerSubscription> listeners = subscriptions.get(event.projectId());
        if (listeners == null || listeners.isEmpty()) {
            return;
        }
        for (ListenerSubscription subscription : listeners) {
            if (!subscription.isActive()) {
                continue;
            }
            try {
                dispatcher.execute(() -> deliver(subscription, event));
            } catch (RejectedExecutionException e) {
                LOG.warnf("Dropped %s event for project %s: dispatcher rejected it", event.type(), event.projectId());
            }
        }
    }

    public void publish(@NotNull GraphEventType type, @NotNull String projectId, @NotNull Map<String, Object> payload) {
        publish(GraphEvent.of(type, projectId, payload));
    }

    public int subscriberCount(@NotNull String projectId) {
        List<ListenerSubscription> listeners = subscriptions.get(projectId);
        return listeners == null ? 0 : listeners.size();
    }

    @PreDestroy
    void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
        subscriptions.clear();
    }

    private void deliver(ListenerSubscription subscription, GraphEvent event) {
        if (!subscription.isActive()) {
            return;
        }
        try {
            subscription.listener.onEvent(event);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Listener failed on %s event for project %s", event.type(), event.projectId());
        }
    }

    private void unsubscribe(ListenerSubscription subscription) {
        subscriptions.computeIfPresent(subscription.projectId, (k, list) -> {
            list.remove(subscription);
            return list.isEmpty() ? null : list;
        });
    }

    private final class ListenerSubscription implements Subscription {
        private final String projectId;
        private final GraphEventListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private ListenerSubscription(String projectId, GraphEventListener listener) {
            this.projectId = projectId;
            this.listener = listener;
        }

        @Override
        public String projectId() {
            return projectId;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                unsubscribe(this);
            }
        }
    }
}
