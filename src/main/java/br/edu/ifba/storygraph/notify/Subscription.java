package br.edu.ifba.storygraph.notify;

/**
 * Handle returned by {@link GraphChangeNotifier#subscribe}. Closing it stops delivery.
 */
public interface Subscription extends AutoCloseable {

    String projectId();

    boolean isActive();

    @Override
    void close();
}
