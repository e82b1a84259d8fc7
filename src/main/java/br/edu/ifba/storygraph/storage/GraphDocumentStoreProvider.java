package br.edu.ifba.storygraph.storage;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.storage.impl.InMemoryGraphDocumentStore;
import br.edu.ifba.storygraph.storage.impl.JsonFileGraphDocumentStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * CDI producer that selects the {@link GraphDocumentStore} implementation from
 * {@code storygraph.storage.type} at runtime.
 */
@ApplicationScoped
public class GraphDocumentStoreProvider {

    private static final Logger LOG = Logger.getLogger(GraphDocumentStoreProvider.class);

    @Inject
    StoryGraphConfig config;

    @Produces
    @ApplicationScoped
    public GraphDocumentStore produceGraphDocumentStore() {
        String type = config.storage().type();
        LOG.infof("Selecting GraphDocumentStore for storage type: %s", type);

        GraphDocumentStore store;
        if ("memory".equalsIgnoreCase(type)) {
            LOG.info("Using in-memory graph document store");
            store = new InMemoryGraphDocumentStore();
        } else if ("file".equalsIgnoreCase(type)) {
            LOG.infof("Using JSON file graph document store in %s", config.storage().directory());
            store = new JsonFileGraphDocumentStore(config.storage().directory());
        } else {
            throw new IllegalStateException("Unsupported storygraph.storage.type: " + type);
        }
        store.initialize().join();
        return store;
    }

    void closeGraphDocumentStore(@Disposes GraphDocumentStore store) {
        try {
            store.close();
        } catch (Exception e) {
            LOG.warnf(e, "Error closing graph document store");
        }
    }
}
