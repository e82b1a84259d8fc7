package br.edu.ifba.storygraph.extraction.ner;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * CDI producer that selects the {@link EntityRecognizer} from runtime configuration:
 * OpenNLP when name finder models are configured, the pattern recognizer otherwise.
 */
@ApplicationScoped
public class EntityRecognizerProvider {

    private static final Logger LOG = Logger.getLogger(EntityRecognizerProvider.class);

    @Inject
    StoryGraphConfig config;

    @Produces
    @ApplicationScoped
    public EntityRecognizer produceEntityRecognizer() {
        return OpenNlpEntityRecognizer.fromConfig(config.extraction().ner())
            .<EntityRecognizer>map(recognizer -> {
                LOG.info("Using OpenNLP entity recognizer for lightweight extraction");
                return recognizer;
            })
            .orElseGet(() -> {
                LOG.info("No OpenNLP name finder model configured, using pattern entity recognizer");
                return new PatternEntityRecognizer();
            });
    }
}
