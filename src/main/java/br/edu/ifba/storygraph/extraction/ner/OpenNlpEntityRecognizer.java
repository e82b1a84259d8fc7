package br.edu.ifba.storygraph.extraction.ner;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.exception.StoryGraphException;
import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.sentdetect.SentenceDetectorME;
import opennlp.tools.sentdetect.SentenceModel;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.tokenize.Tokenizer;
import opennlp.tools.tokenize.TokenizerME;
import opennlp.tools.tokenize.TokenizerModel;
import opennlp.tools.util.Span;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statistical recognizer backed by Apache OpenNLP name finder models, one model per category.
 *
 * <p>Sentences come from a sentence model when configured, otherwise from punctuation; tokens
 * come from a tokenizer model when configured, otherwise from {@link SimpleTokenizer}. OpenNLP
 * detectors are not thread-safe, so recognition is serialized per instance.</p>
 */
public class OpenNlpEntityRecognizer implements EntityRecognizer {

    private static final Logger logger = LoggerFactory.getLogger(OpenNlpEntityRecognizer.class);

    private final Map<String, NameFinderME> finders;
    @Nullable
    private final SentenceDetectorME sentenceDetector;
    private final Tokenizer tokenizer;

    /**
     * @param models name finder models keyed by the label their mentions get (PERSON, LOC, ORG, ...)
     * @param sentenceModel optional sentence detector model
     * @param tokenizerModel optional tokenizer model
     */
    public OpenNlpEntityRecognizer(@NotNull Map<String, TokenNameFinderModel> models,
                                   @Nullable SentenceModel sentenceModel,
                                   @Nullable TokenizerModel tokenizerModel) {
        if (models.isEmpty()) {
            throw new IllegalArgumentException("At least one name finder model is required");
        }
        this.finders = new LinkedHashMap<>();
        models.forEach((label, model) -> finders.put(label, new NameFinderME(model)));
        this.sentenceDetector = sentenceModel != null ? new SentenceDetectorME(sentenceModel) : null;
        this.tokenizer = tokenizerModel != null ? new TokenizerME(tokenizerModel) : SimpleTokenizer.INSTANCE;
    }

    /**
     * Loads the models named in configuration.
     *
     * @return empty when no name finder model is configured
     * @throws StoryGraphException if a configured model cannot be read
     */
    @NotNull
    public static Optional<OpenNlpEntityRecognizer> fromConfig(@NotNull StoryGraphConfig.Ner config) {
        Map<String, TokenNameFinderModel> models = new LinkedHashMap<>();
        config.personModel().ifPresent(path -> models.put("PERSON", load(path, TokenNameFinderModel::new)));
        config.locationModel().ifPresent(path -> models.put("LOC", load(path, TokenNameFinderModel::new)));
        config.organizationModel().ifPresent(path -> models.put("ORG", load(path, TokenNameFinderModel::new)));
        if (models.isEmpty()) {
            return Optional.empty();
        }

        SentenceModel sentenceModel = config.sentenceModel().map(path -> load(path, SentenceModel::new)).orElse(null);
        TokenizerModel tokenizerModel = config.tokenizerModel().map(path -> load(path, TokenizerModel::new)).orElse(null);
        logger.info("Loaded OpenNLP name finder models for {}", models.keySet());
        return Optional.of(new OpenNlpEntityRecognizer(models, sentenceModel, tokenizerModel));
    }

    @Override
    @NotNull
    public synchronized List<RecognizedEntity> recognize(@NotNull String text) {
        List<RecognizedEntity> mentions = new ArrayList<>();
        if (text.isBlank()) {
            return mentions;
        }

        try {
            for (int[] sentenceSpan : sentenceSpans(text)) {
                String sentence = text.substring(sentenceSpan[0], sentenceSpan[1]);
                Span[] tokenSpans = tokenizer.tokenizePos(sentence);
                String[] tokens = Span.spansToStrings(tokenSpans, sentence);

                for (Map.Entry<String, NameFinderME> finder : finders.entrySet()) {
                    for (Span name : finder.getValue().find(tokens)) {
                        int from = tokenSpans[name.getStart()].getStart();
                        int to = tokenSpans[name.getEnd() - 1].getEnd();
                        mentions.add(new RecognizedEntity(sentence.substring(from, to), finder.getKey(),
                            sentenceSpan[0] + from, sentenceSpan[0] + to, sentence));
                    }
                }
            }
        } finally {
            for (NameFinderME finder : finders.values()) {
                finder.clearAdaptiveData();
            }
        }

        mentions.sort(Comparator.comparingInt(RecognizedEntity::start));
        return mentions;
    }

    @Override
    @NotNull
    public String getName() {
        return "opennlp";
    }

    private List<int[]> sentenceSpans(String text) {
        if (sentenceDetector == null) {
            return SentenceSplitter.spans(text);
        }
        List<int[]> spans = new ArrayList<>();
        for (Span span : sentenceDetector.sentPosDetect(text)) {
            spans.add(new int[] {span.getStart(), span.getEnd()});
        }
        return spans;
    }

    @FunctionalInterface
    private interface ModelReader<T> {
        T read(InputStream in) throws IOException;
    }

    private static <T> T load(String path, ModelReader<T> reader) {
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            return reader.read(in);
        } catch (IOException e) {
            throw new StoryGraphException("Failed to load OpenNLP model from " + path, e);
        }
    }
}
