package br.edu.ifba.storygraph.extraction.ner;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityType;
import br.edu.ifba.storygraph.exception.StoryGraphException;
import br.edu.ifba.storygraph.extraction.ExtractionResult;
import br.edu.ifba.storygraph.extraction.LightweightSceneExtractor;
import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.NameSample;
import opennlp.tools.namefind.NameSampleDataStream;
import opennlp.tools.namefind.TokenNameFinderFactory;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.util.ObjectStream;
import opennlp.tools.util.PlainTextByLineStream;
import opennlp.tools.util.TrainingParameters;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OpenNlpEntityRecognizerTest {

    private static final String SCENE = "Mickey drove to Boston. He was looking for Sarah.";

    private static final String PERSON_SAMPLES = """
        <START:person> Mickey <END> walked into the warehouse .
        He was looking for <START:person> Sarah <END> .
        <START:person> Sarah <END> drove to the station .
        The rain fell on <START:person> Mickey <END> .
        <START:person> Mickey <END> drove to Boston .
        He met <START:person> Sarah <END> near the docks .
        She called <START:person> Mickey <END> from Boston .
        <START:person> Sarah <END> was looking for the car .
        They drove to the warehouse .
        He was waiting in Boston .
        """;

    private static final String LOCATION_SAMPLES = """
        Mickey drove to <START:location> Boston <END> .
        <START:location> Boston <END> was cold that night .
        Sarah left <START:location> Boston <END> for the coast .
        He was looking for Sarah .
        Mickey walked into the warehouse .
        They met in <START:location> Boston <END> .
        She drove to <START:location> Boston <END> with Mickey .
        """;

    private static TokenNameFinderModel personModel;
    private static TokenNameFinderModel locationModel;

    @BeforeAll
    static void trainModels() throws IOException {
        personModel = train("person", PERSON_SAMPLES);
        locationModel = train("location", LOCATION_SAMPLES);
    }

    private static TokenNameFinderModel train(String type, String samples) throws IOException {
        byte[] data = samples.repeat(3).getBytes(StandardCharsets.UTF_8);
        TrainingParameters params = new TrainingParameters();
        params.put(TrainingParameters.ITERATIONS_PARAM, 100);
        params.put(TrainingParameters.CUTOFF_PARAM, 1);
        try (ObjectStream<NameSample> stream = new NameSampleDataStream(
                new PlainTextByLineStream(() -> new ByteArrayInputStream(data), StandardCharsets.UTF_8))) {
            return NameFinderME.train("eng", type, stream, params, new TokenNameFinderFactory());
        }
    }

    private static OpenNlpEntityRecognizer recognizer() {
        Map<String, TokenNameFinderModel> models = new LinkedHashMap<>();
        models.put("PERSON", personModel);
        models.put("LOC", locationModel);
        return new OpenNlpEntityRecognizer(models, null, null);
    }

    @Test
    @DisplayName("Mentions carry the model label, source offsets and their sentence, in text order")
    void testRecognize() {
        // Arrange
        OpenNlpEntityRecognizer recognizer = recognizer();

        // Act
        List<RecognizedEntity> mentions = recognizer.recognize(SCENE);

        // Assert
        assertEquals(List.of(
            new RecognizedEntity("Mickey", "PERSON", 0, 6, "Mickey drove to Boston."),
            new RecognizedEntity("Boston", "LOC", 16, 22, "Mickey drove to Boston."),
            new RecognizedEntity("Sarah", "PERSON", 43, 48, "He was looking for Sarah.")), mentions);
        for (RecognizedEntity mention : mentions) {
            assertEquals(mention.text(), SCENE.substring(mention.start(), mention.end()));
        }
        assertEquals("opennlp", recognizer.getName());
    }

    @Test
    @DisplayName("Repeated calls give the same answer once adaptive data is cleared")
    void testRepeatable() {
        OpenNlpEntityRecognizer recognizer = recognizer();

        List<RecognizedEntity> first = recognizer.recognize(SCENE);
        List<RecognizedEntity> second = recognizer.recognize(SCENE);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Blank text yields no mentions")
    void testBlankText() {
        assertTrue(recognizer().recognize("   ").isEmpty());
    }

    @Test
    @DisplayName("At least one name finder model is required")
    void testNoModels() {
        assertThrows(IllegalArgumentException.class, () -> new OpenNlpEntityRecognizer(Map.of(), null, null));
    }

    @Test
    @DisplayName("Lightweight extraction maps the model labels onto story entity types")
    void testLightweightExtraction() throws Exception {
        // Arrange
        LightweightSceneExtractor extractor = new LightweightSceneExtractor(recognizer());

        // Act
        ExtractionResult result = extractor.extract(SCENE, "scene-1", List.of()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(List.of("entity_mickey", "entity_boston", "entity_sarah"),
            result.entities().stream().map(Entity::getId).toList());
        assertEquals(EntityType.CHARACTER, result.entities().get(0).getType());
        assertEquals(EntityType.LOCATION, result.entities().get(1).getType());
        assertEquals(EntityType.CHARACTER, result.entities().get(2).getType());
        assertEquals("He was looking for Sarah.", result.entities().get(2).getDescription());
        assertTrue(result.relationships().isEmpty());
    }

    @Test
    @DisplayName("Configured model files are loaded, missing configuration yields nothing")
    void testFromConfig(@TempDir Path dir) throws IOException {
        // Arrange
        Path modelFile = dir.resolve("en-ner-person.bin");
        try (OutputStream out = Files.newOutputStream(modelFile)) {
            personModel.serialize(out);
        }
        StoryGraphConfig.Ner configured = mock(StoryGraphConfig.Ner.class);
        when(configured.personModel()).thenReturn(Optional.of(modelFile.toString()));
        StoryGraphConfig.Ner unconfigured = mock(StoryGraphConfig.Ner.class);
        StoryGraphConfig.Ner broken = mock(StoryGraphConfig.Ner.class);
        when(broken.personModel()).thenReturn(Optional.of(dir.resolve("missing.bin").toString()));

        // Act
        Optional<OpenNlpEntityRecognizer> loaded = OpenNlpEntityRecognizer.fromConfig(configured);

        // Assert
        assertTrue(loaded.isPresent());
        List<RecognizedEntity> mentions = loaded.get().recognize(SCENE);
        assertEquals(List.of("Mickey", "Sarah"), mentions.stream().map(RecognizedEntity::text).toList());
        assertTrue(mentions.stream().allMatch(mention -> mention.label().equals("PERSON")));
        assertTrue(OpenNlpEntityRecognizer.fromConfig(unconfigured).isEmpty());
        assertThrows(StoryGraphException.class, () -> OpenNlpEntityRecognizer.fromConfig(broken));
    }
}
