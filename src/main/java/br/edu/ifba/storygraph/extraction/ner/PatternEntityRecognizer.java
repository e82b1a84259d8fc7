package br.edu.ifba.storygraph.extraction.ner;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model-free recognizer that treats runs of capitalized words as entity mentions.
 *
 * <p>Category cues, in order: a leading honorific marks a PERSON; an organisation suffix marks
 * an ORG; an event noun marks an EVENT; a place noun marks a LOC; a preceding locative
 * preposition marks a GPE. Anything else is taken to be a PERSON. Sentence-initial words that
 * are common sentence starters, or that also occur in lower case in the text, are ignored.</p>
 */
public class PatternEntityRecognizer implements EntityRecognizer {

    private static final Logger logger = LoggerFactory.getLogger(PatternEntityRecognizer.class);

    private static final Pattern WORD = Pattern.compile("\\p{L}[\\p{L}\\p{N}'’-]*");

    static final Set<String> HONORIFICS = Set.of(
        "mr", "mrs", "ms", "miss", "dr", "sir", "lady", "lord", "captain", "detective", "professor",
        "king", "queen", "prince", "princess", "father", "mother", "sister", "brother", "officer",
        "sergeant", "general", "colonel", "agent", "uncle", "aunt", "madam", "inspector", "doctor");

    static final Set<String> ORGANIZATION_SUFFIXES = Set.of(
        "inc", "corp", "corporation", "company", "co", "ltd", "llc", "agency", "bureau", "department",
        "guild", "order", "council", "society", "institute", "university", "academy", "church",
        "army", "navy", "police", "ministry", "bank", "group", "foundation", "brotherhood", "league",
        "syndicate", "federation", "party");

    static final Set<String> PLACE_WORDS = Set.of(
        "street", "road", "avenue", "lane", "city", "town", "village", "river", "mountain", "mountains",
        "lake", "forest", "woods", "castle", "tower", "island", "isles", "kingdom", "empire", "bay",
        "valley", "park", "square", "harbor", "harbour", "hall", "palace", "station", "bridge", "hill",
        "hills", "county", "sea", "ocean", "desert", "manor", "abbey", "temple", "market", "port");

    static final Set<String> EVENT_WORDS = Set.of(
        "war", "battle", "festival", "revolution", "ball", "wedding", "tournament", "massacre",
        "siege", "feast", "coronation", "uprising", "rebellion", "games", "trial", "funeral");

    static final Set<String> LOCATIVE_PREPOSITIONS = Set.of(
        "in", "at", "to", "from", "into", "near", "toward", "towards", "across", "through", "outside", "inside");

    private static final Set<String> CONNECTORS = Set.of("of", "the", "de", "da", "van", "von", "la", "le", "du", "del");

    private static final Set<String> SENTENCE_STARTERS = Set.of(
        "the", "a", "an", "he", "she", "it", "they", "we", "i", "you", "his", "her", "their", "our",
        "my", "your", "its", "this", "that", "these", "those", "there", "here", "then", "when", "while",
        "but", "and", "or", "so", "yet", "if", "as", "after", "before", "suddenly", "meanwhile", "later",
        "now", "still", "once", "nothing", "everything", "someone", "something", "no", "yes", "why",
        "what", "where", "who", "how", "perhaps", "maybe", "finally", "outside", "inside", "with",
        "without", "in", "on", "at", "for", "from", "by", "to", "of", "all", "some", "every", "each",
        "oh", "well", "not", "even", "only", "just", "again", "soon", "tonight", "today", "tomorrow");

    @Override
    @NotNull
    public List<RecognizedEntity> recognize(@NotNull String text) {
        List<RecognizedEntity> mentions = new ArrayList<>();
        if (text.isBlank()) {
            return mentions;
        }
        String padded = " " + text + " ";

        for (int[] sentenceSpan : SentenceSplitter.spans(text)) {
            String sentence = text.substring(sentenceSpan[0], sentenceSpan[1]);
            List<Token> tokens = tokenize(sentence);

            int i = 0;
            while (i < tokens.size()) {
                if (!tokens.get(i).capitalized()) {
                    i++;
                    continue;
                }

                // extend over capitalized words, bridging connectors between them
                int end = i + 1;
                while (end < tokens.size()) {
                    if (tokens.get(end).capitalized()) {
                        end++;
                    } else if (CONNECTORS.contains(tokens.get(end).lower()) && end + 1 < tokens.size()
                        && tokens.get(end + 1).capitalized()) {
                        end += 2;
                    } else {
                        break;
                    }
                }

                int start = i;
                if (start == 0) {
                    while (start < end && isSentenceStarter(tokens.get(start), padded)) {
                        start++;
                    }
                }
                while (start < end && SENTENCE_STARTERS.contains(tokens.get(start).lower())
                    && (end - start == 1 || tokens.get(start).lower().equals("the"))) {
                    start++;
                }

                if (start < end) {
                    RecognizedEntity mention = classify(tokens, start, end, sentence, sentenceSpan[0]);
                    if (mention != null) {
                        mentions.add(mention);
                    }
                }
                i = end;
            }
        }

        logger.debug("Pattern recognizer found {} mentions", mentions.size());
        return mentions;
    }

    @Override
    @NotNull
    public String getName() {
        return "pattern";
    }

    private RecognizedEntity classify(List<Token> tokens, int start, int end, String sentence, int offset) {
        String first = tokens.get(start).lower();
        String last = tokens.get(end - 1).lower();

        String label;
        if (HONORIFICS.contains(first)) {
            if (end - start == 1) {
                return null;
            }
            label = "PERSON";
        } else if (ORGANIZATION_SUFFIXES.contains(last)) {
            label = "ORG";
        } else if (EVENT_WORDS.contains(last)) {
            label = "EVENT";
        } else if (PLACE_WORDS.contains(last)) {
            label = "LOC";
        } else if (start > 0 && LOCATIVE_PREPOSITIONS.contains(tokens.get(start - 1).lower())) {
            label = "GPE";
        } else {
            label = "PERSON";
        }

        int from = tokens.get(start).start();
        int to = tokens.get(end - 1).end();
        return new RecognizedEntity(sentence.substring(from, to), label, offset + from, offset + to, sentence);
    }

    // a capitalized first word is ignored when it is a common starter or also appears in lower case
    private static boolean isSentenceStarter(Token token, String paddedText) {
        return SENTENCE_STARTERS.contains(token.lower())
            || paddedText.contains(" " + token.lower() + " ");
    }

    private static List<Token> tokenize(String sentence) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = WORD.matcher(sentence);
        while (matcher.find()) {
            String word = matcher.group();
            int end = matcher.end();
            // possessives: Sarah's -> Sarah
            if (word.endsWith("'s") || word.endsWith("’s")) {
                word = word.substring(0, word.length() - 2);
                end -= 2;
            }
            if (!word.isEmpty()) {
                tokens.add(new Token(word, matcher.start(), end));
            }
        }
        return tokens;
    }

    private record Token(String word, int start, int end) {
        String lower() {
            return word.toLowerCase(Locale.ROOT);
        }

        boolean capitalized() {
            return Character.isUpperCase(word.charAt(0)) && !word.equals("I");
        }
    }
}
