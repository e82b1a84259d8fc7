package br.edu.ifba.storygraph.utils;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.EncodingType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Token arithmetic for extraction prompts, job accounting and batch cost estimates.
 *
 * <p>Counts use the cl100k_base encoding through jtokkit. If the encoding cannot be loaded the
 * counts fall back to four characters per token, which is close enough for cost gating.</p>
 */
public final class TokenUtil {

    private static final Logger logger = LoggerFactory.getLogger(TokenUtil.class);

    private static final int CHARS_PER_TOKEN = 4;
    private static final String ELLIPSIS = "...";
    private static final BigDecimal PER_THOUSAND = BigDecimal.valueOf(1000);

    private TokenUtil() {
    }

    /**
     * Loaded on first use; {@code ENCODING} is null when jtokkit could not provide cl100k_base.
     */
    private static final class Cl100k {
        static final Encoding ENCODING = load();

        private static Encoding load() {
            try {
                Encoding encoding = Encodings.newLazyEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
                logger.info("Token counting uses cl100k_base");
                return encoding;
            } catch (RuntimeException e) {
                logger.warn("cl100k_base unavailable, token counts are approximate: {}", e.getMessage());
                return null;
            }
        }
    }

    public static int estimateTokens(@NotNull String text) {
        if (text.isEmpty()) {
            return 0;
        }
        Encoding encoding = Cl100k.ENCODING;
        return encoding != null ? encoding.countTokens(text) : estimateTokensApproximate(text);
    }

    /**
     * Null-tolerant {@link #estimateTokens(String)}, for optional prompt parts and model replies.
     */
    public static int estimateTokensSafe(@Nullable String text) {
        return text == null ? 0 : estimateTokens(text);
    }

    public static int estimateTokensApproximate(@NotNull String text) {
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * Dollar cost of {@code tokens} at a price per 1000 tokens, with 6 decimal places.
     */
    @NotNull
    public static BigDecimal cost(long tokens, @NotNull BigDecimal pricePer1kTokens) {
        return pricePer1kTokens.multiply(BigDecimal.valueOf(tokens)).divide(PER_THOUSAND, 6, RoundingMode.HALF_UP);
    }

    /**
     * Shortens text to at most {@code maxTokens} tokens. A shortened text ends in "...",
     * which takes one token of the allowance.
     */
    @NotNull
    public static String truncateToTokenLimit(@NotNull String text, int maxTokens) {
        if (maxTokens <= 0) {
            return "";
        }
        if (estimateTokens(text) <= maxTokens) {
            return text;
        }

        Encoding encoding = Cl100k.ENCODING;
        if (encoding != null) {
            EncodingResult head = encoding.encode(text, maxTokens - 1);
            return encoding.decode(head.getTokens()) + ELLIPSIS;
        }
        int keep = Math.max(0, maxTokens * CHARS_PER_TOKEN - ELLIPSIS.length());
        return text.substring(0, Math.min(keep, text.length())) + ELLIPSIS;
    }
}
