package br.edu.ifba.storygraph.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TokenUtilTest {

    @Test
    @DisplayName("Empty and null text count as zero tokens")
    void testEmptyText() {
        assertEquals(0, TokenUtil.estimateTokens(""));
        assertEquals(0, TokenUtil.estimateTokensSafe(null));
        assertEquals(0, TokenUtil.estimateTokensApproximate(""));
    }

    @Test
    @DisplayName("Non-empty text counts at least one token")
    void testNonEmptyText() {
        assertTrue(TokenUtil.estimateTokens("Mickey walked into the warehouse.") > 0);
        assertEquals(3, TokenUtil.estimateTokensApproximate("twelve chars"));
    }

    @Test
    @DisplayName("Cost is tokens times the per-1k price, rounded to six places")
    void testCost() {
        // Act
        BigDecimal cost = TokenUtil.cost(2500, new BigDecimal("0.003"));

        // Assert
        assertEquals(0, new BigDecimal("0.0075").compareTo(cost));
        assertEquals(6, cost.scale());
        assertEquals(0, BigDecimal.ZERO.compareTo(TokenUtil.cost(0, new BigDecimal("0.003"))));
    }

    @Test
    @DisplayName("Truncation keeps short text and shortens long text")
    void testTruncate() {
        // Arrange
        String shortText = "Sarah";
        String longText = "word ".repeat(200);

        // Act
        String kept = TokenUtil.truncateToTokenLimit(shortText, 10);
        String cut = TokenUtil.truncateToTokenLimit(longText, 10);

        // Assert
        assertEquals(shortText, kept);
        assertTrue(cut.length() < longText.length());
        assertTrue(cut.endsWith("..."));
        assertEquals("", TokenUtil.truncateToTokenLimit(longText, 0));
    }
}
