package com.narrativeplatform.narrative.signal;

import com.narrativeplatform.common.model.NewsSentiment;

/**
 * Stand-in news sentiment feed: a pure function of the symbol text, so the
 * same symbol always reads the same sentiment. Used only when the caller does
 * not report {@code market_state.news_sentiment}.
 */
public final class SymbolHashSentimentSource {

    private SymbolHashSentimentSource() {}

    public static NewsSentiment sentimentFor(String symbol) {
        return switch (symbol.length() % 3) {
            case 0  -> NewsSentiment.POSITIVE;
            case 1  -> NewsSentiment.NEUTRAL;
            default -> NewsSentiment.NEGATIVE;
        };
    }

    /** Headline strength in [40, 99]. */
    public static int strengthFor(String symbol) {
        int sum = 0;
        for (int i = 0; i < symbol.length(); i++) {
            sum += symbol.charAt(i);
        }
        return (sum % 60) + 40;
    }
}
