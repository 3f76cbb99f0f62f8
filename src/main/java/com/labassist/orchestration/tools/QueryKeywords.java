package com.labassist.orchestration.tools;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits free text into lowercase search keywords.
 */
final class QueryKeywords {

    static final int MIN_LENGTH = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "how", "what", "why", "when", "where", "who", "does", "can",
            "should", "would", "could", "this", "that", "these", "those", "from", "into", "about",
            "our", "your", "you", "are", "was", "were", "has", "have", "had", "not", "but", "any",
            "all", "get", "out", "use", "its", "there", "their", "them", "then", "than", "handle");

    private QueryKeywords() {
    }

    static List<String> of(String query) {
        if (query == null) {
            return List.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : query.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}_-]+")) {
            if (token.length() >= MIN_LENGTH && !STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return List.copyOf(keywords);
    }
}
