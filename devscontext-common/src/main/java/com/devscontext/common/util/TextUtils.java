package com.devscontext.common.util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by adapters, the pipeline and the synthesis engines.
 */
public final class TextUtils {

    private static final double CHARS_PER_TOKEN = 4.0;
    private static final int MAX_KEYWORDS = 10;
    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final String TRUNCATION_SUFFIX = "... [truncated]";
    private static final Pattern WORD = Pattern.compile("[a-z0-9]+");

    static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "but", "in", "on", "at", "to", "for",
        "of", "with", "by", "from", "as", "is", "was", "are", "were", "been",
        "be", "have", "has", "had", "do", "does", "did", "will", "would",
        "could", "should", "may", "might", "must", "shall", "can", "need",
        "it", "its", "this", "that", "these", "those", "i", "you", "he",
        "she", "we", "they", "what", "which", "who", "when", "where", "why",
        "how", "all", "each", "every", "both", "few", "more", "most", "other",
        "some", "such", "no", "nor", "not", "only", "own", "same", "so",
        "than", "too", "very", "just", "also", "now", "here", "there", "then",
        "if", "else", "because", "about", "into", "through", "during", "before",
        "after", "above", "below", "between", "under", "again", "further",
        "once", "any", "out", "up", "down", "off", "over", "our", "your"
    );

    // Verbs that start most ticket titles and say nothing about the subject
    static final Set<String> ACTION_VERBS = Set.of(
        "add", "fix", "update", "implement", "create", "remove", "delete",
        "change", "modify", "refactor", "improve", "enhance", "optimize",
        "handle", "support", "enable", "disable", "configure", "setup",
        "make", "get", "set", "use", "move", "rename", "replace", "resolve",
        "ensure", "allow", "prevent", "check", "verify", "validate", "test",
        "debug", "investigate", "review", "clean", "cleanup", "simplify"
    );

    private TextUtils() {}

    /**
     * Extracts up to ten keywords, most specific (longest) first.
     * "Add retry logic to payment webhook handler" gives
     * [handler, payment, webhook, logic, retry].
     */
    public static List<String> extractKeywords(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() >= MIN_KEYWORD_LENGTH
                && !STOP_WORDS.contains(word)
                && !ACTION_VERBS.contains(word)) {
                seen.add(word);
            }
        }
        List<String> keywords = new ArrayList<>(seen);
        keywords.sort(Comparator.comparingInt(String::length).reversed()
            .thenComparing(Comparator.naturalOrder()));
        return keywords.size() > MAX_KEYWORDS ? keywords.subList(0, MAX_KEYWORDS) : keywords;
    }

    /**
     * Cuts text to {@code maxChars}, preferring a sentence end and then a word
     * boundary when either keeps at least half of the budget.
     */
    public static String truncateText(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        if (maxChars <= TRUNCATION_SUFFIX.length()) {
            return text.substring(0, Math.max(0, maxChars));
        }
        int available = maxChars - TRUNCATION_SUFFIX.length();
        String truncated = text.substring(0, available);

        int sentenceEnd = -1;
        for (int i = truncated.length() - 1; i >= 0; i--) {
            char c = truncated.charAt(i);
            if (c == '.' || c == '!' || c == '?') {
                if (i == truncated.length() - 1 || " \n\t\"'".indexOf(truncated.charAt(i + 1)) >= 0) {
                    sentenceEnd = i + 1;
                    break;
                }
            }
        }
        if (sentenceEnd > available * 0.5) {
            return truncated.substring(0, sentenceEnd).stripTrailing() + TRUNCATION_SUFFIX;
        }

        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > available * 0.5) {
            return truncated.substring(0, lastSpace).stripTrailing() + TRUNCATION_SUFFIX;
        }
        return truncated + TRUNCATION_SUFFIX;
    }

    /**
     * 150 -> "150ms", 2500 -> "2.5s", 65000 -> "1m 5s".
     */
    public static String formatDuration(long ms) {
        if (ms < 0) {
            return "0ms";
        }
        if (ms < 1000) {
            return ms + "ms";
        }
        if (ms < 60_000) {
            if (ms % 1000 == 0) {
                return (ms / 1000) + "s";
            }
            String formatted = String.format(Locale.ROOT, "%.1f", ms / 1000.0);
            if (formatted.endsWith(".0")) {
                formatted = formatted.substring(0, formatted.length() - 2);
            }
            return formatted + "s";
        }
        long minutes = ms / 60_000;
        long seconds = (ms % 60_000) / 1000;
        return seconds == 0 ? minutes + "m" : minutes + "m " + seconds + "s";
    }

    /**
     * Rough estimate: 1 token is about 4 characters of English text.
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null || needle.isEmpty()) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }
}
