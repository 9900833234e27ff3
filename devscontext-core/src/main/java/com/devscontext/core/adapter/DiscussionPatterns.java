package com.devscontext.core.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex extraction of decisions and action items from free-form discussion
 * text (Slack messages, meeting sentences).
 */
public final class DiscussionPatterns {

    private static final int MAX_ITEMS = 10;

    private static final List<Pattern> DECISION_PATTERNS = List.of(
        Pattern.compile("(?:we(?:'ve|'ll| will| have)?\\s+)?decided\\s+(?:to\\s+)?(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("let's\\s+(?:go\\s+with|use|do)\\s+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("agreed[:\\s]+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("decision[:\\s]+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("we(?:'re| are)\\s+going\\s+(?:to|with)\\s+(.+)", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> ACTION_PATTERNS = List.of(
        Pattern.compile("(?:i(?:'ll| will|'m going to)\\s+)(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("@\\w+\\s+(?:can you|please|will you|could you)\\s+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("action item[:\\s]+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("todo[:\\s]+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("need(?:s)? to\\s+(.+)", Pattern.CASE_INSENSITIVE)
    );

    private DiscussionPatterns() {}

    public static List<String> extractDecisions(String text) {
        return extract(text, DECISION_PATTERNS, 10);
    }

    public static List<String> extractActionItems(String text) {
        return extract(text, ACTION_PATTERNS, 5);
    }

    private static List<String> extract(String text, List<Pattern> patterns, int minLength) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find() && found.size() < MAX_ITEMS) {
                String item = matcher.group(1).strip();
                if (item.length() > minLength && item.length() < 200 && !found.contains(item)) {
                    found.add(item);
                }
            }
        }
        return found;
    }
}
