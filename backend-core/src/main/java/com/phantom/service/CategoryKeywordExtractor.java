package com.phantom.service;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
public class CategoryKeywordExtractor {

    private static final Map<String, List<String>> CATEGORY_KEYWORDS = buildCategoryKeywords();
    private static final Map<String, List<Pattern>> CATEGORY_PATTERNS = compile(CATEGORY_KEYWORDS);

    private static final List<Pattern> TEMPORAL_PATTERNS = List.of(
            Pattern.compile("\\b(tomorrow|today|tonight|now|currently|right now)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(next|this|last)\\s+(week|month|year|monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(in|at|on)\\s+\\d+\\s*(am|pm|hour|hours|minute|minutes|day|days|week|weeks)?\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(morning|afternoon|evening|night)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\d{1,2}:\\d{2}\\s*(am|pm)?\\b", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern LEADING_VERB_PATTERN =
            Pattern.compile("^\\s*(schedule|add|create|make|set up|book)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    public Optional<String> extractCategory(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<Pattern>> entry : CATEGORY_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(normalized).find()) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public String extractTitle(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text;
        for (Pattern pattern : TEMPORAL_PATTERNS) {
            cleaned = pattern.matcher(cleaned).replaceAll("");
        }
        cleaned = LEADING_VERB_PATTERN.matcher(cleaned).replaceFirst("");
        cleaned = WHITESPACE_PATTERN.matcher(cleaned).replaceAll(" ").trim();
        return cleaned.isEmpty() ? text.trim() : cleaned;
    }

    public boolean isAmbiguous(String text) {
        if (text == null || text.trim().length() < 3) {
            return true;
        }
        return extractCategory(text).isEmpty() && extractTitle(text).trim().length() < 3;
    }

    private static Map<String, List<String>> buildCategoryKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("Exam", List.of("exam", "test", "quiz", "midterm", "final"));
        keywords.put("Study", List.of("study", "review", "homework", "assignment", "reading"));
        keywords.put("Gym", List.of("gym", "workout", "exercise", "fitness", "training", "run", "jog"));
        keywords.put("Social", List.of("meet", "meeting", "hangout", "party", "dinner", "lunch", "coffee",
                "friend", "sleep", "rest", "nap", "bedtime", "wake", "call"));
        keywords.put("Gaming", List.of("game", "gaming", "play", "stream", "esports"));
        return keywords;
    }

    private static Map<String, List<Pattern>> compile(Map<String, List<String>> keywords) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        keywords.forEach((category, words) -> compiled.put(category, words.stream()
                .map(word -> Pattern.compile("\\b" + Pattern.quote(word) + "\\b"))
                .toList()));
        return compiled;
    }
}
