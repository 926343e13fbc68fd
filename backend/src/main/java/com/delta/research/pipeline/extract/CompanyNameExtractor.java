package com.delta.research.pipeline.extract;

import com.delta.research.pipeline.util.TextNormalizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Line-oriented company name extraction. Each cleaned line is a candidate unless it reads like a
 * heading, a sentence or a number.
 */
public final class CompanyNameExtractor {
    private static final int MAX_NAME_LENGTH = 150;
    private static final int MAX_SNIPPET_LENGTH = 500;
    private static final int NEXT_LINE_CONTEXT = 100;
    private static final double SHORT_SINGLE_WORD_RATIO = 0.7;

    private static final Pattern BULLET = Pattern.compile("^[\\-•*]+\\s+");
    private static final Pattern NUMBERING = Pattern.compile("^\\d+[.)]\\s+");
    private static final Pattern LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern MONEY_PREFIX = Pattern.compile(
        "^[$€£¥]?\\s*[\\d,.]+(\\s*[BMK])?$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MONEY_SUFFIX = Pattern.compile(
        "^[\\d,.]+(\\s*[BMK])?\\s*[$€£¥]$",
        Pattern.CASE_INSENSITIVE
    );
    private static final List<Pattern> HEADER_LINES = List.of(
        Pattern.compile("^top\\s+\\w+\\s*\\(.*\\)", Pattern.UNICODE_CHARACTER_CLASS),
        Pattern.compile("^here\\s+are\\s+.*", Pattern.UNICODE_CHARACTER_CLASS),
        Pattern.compile("^\\w+\\s+list\\s*$", Pattern.UNICODE_CHARACTER_CLASS)
    );
    private static final List<String> HEADER_PHRASES = List.of(
        "top nbfc", "sample list", "notes", "company list", "here are",
        "interesting", "sample", "following", "these are"
    );
    private static final int HEADER_PHRASE_MAX_LENGTH = 60;

    private CompanyNameExtractor() {
    }

    public static List<CompanyMention> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] lines = TextNormalizer.normalizePastedText(text).split("\n", -1);
        List<CompanyMention> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String cleaned = BULLET.matcher(line).replaceFirst("");
            cleaned = NUMBERING.matcher(cleaned).replaceFirst("");
            cleaned = TextNormalizer.collapseWhitespace(cleaned);
            if (!isCandidate(cleaned)) {
                continue;
            }
            String normalized = TextNormalizer.normalizeCompanyName(cleaned);
            if (normalized.isEmpty() || !seen.add(normalized)) {
                continue;
            }
            String snippet = cleaned;
            if (i + 1 < lines.length && !lines[i + 1].trim().isEmpty()) {
                String next = lines[i + 1].trim();
                snippet = snippet + " | " + next.substring(0, Math.min(NEXT_LINE_CONTEXT, next.length()));
            }
            if (snippet.length() > MAX_SNIPPET_LENGTH) {
                snippet = snippet.substring(0, MAX_SNIPPET_LENGTH);
            }
            out.add(new CompanyMention(cleaned, normalized, snippet));
        }

        if (!out.isEmpty()) {
            long shortSingleWords = out.stream()
                .filter(mention -> !mention.name().contains(" ") && mention.name().length() < 15)
                .count();
            if ((double) shortSingleWords / out.size() > SHORT_SINGLE_WORD_RATIO) {
                return List.of();
            }
        }
        return out;
    }

    static boolean isCandidate(String cleaned) {
        if (cleaned.length() < 3 || !LETTER.matcher(cleaned).find()) {
            return false;
        }
        if (cleaned.length() > MAX_NAME_LENGTH) {
            return false;
        }
        if (cleaned.endsWith(".") && cleaned.split(" ").length > 6) {
            return false;
        }
        if (MONEY_PREFIX.matcher(cleaned).matches() || MONEY_SUFFIX.matcher(cleaned).matches()) {
            return false;
        }
        String lower = cleaned.toLowerCase(Locale.ROOT);
        for (Pattern pattern : HEADER_LINES) {
            if (pattern.matcher(lower).lookingAt()) {
                return false;
            }
        }
        if (cleaned.length() < HEADER_PHRASE_MAX_LENGTH) {
            for (String phrase : HEADER_PHRASES) {
                if (lower.contains(phrase)) {
                    return false;
                }
            }
        }
        return true;
    }

    public record CompanyMention(String name, String normalizedName, String snippet) {
    }
}
