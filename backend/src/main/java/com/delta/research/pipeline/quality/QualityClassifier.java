package com.delta.research.pipeline.quality;

import com.delta.research.pipeline.model.QualityDecision;
import com.delta.research.pipeline.model.SourceMeta.ExtractionInfo;
import com.delta.research.pipeline.model.SourceMeta.QualityFlags;
import com.delta.research.pipeline.model.SourceType;
import com.delta.research.pipeline.util.HashUtils;
import com.delta.research.pipeline.util.TextNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores acquired text and assigns an accept / flag / reject decision with reason codes.
 */
public final class QualityClassifier {
    public static final String EXTRACTION_VERSION = "5.2.0";

    static final int MIN_WORDS_HTML = 150;
    static final int MIN_WORDS_PDF = 50;
    static final int EXTREME_MIN_WORDS = 5;
    static final double UNIQUE_TOKEN_RATIO_MIN = 0.12;
    static final double ALPHA_RATIO_MIN = 0.55;
    static final int SIGNATURE_PREFIX_CHARS = 2000;
    static final int SIGNATURE_TOKEN_COUNT = 500;
    static final int SCAN_CHARS = 2000;

    public static final String REJECT_EMPTY_TEXT = "REJECT_EMPTY_TEXT";
    public static final String REJECT_EXTREME_THIN = "REJECT_EXTREME_THIN";
    public static final String FLAG_THIN_CONTENT = "FLAG_THIN_CONTENT";
    public static final String FLAG_PAYWALL_OR_LOGIN = "FLAG_PAYWALL_OR_LOGIN";
    public static final String FLAG_ERROR_PAGE = "FLAG_ERROR_PAGE";
    public static final String FLAG_UNEXTRACTABLE_PDF = "FLAG_UNEXTRACTABLE_PDF";
    public static final String FLAG_BOILERPLATE_DOMINANT = "FLAG_BOILERPLATE_DOMINANT";
    public static final String FLAG_DUPLICATE_TEMPLATE = "FLAG_DUPLICATE_TEMPLATE";

    private static final List<String> PAYWALL_MARKERS = List.of(
        "subscribe", "sign in", "log in", "access denied", "registration", "paywall"
    );
    private static final List<String> ERROR_MARKERS = List.of(
        "page not found", "404", "service unavailable", "temporarily unavailable"
    );
    private static final Pattern TOKEN = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private QualityClassifier() {
    }

    /**
     * Scores one document. {@code materialHash} identifies the raw input so an unchanged document
     * can be skipped on the next pass.
     */
    public static QualityReport classify(
        SourceType sourceType,
        String title,
        String text,
        boolean pdfUnextractable,
        String materialHash,
        Instant extractedAt
    ) {
        String normalized = TextNormalizer.normalizeForQuality(text);
        List<String> tokens = tokenize(normalized);
        int wordCount = tokens.size();
        int charCount = normalized.codePointCount(0, normalized.length());
        int lineCount = 0;
        for (String line : normalized.split("\n")) {
            if (!line.isBlank()) {
                lineCount++;
            }
        }
        double uniqueRatio = (double) new HashSet<>(tokens).size() / Math.max(wordCount, 1);
        long alphaChars = normalized.codePoints().filter(Character::isLetter).count();
        double alphaRatio = (double) alphaChars / Math.max(charCount, 1);

        int minWords = sourceType == SourceType.PDF ? MIN_WORDS_PDF : MIN_WORDS_HTML;
        Set<String> reasons = new TreeSet<>();
        boolean thin = false;
        boolean paywall = false;
        boolean errorPage = false;
        boolean boilerplate = false;
        boolean unextractable = sourceType == SourceType.PDF && pdfUnextractable;

        if (unextractable) {
            reasons.add(FLAG_UNEXTRACTABLE_PDF);
        }
        if (wordCount == 0) {
            reasons.add(REJECT_EMPTY_TEXT);
        } else {
            if (wordCount < EXTREME_MIN_WORDS) {
                thin = true;
                reasons.add(REJECT_EXTREME_THIN);
            } else if (wordCount < minWords) {
                thin = true;
                reasons.add(FLAG_THIN_CONTENT);
            }
            String scanned = ((title == null ? "" : title) + " " + prefix(normalized, SCAN_CHARS))
                .toLowerCase(Locale.ROOT);
            if (PAYWALL_MARKERS.stream().anyMatch(scanned::contains)) {
                paywall = true;
                reasons.add(FLAG_PAYWALL_OR_LOGIN);
            }
            if (ERROR_MARKERS.stream().anyMatch(scanned::contains)) {
                errorPage = true;
                reasons.add(FLAG_ERROR_PAGE);
            }
            if ((uniqueRatio < UNIQUE_TOKEN_RATIO_MIN || alphaRatio < ALPHA_RATIO_MIN) && wordCount >= MIN_WORDS_HTML) {
                boilerplate = true;
                reasons.add(FLAG_BOILERPLATE_DOMINANT);
            }
        }

        QualityFlags flags = new QualityFlags(paywall, errorPage, thin, boilerplate, unextractable);
        String textHash = HashUtils.sha256Hex(normalized);
        String signaturePrefix = HashUtils.sha256Hex(prefix(normalized, SIGNATURE_PREFIX_CHARS));
        String signatureTokens = HashUtils.sha256Hex(
            String.join(" ", tokens.subList(0, Math.min(tokens.size(), SIGNATURE_TOKEN_COUNT)))
        );
        ExtractionInfo extraction = new ExtractionInfo(
            EXTRACTION_VERSION,
            materialHash,
            textHash,
            signaturePrefix,
            signatureTokens,
            wordCount,
            charCount,
            lineCount,
            uniqueRatio,
            alphaRatio,
            decide(reasons),
            new ArrayList<>(reasons),
            extractedAt
        );
        return new QualityReport(normalized, extraction, flags);
    }

    /**
     * Decision derived from the reason codes alone: any REJECT code rejects, any FLAG code flags.
     */
    public static QualityDecision decide(Collection<String> reasonCodes) {
        if (reasonCodes.stream().anyMatch(code -> code.startsWith("REJECT_"))) {
            return QualityDecision.REJECT;
        }
        if (reasonCodes.stream().anyMatch(code -> code.startsWith("FLAG_"))) {
            return QualityDecision.FLAG;
        }
        return QualityDecision.ACCEPT;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private static String prefix(String text, int codePoints) {
        if (text.codePointCount(0, text.length()) <= codePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, codePoints));
    }

    public record QualityReport(String normalizedText, ExtractionInfo extraction, QualityFlags flags) {
        public QualityDecision decision() {
            return extraction.decision();
        }
    }
}
