package com.delta.research.pipeline.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[\\t ]+");
    private static final Pattern MULTI_NEWLINE = Pattern.compile("\\n{2,}");
    private static final Pattern TRAILING_SPACE = Pattern.compile("[\\t ]+$", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String[] COMPANY_SUFFIXES = {
        " ltd", " llc", " plc", " saog", " sa", " gmbh", " ag", " inc", " corp",
        " corporation", " limited", " group", " holdings", ".", ","
    };

    private TextNormalizer() {
    }

    public static String normalizeLineEndings(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Line endings unified and trailing whitespace stripped per line; used for pasted text sources.
     */
    public static String normalizePastedText(String text) {
        return TRAILING_SPACE.matcher(normalizeLineEndings(text)).replaceAll("");
    }

    /**
     * Normalization applied before quality scoring and signature hashing.
     */
    public static String normalizeForQuality(String text) {
        String value = normalizeLineEndings(text);
        value = HORIZONTAL_SPACE.matcher(value).replaceAll(" ");
        value = MULTI_NEWLINE.matcher(value).replaceAll("\n");
        return value.trim();
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Lowercased company name with one trailing legal suffix removed per known suffix, in table order.
     */
    public static String normalizeCompanyName(String name) {
        String value = collapseWhitespace(name).toLowerCase(Locale.ROOT);
        for (String suffix : COMPANY_SUFFIXES) {
            if (value.endsWith(suffix)) {
                value = value.substring(0, value.length() - suffix.length()).trim();
            }
        }
        return collapseWhitespace(value);
    }
}
