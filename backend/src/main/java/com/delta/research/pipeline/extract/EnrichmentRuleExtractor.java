package com.delta.research.pipeline.extract;

import com.delta.research.pipeline.model.ExtractedFact;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rules-only company facts: HQ country, ownership signal and industry keywords. Every rule reads a
 * closed vocabulary and iterates it in a fixed order, so equal text always yields equal facts.
 */
public final class EnrichmentRuleExtractor {
    public static final String FIELD_HQ_COUNTRY = "hq_country";
    public static final String FIELD_OWNERSHIP_SIGNAL = "ownership_signal";
    public static final String FIELD_INDUSTRY_KEYWORDS = "industry_keywords";

    static final int MAX_INDUSTRY_KEYWORDS = 10;

    /** Canonical country name to lowercase synonyms; iterated in key order. */
    static final Map<String, List<String>> COUNTRY_SYNONYMS = new TreeMap<>();

    static {
        COUNTRY_SYNONYMS.put("United States", List.of("united states", "usa", "u.s.a", "us", "u.s"));
        COUNTRY_SYNONYMS.put("United Kingdom", List.of("united kingdom", "uk", "u.k", "great britain", "britain"));
        COUNTRY_SYNONYMS.put("United Arab Emirates", List.of("united arab emirates", "uae"));
        COUNTRY_SYNONYMS.put("Saudi Arabia", List.of("saudi arabia", "saudi", "ksa"));
        COUNTRY_SYNONYMS.put("Qatar", List.of("qatar"));
        COUNTRY_SYNONYMS.put("Kuwait", List.of("kuwait"));
        COUNTRY_SYNONYMS.put("Oman", List.of("oman"));
        COUNTRY_SYNONYMS.put("Bahrain", List.of("bahrain"));
        COUNTRY_SYNONYMS.put("Romania", List.of("romania"));
        COUNTRY_SYNONYMS.put("Republic of Moldova", List.of("moldova", "republic of moldova"));
        COUNTRY_SYNONYMS.put("India", List.of("india"));
        COUNTRY_SYNONYMS.put("Pakistan", List.of("pakistan"));
        COUNTRY_SYNONYMS.put("Singapore", List.of("singapore"));
        COUNTRY_SYNONYMS.put("China", List.of("china", "prc"));
        COUNTRY_SYNONYMS.put("Japan", List.of("japan"));
        COUNTRY_SYNONYMS.put("South Korea", List.of("south korea", "korea"));
        COUNTRY_SYNONYMS.put("Vietnam", List.of("vietnam"));
        COUNTRY_SYNONYMS.put("Thailand", List.of("thailand"));
        COUNTRY_SYNONYMS.put("Indonesia", List.of("indonesia"));
        COUNTRY_SYNONYMS.put("Malaysia", List.of("malaysia"));
        COUNTRY_SYNONYMS.put("Philippines", List.of("philippines", "philippine"));
        COUNTRY_SYNONYMS.put("Australia", List.of("australia"));
        COUNTRY_SYNONYMS.put("New Zealand", List.of("new zealand"));
        COUNTRY_SYNONYMS.put("Canada", List.of("canada"));
        COUNTRY_SYNONYMS.put("Mexico", List.of("mexico"));
        COUNTRY_SYNONYMS.put("Brazil", List.of("brazil"));
        COUNTRY_SYNONYMS.put("Argentina", List.of("argentina"));
        COUNTRY_SYNONYMS.put("Chile", List.of("chile"));
        COUNTRY_SYNONYMS.put("Colombia", List.of("colombia"));
        COUNTRY_SYNONYMS.put("Peru", List.of("peru"));
        COUNTRY_SYNONYMS.put("Germany", List.of("germany"));
        COUNTRY_SYNONYMS.put("France", List.of("france"));
        COUNTRY_SYNONYMS.put("Spain", List.of("spain"));
        COUNTRY_SYNONYMS.put("Portugal", List.of("portugal"));
        COUNTRY_SYNONYMS.put("Italy", List.of("italy"));
        COUNTRY_SYNONYMS.put("Switzerland", List.of("switzerland"));
        COUNTRY_SYNONYMS.put("Netherlands", List.of("netherlands", "holland"));
        COUNTRY_SYNONYMS.put("Belgium", List.of("belgium"));
        COUNTRY_SYNONYMS.put("Sweden", List.of("sweden"));
        COUNTRY_SYNONYMS.put("Norway", List.of("norway"));
        COUNTRY_SYNONYMS.put("Denmark", List.of("denmark"));
        COUNTRY_SYNONYMS.put("Finland", List.of("finland"));
        COUNTRY_SYNONYMS.put("Poland", List.of("poland"));
        COUNTRY_SYNONYMS.put("Czech Republic", List.of("czech republic", "czechia"));
        COUNTRY_SYNONYMS.put("Hungary", List.of("hungary"));
        COUNTRY_SYNONYMS.put("Greece", List.of("greece"));
        COUNTRY_SYNONYMS.put("Turkey", List.of("turkey", "turkiye"));
        COUNTRY_SYNONYMS.put("Ireland", List.of("ireland"));
        COUNTRY_SYNONYMS.put("Israel", List.of("israel"));
        COUNTRY_SYNONYMS.put("Egypt", List.of("egypt"));
        COUNTRY_SYNONYMS.put("Kenya", List.of("kenya"));
        COUNTRY_SYNONYMS.put("Nigeria", List.of("nigeria"));
        COUNTRY_SYNONYMS.put("South Africa", List.of("south africa"));
    }

    private static final List<HqRule> HQ_RULES = List.of(
        new HqRule("headquarters", Pattern.compile("\\bheadquarters?:?\\s*([A-Za-z .,'-]+)", Pattern.CASE_INSENSITIVE), 0.90),
        new HqRule("hq", Pattern.compile("\\bhq:?\\s*([A-Za-z .,'-]+)", Pattern.CASE_INSENSITIVE), 0.90),
        new HqRule("based in", Pattern.compile("\\bbased in\\s+([A-Za-z .,'-]+)", Pattern.CASE_INSENSITIVE), 0.70),
        new HqRule("located in", Pattern.compile("\\blocated in\\s+([A-Za-z .,'-]+)", Pattern.CASE_INSENSITIVE), 0.70)
    );

    /** Tie-break order when two ownership signals have the same confidence. */
    static final List<String> OWNERSHIP_PRIORITY = List.of("state_owned", "public_company", "subsidiary", "private_company");

    private static final List<OwnershipRule> OWNERSHIP_RULES = List.of(
        new OwnershipRule("public_company", 0.80, words("listed on", "traded on", "ticker", "nyse", "nasdaq", "lse")),
        new OwnershipRule("subsidiary", 0.80, words("subsidiary of", "wholly owned subsidiary")),
        new OwnershipRule("subsidiary", 0.60, words("part of the")),
        new OwnershipRule("private_company", 0.80, words("privately held", "private company")),
        new OwnershipRule("state_owned", 0.80, List.of(
            Pattern.compile("\\bstate[- ]owned\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bgovernment[- ]owned\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsoe\\b", Pattern.CASE_INSENSITIVE)
        ))
    );

    static final List<String> INDUSTRY_KEYWORDS = List.of(
        "renewable energy", "solar", "wind", "hydrogen", "battery", "energy storage", "grid",
        "power generation", "oil", "gas", "lng", "petrochemical", "mining", "metals", "steel",
        "construction", "cement", "real estate", "infrastructure", "logistics", "supply chain",
        "shipping", "aviation", "aerospace", "defense", "automotive", "mobility", "transportation",
        "rail", "semiconductor", "electronics", "hardware", "robotics", "automation", "manufacturing",
        "industrial equipment", "chemicals", "fertilizer", "agriculture", "food processing",
        "beverage", "retail", "ecommerce", "fintech", "payments", "banking", "insurance", "investment",
        "asset management", "healthcare", "hospital", "pharma", "biotech", "medtech", "life sciences",
        "education", "media", "entertainment", "gaming", "sports", "telecom", "iot", "smart city",
        "cloud", "saas", "data analytics", "ai", "machine learning", "cybersecurity", "blockchain",
        "water treatment", "waste management"
    );

    private static final Map<String, Pattern> SYNONYM_PATTERNS = new TreeMap<>();
    private static final Map<String, Pattern> KEYWORD_PATTERNS = new TreeMap<>();

    static {
        for (List<String> synonyms : COUNTRY_SYNONYMS.values()) {
            for (String synonym : synonyms) {
                SYNONYM_PATTERNS.put(synonym, wordPattern(synonym));
            }
        }
        for (String keyword : INDUSTRY_KEYWORDS) {
            KEYWORD_PATTERNS.put(keyword, wordPattern(keyword));
        }
    }

    private EnrichmentRuleExtractor() {
    }

    public static List<ExtractedFact> extract(String text) {
        String content = text == null ? "" : text.strip();
        if (content.isEmpty()) {
            return List.of();
        }
        String lower = content.toLowerCase(Locale.ROOT);
        List<ExtractedFact> facts = new ArrayList<>();

        HqMatch hq = extractHqCountry(lower);
        if (hq != null) {
            facts.add(new ExtractedFact(FIELD_HQ_COUNTRY, TextNode.valueOf(hq.country()), hq.country(), hq.confidence(), hq.rule()));
        }

        OwnershipMatch ownership = extractOwnership(lower);
        if (ownership != null) {
            facts.add(new ExtractedFact(
                FIELD_OWNERSHIP_SIGNAL,
                TextNode.valueOf(ownership.signal()),
                ownership.signal(),
                ownership.confidence(),
                ownership.phrase()
            ));
        }

        KeywordsMatch keywords = extractIndustryKeywords(lower);
        if (keywords != null) {
            ArrayNode value = JsonNodeFactory.instance.arrayNode();
            keywords.keywords().forEach(value::add);
            facts.add(new ExtractedFact(
                FIELD_INDUSTRY_KEYWORDS,
                value,
                String.join(", ", keywords.keywords()),
                keywords.confidence(),
                "industry_vocabulary"
            ));
        }
        return facts;
    }

    static HqMatch extractHqCountry(String lower) {
        for (HqRule rule : HQ_RULES) {
            Matcher matcher = rule.pattern().matcher(lower);
            if (!matcher.find()) {
                continue;
            }
            String country = matchCountry(matcher.group(1));
            if (country != null) {
                return new HqMatch(country, rule.confidence(), rule.label());
            }
        }
        return null;
    }

    static String matchCountry(String fragment) {
        if (fragment == null) {
            return null;
        }
        String cleaned = fragment.toLowerCase(Locale.ROOT).replaceAll("[^a-zA-Z\\s]", " ");
        cleaned = String.join(" ", cleaned.trim().split("\\s+"));
        for (Map.Entry<String, List<String>> entry : COUNTRY_SYNONYMS.entrySet()) {
            for (String synonym : entry.getValue()) {
                if (SYNONYM_PATTERNS.get(synonym).matcher(cleaned).find()) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    static OwnershipMatch extractOwnership(String lower) {
        OwnershipMatch best = null;
        for (OwnershipRule rule : OWNERSHIP_RULES) {
            for (Pattern pattern : rule.patterns()) {
                if (pattern.matcher(lower).find()) {
                    best = stronger(best, new OwnershipMatch(rule.signal(), rule.confidence(), pattern.pattern()));
                    break;
                }
            }
        }
        return best;
    }

    static KeywordsMatch extractIndustryKeywords(String lower) {
        List<Map.Entry<String, Integer>> matches = new ArrayList<>();
        for (String keyword : INDUSTRY_KEYWORDS) {
            Matcher matcher = KEYWORD_PATTERNS.get(keyword).matcher(lower);
            int occurrences = 0;
            while (matcher.find()) {
                occurrences++;
            }
            if (occurrences > 0) {
                matches.add(Map.entry(keyword, occurrences));
            }
        }
        if (matches.isEmpty()) {
            return null;
        }
        matches.sort(
            Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue).reversed()
                .thenComparing(Map.Entry::getKey)
        );
        int maxFrequency = matches.get(0).getValue();
        List<String> top = matches.stream()
            .limit(MAX_INDUSTRY_KEYWORDS)
            .map(Map.Entry::getKey)
            .toList();
        return new KeywordsMatch(top, maxFrequency >= 2 ? 0.70 : 0.60);
    }

    private static OwnershipMatch stronger(OwnershipMatch current, OwnershipMatch incoming) {
        if (current == null || incoming.confidence() > current.confidence()) {
            return incoming;
        }
        if (incoming.confidence() < current.confidence()) {
            return current;
        }
        int currentRank = OWNERSHIP_PRIORITY.indexOf(current.signal());
        int incomingRank = OWNERSHIP_PRIORITY.indexOf(incoming.signal());
        return incomingRank < currentRank ? incoming : current;
    }

    private static List<Pattern> words(String... phrases) {
        List<Pattern> out = new ArrayList<>();
        for (String phrase : phrases) {
            out.add(Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b", Pattern.CASE_INSENSITIVE));
        }
        return out;
    }

    private static Pattern wordPattern(String phrase) {
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b", Pattern.UNICODE_CHARACTER_CLASS);
    }

    record HqRule(String label, Pattern pattern, double confidence) {
    }

    record OwnershipRule(String signal, double confidence, List<Pattern> patterns) {
    }

    record HqMatch(String country, double confidence, String rule) {
    }

    record OwnershipMatch(String signal, double confidence, String phrase) {
    }

    record KeywordsMatch(List<String> keywords, double confidence) {
    }
}
