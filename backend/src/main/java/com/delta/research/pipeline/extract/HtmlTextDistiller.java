package com.delta.research.pipeline.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces an HTML page to text. Pages built around tables or lists yield one candidate line per
 * row or item; other pages fall back to their visible text, one line per text node.
 */
public final class HtmlTextDistiller {
    static final int MAX_CANDIDATE_LENGTH = 150;
    static final int MAX_CANDIDATES = 200;

    private static final String[] REMOVED_TAGS = {"script", "style", "nav", "footer", "header", "aside", "button"};
    private static final Pattern NOISE_ATTRIBUTE = Pattern.compile(
        "(nav|menu|sidebar|widget|social|share|comment|ad|banner)",
        Pattern.CASE_INSENSITIVE
    );
    private static final List<String> TABLE_SKIP = List.of("nav", "menu", "widget", "sidebar");
    private static final List<String> UL_SKIP = List.of("nav", "menu", "social", "share", "widget", "sidebar");
    private static final List<String> OL_SKIP = List.of("nav", "menu", "sidebar");
    private static final List<String> NAV_UI_PHRASES = List.of(
        "home", "about", "contact", "search", "login", "logout", "sign in", "sign up",
        "subscribe", "menu", "close", "open", "skip to", "read more", "learn more",
        "click here", "view all", "see all", "show more", "author:", "published:",
        "facebook", "twitter", "linkedin", "instagram", "youtube", "social",
        "share", "email", "print", "download", "newsletter", "rss",
        "previous", "next", "back", "forward", "arrow", "button", "icon",
        "caret", "chevron", "hamburger", "pause", "play", "stop", "mute",
        "copyright", "©", "privacy", "terms", "cookie", "sitemap",
        "all rights reserved", "awards", "winners", "articles", "news",
        "digital", "magazine", "related", "content", "submit"
    );
    private static final Set<String> UI_WORDS = Set.of(
        "pause", "play", "stop", "mute", "search", "close", "open", "menu",
        "home", "back", "next", "skip", "more", "less", "submit", "cancel",
        "twitter", "facebook", "linkedin", "youtube", "instagram",
        "subscribe", "login", "logout", "register", "signin", "signup",
        "print", "download", "share", "email", "follow", "unfollow"
    );
    private static final Set<String> NAV_WORDS = Set.of(
        "home", "awards", "news", "blog", "shop", "store", "help", "support"
    );
    private static final Pattern CHARSET = Pattern.compile("charset=[\"']?([^\"';\\s]+)", Pattern.CASE_INSENSITIVE);
    private static final List<String> TITLE_SUFFIXES = List.of(" Magazine", " Journal", " News", " Times", " Post");
    private static final Pattern ICON_NAME = Pattern.compile("^[a-z]+[-_][a-z]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONEY_PREFIX = Pattern.compile(
        "^[$€£¥]?\\s*[\\d,.]+(\\s*[BMK%])?$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern MONEY_SUFFIX = Pattern.compile(
        "^[\\d,.]+(\\s*[BMK%])?\\s*[$€£¥]?$",
        Pattern.CASE_INSENSITIVE
    );

    private HtmlTextDistiller() {
    }

    public static Distilled distill(String html) {
        return distill(Jsoup.parse(html == null ? "" : html));
    }

    /**
     * Decodes a fetched body with the charset its Content-Type names. Without one, jsoup picks the
     * charset from a byte order mark or a meta tag and falls back to UTF-8.
     */
    public static Distilled distill(byte[] body, String contentType, String baseUri) throws IOException {
        try (InputStream in = new ByteArrayInputStream(body == null ? new byte[0] : body)) {
            return distill(Jsoup.parse(in, charsetOf(contentType), baseUri == null ? "" : baseUri));
        }
    }

    static String charsetOf(String contentType) {
        if (contentType == null) {
            return null;
        }
        Matcher matcher = CHARSET.matcher(contentType);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1).trim();
        try {
            return Charset.isSupported(name) ? name : null;
        } catch (IllegalCharsetNameException e) {
            return null;
        }
    }

    private static Distilled distill(Document document) {
        String title = extractTitle(document);
        removeNoise(document);

        List<String> candidates = new ArrayList<>();
        for (Element table : document.select("table")) {
            if (containsAny(table.className(), TABLE_SKIP)) {
                continue;
            }
            for (Element row : table.select("tr")) {
                Elements cells = row.select("td, th");
                if (!cells.isEmpty()) {
                    addCandidate(candidates, cells.get(0).text());
                }
            }
        }
        for (Element list : document.select("ul")) {
            if (containsAny(list.className(), UL_SKIP) || containsAny(list.id(), UL_SKIP)) {
                continue;
            }
            for (Element item : list.children()) {
                if ("li".equals(item.normalName())) {
                    addCandidate(candidates, item.text());
                }
            }
        }
        for (Element list : document.select("ol")) {
            if (containsAny(list.className(), OL_SKIP)) {
                continue;
            }
            for (Element item : list.children()) {
                if ("li".equals(item.normalName())) {
                    addCandidate(candidates, item.text());
                }
            }
        }

        List<String> filtered = new ArrayList<>();
        for (String candidate : candidates) {
            if (isListEntry(candidate)) {
                filtered.add(candidate);
            }
        }
        if (!filtered.isEmpty()) {
            return new Distilled(String.join("\n", filtered.subList(0, Math.min(MAX_CANDIDATES, filtered.size()))), title);
        }
        return new Distilled(fullText(document), title);
    }

    static boolean isListEntry(String candidate) {
        if (candidate.length() < 3 || !hasLetter(candidate)) {
            return false;
        }
        String lower = candidate.toLowerCase(Locale.ROOT);
        boolean singleWord = !candidate.contains(" ");
        if (singleWord && UI_WORDS.contains(lower)) {
            return false;
        }
        for (String phrase : NAV_UI_PHRASES) {
            if (lower.contains(phrase)) {
                return false;
            }
        }
        if (ICON_NAME.matcher(candidate).find()) {
            return false;
        }
        if (MONEY_PREFIX.matcher(candidate).matches() || MONEY_SUFFIX.matcher(candidate).matches()) {
            return false;
        }
        if (candidate.trim().split("\\s+").length == 1 && candidate.length() < 15 && NAV_WORDS.contains(lower)) {
            return false;
        }
        if (candidate.contains(" | ")) {
            return false;
        }
        for (String suffix : TITLE_SUFFIXES) {
            if (candidate.endsWith(suffix)) {
                return false;
            }
        }
        return true;
    }

    private static void removeNoise(Document document) {
        for (String tag : REMOVED_TAGS) {
            document.select(tag).remove();
        }
        for (Element element : document.getAllElements()) {
            if (element == document || "html".equals(element.normalName()) || "body".equals(element.normalName())) {
                continue;
            }
            if (element.parent() == null) {
                continue;
            }
            String role = element.attr("role");
            boolean noisy = "navigation".equals(role) || "complementary".equals(role);
            if (!noisy) {
                for (String className : element.classNames()) {
                    if (NOISE_ATTRIBUTE.matcher(className).find()) {
                        noisy = true;
                        break;
                    }
                }
            }
            if (!noisy && element.hasAttr("id") && NOISE_ATTRIBUTE.matcher(element.id()).find()) {
                noisy = true;
            }
            if (noisy) {
                element.remove();
            }
        }
    }

    private static String fullText(Document document) {
        List<String> lines = new ArrayList<>();
        document.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                for (String line : textNode.getWholeText().split("\n")) {
                    String stripped = line.strip();
                    if (!stripped.isEmpty()) {
                        lines.add(stripped);
                    }
                }
            }
        });
        return String.join("\n", lines);
    }

    private static String extractTitle(Document document) {
        Element ogTitle = document.selectFirst("meta[property=og:title], meta[name=og:title]");
        if (ogTitle != null && !ogTitle.attr("content").isBlank()) {
            return ogTitle.attr("content").trim();
        }
        if (!document.title().isBlank()) {
            return document.title().trim();
        }
        Element h1 = document.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) {
            return h1.text().trim();
        }
        return null;
    }

    private static void addCandidate(List<String> candidates, String text) {
        String value = text == null ? "" : text.trim();
        if (!value.isEmpty() && value.length() <= MAX_CANDIDATE_LENGTH) {
            candidates.add(value);
        }
    }

    private static boolean containsAny(String attribute, List<String> needles) {
        if (attribute == null || attribute.isBlank()) {
            return false;
        }
        String lower = attribute.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (lower.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasLetter(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetter(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    public record Distilled(String text, String title) {
    }
}
