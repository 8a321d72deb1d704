package com.game.metadata.text;

import org.jsoup.Jsoup;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain-text cleanup for descriptions and labels pulled from external sources.
 */
public final class HtmlText {

    public static final int SHORT_DESCRIPTION_LENGTH = 250;

    private static final Pattern DECIMAL_ENTITY = Pattern.compile("&#(\\d{1,7});");
    private static final Pattern HEX_ENTITY = Pattern.compile("&#[xX]([0-9a-fA-F]{1,6});");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // &amp; is handled separately, after everything else
    private static final Map<String, String> NAMED_ENTITIES = new LinkedHashMap<>();

    static {
        NAMED_ENTITIES.put("&nbsp;", " ");
        NAMED_ENTITIES.put("&lt;", "<");
        NAMED_ENTITIES.put("&gt;", ">");
        NAMED_ENTITIES.put("&quot;", "\"");
        NAMED_ENTITIES.put("&apos;", "'");
        NAMED_ENTITIES.put("&ndash;", "–");
        NAMED_ENTITIES.put("&mdash;", "—");
        NAMED_ENTITIES.put("&rsquo;", "’");
        NAMED_ENTITIES.put("&lsquo;", "‘");
        NAMED_ENTITIES.put("&rdquo;", "”");
        NAMED_ENTITIES.put("&ldquo;", "“");
        NAMED_ENTITIES.put("&hellip;", "…");
    }

    private HtmlText() {
        // Utility class
    }

    /**
     * Parses markup and returns its text with whitespace collapsed. Entities are decoded
     * exactly once by the parser.
     */
    public static String stripHtml(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String text = Jsoup.parse(html).text().replace('\u00A0', ' ');
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Decodes character references left in text that was already unwrapped from its
     * envelope (XML attribute values, query bindings). Numeric references go first,
     * then named ones, and {@code &amp;} last, so {@code &amp;lt;} becomes {@code &lt;}
     * and is not decoded a second time.
     */
    public static String decodeEntities(String text) {
        if (text == null || text.indexOf('&') < 0) {
            return text;
        }
        String result = replaceNumeric(text, DECIMAL_ENTITY, 10);
        result = replaceNumeric(result, HEX_ENTITY, 16);
        for (Map.Entry<String, String> entity : NAMED_ENTITIES.entrySet()) {
            result = replaceIgnoreCase(result, entity.getKey(), entity.getValue());
        }
        return replaceIgnoreCase(result, "&amp;", "&");
    }

    /**
     * Description cleanup applied before a description is stored on a title:
     * markup removed, entities decoded, whitespace collapsed. Null becomes empty.
     */
    public static String normalizeDescription(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return stripHtml(raw);
    }

    /**
     * Cuts text to {@code maxLength} characters, the last three being "...".
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)) + "...";
    }

    private static String replaceNumeric(String text, Pattern pattern, int radix) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            int codePoint = Integer.parseInt(matcher.group(1), radix);
            String replacement = Character.isValidCodePoint(codePoint)
                    ? new String(Character.toChars(codePoint))
                    : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String replaceIgnoreCase(String text, String entity, String replacement) {
        return Pattern.compile(Pattern.quote(entity), Pattern.CASE_INSENSITIVE)
                .matcher(text)
                .replaceAll(Matcher.quoteReplacement(replacement));
    }
}
