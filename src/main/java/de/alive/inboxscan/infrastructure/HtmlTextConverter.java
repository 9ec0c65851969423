package de.alive.inboxscan.infrastructure;

import org.jetbrains.annotations.NotNull;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flattens HTML mail bodies to text. Link targets are kept as {@code text (url)} so unsubscribe
 * links remain detectable in the converted body.
 */
public final class HtmlTextConverter {

    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern INVISIBLE_BLOCK = Pattern.compile(
            "<(script|style|head)\\b[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ANCHOR = Pattern.compile(
            "<a\\b[^>]*?href\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))[^>]*>(.*?)</a\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LINE_BREAK = Pattern.compile(
            "<(br|/p|/div|/tr|/li|/h[1-6])\\b[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?)([0-9a-fA-F]+);");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");

    private HtmlTextConverter() {
    }

    @NotNull
    public static String toText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }

        String text = COMMENT.matcher(html).replaceAll(" ");
        text = INVISIBLE_BLOCK.matcher(text).replaceAll(" ");
        text = replaceAnchors(text);
        text = LINE_BREAK.matcher(text).replaceAll("\n");
        text = TAG.matcher(text).replaceAll(" ");
        text = unescapeEntities(text);
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        text = BLANK_LINES.matcher(text).replaceAll("\n");

        StringBuilder result = new StringBuilder(text.length());
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                if (result.length() > 0) {
                    result.append('\n');
                }
                result.append(trimmed);
            }
        }
        return result.toString();
    }

    private static String replaceAnchors(String html) {
        Matcher matcher = ANCHOR.matcher(html);
        StringBuilder out = new StringBuilder(html.length());
        while (matcher.find()) {
            // double quoted, single quoted or bare attribute value
            String href = firstNonNull(matcher.group(1), matcher.group(2), matcher.group(3)).trim();
            String label = matcher.group(4);
            String replacement = href.isEmpty() ? label : label + " (" + href + ")";
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String unescapeEntities(String text) {
        Matcher matcher = NUMERIC_ENTITY.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement;
            try {
                int codePoint = Integer.parseInt(matcher.group(2), matcher.group(1).isEmpty() ? 10 : 16);
                replacement = new String(Character.toChars(codePoint));
            } catch (IllegalArgumentException e) {
                replacement = matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);

        return out.toString()
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return "";
    }
}
