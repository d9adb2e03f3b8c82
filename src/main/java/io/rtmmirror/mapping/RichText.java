package io.rtmmirror.mapping;

import java.util.regex.Pattern;

/**
 * Conversion between the remote rich-text step cells and local plain text. Lossy: markup is
 * dropped on the way in and only a single paragraph is re-applied on the way out.
 */
public final class RichText {
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern BREAK = Pattern.compile("(?i)<br\\s*/?>|</p>\\s*<p[^>]*>");

    private RichText() {
    }

    public static String toPlain(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String withBreaks = BREAK.matcher(html).replaceAll("\n");
        String stripped = TAG.matcher(withBreaks).replaceAll("");
        return unescape(stripped).strip();
    }

    public static String toHtml(String plain) {
        if (plain == null || plain.isEmpty()) {
            return "";
        }
        return "<p>" + escape(plain).replace("\n", "<br/>") + "</p>";
    }

    static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    static String unescape(String text) {
        return text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }
}
