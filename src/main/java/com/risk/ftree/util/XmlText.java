package com.risk.ftree.util;

/**
 * Escaping for text written into MEF XML attribute values.
 * Names made of letters, digits, '_' and '-' pass through unchanged.
 */
public final class XmlText {
    private XmlText() {
        // Utility class
    }

    public static String escape(String value) {
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            String replacement = switch (c) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\'' -> "&apos;";
                default -> null;
            };
            if (replacement == null) {
                if (sb != null)
                    sb.append(c);
                continue;
            }
            if (sb == null)
                sb = new StringBuilder(value.length() + 16).append(value, 0, i);
            sb.append(replacement);
        }
        return sb == null ? value : sb.toString();
    }
}
