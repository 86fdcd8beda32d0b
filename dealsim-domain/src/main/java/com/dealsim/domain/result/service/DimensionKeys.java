package com.dealsim.domain.result.service;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Key normalization and number coercion for engine-reported dimension values.
 */
public final class DimensionKeys {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private DimensionKeys() {
    }

    /**
     * Lowercase, German umlauts spelled out, accents stripped, only [a-z0-9] kept.
     */
    public static String normalizeKey(String value) {
        if (StringUtils.isEmpty(value)) {
            return "";
        }
        String normalized = value.toLowerCase()
                .replace("ä", "ae")
                .replace("ö", "oe")
                .replace("ü", "ue")
                .replace("ß", "ss");
        normalized = StringUtils.stripAccents(normalized);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Finite numbers as-is. Strings: the first comma becomes a dot, then the first decimal literal is parsed.
     *
     * @return null when nothing numeric can be read
     */
    public static Double coerceNumber(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof String) {
            String text = (String) value;
            if (StringUtils.isBlank(text)) {
                return null;
            }
            Matcher matcher = NUMBER.matcher(StringUtils.replaceOnce(text, ",", "."));
            if (matcher.find()) {
                try {
                    double parsed = Double.parseDouble(matcher.group());
                    return Double.isFinite(parsed) ? parsed : null;
                } catch (NumberFormatException ex) {
                    return null;
                }
            }
        }
        return null;
    }

    public static boolean containsAny(String value, String... keywords) {
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
