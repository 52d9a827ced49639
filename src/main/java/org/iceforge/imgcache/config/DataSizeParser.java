package org.iceforge.imgcache.config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-friendly byte sizes such as "96MB", "128KiB", "1.5GB" or "4*1024*1024".
 * Units are binary (1KB = 1024 bytes); tokens are multiplied together.
 */
public final class DataSizeParser {
    private static final Pattern TOKEN = Pattern.compile("\\d+\\.\\d*|\\d+|\\*|KIB|MIB|GIB|TIB|KB|MB|GB|TB|B");

    private DataSizeParser() {}

    public static long parseBytes(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("size expression is blank");
        }
        BigDecimal result = BigDecimal.ONE;
        boolean sawNumber = false;
        for (String token : tokenize(expr)) {
            switch (token) {
                case "*", "B" -> { }
                case "KB", "KIB" -> result = result.multiply(BigDecimal.valueOf(1024L));
                case "MB", "MIB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L));
                case "GB", "GIB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L * 1024L));
                case "TB", "TIB" -> result = result.multiply(BigDecimal.valueOf(1024L * 1024L * 1024L * 1024L));
                default -> {
                    result = result.multiply(new BigDecimal(token));
                    sawNumber = true;
                }
            }
        }
        if (!sawNumber) {
            throw new IllegalArgumentException("invalid size expression: " + expr);
        }
        BigDecimal bytes = result.setScale(0, RoundingMode.FLOOR);
        if (bytes.signum() <= 0 || bytes.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
            throw new IllegalArgumentException("size out of range: " + expr);
        }
        return bytes.longValue();
    }

    static List<String> tokenize(String expr) {
        String s = expr.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(s);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        if (!String.join("", tokens).equals(s)) {
            throw new IllegalArgumentException("invalid size expression: " + expr);
        }
        return tokens;
    }
}
