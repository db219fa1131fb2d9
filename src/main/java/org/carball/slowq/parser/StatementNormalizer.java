package org.carball.slowq.parser;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Reduces statements to a digest form so that executions differing only in literals group together.
 */
public class StatementNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern IN_LIST = Pattern.compile("\\bin\\s*\\(\\s*\\?(?:\\s*,\\s*\\?)*\\s*\\)");
    private static final Pattern VALUES_LIST = Pattern.compile(
            "\\bvalues\\s*(\\(\\s*\\?(?:\\s*,\\s*\\?)*\\s*\\))(?:\\s*,\\s*\\(\\s*\\?(?:\\s*,\\s*\\?)*\\s*\\))+");

    private StatementNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Normalizes a statement: comments dropped, literals replaced by '?', unquoted text lower-cased.
     */
    public static String normalize(String sql) {
        if (sql == null) {
            throw new IllegalArgumentException("Statement text is null");
        }

        StringBuilder out = new StringBuilder(sql.length());
        int length = sql.length();
        int i = 0;

        while (i < length) {
            char c = sql.charAt(i);
            char next = i + 1 < length ? sql.charAt(i + 1) : '\0';

            if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
                out.append(' ');
            } else if ((c == '-' && next == '-' && (i + 2 >= length || Character.isWhitespace(sql.charAt(i + 2))))
                    || c == '#') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? length : end;
            } else if (c == '\'' || c == '"') {
                i = skipString(sql, i, c);
                out.append('?');
            } else if (c == '`') {
                int end = sql.indexOf('`', i + 1);
                end = end < 0 ? length - 1 : end;
                out.append(sql, i, end + 1);
                i = end + 1;
            } else if (Character.isDigit(c) && !isIdentifierChar(out)) {
                i = skipNumber(sql, i);
                out.append('?');
            } else {
                out.append(Character.toLowerCase(c));
                i++;
            }
        }

        String normalized = WHITESPACE.matcher(out.toString()).replaceAll(" ").trim();
        normalized = IN_LIST.matcher(normalized).replaceAll("in (...)");
        normalized = VALUES_LIST.matcher(normalized).replaceAll("values $1, ...");
        if (normalized.endsWith(";")) {
            normalized = normalized.substring(0, normalized.length() - 1).trim();
        }
        return normalized;
    }

    /**
     * SHA-256 of the normalized statement, as lower-case hex.
     */
    public static String digest(String sql) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(normalize(sql).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static int skipString(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return sql.length();
    }

    private static int skipNumber(String sql, int start) {
        int i = start;
        if (sql.startsWith("0x", i) || sql.startsWith("0X", i)) {
            i += 2;
        }
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '.') {
                i++;
            } else if ((c == '+' || c == '-') && (sql.charAt(i - 1) == 'e' || sql.charAt(i - 1) == 'E')) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static boolean isIdentifierChar(StringBuilder out) {
        if (out.isEmpty()) {
            return false;
        }
        char previous = out.charAt(out.length() - 1);
        return Character.isLetterOrDigit(previous) || previous == '_' || previous == '$';
    }
}
