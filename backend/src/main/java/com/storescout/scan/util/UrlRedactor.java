package com.storescout.scan.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks secrets in URLs and error messages before they reach the log.
 */
public final class UrlRedactor {
    private static final String MASK = "****";
    private static final Pattern URL_CREDENTIALS = Pattern.compile("(https?://[^:/@\\s]+):([^@\\s]+)@");
    private static final Pattern SECRET_PARAMS = Pattern.compile(
        "((?:api_key|apikey|password|token)\\s*[:=]\\s*)([^&\\s,}\"]+)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern AUTHORIZATION = Pattern.compile(
        "(Authorization\\s*[:=]\\s*)(Bearer\\s+|Basic\\s+)?([^\"&\\s,}]+)",
        Pattern.CASE_INSENSITIVE
    );

    private UrlRedactor() {
    }

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = URL_CREDENTIALS.matcher(text).replaceAll("$1:" + MASK + "@");
        out = SECRET_PARAMS.matcher(out).replaceAll("$1" + MASK);
        return AUTHORIZATION.matcher(out).replaceAll(match -> {
            String scheme = match.group(2) == null ? "" : match.group(2);
            return Matcher.quoteReplacement(match.group(1) + scheme + MASK);
        });
    }
}
