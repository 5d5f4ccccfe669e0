package org.oldskooler.pgschema4j.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Names {
    // id, api or url surrounded by a word boundary or a non-word character.
    private static final Pattern PASCAL_ACRONYMS =
            Pattern.compile("(?:\\b|[^a-z0-9])(id|api|url)(?:\\b|[^a-z0-9])", Pattern.CASE_INSENSITIVE);

    private Names() {}

    /**
     * Converts a field name to a column name, e.g.
     * userId to user_id, ID to id, ProviderAPIKey to provider_api_key.
     */
    public static String snakeCase(String camel) {
        StringBuilder b = new StringBuilder(camel.length() + 4);
        boolean prevWasUpper = false;

        for (int i = 0; i < camel.length(); i++) {
            char c = camel.charAt(i);
            if (isUpper(c)) {
                if (b.length() > 0 && !prevWasUpper) {
                    b.append('_');
                } else {
                    // XxxAPIKey: the last upper letter of an acronym starts a new word.
                    int next = i + 1;
                    if (next > 1 && camel.length() - 1 > next && !isUpper(camel.charAt(next))) {
                        b.append('_');
                    }
                }
                b.append((char) (c - 'A' + 'a'));
                prevWasUpper = true;
            } else {
                b.append(c);
                prevWasUpper = false;
            }
        }
        return b.toString();
    }

    /**
     * Converts a column name to a type or field name, e.g.
     * user_id to UserID, provider_api_key to ProviderAPIKey.
     */
    public static String pascalCase(String snake) {
        Matcher m = PASCAL_ACRONYMS.matcher(snake);
        StringBuffer replaced = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(replaced, Matcher.quoteReplacement(m.group().toUpperCase()));
        }
        m.appendTail(replaced);
        String s = replaced.toString();

        StringBuilder b = new StringBuilder(s.length());
        boolean shouldUpper = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (i >= s.length() - 1) {
                b.append(c);
                break;
            }

            if (c == '_') {
                shouldUpper = true;
            } else if (isLower(c)) {
                if (b.length() == 0 || shouldUpper) {
                    b.append((char) (c - 'a' + 'A'));
                    shouldUpper = false;
                } else {
                    b.append(c);
                }
            } else {
                b.append(c);
                shouldUpper = false;
            }
        }
        return b.toString();
    }

    private static boolean isUpper(char c) {
        return 'A' <= c && c <= 'Z';
    }

    private static boolean isLower(char c) {
        return 'a' <= c && c <= 'z';
    }
}
