package io.aiorg.storage;

import java.util.Locale;

public final class Slugs {
    private static final int MAX_LENGTH = 50;

    private Slugs() {
    }

    public static String slugify(String title) {
        String slug = keepSlugChars(title.toLowerCase(Locale.ROOT).replace(' ', '-'));
        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH);
        }
        return trimTrailingHyphens(slug);
    }

    public static String nameSlug(String name) {
        return keepSlugChars(name.trim().replace(' ', '-'));
    }

    public static String normalizeName(String name) {
        return name.toLowerCase(Locale.ROOT).replace('-', ' ').replace('_', ' ');
    }

    private static String keepSlugChars(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        char prev = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '-') {
                continue;
            }
            if (c == '-' && prev == '-') {
                continue;
            }
            sb.append(c);
            prev = c;
        }
        return sb.toString();
    }

    private static String trimTrailingHyphens(String slug) {
        int end = slug.length();
        while (end > 0 && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(0, end);
    }
}
