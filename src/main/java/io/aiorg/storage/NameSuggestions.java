package io.aiorg.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

final class NameSuggestions {
    static final int MAX_SUGGESTIONS = 3;
    private static final double THRESHOLD = 0.4;
    private static final double CONTAINS_SCORE = 0.7;

    private NameSuggestions() {
    }

    static List<String> similar(String query, List<String> candidates) {
        String q = query.toLowerCase(Locale.ROOT);
        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            String c = candidate.toLowerCase(Locale.ROOT);
            double ratio = ratio(q, c);
            if (c.contains(q) || q.contains(c)) {
                ratio = Math.max(ratio, CONTAINS_SCORE);
            }
            if (ratio > THRESHOLD) {
                scored.add(new Scored(candidate, ratio));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        List<String> out = new ArrayList<>();
        for (int i = 0; i < scored.size() && i < MAX_SUGGESTIONS; i++) {
            out.add(scored.get(i).name());
        }
        return out;
    }

    static double ratio(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        int[][] lcs = new int[a.length() + 1][b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                lcs[i][j] = a.charAt(i - 1) == b.charAt(j - 1)
                        ? lcs[i - 1][j - 1] + 1
                        : Math.max(lcs[i - 1][j], lcs[i][j - 1]);
            }
        }
        return 2.0 * lcs[a.length()][b.length()] / (a.length() + b.length());
    }

    private record Scored(String name, double score) {
    }
}
