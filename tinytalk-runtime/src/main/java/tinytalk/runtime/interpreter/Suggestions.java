package tinytalk.runtime.interpreter;

import java.util.Collection;

/**
 * 基于编辑距离的 "Did you mean" 提示
 */
public final class Suggestions {

    private static final int MAX_DISTANCE = 2;

    private Suggestions() {}

    /**
     * 经典 Levenshtein 距离
     */
    public static int levenshtein(String a, String b) {
        if (a.length() < b.length()) {
            return levenshtein(b, a);
        }
        if (b.isEmpty()) {
            return a.length();
        }
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /**
     * 最接近的候选（不区分大小写，距离不超过 2），没有则返回 null
     */
    public static String closest(String name, Collection<String> candidates) {
        String best = null;
        int bestDistance = MAX_DISTANCE + 1;
        String lower = name.toLowerCase();
        for (String candidate : candidates) {
            if (candidate.equals(name)) continue;
            int d = levenshtein(lower, candidate.toLowerCase());
            if (d < bestDistance) {
                bestDistance = d;
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Undefined variable 'x'[. Did you mean 'y'?]
     */
    public static String undefinedVariable(String name, Collection<String> visible) {
        String message = "Undefined variable '" + name + "'";
        String hint = closest(name, visible);
        return hint != null ? message + ". Did you mean '" + hint + "'?" : message;
    }
}
