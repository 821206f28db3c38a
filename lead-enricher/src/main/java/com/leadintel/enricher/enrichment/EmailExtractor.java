package com.leadintel.enricher.enrichment;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds, cleans and validates email addresses in free text.
 * Handles the common "name at domain dot com" obfuscation.
 */
public final class EmailExtractor {

    private static final List<Pattern> EMAIL_PATTERNS = List.of(
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
            Pattern.compile("\\b[A-Za-z0-9._%+-]+\\s+at\\s+[A-Za-z0-9.-]+\\s+dot\\s+[A-Za-z]{2,}\\b",
                    Pattern.CASE_INSENSITIVE));

    private static final Pattern VALID = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final List<Pattern> EXCLUDED = List.of(
            Pattern.compile("@(example|test|placeholder|domain|company|yoursite)\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(image|photo|picture)@", Pattern.CASE_INSENSITIVE),
            // asset names like logo@2x.png
            Pattern.compile("\\.(png|jpe?g|gif|svg|webp)$", Pattern.CASE_INSENSITIVE));

    private static final int MAX_LENGTH = 254;

    private EmailExtractor() {
    }

    /** Distinct valid addresses in order of first appearance. */
    public static Set<String> extract(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return found;
        for (Pattern p : EMAIL_PATTERNS) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String email = clean(m.group());
                if (isValid(email)) found.add(email);
            }
        }
        return found;
    }

    public static String clean(String raw) {
        if (raw == null) return "";
        String email = raw.trim();
        if (email.regionMatches(true, 0, "mailto:", 0, 7)) email = email.substring(7);
        int query = email.indexOf('?');
        if (query >= 0) email = email.substring(0, query);
        email = email.replaceAll("(?i)\\s+at\\s+", "@").replaceAll("(?i)\\s+dot\\s+", ".");
        email = email.trim().toLowerCase(Locale.ROOT);
        return email.replaceAll("[.,;!?]+$", "");
    }

    public static boolean isValid(String email) {
        if (email == null || email.isEmpty() || email.length() > MAX_LENGTH) return false;
        if (!VALID.matcher(email).matches()) return false;
        for (Pattern excluded : EXCLUDED) {
            if (excluded.matcher(email).find()) return false;
        }
        return true;
    }
}
