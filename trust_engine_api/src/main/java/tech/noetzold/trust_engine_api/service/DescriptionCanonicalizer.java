package tech.noetzold.trust_engine_api.service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Reduces a control description to a set of canonical terms: lower-cased,
 * punctuation stripped, domain phrases and synonyms folded, stopwords removed.
 */
public class DescriptionCanonicalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "of", "to", "in", "on", "at", "for", "by", "with",
            "from", "as", "it", "its", "their", "that", "this", "which", "where", "such",
            "must", "shall", "should", "will", "be", "is", "are", "been", "all", "any", "each",
            "ensure", "ensures", "organization", "organisation", "entity", "appropriate",
            "implement", "implemented", "maintain", "maintained", "using", "use", "used",
            "etc", "including", "within", "per");

    // applied on the whitespace-normalized text, longest phrases first
    private static final Map<String, String> PHRASES = new LinkedHashMap<>();

    private static final Map<String, String> SYNONYMS = new LinkedHashMap<>();

    static {
        PHRASES.put("personally identifiable information", "pii");
        PHRASES.put("multi factor authentication", "mfa");
        PHRASES.put("two factor authentication", "mfa");
        PHRASES.put("business continuity", "continuity");
        PHRASES.put("disaster recovery", "continuity");
        PHRASES.put("incident response", "incident");
        PHRASES.put("least privilege", "leastprivilege");
        PHRASES.put("access control", "access");
        PHRASES.put("personal data", "pii");
        PHRASES.put("audit trail", "log");
        PHRASES.put("at rest", "rest");
        PHRASES.put("in transit", "transit");
        PHRASES.put("multi factor", "mfa");
        PHRASES.put("2fa", "mfa");

        synonyms("encrypt", "encrypted", "encryption", "encrypting", "encrypts", "cryptographic", "cryptographically");
        synonyms("rest", "stored", "storage", "persisted");
        synonyms("data", "information", "records");
        synonyms("protect", "protected", "protection", "protecting", "safeguard", "safeguarded", "secure", "secured");
        synonyms("log", "logs", "logging", "logged");
        synonyms("monitor", "monitored", "monitoring", "monitors");
        synonyms("review", "reviewed", "reviews", "reviewing");
        synonyms("backup", "backups", "backed");
        synonyms("credential", "credentials", "password", "passwords", "passphrase");
        synonyms("vulnerability", "vulnerabilities", "weakness", "weaknesses");
        synonyms("patch", "patches", "patching", "patched");
        synonyms("personnel", "user", "users", "employee", "employees", "staff", "workforce");
        synonyms("restrict", "restricted", "restricts", "limit", "limited", "limits");
        synonyms("authenticate", "authentication", "authenticated");
        synonyms("manage", "managed", "management", "managing");
        synonyms("key", "keys");
        synonyms("test", "tested", "testing", "tests");
        synonyms("train", "training", "trained", "awareness");
    }

    private static void synonyms(String canonical, String... variants) {
        SYNONYMS.put(canonical, canonical);
        for (String v : variants) {
            SYNONYMS.put(v, canonical);
        }
    }

    public SortedSet<String> canonicalize(String description) {
        SortedSet<String> terms = new TreeSet<>();
        if (description == null || description.isBlank()) {
            return terms;
        }
        String text = " " + NON_WORD.matcher(description.toLowerCase(Locale.ROOT)).replaceAll(" ").trim() + " ";
        for (Map.Entry<String, String> phrase : PHRASES.entrySet()) {
            text = text.replace(" " + phrase.getKey() + " ", " " + phrase.getValue() + " ");
        }
        for (String token : text.trim().split(" ")) {
            if (token.isEmpty() || STOPWORDS.contains(token)) continue;
            terms.add(fold(token));
        }
        return terms;
    }

    /** Jaccard index of the two canonical term sets; 0 when either side is empty. */
    public double similarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        int common = 0;
        for (String t : a) {
            if (b.contains(t)) common++;
        }
        return (double) common / (a.size() + b.size() - common);
    }

    private String fold(String token) {
        String direct = SYNONYMS.get(token);
        if (direct != null) return direct;
        String stem = stem(token);
        return SYNONYMS.getOrDefault(stem, stem);
    }

    private String stem(String token) {
        if (token.length() > 4 && token.endsWith("ies")) {
            return token.substring(0, token.length() - 3) + "y";
        }
        if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }
}
