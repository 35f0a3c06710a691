package com.sportsync.resolution.normalize;

import com.sportsync.resolution.core.model.EntityKind;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes free-text names for comparison: strips accents, lowercases,
 * removes a trailing generational suffix, drops punctuation and collapses whitespace.
 * Stateless and thread-safe once constructed.
 */
public class NameNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern TRAILING_SUFFIX =
            Pattern.compile("[\\s,]+(jr|sr|ii|iii|iv)\\.?\\s*$", Pattern.CASE_INSENSITIVE);

    private final List<NormalizationRule> rules;

    public NameNormalizer() {
        this(DefaultNameRules.all());
    }

    public NameNormalizer(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Normalizes a person's name and extracts its generational suffix.
     * "Tim Hardaway Jr." becomes {@code ("tim hardaway", JR)}.
     */
    public NormalizedName normalizePlayer(String raw) {
        if (raw == null) {
            return new NormalizedName("", GenerationalSuffix.NONE);
        }
        String text = foldCase(raw).trim();
        GenerationalSuffix suffix = GenerationalSuffix.NONE;
        Matcher m = TRAILING_SUFFIX.matcher(text);
        if (m.find()) {
            suffix = GenerationalSuffix.fromToken(m.group(1));
            text = text.substring(0, m.start());
        }
        return new NormalizedName(applyRules(text, EntityKind.PLAYER), suffix);
    }

    /**
     * Normalizes a team name ("St. Louis Blues", "The Los Angeles Lakers").
     */
    public String normalizeTeam(String raw) {
        if (raw == null) {
            return "";
        }
        return applyRules(foldCase(raw).trim(), EntityKind.TEAM);
    }

    private String applyRules(String text, EntityKind kind) {
        String result = text;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(kind)) {
                result = rule.apply(result);
            }
        }
        return result.trim();
    }

    private static String foldCase(String raw) {
        String decomposed = Normalizer.normalize(raw, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }
}
