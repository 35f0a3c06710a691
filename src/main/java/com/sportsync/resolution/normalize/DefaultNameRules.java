package com.sportsync.resolution.normalize;

import com.sportsync.resolution.core.model.EntityKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rewrite rules for player and team names.
 * Rules run after accents are stripped and the text is lowercased.
 */
public final class DefaultNameRules {

    private DefaultNameRules() {
    }

    public static List<NormalizationRule> all() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(playerRules());
        rules.addAll(teamRules());
        rules.addAll(commonRules());
        return List.copyOf(rules);
    }

    public static List<NormalizationRule> playerRules() {
        return List.of(
                // Karl-Anthony Towns and Karl Anthony Towns should compare equal
                NormalizationRule.builder()
                        .name("player-hyphen")
                        .pattern("-")
                        .replacement(" ")
                        .kinds(EntityKind.PLAYER)
                        .priority(10)
                        .build(),

                // P.J. Tucker -> pj tucker
                NormalizationRule.builder()
                        .name("player-initials")
                        .pattern("\\b(\\w)\\.(?=\\w)")
                        .replacement("$1")
                        .kinds(EntityKind.PLAYER)
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> teamRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("team-leading-the")
                        .pattern("^the\\s+")
                        .replacement("")
                        .kinds(EntityKind.TEAM)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("team-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .kinds(EntityKind.TEAM)
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("team-saint")
                        .pattern("\\bst\\.?\\s")
                        .replacement("saint ")
                        .kinds(EntityKind.TEAM)
                        .priority(30)
                        .build()
        );
    }

    public static List<NormalizationRule> commonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\w\\s]")
                        .replacement("")
                        .priority(200)
                        .build(),

                NormalizationRule.builder()
                        .name("underscore")
                        .pattern("_")
                        .replacement(" ")
                        .priority(210)
                        .build(),

                NormalizationRule.builder()
                        .name("whitespace")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(300)
                        .build()
        );
    }
}
