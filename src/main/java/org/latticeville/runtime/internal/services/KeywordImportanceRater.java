package org.latticeville.runtime.internal.services;

import java.util.List;
import java.util.Locale;

import org.latticeville.runtime.memory.MemoryKind;
import org.latticeville.runtime.memory.MemoryRecord;
import org.latticeville.runtime.spi.IImportanceRater;

import com.typesafe.config.Config;

/**
 * Rates a memory by its kind's baseline plus a bonus per distinct keyword it mentions.
 */
public class KeywordImportanceRater implements IImportanceRater {

    private static final List<String> DEFAULT_KEYWORDS =
            List.of("failed", "says", "broken", "fire", "party", "argument", "love", "empty");

    private final List<String> keywords;
    private final int bonus;

    public KeywordImportanceRater() {
        this(DEFAULT_KEYWORDS, 2);
    }

    /**
     * @param config Options with optional {@code keywords} and {@code bonus}.
     */
    public KeywordImportanceRater(Config config) {
        this(config.hasPath("keywords") ? config.getStringList("keywords") : DEFAULT_KEYWORDS,
                config.hasPath("bonus") ? config.getInt("bonus") : 2);
    }

    KeywordImportanceRater(List<String> keywords, int bonus) {
        this.keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        this.bonus = bonus;
    }

    @Override
    public int rate(String description, MemoryKind kind) {
        String text = description != null ? description.toLowerCase(Locale.ROOT) : "";
        int score = kind.fallbackImportance();
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                score += bonus;
            }
        }
        return MemoryRecord.clampImportance(score);
    }
}
