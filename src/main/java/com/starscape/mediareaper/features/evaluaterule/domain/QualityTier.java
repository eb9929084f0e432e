package com.starscape.mediareaper.features.evaluaterule.domain;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Orders quality labels such as "1080p", "HD-720p" or "Ultra-HD". Unknown labels rank 0.
 */
public final class QualityTier {
    
    public static final int UNKNOWN = 0;
    
    // Insertion order matters for the substring fallback.
    private static final Map<String, Integer> TIERS = new LinkedHashMap<>();
    
    static {
        TIERS.put("4k", 5);
        TIERS.put("2160p", 5);
        TIERS.put("ultra-hd", 5);
        TIERS.put("uhd", 5);
        TIERS.put("1080p", 4);
        TIERS.put("hd-1080p", 4);
        TIERS.put("full-hd", 4);
        TIERS.put("720p", 3);
        TIERS.put("hd-720p", 3);
        TIERS.put("hd", 3);
        TIERS.put("480p", 2);
        TIERS.put("sd", 1);
        TIERS.put("dvd", 1);
    }
    
    private QualityTier() {
    }
    
    public static int of(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        Integer exact = TIERS.get(normalized);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, Integer> entry : TIERS.entrySet()) {
            if (normalized.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return UNKNOWN;
    }
    
    public static boolean isKnown(String label) {
        return of(label) != UNKNOWN;
    }
}
