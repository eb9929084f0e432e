package com.starscape.mediareaper.features.evaluaterule.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QualityTierTest {
    
    @Test
    void ranksKnownLabels() {
        assertEquals(5, QualityTier.of("4K"));
        assertEquals(5, QualityTier.of("2160p"));
        assertEquals(4, QualityTier.of("HD-1080p"));
        assertEquals(3, QualityTier.of("720p"));
        assertEquals(2, QualityTier.of("480p"));
        assertEquals(1, QualityTier.of("DVD"));
    }
    
    @Test
    void fallsBackToSubstringMatch() {
        assertEquals(4, QualityTier.of("Bluray-1080p Remux"));
        assertEquals(5, QualityTier.of("WEBDL-2160p"));
    }
    
    @Test
    void unknownLabelsRankZero() {
        assertEquals(QualityTier.UNKNOWN, QualityTier.of(null));
        assertEquals(QualityTier.UNKNOWN, QualityTier.of("  "));
        assertEquals(QualityTier.UNKNOWN, QualityTier.of("potato"));
        assertFalse(QualityTier.isKnown("potato"));
        assertTrue(QualityTier.isKnown("sd"));
    }
}
