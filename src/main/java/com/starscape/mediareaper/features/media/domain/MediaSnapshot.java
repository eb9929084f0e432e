package com.starscape.mediareaper.features.media.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time copy of a media item.
 * Rules are evaluated against snapshots, and a pending deletion keeps the snapshot it was proposed with.
 */
public record MediaSnapshot(
    Long id,
    String path,
    String filename,
    long size,
    MediaType type,
    Instant addedAt,
    String title,
    Integer year,
    Double rating,
    Map<String, Object> metadata,
    boolean watched,
    int viewCount,
    Instant lastWatchedAt,
    long watchTimeSeconds,
    Long durationSeconds,
    String qualityProfile,
    String qualityName,
    String resolution,
    String codec,
    String seriesStatus,
    String network,
    Boolean monitored,
    String downloadStatus,
    List<String> tags,
    Integer sonarrId,
    Integer sonarrEpisodeFileId,
    Integer radarrId,
    Integer radarrMovieFileId,
    boolean protectedItem
) {
    
    public MediaSnapshot {
        metadata = metadata == null ? Map.of() : metadata;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
    
    /**
     * Title used for matching and display; falls back to the filename.
     */
    public String displayTitle() {
        return title != null && !title.isBlank() ? title : filename;
    }
    
    /**
     * Direct rating, else a numeric {@code metadata.rating}; empty when neither is present.
     */
    public Optional<Double> effectiveRating() {
        if (rating != null) {
            return Optional.of(rating);
        }
        Object nested = metadata.get("rating");
        if (nested instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (nested instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
    
    public WatchStatus watchStatus() {
        if (watched || viewCount > 0) {
            return WatchStatus.WATCHED;
        }
        if (watchTimeSeconds > 0) {
            return WatchStatus.IN_PROGRESS;
        }
        return WatchStatus.UNWATCHED;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static final class Builder {
        private Long id;
        private String path;
        private String filename;
        private long size;
        private MediaType type = MediaType.OTHER;
        private Instant addedAt;
        private String title;
        private Integer year;
        private Double rating;
        private Map<String, Object> metadata = Map.of();
        private boolean watched;
        private int viewCount;
        private Instant lastWatchedAt;
        private long watchTimeSeconds;
        private Long durationSeconds;
        private String qualityProfile;
        private String qualityName;
        private String resolution;
        private String codec;
        private String seriesStatus;
        private String network;
        private Boolean monitored;
        private String downloadStatus;
        private List<String> tags = List.of();
        private Integer sonarrId;
        private Integer sonarrEpisodeFileId;
        private Integer radarrId;
        private Integer radarrMovieFileId;
        private boolean protectedItem;
        
        private Builder() {
        }
        
        public Builder id(Long id) { this.id = id; return this; }
        public Builder path(String path) { this.path = path; return this; }
        public Builder filename(String filename) { this.filename = filename; return this; }
        public Builder size(long size) { this.size = size; return this; }
        public Builder type(MediaType type) { this.type = type; return this; }
        public Builder addedAt(Instant addedAt) { this.addedAt = addedAt; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder year(Integer year) { this.year = year; return this; }
        public Builder rating(Double rating) { this.rating = rating; return this; }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }
        public Builder watched(boolean watched) { this.watched = watched; return this; }
        public Builder viewCount(int viewCount) { this.viewCount = viewCount; return this; }
        public Builder lastWatchedAt(Instant lastWatchedAt) { this.lastWatchedAt = lastWatchedAt; return this; }
        public Builder watchTimeSeconds(long watchTimeSeconds) { this.watchTimeSeconds = watchTimeSeconds; return this; }
        public Builder durationSeconds(Long durationSeconds) { this.durationSeconds = durationSeconds; return this; }
        public Builder qualityProfile(String qualityProfile) { this.qualityProfile = qualityProfile; return this; }
        public Builder qualityName(String qualityName) { this.qualityName = qualityName; return this; }
        public Builder resolution(String resolution) { this.resolution = resolution; return this; }
        public Builder codec(String codec) { this.codec = codec; return this; }
        public Builder seriesStatus(String seriesStatus) { this.seriesStatus = seriesStatus; return this; }
        public Builder network(String network) { this.network = network; return this; }
        public Builder monitored(Boolean monitored) { this.monitored = monitored; return this; }
        public Builder downloadStatus(String downloadStatus) { this.downloadStatus = downloadStatus; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder sonarrId(Integer sonarrId) { this.sonarrId = sonarrId; return this; }
        public Builder sonarrEpisodeFileId(Integer sonarrEpisodeFileId) { this.sonarrEpisodeFileId = sonarrEpisodeFileId; return this; }
        public Builder radarrId(Integer radarrId) { this.radarrId = radarrId; return this; }
        public Builder radarrMovieFileId(Integer radarrMovieFileId) { this.radarrMovieFileId = radarrMovieFileId; return this; }
        public Builder protectedItem(boolean protectedItem) { this.protectedItem = protectedItem; return this; }
        
        public MediaSnapshot build() {
            return new MediaSnapshot(
                id, path, filename, size, type, addedAt, title, year, rating, metadata,
                watched, viewCount, lastWatchedAt, watchTimeSeconds, durationSeconds,
                qualityProfile, qualityName, resolution, codec,
                seriesStatus, network, monitored, downloadStatus, tags,
                sonarrId, sonarrEpisodeFileId, radarrId, radarrMovieFileId,
                protectedItem
            );
        }
    }
}
