package com.starscape.mediareaper.features.media.domain;

import com.starscape.mediareaper.common.domain.Entity;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A file in the library as mirrored by the sync subsystem.
 * Rule evaluation and execution only read it, through {@link #toSnapshot()}.
 */
@jakarta.persistence.Entity
@Table(name = "media")
public class Media extends Entity<Long> {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false, unique = true)
    private String path;
    
    @Column(nullable = false)
    private String filename;
    
    @Column(nullable = false)
    private long size;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MediaType type;
    
    @Column(name = "added_at")
    private Instant addedAt;
    
    private String title;
    
    private Integer year;
    
    private Double rating;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> metadata = new HashMap<>();
    
    @Column(nullable = false)
    private boolean watched;
    
    @Column(name = "view_count", nullable = false)
    private int viewCount;
    
    @Column(name = "last_watched_at")
    private Instant lastWatchedAt;
    
    @Column(name = "watch_time_seconds", nullable = false)
    private long watchTimeSeconds;
    
    @Column(name = "duration_seconds")
    private Long durationSeconds;
    
    @Column(name = "quality_profile")
    private String qualityProfile;
    
    @Column(name = "quality_name")
    private String qualityName;
    
    private String resolution;
    
    private String codec;
    
    @Column(name = "series_status")
    private String seriesStatus;
    
    private String network;
    
    private Boolean monitored;
    
    @Column(name = "download_status")
    private String downloadStatus;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private List<String> tags = new ArrayList<>();
    
    @Column(name = "sonarr_id")
    private Integer sonarrId;
    
    @Column(name = "sonarr_episode_file_id")
    private Integer sonarrEpisodeFileId;
    
    @Column(name = "radarr_id")
    private Integer radarrId;
    
    @Column(name = "radarr_movie_file_id")
    private Integer radarrMovieFileId;
    
    @Column(name = "protected", nullable = false)
    private boolean protectedItem;
    
    protected Media() {
        // JPA constructor
    }
    
    public Media(String path, String filename, long size, MediaType type, Instant addedAt) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be blank");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be blank");
        }
        if (size < 0) {
            throw new IllegalArgumentException("Size cannot be negative");
        }
        this.path = path;
        this.filename = filename;
        this.size = size;
        this.type = type;
        this.addedAt = addedAt;
    }
    
    @Override
    public Long getId() {
        return id;
    }
    
    /**
     * Immutable copy of everything rules and integrations look at.
     */
    public MediaSnapshot toSnapshot() {
        return MediaSnapshot.builder()
                .id(id)
                .path(path)
                .filename(filename)
                .size(size)
                .type(type)
                .addedAt(addedAt)
                .title(title)
                .year(year)
                .rating(rating)
                .metadata(metadata == null ? Map.of() : new HashMap<>(metadata))
                .watched(watched)
                .viewCount(viewCount)
                .lastWatchedAt(lastWatchedAt)
                .watchTimeSeconds(watchTimeSeconds)
                .durationSeconds(durationSeconds)
                .qualityProfile(qualityProfile)
                .qualityName(qualityName)
                .resolution(resolution)
                .codec(codec)
                .seriesStatus(seriesStatus)
                .network(network)
                .monitored(monitored)
                .downloadStatus(downloadStatus)
                .tags(tags)
                .sonarrId(sonarrId)
                .sonarrEpisodeFileId(sonarrEpisodeFileId)
                .radarrId(radarrId)
                .radarrMovieFileId(radarrMovieFileId)
                .protectedItem(protectedItem)
                .build();
    }
    
    public String getPath() { return path; }
    public String getFilename() { return filename; }
    public long getSize() { return size; }
    public MediaType getType() { return type; }
    public Instant getAddedAt() { return addedAt; }
    public String getTitle() { return title; }
    public Double getRating() { return rating; }
    public Map<String, Object> getMetadata() { return metadata; }
    public boolean isProtectedItem() { return protectedItem; }
    public List<String> getTags() { return tags; }
    
    // Written by the sync subsystem; exposed for it and for fixtures.
    public void setTitle(String title) { this.title = title; }
    public void setYear(Integer year) { this.year = year; }
    public void setRating(Double rating) { this.rating = rating; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
    public void setWatched(boolean watched) { this.watched = watched; }
    public void setViewCount(int viewCount) { this.viewCount = viewCount; }
    public void setLastWatchedAt(Instant lastWatchedAt) { this.lastWatchedAt = lastWatchedAt; }
    public void setWatchTimeSeconds(long watchTimeSeconds) { this.watchTimeSeconds = watchTimeSeconds; }
    public void setDurationSeconds(Long durationSeconds) { this.durationSeconds = durationSeconds; }
    public void setQualityProfile(String qualityProfile) { this.qualityProfile = qualityProfile; }
    public void setQualityName(String qualityName) { this.qualityName = qualityName; }
    public void setResolution(String resolution) { this.resolution = resolution; }
    public void setCodec(String codec) { this.codec = codec; }
    public void setSeriesStatus(String seriesStatus) { this.seriesStatus = seriesStatus; }
    public void setNetwork(String network) { this.network = network; }
    public void setMonitored(Boolean monitored) { this.monitored = monitored; }
    public void setDownloadStatus(String downloadStatus) { this.downloadStatus = downloadStatus; }
    public void setTags(List<String> tags) { this.tags = tags; }
    public void setSonarrId(Integer sonarrId) { this.sonarrId = sonarrId; }
    public void setSonarrEpisodeFileId(Integer sonarrEpisodeFileId) { this.sonarrEpisodeFileId = sonarrEpisodeFileId; }
    public void setRadarrId(Integer radarrId) { this.radarrId = radarrId; }
    public void setRadarrMovieFileId(Integer radarrMovieFileId) { this.radarrMovieFileId = radarrMovieFileId; }
    public void setProtectedItem(boolean protectedItem) { this.protectedItem = protectedItem; }
}
