package dev.aurum.registry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * A registered golden repository.
 *
 * <p>Each record names an alias, where its content comes from ({@link SourceKind#GIT} remote URL or
 * {@link SourceKind#LOCAL} directory) and which optional indexes to build. The refresh scheduler
 * updates the refresh timestamp, status, last error and failure count after every cycle; the
 * failure count here mirrors the in-memory counter and is never read back for recovery decisions.
 *
 * <p>Maps to the {@code golden_repos} table managed by Flyway migrations.
 *
 * @see GoldenRepoRepository
 */
@Entity
@Table(name = "golden_repos")
public class GoldenRepo {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String alias;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_kind", nullable = false)
    private SourceKind sourceKind;

    @Column(nullable = false)
    private String upstream;

    @Column(name = "default_branch")
    private String defaultBranch;

    @Column(name = "last_refresh_at")
    private Instant lastRefreshAt;

    @Column(name = "enable_temporal", nullable = false)
    private boolean enableTemporal;

    @Column(name = "enable_scip", nullable = false)
    private boolean enableScip;

    @Column(name = "temporal_max_commits")
    private Integer temporalMaxCommits;

    @Column(name = "temporal_since_date")
    private String temporalSinceDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "refresh_status", nullable = false)
    private RefreshStatus refreshStatus = RefreshStatus.IDLE;

    @Column(name = "last_error")
    private String lastError;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected GoldenRepo() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a new record in {@link RefreshStatus#IDLE} state with no refresh yet.
     *
     * @param alias      unique alias readers resolve
     * @param sourceKind git remote or local directory
     * @param upstream   remote URL or absolute local path
     */
    public GoldenRepo(String alias, SourceKind sourceKind, String upstream) {
        this.alias = alias;
        this.sourceKind = sourceKind;
        this.upstream = upstream;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isGit() {
        return sourceKind == SourceKind.GIT;
    }

    public UUID getId() {
        return id;
    }

    public String getAlias() {
        return alias;
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public String getUpstream() {
        return upstream;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    public void setDefaultBranch(String defaultBranch) {
        this.defaultBranch = defaultBranch;
    }

    public Instant getLastRefreshAt() {
        return lastRefreshAt;
    }

    public void setLastRefreshAt(Instant lastRefreshAt) {
        this.lastRefreshAt = lastRefreshAt;
    }

    public boolean isEnableTemporal() {
        return enableTemporal;
    }

    public void setEnableTemporal(boolean enableTemporal) {
        this.enableTemporal = enableTemporal;
    }

    public boolean isEnableScip() {
        return enableScip;
    }

    public void setEnableScip(boolean enableScip) {
        this.enableScip = enableScip;
    }

    public Integer getTemporalMaxCommits() {
        return temporalMaxCommits;
    }

    public void setTemporalMaxCommits(Integer temporalMaxCommits) {
        this.temporalMaxCommits = temporalMaxCommits;
    }

    public String getTemporalSinceDate() {
        return temporalSinceDate;
    }

    public void setTemporalSinceDate(String temporalSinceDate) {
        this.temporalSinceDate = temporalSinceDate;
    }

    public RefreshStatus getRefreshStatus() {
        return refreshStatus;
    }

    public void setRefreshStatus(RefreshStatus refreshStatus) {
        this.refreshStatus = refreshStatus;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
