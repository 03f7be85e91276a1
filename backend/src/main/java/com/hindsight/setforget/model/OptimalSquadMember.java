package com.hindsight.setforget.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One member of a search's final squad, flattened to a row with its role flags.
 */
@Entity
@Table(name = "optimal_squad_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_optimal_squad_job_player",
                columnNames = {"job_id", "player_id"}),
        indexes = {
                @Index(name = "idx_optimal_squad_season", columnList = "season"),
                @Index(name = "idx_optimal_squad_job", columnList = "job_id")
        })
public class OptimalSquadMember {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private String jobId;

    @Column(name = "season", nullable = false)
    private String season;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Column(name = "player_name", nullable = false)
    private String playerName;

    @Enumerated(EnumType.STRING)
    @Column(name = "player_position", nullable = false)
    private Position position;

    @Column(name = "club", nullable = false)
    private String club;

    @Column(name = "start_cost", nullable = false)
    private Integer startCost;

    @Column(name = "in_lineup", nullable = false)
    private boolean inLineup;

    @Column(name = "on_bench", nullable = false)
    private boolean onBench;

    @Column(name = "is_captain", nullable = false)
    private boolean captain;

    @Column(name = "is_vice_captain", nullable = false)
    private boolean viceCaptain;

    // 0-based position in the lineup or on the bench (bench goalkeeper is 0)
    @Column(name = "slot", nullable = false)
    private Integer slot;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public OptimalSquadMember() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getSeason() { return season; }
    public void setSeason(String season) { this.season = season; }
    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }
    public String getPlayerName() { return playerName; }
    public void setPlayerName(String playerName) { this.playerName = playerName; }
    public Position getPosition() { return position; }
    public void setPosition(Position position) { this.position = position; }
    public String getClub() { return club; }
    public void setClub(String club) { this.club = club; }
    public Integer getStartCost() { return startCost; }
    public void setStartCost(Integer startCost) { this.startCost = startCost; }
    public boolean isInLineup() { return inLineup; }
    public void setInLineup(boolean inLineup) { this.inLineup = inLineup; }
    public boolean isOnBench() { return onBench; }
    public void setOnBench(boolean onBench) { this.onBench = onBench; }
    public boolean isCaptain() { return captain; }
    public void setCaptain(boolean captain) { this.captain = captain; }
    public boolean isViceCaptain() { return viceCaptain; }
    public void setViceCaptain(boolean viceCaptain) { this.viceCaptain = viceCaptain; }
    public Integer getSlot() { return slot; }
    public void setSlot(Integer slot) { this.slot = slot; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
