package com.deferq;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "deferq_jobs")
public class Job implements Lockable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private JsonNode args;

    @Column(name = "perform_at", nullable = false)
    private OffsetDateTime performAt;

    @Column(nullable = false)
    private String frequency = "";

    @Column(nullable = false)
    private String queue = "default";

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "number_attempts", nullable = false)
    private long numberAttempts = 0;

    @Column(name = "last_error", nullable = false, columnDefinition = "text")
    private String lastError = "";

    @Column(name = "failed_at")
    private OffsetDateTime failedAt;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public Job() {
    }

    public Job(String name, JobArguments arguments, OffsetDateTime performAt, String queue, String frequency) {
        this.name = name;
        this.args = arguments.toJson();
        this.performAt = performAt;
        this.queue = queue;
        this.frequency = frequency == null ? "" : frequency;
    }

    @Override
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public JsonNode getArgs() {
        return args;
    }

    public void setArgs(JsonNode args) {
        this.args = args;
    }

    @Transient
    public JobArguments getArguments() {
        return JobArguments.fromJson(args);
    }

    public void setArguments(JobArguments arguments) {
        this.args = arguments.toJson();
    }

    public OffsetDateTime getPerformAt() {
        return performAt;
    }

    public void setPerformAt(OffsetDateTime performAt) {
        this.performAt = performAt;
    }

    public String getFrequency() {
        return frequency;
    }

    public void setFrequency(String frequency) {
        this.frequency = frequency == null ? "" : frequency;
    }

    @Transient
    public boolean isRecurring() {
        return frequency != null && !frequency.isBlank();
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    @Override
    public OffsetDateTime getLockedAt() {
        return lockedAt;
    }

    @Override
    public void setLockedAt(OffsetDateTime lockedAt) {
        this.lockedAt = lockedAt;
    }

    public long getNumberAttempts() {
        return numberAttempts;
    }

    public void setNumberAttempts(long numberAttempts) {
        this.numberAttempts = numberAttempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError == null ? "" : lastError;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(OffsetDateTime failedAt) {
        this.failedAt = failedAt;
    }

    @Transient
    public boolean hasFailed() {
        return failedAt != null;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
