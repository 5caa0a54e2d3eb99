package com.imagebuilder.metrics.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * One row of the build dataset.
 *
 * <p>{@code createdAt} may be null when the source timestamp was missing or unparseable; such
 * records stay in the dataset but never contribute to a window.
 */
public final class BuildRecord {
    private final String orgId;
    private final LocalDateTime createdAt;
    private final String jobId;
    private final String imageType;
    private final List<String> packages;
    private final List<String> filesystem;
    private final List<String> payloadRepositories;
    private final String accountNumber;

    public BuildRecord(
            String orgId,
            LocalDateTime createdAt,
            String jobId,
            String imageType,
            List<String> packages,
            List<String> filesystem,
            List<String> payloadRepositories,
            String accountNumber) {
        this.orgId = orgId;
        this.createdAt = createdAt;
        this.jobId = jobId;
        this.imageType = imageType;
        this.packages = packages == null ? List.of() : List.copyOf(packages);
        this.filesystem = filesystem == null ? List.of() : List.copyOf(filesystem);
        this.payloadRepositories = payloadRepositories == null ? List.of() : List.copyOf(payloadRepositories);
        this.accountNumber = accountNumber;
    }

    /**
     * Reduced record carrying only an organization and a timestamp, as produced by the cohort tracker.
     */
    public static BuildRecord orgAt(String orgId, LocalDateTime createdAt) {
        return new BuildRecord(orgId, createdAt, null, null, null, null, null, null);
    }

    public String orgId() {
        return orgId;
    }

    public LocalDateTime createdAt() {
        return createdAt;
    }

    public boolean hasTimestamp() {
        return createdAt != null;
    }

    public String jobId() {
        return jobId;
    }

    public String imageType() {
        return imageType;
    }

    public List<String> packages() {
        return packages;
    }

    public List<String> filesystem() {
        return filesystem;
    }

    public List<String> payloadRepositories() {
        return payloadRepositories;
    }

    public String accountNumber() {
        return accountNumber;
    }

    public BuildRecord withImageType(String newImageType) {
        if (Objects.equals(imageType, newImageType)) {
            return this;
        }
        return new BuildRecord(orgId, createdAt, jobId, newImageType, packages, filesystem, payloadRepositories,
                accountNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BuildRecord)) {
            return false;
        }
        BuildRecord that = (BuildRecord) o;
        return Objects.equals(orgId, that.orgId)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(jobId, that.jobId)
                && Objects.equals(imageType, that.imageType)
                && packages.equals(that.packages)
                && filesystem.equals(that.filesystem)
                && payloadRepositories.equals(that.payloadRepositories)
                && Objects.equals(accountNumber, that.accountNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orgId, createdAt, jobId, imageType, packages, filesystem, payloadRepositories,
                accountNumber);
    }

    @Override
    public String toString() {
        return "BuildRecord{orgId=" + orgId + ", createdAt=" + createdAt + ", jobId=" + jobId
                + ", imageType=" + imageType + "}";
    }
}
