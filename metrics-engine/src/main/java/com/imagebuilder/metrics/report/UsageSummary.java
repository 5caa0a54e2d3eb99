package com.imagebuilder.metrics.report;

import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Headline counts for a dataset and their human-readable text form.
 */
public final class UsageSummary {
    public final LocalDateTime start;
    public final LocalDateTime end;
    public final long builds;
    public final long users;
    public final long buildsWithPackages;
    public final long buildsWithFilesystemCustomizations;
    public final long buildsWithCustomRepos;

    private UsageSummary(
            LocalDateTime start,
            LocalDateTime end,
            long builds,
            long users,
            long buildsWithPackages,
            long buildsWithFilesystemCustomizations,
            long buildsWithCustomRepos) {
        this.start = start;
        this.end = end;
        this.builds = builds;
        this.users = users;
        this.buildsWithPackages = buildsWithPackages;
        this.buildsWithFilesystemCustomizations = buildsWithFilesystemCustomizations;
        this.buildsWithCustomRepos = buildsWithCustomRepos;
    }

    public static UsageSummary of(Dataset dataset) {
        LocalDateTime start = dataset.minCreatedAt();
        LocalDateTime end = dataset.maxCreatedAt();
        long withPackages = 0L;
        long withFilesystem = 0L;
        long withRepos = 0L;
        for (BuildRecord record : dataset.records()) {
            if (!record.packages().isEmpty()) {
                withPackages++;
            }
            if (!record.filesystem().isEmpty()) {
                withFilesystem++;
            }
            if (!record.payloadRepositories().isEmpty()) {
                withRepos++;
            }
        }
        return new UsageSummary(start, end, dataset.size(), dataset.orgIds().size(),
                withPackages, withFilesystem, withRepos);
    }

    public String toText() {
        List<String> out = new ArrayList<>();
        out.add("Summary");
        out.add("=======\n");
        out.add("Period: " + start + " - " + end + "\n");
        out.add("- Total builds: " + builds);
        out.add("- Number of users: " + users);
        out.add("- Builds with packages: " + buildsWithPackages);
        out.add("- Builds with filesystem customizations: " + buildsWithFilesystemCustomizations);
        out.add("- Builds with custom repos: " + buildsWithCustomRepos);
        return String.join("\n", out);
    }
}
