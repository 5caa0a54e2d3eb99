package com.imagebuilder.metrics.report;

import com.imagebuilder.metrics.config.MetricsConfig;
import com.imagebuilder.metrics.error.MetricsException;
import com.imagebuilder.metrics.filter.BuildFilters;
import com.imagebuilder.metrics.filter.OrgDirectory;
import com.imagebuilder.metrics.footprint.FootprintCatalogLoader;
import com.imagebuilder.metrics.footprint.FootprintMapper;
import com.imagebuilder.metrics.ingest.DumpReader;
import com.imagebuilder.metrics.ingest.OrgDirectoryReader;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.util.BuildMetadata;
import com.imagebuilder.metrics.util.JsonSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Command-line entry point: {@code UsageReportJob <dump-file> [users-file]}.
 *
 * <p>Reads the dump, applies the configured filters and time slice, prints the text summary and
 * tabulations to stdout and writes the JSON report to {@code IBMETRICS_REPORT_PATH}.
 */
public class UsageReportJob {
    private static final Logger LOG = LoggerFactory.getLogger(UsageReportJob.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int status = execute(args, System.getenv());
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs the report against {@code env} settings and returns the process exit status. Every
     * failure is logged here; nothing escapes as an uncaught exception.
     */
    static int execute(String[] args, Map<String, String> env) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: UsageReportJob <dump-file> [users-file]");
            return EXIT_USAGE;
        }
        try {
            MetricsConfig config = MetricsConfig.fromMap(env);
            LOG.info("Starting usage report build={} config={}", BuildMetadata.current().identity(), config);

            OrgDirectory directory = args.length == 2
                    ? OrgDirectoryReader.read(Path.of(args[1]))
                    : OrgDirectory.empty();
            Dataset builds = new DumpReader(Path.of(args[0])).read();
            LOG.info("Imported {} records", builds.size());

            Dataset filtered = applyFilters(builds, directory, config);
            LOG.info("{} records after filtering", filtered.size());

            MetricsReport report = run(filtered, directory, config, LocalDateTime.now(), System.out);
            Path out = Path.of(config.reportPath);
            JsonSupport.PRETTY_MAPPER.writeValue(out.toFile(), report);
            LOG.info("Saved report {}", out);
            return EXIT_OK;
        } catch (MetricsException | IllegalStateException | IllegalArgumentException | IOException ex) {
            LOG.error("Usage report failed: {}", ex.getMessage(), ex);
            return EXIT_FAILED;
        }
    }

    static Dataset applyFilters(Dataset builds, OrgDirectory directory, MetricsConfig config) {
        Dataset out = BuildFilters.filterUsers(builds, directory, config.filterPatterns);
        Set<String> orgIds = new HashSet<>(config.filterOrgIds);
        orgIds.addAll(directory.matchingOrgIds(config.filterPatterns));
        out = BuildFilters.filterOrgs(out, orgIds);
        return BuildFilters.sliceTime(out, config.sliceStart, config.sliceEnd);
    }

    /**
     * Prints the text sections and returns the full report. {@code now} is the reference time for
     * the active-org classification.
     */
    static MetricsReport run(
            Dataset builds,
            OrgDirectory directory,
            MetricsConfig config,
            LocalDateTime now,
            PrintStream out) {
        FootprintMapper mapper = new FootprintMapper(FootprintCatalogLoader.loadDefault());
        MetricsReport report = MetricsReport.build(builds, config, mapper, directory, now);

        out.println(report.summary.toText());
        out.println();
        out.println(Tabulations.format("Most frequently selected packages", report.frequentPackages));
        out.println(Tabulations.format("Image types", report.imageTypes));
        out.println(Tabulations.format("Biggest orgs", report.frequentOrgs));
        return report;
    }
}
