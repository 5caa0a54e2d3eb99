package com.imagebuilder.metrics.report;

import com.imagebuilder.metrics.activity.ActivityClassifier;
import com.imagebuilder.metrics.cohort.CohortTracker;
import com.imagebuilder.metrics.cohort.PeriodCohort;
import com.imagebuilder.metrics.config.MetricsConfig;
import com.imagebuilder.metrics.derived.RatioMetrics;
import com.imagebuilder.metrics.derived.Smoothing;
import com.imagebuilder.metrics.filter.OrgDirectory;
import com.imagebuilder.metrics.footprint.FootprintMapper;
import com.imagebuilder.metrics.model.CountSeries;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.model.RatioSeries;
import com.imagebuilder.metrics.util.BuildMetadata;
import com.imagebuilder.metrics.window.Attributes;
import com.imagebuilder.metrics.window.TailPolicy;
import com.imagebuilder.metrics.window.TimeBuckets;
import com.imagebuilder.metrics.window.WindowAggregator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * JSON-serializable bundle of every numeric series the report consumers render.
 */
public class MetricsReport {
    private static final Logger LOG = LoggerFactory.getLogger(MetricsReport.class);

    public String buildIdentity;
    public LocalDateTime generatedAt;
    public String footprintCatalogVersion;

    public UsageSummary summary;

    public Series monthlyUsers;
    public Series monthlyBuilds;
    public Series monthlyNewOrgs;
    public List<Cohort> monthlyCohorts;
    public List<Cohort> periodCohorts;

    public Series buildsOverTime;
    public Series usersOverTime;
    public Series usersSlidingWindow;
    public Ratios dauOverMau;

    public SortedSet<String> repeatOrgs;
    public SortedSet<String> activeOrgs;

    public List<RankedCount> imageTypes;
    public List<RankedCount> footprints;
    public Map<String, Long> singleFootprintOrgs;
    public List<RankedCount> frequentPackages;
    public List<RankedCount> frequentOrgs;

    public static class Series {
        public List<LocalDateTime> labels;
        public List<Long> counts;
        public double[] runningMean;
        public double[] trend;

        static Series of(CountSeries series) {
            Series out = new Series();
            out.labels = series.labels();
            out.counts = series.counts();
            double[] values = series.toArray();
            out.runningMean = Smoothing.runningMean(values);
            out.trend = Smoothing.gaussianTrend(values);
            return out;
        }
    }

    public static class Ratios {
        public List<LocalDateTime> labels;
        public List<Double> ratios;

        static Ratios of(RatioSeries series) {
            Ratios out = new Ratios();
            out.labels = series.labels();
            out.ratios = series.ratios();
            return out;
        }
    }

    public static class Cohort {
        public LocalDateTime start;
        public long allOrgs;
        public long newOrgs;
        public long returningOrgs;

        static List<Cohort> of(List<PeriodCohort> rows) {
            List<Cohort> out = new ArrayList<>(rows.size());
            for (PeriodCohort row : rows) {
                Cohort c = new Cohort();
                c.start = row.start();
                c.allOrgs = row.allOrgs();
                c.newOrgs = row.newOrgs();
                c.returningOrgs = row.returningOrgs();
                out.add(c);
            }
            return out;
        }
    }

    /**
     * Computes every section for an already filtered dataset. Over-time series are anchored at
     * the Monday on or before the first build and drop the partial tail period.
     */
    public static MetricsReport build(
            Dataset dataset,
            MetricsConfig config,
            FootprintMapper footprintMapper,
            OrgDirectory directory,
            LocalDateTime now) {
        MetricsReport report = new MetricsReport();
        report.buildIdentity = BuildMetadata.current().identity();
        report.generatedAt = now;
        report.footprintCatalogVersion = footprintMapper.catalog().version();

        report.summary = UsageSummary.of(dataset);

        report.monthlyUsers = Series.of(WindowAggregator.monthlyUsers(dataset));
        report.monthlyBuilds = Series.of(WindowAggregator.monthlyBuilds(dataset));
        report.monthlyNewOrgs = Series.of(CohortTracker.monthlyNewOrgs(dataset));
        report.monthlyCohorts = Cohort.of(CohortTracker.monthlyCohorts(dataset));
        report.periodCohorts = Cohort.of(CohortTracker.periodCohorts(dataset, config.overTimePeriod));

        LocalDateTime anchor = TimeBuckets.mondayOnOrBefore(dataset.minCreatedAt());
        LocalDateTime end = dataset.maxCreatedAt();
        report.buildsOverTime = Series.of(WindowAggregator.recordsPerPeriod(
                dataset, anchor, end, config.overTimePeriod, TailPolicy.DROP_PARTIAL));
        report.usersOverTime = Series.of(WindowAggregator.distinctPerPeriod(
                dataset, Attributes.ORG_ID, anchor, end, config.overTimePeriod, TailPolicy.DROP_PARTIAL));
        report.usersSlidingWindow = Series.of(
                WindowAggregator.distinctSliding(dataset, Attributes.ORG_ID, RatioMetrics.MAU_WIDTH_DAYS));
        try {
            report.dauOverMau = Ratios.of(RatioMetrics.dauOverMau(dataset));
        } catch (IllegalStateException ex) {
            LOG.warn("DAU/MAU omitted from report: {}", ex.getMessage());
        }

        report.repeatOrgs = ActivityClassifier.repeatOrgs(dataset, config.repeatMinBuilds, config.repeatPeriod);
        report.activeOrgs = ActivityClassifier.activeOrgs(
                dataset, config.activeMinDays, config.activeRecentDays, now);

        report.imageTypes = Tabulations.imageTypeCounts(dataset);
        report.footprints = Tabulations.imageTypeCounts(footprintMapper.apply(dataset));
        report.singleFootprintOrgs = footprintMapper.singleFootprintDistribution(dataset);
        report.frequentPackages = Tabulations.frequentPackages(dataset, config.topLimit);
        report.frequentOrgs = Tabulations.frequentOrgs(dataset, directory, config.topLimit);

        LOG.info("Built report: {} builds, {} orgs, {} repeat, {} active",
                report.summary.builds, report.summary.users, report.repeatOrgs.size(), report.activeOrgs.size());
        return report;
    }
}
