package com.imagebuilder.metrics.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.imagebuilder.metrics.config.MetricsConfig;
import com.imagebuilder.metrics.filter.OrgDirectory;
import com.imagebuilder.metrics.filter.OrgDirectoryEntry;
import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;
import com.imagebuilder.metrics.util.JsonSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.imagebuilder.metrics.support.Builds.build;
import static com.imagebuilder.metrics.support.Builds.noon;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsageReportJobTest {
    private static final String DUMP =
            " org_id | created_at | job_id | image_type | packages | filesystem | payload_repositories | account_number\n"
                    + "--------+------------+--------+------------+----------+------------+----------------------+---------------\n"
                    + " o1 | 2023-01-15 10:00:00 | j1 | aws | [\"vim\"] |  |  | 1001\n"
                    + " o2 | 2023-01-16 11:30:00 | j2 | vhd |  |  |  | 1002\n"
                    + "(2 rows)\n";

    @Test
    void runPrintsSummaryAndBuildsSerializableReport() throws Exception {
        List<BuildRecord> records = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            LocalDateTime t = noon(2023, 1, 2).plusDays(i);
            records.add(build("daily", t, i % 2 == 0 ? "vhd" : "azure"));
            if (i % 10 == 0) {
                records.add(build("org-" + i, t.plusHours(1), "vsphere"));
            }
        }
        Dataset dataset = Dataset.of(records);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        MetricsReport report = UsageReportJob.run(dataset, OrgDirectory.empty(), MetricsConfig.defaults(),
                noon(2023, 3, 5), new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("- Total builds: 66"));
        assertTrue(printed.contains("## Image types"));
        assertEquals(Set.of("daily"), report.repeatOrgs);
        assertEquals(Set.of("daily"), report.activeOrgs);
        assertEquals(List.of(4L, 3L, 0L), report.monthlyNewOrgs.counts);
        assertNotNull(report.dauOverMau);
        assertEquals(1L, report.singleFootprintOrgs.get("azure"));
        assertEquals(6L, report.singleFootprintOrgs.get("private-cloud"));

        JsonNode json = JsonSupport.MAPPER.readTree(JsonSupport.toJson(report));
        assertTrue(json.path("monthlyUsers").path("labels").get(0).asText().startsWith("2023-01-01T00:00"));
        assertEquals(66, json.path("summary").path("builds").asInt());
        assertEquals("v1", json.path("footprintCatalogVersion").asText());
    }

    @Test
    void applyFiltersCombinesDirectoryPatternsIdsAndSlice() {
        Dataset dataset = Dataset.of(
                build("keep", noon(2023, 1, 2)),
                build("internal", noon(2023, 1, 3)),
                build("listed", noon(2023, 1, 4)),
                build("keep", noon(2023, 3, 1)));
        OrgDirectory directory = new OrgDirectory(List.of(
                new OrgDirectoryEntry("Internal QA", "acct-internal", "internal")));
        MetricsConfig config = MetricsConfig.fromMap(Map.of(
                "IBMETRICS_FILTER_PATTERNS", "internal",
                "IBMETRICS_FILTER_ORG_IDS", "listed",
                "IBMETRICS_END", "2023-02-01"));

        Dataset out = UsageReportJob.applyFilters(dataset, directory, config);

        assertEquals(1, out.size());
        assertEquals(Set.of("keep"), out.orgIds());
    }

    @Test
    void executeWritesReportFile(@TempDir Path dir) throws Exception {
        Path dump = dir.resolve("builds.txt");
        Files.writeString(dump, DUMP, StandardCharsets.UTF_8);
        Path report = dir.resolve("report.json");

        int status = UsageReportJob.execute(new String[] {dump.toString()},
                Map.of("IBMETRICS_REPORT_PATH", report.toString()));

        assertEquals(UsageReportJob.EXIT_OK, status);
        JsonNode json = JsonSupport.MAPPER.readTree(report.toFile());
        assertEquals(2, json.path("summary").path("builds").asInt());
    }

    @Test
    void executeReportsInvalidSliceDateAsFailure(@TempDir Path dir) throws Exception {
        Path dump = dir.resolve("builds.txt");
        Files.writeString(dump, DUMP, StandardCharsets.UTF_8);

        int status = UsageReportJob.execute(new String[] {dump.toString()},
                Map.of("IBMETRICS_START", "2023-13-45"));

        assertEquals(UsageReportJob.EXIT_FAILED, status);
    }

    @Test
    void executeReportsUnreadableInputsAsFailure(@TempDir Path dir) throws Exception {
        Path dump = dir.resolve("builds.txt");
        Files.writeString(dump, DUMP, StandardCharsets.UTF_8);
        Path users = dir.resolve("users.json");
        Files.writeString(users, "not json", StandardCharsets.UTF_8);

        assertEquals(UsageReportJob.EXIT_FAILED,
                UsageReportJob.execute(new String[] {dir.resolve("missing.txt").toString()}, Map.of()));
        assertEquals(UsageReportJob.EXIT_FAILED,
                UsageReportJob.execute(new String[] {dump.toString(), users.toString()}, Map.of()));
    }

    @Test
    void executeRejectsWrongArgumentCount() {
        assertEquals(UsageReportJob.EXIT_USAGE, UsageReportJob.execute(new String[0], Map.of()));
    }
}
