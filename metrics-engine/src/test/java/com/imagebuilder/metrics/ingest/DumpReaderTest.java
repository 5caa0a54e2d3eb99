package com.imagebuilder.metrics.ingest;

import com.imagebuilder.metrics.filter.OrgDirectory;
import com.imagebuilder.metrics.model.BuildRecord;
import com.imagebuilder.metrics.model.Dataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DumpReaderTest {
    private static final String HEADER =
            " org_id | created_at | job_id | image_type | packages | filesystem | payload_repositories | account_number\n"
                    + "--------+------------+--------+------------+----------+------------+----------------------+---------------\n";

    @Test
    void readsRecordsFromDumpFile(@TempDir Path dir) throws Exception {
        Path dump = dir.resolve("builds.txt");
        Files.writeString(dump, HEADER
                + " o1 | 2023-01-15 10:00:00.123456 | j1 | aws | [\"vim\", \"git\"] | [] |  | 1001\n"
                + " o2 | 2023-01-16 11:30:00+00 | j2 | vhd |  | [{\"mountpoint\": \"/var\"}] | [{\"baseurl\": \"http://x\"}] | 1002\n"
                + "(2 rows)\n", StandardCharsets.UTF_8);

        Dataset dataset = new DumpReader(dump).read();

        assertEquals(2, dataset.size());
        BuildRecord first = dataset.records().get(0);
        assertEquals("o1", first.orgId());
        assertEquals(LocalDateTime.of(2023, 1, 15, 10, 0, 0, 123_456_000), first.createdAt());
        assertEquals("j1", first.jobId());
        assertEquals("aws", first.imageType());
        assertEquals(List.of("vim", "git"), first.packages());
        assertTrue(first.filesystem().isEmpty());
        assertTrue(first.payloadRepositories().isEmpty());
        assertEquals("1001", first.accountNumber());

        BuildRecord second = dataset.records().get(1);
        assertEquals(LocalDateTime.of(2023, 1, 16, 11, 30), second.createdAt());
        assertEquals(List.of("{\"mountpoint\":\"/var\"}"), second.filesystem());
        assertEquals(1, second.payloadRepositories().size());
    }

    @Test
    void unparseableTimestampsBecomeMissingInsteadOfFailing() throws Exception {
        DumpTable table = DumpTable.parse(new BufferedReader(new StringReader(HEADER
                + " o1 | not-a-date | j1 | aws | | | | 1\n"
                + " o2 | 2023-02-01T08:00:00 | j2 | aws | | | | 2\n"
                + "(2 rows)\n")), "inline");

        Dataset dataset = DumpReader.toDataset(table, "inline");

        assertNull(dataset.records().get(0).createdAt());
        assertEquals(1, dataset.timestamped().size());
        assertEquals(LocalDateTime.of(2023, 2, 1, 8, 0), dataset.minCreatedAt());
    }

    @Test
    void toleratesMissingOrMismatchedFooter() throws Exception {
        DumpTable noFooter = DumpTable.parse(new BufferedReader(new StringReader(HEADER
                + " o1 | 2023-01-01 00:00:00 | j1 | aws | | | | 1\n")), "inline");
        DumpTable mismatch = DumpTable.parse(new BufferedReader(new StringReader(HEADER
                + " o1 | 2023-01-01 00:00:00 | j1 | aws | | | | 1\n"
                + "(5 rows)\n")), "inline");

        assertEquals(1, noFooter.rows().size());
        assertEquals(-1, noFooter.declaredRows());
        assertEquals(1, mismatch.rows().size());
        assertEquals(5, mismatch.declaredRows());
    }

    @Test
    void rejectsRowsWithMoreCellsThanColumns() {
        assertThrows(IllegalStateException.class, () -> DumpTable.parse(new BufferedReader(new StringReader(HEADER
                + " o1 | 2023-01-01 00:00:00 | j1 | aws | | | | 1 | extra\n")), "inline"));
    }

    @Test
    void rejectsInvalidListCells() {
        assertThrows(IllegalStateException.class, () -> DumpReader.parseList("[\"vim\"", "packages"));
        assertThrows(IllegalStateException.class, () -> DumpReader.parseList("{\"a\": 1}", "packages"));
        assertTrue(DumpReader.parseList("null", "packages").isEmpty());
    }

    @Test
    void missingDumpFileIsReported(@TempDir Path dir) {
        assertThrows(IllegalStateException.class, () -> new DumpReader(dir.resolve("missing.txt")).read());
    }

    @Test
    void readsOrgDirectoryFromJsonRecords(@TempDir Path dir) throws Exception {
        Path users = dir.resolve("users.json");
        Files.writeString(users, "[\n"
                + "  {\"name\": \"Acme Corp\", \"accountNumber\": 1001, \"org_id\": \"o1\"},\n"
                + "  {\"name\": null, \"accountNumber\": \"1002\", \"org_id\": \"o2\"}\n"
                + "]\n", StandardCharsets.UTF_8);

        OrgDirectory directory = OrgDirectoryReader.read(users);

        assertEquals(2, directory.entries().size());
        assertEquals("Acme Corp", directory.nameFor("1001"));
        assertEquals("---", directory.nameFor("1002"));
        assertEquals("o1", directory.entries().get(0).orgId());
    }

    @Test
    void rejectsUsersFileThatIsNotAnArray(@TempDir Path dir) throws Exception {
        Path users = dir.resolve("users.json");
        Files.writeString(users, "{\"name\": \"Acme Corp\"}", StandardCharsets.UTF_8);

        assertThrows(IllegalStateException.class, () -> OrgDirectoryReader.read(users));
        assertThrows(IllegalStateException.class, () -> OrgDirectoryReader.read(dir.resolve("missing.json")));
    }
}
