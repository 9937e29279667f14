package org.carball.router.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.router.model.cost.Backend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryRouterCLITest {

    @TempDir
    Path tempDir;

    private Path dataRoot;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws IOException {
        dataRoot = tempDir.resolve("events");
        for (int day = 1; day <= 3; day++) {
            Path file = dataRoot.resolve("event_date=2024-11-0" + day).resolve("part-0.parquet");
            Files.createDirectories(file.getParent());
            Files.write(file, new byte[64]);
        }
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    void shouldExplainQueryAsJson() throws IOException {
        // When
        int exitCode = run("explain", "SELECT count(*) FROM events WHERE event_date = '2024-11-02'",
                "-d", dataRoot.toString(), "-f", "json");

        // Then
        assertThat(exitCode).isZero();
        JsonNode report = new ObjectMapper().readTree(stdout());
        assertThat(report.get("selectedBackend").asText()).isEqualTo("DUCKDB");
        assertThat(report.get("pruning").get("partitionsScanned").asInt()).isEqualTo(1);
        assertThat(report.get("pruning").get("totalPartitions").asInt()).isEqualTo(3);
    }

    @Test
    void shouldExplainQueryFromFileAsMarkdown() throws IOException {
        // Given
        Path sql = tempDir.resolve("query.sql");
        Files.writeString(sql, "SELECT * FROM events WHERE event_date >= '2024-11-02'");

        // When
        int exitCode = run("explain-file", sql.toString(), "--data-path", dataRoot.toString(),
                "--backend", "spark");

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout())
                .contains("# Query Routing Report")
                .contains("(pinned by caller)")
                .contains("| Partitions Scanned | 2 / 3 |");
    }

    @Test
    void shouldListCatalog() {
        int exitCode = run("catalog", "-d", dataRoot.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout())
                .contains("3 partitions")
                .contains("event_date=2024-11-03");
    }

    @Test
    void shouldApplySettingOverrides() {
        // Given - a cheap cluster makes the distributed engine win
        int exitCode = run("explain", "SELECT count(*) FROM events", "-d", dataRoot.toString(), "-f", "json",
                "--router.spark-overhead", "0", "--router.duckdb-overhead", "1");

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"selectedBackend\" : \"SPARK\"");
    }

    @Test
    void shouldPrintUsageForHelp() {
        assertThat(run("--help")).isZero();
        assertThat(stdout()).contains("Usage:").contains("explain <sql>");
    }

    @Test
    void shouldFailWithoutArguments() {
        assertThat(run()).isEqualTo(1);
    }

    @Test
    void shouldRejectUnknownOption() {
        int exitCode = run("catalog", "--verbose");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Unknown option: --verbose");
    }

    @Test
    void shouldReportMissingDatasetAsRoutingError() {
        int exitCode = run("catalog", "-d", tempDir.resolve("nowhere").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(stderr()).contains("CATALOG_UNAVAILABLE");
    }

    @Test
    void shouldReportInvalidQueryAsRoutingError() {
        int exitCode = run("explain", "DROP TABLE events", "-d", dataRoot.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(stderr()).contains("INVALID_QUERY");
    }

    @Test
    void shouldParseOptions() {
        // When
        QueryRouterCLI.Options options = QueryRouterCLI.parseArgs(new String[]{
                "explain", "SELECT 1", "-b", "polars", "--profile", "laptop", "--router.cores", "2"});

        // Then
        assertThat(options.command).isEqualTo("explain");
        assertThat(options.argument).isEqualTo("SELECT 1");
        assertThat(options.pinnedBackend).isEqualTo(Backend.POLARS);
        assertThat(options.profile).isEqualTo("laptop");
        assertThat(options.overrides).containsExactly("--router.cores", "2");
    }

    @Test
    void shouldRequireArgumentForExplain() {
        assertThatThrownBy(() -> QueryRouterCLI.parseArgs(new String[]{"explain"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly one argument");
    }

    private int run(String... args) {
        return QueryRouterCLI.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
