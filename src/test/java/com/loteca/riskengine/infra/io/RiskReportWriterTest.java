package com.loteca.riskengine.infra.io;

import com.loteca.riskengine.domain.model.RiskEvaluation;
import com.loteca.riskengine.domain.model.RiskReport;
import com.loteca.riskengine.domain.model.TicketHitSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RiskReportWriterTest {

    @TempDir
    Path dir;

    private final RiskReportWriter writer = new RiskReportWriter();

    @Test
    void writesReturnsRiskAndTicketFiles() throws IOException {
        RiskReport report = RiskReport.builder()
                .varLabel("VaR95")
                .esLabel("ES95")
                .valueAtRisk(-0.25)
                .expectedShortfall(0.0)
                .tickets(List.of(TicketHitSummary.builder()
                        .ticketIndex(1).picks("1 1X").weight(1.0).combinations(2)
                        .expectedHits(1.5).fullHitProbability(0.25).oneMissProbability(0.5).meanPayout(0.25)
                        .cost(1.5).expectedValue(-1.25).suggestedStake(0.0)
                        .build()))
                .build();
        Path roundDir = dir.resolve("2025-10");

        writer.write(roundDir, new RiskEvaluation(report, new double[]{1.0, 0.0, 0.0, 0.0}));

        assertThat(Files.readAllLines(roundDir.resolve(RiskReportWriter.RETURNS_FILE)))
                .containsExactly("return", "1.0", "0.0", "0.0", "0.0");
        assertThat(Files.readAllLines(roundDir.resolve(RiskReportWriter.RISK_FILE)))
                .containsExactly("metric,value", "VaR95,-0.25", "ES95,0.0");
        assertThat(Files.readAllLines(roundDir.resolve(RiskReportWriter.TICKETS_FILE)))
                .containsExactly(
                        "ticket,picks,weight,combinations,fallback_cells,expected_hits,p_full,p_one_miss,"
                                + "mean_payout,cost,ev,suggested_stake",
                        "1,1 1X,1.0,2,0,1.5,0.25,0.5,0.25,1.5,-1.25,0.0");

        try (Stream<Path> files = Files.list(roundDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    void failedWriteLeavesNoOutputOrTempFiles() throws IOException {
        Path roundDir = Files.createDirectories(dir.resolve("2025-11"));
        Files.writeString(roundDir.resolve(RiskReportWriter.RETURNS_FILE), "return\n9.0\n");
        Path blocked = Files.createDirectories(roundDir.resolve(RiskReportWriter.RISK_FILE));
        Files.writeString(blocked.resolve("keep.txt"), "x");
        RiskReport report = RiskReport.builder().varLabel("VaR95").esLabel("ES95").tickets(List.of()).build();

        assertThatThrownBy(() -> writer.write(roundDir, new RiskEvaluation(report, new double[]{1.0})))
                .isInstanceOf(UncheckedIOException.class);

        assertThat(roundDir.resolve(RiskReportWriter.RETURNS_FILE)).doesNotExist();
        assertThat(roundDir.resolve(RiskReportWriter.TICKETS_FILE)).doesNotExist();
        assertThat(blocked).isDirectory();
        try (Stream<Path> files = Files.list(roundDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    void discardRemovesPreviousOutputs() throws IOException {
        Path roundDir = Files.createDirectories(dir.resolve("2025-12"));
        Files.writeString(roundDir.resolve(RiskReportWriter.RETURNS_FILE), "return\n1.0\n");
        Files.writeString(roundDir.resolve(RiskReportWriter.RISK_FILE), "metric,value\n");
        Files.writeString(roundDir.resolve(PortfolioPlanLoader.PLAN_FILE), "J1\n1\n");

        writer.discard(roundDir);

        assertThat(roundDir.resolve(RiskReportWriter.RETURNS_FILE)).doesNotExist();
        assertThat(roundDir.resolve(RiskReportWriter.RISK_FILE)).doesNotExist();
        assertThat(roundDir.resolve(PortfolioPlanLoader.PLAN_FILE)).exists();
    }
}
