package com.loteca.riskengine.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loteca.riskengine.domain.exception.PortfolioPlanSchemaException;
import com.loteca.riskengine.domain.exception.TicketShapeMismatchException;
import com.loteca.riskengine.domain.model.MatchProbability;
import com.loteca.riskengine.domain.model.PayTable;
import com.loteca.riskengine.domain.model.ProbabilityMatrix;
import com.loteca.riskengine.domain.model.RiskEvaluation;
import com.loteca.riskengine.domain.model.RiskReport;
import com.loteca.riskengine.domain.model.SimulationBatch;
import com.loteca.riskengine.domain.model.Ticket;
import com.loteca.riskengine.domain.service.payout.PayoutEngine;
import com.loteca.riskengine.domain.service.payout.PortfolioAggregator;
import com.loteca.riskengine.domain.service.risk.RiskMetrics;
import com.loteca.riskengine.domain.service.risk.TicketHitAnalyzer;
import com.loteca.riskengine.domain.service.simulation.OutcomeSimulator;
import com.loteca.riskengine.domain.service.ticket.TicketParser;
import com.loteca.riskengine.infra.io.PayTableParser;
import com.loteca.riskengine.infra.io.PortfolioPlanLoader;
import com.loteca.riskengine.infra.io.ProbabilityMatrixLoader;
import com.loteca.riskengine.infra.io.RiskReportWriter;
import com.loteca.riskengine.infra.monitor.RiskEvaluationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortfolioRiskServiceTest {

    @TempDir
    Path dataDir;

    private RiskEngineProperties properties;
    private OutcomeSimulator simulator;
    private SimpleMeterRegistry meterRegistry;
    private PortfolioRiskService service;
    private final TicketParser parser = new TicketParser();

    private final ProbabilityMatrix twoMatches = ProbabilityMatrix.of(List.of(
            MatchProbability.normalized("1", 0.5, 0.3, 0.2),
            MatchProbability.normalized("2", 0.4, 0.3, 0.3)));

    @BeforeEach
    void setUp() {
        properties = new RiskEngineProperties();
        properties.setDataDir(dataDir.toString());
        properties.setExpectedMatches(0);
        properties.setSimulations(4);
        properties.setChunkSize(2);
        meterRegistry = new SimpleMeterRegistry();
        simulator = new OutcomeSimulator(properties);

        service = new PortfolioRiskService(
                properties,
                simulator,
                new PayoutEngine(),
                new PortfolioAggregator(),
                new RiskMetrics(),
                new TicketHitAnalyzer(),
                new ProbabilityMatrixLoader(properties),
                new PortfolioPlanLoader(parser),
                new PayTableParser(new ObjectMapper()),
                new RiskReportWriter(),
                new RiskEvaluationMetrics(meterRegistry));
    }

    @Test
    void smallRoundIsDeterministicForFixedSeed() {
        Ticket ticket = parser.parsePicks(List.of("1", "1X"), 1.0);
        EvaluationInput input = EvaluationInput.builder()
                .roundId("demo")
                .probabilities(twoMatches)
                .tickets(List.of(ticket))
                .simulations(4)
                .seed(2025L)
                .build();

        RiskEvaluation first = service.evaluate(input);
        RiskEvaluation second = service.evaluate(input);

        assertThat(first.returns()).containsExactly(second.returns());
        assertThat(first.report().getValueAtRisk()).isEqualTo(second.report().getValueAtRisk());
        assertThat(first.report().getExpectedShortfall()).isEqualTo(second.report().getExpectedShortfall());

        SimulationBatch batch = simulator.simulate(twoMatches, 4, 2025L);
        for (int s = 0; s < 4; s++) {
            boolean won = batch.outcome(s, 0) == 0 && batch.outcome(s, 1) != 2;
            assertThat(first.returns()[s]).isEqualTo(won ? 1.0 : 0.0);
        }
        assertThat(first.report().getSeed()).isEqualTo(2025L);
        assertThat(first.report().getExpectedShortfall()).isGreaterThanOrEqualTo(first.report().getValueAtRisk());
    }

    @Test
    void reportCarriesSummariesAndIsCachedAsLatest() {
        EvaluationInput input = EvaluationInput.builder()
                .roundId("Rodada-7")
                .probabilities(twoMatches)
                .tickets(List.of(
                        parser.parsePicks(List.of("1", "1X"), 2.0),
                        parser.parsePicks(List.of("1X2", "2"), 2.0)))
                .payTable(PayTable.explicit(Map.of(2, 10.0, 1, 1.0)))
                .simulations(2_000)
                .alpha(0.9)
                .seed(11L)
                .build();

        RiskReport report = service.evaluate(input).report();

        assertThat(report.getVarLabel()).isEqualTo("VaR90");
        assertThat(report.getTicketCount()).isEqualTo(2);
        assertThat(report.getMatchCount()).isEqualTo(2);
        assertThat(report.getSimulationCount()).isEqualTo(2_000);
        assertThat(report.getPayTableKind()).isEqualTo("EXPLICIT_TABLE");
        assertThat(report.getCostPerTicket()).isEqualTo(1.5);
        assertThat(report.getKellyFraction()).isEqualTo(0.25);
        assertThat(report.getTickets().get(0).getExpectedValue())
                .isEqualTo(report.getTickets().get(0).getMeanPayout() - 1.5);
        assertThat(report.getTickets()).hasSize(2);
        assertThat(report.getTickets().get(1).getFullHitProbability()).isBetween(0.25, 0.35);
        assertThat(report.getReturns().getMax()).isLessThanOrEqualTo(10.0);
        assertThat(service.getLatest("rodada-7")).containsSame(report);

        service.resetLatest();
        assertThat(service.getLatest("rodada-7")).isEmpty();
        assertThat(meterRegistry.find("risk.evaluation.duration").timer()).isNotNull();
    }

    @Test
    void zeroWeightsAreReportedAsWarning() {
        EvaluationInput input = EvaluationInput.builder()
                .probabilities(twoMatches)
                .tickets(List.of(parser.parsePicks(List.of("1", "1"), 0.0)))
                .build();

        RiskReport report = service.evaluate(input).report();

        assertThat(report.getRoundId()).isEqualTo("ADHOC");
        assertThat(report.getWarnings()).hasSize(1);
        assertThat(meterRegistry.find("risk.evaluation.fallback").tag("kind", "weight").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void ticketLongerThanRoundIsFatal() {
        EvaluationInput input = EvaluationInput.builder()
                .probabilities(twoMatches)
                .tickets(List.of(parser.parsePicks(List.of("1", "1", "1"), 1.0)))
                .build();

        assertThatThrownBy(() -> service.evaluate(input))
                .isInstanceOf(TicketShapeMismatchException.class);
        assertThat(meterRegistry.find("risk.evaluation.failure").counter()).isNotNull();
    }

    @Test
    void evaluatesRoundFromFilesAndWritesOutputs() throws IOException {
        Path roundDir = Files.createDirectories(dataDir.resolve("2025-41"));
        Files.writeString(roundDir.resolve("joined.csv"),
                "match_id,p_home,p_draw,p_away\n1,0.5,0.3,0.2\n2,0.4,0.3,0.3\n");
        Files.writeString(roundDir.resolve(PortfolioPlanLoader.PLAN_FILE),
                "J1,J2,stake_weight\n1,1X,1\n?,2,1\n");
        properties.setPayTableJson("{not json");
        properties.setSimulations(1_000);

        RiskEvaluation evaluation = service.evaluateRound("2025-41");

        assertThat(evaluation.returns()).hasSize(1_000);
        assertThat(evaluation.report().getPayTableKind()).isEqualTo("DEFAULT_BINARY");
        assertThat(evaluation.report().getWarnings()).hasSize(2);
        assertThat(Files.readAllLines(roundDir.resolve(RiskReportWriter.RETURNS_FILE))).hasSize(1_001);
        assertThat(Files.readAllLines(roundDir.resolve(RiskReportWriter.RISK_FILE)))
                .hasSize(3)
                .element(1).asString().startsWith("VaR95,");
    }

    @Test
    void failedRoundWritesNothing() throws IOException {
        Path roundDir = Files.createDirectories(dataDir.resolve("broken"));
        Files.writeString(roundDir.resolve("joined.csv"), "p_home,p_draw,p_away\n0.5,0.3,0.2\n");
        Files.writeString(roundDir.resolve(PortfolioPlanLoader.PLAN_FILE), "J1,J2\n1,1\n");

        assertThatThrownBy(() -> service.evaluateRound("broken"))
                .isInstanceOf(PortfolioPlanSchemaException.class);
        assertThat(roundDir.resolve(RiskReportWriter.RETURNS_FILE)).doesNotExist();
        assertThat(roundDir.resolve(RiskReportWriter.RISK_FILE)).doesNotExist();
    }

    @Test
    void failedRerunRemovesPreviousOutputs() throws IOException {
        Path roundDir = Files.createDirectories(dataDir.resolve("2025-42"));
        Files.writeString(roundDir.resolve("joined.csv"),
                "match_id,p_home,p_draw,p_away\n1,0.5,0.3,0.2\n2,0.4,0.3,0.3\n");
        Path plan = roundDir.resolve(PortfolioPlanLoader.PLAN_FILE);
        Files.writeString(plan, "J1,J2,stake_weight\n1,1X,1\n");
        service.evaluateRound("2025-42");
        assertThat(roundDir.resolve(RiskReportWriter.RISK_FILE)).exists();

        Files.writeString(plan, "J1,stake_weight\n1,1\n");

        assertThatThrownBy(() -> service.evaluateRound("2025-42"))
                .isInstanceOf(PortfolioPlanSchemaException.class);
        assertThat(roundDir.resolve(RiskReportWriter.RETURNS_FILE)).doesNotExist();
        assertThat(roundDir.resolve(RiskReportWriter.RISK_FILE)).doesNotExist();
        assertThat(roundDir.resolve(RiskReportWriter.TICKETS_FILE)).doesNotExist();
        assertThat(plan).exists();
    }

    @Test
    void rejectsPathLikeRoundIds() {
        assertThatThrownBy(() -> service.evaluateRound("../etc"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
