package com.loteca.riskengine.domain.service;

import com.loteca.riskengine.domain.exception.RiskEngineException;
import com.loteca.riskengine.domain.exception.TicketShapeMismatchException;
import com.loteca.riskengine.domain.model.Portfolio;
import com.loteca.riskengine.domain.model.ProbabilityMatrix;
import com.loteca.riskengine.domain.model.RiskEvaluation;
import com.loteca.riskengine.domain.model.RiskMeasure;
import com.loteca.riskengine.domain.model.RiskReport;
import com.loteca.riskengine.domain.model.SimulationBatch;
import com.loteca.riskengine.domain.model.Ticket;
import com.loteca.riskengine.domain.model.TicketHitSummary;
import com.loteca.riskengine.domain.service.payout.PayoutEngine;
import com.loteca.riskengine.domain.service.payout.PortfolioAggregator;
import com.loteca.riskengine.domain.service.risk.RiskMetrics;
import com.loteca.riskengine.domain.service.risk.TicketHitAnalyzer;
import com.loteca.riskengine.domain.service.simulation.OutcomeSimulator;
import com.loteca.riskengine.infra.io.LoadResult;
import com.loteca.riskengine.infra.io.PayTableParser;
import com.loteca.riskengine.infra.io.PortfolioPlanLoader;
import com.loteca.riskengine.infra.io.ProbabilityMatrixLoader;
import com.loteca.riskengine.infra.io.RiskReportWriter;
import com.loteca.riskengine.infra.monitor.RiskEvaluationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioRiskService {

    static final String ADHOC_ROUND = "ADHOC";
    private static final Pattern ROUND_ID = Pattern.compile("^[A-Za-z0-9_\\-]+(\\.[A-Za-z0-9_\\-]+)*$");

    private final RiskEngineProperties properties;
    private final OutcomeSimulator outcomeSimulator;
    private final PayoutEngine payoutEngine;
    private final PortfolioAggregator portfolioAggregator;
    private final RiskMetrics riskMetrics;
    private final TicketHitAnalyzer ticketHitAnalyzer;
    private final ProbabilityMatrixLoader probabilityMatrixLoader;
    private final PortfolioPlanLoader portfolioPlanLoader;
    private final PayTableParser payTableParser;
    private final RiskReportWriter riskReportWriter;
    private final RiskEvaluationMetrics metrics;

    private final Map<String, RiskReport> latestReports = new ConcurrentHashMap<>();

    public RiskEvaluation evaluate(EvaluationInput input) {
        try {
            return doEvaluate(input);
        } catch (RiskEngineException e) {
            metrics.recordFailure(e.getClass().getSimpleName());
            throw e;
        }
    }

    public RiskEvaluation evaluateRound(String roundId) {
        Path roundDir = resolveRoundDir(roundId);
        log.info("[Risk] 라운드 평가 시작: round={}, dir={}", roundId, roundDir);

        try {
            LoadResult<ProbabilityMatrix> matrix = probabilityMatrixLoader.load(roundDir);
            LoadResult<List<Ticket>> plan = portfolioPlanLoader.load(
                    roundDir.resolve(PortfolioPlanLoader.PLAN_FILE), matrix.value().matchCount());
            PayTableParser.Resolution payTable = payTableParser.parse(properties.getPayTableJson());

            List<String> warnings = new ArrayList<>(matrix.warnings());
            warnings.addAll(plan.warnings());
            if (payTable.fellBack()) warnings.add(payTable.warning());

            RiskEvaluation evaluation = doEvaluate(EvaluationInput.builder()
                    .roundId(roundId)
                    .probabilities(matrix.value())
                    .tickets(plan.value())
                    .payTable(payTable.payTable())
                    .payTableFallback(payTable.fellBack())
                    .warnings(warnings)
                    .build());

            riskReportWriter.write(roundDir, evaluation);
            return evaluation;
        } catch (RiskEngineException e) {
            metrics.recordFailure(e.getClass().getSimpleName());
            log.error("[Risk] 라운드 평가 실패, 결과 파일 미생성: round={}, error={}", roundId, e.getMessage());
            riskReportWriter.discard(roundDir);
            throw e;
        }
    }

    public Optional<RiskReport> getLatest(String roundId) {
        if (roundId == null) return Optional.empty();
        return Optional.ofNullable(latestReports.get(key(roundId)));
    }

    public void resetLatest() {
        latestReports.clear();
        log.info("[Risk] 최신 리포트 캐시 초기화");
    }

    private RiskEvaluation doEvaluate(EvaluationInput input) {
        ProbabilityMatrix matrix = input.getProbabilities();
        if (matrix == null) {
            throw new IllegalArgumentException("확률 행렬(probabilities)은 필수입니다");
        }
        if (input.getTickets() == null || input.getTickets().isEmpty()) {
            throw new IllegalArgumentException("평가할 티켓이 없습니다");
        }

        int simulations = input.getSimulations() != null ? input.getSimulations() : properties.getSimulations();
        double alpha = input.getAlpha() != null ? input.getAlpha() : properties.getAlpha();
        Long seed = input.getSeed() != null ? input.getSeed() : properties.getSeed();
        double costPerTicket = input.getCostPerTicket() != null
                ? input.getCostPerTicket() : properties.getCostPerTicket();
        double kellyFraction = input.getKellyFraction() != null
                ? input.getKellyFraction() : properties.getKellyFraction();
        String roundId = input.getRoundId() != null && !input.getRoundId().isBlank()
                ? input.getRoundId() : ADHOC_ROUND;

        long startNano = System.nanoTime();

        Portfolio portfolio = Portfolio.of(input.getTickets(), input.getPayTable());
        if (portfolio.getMatchCount() != matrix.matchCount()) {
            throw new TicketShapeMismatchException("ticket", matrix.matchCount(), portfolio.getMatchCount());
        }

        List<String> warnings = new ArrayList<>(input.getWarnings() != null ? input.getWarnings() : List.of());
        if (portfolio.isUniformFallback()) {
            String warning = "유효한 stake_weight 합이 0, 균등 가중치로 대체했습니다";
            log.warn("[Risk] {}: round={}, tickets={}", warning, roundId, portfolio.ticketCount());
            warnings.add(warning);
        }

        SimulationBatch batch = outcomeSimulator.simulate(matrix, simulations, seed);
        int[][] hits = payoutEngine.hitMatrix(batch, portfolio.getTickets());
        double[][] payouts = payoutEngine.payoutMatrix(hits, batch.matchCount(), portfolio.getPayTable());
        double[] returns = portfolioAggregator.aggregate(payouts, portfolio.weights());

        RiskMeasure measure = riskMetrics.varEs(returns, alpha);
        List<TicketHitSummary> ticketSummaries = ticketHitAnalyzer.analyze(
                hits, payouts, portfolio, costPerTicket, kellyFraction);

        long calcDurationMicros = (System.nanoTime() - startNano) / 1_000;

        RiskReport report = RiskReport.builder()
                .roundId(roundId)
                .alpha(alpha)
                .varLabel(measure.varLabel())
                .esLabel(measure.esLabel())
                .valueAtRisk(measure.valueAtRisk())
                .expectedShortfall(measure.expectedShortfall())
                .simulationCount(batch.simulationCount())
                .matchCount(batch.matchCount())
                .ticketCount(portfolio.ticketCount())
                .seed(batch.seed())
                .payTableKind(portfolio.getPayTable().kind())
                .costPerTicket(costPerTicket)
                .kellyFraction(kellyFraction)
                .returns(riskMetrics.distribution(returns))
                .tickets(ticketSummaries)
                .warnings(List.copyOf(warnings))
                .timestamp(System.currentTimeMillis())
                .calcDurationMicros(calcDurationMicros)
                .build();

        metrics.recordEvaluation(calcDurationMicros, batch.simulationCount(), portfolio.ticketCount());
        metrics.recordFallback(RiskEvaluationMetrics.FALLBACK_COVERAGE, portfolio.fallbackCells());
        metrics.recordFallback(RiskEvaluationMetrics.FALLBACK_WEIGHT, portfolio.isUniformFallback() ? 1 : 0);
        metrics.recordFallback(RiskEvaluationMetrics.FALLBACK_PAYTABLE, input.isPayTableFallback() ? 1 : 0);

        latestReports.put(key(roundId), report);

        log.info("[Risk] 평가 완료: round={}, sims={}, matches={}, tickets={}, table={}, {}={}, {}={}, seed={}, total={}μs",
                roundId, batch.simulationCount(), batch.matchCount(), portfolio.ticketCount(),
                portfolio.getPayTable().kind(), measure.varLabel(), measure.valueAtRisk(),
                measure.esLabel(), measure.expectedShortfall(), batch.seed(), calcDurationMicros);

        return new RiskEvaluation(report, returns);
    }

    private Path resolveRoundDir(String roundId) {
        if (roundId == null || !ROUND_ID.matcher(roundId).matches()) {
            throw new IllegalArgumentException("잘못된 라운드 식별자: " + roundId);
        }
        return Paths.get(properties.getDataDir()).resolve(roundId);
    }

    private String key(String roundId) {
        return roundId.toUpperCase(Locale.ROOT);
    }
}
