package com.loteca.riskengine.infra.batch;

import com.loteca.riskengine.domain.model.RiskEvaluation;
import com.loteca.riskengine.domain.model.RiskReport;
import com.loteca.riskengine.domain.service.PortfolioRiskService;
import com.loteca.riskengine.domain.service.RiskEngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "risk.batch", name = "enabled", havingValue = "true")
public class RiskBatchRunner implements ApplicationRunner {

    private final PortfolioRiskService portfolioRiskService;
    private final RiskEngineProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String roundId = properties.getBatch().getRoundId();
        if (roundId == null || roundId.isBlank()) {
            throw new IllegalStateException("risk.batch.round-id 설정이 필요합니다");
        }

        RiskEvaluation evaluation = portfolioRiskService.evaluateRound(roundId);
        RiskReport report = evaluation.report();
        log.info("[Batch] OK -> round={} | {}={} {}={} | warnings={}",
                roundId, report.getVarLabel(), String.format("%.4f", report.getValueAtRisk()),
                report.getEsLabel(), String.format("%.4f", report.getExpectedShortfall()),
                report.getWarnings().size());
    }
}
