package com.loteca.riskengine.api;

import com.loteca.riskengine.api.dto.RiskEvaluationRequest;
import com.loteca.riskengine.api.dto.RiskEvaluationRequest.MatchRow;
import com.loteca.riskengine.api.dto.RiskEvaluationRequest.TicketRow;
import com.loteca.riskengine.domain.model.MatchProbability;
import com.loteca.riskengine.domain.model.ProbabilityMatrix;
import com.loteca.riskengine.domain.model.RiskReport;
import com.loteca.riskengine.domain.model.Ticket;
import com.loteca.riskengine.domain.service.EvaluationInput;
import com.loteca.riskengine.domain.service.PortfolioRiskService;
import com.loteca.riskengine.domain.service.ticket.TicketParser;
import com.loteca.riskengine.infra.io.PayTableParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PortfolioRiskController {

    private final PortfolioRiskService portfolioRiskService;
    private final TicketParser ticketParser;
    private final PayTableParser payTableParser;

    @PostMapping("/evaluate")
    public ResponseEntity<Object> evaluate(@RequestBody RiskEvaluationRequest request) {
        if (request.getProbabilities() == null || request.getProbabilities().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "probabilities는 필수입니다"));
        }
        if (request.getTickets() == null || request.getTickets().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "tickets는 필수입니다"));
        }

        List<MatchProbability> rows = new ArrayList<>(request.getProbabilities().size());
        for (int i = 0; i < request.getProbabilities().size(); i++) {
            MatchRow row = request.getProbabilities().get(i);
            String matchId = row.getMatchId() != null && !row.getMatchId().isBlank()
                    ? row.getMatchId() : String.valueOf(i + 1);
            rows.add(MatchProbability.normalized(matchId, row.getPHome(), row.getPDraw(), row.getPAway()));
        }

        List<Ticket> tickets = new ArrayList<>(request.getTickets().size());
        for (TicketRow row : request.getTickets()) {
            double weight = row.getStakeWeight() != null ? row.getStakeWeight() : 1.0;
            tickets.add(ticketParser.parsePicks(row.getPicks(), weight));
        }

        PayTableParser.Resolution payTable = payTableParser.fromMap(request.getPayTable());

        log.info("[Risk API] 온디맨드 평가 요청: round={}, matches={}, tickets={}, sims={}",
                request.getRoundId(), rows.size(), tickets.size(), request.getSimulations());

        EvaluationInput.EvaluationInputBuilder input = EvaluationInput.builder()
                .roundId(request.getRoundId())
                .probabilities(ProbabilityMatrix.of(rows))
                .tickets(tickets)
                .payTable(payTable.payTable())
                .payTableFallback(payTable.fellBack())
                .simulations(request.getSimulations())
                .alpha(request.getAlpha())
                .seed(request.getSeed())
                .costPerTicket(request.getCostPerTicket())
                .kellyFraction(request.getKellyFraction());
        if (payTable.fellBack()) {
            input.warning(payTable.warning());
        }

        RiskReport report = portfolioRiskService.evaluate(input.build()).report();
        return ResponseEntity.ok(report);
    }

    @PostMapping("/rounds/{roundId}/evaluate")
    public ResponseEntity<Object> evaluateRound(@PathVariable String roundId) {
        log.info("[Risk API] 라운드 평가 요청: round={}", roundId);
        return ResponseEntity.ok(portfolioRiskService.evaluateRound(roundId).report());
    }

    @GetMapping("/latest")
    public ResponseEntity<Object> latest(@RequestParam String roundId) {
        return portfolioRiskService.getLatest(roundId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "success", false,
                        "roundId", roundId,
                        "message", "아직 평가 결과가 없습니다. /api/risk/evaluate 또는 /api/risk/rounds/{roundId}/evaluate로 먼저 실행하세요.")));
    }
}
