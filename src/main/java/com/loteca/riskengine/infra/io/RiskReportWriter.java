package com.loteca.riskengine.infra.io;

import com.loteca.riskengine.domain.model.RiskEvaluation;
import com.loteca.riskengine.domain.model.RiskReport;
import com.loteca.riskengine.domain.model.TicketHitSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class RiskReportWriter {

    public static final String RETURNS_FILE = "portfolio_returns_eval.csv";
    public static final String RISK_FILE = "portfolio_risk_eval.csv";
    public static final String TICKETS_FILE = "portfolio_tickets_eval.csv";

    private static final List<String> OUTPUT_FILES = List.of(RETURNS_FILE, RISK_FILE, TICKETS_FILE);

    public void write(Path roundDir, RiskEvaluation evaluation) {
        RiskReport report = evaluation.report();
        Map<String, Path> staged = new LinkedHashMap<>();
        try {
            Files.createDirectories(roundDir);

            staged.put(RETURNS_FILE, writeTemp(roundDir, RETURNS_FILE, w -> {
                w.write("return\n");
                for (double r : evaluation.returns()) {
                    w.write(Double.toString(r));
                    w.write('\n');
                }
            }));
            staged.put(RISK_FILE, writeTemp(roundDir, RISK_FILE, w -> {
                w.write("metric,value\n");
                w.write(report.getVarLabel() + "," + report.getValueAtRisk() + "\n");
                w.write(report.getEsLabel() + "," + report.getExpectedShortfall() + "\n");
            }));
            staged.put(TICKETS_FILE, writeTemp(roundDir, TICKETS_FILE, w -> {
                w.write("ticket,picks,weight,combinations,fallback_cells,expected_hits,p_full,p_one_miss,"
                        + "mean_payout,cost,ev,suggested_stake\n");
                List<TicketHitSummary> tickets = report.getTickets() != null ? report.getTickets() : List.of();
                for (TicketHitSummary t : tickets) {
                    w.write(t.getTicketIndex() + "," + t.getPicks() + "," + t.getWeight() + ","
                            + t.getCombinations() + "," + t.getFallbackCells() + ","
                            + t.getExpectedHits() + "," + t.getFullHitProbability() + ","
                            + t.getOneMissProbability() + "," + t.getMeanPayout() + ","
                            + t.getCost() + "," + t.getExpectedValue() + "," + t.getSuggestedStake() + "\n");
                }
            }));

            for (Map.Entry<String, Path> e : staged.entrySet()) {
                moveIntoPlace(e.getValue(), roundDir.resolve(e.getKey()));
            }
        } catch (IOException e) {
            rollback(roundDir, staged.values(), e);
            throw new UncheckedIOException("리스크 결과 저장 실패: dir=" + roundDir, e);
        }

        log.info("[Writer] 저장 완료: dir={}, {}={}, {}={}",
                roundDir, report.getVarLabel(), report.getValueAtRisk(),
                report.getEsLabel(), report.getExpectedShortfall());
    }

    public void discard(Path roundDir) {
        for (String name : OUTPUT_FILES) {
            Path target = roundDir.resolve(name);
            try {
                if (Files.isRegularFile(target) && Files.deleteIfExists(target)) {
                    log.info("[Writer] 이전 결과 삭제: file={}", target);
                }
            } catch (IOException e) {
                log.warn("[Writer] 이전 결과 삭제 실패: file={}", target, e);
            }
        }
    }

    private void rollback(Path roundDir, Iterable<Path> temps, IOException cause) {
        for (Path tmp : temps) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
        for (String name : OUTPUT_FILES) {
            Path target = roundDir.resolve(name);
            try {
                if (Files.isRegularFile(target)) {
                    Files.deleteIfExists(target);
                }
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
        log.error("[Writer] 저장 실패, 결과 파일 롤백: dir={}, error={}", roundDir, cause.getMessage());
    }

    private Path writeTemp(Path dir, String name, CsvBody body) throws IOException {
        Path tmp = Files.createTempFile(dir, name, ".tmp");
        try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            body.write(writer);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return tmp;
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    private interface CsvBody {
        void write(BufferedWriter writer) throws IOException;
    }
}
