package com.loteca.riskengine.infra.io;

import com.loteca.riskengine.domain.exception.PortfolioPlanSchemaException;
import com.loteca.riskengine.domain.model.Ticket;
import com.loteca.riskengine.domain.service.ticket.TicketParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
@RequiredArgsConstructor
public class PortfolioPlanLoader {

    public static final String PLAN_FILE = "portfolio_plan.csv";

    private static final Pattern PICK_COLUMN = Pattern.compile("^[Jj](\\d+)$");

    private final TicketParser ticketParser;

    public LoadResult<List<Ticket>> load(Path planFile, int matchCount) {
        CsvTable table = readTable(planFile);
        Map<Integer, Integer> pickColumns = validateSchema(table, planFile, matchCount);
        int weightColumn = table.columnIndex(TicketParser.WEIGHT_COLUMN);

        List<Ticket> tickets = new ArrayList<>(table.rowCount());
        int fallbackCells = 0;
        int badWeights = 0;
        for (int r = 0; r < table.rowCount(); r++) {
            Map<String, String> row = new HashMap<>();
            for (Map.Entry<Integer, Integer> e : pickColumns.entrySet()) {
                row.put(TicketParser.pickColumn(e.getKey()), table.cell(r, e.getValue()));
            }
            String weightCell = table.cell(r, weightColumn);
            row.put(TicketParser.WEIGHT_COLUMN, weightCell);
            if (!TicketParser.isWellFormedWeight(weightCell)) {
                badWeights++;
            }

            Ticket ticket = ticketParser.parseTicketRow(row, matchCount);
            fallbackCells += ticket.getFallbackCells();
            tickets.add(ticket);
        }

        List<String> warnings = new ArrayList<>();
        if (fallbackCells > 0) {
            String warning = "해석 불가 픽 " + fallbackCells + "개를 트리플(1X2)로 대체했습니다";
            log.warn("[Plan] {}: file={}", warning, planFile);
            warnings.add(warning);
        }
        if (badWeights > 0) {
            String warning = "잘못된 stake_weight " + badWeights + "건을 0으로 처리했습니다";
            log.warn("[Plan] {}: file={}", warning, planFile);
            warnings.add(warning);
        }
        if (weightColumn < 0) {
            log.info("[Plan] stake_weight 컬럼 없음, 균등 가중치 사용: file={}", planFile);
        }

        log.info("[Plan] 포트폴리오 로드: file={}, tickets={}, matches={}", planFile, tickets.size(), matchCount);
        return new LoadResult<>(tickets, planFile.getFileName().toString(), warnings);
    }

    private Map<Integer, Integer> validateSchema(CsvTable table, Path planFile, int matchCount) {
        Map<Integer, Integer> pickColumns = new HashMap<>();
        for (int c = 0; c < table.header().size(); c++) {
            Matcher m = PICK_COLUMN.matcher(table.header().get(c));
            if (!m.matches()) continue;
            int index = Integer.parseInt(m.group(1));
            if (pickColumns.put(index, c) != null) {
                throw new PortfolioPlanSchemaException(
                        "중복된 픽 컬럼: J" + index + ", file=" + planFile);
            }
        }

        if (pickColumns.isEmpty()) {
            throw new PortfolioPlanSchemaException("픽 컬럼(J1..J" + matchCount + ")이 없습니다: file=" + planFile);
        }
        TreeSet<Integer> found = new TreeSet<>(pickColumns.keySet());
        if (found.first() != 1 || found.last() != matchCount || found.size() != matchCount) {
            throw new PortfolioPlanSchemaException(String.format(Locale.ROOT,
                    "픽 컬럼은 J1..J%d 이어야 합니다: found=%s, file=%s", matchCount, found, planFile));
        }
        if (table.rowCount() == 0) {
            throw new PortfolioPlanSchemaException("포트폴리오에 티켓 행이 없습니다: file=" + planFile);
        }
        return pickColumns;
    }

    private CsvTable readTable(Path planFile) {
        try {
            if (!Files.isRegularFile(planFile) || Files.size(planFile) == 0) {
                throw new PortfolioPlanSchemaException("portfolio_plan.csv 없음 또는 빈 파일: " + planFile);
            }
            return CsvTable.read(planFile);
        } catch (IOException e) {
            throw new PortfolioPlanSchemaException("포트폴리오 파일 읽기 실패: " + planFile, e);
        }
    }
}
