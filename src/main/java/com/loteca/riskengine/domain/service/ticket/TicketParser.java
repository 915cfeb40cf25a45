package com.loteca.riskengine.domain.service.ticket;

import com.loteca.riskengine.domain.model.Outcome;
import com.loteca.riskengine.domain.model.Ticket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
public class TicketParser {

    public static final String PICK_COLUMN_PREFIX = "J";
    public static final String WEIGHT_COLUMN = "stake_weight";
    static final double DEFAULT_WEIGHT = 1.0;

    public Ticket parseTicketRow(Map<String, String> row, int numMatches) {
        if (numMatches < 1) {
            throw new IllegalArgumentException("경기 수(numMatches)는 1 이상이어야 합니다");
        }
        List<String> cells = new ArrayList<>(numMatches);
        for (int j = 1; j <= numMatches; j++) {
            cells.add(row != null ? row.get(pickColumn(j)) : null);
        }
        String weightCell = row != null ? row.get(WEIGHT_COLUMN) : null;
        return parsePicks(cells, parseWeight(weightCell));
    }

    public Ticket parsePicks(List<String> picks, double stakeWeight) {
        if (picks == null || picks.isEmpty()) {
            throw new IllegalArgumentException("티켓 픽 목록이 비어 있습니다");
        }
        List<Set<Outcome>> coverage = new ArrayList<>(picks.size());
        int fallback = 0;
        for (String cell : picks) {
            Set<Outcome> set = parseCell(cell);
            if (set == null) {
                set = Outcome.fullCover();
                fallback++;
            }
            coverage.add(set);
        }
        if (fallback > 0) {
            log.debug("[Ticket] 해석 불가 셀 {}개를 트리플로 대체: picks={}", fallback, picks);
        }
        return new Ticket(coverage, stakeWeight, fallback);
    }

    public static String pickColumn(int match) {
        return PICK_COLUMN_PREFIX + match;
    }

    public static double parseWeight(String cell) {
        if (cell == null || cell.isBlank()) {
            return DEFAULT_WEIGHT;
        }
        try {
            double w = Double.parseDouble(cell.trim());
            return Double.isFinite(w) && w >= 0 ? w : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    public static boolean isWellFormedWeight(String cell) {
        if (cell == null || cell.isBlank()) {
            return true;
        }
        try {
            double w = Double.parseDouble(cell.trim());
            return Double.isFinite(w) && w >= 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private Set<Outcome> parseCell(String cell) {
        if (cell == null) return null;
        String normalized = cell.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) return null;

        EnumSet<Outcome> set = EnumSet.noneOf(Outcome.class);
        for (int i = 0; i < normalized.length(); i++) {
            Outcome o = Outcome.fromCode(normalized.charAt(i));
            if (o != null) set.add(o);
        }
        return set.isEmpty() ? null : set;
    }
}
