package com.loteca.riskengine.domain.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public final class Ticket {

    @Getter
    private final List<Set<Outcome>> coverage;
    @Getter
    private final double stakeWeight;
    @Getter
    private final int fallbackCells;

    private final int[] masks;

    public Ticket(List<Set<Outcome>> coverage, double stakeWeight, int fallbackCells) {
        if (coverage == null || coverage.isEmpty()) {
            throw new IllegalArgumentException("티켓에 경기 커버리지가 없습니다");
        }
        List<Set<Outcome>> copy = new ArrayList<>(coverage.size());
        int[] m = new int[coverage.size()];
        for (int i = 0; i < coverage.size(); i++) {
            Set<Outcome> cell = coverage.get(i);
            if (cell == null || cell.isEmpty()) {
                throw new IllegalArgumentException("빈 커버리지 집합: match=" + (i + 1));
            }
            EnumSet<Outcome> set = EnumSet.copyOf(cell);
            copy.add(Collections.unmodifiableSet(set));
            for (Outcome o : set) {
                m[i] |= o.mask();
            }
        }
        this.coverage = Collections.unmodifiableList(copy);
        this.stakeWeight = stakeWeight;
        this.fallbackCells = fallbackCells;
        this.masks = m;
    }

    public int matchCount() {
        return masks.length;
    }

    public boolean covers(int match, int outcomeIndex) {
        return (masks[match] & (1 << outcomeIndex)) != 0;
    }

    public String picks(int match) {
        StringBuilder sb = new StringBuilder(3);
        for (Outcome o : coverage.get(match)) {
            sb.append(o.code());
        }
        return sb.toString();
    }

    public long combinations() {
        long n = 1;
        for (Set<Outcome> cell : coverage) {
            try {
                n = Math.multiplyExact(n, cell.size());
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
        return n;
    }

    public String describePicks() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < masks.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(picks(i));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Ticket[" + describePicks() + ", w=" + stakeWeight + "]";
    }
}
