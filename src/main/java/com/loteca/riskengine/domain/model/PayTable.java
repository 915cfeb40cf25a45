package com.loteca.riskengine.domain.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public interface PayTable {

    double payout(int hits, int matchCount);

    String kind();

    static PayTable defaultScheme() {
        return DefaultBinaryScheme.INSTANCE;
    }

    static PayTable explicit(Map<Integer, Double> mapping) {
        return new ExplicitTable(mapping);
    }

    final class DefaultBinaryScheme implements PayTable {

        static final DefaultBinaryScheme INSTANCE = new DefaultBinaryScheme();

        private DefaultBinaryScheme() {
        }

        @Override
        public double payout(int hits, int matchCount) {
            return hits == matchCount ? 1.0 : 0.0;
        }

        @Override
        public String kind() {
            return "DEFAULT_BINARY";
        }

        @Override
        public String toString() {
            return "DefaultBinaryScheme";
        }
    }

    final class ExplicitTable implements PayTable {

        private final Map<Integer, Double> mapping;

        private ExplicitTable(Map<Integer, Double> mapping) {
            if (mapping == null || mapping.isEmpty()) {
                throw new IllegalArgumentException("지급표가 비어 있습니다");
            }
            this.mapping = Collections.unmodifiableMap(new TreeMap<>(mapping));
        }

        public Map<Integer, Double> mapping() {
            return mapping;
        }

        @Override
        public double payout(int hits, int matchCount) {
            Double value = mapping.get(hits);
            return value != null ? value : 0.0;
        }

        @Override
        public String kind() {
            return "EXPLICIT_TABLE";
        }

        @Override
        public String toString() {
            return "ExplicitTable" + mapping;
        }
    }
}
