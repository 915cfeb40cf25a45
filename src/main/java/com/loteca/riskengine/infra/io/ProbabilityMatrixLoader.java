package com.loteca.riskengine.infra.io;

import com.loteca.riskengine.domain.exception.InvalidProbabilityRowException;
import com.loteca.riskengine.domain.exception.ProbabilityMatrixLoadException;
import com.loteca.riskengine.domain.model.MatchProbability;
import com.loteca.riskengine.domain.model.ProbabilityMatrix;
import com.loteca.riskengine.domain.service.RiskEngineProperties;
import com.loteca.riskengine.domain.service.RiskEngineProperties.ProbabilitySource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class ProbabilityMatrixLoader {

    static final String MATCH_ID_COLUMN = "match_id";

    private final RiskEngineProperties properties;

    public LoadResult<ProbabilityMatrix> load(Path roundDir) {
        List<String> tried = new ArrayList<>();
        for (ProbabilitySource source : properties.getProbabilitySources()) {
            Path path = roundDir.resolve(source.getFile());
            tried.add(source.getFile());
            if (!isReadable(path)) continue;

            CsvTable table = readTable(path);
            int home = table.columnIndex(source.getHomeColumn());
            int draw = table.columnIndex(source.getDrawColumn());
            int away = table.columnIndex(source.getAwayColumn());
            if (home < 0 || draw < 0 || away < 0) {
                log.warn("[ProbLoader] 확률 컬럼 누락, 다음 후보로 진행: file={}, columns=[{}, {}, {}]",
                        path, source.getHomeColumn(), source.getDrawColumn(), source.getAwayColumn());
                continue;
            }
            return toMatrix(table, path, home, draw, away);
        }
        throw new ProbabilityMatrixLoadException(
                "사용 가능한 확률 파일이 없습니다: dir=" + roundDir + ", candidates=" + tried);
    }

    private LoadResult<ProbabilityMatrix> toMatrix(CsvTable table, Path path, int home, int draw, int away) {
        if (table.rowCount() == 0) {
            throw new ProbabilityMatrixLoadException("확률 파일에 경기 행이 없습니다: " + path);
        }

        int idColumn = table.columnIndex(MATCH_ID_COLUMN);
        List<MatchProbability> rows = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            String matchId = table.cell(r, idColumn);
            if (matchId == null) {
                matchId = String.valueOf(r + 1);
            }
            rows.add(MatchProbability.normalized(matchId,
                    parse(table, r, home, matchId),
                    parse(table, r, draw, matchId),
                    parse(table, r, away, matchId)));
        }

        List<String> warnings = new ArrayList<>();
        int expected = properties.getExpectedMatches();
        if (expected > 0) {
            if (rows.size() < expected) {
                throw new ProbabilityMatrixLoadException(
                        "경기 수 부족: expected=" + expected + ", actual=" + rows.size() + ", file=" + path);
            }
            if (rows.size() > expected) {
                String warning = "확률 파일의 초과 경기 " + (rows.size() - expected) + "건을 제외했습니다";
                log.warn("[ProbLoader] {}: file={}", warning, path);
                warnings.add(warning);
                rows = rows.subList(0, expected);
            }
        }

        log.info("[ProbLoader] 확률 행렬 로드: file={}, matches={}", path, rows.size());
        return new LoadResult<>(ProbabilityMatrix.of(rows), path.getFileName().toString(), warnings);
    }

    private double parse(CsvTable table, int row, int column, String matchId) {
        String cell = table.cell(row, column);
        if (cell == null) {
            throw new InvalidProbabilityRowException(matchId, "확률 값 누락: column=" + table.header().get(column));
        }
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new InvalidProbabilityRowException(matchId, "숫자가 아닌 확률 값: " + cell);
        }
    }

    private CsvTable readTable(Path path) {
        try {
            return CsvTable.read(path);
        } catch (IOException e) {
            throw new ProbabilityMatrixLoadException("확률 파일 읽기 실패: " + path, e);
        }
    }

    private boolean isReadable(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            log.warn("[ProbLoader] 파일 크기 확인 실패: file={}", path, e);
            return false;
        }
    }
}
