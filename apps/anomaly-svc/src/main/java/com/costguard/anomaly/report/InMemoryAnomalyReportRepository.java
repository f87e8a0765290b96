package com.costguard.anomaly.report;

import com.costguard.anomaly.model.DetectionRun;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryAnomalyReportRepository implements AnomalyReportRepository {

    private final List<DetectionRun> runs = new CopyOnWriteArrayList<>();

    @Override
    public void append(DetectionRun run) {
        runs.add(run);
    }

    @Override
    public Optional<DetectionRun> findLatest() {
        if (runs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(runs.get(runs.size() - 1));
    }

    public List<DetectionRun> findAll() {
        return List.copyOf(runs);
    }
}
