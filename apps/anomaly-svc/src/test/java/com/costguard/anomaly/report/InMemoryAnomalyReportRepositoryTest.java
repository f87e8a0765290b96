package com.costguard.anomaly.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.costguard.anomaly.model.DetectionRun;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryAnomalyReportRepositoryTest {

    private final InMemoryAnomalyReportRepository repository = new InMemoryAnomalyReportRepository();

    @Test
    void latestIsLastAppendedRun() {
        assertThat(repository.findLatest()).isEmpty();

        DetectionRun first = run("first");
        DetectionRun second = run("second");
        repository.append(first);
        repository.append(second);

        assertThat(repository.findLatest()).contains(second);
        assertThat(repository.findAll()).containsExactly(first, second);
    }

    private DetectionRun run(String runId) {
        return new DetectionRun(runId, Instant.parse("2024-03-31T06:00:00Z"), DetectionRun.Status.INSUFFICIENT_HISTORY,
                3, null, 0, List.of(), null, List.of());
    }
}
