package it.aw.issueprioritizer.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RunMetricsTest {

    private static ScoredIssue issue(double score, int occurrences) {
        return new ScoredIssue(new NormalizedKey("k" + score), "k", score, occurrences, 0, false);
    }

    @Test
    void computesMaxAndAverageOverUniqueIssues() {
        IssueResultSet resultSet = new IssueResultSet(List.of(issue(0.9, 3), issue(0.4, 1)));

        RunMetrics metrics = RunMetrics.of(resultSet, 4);

        assertThat(metrics.uniqueCount()).isEqualTo(2);
        assertThat(metrics.totalRecords()).isEqualTo(4);
        assertThat(metrics.maxScore()).isEqualTo(0.9);
        assertThat(metrics.avgScore()).isCloseTo(0.65, within(1e-9));
    }

    @Test
    void emptyResultHasZeroScoresButKeepsTheRecordCount() {
        RunMetrics metrics = RunMetrics.of(IssueResultSet.empty(), 3);

        assertThat(metrics).isEqualTo(new RunMetrics(0, 3, 0.0, 0.0));
    }

    @Test
    void priorityLevelFollowsTheThresholds() {
        assertThat(issue(0.8, 1).priorityLevel()).isEqualTo(PriorityLevel.HIGH);
        assertThat(issue(0.79, 1).priorityLevel()).isEqualTo(PriorityLevel.MEDIUM);
        assertThat(issue(0.5, 1).priorityLevel()).isEqualTo(PriorityLevel.MEDIUM);
        assertThat(issue(0.49, 1).priorityLevel()).isEqualTo(PriorityLevel.LOW);
    }

    @Test
    void scoredIssueRejectsImpossibleValues() {
        assertThatThrownBy(() -> issue(1.2, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> issue(0.5, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
