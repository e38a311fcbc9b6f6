package it.aw.issueprioritizer.service;

import it.aw.issueprioritizer.model.FilterParams;
import it.aw.issueprioritizer.model.InvalidFilterParametersException;
import it.aw.issueprioritizer.model.IssueResultSet;
import it.aw.issueprioritizer.model.NormalizedKey;
import it.aw.issueprioritizer.model.ScoredIssue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankingEngineTest {

    private final RankingEngine engine = new RankingEngine();

    private static ScoredIssue issue(String text, double score, int occurrences, int firstSeen) {
        return new ScoredIssue(new NormalizedKey(text), text, score, occurrences, firstSeen, false);
    }

    @Test
    void sortsByScoreThenOccurrencesThenFirstSeen() {
        List<ScoredIssue> input = List.of(
                issue("c", 0.5, 1, 0),
                issue("a", 0.9, 1, 1),
                issue("b", 0.5, 3, 2),
                issue("d", 0.5, 1, 3),
                issue("e", 0.9, 2, 4));

        IssueResultSet ranked = engine.rankAndFilter(input, FilterParams.defaults());

        assertThat(ranked.issues()).extracting(ScoredIssue::displayText)
                .containsExactly("e", "a", "b", "c", "d");
    }

    @Test
    void adjacentPairsAreOrdered() {
        List<ScoredIssue> input = List.of(
                issue("a", 0.1, 4, 0), issue("b", 0.7, 1, 1), issue("c", 0.7, 5, 2),
                issue("d", 0.0, 1, 3), issue("e", 1.0, 1, 4), issue("f", 0.1, 4, 5));

        List<ScoredIssue> ranked = engine.rankAndFilter(input, FilterParams.defaults()).issues();

        for (int i = 0; i + 1 < ranked.size(); i++) {
            ScoredIssue cur = ranked.get(i);
            ScoredIssue next = ranked.get(i + 1);
            assertThat(cur.score()).isGreaterThanOrEqualTo(next.score());
            if (cur.score() == next.score()) {
                assertThat(cur.occurrences()).isGreaterThanOrEqualTo(next.occurrences());
            }
        }
    }

    @Test
    void keepsExactlyTheIssuesAboveBothThresholds() {
        List<ScoredIssue> input = List.of(
                issue("keep", 0.6, 2, 0),
                issue("low score", 0.59, 5, 1),
                issue("few occurrences", 0.9, 1, 2),
                issue("boundary", 0.6, 2, 3));

        IssueResultSet ranked = engine.rankAndFilter(input, 0.6, 2);

        assertThat(ranked.issues()).extracting(ScoredIssue::displayText)
                .containsExactly("keep", "boundary");
    }

    @Test
    void rejectsOutOfRangeParameters() {
        List<ScoredIssue> input = List.of(issue("a", 0.5, 1, 0));

        assertThatThrownBy(() -> engine.rankAndFilter(input, -0.1, 1))
                .isInstanceOf(InvalidFilterParametersException.class);
        assertThatThrownBy(() -> engine.rankAndFilter(input, 1.01, 1))
                .isInstanceOf(InvalidFilterParametersException.class);
        assertThatThrownBy(() -> engine.rankAndFilter(input, 0.5, 0))
                .isInstanceOf(InvalidFilterParametersException.class);
        assertThatThrownBy(() -> engine.rankAndFilter(input, Double.NaN, 1))
                .isInstanceOf(InvalidFilterParametersException.class);
    }

    @Test
    void emptyInputGivesEmptyResult() {
        assertThat(engine.rankAndFilter(List.of(), FilterParams.defaults()).isEmpty()).isTrue();
    }
}
