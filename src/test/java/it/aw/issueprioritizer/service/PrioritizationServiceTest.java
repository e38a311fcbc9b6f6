package it.aw.issueprioritizer.service;

import it.aw.issueprioritizer.model.FilterParams;
import it.aw.issueprioritizer.model.IssueRecord;
import it.aw.issueprioritizer.model.IssueResultSet;
import it.aw.issueprioritizer.model.RunMetrics;
import it.aw.issueprioritizer.model.RunSummary;
import it.aw.issueprioritizer.model.ScoredIssue;
import it.aw.issueprioritizer.scoring.IssueScorer;
import it.aw.issueprioritizer.scoring.ModelUnavailableException;
import it.aw.issueprioritizer.scoring.ScoringModelHolder;
import it.aw.issueprioritizer.scoring.ScoringSettings;
import it.aw.issueprioritizer.store.ResultStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class PrioritizationServiceTest {

    private static final Map<String, Double> SCORES = Map.of("login fails", 0.9, "crash on save", 0.4);

    private ExecutorService executor;
    private ResultStore store;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        store = new ResultStore();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PrioritizationService service(Supplier<IssueScorer> scorerFactory, int parallelism) {
        return new PrioritizationService(
                new ScoringModelHolder(scorerFactory, "stub"),
                new IssueAggregator(new TextNormalizer(), executor, parallelism, Duration.ofSeconds(5)),
                new RankingEngine(),
                store,
                FilterParams.defaults(),
                ScoringSettings.defaults());
    }

    private static List<IssueRecord> records(String... texts) {
        List<IssueRecord> records = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            records.add(new IssueRecord(texts[i], i));
        }
        return records;
    }

    private static List<IssueRecord> loginScenario() {
        return records("Login fails", "login fails", "Crash on save", "Login Fails!!");
    }

    @Test
    void loginScenarioProducesRankedResultAndMetrics() {
        PrioritizationService service = service(() -> new StubScorer(SCORES), 2);

        RunSummary summary = service.run(loginScenario());

        IssueResultSet all = service.all();
        assertThat(all.issues()).extracting(ScoredIssue::displayText, ScoredIssue::score, ScoredIssue::occurrences)
                .containsExactly(
                        tuple("Login fails", 0.9, 3),
                        tuple("Crash on save", 0.4, 1));

        RunMetrics metrics = service.metrics();
        assertThat(metrics.uniqueCount()).isEqualTo(2);
        assertThat(metrics.totalRecords()).isEqualTo(4);
        assertThat(metrics.maxScore()).isEqualTo(0.9);
        assertThat(metrics.avgScore()).isCloseTo(0.65, within(1e-9));
        assertThat(summary.modelId()).isEqualTo("stub");
        assertThat(summary.runId()).isNotNull();
        assertThat(summary.failedScorings()).isZero();
    }

    @Test
    void minOccurrencesFilterKeepsOnlyRepeatedIssues() {
        PrioritizationService service = service(() -> new StubScorer(SCORES), 2);
        service.run(loginScenario());

        IssueResultSet filtered = service.query(new FilterParams(0.0, 2), null, null);

        assertThat(filtered.issues()).extracting(ScoredIssue::displayText).containsExactly("Login fails");
        assertThat(filtered.issues().get(0).occurrences()).isEqualTo(3);
    }

    @Test
    void emptyBatchPublishesEmptyResultWithZeroMetrics() {
        PrioritizationService service = service(() -> new StubScorer(SCORES), 2);

        service.run(List.of());

        assertThat(service.all().issues()).isEmpty();
        assertThat(service.metrics()).isEqualTo(new RunMetrics(0, 0, 0.0, 0.0));
    }

    @Test
    void emptyRecordsCountInTotalsButNotInTheView() {
        PrioritizationService service = service(() -> new StubScorer(SCORES), 2);

        RunSummary summary = service.run(records("Login fails", "", "   ", "login fails"));

        assertThat(service.all().issues()).hasSize(1);
        assertThat(service.all().totalOccurrences()).isEqualTo(2);
        assertThat(summary.totalRecords()).isEqualTo(4);
        assertThat(summary.emptyRecords()).isEqualTo(2);
        assertThat(service.metrics().totalRecords()).isEqualTo(4);
    }

    @Test
    void runningTwiceOnTheSameInputIsIdempotent() {
        PrioritizationService service = service(() -> new StubScorer(Map.of(), 0.5, Set.of()), 2);
        List<IssueRecord> input = records("b", "a", "c", "A", "b!", "d", "c", "C", "e");

        service.run(input);
        IssueResultSet first = service.all();
        service.run(input);
        IssueResultSet second = service.all();

        assertThat(second).isEqualTo(first);
        assertThat(first.issues()).extracting(ScoredIssue::displayText).containsExactly("c", "b", "a", "d", "e");
    }

    @Test
    void queryAppliesSearchAndLimitAfterRanking() {
        PrioritizationService service = service(() -> new StubScorer(
                Map.of("login fails", 0.9, "login slow", 0.6, "crash on save", 0.4)), 2);
        service.run(records("Login fails", "Crash on save", "Login slow"));

        IssueResultSet searched = service.query(FilterParams.defaults(), "LOGIN", null);
        IssueResultSet limited = service.query(FilterParams.defaults(), null, 1);

        assertThat(searched.issues()).extracting(ScoredIssue::displayText).containsExactly("Login fails", "Login slow");
        assertThat(limited.issues()).extracting(ScoredIssue::displayText).containsExactly("Login fails");
        assertThatThrownBy(() -> service.query(FilterParams.defaults(), null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void filteredMetricsDescribeTheFilteredView() {
        PrioritizationService service = service(() -> new StubScorer(
                Map.of("login fails", 0.9, "login slow", 0.6, "crash on save", 0.4)), 2);
        service.run(records("Login fails", "Crash on save", "Login slow", "login fails", ""));

        RunMetrics repeated = service.metrics(new FilterParams(0.0, 2), null);
        RunMetrics login = service.metrics(FilterParams.defaults(), "login");
        RunMetrics none = service.metrics(new FilterParams(0.95, 1), null);

        assertThat(repeated).isEqualTo(new RunMetrics(1, 5, 0.9, 0.9));
        assertThat(login.uniqueCount()).isEqualTo(2);
        assertThat(login.maxScore()).isEqualTo(0.9);
        assertThat(login.avgScore()).isCloseTo(0.75, within(1e-9));
        assertThat(none).isEqualTo(new RunMetrics(0, 5, 0.0, 0.0));
        assertThat(service.metrics().uniqueCount()).isEqualTo(3);
    }

    @Test
    void modelFailureLeavesThePreviousResultPublished() {
        service(() -> new StubScorer(SCORES), 2).run(loginScenario());
        IssueResultSet before = store.all();
        PrioritizationService broken = service(() -> {
            throw new IllegalStateException("pesi mancanti");
        }, 2);

        assertThatThrownBy(() -> broken.run(records("new issue")))
                .isInstanceOf(ModelUnavailableException.class);
        assertThat(store.all()).isSameAs(before);
        assertThat(broken.isRunning()).isFalse();
    }

    @Test
    void cancelledRunPublishesNothing() {
        AtomicReference<PrioritizationService> ref = new AtomicReference<>();
        StubScorer delegate = new StubScorer(SCORES);
        IssueScorer cancelling = new IssueScorer() {
            @Override
            public double score(String text) {
                ref.get().cancelActiveRun();
                return delegate.score(text);
            }

            @Override
            public String modelId() {
                return "stub";
            }
        };
        PrioritizationService service = service(() -> cancelling, 1);
        ref.set(service);

        assertThatThrownBy(() -> service.run(loginScenario())).isInstanceOf(RunCancelledException.class);
        assertThat(store.snapshot().summary().runId()).isNull();
        assertThat(service.cancelActiveRun()).isFalse();
    }

    @Test
    void modelIsLoadedOnceAcrossRuns() {
        int[] loads = {0};
        PrioritizationService service = service(() -> {
            loads[0]++;
            return new StubScorer(SCORES);
        }, 2);

        assertThat(service.modelInfo().loaded()).isFalse();
        service.run(loginScenario());
        service.run(loginScenario());

        assertThat(loads[0]).isEqualTo(1);
        assertThat(service.modelInfo().loaded()).isTrue();
    }
}
