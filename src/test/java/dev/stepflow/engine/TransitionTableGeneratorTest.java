package dev.stepflow.engine;

import dev.stepflow.model.Connection;
import dev.stepflow.model.ConnectionType;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepType;
import dev.stepflow.model.TransitionRow;
import org.assertj.core.groups.Tuple;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TransitionTableGeneratorTest {

    private static final Map<String, String> STATES = Map.of("Login", "LOGIN", "Dashboard", "DASH");
    private static final Map<String, String> RULES = Map.of("is valid?", "IS_VALID");

    private StepStore store;
    private StepClassifier classifier;
    private String login;
    private String check;
    private String dashboard;

    @BeforeEach
    void setUp() {
        var ids = new AtomicInteger();
        store = new StepStore(() -> "id-" + ids.incrementAndGet(), Clock.systemUTC(),
            StepStore.DEFAULT_DEBOUNCE_WINDOW);
        classifier = StepClassifier.withDefaults();
        login = store.addStep("Login", StepType.STATE);
        check = store.addStep("is valid?", StepType.RULE);
        dashboard = store.addStep("Dashboard", StepType.STATE);
        store.addConnection(login, check, ConnectionType.SUCCESS);
        store.addConnection(check, dashboard, ConnectionType.SUCCESS);
    }

    private List<TransitionRow> generate() {
        return TransitionTableGenerator.generateRows(
            store.steps(), store.connections(), classifier.classifyAll(store.steps()), STATES, RULES);
    }

    @Test
    void ruleChainCollapsesIntoOneRow() {
        List<TransitionRow> rows = generate();

        assertThat(rows.get(0)).isEqualTo(new TransitionRow("LOGIN", "DASH", "IS_VALID", 50, ""));
    }

    @Test
    void stateWithoutConnectionsGetsAnEmptyRow() {
        List<TransitionRow> rows = generate();

        assertThat(rows).containsExactly(
            new TransitionRow("LOGIN", "DASH", "IS_VALID", 50, ""),
            new TransitionRow("DASH", "", "", 50, ""));
    }

    @Test
    void removingTheRuleLeavesOnlyEmptyRows() {
        store.removeStep(check);

        List<TransitionRow> rows = generate();

        assertThat(store.connections()).isEmpty();
        assertThat(rows).containsExactly(
            new TransitionRow("LOGIN", "", "", 50, ""),
            new TransitionRow("DASH", "", "", 50, ""));
    }

    @Test
    void oneRowPerOutgoingConnectionInConnectionOrder() {
        String error = store.addStep("Error", StepType.STATE);
        store.addConnection(login, error, ConnectionType.FAILURE);
        store.addConnection(login, dashboard, ConnectionType.SUCCESS);

        List<TransitionRow> rows = generate();

        assertThat(rows).extracting(TransitionRow::sourceNode, TransitionRow::destinationNode, TransitionRow::ruleList)
            .containsExactly(
                Tuple.tuple("LOGIN", "DASH", "IS_VALID"),
                Tuple.tuple("LOGIN", "[UNKNOWN_STATE: Error]", ""),
                Tuple.tuple("LOGIN", "DASH", ""),
                Tuple.tuple("DASH", "", ""),
                Tuple.tuple("[UNKNOWN_STATE: Error]", "", ""));
    }

    @Test
    void rowCountMatchesOutgoingConnectionsOfEveryState() {
        String error = store.addStep("Error", StepType.STATE);
        String retry = store.addStep("Click retry");
        store.addConnection(login, error, ConnectionType.FAILURE);
        store.addConnection(error, retry, ConnectionType.SUCCESS);
        store.addConnection(retry, login, ConnectionType.SUCCESS);

        Map<String, StepType> types = classifier.classifyAll(store.steps());
        List<TransitionRow> rows = generate();

        int expected = 0;
        for (Step step : store.steps()) {
            if (types.get(step.id()) == StepType.STATE) {
                expected += Math.max(1, store.outgoing(step.id()).size());
            }
        }
        assertThat(types.get(retry)).isEqualTo(StepType.BEHAVIOR);
        assertThat(rows).hasSize(expected);
    }

    @Test
    void generationIsIdempotent() {
        String error = store.addStep("Error", StepType.STATE);
        store.addConnection(login, error, ConnectionType.FAILURE);

        List<TransitionRow> first = generate();
        List<TransitionRow> second = generate();

        assertThat(second).isEqualTo(first);
        assertThat(second.toString()).isEqualTo(first.toString());
    }

    @Test
    void qualifiedNamesAreUsedForLookups() {
        String checkout = store.addStep("Checkout", StepType.STATE);
        String pay = store.addChildStep(checkout, "Pay");
        store.addConnection(checkout, pay, ConnectionType.SUCCESS);
        var states = Map.of("Checkout", "CHECKOUT", "Checkout > Pay", "CHECKOUT_PAY");

        List<TransitionRow> rows = TransitionTableGenerator.generateRows(
            store.steps(), store.connections(), classifier.classifyAll(store.steps()), states, RULES);

        assertThat(rows).contains(TransitionRow.of("CHECKOUT", "CHECKOUT_PAY", ""));
    }

    @Test
    void emptyDiagramGivesEmptyTable() {
        List<TransitionRow> rows = TransitionTableGenerator.generateRows(
            List.of(), List.<Connection>of(), Map.of(), Map.of(), Map.of());

        assertThat(rows).isEmpty();
    }
}
