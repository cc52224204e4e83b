package dev.stepflow.engine;

import dev.stepflow.model.Connection;
import dev.stepflow.model.ConnectionType;
import dev.stepflow.model.Step;
import dev.stepflow.model.StepPatch;
import dev.stepflow.model.StepType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StepStoreTest {

    private MutableClock clock;
    private StepStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var ids = new AtomicInteger();
        store = new StepStore(() -> "s" + ids.incrementAndGet(), clock, StepStore.DEFAULT_DEBOUNCE_WINDOW);
    }

    @Test
    void addStepAssignsFreshIdsAndDefaults() {
        String login = store.addStep("Login");
        String dashboard = store.addStep("Dashboard", StepType.STATE);

        assertThat(login).isEqualTo("s1");
        assertThat(dashboard).isEqualTo("s2");

        Step step = store.findStep(login).orElseThrow();
        assertThat(step.name()).isEqualTo("Login");
        assertThat(step.type()).isNull();
        assertThat(step.parentId()).isNull();
        assertThat(step.description()).isEmpty();
        assertThat(step.assumptions()).isEmpty();
        assertThat(store.findStep(dashboard).orElseThrow().type()).isEqualTo(StepType.STATE);
    }

    @Test
    void addStepDropsUnknownParent() {
        String id = store.addStep(StepPatch.rename("Orphan").withParent("missing"));

        assertThat(store.findStep(id).orElseThrow().parentId()).isNull();
    }

    @Test
    void updateStepMergesOnlyGivenFields() {
        String id = store.addStep(StepPatch.rename("Login").withDescription("Sign in page"));

        boolean updated = store.updateStep(id, StepPatch.rename("Sign In").withType(StepType.STATE));

        assertThat(updated).isTrue();
        Step step = store.findStep(id).orElseThrow();
        assertThat(step.name()).isEqualTo("Sign In");
        assertThat(step.description()).isEqualTo("Sign in page");
        assertThat(step.type()).isEqualTo(StepType.STATE);
    }

    @Test
    void emptyPatchChangesNothing() {
        String parent = store.addStep("Checkout");
        String id = store.addChildStep(parent, "Pay");
        Step before = store.findStep(id).orElseThrow();

        assertThat(store.updateStep(id, StepPatch.empty())).isTrue();
        assertThat(store.findStep(id)).contains(before);

        store.updateStep(id, StepPatch.retype(StepType.RULE));
        assertThat(store.findStep(id).orElseThrow().type()).isEqualTo(StepType.RULE);
        assertThat(store.findStep(id).orElseThrow().parentId()).isEqualTo(parent);
    }

    @Test
    void updateOfUnknownStepIsANoOp() {
        store.addStep("Login");

        assertThat(store.updateStep("nope", StepPatch.rename("x"))).isFalse();
        assertThat(store.steps()).extracting(Step::name).containsExactly("Login");
    }

    @Test
    void removeStepCascadesConnections() {
        String login = store.addStep("Login");
        String check = store.addStep("is valid?");
        String dashboard = store.addStep("Dashboard");
        store.addConnection(login, check, ConnectionType.SUCCESS);
        store.addConnection(check, dashboard, ConnectionType.SUCCESS);
        store.addConnection(login, dashboard, ConnectionType.FAILURE);

        assertThat(store.removeStep(check)).isTrue();

        assertThat(store.findStep(check)).isEmpty();
        assertThat(store.connections())
            .containsExactly(new Connection(login, dashboard, ConnectionType.FAILURE));
    }

    @Test
    void removeStepDetachesChildren() {
        String parent = store.addStep("Checkout");
        String child = store.addChildStep(parent, "Payment");

        store.removeStep(parent);

        assertThat(store.findStep(child).orElseThrow().parentId()).isNull();
        assertThat(store.qualifiedName(child)).isEqualTo("Payment");
    }

    @Test
    void removeOfUnknownStepIsANoOp() {
        store.addStep("Login");

        assertThat(store.removeStep("nope")).isFalse();
        assertThat(store.steps()).hasSize(1);
    }

    @Test
    void duplicateConnectionIsRejected() {
        String a = store.addStep("A");
        String b = store.addStep("B");

        assertThat(store.addConnection(a, b, ConnectionType.SUCCESS)).isTrue();
        clock.advance(Duration.ofSeconds(2));
        assertThat(store.addConnection(a, b, ConnectionType.SUCCESS)).isFalse();

        assertThat(store.connections()).hasSize(1);
    }

    @Test
    void sameEndpointsWithDifferentTypeAreDistinct() {
        String a = store.addStep("A");
        String b = store.addStep("B");

        assertThat(store.addConnection(a, b, ConnectionType.SUCCESS)).isTrue();
        assertThat(store.addConnection(a, b, ConnectionType.FAILURE)).isTrue();

        assertThat(store.connections()).hasSize(2);
    }

    @Test
    void repeatedRequestInsideDebounceWindowStoresOneConnection() {
        String login = store.addStep("Login");
        String dashboard = store.addStep("Dashboard");

        boolean first = store.addConnection(login, dashboard, ConnectionType.SUCCESS);
        clock.advance(Duration.ofMillis(120));
        boolean second = store.addConnection(login, dashboard, ConnectionType.SUCCESS);

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(store.connections()).containsExactly(new Connection(login, dashboard, ConnectionType.SUCCESS));
    }

    @Test
    void debounceAppliesOnlyToTheSameTriple() {
        String a = store.addStep("A");
        String b = store.addStep("B");
        String c = store.addStep("C");

        assertThat(store.addConnection(a, b, ConnectionType.SUCCESS)).isTrue();
        assertThat(store.addConnection(a, c, ConnectionType.SUCCESS)).isTrue();

        assertThat(store.connections()).hasSize(2);
    }

    @Test
    void debounceIsPerStore() {
        var otherIds = new AtomicInteger(100);
        var other = new StepStore(() -> "s" + otherIds.incrementAndGet(), clock, StepStore.DEFAULT_DEBOUNCE_WINDOW);
        String a = store.addStep("A");
        String b = store.addStep("B");
        String otherA = other.addStep("A");
        String otherB = other.addStep("B");

        assertThat(store.addConnection(a, b, ConnectionType.SUCCESS)).isTrue();
        assertThat(other.addConnection(otherA, otherB, ConnectionType.SUCCESS)).isTrue();
    }

    @Test
    void connectionToUnknownStepIsRejected() {
        String a = store.addStep("A");

        assertThat(store.addConnection(a, "ghost", ConnectionType.SUCCESS)).isFalse();
        assertThat(store.connections()).isEmpty();
    }

    @Test
    void removeConnectionMatchesExactTriple() {
        String a = store.addStep("A");
        String b = store.addStep("B");
        store.addConnection(a, b, ConnectionType.SUCCESS);
        store.addConnection(a, b, ConnectionType.FAILURE);

        assertThat(store.removeConnection(a, b, ConnectionType.FAILURE)).isTrue();
        assertThat(store.removeConnection(a, b, ConnectionType.FAILURE)).isFalse();

        assertThat(store.connections()).containsExactly(new Connection(a, b, ConnectionType.SUCCESS));
    }

    @Test
    void qualifiedNameJoinsAncestors() {
        String checkout = store.addStep("Checkout");
        String payment = store.addChildStep(checkout, "Payment");
        String card = store.addChildStep(payment, "Card");

        assertThat(store.qualifiedName(card)).isEqualTo("Checkout > Payment > Card");
        assertThat(store.qualifiedName(checkout)).isEqualTo("Checkout");
        assertThat(store.qualifiedName("missing")).isEmpty();
    }

    @Test
    void reparentingIntoOwnSubtreeIsRejected() {
        String root = store.addStep("Root");
        String child = store.addChildStep(root, "Child");
        String grandChild = store.addChildStep(child, "Grandchild");

        assertThat(store.updateStep(root, StepPatch.reparent(grandChild))).isFalse();
        assertThat(store.updateStep(root, StepPatch.reparent(root))).isFalse();

        assertThat(store.findStep(root).orElseThrow().parentId()).isNull();
        assertThat(store.qualifiedName(grandChild)).isEqualTo("Root > Child > Grandchild");
    }

    @Test
    void reparentingToUnknownStepIsRejected() {
        String step = store.addStep("Step");

        assertThat(store.updateStep(step, StepPatch.reparent("missing"))).isFalse();
        assertThat(store.updateStep(step, StepPatch.reparent(null))).isTrue();
    }

    @Test
    void qualifiedNameTerminatesOnParentCycle() {
        // a cycle can only come from outside the store
        Step a = new Step("a", "A", null, "", null, "b", List.of(), List.of(), List.of());
        Step b = new Step("b", "B", null, "", null, "a", List.of(), List.of(), List.of());
        var lookup = Map.of("a", a, "b", b);

        assertThat(StepGraph.qualifiedName(a, lookup::get)).isEqualTo("B > A");
    }

    @Test
    void replaceAllRepairsInvalidReferences() {
        Step a = new Step("a", "A", null, "", null, "b", List.of(), List.of(), List.of());
        Step b = new Step("b", "B", null, "", null, "a", List.of(), List.of(), List.of());
        Step c = new Step("c", "C", null, "", null, "missing", List.of(), List.of(), List.of());

        store.replaceAll(List.of(a, b, c), List.of(
            new Connection("a", "b", ConnectionType.SUCCESS),
            new Connection("a", "b", ConnectionType.SUCCESS),
            new Connection("a", "ghost", ConnectionType.SUCCESS)));

        assertThat(store.findStep("a").orElseThrow().parentId()).isEqualTo("b");
        assertThat(store.findStep("b").orElseThrow().parentId()).isNull();
        assertThat(store.findStep("c").orElseThrow().parentId()).isNull();
        assertThat(store.connections()).containsExactly(new Connection("a", "b", ConnectionType.SUCCESS));
    }
}
