package trellis.test.hook;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import trellis.api.HookException;
import trellis.api.Invocation;
import trellis.api.descriptor.TestCatalog;
import trellis.api.hook.Hook;
import trellis.api.hook.HookBindings;
import trellis.api.hook.HookLevel;
import trellis.api.result.Outcome;
import trellis.api.result.RunSummary;
import trellis.test.BaseTest;

/**
 * Test Case: TC-04
 * Function Scope: hook orchestrator
 * Description: an entry hook failure skips the body but the matching exit hooks still run
 */
public class HookFailureTest extends BaseTest {
  private static final String CLASS_NAME = "com.acme.Checkout";

  @Test
  @DisplayName("TC-04a: Class entry failure fails every test of the class once, exit hooks run")
  void testClassEntryFailure() {
    // Given
    AtomicInteger entryCalls = new AtomicInteger();
    AtomicInteger bodies = new AtomicInteger();
    List<String> exits = new CopyOnWriteArrayList<>();
    HookBindings hooks =
        HookBindings.builder()
            .beforeClass(
                CLASS_NAME,
                Hook.sync(
                    "seed-catalog",
                    ctx -> {
                      entryCalls.incrementAndGet();
                      throw new IllegalStateException("seed failed");
                    }))
            .afterClass(CLASS_NAME, Hook.sync("drop-catalog", ctx -> exits.add("class")))
            .afterSession(Hook.sync("report", ctx -> exits.add("session")))
            .build();
    Invocation body = Invocation.sync(ctx -> bodies.incrementAndGet());
    TestCatalog catalog =
        TestCatalog.of(
            List.of(
                test("pay", CLASS_NAME).body(body).build(),
                test("refund", CLASS_NAME).body(body).build(),
                test("cancel", CLASS_NAME).body(body).build()),
            hooks);

    // When
    RunSummary summary = engine.run(catalog);

    // Then
    assertThat(entryCalls).hasValue(1);
    assertThat(bodies).hasValue(0);
    assertThat(exits).containsExactly("class", "session");
    assertThat(summary.outcomes().values())
        .allSatisfy(
            outcome ->
                assertThat(outcome)
                    .isInstanceOfSatisfying(
                        Outcome.Failed.class,
                        failed ->
                            assertThat(failed.primaryCause())
                                .isInstanceOfSatisfying(
                                    HookException.class,
                                    e -> assertThat(e.getLevel()).isEqualTo(HookLevel.CLASS))));
  }

  @Test
  @DisplayName("TC-04b: Test entry failure skips the body, test exit hooks still run")
  void testTestEntryFailure() {
    // Given
    AtomicInteger bodies = new AtomicInteger();
    AtomicInteger exits = new AtomicInteger();
    HookBindings hooks =
        HookBindings.builder()
            .beforeTest(
                CLASS_NAME,
                Hook.sync(
                    "login",
                    ctx -> {
                      throw new IllegalStateException("login failed");
                    }))
            .afterTest(CLASS_NAME, Hook.sync("logout", ctx -> exits.incrementAndGet()))
            .build();
    TestCatalog catalog =
        TestCatalog.of(
            List.of(
                test("pay", CLASS_NAME)
                    .body(Invocation.sync(ctx -> bodies.incrementAndGet()))
                    .build()),
            hooks);

    // When
    RunSummary summary = engine.run(catalog);

    // Then
    assertThat(bodies).hasValue(0);
    assertThat(exits).hasValue(1);
    assertThat(summary.outcome("pay"))
        .isInstanceOfSatisfying(
            Outcome.Failed.class,
            failed ->
                assertThat(failed.primaryCause())
                    .isInstanceOf(HookException.class)
                    .hasRootCauseMessage("login failed"));
  }
}
