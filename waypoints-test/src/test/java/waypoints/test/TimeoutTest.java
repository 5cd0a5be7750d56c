package waypoints.test;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import waypoints.api.PassResult;

/**
 * Test Case: WP-TC-04
 *
 * <p>A timed-out waiter gives up without moving the cursor or disturbing other waiters.
 */
public class TimeoutTest extends BaseTest {

  @Test
  @DisplayName("WP-TC-04: timed-out waiter leaves cursor and other waiters untouched")
  void testTimeoutDoesNotDisturbOthers() throws Exception {
    // Given
    Future<PassResult> patient = executor.submit(() -> gate.pass(1));
    awaitWaiters(gate, 1);

    // When
    long start = System.nanoTime();
    Future<PassResult> impatient = executor.submit(() -> gate.pass(3, Duration.ofMillis(200)));
    PassResult timedOut = impatient.get(JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    // Then
    assertThat(timedOut).isEqualTo(PassResult.timedOut(3, 0));
    assertThat(elapsedMillis).isGreaterThanOrEqualTo(180);
    assertThat(gate.cursor()).isZero();
    assertThat(patient.isDone()).isFalse();

    gate.pass(0).orThrow();
    assertThat(patient.get(JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS))
        .isEqualTo(PassResult.passed(1));
    assertThat(gate.cursor()).isEqualTo(2);
  }
}
