package org.waabox.primus.lock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link LockPurpose}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LockPurposeTest {

  @Test
  void whenListingPurposes_shouldHaveDistinctKeys() {
    final Set<Long> keys = new HashSet<>();
    for (final LockPurpose purpose : LockPurpose.values()) {
      keys.add(purpose.identifier().key());
    }
    assertEquals(LockPurpose.values().length, keys.size());
  }

  @Test
  void whenAskingIdentifier_givenSamePurpose_shouldBeStable() {
    assertSame(LockPurpose.JOBS_SCHEDULER.identifier(),
        LockPurpose.JOBS_SCHEDULER.identifier());
    assertEquals(0x5052494d00000001L,
        LockPurpose.JOBS_SCHEDULER.identifier().key());
    assertEquals("jobs scheduler",
        LockPurpose.JOBS_SCHEDULER.identifier().name());
  }

  @Test
  void whenResolvingByName_givenKebabOrEnumName_shouldFindPurpose() {
    assertEquals(LockPurpose.RPC_SCHEDULER,
        LockPurpose.fromName("rpc-scheduler"));
    assertEquals(LockPurpose.FUNCTIONS_SCHEDULER,
        LockPurpose.fromName("FUNCTIONS_SCHEDULER"));
  }

  @Test
  void whenResolvingByName_givenUnknownName_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> LockPurpose.fromName("mailer"));
  }
}
