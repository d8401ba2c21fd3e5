package org.waabox.primus.leader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.easymock.EasyMock.*;

import java.util.List;

import org.easymock.IMocksControl;
import org.junit.jupiter.api.Test;

import org.waabox.primus.lock.LockIdentifier;
import org.waabox.primus.lock.LockPurpose;

/**
 * Tests for {@link LeaderElectorRegistry}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LeaderElectorRegistryTest {

  private static final LockIdentifier JOBS =
      LockPurpose.JOBS_SCHEDULER.identifier();

  private static final LockIdentifier RPC =
      LockPurpose.RPC_SCHEDULER.identifier();

  @Test
  void whenStartingAndStopping_givenTwoElections_shouldKeepOrder() {
    final IMocksControl control = createStrictControl();
    final LeaderElectionStrategy jobs =
        control.createMock(LeaderElectionStrategy.class);
    final LeaderElectionStrategy rpc =
        control.createMock(LeaderElectionStrategy.class);
    final LeadershipListener jobsListener =
        createNiceMock(LeadershipListener.class);
    final LeadershipListener rpcListener =
        createNiceMock(LeadershipListener.class);

    jobs.start(jobsListener);
    rpc.start(rpcListener);
    rpc.stop();
    jobs.stop();
    control.replay();

    final LeaderElectorRegistry registry = new LeaderElectorRegistry();
    registry.register(JOBS, jobs, jobsListener);
    registry.register(RPC, rpc, rpcListener);

    registry.startAll();
    registry.stopAll();

    control.verify();
  }

  @Test
  void whenStopping_givenFailingElection_shouldStopTheOthers() {
    final LeaderElectionStrategy jobs =
        createMock(LeaderElectionStrategy.class);
    final LeaderElectionStrategy rpc =
        createMock(LeaderElectionStrategy.class);

    jobs.stop();
    rpc.stop();
    expectLastCall().andThrow(new IllegalStateException("boom"));
    replay(jobs, rpc);

    final LeaderElectorRegistry registry = new LeaderElectorRegistry();
    registry.register(JOBS, jobs, createNiceMock(LeadershipListener.class));
    registry.register(RPC, rpc, createNiceMock(LeadershipListener.class));

    registry.stopAll();

    verify(jobs, rpc);
  }

  @Test
  void whenAskingLeadership_givenRegisteredElection_shouldDelegate() {
    final LeaderElectionStrategy jobs =
        createMock(LeaderElectionStrategy.class);
    expect(jobs.isLeader()).andReturn(true);
    replay(jobs);

    final LeaderElectorRegistry registry = new LeaderElectorRegistry();
    registry.register(JOBS, jobs, createNiceMock(LeadershipListener.class));

    assertTrue(registry.isLeader(JOBS));
    assertFalse(registry.isLeader(RPC));
    assertEquals(List.of(JOBS), registry.identifiers());
    verify(jobs);
  }

  @Test
  void whenAskingLeadership_givenIdentifierWithOtherName_shouldMatchByKey() {
    final LeaderElectionStrategy jobs =
        createMock(LeaderElectionStrategy.class);
    expect(jobs.isLeader()).andReturn(true);
    replay(jobs);

    final LeaderElectorRegistry registry = new LeaderElectorRegistry();
    registry.register(JOBS, jobs, createNiceMock(LeadershipListener.class));

    assertTrue(registry.isLeader(LockIdentifier.of(JOBS.key(), "alias")));
    verify(jobs);
  }

  @Test
  void whenRegistering_givenDuplicateKey_shouldThrow() {
    final LeaderElectorRegistry registry = new LeaderElectorRegistry();
    registry.register(JOBS, new SingleNodeLeaderElection("jobs"),
        createNiceMock(LeadershipListener.class));

    final LockIdentifier clash = LockIdentifier.of(JOBS.key(), "clash");

    assertThrows(IllegalArgumentException.class, () ->
        registry.register(clash, new SingleNodeLeaderElection("clash"),
            createNiceMock(LeadershipListener.class)));
  }

  @Test
  void whenRegistering_givenNullElection_shouldThrow() {
    final LeaderElectorRegistry registry = new LeaderElectorRegistry();

    assertThrows(NullPointerException.class, () ->
        registry.register(JOBS, null,
            createNiceMock(LeadershipListener.class)));
  }
}
