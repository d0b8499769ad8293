package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the PriorityResolver and the TransitionTable it
 * produces.
 */
public final class PriorityResolverTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Trigger keypad = Trigger.event("KEYPAD_INPUT");
  private static final Trigger masterCode = Trigger.event("USER_ENTERS_MASTER_CODE");
  private static final Trigger doorClosed = Trigger.event("DOOR_CLOSED");

  @Test
  public void testSmartLockGuardChain() throws Exception {
    final TransitionTable table = smartLockTable();

    // 1. a valid code opens the door and starts the entry timer
    final Map<String, Object> bindings = new HashMap<>();
    bindings.put("Code", "VALID");
    Resolution resolution = table.resolve("IDLE_LOCKED", keypad, bindings);
    assertEquals(ResolvedEntry.Source.LOCAL, resolution.getSource());
    assertEquals("ENTRY_ALLOWED", resolution.getDestination());
    assertEquals(0, resolution.getBranchIndex());
    assertEquals(Action.Type.START_TIMER, resolution.getActions().get(0).getType());

    // 2. a wrong code under the limit stays
    bindings.put("Code", "INVALID");
    bindings.put("Attempt_Count", 1L);
    resolution = table.resolve("IDLE_LOCKED", keypad, bindings);
    assertEquals("IDLE_LOCKED", resolution.getDestination());
    assertEquals(1, resolution.getBranchIndex());
    assertTrue(resolution.getActions().isEmpty());

    // 3. a wrong code at the limit raises the alarm
    bindings.put("Attempt_Count", 3L);
    resolution = table.resolve("IDLE_LOCKED", keypad, bindings);
    assertEquals("ALARM_STATE", resolution.getDestination());
    assertEquals(2, resolution.getBranchIndex());
    assertEquals("SOUND_ALARM", resolution.getActions().get(0).getName());

    // 4. nothing holds: the state keeps itself and fires nothing
    resolution = table.resolve("IDLE_LOCKED", keypad, Collections.<String, Object>emptyMap());
    assertTrue(resolution.isImplicitStay());
    assertEquals("IDLE_LOCKED", resolution.getDestination());
    assertEquals(-1, resolution.getBranchIndex());
  }

  @Test
  public void testGlobalOverridesLocal() throws Exception {
    final TransitionTable table = smartLockTable();

    // ALARM_STATE declares its own STAY on the master code, the global wins anyway
    final ResolvedEntry entry = table.lookup("ALARM_STATE", masterCode);
    assertEquals(ResolvedEntry.Source.GLOBAL, entry.getSource());
    assertTrue(entry.getBranches().isEmpty());
    final Resolution resolution =
        table.resolve("ALARM_STATE", masterCode, Collections.<String, Object>emptyMap());
    assertEquals("IDLE_LOCKED", resolution.getDestination());
    assertEquals(2, resolution.getActions().size());
    assertEquals(Action.Type.STOP_ALL_TIMERS, resolution.getActions().get(0).getType());
    assertEquals(Action.Type.CLEAR_ALARM, resolution.getActions().get(1).getType());

    // the global fires from every state, including its own destination
    assertEquals(ResolvedEntry.Source.GLOBAL, table.lookup("IDLE_LOCKED", masterCode).getSource());
    assertEquals(ResolvedEntry.Source.GLOBAL,
        table.lookup("ENTRY_ALLOWED", masterCode).getSource());
  }

  @Test
  public void testImplicitStayAndTimeouts() throws Exception {
    final TransitionTable table = smartLockTable();

    // 1. only explicit pairs are stored
    assertEquals(6, table.size());

    // 2. a pair without any transition falls back to STAY
    final ResolvedEntry stay = table.lookup("ALARM_STATE", doorClosed);
    assertEquals(ResolvedEntry.Source.IMPLICIT_STAY, stay.getSource());
    assertNull(stay.getGlobal());
    final Resolution resolution =
        table.resolve("ALARM_STATE", doorClosed, Collections.<String, Object>emptyMap());
    assertTrue(resolution.isImplicitStay());
    assertEquals("ALARM_STATE", resolution.getDestination());
    assertTrue(resolution.getActions().isEmpty());

    // 3. the timeout of the timed state leads back to the locked state
    final Resolution expired = table.resolve("ENTRY_ALLOWED", Trigger.timeout(null),
        Collections.<String, Object>emptyMap());
    assertEquals(ResolvedEntry.Source.LOCAL, expired.getSource());
    assertEquals("IDLE_LOCKED", expired.getDestination());
    assertEquals(Action.Type.STOP_TIMER, expired.getActions().get(0).getType());
  }

  @Test
  public void testResolutionIsDeterministic() throws Exception {
    final TransitionTable first = smartLockTable();
    final TransitionTable second = smartLockTable();
    assertEquals(first, second);
    assertEquals(first.describe(), second.describe());
    assertTrue(first.describe().startsWith(
        "IDLE_LOCKED ON_EVENT(USER_ENTERS_MASTER_CODE): GLOBAL -> IDLE_LOCKED"));
  }

  private static TransitionTable smartLockTable() throws Exception {
    final Diagnostics diagnostics = new Diagnostics();
    final Specification specification = TestSpecifications
        .build(TestSpecifications.load(TestSpecifications.smartLock), diagnostics);
    return new PriorityResolver().resolve(specification);
  }
}
