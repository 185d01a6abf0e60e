package com.github.hsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

/**
 * Tests for the per-level action log buffer.
 */
public class ActionLogTest {

  @Test
  public void testPrefixAbsorbAndDrain() {
    final ActionLog parent = new ActionLog("parent", "", 10);
    final ActionLog child = new ActionLog("child", SimulatorConfiguration.subMachineLogPrefix, 10);
    parent.log("Entering state: Outer");
    child.log("Entering state: Inner");
    parent.absorb(child.drain());
    assertEquals(0, child.size());
    assertEquals(Arrays.asList("Entering state: Outer", "  [SUB] Entering state: Inner"),
        parent.drain());
    assertTrue(parent.drain().isEmpty());
  }

  @Test
  public void testOldestLinesAreDroppedWhenFull() {
    final ActionLog log = new ActionLog("bounded", "", 3);
    for (int i = 0; i < 5; i++) {
      log.log("line " + i);
    }
    assertEquals(3, log.size());
    assertEquals(2, log.getDroppedLines());
    assertEquals(Arrays.asList("line 2", "line 3", "line 4"), log.drain());
  }

}
