package com.turn.peerwire.client;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

@Test
public class RedialPolicyTest {

  public void noneNeverRedials() {
    assertTrue(RedialPolicy.NONE.getDelayMillis(1) < 0);
  }

  public void fixedBackoffGivesUpAfterMaxAttempts() {
    RedialPolicy policy = RedialPolicy.fixedBackoff(500, 2);
    assertEquals(policy.getDelayMillis(1), 500);
    assertEquals(policy.getDelayMillis(2), 500);
    assertTrue(policy.getDelayMillis(3) < 0);
  }
}
