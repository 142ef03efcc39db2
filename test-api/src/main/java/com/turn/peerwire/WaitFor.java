package com.turn.peerwire;

/**
 * Polls a condition until it holds or the timeout expires. The wait happens
 * in the constructor, check {@link #isMyResult()} afterwards.
 */
public abstract class WaitFor {
  public static final long POLL_INTERVAL = 50;

  private boolean myResult = false;

  protected WaitFor() {
    this(10 * 1000);
  }

  protected WaitFor(long timeout) {
    long maxTime = System.currentTimeMillis() + timeout;
    try {
      while (System.currentTimeMillis() < maxTime && !condition()) {
        Thread.sleep(POLL_INTERVAL);
      }
      if (condition()) {
        myResult = true;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public boolean isMyResult() {
    return myResult;
  }

  protected abstract boolean condition();
}
