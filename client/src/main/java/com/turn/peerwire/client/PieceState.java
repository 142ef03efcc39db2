package com.turn.peerwire.client;

public enum PieceState {
  /** No block received. Blocks may still be requested from peers. */
  MISSING,
  /** Some blocks received, the piece isn't complete yet. */
  IN_PROGRESS,
  /** All blocks received and the piece matched its hash. Final. */
  VERIFIED
}
