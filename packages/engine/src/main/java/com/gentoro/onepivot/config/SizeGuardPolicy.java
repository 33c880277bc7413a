package com.gentoro.onepivot.config;

/** What the engine does when a pivot would exceed its cell budget. */
public enum SizeGuardPolicy {
  /** Abort the computation with a size-limit failure. */
  FAIL,
  /** Compute anyway and record a warning on the result. */
  WARN
}
