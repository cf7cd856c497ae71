/**
 * Detection stabilization engine.
 *
 * <p>
 * All stabilizers implement the
 * {@link com.framestabilizer.core.stabilization.DetectionStabilizer}
 * interface and are instantiated via
 * {@link com.framestabilizer.core.stabilization.StabilizerFactory}.
 * Built-in modes:
 * </p>
 * <ul>
 * <li>{@link com.framestabilizer.core.stabilization.TemporalHysteresisStabilizer}
 * — temporal confirmation, confidence hysteresis and IoU tracking</li>
 * <li>{@link com.framestabilizer.core.stabilization.NoOpStabilizer} —
 * pass-through</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.framestabilizer.core.stabilization;
