/**
 * Domain model shared between the stabilization engine and the Flink job.
 *
 * <ul>
 * <li>{@link com.framestabilizer.core.model.Detection} — one raw or stabilized
 * detection</li>
 * <li>{@link com.framestabilizer.core.model.BoundingBox} — centre + size box
 * with IoU</li>
 * <li>{@link com.framestabilizer.core.model.DetectionFrame} /
 * {@link com.framestabilizer.core.model.StabilizedFrame} — per-frame wire
 * envelopes</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.framestabilizer.core.model;
