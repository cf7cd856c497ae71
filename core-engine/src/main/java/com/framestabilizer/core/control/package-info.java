/**
 * Control plane for the stabilization engine: command messages, their
 * dispatch onto a
 * {@link com.framestabilizer.core.stabilization.DetectionStabilizer} and the
 * status reports they produce.
 *
 * @since 1.0.0
 */
package com.framestabilizer.core.control;
