/**
 * Apache Flink streaming job for the frame stabilizer.
 *
 * <p>
 * This package wires the detection stabilization engine into a Flink pipeline
 * that consumes detection frames and control commands from Kafka, stabilizes
 * frames per source, and publishes stabilized frames and status reports back
 * to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.framestabilizer.flink.StabilizerJob} — main entry point</li>
 * <li>{@link com.framestabilizer.flink.StabilizationProcessFunction} — keyed
 * broadcast process function</li>
 * <li>{@link com.framestabilizer.flink.JobConfig} — environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.framestabilizer.flink;
