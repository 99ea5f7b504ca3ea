/**
 * The aggregator actor.
 *
 * <p>
 * One loop thread ({@link com.raidwatch.core.actor.AggregatorDriver}) owns
 * the aggregation table and drains a single merged input: sightings pulled
 * from the upstream source and queries submitted through any number of
 * {@link com.raidwatch.core.actor.AggregatorHandle}s. Each query carries a
 * one-shot reply slot surfaced to the caller as a
 * {@link java.util.concurrent.CompletableFuture}.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.raidwatch.core.actor.Aggregator} - construction entry
 * point</li>
 * <li>{@link com.raidwatch.core.actor.AggregatorHandle} - cloneable query
 * front door</li>
 * <li>{@link com.raidwatch.core.actor.AggregatorDriver} - the loop</li>
 * <li>{@link com.raidwatch.core.actor.AggregatorClosedException} - reply
 * cannot be delivered</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.raidwatch.core.actor;
