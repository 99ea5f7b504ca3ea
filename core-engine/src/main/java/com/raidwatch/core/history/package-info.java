/**
 * Bounded per-boss sighting history.
 *
 * @since 1.0.0
 */
package com.raidwatch.core.history;
