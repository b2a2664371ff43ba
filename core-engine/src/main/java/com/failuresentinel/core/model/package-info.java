/**
 * Immutable domain model shared by every analysis stage: sensor readings,
 * detected patterns, equipment context, recommendations and typed errors.
 */
package com.failuresentinel.core.model;
