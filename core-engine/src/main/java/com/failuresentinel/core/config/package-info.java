/**
 * Configuration for the analysis engine.
 *
 * <p>
 * {@link com.failuresentinel.core.config.DetectorConfig} is immutable and
 * validated at construction. The remaining stage settings are YAML-bindable
 * POJOs grouped under {@link com.failuresentinel.core.config.EngineConfig}
 * and loaded by {@link com.failuresentinel.core.config.EngineConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
package com.failuresentinel.core.config;
