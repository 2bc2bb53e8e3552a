/**
 * YAML configuration for the detection engine and partition scans.
 *
 * <p>
 * {@link com.volumesentinel.core.config.SettingsLoader} parses
 * {@link com.volumesentinel.core.config.EngineSettings} and validates it
 * immediately, so bad thresholds fail at startup instead of silently
 * disabling a detector.
 * </p>
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.config;
