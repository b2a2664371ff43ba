/**
 * Severity tiering and risk scoring of detected patterns.
 */
package com.failuresentinel.core.classification;
