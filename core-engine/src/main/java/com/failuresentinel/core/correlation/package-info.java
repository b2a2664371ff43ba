/**
 * Correlation of detected patterns across sensors, floors and time, used to
 * surface cascading or co-occurring failures.
 *
 * @since 1.0.0
 */
package com.failuresentinel.core.correlation;
