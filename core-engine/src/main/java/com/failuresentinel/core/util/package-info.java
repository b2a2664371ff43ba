/**
 * Numeric helpers and cooperative cancellation.
 */
package com.failuresentinel.core.util;
