/**
 * Cost-justified maintenance recommendations for detected patterns.
 *
 * <p>
 * {@link com.failuresentinel.core.recommendation.ActionCatalog} lists the
 * actions per equipment type;
 * {@link com.failuresentinel.core.recommendation.RecommendationEngine}
 * estimates cost, savings, success probability and priority for each of them
 * and applies the configured budget policy.
 * </p>
 *
 * @since 1.0.0
 */
package com.failuresentinel.core.recommendation;
