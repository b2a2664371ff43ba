/**
 * Runner layer of the failure pattern engine: the end-to-end pipeline,
 * its environment configuration, Micrometer metrics and the notification
 * payload handed to a {@link com.failuresentinel.pipeline.NotificationDispatcher}.
 */
package com.failuresentinel.pipeline;
