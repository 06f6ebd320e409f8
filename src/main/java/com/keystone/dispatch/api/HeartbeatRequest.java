package com.keystone.dispatch.api;

/**
 * Optional body for POST /api/v1/agents/{id}/heartbeat.
 *
 * @param status self-reported health (HEALTHY, DEGRADED); nullable, defaults to HEALTHY
 */
public record HeartbeatRequest(String status) {}
