package com.keystone.dispatch.api;

/**
 * Optional body for POST /api/v1/submissions/{id}/integrate.
 *
 * @param strategy advisory strategy hint (HOT_RELOAD, BLUE_GREEN, CANARY); nullable
 */
public record IntegrateRequest(String strategy) {}
