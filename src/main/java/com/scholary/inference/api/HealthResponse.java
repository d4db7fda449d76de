package com.scholary.inference.api;

/**
 * Basic liveness summary of the gateway.
 *
 * @param timestamp current time in epoch seconds
 * @param uptime seconds since the gateway started
 */
public record HealthResponse(String status, String version, double timestamp, double uptime) {}
