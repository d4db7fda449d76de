package com.scholary.inference.api;

public record PingResponse(String ping) {}
