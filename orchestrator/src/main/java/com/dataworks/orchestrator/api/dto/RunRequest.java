package com.dataworks.orchestrator.api.dto;

/** JSON body accepted by {@code POST /run}. */
public record RunRequest(String task, String session) {}
