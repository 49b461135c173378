package com.dataworks.orchestrator.api.dto;

import com.dataworks.orchestrator.conversation.Turn;

import java.util.List;

public record ChatHistoryResponse(String sessionId, List<Turn> turns) {}
