package com.javis.agents;

import com.javis.shared.model.ErrorKind;

public class DuplicateAgentException extends IllegalArgumentException {

    private final String agentId;

    public DuplicateAgentException(String agentId) {
        super("Duplicate agent: " + agentId);
        this.agentId = agentId;
    }

    public ErrorKind kind() {
        return ErrorKind.DUPLICATE_AGENT;
    }

    public String agentId() {
        return agentId;
    }
}
