package com.linlay.taskagent.gateway;

import java.util.List;

public sealed interface ModelOutcome permits ModelOutcome.FinalReply, ModelOutcome.ToolRequests {

    record FinalReply(String text) implements ModelOutcome {
    }

    record ToolRequests(List<ToolRequest> requests) implements ModelOutcome {
        public ToolRequests {
            requests = requests == null ? List.of() : List.copyOf(requests);
        }
    }
}
