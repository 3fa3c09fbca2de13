package com.linlay.taskagent.gateway;

import com.linlay.taskagent.tool.ToolDescriptor;

import java.util.List;

/**
 * Single request/response exchange with the language model. Implementations have no side effects
 * beyond the remote call and report every failure as a {@link GatewayException}.
 */
public interface ModelGateway {

    ModelOutcome complete(Transcript transcript, List<ToolDescriptor> toolCatalog);
}
