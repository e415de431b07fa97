package com.taskpilot.agent;

import com.taskpilot.exception.ModelInvocationException;
import com.taskpilot.tools.ToolSpec;

import java.util.List;

/**
 * Boundary to the language-model service: submit the context window plus the tool catalogue,
 * get back either final text or a list of tool requests.
 */
public interface ModelClient {

    /**
     * @throws ModelInvocationException when the service cannot produce a reply
     */
    ModelReply complete(List<ModelMessage> messages, List<ToolSpec> tools);

    String modelName();
}
