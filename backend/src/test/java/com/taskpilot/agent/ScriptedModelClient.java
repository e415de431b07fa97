package com.taskpilot.agent;

import com.taskpilot.tools.ToolSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays queued replies (or failures) in order and records every context it was sent.
 */
public class ScriptedModelClient implements ModelClient {

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<List<ModelMessage>> calls = new ArrayList<>();

    public ScriptedModelClient reply(ModelReply reply) {
        script.add(reply);
        return this;
    }

    public ScriptedModelClient fail(RuntimeException failure) {
        script.add(failure);
        return this;
    }

    @Override
    public ModelReply complete(List<ModelMessage> messages, List<ToolSpec> tools) {
        calls.add(List.copyOf(messages));
        Object next = script.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted reply left");
        }
        if (next instanceof RuntimeException failure) {
            throw failure;
        }
        return (ModelReply) next;
    }

    @Override
    public String modelName() {
        return "scripted";
    }

    public List<List<ModelMessage>> calls() {
        return calls;
    }
}
