package com.taskpilot.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskpilot.exception.ModelInvocationException;
import com.taskpilot.tools.ToolRequest;
import com.taskpilot.tools.ToolSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ModelClient} for any service speaking the OpenAI chat-completions protocol with function tools.
 */
@Component
@Slf4j
public class OpenAiCompatibleModelClient implements ModelClient {

    private final WebClient modelApiClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Duration timeout;

    public OpenAiCompatibleModelClient(@Qualifier("modelApiClient") WebClient modelApiClient,
            ObjectMapper objectMapper,
            @Value("${app.model-api.model:gpt-4o-mini}") String model,
            @Value("${app.model-api.timeout-seconds:60}") long timeoutSeconds) {
        this.modelApiClient = modelApiClient;
        this.objectMapper = objectMapper;
        this.model = model;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public ModelReply complete(List<ModelMessage> messages, List<ToolSpec> tools) {
        ObjectNode body = buildRequest(messages, tools);

        JsonNode response;
        try {
            response = modelApiClient.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (WebClientResponseException e) {
            log.error("Model API error: HTTP {} - {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new ModelInvocationException("Model API returned HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new ModelInvocationException("Model API call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ModelInvocationException("Model API returned an empty body");
        }
        return parseReply(response);
    }

    ObjectNode buildRequest(List<ModelMessage> messages, List<ToolSpec> tools) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);

        ArrayNode messageArray = body.putArray("messages");
        for (ModelMessage message : messages) {
            ObjectNode node = messageArray.addObject();
            switch (message.role()) {
                case SYSTEM -> {
                    node.put("role", "system");
                    node.put("content", message.content());
                }
                case USER -> {
                    node.put("role", "user");
                    node.put("content", message.content());
                }
                case ASSISTANT -> {
                    node.put("role", "assistant");
                    if (message.content() != null) {
                        node.put("content", message.content());
                    } else {
                        node.putNull("content");
                    }
                    if (!message.toolRequests().isEmpty()) {
                        ArrayNode calls = node.putArray("tool_calls");
                        for (ToolRequest request : message.toolRequests()) {
                            ObjectNode call = calls.addObject();
                            call.put("id", request.id());
                            call.put("type", "function");
                            ObjectNode function = call.putObject("function");
                            function.put("name", request.name());
                            function.put("arguments", request.rawArguments() != null
                                    ? request.rawArguments()
                                    : String.valueOf(request.arguments()));
                        }
                    }
                }
                case TOOL -> {
                    node.put("role", "tool");
                    node.put("tool_call_id", message.toolCallId());
                    node.put("content", message.content());
                }
            }
        }

        if (!tools.isEmpty()) {
            ArrayNode toolArray = body.putArray("tools");
            for (ToolSpec spec : tools) {
                ObjectNode tool = toolArray.addObject();
                tool.put("type", "function");
                ObjectNode function = tool.putObject("function");
                function.put("name", spec.name());
                function.put("description", spec.description());
                function.set("parameters", spec.parameters());
            }
            body.put("tool_choice", "auto");
        }
        return body;
    }

    ModelReply parseReply(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ModelInvocationException("Model API returned no choices");
        }
        JsonNode message = choices.get(0).path("message");
        JsonNode content = message.path("content");
        String text = content.isTextual() ? content.asText() : null;

        List<ToolRequest> requests = new ArrayList<>();
        JsonNode toolCalls = message.path("tool_calls");
        if (toolCalls.isArray()) {
            int index = 0;
            for (JsonNode call : toolCalls) {
                String id = call.path("id").asText("");
                if (id.isBlank()) {
                    id = "call_" + index;
                }
                JsonNode function = call.path("function");
                String name = function.path("name").asText(null);
                String rawArguments = function.path("arguments").isTextual()
                        ? function.path("arguments").asText()
                        : function.path("arguments").toString();
                requests.add(new ToolRequest(id, name, parseArguments(rawArguments), rawArguments));
                index++;
            }
        }
        return new ModelReply(text, requests);
    }

    private JsonNode parseArguments(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(rawArguments);
            return parsed != null && parsed.isObject() ? parsed : null;
        } catch (JsonProcessingException e) {
            log.warn("Model sent unparseable tool arguments: {}", e.getOriginalMessage());
            return null;
        }
    }
}
