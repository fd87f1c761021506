package com.flagship.shipping_workflow.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.shipping_workflow.workflow.PromptDescriptor;
import com.flagship.shipping_workflow.workflow.WorkflowController;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Thin HTTP transport for the workflow. A chat front end posts each user
 * message here and renders the returned prompt.
 */
@RestController
@RequestMapping("/api/sessions/{userKey}")
@RequiredArgsConstructor
public class ConversationApiController {

    private final WorkflowController workflowController;

    @PostMapping("/start")
    public PromptDescriptor start(@PathVariable String userKey) {
        return workflowController.start(userKey);
    }

    @PostMapping("/input")
    public PromptDescriptor input(@PathVariable String userKey, @Valid @RequestBody UserInput input) {
        return workflowController.advance(userKey, input.getText());
    }

    @PostMapping("/skip")
    public PromptDescriptor skip(@PathVariable String userKey) {
        return workflowController.skip(userKey);
    }

    @PostMapping("/back")
    public PromptDescriptor back(@PathVariable String userKey) {
        return workflowController.rollback(userKey, "Going back at the user's request");
    }

    @PostMapping("/cancel")
    public PromptDescriptor cancel(@PathVariable String userKey) {
        return workflowController.cancel(userKey);
    }

    @PostMapping("/refresh-quotes")
    public PromptDescriptor refreshQuotes(@PathVariable String userKey) {
        return workflowController.refreshQuotes(userKey);
    }

    @PostMapping("/template")
    public PromptDescriptor saveTemplate(@PathVariable String userKey, @Valid @RequestBody TemplateName body) {
        return workflowController.saveTemplate(userKey, body.getName());
    }

    @PostMapping("/start-from-template/{templateId}")
    public PromptDescriptor startFromTemplate(@PathVariable String userKey, @PathVariable UUID templateId) {
        return workflowController.startFromTemplate(userKey, templateId);
    }

    @GetMapping
    public ResponseEntity<PromptDescriptor> current(@PathVariable String userKey) {
        return workflowController.describe(userKey)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Value
    public static class UserInput {
        @NotNull(message = "Text is required")
        @JsonProperty("text")
        String text;
    }

    @Value
    public static class TemplateName {
        @NotBlank(message = "Name is required")
        @JsonProperty("name")
        String name;
    }
}
