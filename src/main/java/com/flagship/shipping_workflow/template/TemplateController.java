package com.flagship.shipping_workflow.template;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/users/{userKey}/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final TemplateService templateService;

    @GetMapping
    public List<TemplateResponse> list(@PathVariable String userKey) {
        return templateService.list(userKey).stream()
                .map(TemplateResponse::from)
                .collect(Collectors.toList());
    }

    @DeleteMapping("/{templateId}")
    public ResponseEntity<Void> delete(@PathVariable String userKey, @PathVariable UUID templateId) {
        return templateService.delete(userKey, templateId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @Value
    public static class TemplateResponse {
        @JsonProperty("id")
        UUID id;
        @JsonProperty("name")
        String name;
        @JsonProperty("fields")
        Map<String, String> fields;
        @JsonProperty("created_at")
        Instant createdAt;

        static TemplateResponse from(AddressTemplate template) {
            Map<String, String> fields = new LinkedHashMap<>();
            template.getFields().forEach((field, value) -> fields.put(field.getKey(), value));
            return new TemplateResponse(template.getId(), template.getName(), fields, template.getCreatedAt());
        }
    }
}
