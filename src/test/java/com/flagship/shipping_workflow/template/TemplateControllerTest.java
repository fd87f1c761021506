package com.flagship.shipping_workflow.template;

import com.flagship.shipping_workflow.session.SessionField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TemplateController.class)
class TemplateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TemplateService templateService;

    @Test
    @DisplayName("Templates are listed with their storage keys")
    void list() throws Exception {
        AddressTemplate template = new AddressTemplate(UUID.randomUUID(), "tg:7", "Office",
                Map.of(SessionField.FROM_NAME, "Ada Lovelace", SessionField.TO_ZIP, "10001"),
                Instant.parse("2026-03-02T10:00:00Z"));
        when(templateService.list("tg:7")).thenReturn(List.of(template));

        mockMvc.perform(get("/api/users/tg:7/templates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(template.getId().toString()))
                .andExpect(jsonPath("$[0].name").value("Office"))
                .andExpect(jsonPath("$[0].fields.from_name").value("Ada Lovelace"))
                .andExpect(jsonPath("$[0].fields.to_zip").value("10001"));
    }

    @Test
    @DisplayName("Deleting answers 204, or 404 for someone else's or a missing template")
    void delete_template() throws Exception {
        UUID owned = UUID.randomUUID();
        UUID missing = UUID.randomUUID();
        when(templateService.delete("tg:7", owned)).thenReturn(true);
        when(templateService.delete("tg:7", missing)).thenReturn(false);

        mockMvc.perform(delete("/api/users/tg:7/templates/" + owned))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/users/tg:7/templates/" + missing))
                .andExpect(status().isNotFound());
    }
}
