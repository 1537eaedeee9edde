package com.example.conversations.controller;

import com.example.conversations.repository.ConversationRepository;
import com.example.conversations.repository.MessageRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests for the conversation endpoints against an in-memory database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ConversationControllerTest {

    static final String API_KEY_HEADER = "X-API-Key";
    static final String API_KEY = "test-api-key";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private MessageRepository messageRepository;

    @BeforeEach
    void cleanDatabase() {
        messageRepository.deleteAllInBatch();
        conversationRepository.deleteAllInBatch();
    }

    private String createConversation(Map<String, Object> body) throws Exception {
        String json = mockMvc.perform(post("/conversations")
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        return JsonPath.read(json, "$.data.id");
    }

    private void addMessage(String conversationId, String text, String role) throws Exception {
        mockMvc.perform(post("/conversations/{id}/messages", conversationId)
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("text", text, "role", role))))
            .andExpect(status().isCreated());
    }

    @Test
    void createWithoutTitleReturns201AndGeneratedId() throws Exception {
        mockMvc.perform(post("/conversations")
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\": \"A conversation about AI assistants\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.code").value(201))
            .andExpect(jsonPath("$.message").value("Conversation created successfully"))
            .andExpect(jsonPath("$.data.id").isNotEmpty())
            .andExpect(jsonPath("$.data.title").doesNotExist())
            .andExpect(jsonPath("$.data.description").value("A conversation about AI assistants"))
            .andExpect(jsonPath("$.data.created_at").isNotEmpty())
            .andExpect(jsonPath("$.data.updated_at").isNotEmpty())
            .andExpect(jsonPath("$", not(hasKey("errors"))));
    }

    @Test
    void createWithoutDescriptionReturns400() throws Exception {
        mockMvc.perform(post("/conversations")
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"No description\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.message").value("Validation error"))
            .andExpect(jsonPath("$.data").isEmpty())
            .andExpect(jsonPath("$.errors.description[0]").value("This field is required."));

        assertThat(conversationRepository.count()).isZero();
    }

    @Test
    void createWithMalformedJsonReturns400() throws Exception {
        mockMvc.perform(post("/conversations")
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Validation error"));
    }

    @Test
    void createWithoutApiKeyReturns401() throws Exception {
        mockMvc.perform(post("/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\": \"x\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.code").value(401))
            .andExpect(jsonPath("$.message").value("Authentication failed"))
            .andExpect(jsonPath("$.errors.detail").value("Invalid API Key"));

        assertThat(conversationRepository.count()).isZero();
    }

    @Test
    void createWithWrongApiKeyReturns401() throws Exception {
        mockMvc.perform(post("/conversations")
                .header(API_KEY_HEADER, "wrong-key")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\": \"x\"}"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void generatedIdsAreUnique() throws Exception {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            ids.add(createConversation(Map.of("description", "conversation " + i)));
        }
        assertThat(ids).hasSize(5);
    }

    @Test
    void getWithoutApiKeySucceeds() throws Exception {
        String id = createConversation(Map.of("title", "Release", "description", "Planning"));

        mockMvc.perform(get("/conversations/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(200))
            .andExpect(jsonPath("$.message").value("Conversation retrieved successfully"))
            .andExpect(jsonPath("$.data.id").value(id))
            .andExpect(jsonPath("$.data.title").value("Release"));
    }

    @Test
    void getUnknownConversationReturns404() throws Exception {
        mockMvc.perform(get("/conversations/{id}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404))
            .andExpect(jsonPath("$.message").value("Resource not found"))
            .andExpect(jsonPath("$.errors.detail").value("No Conversation matches the given query."));
    }

    @Test
    void malformedIdReturns400ForGetAndDelete() throws Exception {
        mockMvc.perform(get("/conversations/{id}", "not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors.id[0]").value("Invalid UUID format: 'not-a-uuid'"));

        mockMvc.perform(delete("/conversations/{id}", "12345").header(API_KEY_HEADER, API_KEY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Validation error"));
    }

    @Test
    void deleteWithoutApiKeyReturns401AndKeepsConversation() throws Exception {
        String id = createConversation(Map.of("description", "keep me"));

        mockMvc.perform(delete("/conversations/{id}", id))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/conversations/{id}", id))
            .andExpect(status().isOk());
    }

    @Test
    void deleteCascadesToAllMessages() throws Exception {
        String id = createConversation(Map.of("description", "to be removed"));
        addMessage(id, "hello", "user");
        addMessage(id, "need help", "user");
        addMessage(id, "noted", "assistant");
        List<String> messageIds = messageRepository.findAll().stream()
            .map(message -> message.getId().toString())
            .toList();
        assertThat(messageIds).hasSize(5);

        mockMvc.perform(delete("/conversations/{id}", id).header(API_KEY_HEADER, API_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(200))
            .andExpect(jsonPath("$.message").value("Conversation deleted successfully"))
            .andExpect(jsonPath("$.data").isEmpty());

        assertThat(messageRepository.countByConversationId(UUID.fromString(id))).isZero();
        mockMvc.perform(get("/conversations/{id}", id))
            .andExpect(status().isNotFound());
        for (String messageId : messageIds) {
            mockMvc.perform(get("/conversations/{id}/messages/{message_id}", id, messageId))
                .andExpect(status().isNotFound());
        }
    }

    @Test
    void deleteLeavesOtherConversationsIntact() throws Exception {
        String doomed = createConversation(Map.of("description", "doomed"));
        String survivor = createConversation(Map.of("description", "survivor"));
        addMessage(doomed, "bye", "assistant");
        addMessage(survivor, "still here", "assistant");

        mockMvc.perform(delete("/conversations/{id}", doomed).header(API_KEY_HEADER, API_KEY))
            .andExpect(status().isOk());

        assertThat(messageRepository.countByConversationId(UUID.fromString(survivor))).isEqualTo(1);
    }

    @Test
    void deleteUnknownConversationReturns404() throws Exception {
        mockMvc.perform(delete("/conversations/{id}", UUID.randomUUID()).header(API_KEY_HEADER, API_KEY))
            .andExpect(status().isNotFound());
    }

    @Test
    void unsupportedMethodReturns405Envelope() throws Exception {
        mockMvc.perform(put("/conversations/{id}", UUID.randomUUID())
                .header(API_KEY_HEADER, API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(jsonPath("$.code").value(405))
            .andExpect(jsonPath("$.message").value("Method not allowed"));
    }
}
