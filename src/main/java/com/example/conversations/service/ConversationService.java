package com.example.conversations.service;

import com.example.conversations.config.ConversationsProperties;
import com.example.conversations.dto.ConversationView;
import com.example.conversations.dto.CreateConversationRequest;
import com.example.conversations.entity.Conversation;
import com.example.conversations.repository.ConversationRepository;
import com.example.conversations.repository.MessageRepository;
import com.example.conversations.util.ValidationErrors;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creates, reads and deletes conversations. Deleting a conversation removes its
 * messages in the same transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    static final String ENTITY = "Conversation";

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final Validator validator;
    private final EventRecorder eventRecorder;
    private final ConversationsProperties properties;

    @Transactional
    public ServiceResult<ConversationView> create(CreateConversationRequest request) {
        CreateConversationRequest normalized = CreateConversationRequest.builder()
                .title(ValidationErrors.trimmed(request.getTitle()))
                .description(ValidationErrors.trimmed(request.getDescription()))
                .build();

        Set<ConstraintViolation<CreateConversationRequest>> violations = validator.validate(normalized);
        if (!violations.isEmpty()) {
            return ServiceResult.invalid(ValidationErrors.byField(violations));
        }

        Conversation conversation = conversationRepository.save(Conversation.builder()
                .title(normalized.getTitle())
                .description(normalized.getDescription())
                .build());
        log.info("Created conversation {}", conversation.getId());
        return ServiceResult.ok(ConversationView.from(conversation));
    }

    @Transactional(readOnly = true)
    public ServiceResult<ConversationView> get(UUID id) {
        return conversationRepository.findById(id)
                .map(ConversationView::from)
                .<ServiceResult<ConversationView>>map(ServiceResult::ok)
                .orElseGet(() -> ServiceResult.notFound(ENTITY));
    }

    /**
     * Removes the conversation and every message in it.
     */
    @Transactional
    public ServiceResult<Void> delete(UUID id) {
        Optional<Conversation> conversation = conversationRepository.findById(id);
        if (conversation.isEmpty()) {
            return ServiceResult.notFound(ENTITY);
        }

        long messageCount = messageRepository.countByConversationId(id);
        if (messageCount > properties.getCascadeWarnThreshold()) {
            eventRecorder.recordWarning("Deleting conversation with a large number of messages",
                    Map.of("conversationId", id, "messageCount", messageCount));
        }

        int removed = messageRepository.deleteAllByConversationId(id);
        conversationRepository.deleteById(id);
        log.info("Deleted conversation {} and {} messages", id, removed);
        return ServiceResult.ok(null);
    }
}
