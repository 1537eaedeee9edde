package com.example.conversations.service;

import com.example.conversations.dto.CreateMessageRequest;
import com.example.conversations.dto.MessageView;
import com.example.conversations.entity.Conversation;
import com.example.conversations.entity.Message;
import com.example.conversations.entity.MessageRole;
import com.example.conversations.repository.ConversationRepository;
import com.example.conversations.repository.MessageRepository;
import com.example.conversations.service.pagination.MessageFilter;
import com.example.conversations.service.pagination.PageParams;
import com.example.conversations.util.ValidationErrors;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Manages the messages of a conversation.
 *
 * <p>{@link #create} is not transactional as a whole: the user message
 * commits on its own, then {@link AssistantReplyWriter} stores the reply in a second
 * transaction so that a failed reply cannot roll back the user message.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    static final String ENTITY = "Message";

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final AssistantReplyWriter replyWriter;
    private final Validator validator;

    public ServiceResult<MessageView> create(UUID conversationId, CreateMessageRequest request) {
        Optional<Conversation> conversation = conversationRepository.findById(conversationId);
        if (conversation.isEmpty()) {
            return ServiceResult.notFound(ConversationService.ENTITY);
        }

        CreateMessageRequest normalized = CreateMessageRequest.builder()
                .text(ValidationErrors.trimmed(request.getText()))
                .role(request.getRole())
                .build();
        Set<ConstraintViolation<CreateMessageRequest>> violations = validator.validate(normalized);
        if (!violations.isEmpty()) {
            return ServiceResult.invalid(ValidationErrors.byField(violations));
        }

        MessageRole role = normalized.getRole() == null
                ? MessageRole.USER
                : MessageRole.fromValue(normalized.getRole()).orElseThrow();

        Message message = messageRepository.save(Message.builder()
                .conversation(conversation.get())
                .role(role)
                .text(normalized.getText())
                .build());
        log.info("Created {} message {} in conversation {}", role.value(), message.getId(), conversationId);

        if (message.getRole() == MessageRole.USER) {
            replyWriter.replyTo(message);
        }
        return ServiceResult.ok(MessageView.from(message));
    }

    /**
     * Filtered, paginated listing. An unknown conversation yields an empty page, not a failure.
     */
    @Transactional(readOnly = true)
    public ServiceResult<Page<MessageView>> list(UUID conversationId, MessageFilter filter, PageParams pageParams) {
        if (filter.matchesNothing()) {
            return ServiceResult.ok(Page.empty(pageParams.toPageable()));
        }
        if (!pageParams.isAddressable()) {
            long total = messageRepository.countMatching(conversationId, filter.roles(), filter.textPattern());
            log.debug("Page {} of conversation {} lies past every message ({} total)",
                    pageParams.page(), conversationId, total);
            return ServiceResult.ok(new PageImpl<MessageView>(List.of(), pageParams.toPageable(), total));
        }
        Page<Message> page = messageRepository.search(
                conversationId, filter.roles(), filter.textPattern(), pageParams.toPageable());
        log.debug("Listed conversation {} with {}: {} of {} messages",
                conversationId, filter, page.getNumberOfElements(), page.getTotalElements());
        return ServiceResult.ok(page.map(MessageView::from));
    }

    @Transactional(readOnly = true)
    public ServiceResult<MessageView> get(UUID conversationId, UUID messageId) {
        return messageRepository.findByIdAndConversationId(messageId, conversationId)
                .map(MessageView::from)
                .<ServiceResult<MessageView>>map(ServiceResult::ok)
                .orElseGet(() -> ServiceResult.notFound(ENTITY));
    }

    @Transactional
    public ServiceResult<Void> delete(UUID conversationId, UUID messageId) {
        Optional<Message> message = messageRepository.findByIdAndConversationId(messageId, conversationId);
        if (message.isEmpty()) {
            return ServiceResult.notFound(ENTITY);
        }
        messageRepository.delete(message.get());
        log.info("Deleted message {} from conversation {}", messageId, conversationId);
        return ServiceResult.ok(null);
    }
}
