package com.example.conversations.service;

import com.example.conversations.entity.Message;
import com.example.conversations.entity.MessageRole;
import com.example.conversations.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Writes the automatic assistant reply to a user message.
 *
 * <p>This is a secondary effect of message creation: a failure here is recorded through
 * {@link EventRecorder#recordError} and then dropped, so the user message it answers is
 * still reported as created. There is no retry.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssistantReplyWriter {

    private final AssistantResponder responder;
    private final MessageRepository messageRepository;
    private final EventRecorder eventRecorder;

    /**
     * @param userMessage persisted message with role {@link MessageRole#USER}
     * @return the stored reply, or empty if it could not be produced
     */
    public Optional<Message> replyTo(Message userMessage) {
        try {
            String reply = responder.replyTo(userMessage.getText());
            Message saved = messageRepository.save(Message.builder()
                    .conversation(userMessage.getConversation())
                    .role(MessageRole.ASSISTANT)
                    .text(reply)
                    .build());
            log.debug("Stored assistant reply {} to message {}", saved.getId(), userMessage.getId());
            return Optional.of(saved);
        } catch (RuntimeException e) {
            eventRecorder.recordError("Failed to generate assistant response",
                    Map.of("conversationId", userMessage.getConversation().getId(),
                            "messageId", userMessage.getId(),
                            "error", String.valueOf(e.getMessage())),
                    e);
            return Optional.empty();
        }
    }
}
