package com.example.conversations.repository;

import com.example.conversations.entity.Message;
import com.example.conversations.entity.MessageRole;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for {@link com.example.conversations.entity.Message} entities.
 * Every query is scoped to a single conversation.
 */
public interface MessageRepository extends JpaRepository<Message, UUID> {

  /**
   * @param id             the message ID
   * @param conversationId the conversation the message must belong to
   * @return the matching message, or empty if not found or the message belongs to a different conversation
   */
  Optional<Message> findByIdAndConversationId(UUID id, UUID conversationId);

  long countByConversationId(UUID conversationId);

  /**
   * Filtered page of a conversation's messages.
   *
   * @param conversationId the conversation to search within
   * @param roles          roles to include; pass every role to disable the filter
   * @param textPattern    lowercase {@code LIKE} pattern applied to the lowercased text; {@code "%"} matches all
   * @param pageable       page slice; its sort is ignored in favour of the fixed ordering
   * @return messages ordered by {@code createdAt} ascending, then insertion order
   */
  @Query(value = """
      select m from Message m
      where m.conversation.id = :conversationId
        and m.role in :roles
        and lower(m.text) like :textPattern escape '\\'
      order by m.createdAt asc, m.seq asc
      """,
      countQuery = """
      select count(m) from Message m
      where m.conversation.id = :conversationId
        and m.role in :roles
        and lower(m.text) like :textPattern escape '\\'
      """)
  Page<Message> search(@Param("conversationId") UUID conversationId,
                       @Param("roles") Collection<MessageRole> roles,
                       @Param("textPattern") String textPattern,
                       Pageable pageable);

  /**
   * Number of messages {@link #search} would match, without fetching any of them.
   */
  @Query("""
      select count(m) from Message m
      where m.conversation.id = :conversationId
        and m.role in :roles
        and lower(m.text) like :textPattern escape '\\'
      """)
  long countMatching(@Param("conversationId") UUID conversationId,
                     @Param("roles") Collection<MessageRole> roles,
                     @Param("textPattern") String textPattern);

  /**
   * Bulk removal used by the conversation cascade. Must run inside the caller's transaction.
   *
   * @return number of deleted rows
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("delete from Message m where m.conversation.id = :conversationId")
  int deleteAllByConversationId(@Param("conversationId") UUID conversationId);
}
