package com.example.conversations.service.pagination;

import com.example.conversations.entity.MessageRole;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Optional text and role filters for a message listing, combined with AND.
 *
 * <p>{@code q} is a case-insensitive substring match on the message text.
 * {@code role} is an exact match; a value that names no known role matches nothing.</p>
 */
public final class MessageFilter {

    private static final String MATCH_ALL = "%";

    private final String query;
    private final Set<MessageRole> roles;

    private MessageFilter(String query, Set<MessageRole> roles) {
        this.query = query;
        this.roles = roles;
    }

    /**
     * @param q    raw {@code q} parameter; {@code null} or empty disables the text filter
     * @param role raw {@code role} parameter; {@code null} or empty disables the role filter
     */
    public static MessageFilter of(String q, String role) {
        String query = (q == null || q.isEmpty()) ? null : q;
        Set<MessageRole> roles;
        if (role == null || role.isEmpty()) {
            roles = EnumSet.allOf(MessageRole.class);
        } else {
            Optional<MessageRole> parsed = MessageRole.fromValue(role);
            roles = parsed.map(EnumSet::of).orElseGet(() -> EnumSet.noneOf(MessageRole.class));
        }
        return new MessageFilter(query, roles);
    }

    public Optional<String> query() {
        return Optional.ofNullable(query);
    }

    public Set<MessageRole> roles() {
        return roles;
    }

    /** True when the role filter names an unknown role, so no message can match. */
    public boolean matchesNothing() {
        return roles.isEmpty();
    }

    /**
     * Lowercase {@code LIKE} pattern for the text filter, with {@code %}, {@code _} and
     * the escape character itself escaped by {@code \}.
     */
    public String textPattern() {
        if (query == null) {
            return MATCH_ALL;
        }
        String escaped = query.toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return MATCH_ALL + escaped + MATCH_ALL;
    }

    @Override
    public String toString() {
        return "MessageFilter{q=" + query + ", roles=" + roles + "}";
    }
}
