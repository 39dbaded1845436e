package in.chathub.domain.chat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Chat snapshot as emitted by the chat_updated trigger.
 * The member list decides who is affected by a change. Only {@code name} may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chat(
    @JsonProperty(value = "id", required = true) long id,
    @JsonProperty("name") String name,
    @JsonProperty(value = "type", required = true) ChatType type,
    @JsonProperty(value = "ws_id", required = true) long wsId,
    @JsonProperty(value = "members", required = true) List<Long> members,
    @JsonProperty(value = "created_at", required = true) Instant createdAt
) {
    public Chat {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(createdAt, "created_at");
        members = List.copyOf(Objects.requireNonNull(members, "members"));
    }

    /**
     * Members as a set (insertion order kept, duplicates collapsed).
     */
    public Set<Long> memberSet() {
        return new LinkedHashSet<>(members);
    }

    /**
     * True when both snapshots carry the same members, ignoring order and duplicates.
     */
    public boolean sameMembersAs(Chat other) {
        Objects.requireNonNull(other, "other");
        return memberSet().equals(other.memberSet());
    }
}
