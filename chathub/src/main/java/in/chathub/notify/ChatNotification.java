package in.chathub.notify;

import in.chathub.domain.event.ChatEvent;

import java.util.Set;

/**
 * A decoded notification: the shared event plus the users it must reach.
 */
public record ChatNotification(ChatEvent event, Set<Long> userIds) {

    public ChatNotification {
        userIds = Set.copyOf(userIds);
    }

    public boolean hasRecipients() {
        return !userIds.isEmpty();
    }
}
