package in.chathub.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.chathub.domain.chat.Chat;
import in.chathub.domain.chat.ChatType;
import in.chathub.domain.event.ChatEventType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NotificationCodec.
 *
 * Tests:
 * - Affected-user rules for chat changes
 * - Operation to event mapping
 * - Message recipients taken verbatim from the payload
 * - Malformed payload rejection
 * - Required fields on chat and message rows
 */
class NotificationCodecTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final NotificationCodec codec = new NotificationCodec();

    private static Chat chat(long id, Long... members) {
        return new Chat(id, "chat-" + id, ChatType.GROUP, 1, List.of(members), Instant.parse("2024-05-01T10:00:00Z"));
    }

    private static String chatJson(long id, String members) {
        return "{\"id\":" + id + ",\"name\":\"chat-" + id + "\",\"type\":\"group\",\"ws_id\":1,"
            + "\"members\":" + members + ",\"created_at\":\"2024-05-01T10:00:00Z\"}";
    }

    // ═══════════════════════════════════════════════════════════════
    // affectedUsers
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testAffectedUsersEqualMembersIsEmpty() {
        Set<Long> users = NotificationCodec.affectedUsers(chat(1, 1L, 2L), chat(1, 1L, 2L));
        assertTrue(users.isEmpty(), "Rename-only update should affect nobody");
    }

    @Test
    void testAffectedUsersIgnoresMemberOrder() {
        Set<Long> users = NotificationCodec.affectedUsers(chat(1, 1L, 2L), chat(1, 2L, 1L));
        assertTrue(users.isEmpty(), "Reordered members are the same membership");
    }

    @Test
    void testAffectedUsersDifferentMembersIsUnion() {
        Set<Long> users = NotificationCodec.affectedUsers(chat(1, 1L, 2L), chat(1, 2L, 3L));
        assertEquals(Set.of(1L, 2L, 3L), users);
    }

    @Test
    void testAffectedUsersInsertIsNewMembers() {
        assertEquals(Set.of(4L, 5L), NotificationCodec.affectedUsers(null, chat(1, 4L, 5L)));
    }

    @Test
    void testAffectedUsersDeleteIsOldMembers() {
        assertEquals(Set.of(6L), NotificationCodec.affectedUsers(chat(1, 6L), null));
    }

    @Test
    void testAffectedUsersNeitherIsEmpty() {
        assertTrue(NotificationCodec.affectedUsers(null, null).isEmpty());
    }

    @Test
    void testAffectedUsersCollapsesDuplicates() {
        Set<Long> users = NotificationCodec.affectedUsers(null, chat(1, 7L, 7L, 8L));
        assertEquals(Set.of(7L, 8L), users);
    }

    // ═══════════════════════════════════════════════════════════════
    // chat_updated
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testInsertMapsToNewChat() {
        String payload = "{\"op\":\"INSERT\",\"old\":null,\"new\":" + chatJson(9, "[1,2]") + "}";

        ChatNotification n = codec.decode("chat_updated", payload);

        assertEquals(ChatEventType.NEW_CHAT, n.event().type());
        assertEquals(9L, n.event().chat().id());
        assertEquals(ChatType.GROUP, n.event().chat().type());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), n.event().chat().createdAt());
        assertEquals(Set.of(1L, 2L), n.userIds());
    }

    @Test
    void testUpdateMapsToAddToChatWithNewSnapshot() {
        String payload = "{\"op\":\"UPDATE\",\"old\":" + chatJson(3, "[1,2]")
            + ",\"new\":" + chatJson(3, "[1,2,5]") + "}";

        ChatNotification n = codec.decode("chat_updated", payload);

        assertEquals(ChatEventType.ADD_TO_CHAT, n.event().type());
        assertEquals(List.of(1L, 2L, 5L), n.event().chat().members(), "Event carries the new snapshot");
        assertEquals(Set.of(1L, 2L, 5L), n.userIds());
    }

    @Test
    void testUpdateWithMemberRemovedStillNotifiesRemovedUser() {
        String payload = "{\"op\":\"UPDATE\",\"old\":" + chatJson(3, "[1,2,5]")
            + ",\"new\":" + chatJson(3, "[1,2]") + "}";

        ChatNotification n = codec.decode("chat_updated", payload);

        assertEquals(ChatEventType.ADD_TO_CHAT, n.event().type());
        assertTrue(n.userIds().contains(5L), "Removed member is part of the union");
    }

    @Test
    void testUpdateWithSameMembersHasNoRecipients() {
        String payload = "{\"op\":\"UPDATE\",\"old\":" + chatJson(3, "[1,2]")
            + ",\"new\":" + chatJson(3, "[2,1]") + "}";

        ChatNotification n = codec.decode("chat_updated", payload);

        assertFalse(n.hasRecipients());
    }

    @Test
    void testDeleteMapsToRemoveFromChatWithOldSnapshot() {
        String payload = "{\"op\":\"DELETE\",\"old\":" + chatJson(4, "[2,3]") + ",\"new\":null}";

        ChatNotification n = codec.decode("chat_updated", payload);

        assertEquals(ChatEventType.REMOVE_FROM_CHAT, n.event().type());
        assertEquals(4L, n.event().chat().id());
        assertEquals(Set.of(2L, 3L), n.userIds());
    }

    @Test
    void testChatTypeAcceptsDatabaseLabels() {
        String chat = chatJson(9, "[1]").replace("\"group\"", "\"public_channel\"");
        ChatNotification n = codec.decode("chat_updated", "{\"op\":\"INSERT\",\"new\":" + chat + "}");
        assertEquals(ChatType.PUBLIC_CHANNEL, n.event().chat().type());
    }

    @Test
    void testUnknownFieldsAreIgnored() {
        String chat = chatJson(9, "[1]").replace("\"ws_id\":1", "\"ws_id\":1,\"agents\":[]");
        ChatNotification n = codec.decode("chat_updated", "{\"op\":\"INSERT\",\"new\":" + chat + ",\"extra\":true}");
        assertEquals(Set.of(1L), n.userIds());
    }

    @Test
    void testMissingOpIsRejected() {
        NotificationDecodeException e = assertThrows(NotificationDecodeException.class,
            () -> codec.decode("chat_updated", "{\"new\":" + chatJson(1, "[1]") + "}"));
        assertEquals("chat_updated", e.getChannel());
    }

    @Test
    void testUnknownOpIsRejected() {
        NotificationDecodeException e = assertThrows(NotificationDecodeException.class,
            () -> codec.decode("chat_updated", "{\"op\":\"TRUNCATE\",\"new\":" + chatJson(1, "[1]") + "}"));
        assertTrue(e.getMessage().contains("TRUNCATE"));
    }

    @Test
    void testInsertWithoutNewSnapshotIsRejected() {
        assertThrows(NotificationDecodeException.class,
            () -> codec.decode("chat_updated", "{\"op\":\"INSERT\",\"old\":null,\"new\":null}"));
    }

    @Test
    void testDeleteWithoutOldSnapshotIsRejected() {
        assertThrows(NotificationDecodeException.class,
            () -> codec.decode("chat_updated", "{\"op\":\"DELETE\",\"new\":" + chatJson(1, "[1]") + "}"));
    }

    @Test
    void testMalformedJsonIsRejected() {
        assertThrows(NotificationDecodeException.class, () -> codec.decode("chat_updated", "{not json"));
        assertThrows(NotificationDecodeException.class, () -> codec.decode("chat_updated", ""));
        assertThrows(NotificationDecodeException.class, () -> codec.decode("chat_updated", "null"));
    }

    @Test
    void testUnknownChannelIsAWiringError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> codec.decode("user_updated", "{}"));
        assertTrue(e.getMessage().contains("user_updated"));
    }

    // ═══════════════════════════════════════════════════════════════
    // chat_message_created
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testMessageCreatedUsesMembersVerbatim() {
        String payload = "{\"message\":{\"id\":13,\"chat_id\":9,\"sender_id\":1,\"content\":\"hello\","
            + "\"files\":[],\"created_at\":\"2024-05-01T10:00:01Z\"},\"members\":[1,2]}";

        ChatNotification n = codec.decode("chat_message_created", payload);

        assertEquals(ChatEventType.NEW_MESSAGE, n.event().type());
        assertEquals(13L, n.event().message().id());
        assertEquals(9L, n.event().message().chatId());
        assertEquals("hello", n.event().message().content());
        assertEquals(List.of(), n.event().message().files());
        assertEquals(Set.of(1L, 2L), n.userIds(), "Sender is not excluded");
    }

    @Test
    void testMessageCreatedWithEmptyMembersHasNoRecipients() {
        String payload = "{\"message\":{\"id\":1,\"chat_id\":9,\"sender_id\":1,\"content\":\"x\","
            + "\"created_at\":\"2024-05-01T10:00:01Z\"},\"members\":[]}";

        ChatNotification n = codec.decode("chat_message_created", payload);

        assertFalse(n.hasRecipients());
        assertNull(n.event().message().files());
    }

    @Test
    void testMessageCreatedWithoutMembersIsRejected() {
        String payload = "{\"message\":" + messageNode().toString() + "}";
        assertThrows(NotificationDecodeException.class, () -> codec.decode("chat_message_created", payload));
    }

    @Test
    void testMessageCreatedWithoutMessageIsRejected() {
        assertThrows(NotificationDecodeException.class,
            () -> codec.decode("chat_message_created", "{\"members\":[1]}"));
    }

    @Test
    void testMessageCreatedWithNonNumericMemberIsRejected() {
        String payload = "{\"message\":" + messageNode().toString() + ",\"members\":[\"bob\"]}";
        assertThrows(NotificationDecodeException.class, () -> codec.decode("chat_message_created", payload));
    }

    // ═══════════════════════════════════════════════════════════════
    // required fields
    // ═══════════════════════════════════════════════════════════════

    private static ObjectNode chatNode() {
        ObjectNode chat = JSON.createObjectNode();
        chat.put("id", 9);
        chat.put("name", "public chat");
        chat.put("type", "publicChannel");
        chat.put("ws_id", 1);
        chat.putArray("members").add(1).add(2);
        chat.put("created_at", "2024-05-01T10:00:00Z");
        return chat;
    }

    private static ObjectNode messageNode() {
        ObjectNode message = JSON.createObjectNode();
        message.put("id", 13);
        message.put("chat_id", 9);
        message.put("sender_id", 1);
        message.put("content", "hello");
        message.putArray("files");
        message.put("created_at", "2024-05-01T10:00:01Z");
        return message;
    }

    private static String insertOf(ObjectNode chat) {
        return "{\"op\":\"INSERT\",\"old\":null,\"new\":" + chat + "}";
    }

    private static String messageCreatedOf(ObjectNode message) {
        return "{\"message\":" + message + ",\"members\":[1,2]}";
    }

    @Test
    void testCompleteFixturesDecode() {
        assertEquals(Set.of(1L, 2L), codec.decode("chat_updated", insertOf(chatNode())).userIds());
        assertEquals(Set.of(1L, 2L), codec.decode("chat_message_created", messageCreatedOf(messageNode())).userIds());
    }

    @Test
    void testChatMissingRequiredFieldIsRejected() {
        for (String field : List.of("id", "type", "ws_id", "members", "created_at")) {
            ObjectNode chat = chatNode();
            chat.remove(field);
            assertThrows(NotificationDecodeException.class, () -> codec.decode("chat_updated", insertOf(chat)),
                "Chat without '" + field + "' must be rejected");
        }
    }

    @Test
    void testChatNullRequiredFieldIsRejected() {
        for (String field : List.of("id", "type", "ws_id", "members", "created_at")) {
            ObjectNode chat = chatNode();
            chat.putNull(field);
            assertThrows(NotificationDecodeException.class, () -> codec.decode("chat_updated", insertOf(chat)),
                "Chat with null '" + field + "' must be rejected");
        }
    }

    @Test
    void testChatWithoutNameIsAccepted() {
        ObjectNode chat = chatNode();
        chat.remove("name");
        assertNull(codec.decode("chat_updated", insertOf(chat)).event().chat().name());
    }

    @Test
    void testMessageMissingRequiredFieldIsRejected() {
        for (String field : List.of("id", "chat_id", "sender_id", "created_at")) {
            ObjectNode message = messageNode();
            message.remove(field);
            assertThrows(NotificationDecodeException.class,
                () -> codec.decode("chat_message_created", messageCreatedOf(message)),
                "Message without '" + field + "' must be rejected");
        }
    }

    @Test
    void testMessageNullIdIsRejected() {
        ObjectNode message = messageNode();
        message.putNull("sender_id");
        assertThrows(NotificationDecodeException.class,
            () -> codec.decode("chat_message_created", messageCreatedOf(message)));
    }

    @Test
    void testMessageWithoutContentOrFilesIsAccepted() {
        ObjectNode message = messageNode();
        message.remove("content");
        message.remove("files");

        ChatNotification n = codec.decode("chat_message_created", messageCreatedOf(message));

        assertNull(n.event().message().content());
        assertNull(n.event().message().files());
    }

    @Test
    void testRowWithOnlyContentIsRejected() {
        assertThrows(NotificationDecodeException.class,
            () -> codec.decode("chat_message_created", "{\"message\":{\"content\":\"hello\"},\"members\":[1,2]}"));
        assertThrows(NotificationDecodeException.class,
            () -> codec.decode("chat_updated", "{\"op\":\"INSERT\",\"new\":{\"name\":\"x\"}}"));
    }
}
