package in.chathub.domain.chat;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Chat kind. Serialized in camelCase; the snake_case labels of the
 * database enum are accepted on input.
 */
public enum ChatType {
    @JsonProperty("single")
    @JsonAlias({"Single"})
    SINGLE,

    @JsonProperty("group")
    @JsonAlias({"Group"})
    GROUP,

    @JsonProperty("privateChannel")
    @JsonAlias({"private_channel", "PrivateChannel"})
    PRIVATE_CHANNEL,

    @JsonProperty("publicChannel")
    @JsonAlias({"public_channel", "PublicChannel"})
    PUBLIC_CHANNEL
}
