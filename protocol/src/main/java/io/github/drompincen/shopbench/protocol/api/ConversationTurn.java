package io.github.drompincen.shopbench.protocol.api;

public record ConversationTurn(
        Role role,
        String content
) {
    public enum Role {
        USER, ASSISTANT;

        public String label() {
            return this == USER ? "User" : "Assistant";
        }
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content != null ? content : "");
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content != null ? content : "");
    }
}
