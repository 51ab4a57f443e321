package dev.catananti.reviewhub.comment;

public enum RoomMessageType {
    COMMENT,
    JOINED,
    LEFT,
    ERROR,
    SHUTDOWN
}
