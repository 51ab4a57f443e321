package dev.catananti.reviewhub.comment;

public record RoomStats(Long postId, int members, long lastSequence) {}
