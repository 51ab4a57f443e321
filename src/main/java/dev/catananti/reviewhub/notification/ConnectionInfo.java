package dev.catananti.reviewhub.notification;

import dev.catananti.reviewhub.entity.UserRole;

import java.time.Instant;

public record ConnectionInfo(String connectionId, UserRole role, Instant connectedAt, Instant lastActivity) {}
