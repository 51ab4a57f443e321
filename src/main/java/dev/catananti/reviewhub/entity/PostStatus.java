package dev.catananti.reviewhub.entity;

/**
 * Lifecycle status of a post in the review workflow.
 * Entity fields remain as String for R2DBC compatibility.
 */
public enum PostStatus {
    DRAFT,
    PENDING,
    APPROVED,
    REJECTED;

    /**
     * Check if the given status string matches this enum value.
     */
    public boolean matches(String status) {
        return this.name().equals(status);
    }
}
