package dev.catananti.reviewhub.event;

import dev.catananti.reviewhub.comment.CommentMessage;

/**
 * Typed bus topic. Each topic carries a single event type.
 */
public final class Topic<T> {

    public static final Topic<WorkflowEvent> WORKFLOW = new Topic<>("workflow", WorkflowEvent.class);
    public static final Topic<CommentMessage> COMMENTS = new Topic<>("comments", CommentMessage.class);

    private final String name;
    private final Class<T> eventType;

    private Topic(String name, Class<T> eventType) {
        this.name = name;
        this.eventType = eventType;
    }

    public String name() {
        return name;
    }

    public Class<T> eventType() {
        return eventType;
    }

    @Override
    public String toString() {
        return name;
    }
}
