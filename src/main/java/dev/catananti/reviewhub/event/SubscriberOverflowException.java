package dev.catananti.reviewhub.event;

/**
 * Terminates a bus subscription whose channel filled up.
 */
public class SubscriberOverflowException extends RuntimeException {

    public SubscriberOverflowException(String topic, int capacity) {
        super("Subscriber channel on topic '" + topic + "' overflowed (capacity " + capacity + ")");
    }
}
