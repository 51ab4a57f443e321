package dev.catananti.reviewhub.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.catananti.reviewhub.comment.CommentRoomRegistry;
import dev.catananti.reviewhub.comment.RoomMessage;
import dev.catananti.reviewhub.event.SubscriberOverflowException;
import dev.catananti.reviewhub.exception.ConnectionRejectedException;
import dev.catananti.reviewhub.exception.InvalidInputException;
import dev.catananti.reviewhub.exception.ResourceNotFoundException;
import dev.catananti.reviewhub.exception.UnauthenticatedException;
import dev.catananti.reviewhub.security.Identity;
import dev.catananti.reviewhub.security.IdentityProvider;
import dev.catananti.reviewhub.store.PostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriTemplate;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;

/**
 * Live comment room of one post: {@code /ws/posts/{postId}/comments?token=<jwt>}.
 * <p>
 * Inbound text frames are {@code {"text": "..."}}; every outbound frame is a JSON {@link RoomMessage}.
 * A join without a valid token, with a malformed post id or for an unknown post is closed
 * before any frame is exchanged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommentWebSocketHandler implements WebSocketHandler {

    static final String PATH = "/ws/posts/{postId}/comments";
    private static final UriTemplate PATH_TEMPLATE = new UriTemplate(PATH);

    private final CommentRoomRegistry commentRooms;
    private final IdentityProvider identityProvider;
    private final PostStore postStore;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        URI uri = session.getHandshakeInfo().getUri();
        Long postId = parsePostId(uri);
        if (postId == null) {
            log.warn("Closing comment socket {}: malformed post id in {}", session.getId(), uri.getPath());
            return session.close(CloseStatus.BAD_DATA.withReason("Invalid post id"));
        }
        String token = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");

        return identityProvider.authenticate(token)
                .flatMap(identity -> postStore.getPost(postId)
                        .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Post", postId)))
                        .thenReturn(identity))
                .flatMap(identity -> serve(session, postId, identity))
                .onErrorResume(UnauthenticatedException.class,
                        e -> close(session, postId, CloseStatus.POLICY_VIOLATION, "Invalid token"))
                .onErrorResume(ResourceNotFoundException.class,
                        e -> close(session, postId, CloseStatus.POLICY_VIOLATION, "Unknown post"))
                .onErrorResume(ConnectionRejectedException.class,
                        e -> close(session, postId, CloseStatus.SERVICE_OVERLOAD, e.getMessage()))
                .onErrorResume(SubscriberOverflowException.class,
                        e -> close(session, postId, CloseStatus.POLICY_VIOLATION, "Too slow"));
    }

    private Mono<Void> serve(WebSocketSession session, Long postId, Identity identity) {
        String connectionId = session.getId();
        log.info("Viewer {} connected to comments of post {} as {}", identity.userId(), postId, connectionId);

        Mono<Void> output = session.send(commentRooms.join(postId, connectionId, identity.userId())
                .map(message -> session.textMessage(toJson(message))));

        Mono<Void> input = session.receive()
                .filter(frame -> frame.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(payload -> accept(postId, connectionId, identity, payload))
                .then();

        return Mono.zip(input, output)
                .then()
                .doFinally(signal -> {
                    commentRooms.leave(postId, connectionId);
                    log.info("Viewer {} disconnected from comments of post {} ({})", identity.userId(), postId, signal);
                });
    }

    private void accept(Long postId, String connectionId, Identity identity, String payload) {
        CommentFrame frame;
        try {
            frame = objectMapper.readValue(payload, CommentFrame.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed frame from {} in room {}: {}", connectionId, postId, e.getOriginalMessage());
            commentRooms.reject(postId, connectionId, "Malformed frame, expected {\"text\": \"...\"}");
            return;
        }
        try {
            commentRooms.post(postId, identity.userId(), frame == null ? null : frame.text());
        } catch (InvalidInputException | ConnectionRejectedException e) {
            commentRooms.reject(postId, connectionId, e.getMessage());
        }
    }

    private String toJson(RoomMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize room message " + message.type(), e);
        }
    }

    private Mono<Void> close(WebSocketSession session, Long postId, CloseStatus status, String reason) {
        log.warn("Closing comment socket {} for post {}: {}", session.getId(), postId, reason);
        return session.close(status.withReason(reason));
    }

    static Long parsePostId(URI uri) {
        if (!PATH_TEMPLATE.matches(uri.getPath())) {
            return null;
        }
        Map<String, String> variables = PATH_TEMPLATE.match(uri.getPath());
        try {
            long id = Long.parseLong(variables.get("postId"));
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    record CommentFrame(String text) {
    }
}
