package io.palaver.core.flow;

import io.palaver.core.context.Location;
import io.palaver.core.session.SessionStore;
import io.palaver.core.signal.Media;
import java.time.Instant;
import java.util.List;

/**
 * What a flow can do during one replay. Implementations are chosen by the transport channel.
 */
public interface ConversationApp {

    /**
     * Returns the remembered answer for {@code key}, or runs {@code builder} to obtain one. A
     * builder that cannot answer raises a prompt signal which ends the replay. Remembered answers
     * come back as the class they were given with.
     */
    <T> T screen(String key, ScreenBuilder<T> builder);

    /**
     * Typed variant that decodes a remembered answer as {@code type} instead of its recorded class.
     */
    <T> T screen(String key, Class<T> type, ScreenBuilder<T> builder);

    /**
     * Ends the conversation with a final message. Never returns normally.
     */
    void say(String message, Media media);

    default void say(String message) {
        say(message, null);
    }

    /**
     * Forgets the most recent screen of this replay and restarts the flow. Returns {@code false}
     * when no screen has been touched yet.
     */
    boolean goBack();

    SessionStore session();

    /**
     * The turn's raw input, or {@code null} once a screen has consumed it.
     */
    String input();

    List<String> navigationStack();

    String callerId();

    String messageId();

    Instant timestamp();

    String contactName();

    Location location();

    Media media();
}
