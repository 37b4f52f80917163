package io.palaver.core.session;

@FunctionalInterface
public interface SessionStoreFactory {
    SessionStore open(String sessionId);
}
