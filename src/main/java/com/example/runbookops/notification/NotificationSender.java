package com.example.runbookops.notification;

/**
 * Outbound chat and paging. Implementations report delivery as a boolean and do not throw
 * for remote failures.
 */
public interface NotificationSender {

    boolean sendChat(String token, String channel, ChatMessage message);

    boolean sendPage(String apiKey, PageAlert alert);
}
