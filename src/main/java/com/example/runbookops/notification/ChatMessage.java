package com.example.runbookops.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chat post: plain text plus optional Slack blocks. The text is what remains when blocks are rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {
    private String text;
    @Builder.Default
    private List<Map<String, Object>> blocks = new ArrayList<>();
}
