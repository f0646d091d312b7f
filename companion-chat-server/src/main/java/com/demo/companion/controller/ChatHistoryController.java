package com.demo.companion.controller;

import com.demo.companion.domain.ConversationHistory;
import com.demo.companion.service.ConversationHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only history for clients that (re)open the chat screen.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatHistoryController {

    private final ConversationHistoryService historyService;

    @GetMapping("/conversation")
    public ConversationHistory conversation(@RequestParam("userId") String userId) {
        return historyService.getConversationHistory(userId);
    }
}
