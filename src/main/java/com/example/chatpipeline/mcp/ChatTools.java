package com.example.chatpipeline.mcp;

import com.example.chatpipeline.model.ChatEventView;
import com.example.chatpipeline.service.AppendMessageRequest;
import com.example.chatpipeline.service.AppendOutcome;
import com.example.chatpipeline.service.ChatEventService;
import com.example.chatpipeline.store.EventPage;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class ChatTools {

    private final ChatEventService chatEventService;

    public ChatTools(ChatEventService chatEventService) {
        this.chatEventService = chatEventService;
    }

    @Tool(description = "Append a message to a chat channel; role is user, ai or system. Returns the stored event")
    public Map<String, Object> chat_append(String channelId, String senderId, String role, String content,
                                           String contentType, String eventId) {
        AppendOutcome outcome = chatEventService.append(channelId,
                new AppendMessageRequest(eventId, null, senderId, role, content, contentType, null));
        Map<String, Object> result = new HashMap<>();
        result.put("event", ChatEventView.from(outcome.event()));
        result.put("duplicate", outcome.duplicate());
        return result;
    }

    @Tool(description = "List messages of a chat channel in order, after an optional ts cursor")
    public Map<String, Object> chat_list(String channelId, Long cursor, Integer limit) {
        EventPage page = chatEventService.list(channelId, cursor, limit);
        List<ChatEventView> items = page.items().stream().map(ChatEventView::from).toList();
        Map<String, Object> result = new HashMap<>();
        result.put("items", items);
        result.put("nextCursor", page.nextCursor());
        return result;
    }
}
