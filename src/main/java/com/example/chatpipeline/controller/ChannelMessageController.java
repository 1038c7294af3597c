package com.example.chatpipeline.controller;

import com.example.chatpipeline.model.ChatEventView;
import com.example.chatpipeline.service.AppendMessageRequest;
import com.example.chatpipeline.service.AppendOutcome;
import com.example.chatpipeline.service.ChatEventService;
import com.example.chatpipeline.store.EventPage;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/channels/{channelId}/messages")
public class ChannelMessageController {

    private final ChatEventService chatEventService;

    public ChannelMessageController(ChatEventService chatEventService) {
        this.chatEventService = chatEventService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ChatEventView>> append(@PathVariable String channelId,
                                                      @RequestBody AppendMessageRequest request) {
        return Mono.fromCallable(() -> chatEventService.append(channelId, request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ChannelMessageController::toResponse);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> list(@PathVariable String channelId,
                                          @RequestParam(required = false) Long cursor,
                                          @RequestParam(required = false) Integer limit) {
        return Mono.fromCallable(() -> toBody(chatEventService.list(channelId, cursor, limit)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<ChatEventView> toResponse(AppendOutcome outcome) {
        HttpStatus status = outcome.duplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(ChatEventView.from(outcome.event()));
    }

    static Map<String, Object> toBody(EventPage page) {
        List<ChatEventView> items = page.items().stream().map(ChatEventView::from).toList();
        Map<String, Object> body = new HashMap<>();
        body.put("items", items);
        body.put("nextCursor", page.nextCursor());
        return body;
    }
}
