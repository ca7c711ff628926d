package com.ai.intake.controller;

import com.ai.intake.conversation.IntakeSnapshot;
import com.ai.intake.dto.CancelRequest;
import com.ai.intake.dto.IntakeReply;
import com.ai.intake.dto.MessageRequest;
import com.ai.intake.service.IntakeDialogueEngine;
import com.ai.intake.service.ReplyRenderer;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/intake/{conversationId}")
public class IntakeController {

    private final IntakeDialogueEngine engine;
    private final ReplyRenderer renderer;

    public IntakeController(IntakeDialogueEngine engine, ReplyRenderer renderer) {
        this.engine = engine;
        this.renderer = renderer;
    }

    @PostMapping("/start")
    public IntakeReply start(@PathVariable String conversationId) {
        return renderer.render(conversationId, engine.openConversation(conversationId));
    }

    @PostMapping("/messages")
    public IntakeReply message(@PathVariable String conversationId, @Valid @RequestBody MessageRequest request) {
        return renderer.render(conversationId, engine.processMessage(conversationId, request.message()));
    }

    @PostMapping("/cancel")
    public IntakeReply cancel(@PathVariable String conversationId,
                              @Valid @RequestBody(required = false) CancelRequest request) {
        String reason = request != null ? request.reason() : null;
        return renderer.render(conversationId, engine.cancel(conversationId, reason));
    }

    @PostMapping("/timeout")
    public IntakeReply timeout(@PathVariable String conversationId) {
        return renderer.render(conversationId, engine.timeout(conversationId));
    }

    @GetMapping
    public IntakeSnapshot snapshot(@PathVariable String conversationId) {
        return engine.snapshot(conversationId);
    }

    @DeleteMapping
    public ResponseEntity<Void> release(@PathVariable String conversationId) {
        engine.release(conversationId);
        return ResponseEntity.noContent().build();
    }
}
