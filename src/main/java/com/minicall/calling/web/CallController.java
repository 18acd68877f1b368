package com.minicall.calling.web;

import com.minicall.calling.command.CallingCommandService;
import com.minicall.calling.command.CallingInboundHandler;
import com.minicall.calling.command.StartCallRequest;
import com.minicall.calling.conversation.ConversationInfo;
import com.minicall.calling.model.CallMode;
import com.minicall.calling.model.CallingState;
import com.minicall.calling.model.PresentedSource;
import com.minicall.calling.net.ConnectivityMonitor;
import com.minicall.calling.service.VideoRequest;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RequiredArgsConstructor
@RestController
@RequestMapping("/calls")
public class CallController {

    private final CallingCommandService commands;
    private final CallingInboundHandler inbound;
    private final ConnectivityMonitor connectivity;

    @GetMapping("/state")
    public Result<CallingState> state() {
        return Result.ok(commands.getState());
    }

    public record LobbyRequest(@NotBlank(message = "missing_conversation_id") String conversationId, boolean video) {
    }

    @PostMapping("/lobby")
    public CompletableFuture<Result<Void>> lobby(@Valid @RequestBody LobbyRequest req) {
        return commands.startOutgoingCall(req.conversationId().trim(), req.video()).thenApply(v -> Result.okVoid());
    }

    public record StartRequest(
            @NotBlank(message = "missing_conversation_id") String conversationId,
            @NotNull(message = "missing_call_mode") CallMode callMode,
            boolean hasLocalAudio,
            boolean hasLocalVideo
    ) {
    }

    @PostMapping("/start")
    public CompletableFuture<Result<Void>> start(@Valid @RequestBody StartRequest req) {
        return commands.startCall(new StartCallRequest(req.conversationId().trim(), req.callMode(),
                req.hasLocalAudio(), req.hasLocalVideo())).thenApply(v -> Result.okVoid());
    }

    public record ConversationCallRequest(@NotBlank(message = "missing_conversation_id") String conversationId,
                                          boolean video) {
    }

    @PostMapping("/accept")
    public CompletableFuture<Result<Void>> accept(@Valid @RequestBody ConversationCallRequest req) {
        return commands.acceptCall(req.conversationId().trim(), req.video()).thenApply(v -> Result.okVoid());
    }

    @PostMapping("/decline")
    public CompletableFuture<Result<Void>> decline(@Valid @RequestBody ConversationCallRequest req) {
        return commands.declineCall(req.conversationId().trim()).thenApply(v -> Result.okVoid());
    }

    @PostMapping("/cancel")
    public Result<Void> cancel(@Valid @RequestBody ConversationCallRequest req) {
        commands.cancelCall(req.conversationId().trim());
        return Result.okVoid();
    }

    public record HangUpRequest(String reason) {
    }

    @PostMapping("/hangup")
    public CompletableFuture<Result<Void>> hangUp(@RequestBody(required = false) HangUpRequest req) {
        String reason = req == null || req.reason() == null || req.reason().isBlank() ? "user_hangup" : req.reason();
        return commands.hangUpActiveCall(reason).thenApply(v -> Result.okVoid());
    }

    public record ToggleRequest(boolean enabled) {
    }

    @PostMapping("/local-audio")
    public CompletableFuture<Result<Void>> localAudio(@RequestBody ToggleRequest req) {
        return commands.setLocalAudio(req.enabled()).thenApply(v -> Result.okVoid());
    }

    @PostMapping("/local-video")
    public CompletableFuture<Result<Void>> localVideo(@RequestBody ToggleRequest req) {
        return commands.setLocalVideo(req.enabled()).thenApply(v -> Result.okVoid());
    }

    @PostMapping("/outgoing-ring")
    public Result<Void> outgoingRing(@RequestBody ToggleRequest req) {
        commands.setOutgoingRing(req.enabled());
        return Result.okVoid();
    }

    /**
     * sourceId 为空表示停止共享。
     */
    public record PresentingRequest(String sourceId, String sourceName) {
    }

    @PostMapping("/presenting")
    public CompletableFuture<Result<Void>> presenting(@RequestBody PresentingRequest req) {
        PresentedSource source = req == null || req.sourceId() == null || req.sourceId().isBlank()
                ? null
                : new PresentedSource(req.sourceId(), req.sourceName());
        return commands.setPresenting(source).thenApply(v -> Result.okVoid());
    }

    public record VideoRequestBody(
            @NotBlank(message = "missing_conversation_id") String conversationId,
            List<VideoRequest> resolutions,
            @Min(value = 0, message = "invalid_speaker_height") int speakerHeight
    ) {
    }

    @PostMapping("/video-request")
    public CompletableFuture<Result<Void>> videoRequest(@Valid @RequestBody VideoRequestBody req) {
        return commands.setGroupCallVideoRequest(req.conversationId().trim(), req.resolutions(), req.speakerHeight())
                .thenApply(v -> Result.okVoid());
    }

    @PostMapping("/safety-number/confirm")
    public Result<Void> confirmSafetyNumber(@Valid @RequestBody ConversationCallRequest req) {
        inbound.onSafetyNumberConfirmed(req.conversationId().trim());
        return Result.okVoid();
    }

    @PostMapping("/view/{action}")
    public Result<Void> view(@PathVariable("action") String action) {
        switch (action) {
            case "pip" -> commands.togglePip();
            case "settings" -> commands.toggleSettings();
            case "participants" -> commands.toggleParticipants();
            case "speaker" -> commands.toggleSpeakerView();
            case "presentation" -> commands.switchToPresentationView();
            case "grid" -> commands.switchFromPresentationView();
            case "return" -> commands.returnToActiveCall();
            case "close-permission" -> commands.closeNeedPermissionScreen();
            default -> {
                return Result.fail(ApiCodes.BAD_REQUEST, "unknown_view_action");
            }
        }
        return Result.okVoid();
    }

    public record ConversationRequest(
            @NotBlank(message = "missing_conversation_id") String conversationId,
            @NotNull(message = "missing_call_mode") CallMode callMode,
            @Min(value = 0, message = "invalid_member_count") int memberCount,
            boolean announcementsOnly,
            boolean weAreAdmin
    ) {
    }

    /**
     * 同步会话元数据（成员数、仅管理员发言等），用于响铃判断和发起校验。
     */
    @PostMapping("/conversations")
    public Result<Void> conversation(@Valid @RequestBody ConversationRequest req) {
        inbound.onConversationChanged(new ConversationInfo(req.conversationId().trim(), req.callMode(),
                req.memberCount(), req.announcementsOnly(), req.weAreAdmin()));
        return Result.okVoid();
    }

    @PostMapping("/connectivity")
    public Result<Void> connectivity(@RequestBody ToggleRequest req) {
        connectivity.setOnline(req.enabled());
        return Result.okVoid();
    }
}
