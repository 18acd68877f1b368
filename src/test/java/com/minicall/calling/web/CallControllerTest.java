package com.minicall.calling.web;

import com.minicall.calling.command.CallingCommandService;
import com.minicall.calling.command.CallingException;
import com.minicall.calling.command.CallingInboundHandler;
import com.minicall.calling.conversation.ConversationInfo;
import com.minicall.calling.model.CallMode;
import com.minicall.calling.net.ConnectivityMonitor;
import com.minicall.common.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CallControllerTest {

    private CallingCommandService commands;
    private CallingInboundHandler inbound;
    private ConnectivityMonitor connectivity;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        commands = mock(CallingCommandService.class);
        inbound = mock(CallingInboundHandler.class);
        connectivity = new ConnectivityMonitor();
        mvc = MockMvcBuilders.standaloneSetup(new CallController(commands, inbound, connectivity))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void lobbyWithoutConversationIdShouldBeRejected() throws Exception {
        mvc.perform(post("/calls/lobby").contentType(MediaType.APPLICATION_JSON).content("{\"video\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("missing_conversation_id"));

        verify(commands, never()).startOutgoingCall(anyString(), anyBoolean());
    }

    @Test
    void rejectedCommandShouldMapToConflict() throws Exception {
        when(commands.startOutgoingCall("g1", false)).thenThrow(new CallingException("cannot_start_group_call"));

        mvc.perform(post("/calls/lobby").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"g1\",\"video\":false}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.message").value("cannot_start_group_call"));
    }

    @Test
    void hangUpShouldDefaultReason() throws Exception {
        when(commands.hangUpActiveCall(anyString())).thenReturn(CompletableFuture.completedFuture(null));

        MvcResult started = mvc.perform(post("/calls/hangup"))
                .andExpect(request().asyncStarted())
                .andReturn();
        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        verify(commands).hangUpActiveCall("user_hangup");
    }

    @Test
    void viewActionsShouldRouteToCommands() throws Exception {
        mvc.perform(post("/calls/view/pip")).andExpect(status().isOk());
        mvc.perform(post("/calls/view/presentation")).andExpect(status().isOk());
        mvc.perform(post("/calls/view/unknown"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.message").value("unknown_view_action"));

        verify(commands).togglePip();
        verify(commands).switchToPresentationView();
    }

    @Test
    void conversationSyncShouldReachInboundHandler() throws Exception {
        mvc.perform(post("/calls/conversations").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\" g1 \",\"callMode\":\"GROUP\",\"memberCount\":5}"))
                .andExpect(status().isOk());

        verify(inbound).onConversationChanged(new ConversationInfo("g1", CallMode.GROUP, 5, false, false));
        verify(inbound, never()).onConversationRemoved(any());
    }

    @Test
    void connectivityToggleShouldUpdateMonitor() throws Exception {
        mvc.perform(post("/calls/connectivity").contentType(MediaType.APPLICATION_JSON).content("{\"enabled\":false}"))
                .andExpect(status().isOk());

        assertThat(connectivity.isOnline()).isFalse();
    }
}
