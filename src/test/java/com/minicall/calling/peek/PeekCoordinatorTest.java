package com.minicall.calling.peek;

import com.minicall.calling.conversation.ConversationDirectory;
import com.minicall.calling.conversation.ConversationInfo;
import com.minicall.calling.model.CallMode;
import com.minicall.calling.model.GroupCall;
import com.minicall.calling.model.GroupCallConnectionState;
import com.minicall.calling.model.GroupCallJoinState;
import com.minicall.calling.model.PeekInfo;
import com.minicall.calling.service.CallingService;
import com.minicall.calling.store.CallSessionStore;
import com.minicall.calling.store.CallingEvent;
import com.minicall.config.CallingProperties;
import com.minicall.config.ConversationCacheProperties;
import com.minicall.config.PeekProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PeekCoordinatorTest {

    private static final String GROUP_ID = "g1";

    private final List<CompletableFuture<Void>> gates = new ArrayList<>();
    private final List<CompletableFuture<PeekInfo>> peeks = new ArrayList<>();

    private CallSessionStore store;
    private CallingService callingService;
    private ConversationDirectory conversations;
    private PeekGate gate;
    private PeekCoordinator coordinator;

    @BeforeEach
    void setUp() {
        CallingProperties props = new CallingProperties("me", true, 16);
        store = new CallSessionStore(props);
        callingService = mock(CallingService.class);
        conversations = new ConversationDirectory(new ConversationCacheProperties(), props);
        conversations.put(new ConversationInfo(GROUP_ID, CallMode.GROUP, 5, false, false));
        conversations.put(new ConversationInfo("d1", CallMode.DIRECT, 2, false, false));

        gate = mock(PeekGate.class);
        when(gate.await(anyLong())).thenAnswer(inv -> {
            CompletableFuture<Void> f = new CompletableFuture<>();
            gates.add(f);
            return f;
        });
        when(callingService.peekGroupCall(anyString())).thenAnswer(inv -> {
            CompletableFuture<PeekInfo> f = new CompletableFuture<>();
            peeks.add(f);
            return f;
        });

        coordinator = new PeekCoordinator(store, callingService, conversations, gate,
                new PeekProperties(1000, 1000), Runnable::run);
    }

    @Test
    void burstOfRequestsShouldIssueOnePeekPerWindow() {
        for (int i = 0; i < 5; i++) {
            coordinator.requestPeek(GROUP_ID);
        }

        assertThat(gates).hasSize(1);
        verify(callingService, never()).peekGroupCall(anyString());

        gates.get(0).complete(null);
        verify(callingService, times(1)).peekGroupCall(GROUP_ID);

        // 合并后的那一次在第一次结束后才开始
        peeks.get(0).complete(peek("alice"));
        assertThat(gates).hasSize(2);
        gates.get(1).complete(null);
        peeks.get(1).complete(peek("alice"));

        verify(callingService, times(2)).peekGroupCall(GROUP_ID);
        assertThat(coordinator.queueCount()).isZero();
    }

    @Test
    void earlySyncedGroupShouldStillBePeekedAfterManyOthers() {
        for (int i = 0; i < 50; i++) {
            conversations.put(new ConversationInfo("other-" + i, CallMode.GROUP, 3, false, false));
        }

        coordinator.requestPeek(GROUP_ID);
        gates.get(0).complete(null);

        verify(callingService).peekGroupCall(GROUP_ID);
    }

    @Test
    void requestsDuringInFlightPeekShouldCauseExactlyOneRerun() {
        coordinator.requestPeek(GROUP_ID);
        gates.get(0).complete(null);
        assertThat(peeks).hasSize(1);

        coordinator.requestPeek(GROUP_ID);
        coordinator.requestPeek(GROUP_ID);
        coordinator.requestPeek(GROUP_ID);
        assertThat(gates).hasSize(1);

        peeks.get(0).complete(peek("alice"));
        assertThat(gates).hasSize(2);
        gates.get(1).complete(null);
        peeks.get(1).complete(peek("alice", "bob"));

        verify(callingService, times(2)).peekGroupCall(GROUP_ID);
        assertThat(store.getState().getGroupCall(GROUP_ID).peekInfo().memberIds()).containsExactly("alice", "bob");
        assertThat(coordinator.queueCount()).isZero();
    }

    @Test
    void successfulPeekShouldUpdateStoreAndCallHistory() {
        coordinator.requestPeek(GROUP_ID);
        assertThat(coordinator.queueCount()).isEqualTo(1);

        gates.get(0).complete(null);
        PeekInfo result = peek("alice");
        peeks.get(0).complete(result);

        GroupCall call = store.getState().getGroupCall(GROUP_ID);
        assertThat(call.peekInfo()).isEqualTo(result);
        assertThat(call.connectionState()).isEqualTo(GroupCallConnectionState.NOT_CONNECTED);
        verify(callingService).updateCallHistoryForGroupCall(eq(GROUP_ID), isNull(), eq(result));
        assertThat(coordinator.queueCount()).isZero();
    }

    @Test
    void callHistoryShouldReceiveCurrentJoinState() {
        store.dispatch(new CallingEvent.IncomingGroupCall(GROUP_ID, 1L, "alice"));

        coordinator.requestPeek(GROUP_ID);
        gates.get(0).complete(null);
        PeekInfo result = peek("alice");
        peeks.get(0).complete(result);

        verify(callingService).updateCallHistoryForGroupCall(GROUP_ID, GroupCallJoinState.NOT_JOINED, result);
    }

    @Test
    void callHistoryFailureShouldNotBlockResult() {
        when(callingService.updateCallHistoryForGroupCall(anyString(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("history down")));

        coordinator.requestPeek(GROUP_ID);
        gates.get(0).complete(null);
        PeekInfo result = peek("alice");
        peeks.get(0).complete(result);

        assertThat(store.getState().getGroupCall(GROUP_ID).peekInfo()).isEqualTo(result);
    }

    @Test
    void peekShouldBeSkippedWhenCallConnectsDuringWait() {
        store.dispatch(new CallingEvent.IncomingGroupCall(GROUP_ID, 1L, "alice"));
        coordinator.requestPeek(GROUP_ID);

        store.dispatch(new CallingEvent.GroupCallStateChange(GROUP_ID, GroupCallConnectionState.CONNECTED,
                GroupCallJoinState.JOINED, true, false, null, List.of(), "me"));
        gates.get(0).complete(null);

        verify(callingService, never()).peekGroupCall(anyString());
        assertThat(coordinator.queueCount()).isZero();
    }

    @Test
    void stalePeekResultShouldNotOverwriteConnectedCall() {
        store.dispatch(new CallingEvent.IncomingGroupCall(GROUP_ID, 1L, "alice"));
        coordinator.requestPeek(GROUP_ID);
        gates.get(0).complete(null);

        PeekInfo p1 = peek("alice", "me");
        store.dispatch(new CallingEvent.GroupCallStateChange(GROUP_ID, GroupCallConnectionState.CONNECTED,
                GroupCallJoinState.JOINED, true, false, p1, List.of(), "me"));
        peeks.get(0).complete(peek("alice"));

        GroupCall call = store.getState().getGroupCall(GROUP_ID);
        assertThat(call.peekInfo()).isEqualTo(p1);
        assertThat(call.connectionState()).isEqualTo(GroupCallConnectionState.CONNECTED);
        assertThat(call.joinState()).isEqualTo(GroupCallJoinState.JOINED);
    }

    @Test
    void connectedCallShouldNotEvenWait() {
        store.dispatch(new CallingEvent.GroupCallStateChange(GROUP_ID, GroupCallConnectionState.CONNECTING,
                GroupCallJoinState.JOINING, true, false, null, List.of(), "me"));

        coordinator.requestPeek(GROUP_ID);

        verify(gate, never()).await(anyLong());
        assertThat(coordinator.queueCount()).isZero();
    }

    @Test
    void nonGroupConversationsShouldBeIgnored() {
        coordinator.requestPeek("d1");
        coordinator.requestPeek("unknown");

        verify(gate, never()).await(anyLong());
        assertThat(coordinator.queueCount()).isZero();
    }

    @Test
    void failedPeekShouldBeDropped() {
        coordinator.requestPeek(GROUP_ID);
        gates.get(0).complete(null);

        peeks.get(0).completeExceptionally(new RuntimeException("network down"));

        assertThat(store.getState().getCall(GROUP_ID)).isNull();
        assertThat(coordinator.queueCount()).isZero();

        // 下一次触发照常执行
        coordinator.requestPeek(GROUP_ID);
        assertThat(gates).hasSize(2);
    }

    @Test
    void emptyPeekResultShouldBeDropped() {
        coordinator.requestPeek(GROUP_ID);
        gates.get(0).complete(null);

        peeks.get(0).complete(null);

        assertThat(store.getState().getCall(GROUP_ID)).isNull();
        verify(callingService, never()).updateCallHistoryForGroupCall(anyString(), any(), any());
    }

    @Test
    void requestPeekAfterShouldWaitForDelay() {
        CompletableFuture<Void> delay = new CompletableFuture<>();
        when(gate.delay(1000L)).thenReturn(delay);

        coordinator.requestPeekAfter(GROUP_ID, 1000L);
        assertThat(gates).isEmpty();

        delay.complete(null);
        assertThat(gates).hasSize(1);
    }

    @Test
    void peekForTheFirstTimeShouldSkipKnownSnapshot() {
        store.dispatch(new CallingEvent.PeekFulfilled(GROUP_ID, peek("alice")));

        coordinator.peekForTheFirstTime(GROUP_ID);

        assertThat(gates).isEmpty();
    }

    @Test
    void peekForTheFirstTimeShouldPeekUnknownCall() {
        coordinator.peekForTheFirstTime(GROUP_ID);

        assertThat(gates).hasSize(1);
    }

    @Test
    void peekIfItHasMembersShouldRequireDevices() {
        store.dispatch(new CallingEvent.PeekFulfilled(GROUP_ID, new PeekInfo(List.of(), null, null, 16, 0)));
        coordinator.peekIfItHasMembers(GROUP_ID);
        assertThat(gates).isEmpty();

        store.dispatch(new CallingEvent.PeekFulfilled(GROUP_ID, peek("alice")));
        coordinator.peekIfItHasMembers(GROUP_ID);
        assertThat(gates).hasSize(1);
    }

    private static PeekInfo peek(String... memberIds) {
        return new PeekInfo(List.of(memberIds), memberIds.length == 0 ? null : memberIds[0], "era-1", 16,
                memberIds.length);
    }
}
