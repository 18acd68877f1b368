package com.minicall.calling.command;

import com.minicall.calling.peek.PeekCoordinator;
import com.minicall.calling.service.CallingService;
import com.minicall.calling.store.CallingEffect;
import com.minicall.config.PeekProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 执行状态迁移返回的副作用。只在 store 锁外调用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallingEffectRunner {

    private final PeekCoordinator peekCoordinator;
    private final CallingService callingService;
    private final PeekProperties peekProps;

    public void run(List<CallingEffect> effects) {
        if (effects == null || effects.isEmpty()) {
            return;
        }
        for (CallingEffect effect : effects) {
            try {
                runOne(effect);
            } catch (RuntimeException e) {
                log.error("calling effect failed: effect={}, cause={}", effect, e.toString());
            }
        }
    }

    private void runOne(CallingEffect effect) {
        if (effect instanceof CallingEffect.PeekAfterHangUp e) {
            long delayMs = peekProps == null ? 1000 : peekProps.afterHangUpDelayMsEffective();
            peekCoordinator.requestPeekAfter(e.conversationId(), delayMs);
            return;
        }
        if (effect instanceof CallingEffect.StopCallingLobby e) {
            callingService.stopCallingLobby(e.conversationId());
            return;
        }
        log.warn("calling effect ignored: unknown effect {}", effect);
    }
}
