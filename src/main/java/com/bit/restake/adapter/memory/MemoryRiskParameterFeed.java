package com.bit.restake.adapter.memory;

import com.bit.restake.risk.PauseFlag;
import com.bit.restake.risk.RiskParameterFeed;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

@Component
public class MemoryRiskParameterFeed implements RiskParameterFeed {

    private final Set<PauseFlag> paused = EnumSet.noneOf(PauseFlag.class);
    private volatile Duration cooldownOverride = Duration.ZERO;

    @Override
    public synchronized boolean isPaused(PauseFlag flag) {
        return paused.contains(flag);
    }

    public synchronized void setPaused(PauseFlag flag, boolean value) {
        if (value) {
            paused.add(flag);
        } else {
            paused.remove(flag);
        }
    }

    @Override
    public Duration cooldownOverride() {
        return cooldownOverride;
    }

    public void setCooldownOverride(Duration cooldownOverride) {
        this.cooldownOverride = cooldownOverride == null ? Duration.ZERO : cooldownOverride;
    }
}
