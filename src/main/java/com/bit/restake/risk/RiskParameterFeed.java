package com.bit.restake.risk;

import java.time.Duration;

/**
 * 风控参数源（外部协作方）：独立于本地暂停开关的动态暂停与冷却期延长
 */
public interface RiskParameterFeed {

    boolean isPaused(PauseFlag flag);

    /**
     * 冷却期覆盖值，只能延长本地默认值，不能缩短
     * @return 覆盖时长，未设置时返回 {@link Duration#ZERO}
     */
    Duration cooldownOverride();
}
