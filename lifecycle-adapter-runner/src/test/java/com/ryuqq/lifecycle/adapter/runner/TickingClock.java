package com.ryuqq.lifecycle.adapter.runner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 호출할 때마다 1초씩 전진하는 테스트용 시계.
 *
 * <p>레코드마다 서로 다른 createdAt을 갖도록 하여 이력 순서를 결정적으로 만듭니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TickingClock extends Clock {

    private static final Duration TICK = Duration.ofSeconds(1);

    private final AtomicReference<Instant> now;

    TickingClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now.getAndUpdate(current -> current.plus(TICK));
    }
}
