package com.papertrade.simulation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.papertrade.domain.enums.PositionSide;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

public class OutcomeScheduler {

	private static final Logger LOGGER = LoggerFactory.getLogger(OutcomeScheduler.class);
	private static final int PRICE_SCALE = 8;

	private final Scheduler scheduler;
	private final Random random;
	private final BigDecimal exitPriceDeviation;
	private final Map<String, Disposable> pending = new ConcurrentHashMap<>();

	public OutcomeScheduler(Scheduler scheduler, Random random, BigDecimal exitPriceDeviation) {
		this.scheduler = scheduler;
		this.random = random;
		this.exitPriceDeviation = exitPriceDeviation;
	}

	public Duration scheduleClose(String positionId, BigDecimal entryPrice, PositionSide side, BigDecimal amount,
			Duration minDelay, Duration maxDelay, PositionCloser closer) {
		Duration delay = drawDelay(minDelay, maxDelay);
		Disposable.Swap timer = Disposables.swap();
		Disposable previous = pending.put(positionId, timer);
		if (previous != null) {
			previous.dispose();
			LOGGER.warn("EVENT=SCHEDULED_CLOSE_REPLACED positionId={}", positionId);
		}
		timer.update(Mono.delay(delay, scheduler)
				.subscribe(
						ignored -> fire(positionId, timer, entryPrice, side, amount, closer),
						ex -> {
							pending.remove(positionId, timer);
							LOGGER.error("EVENT=SCHEDULED_CLOSE_TIMER_ERROR positionId={} message={}", positionId,
									ex.getMessage(), ex);
						}));
		LOGGER.debug("EVENT=SCHEDULED_CLOSE positionId={} side={} amount={} delayMs={}", positionId, side, amount,
				delay.toMillis());
		return delay;
	}

	public boolean cancel(String positionId) {
		Disposable timer = pending.remove(positionId);
		if (timer == null) {
			return false;
		}
		timer.dispose();
		LOGGER.debug("EVENT=SCHEDULED_CLOSE_CANCELLED positionId={}", positionId);
		return true;
	}

	public boolean isPending(String positionId) {
		return pending.containsKey(positionId);
	}

	public int pendingCount() {
		return pending.size();
	}

	public void shutdown() {
		int outstanding = pending.size();
		pending.values().forEach(Disposable::dispose);
		pending.clear();
		if (outstanding > 0) {
			LOGGER.info("EVENT=SCHEDULED_CLOSE_SHUTDOWN outstanding={}", outstanding);
		}
	}

	Duration drawDelay(Duration minDelay, Duration maxDelay) {
		long min = minDelay.toMillis();
		long span = Math.max(0L, maxDelay.toMillis() - min);
		return Duration.ofMillis(min + Math.round(random.nextDouble() * span));
	}

	BigDecimal syntheticExitPrice(BigDecimal entryPrice) {
		double deviation = exitPriceDeviation.doubleValue();
		double factor = (1.0 - deviation) + random.nextDouble() * (2.0 * deviation);
		return entryPrice.multiply(BigDecimal.valueOf(factor), MathContext.DECIMAL64)
				.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
	}

	private void fire(String positionId, Disposable timer, BigDecimal entryPrice, PositionSide side,
			BigDecimal amount, PositionCloser closer) {
		pending.remove(positionId, timer);
		BigDecimal exitPrice = syntheticExitPrice(entryPrice);
		try {
			closer.close(positionId, exitPrice);
		} catch (UnknownPositionException ex) {
			LOGGER.warn("EVENT=SCHEDULED_CLOSE_DROPPED positionId={} side={} amount={} reason={}", positionId, side,
					amount, ex.getMessage());
		} catch (RuntimeException ex) {
			LOGGER.error("EVENT=SCHEDULED_CLOSE_FAILED positionId={} exitPrice={} message={}", positionId,
					exitPrice, ex.getMessage(), ex);
		}
	}
}
