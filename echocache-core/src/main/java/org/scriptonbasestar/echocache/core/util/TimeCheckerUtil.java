package org.scriptonbasestar.echocache.core.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * 신선도(freshness) 와 잠금 나이 계산.
 *
 * @since 2025-01
 */
@Slf4j
@UtilityClass
public class TimeCheckerUtil {

	/**
	 * 사실상 만료되지 않는 기간 (100년)
	 */
	public static final Duration NEVER_EXPIRE = Duration.ofDays(365L * 100);

	/**
	 * {@code createdAt + window} 가 아직 현재 시각 이후인지 확인합니다.
	 *
	 * @param createdAt 값 생성 시각
	 * @param window 신선도 유지 기간
	 * @param clock 기준 시계
	 * @return window 이내면 true (fresh), 지났으면 false (stale)
	 */
	public static boolean isFresh(Instant createdAt, Duration window, Clock clock) {
		Instant now = clock.instant();
		Instant freshUntil = plusSaturated(createdAt, window);

		if (log.isTraceEnabled()) {
			log.trace("isFresh param - createdAt : {}, window : {}", createdAt, window);
			log.trace("isFresh 비교 - now : {}, freshUntil : {}", now, freshUntil);
		}

		return !freshUntil.isBefore(now);
	}

	/**
	 * 기록 시각으로부터 ttl 보다 오래 지났는지 확인합니다.
	 *
	 * @param recordedAt 기록 시각
	 * @param ttl 허용 기간
	 * @param clock 기준 시계
	 * @return ttl 을 초과했으면 true
	 */
	public static boolean isOlderThan(Instant recordedAt, Duration ttl, Clock clock) {
		return Duration.between(recordedAt, clock.instant()).compareTo(ttl) > 0;
	}

	private static Instant plusSaturated(Instant instant, Duration duration) {
		try {
			return instant.plus(duration);
		} catch (ArithmeticException | DateTimeException e) {
			return Instant.MAX;
		}
	}
}
