package org.scriptonbasestar.echocache.core.util;

import lombok.experimental.UtilityClass;

import java.util.concurrent.ThreadLocalRandom;

/**
 * dedup 라운드와 refresh lock 소유자를 구분하는 요청 식별자 생성기.
 * 첫 글자는 항상 영문자입니다.
 *
 * @since 2025-01
 */
@UtilityClass
public class RequestIds {

	public static final int DEFAULT_LENGTH = 10;

	private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
	private static final String ALPHANUMERIC = LETTERS + "0123456789";

	public static String next() {
		return next(DEFAULT_LENGTH);
	}

	/**
	 * @param length 식별자 길이, 1 이상
	 * @throws IllegalArgumentException length 가 1 미만인 경우
	 */
	public static String next(int length) {
		if (length < 1) {
			throw new IllegalArgumentException("length must be at least 1");
		}
		ThreadLocalRandom random = ThreadLocalRandom.current();
		StringBuilder sb = new StringBuilder(length);
		sb.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
		for (int i = 1; i < length; i++) {
			sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
		}
		return sb.toString();
	}
}
