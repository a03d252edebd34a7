package org.scriptonbasestar.echocache.core.refresh;

/**
 * 캐시 미스 또는 갱신 시 값을 계산하는 함수.
 *
 * <p>엔진은 같은 키에 대해 동시에 한 번만 호출합니다. 구현체는 {@link RefreshContext} 의 취소/만료를
 * 주기적으로 확인해야 하며, 취소되면 가능한 빨리 예외로 종료해야 합니다.</p>
 *
 * <pre>{@code
 * RefreshFunction<User> fn = ctx -> {
 *     ctx.throwIfCancelled();
 *     return userRepository.findById(id);
 * };
 * }</pre>
 *
 * @param <T> 계산 결과 타입
 * @since 2025-01
 */
@FunctionalInterface
public interface RefreshFunction<T> {

	/**
	 * @param ctx 취소/타임아웃 컨텍스트
	 * @return 계산된 값 (null 이면 반환은 되지만 캐시에 저장되지 않음)
	 * @throws Exception 계산 실패 시. 캐시되지 않고 같은 라운드의 모든 호출자에게 전달됩니다
	 */
	T compute(RefreshContext ctx) throws Exception;
}
