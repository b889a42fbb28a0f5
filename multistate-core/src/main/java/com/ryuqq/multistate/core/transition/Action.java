package com.ryuqq.multistate.core.transition;

/**
 * 전이 단계에서 실행되는 인자 없는 동작.
 *
 * <p>{@code false}를 반환하거나 예외를 던지면 실패로 간주합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Action outgoing = () -> loginForm.submit();          // boolean 반환
 * Action incoming = Action.of(() -> editor.focus());   // void 본문, 항상 성공
 * }</pre>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Action {

    /**
     * 동작 실행.
     *
     * @return 성공 여부
     * @throws Exception 실행 중 오류 (실패로 기록됨)
     */
    boolean execute() throws Exception;

    /**
     * void 본문을 항상 성공하는 Action으로 변환.
     *
     * @param body 실행할 본문
     * @return 예외가 없으면 true를 반환하는 Action
     * @throws IllegalArgumentException body가 null인 경우
     */
    static Action of(Runnable body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return () -> {
            body.run();
            return true;
        };
    }
}
