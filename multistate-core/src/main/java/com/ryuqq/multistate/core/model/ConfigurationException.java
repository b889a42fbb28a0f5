package com.ryuqq.multistate.core.model;

/**
 * 구성 단계에서 발견된 설정 오류.
 *
 * <p>중복 id 등록, 하나의 State를 두 개의 그룹에 넣으려는 시도 등
 * 등록 시점에 검출되는 충돌을 나타냅니다. 실행({@code execute}) 또는
 * 경로 탐색 도중에는 발생하지 않습니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    /**
     * 메시지로 예외 생성.
     *
     * @param message 오류 메시지
     */
    public ConfigurationException(String message) {
        super(message);
    }
}
