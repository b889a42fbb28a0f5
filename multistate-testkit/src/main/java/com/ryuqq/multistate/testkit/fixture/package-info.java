/**
 * 테스트용 State 그래프 시나리오와 무작위 그래프 생성기.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
package com.ryuqq.multistate.testkit.fixture;
