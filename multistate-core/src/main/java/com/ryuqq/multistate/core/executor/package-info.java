/**
 * Transition Executor - phased, partial-failure-aware transition execution.
 *
 * <p>이 패키지는 하나의 Transition을 단계 순서대로 실행하고, 호출자가 반영할
 * 변화량(delta)을 구조화된 결과로 반환합니다.</p>
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multistate.core.executor.TransitionExecutor} - 단계별 실행기</li>
 *   <li>{@link com.ryuqq.multistate.core.executor.SuccessPolicy} - INCOMING 판정 정책</li>
 *   <li>{@link com.ryuqq.multistate.core.executor.ExecutorConfig} - 실행기 설정</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>Caller-owned state:</strong> 활성 집합은 호출자가 소유하며, 실행기는 사본만 다룸</li>
 *   <li><strong>Rollback by omission:</strong> 실패한 결과는 반영하지 않는 것으로 롤백</li>
 *   <li><strong>Total function:</strong> execute()는 동작 실패를 예외로 던지지 않음</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
package com.ryuqq.multistate.core.executor;
