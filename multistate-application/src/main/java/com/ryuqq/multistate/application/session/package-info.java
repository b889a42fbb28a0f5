/**
 * State Session - 활성 State 집합의 소유와 반영(commit).
 *
 * <p>Core의 Executor와 PathFinder는 상태를 갖지 않으므로, 실제 활성 집합을 들고
 * 실행 결과를 반영하는 역할은 이 계층이 맡습니다.</p>
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multistate.application.session.StateSession} - 세션별 잠금으로 보호되는 활성 집합</li>
 *   <li>{@link com.ryuqq.multistate.application.session.NavigationResult} - 계획 + 실행 결과</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
package com.ryuqq.multistate.application.session;
