/**
 * Multi-target pathfinding - 여러 목표 State를 모두 방문하는 최소 비용 전이 순서 탐색.
 *
 * <p>탐색 상태는 (활성 구성, 방문 목표)이며, 후속 구성은 실행기와 같은
 * activate/exit 집합 연산으로 계산합니다. 어떤 동작도 실행하지 않습니다.</p>
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.multistate.core.pathfinding.MultiTargetPathFinder} - BFS / Dijkstra / A* 탐색기</li>
 *   <li>{@link com.ryuqq.multistate.core.pathfinding.SearchOutcome} - PathFound / PathAbsent / SearchAborted</li>
 *   <li>{@link com.ryuqq.multistate.core.pathfinding.Path} - 탐색 결과 경로</li>
 *   <li>{@link com.ryuqq.multistate.core.pathfinding.PathFinderConfig} - 노드/시간 예산</li>
 *   <li>{@link com.ryuqq.multistate.core.pathfinding.ComplexityEstimator} - 탐색 공간 크기 보고</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
package com.ryuqq.multistate.core.pathfinding;
