package com.ryuqq.multistate.testkit.oracle;

/**
 * 전수 탐색 결과.
 *
 * @param found 깊이 제한 안에서 모든 목표를 방문하는 경로가 있는지 여부
 * @param minCost 최소 비용 (found=false이면 {@link Double#POSITIVE_INFINITY})
 * @param minSteps 최소 단계 수 (found=false이면 {@link Integer#MAX_VALUE})
 * @param visitedPaths 확인한 경로 수
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record OracleResult(boolean found, double minCost, int minSteps, long visitedPaths) {

    static OracleResult none(long visitedPaths) {
        return new OracleResult(false, Double.POSITIVE_INFINITY, Integer.MAX_VALUE, visitedPaths);
    }
}
