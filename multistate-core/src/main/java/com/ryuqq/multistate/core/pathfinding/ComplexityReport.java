package com.ryuqq.multistate.core.pathfinding;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 탐색 공간 크기 보고서 (모니터링 전용, 탐색에 사용되지 않음).
 *
 * @param numStates 선언된 State 수 (n)
 * @param numTargets 목표 수 (k)
 * @param stateConfigurations 가능한 활성 구성 수 (2^n)
 * @param targetProgressConfigurations 가능한 목표 진행 상태 수 (2^k)
 * @param totalSearchSpace 전체 탐색 공간 (2^n × 2^k)
 * @param complexityClass 복잡도 표기
 * @param comparisonToSingle 단일 목표 탐색과의 비교
 * @param exponentialInTargets 목표 수에 대해 지수적인지 여부
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public record ComplexityReport(
    int numStates,
    int numTargets,
    BigInteger stateConfigurations,
    BigInteger targetProgressConfigurations,
    BigInteger totalSearchSpace,
    String complexityClass,
    String comparisonToSingle,
    boolean exponentialInTargets
) {

    /**
     * 디버깅/로깅용 Map 변환.
     *
     * @return 보고서 필드를 담은 Map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("state_configurations", stateConfigurations);
        map.put("target_progress_configurations", targetProgressConfigurations);
        map.put("total_search_space", totalSearchSpace);
        map.put("complexity_class", complexityClass);
        map.put("comparison_to_single", comparisonToSingle);
        map.put("exponential_in_targets", exponentialInTargets);
        return map;
    }
}
