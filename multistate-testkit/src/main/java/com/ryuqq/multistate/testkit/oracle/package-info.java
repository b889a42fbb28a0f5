/**
 * 경로 탐색 최적성 검증용 전수 탐색기.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
package com.ryuqq.multistate.testkit.oracle;
