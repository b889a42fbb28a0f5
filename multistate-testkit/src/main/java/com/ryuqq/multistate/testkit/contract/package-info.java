/**
 * Contract Test 기반 클래스와 테스트용 SPI 구현.
 *
 * <p>다른 모듈의 테스트가 {@link com.ryuqq.multistate.testkit.contract.AbstractMultiStateContractTest}를
 * 상속해 같은 계약을 검증합니다.</p>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
package com.ryuqq.multistate.testkit.contract;
