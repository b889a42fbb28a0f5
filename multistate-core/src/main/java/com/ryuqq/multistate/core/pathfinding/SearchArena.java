package com.ryuqq.multistate.core.pathfinding;

import com.ryuqq.multistate.core.model.State;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 탐색 노드 저장소.
 *
 * <p>노드는 생성 순서대로 번호가 매겨지고, 부모는 참조가 아닌 번호로 가리킵니다.
 * 한 번의 탐색 호출 안에서만 사용됩니다.</p>
 */
final class SearchArena {

    static final int NO_PARENT = -1;

    private final List<Node> nodes = new ArrayList<>();

    int add(Set<State> active, long reached, int parent, int transitionIndex, double cost) {
        int depth = parent == NO_PARENT ? 0 : nodes.get(parent).depth() + 1;
        nodes.add(new Node(active, reached, parent, transitionIndex, cost, depth));
        return nodes.size() - 1;
    }

    Node get(int index) {
        return nodes.get(index);
    }

    int size() {
        return nodes.size();
    }

    /**
     * 시작 노드부터 주어진 노드까지의 경로 (시작 노드가 첫 번째).
     */
    List<Node> chainTo(int index) {
        List<Node> chain = new ArrayList<>(nodes.get(index).depth() + 1);
        int cursor = index;
        while (cursor != NO_PARENT) {
            Node node = nodes.get(cursor);
            chain.add(node);
            cursor = node.parent();
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * 탐색 노드.
     *
     * @param active 활성 State 집합 (불변)
     * @param reached 방문한 목표 비트마스크
     * @param parent 부모 노드 번호 (시작 노드는 {@link #NO_PARENT})
     * @param transitionIndex 부모에서 이 노드로 온 전이 번호 (시작 노드는 -1)
     * @param cost 시작 노드부터의 누적 비용
     * @param depth 시작 노드부터의 전이 개수
     */
    record Node(Set<State> active, long reached, int parent, int transitionIndex, double cost, int depth) {

        Key key() {
            return new Key(active, reached);
        }
    }

    /**
     * 중복 판정 키. 지나온 경로가 아닌 (구성, 방문 목표)로만 동일성을 판단합니다.
     */
    record Key(Set<State> active, long reached) {
    }
}
