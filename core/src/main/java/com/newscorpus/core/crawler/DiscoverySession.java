package com.newscorpus.core.crawler;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * discover() 한 번의 가변 상태: 중복 방지 집합 + 결과 목록.
 * 수명은 호출 하나로 한정되며 단일 스레드(발견 루프)만 변경한다.
 */
final class DiscoverySession {

    private final int target;
    private final Set<String> seen = new HashSet<>();
    private final List<URI> result = new ArrayList<>();

    DiscoverySession(int target) {
        this.target = target;
    }

    /** 새 URL이면 추가하고 true. 중복이거나 이미 목표치면 false(목표치 계산에 포함 안 됨) */
    boolean offer(URI url) {
        if (isFull()) return false;
        if (!seen.add(url.toString())) return false;
        result.add(url);
        return true;
    }

    boolean isFull() { return result.size() >= target; }

    int size() { return result.size(); }

    List<URI> result() { return List.copyOf(result); }
}
