package com.newscorpus.core.util;

/** 수집 진행 상황 콜백. 수집 스레드에서 호출되므로 오래 걸리는 작업은 하지 않는다. */
@FunctionalInterface
public interface ProgressListener {

    enum Phase {
        /** 시드 순회 중. 전체 수를 아직 모른다 */
        DISCOVER,
        /** 기사 추출 및 저장 */
        EXTRACT,
        /** 종료(취소 포함). done 은 저장된 기사 수 */
        DONE
    }

    /**
     * @param phase 현재 단계
     * @param done  처리한 기사 수
     * @param total 발견된 기사 수(DISCOVER 단계에서는 -1)
     */
    void onProgress(Phase phase, int done, int total);

    /** 0.0~1.0. 전체 수를 모르면 0.0 */
    static double fraction(int done, int total) {
        return (total <= 0) ? 0.0 : Math.min(1.0, (double) done / total);
    }

    ProgressListener NONE = (phase, done, total) -> {};
}
