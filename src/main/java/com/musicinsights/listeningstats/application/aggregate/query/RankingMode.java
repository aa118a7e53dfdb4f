package com.musicinsights.listeningstats.application.aggregate.query;

/**
 * 집계 결과 랭킹 방식.
 */
public enum RankingMode {
    /** 요청한 차원 조합 전체를 재생 시간 순으로 나열 */
    PLAIN,
    /** 첫 번째(primary) 차원 값마다 재생 시간이 가장 긴 조합 1건만 남김 */
    TOP_PER_PRIMARY_GROUP;

    public static RankingMode of(boolean topPerGroup) {
        return topPerGroup ? TOP_PER_PRIMARY_GROUP : PLAIN;
    }
}
