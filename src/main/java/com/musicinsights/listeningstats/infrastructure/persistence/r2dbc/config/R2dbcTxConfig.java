package com.musicinsights.listeningstats.infrastructure.persistence.r2dbc.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * 적재 배치를 하나의 Reactive 트랜잭션으로 묶기 위한 설정.
 * <p>
 * 조회 경로(집계/카탈로그)는 단일 SELECT 이므로 트랜잭션을 쓰지 않는다.
 */
@Configuration
public class R2dbcTxConfig {

    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory connectionFactory) {
        return new R2dbcTransactionManager(connectionFactory);
    }

    /**
     * @param transactionManager Reactive 트랜잭션 매니저
     * @return 배치 적재 서비스가 사용하는 operator
     */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }
}
