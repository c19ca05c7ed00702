package com.tcrimer.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestResultRow {
    private String strategyId;
    private String symbol;
    private Long startTs;
    private Long endTs;
    private String timeframe;
    private String paramsJson;
    private Double totalReturn;
    private Double maxDrawdown;
    private Double sharpeRatio;
    private Integer sharpeDefined;
    private Double winRate;
    private Double marketReturn;
    private Integer barCount;
    private Integer tradeCount;
    private String tradesJson;
    private Long completedAt;
}
