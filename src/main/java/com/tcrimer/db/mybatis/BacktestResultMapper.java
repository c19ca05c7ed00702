package com.tcrimer.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface BacktestResultMapper {
    String COLUMNS = "strategy_id, symbol, start_ts, end_ts, timeframe, params_json, total_return, max_drawdown, " +
            "sharpe_ratio, sharpe_defined, win_rate, market_return, bar_count, trade_count, trades_json, completed_at";

    @Insert("INSERT INTO backtest_results(" + COLUMNS + ") " +
            "VALUES(#{strategyId}, #{symbol}, #{startTs}, #{endTs}, #{timeframe}, #{paramsJson}, #{totalReturn}, " +
            "#{maxDrawdown}, #{sharpeRatio}, #{sharpeDefined}, #{winRate}, #{marketReturn}, #{barCount}, " +
            "#{tradeCount}, #{tradesJson}, #{completedAt}) " +
            "ON CONFLICT(strategy_id, symbol, start_ts, end_ts) DO UPDATE SET " +
            "timeframe=excluded.timeframe, params_json=excluded.params_json, total_return=excluded.total_return, " +
            "max_drawdown=excluded.max_drawdown, sharpe_ratio=excluded.sharpe_ratio, " +
            "sharpe_defined=excluded.sharpe_defined, win_rate=excluded.win_rate, " +
            "market_return=excluded.market_return, bar_count=excluded.bar_count, " +
            "trade_count=excluded.trade_count, trades_json=excluded.trades_json, completed_at=excluded.completed_at")
    int upsert(BacktestResultRow row);

    @Select("SELECT " + COLUMNS + " FROM backtest_results " +
            "WHERE strategy_id=#{strategyId} AND symbol=#{symbol} AND start_ts=#{startTs} AND end_ts=#{endTs}")
    BacktestResultRow selectByKey(
            @Param("strategyId") String strategyId,
            @Param("symbol") String symbol,
            @Param("startTs") long startTs,
            @Param("endTs") long endTs
    );

    @Select("SELECT " + COLUMNS + " FROM backtest_results WHERE symbol=#{symbol} " +
            "ORDER BY completed_at DESC LIMIT #{limit}")
    List<BacktestResultRow> selectRecentBySymbol(@Param("symbol") String symbol, @Param("limit") int limit);

    @Select("SELECT " + COLUMNS + " FROM backtest_results WHERE completed_at>=#{since} ORDER BY completed_at ASC")
    List<BacktestResultRow> selectCompletedSince(@Param("since") long since);

    @Select("SELECT COUNT(*) FROM backtest_results")
    int countAll();
}
