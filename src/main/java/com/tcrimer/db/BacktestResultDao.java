package com.tcrimer.db;

import com.tcrimer.db.mybatis.BacktestResultMapper;
import com.tcrimer.db.mybatis.BacktestResultRow;
import com.tcrimer.db.mybatis.MyBatisSupport;
import com.tcrimer.model.BacktestResult;
import com.tcrimer.model.Timeframe;
import com.tcrimer.model.Trade;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONArray;
import org.json.JSONObject;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Completed backtests keyed by {@code (strategyId, symbol, start, end)}.
 */
public final class BacktestResultDao {
    private final DataStore store;

    public BacktestResultDao(DataStore store) {
        this.store = store;
    }

    public void save(BacktestResult result, Map<String, ?> params) throws SQLException {
        BacktestResultRow row = toRow(result, params);
        withMapper(mapper -> mapper.upsert(row));
    }

    public Optional<BacktestResult> find(String strategyId, String symbol, Instant start, Instant end) throws SQLException {
        BacktestResultRow row = withMapper(mapper -> mapper.selectByKey(
                strategyId, symbol, start.toEpochMilli(), end.toEpochMilli()));
        return Optional.ofNullable(row).map(BacktestResultDao::fromRow);
    }

    public List<BacktestResult> recent(String symbol, int limit) throws SQLException {
        List<BacktestResultRow> rows = withMapper(mapper -> mapper.selectRecentBySymbol(symbol, Math.max(1, limit)));
        List<BacktestResult> out = new ArrayList<>(rows.size());
        for (BacktestResultRow row : rows) {
            out.add(fromRow(row));
        }
        return out;
    }

    public int count() throws SQLException {
        return withMapper(BacktestResultMapper::countAll);
    }

    private <T> T withMapper(Function<BacktestResultMapper, T> call) throws SQLException {
        return store.withConnection(conn -> {
            try (SqlSession session = MyBatisSupport.openSession(conn)) {
                T out = call.apply(session.getMapper(BacktestResultMapper.class));
                session.commit();
                return out;
            } catch (PersistenceException e) {
                throw MyBatisSupport.toSqlException(e);
            }
        });
    }

    static BacktestResultRow toRow(BacktestResult result, Map<String, ?> params) {
        JSONArray trades = new JSONArray();
        for (Trade trade : result.getTrades()) {
            JSONObject item = new JSONObject();
            item.put("entry_time", trade.getEntryTime().toEpochMilli());
            item.put("exit_time", trade.getExitTime().toEpochMilli());
            item.put("entry_price", trade.getEntryPrice());
            item.put("exit_price", trade.getExitPrice());
            item.put("pnl", trade.getPnl());
            trades.put(item);
        }
        JSONObject paramsJson = new JSONObject();
        if (params != null) {
            for (Map.Entry<String, ?> entry : new TreeMap<>(params).entrySet()) {
                paramsJson.put(entry.getKey(), entry.getValue());
            }
        }
        return BacktestResultRow.builder()
                .strategyId(result.getStrategyId())
                .symbol(result.getSymbol())
                .startTs(result.getStartTime().toEpochMilli())
                .endTs(result.getEndTime().toEpochMilli())
                .timeframe(result.getTimeframe().code())
                .paramsJson(paramsJson.toString())
                .totalReturn(result.getTotalReturnPct())
                .maxDrawdown(result.getMaxDrawdownPct())
                .sharpeRatio(result.getSharpeRatio())
                .sharpeDefined(result.isSharpeDefined() ? 1 : 0)
                .winRate(result.getWinRatePct())
                .marketReturn(result.getMarketReturnPct())
                .barCount(result.getBarCount())
                .tradeCount(result.getTrades().size())
                .tradesJson(trades.toString())
                .completedAt(result.getCompletedAt().toEpochMilli())
                .build();
    }

    static BacktestResult fromRow(BacktestResultRow row) {
        BacktestResult.BacktestResultBuilder builder = BacktestResult.builder()
                .strategyId(row.getStrategyId())
                .symbol(row.getSymbol())
                .timeframe(Timeframe.fromCode(row.getTimeframe()))
                .startTime(Instant.ofEpochMilli(row.getStartTs()))
                .endTime(Instant.ofEpochMilli(row.getEndTs()))
                .barCount(row.getBarCount() == null ? 0 : row.getBarCount())
                .totalReturnPct(nz(row.getTotalReturn()))
                .maxDrawdownPct(nz(row.getMaxDrawdown()))
                .sharpeRatio(nz(row.getSharpeRatio()))
                .sharpeDefined(row.getSharpeDefined() != null && row.getSharpeDefined() != 0)
                .winRatePct(nz(row.getWinRate()))
                .marketReturnPct(nz(row.getMarketReturn()))
                .completedAt(Instant.ofEpochMilli(row.getCompletedAt()));
        JSONArray trades = new JSONArray(row.getTradesJson() == null ? "[]" : row.getTradesJson());
        for (int i = 0; i < trades.length(); i++) {
            JSONObject item = trades.getJSONObject(i);
            builder.trade(Trade.builder()
                    .entryTime(Instant.ofEpochMilli(item.getLong("entry_time")))
                    .exitTime(Instant.ofEpochMilli(item.getLong("exit_time")))
                    .entryPrice(item.getDouble("entry_price"))
                    .exitPrice(item.getDouble("exit_price"))
                    .pnl(item.getDouble("pnl"))
                    .build());
        }
        return builder.build();
    }

    private static double nz(Double value) {
        return value == null ? 0.0 : value;
    }
}
