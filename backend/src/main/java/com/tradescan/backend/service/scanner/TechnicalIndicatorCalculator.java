package com.tradescan.backend.service.scanner;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TechnicalIndicatorCalculator {

    static final int RSI_PERIOD = 14;
    static final int MACD_FAST = 12;
    static final int MACD_SLOW = 26;

    public TechnicalSnapshot calculate(List<Double> closes) {
        Double macd = macd(closes);
        String signal = macd == null ? null : (macd > 0 ? "bullish" : "bearish");
        return new TechnicalSnapshot(
                rsi(closes, RSI_PERIOD),
                sma(closes, 20),
                sma(closes, 50),
                sma(closes, 200),
                macd,
                signal
        );
    }

    /**
     * Wilder-smoothed RSI; null until {@code period + 1} closes are available.
     */
    public Double rsi(List<Double> closes, int period) {
        if (closes == null || closes.size() < period + 1) {
            return null;
        }
        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss -= change;
            }
        }
        avgGain /= period;
        avgLoss /= period;
        for (int i = period + 1; i < closes.size(); i++) {
            double change = closes.get(i) - closes.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }
        if (avgLoss == 0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    public Double sma(List<Double> closes, int period) {
        if (closes == null || closes.size() < period) {
            return null;
        }
        double sum = 0;
        for (int i = closes.size() - period; i < closes.size(); i++) {
            sum += closes.get(i);
        }
        return sum / period;
    }

    /**
     * MACD line (fast EMA minus slow EMA) at the latest close.
     */
    public Double macd(List<Double> closes) {
        if (closes == null || closes.size() < MACD_SLOW) {
            return null;
        }
        List<Double> fast = emaSeries(closes, MACD_FAST);
        List<Double> slow = emaSeries(closes, MACD_SLOW);
        return fast.get(fast.size() - 1) - slow.get(slow.size() - 1);
    }

    private List<Double> emaSeries(List<Double> values, int period) {
        List<Double> series = new ArrayList<>(values.size());
        double k = 2.0 / (period + 1);
        double ema = values.get(0);
        series.add(ema);
        for (int i = 1; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            series.add(ema);
        }
        return series;
    }
}
