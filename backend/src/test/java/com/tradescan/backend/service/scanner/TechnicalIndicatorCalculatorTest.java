package com.tradescan.backend.service.scanner;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TechnicalIndicatorCalculatorTest {

    private final TechnicalIndicatorCalculator calculator = new TechnicalIndicatorCalculator();

    @Test
    void rsiIsHundredWithoutLosses() {
        assertThat(calculator.rsi(series(100, 1, 15), 14)).isEqualTo(100.0);
    }

    @Test
    void rsiBalancesEqualGainsAndLosses() {
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            closes.add(i % 2 == 0 ? 10.0 : 11.0);
        }
        assertThat(calculator.rsi(closes, 14)).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void rsiNeedsOneMoreCloseThanItsPeriod() {
        assertThat(calculator.rsi(series(100, 1, 14), 14)).isNull();
    }

    @Test
    void smaAveragesTheMostRecentCloses() {
        List<Double> closes = series(1, 1, 25);

        assertThat(calculator.sma(closes, 20)).isCloseTo(15.5, within(1e-9));
        assertThat(calculator.sma(closes, 50)).isNull();
    }

    @Test
    void macdSignalFollowsTrendDirection() {
        TechnicalSnapshot rising = calculator.calculate(series(50, 1, 40));
        TechnicalSnapshot falling = calculator.calculate(series(90, -1, 40));

        assertThat(rising.macd()).isPositive();
        assertThat(rising.macdSignal()).isEqualTo("bullish");
        assertThat(falling.macd()).isNegative();
        assertThat(falling.macdSignal()).isEqualTo("bearish");
        assertThat(rising.sma200()).isNull();
    }

    @Test
    void shortHistoryLeavesMacdUnset() {
        TechnicalSnapshot snapshot = calculator.calculate(series(50, 1, 25));

        assertThat(snapshot.macd()).isNull();
        assertThat(snapshot.macdSignal()).isNull();
        assertThat(snapshot.sma20()).isNotNull();
    }

    private static List<Double> series(double start, double step, int count) {
        List<Double> closes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            closes.add(start + step * i);
        }
        return closes;
    }
}
