package com.ryuqq.scheduler.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void calculate_시도_횟수에_따라_지수적으로_증가함() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(2)).isEqualTo(200);
        assertThat(calculator.calculate(3)).isEqualTo(400);
        assertThat(calculator.calculate(5)).isEqualTo(1600);
    }

    @Test
    void calculate_최대_지연_시간을_넘지_않음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 5000, 1.0);

        // when & then
        for (int attempt = 1; attempt <= 100; attempt++) {
            assertThat(calculator.calculate(attempt)).isBetween(100L, 5000L);
        }
    }

    @Test
    void calculate_매우_큰_시도_횟수에도_overflow_없음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 300_000, 0.1);

        // when
        long delay = calculator.calculate(Integer.MAX_VALUE);

        // then
        assertThat(delay).isEqualTo(300_000);
    }

    @Test
    void calculate_jitter는_지수값의_비율_이내임() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 300_000, 0.1);

        // when & then
        for (int i = 0; i < 50; i++) {
            assertThat(calculator.calculate(3)).isBetween(4000L, 4400L);
        }
    }

    @Test
    void delayFor_Duration으로_반환함() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(250, 1000, 0.0);

        // when & then
        assertThat(calculator.delayFor(2)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void 기본_생성자는_재시도_설정_기본값과_같음() {
        // given
        DataStoreRetryConfig config = new DataStoreRetryConfig();
        BackoffCalculator calculator = new BackoffCalculator();

        // then
        assertThat(calculator.getBaseDelayMs()).isEqualTo(config.baseDelayMs());
        assertThat(calculator.getMaxDelayMs()).isEqualTo(config.maxDelayMs());
        assertThat(calculator.getJitterFactor()).isEqualTo(config.jitterFactor());
    }

    @Test
    void 잘못된_파라미터는_거부함() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 1000, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(1000, 999, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs");
        assertThatThrownBy(() -> new BackoffCalculator(100, 1000, 1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor");
        assertThatThrownBy(() -> new BackoffCalculator().calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt");
    }
}
