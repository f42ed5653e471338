package com.optionsvalidator.unit.core.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.optionsvalidator.core.processor.OptionPricer;
import com.optionsvalidator.domain.enums.OptionType;
import com.optionsvalidator.domain.model.OptionQuote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OptionPricer: closed-form values, put-call parity, the expiry boundary,
 * and moneyness ordering.
 */
class OptionPricerTest {

    private OptionPricer pricer;

    @BeforeEach
    void setUp() {
        pricer = new OptionPricer();
    }

    @Nested
    @DisplayName("Closed-form valuation")
    class ClosedForm {

        @Test
        @DisplayName("Matches the textbook value for S=K=100, T=1, r=5%, vol=20%")
        void textbookCall() {
            OptionQuote call = pricer.price(100, 100, 1.0, 0.05, 0.20, OptionType.CALL);

            assertThat(call.getPrice()).isCloseTo(10.4506, within(1e-3));
            assertThat(call.getDelta()).isCloseTo(0.6368, within(1e-3));
        }

        @Test
        @DisplayName("Put-call parity holds without dividends")
        void putCallParity() {
            double spot = 100;
            double strike = 105;
            double t = 0.5;
            double r = 0.04;

            OptionQuote call = pricer.price(spot, strike, t, r, 0.25, OptionType.CALL);
            OptionQuote put = pricer.price(spot, strike, t, r, 0.25, OptionType.PUT);

            assertThat(call.getPrice() - put.getPrice()).isCloseTo(spot - strike * Math.exp(-r * t), within(1e-9));
        }

        @Test
        @DisplayName("Put-call parity holds with a continuous dividend yield")
        void putCallParityWithDividend() {
            double q = 0.02;
            OptionQuote call = pricer.price(250, 240, 0.75, 0.03, 0.3, OptionType.CALL, q);
            OptionQuote put = pricer.price(250, 240, 0.75, 0.03, 0.3, OptionType.PUT, q);

            double expected = 250 * Math.exp(-q * 0.75) - 240 * Math.exp(-0.03 * 0.75);
            assertThat(call.getPrice() - put.getPrice()).isCloseTo(expected, within(1e-9));
        }

        @Test
        @DisplayName("Theta is a daily decay and vega is per volatility point")
        void greekUnits() {
            OptionQuote call = pricer.price(100, 100, 30 / 365.0, 0.04, 0.20, OptionType.CALL);

            assertThat(call.getTheta()).isNegative().isGreaterThan(-0.2);
            OptionQuote bumped = pricer.price(100, 100, 30 / 365.0, 0.04, 0.21, OptionType.CALL);
            assertThat(bumped.getPrice() - call.getPrice()).isCloseTo(call.getVega(), within(1e-3));
        }
    }

    @Nested
    @DisplayName("Expiry boundary")
    class Expiry {

        @Test
        @DisplayName("In-the-money call at expiry is worth intrinsic value with delta 1")
        void itmCallAtExpiry() {
            OptionQuote call = pricer.price(105, 100, 0.0, 0.04, 0.2, OptionType.CALL);

            assertThat(call.getPrice()).isEqualTo(5.0);
            assertThat(call.getDelta()).isEqualTo(1.0);
            assertThat(call.getGamma()).isZero();
            assertThat(call.getTheta()).isZero();
            assertThat(call.getVega()).isZero();
            assertThat(call.getRho()).isZero();
        }

        @Test
        @DisplayName("In-the-money put at expiry has delta -1, out-of-the-money call is worthless")
        void putAndOtmCallAtExpiry() {
            OptionQuote put = pricer.price(95, 100, 0.0, 0.04, 0.2, OptionType.PUT);
            OptionQuote otmCall = pricer.price(95, 100, -0.01, 0.04, 0.2, OptionType.CALL);

            assertThat(put.getPrice()).isEqualTo(5.0);
            assertThat(put.getDelta()).isEqualTo(-1.0);
            assertThat(otmCall.getPrice()).isZero();
            assertThat(otmCall.getDelta()).isZero();
        }

        @Test
        @DisplayName("Zero volatility is accepted at expiry")
        void zeroVolAtExpiry() {
            assertThat(pricer.price(100, 90, 0.0, 0.04, 0.0, OptionType.CALL).getPrice()).isEqualTo(10.0);
        }
    }

    @Nested
    @DisplayName("Moneyness and inputs")
    class Moneyness {

        @Test
        @DisplayName("Out-of-the-money call is cheaper and has lower delta than at-the-money")
        void otmBelowAtm() {
            OptionQuote atm = pricer.price(100, 100, 0.25, 0.04, 0.2, OptionType.CALL);
            OptionQuote otm = pricer.price(100, 110, 0.25, 0.04, 0.2, OptionType.CALL);

            assertThat(otm.getPrice()).isLessThan(atm.getPrice());
            assertThat(otm.getDelta()).isLessThan(atm.getDelta());
        }

        @Test
        @DisplayName("Non-positive spot or pre-expiry volatility is rejected")
        void rejectsInvalidInputs() {
            assertThatThrownBy(() -> pricer.price(0, 100, 0.5, 0.04, 0.2, OptionType.CALL))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> pricer.price(100, 100, 0.5, 0.04, 0.0, OptionType.PUT))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Implied volatility estimate is a 20% premium over historical by default")
        void impliedFromHistorical() {
            assertThat(pricer.impliedVolFromHistorical(0.20)).isCloseTo(0.24, within(1e-12));
            assertThat(pricer.impliedVolFromHistorical(0.20, 1.5)).isCloseTo(0.30, within(1e-12));
        }
    }
}
