package com.example.ctdose.util.date;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class AgeCalculatorTest {

    private final AgeCalculator calculator = new AgeCalculator();

    @Test
    void shouldNotCountBirthdayThatHasNotHappenedYet() {
        assertThat(calculator.age("Jul 1, 1997", "May 5, 2025")).hasValue(27);
    }

    @Test
    void shouldCountBirthdayOnTheSameDay() {
        assertThat(calculator.age("Jan 1, 2000", "Jan 1, 2025")).hasValue(25);
    }

    @Test
    void shouldIgnoreTrailingTime() {
        assertThat(calculator.age("Jul 1, 1997", "May 5, 2025 10:32:11 AM")).hasValue(27);
    }

    @Test
    void shouldParseSupportedFormats() {
        assertThat(calculator.parse("July 1, 1997")).contains(LocalDate.of(1997, 7, 1));
        assertThat(calculator.parse("jul 1, 1997")).contains(LocalDate.of(1997, 7, 1));
        assertThat(calculator.parse("1997-07-01")).contains(LocalDate.of(1997, 7, 1));
        assertThat(calculator.parse("1997/07/01")).contains(LocalDate.of(1997, 7, 1));
        assertThat(calculator.parse("19970701")).contains(LocalDate.of(1997, 7, 1));
        assertThat(calculator.parse("01/07/1997")).contains(LocalDate.of(1997, 7, 1));
        assertThat(calculator.parse("01.07.1997")).contains(LocalDate.of(1997, 7, 1));
        assertThat(calculator.parse("1 Jul 1997")).contains(LocalDate.of(1997, 7, 1));
    }

    @Test
    void shouldComputeAgeForEveryCapturedDateShape() {
        String[][] birthAndStudyDates = {
                {"Jul 1, 1997", "May 5, 2025"},
                {"Jul. 1, 1997", "May 5,2025"},
                {"July 1, 1997", "May 5, 2025"},
                {"1997-07-01", "2025-05-05"},
                {"1997-7-1", "2025-5-5"},
                {"1997/7/1", "2025/5/5"},
                {"1997.7.1", "2025.5.5"},
                {"19970701", "20250505"},
                {"01/07/1997", "05/05/2025"},
                {"1/7/1997", "5/5/2025"},
                {"1.7.1997", "5.5.2025"},
                {"01-07-1997", "05-05-2025"},
                {"1-7-1997", "5-5-2025"},
                {"1 Jul 1997", "5 May 2025"}
        };

        for (String[] dates : birthAndStudyDates) {
            assertThat(calculator.age(dates[0], dates[1])).as(dates[0] + " -> " + dates[1]).hasValue(27);
        }
    }

    @Test
    void shouldRejectImpossibleDatesInShortNumericForms() {
        assertThat(calculator.parse("31/4/2025")).isEmpty();
        assertThat(calculator.parse("2025/13/1")).isEmpty();
        assertThat(calculator.parse("1.7.19970")).isEmpty();
    }

    @Test
    void shouldMixFormatsBetweenBirthAndReference() {
        assertThat(calculator.age("19970701", "2025-07-01")).hasValue(28);
    }

    @Test
    void shouldReturnEmptyForUnparseableOrMissingDates() {
        assertThat(calculator.age("unknown", "May 5, 2025")).isEmpty();
        assertThat(calculator.age("Jul 1, 1997", null)).isEmpty();
        assertThat(calculator.age("  ", "May 5, 2025")).isEmpty();
        assertThat(calculator.parse("Feb 30, 2020")).isEmpty();
        assertThat(calculator.parse("2025-01-011")).isEmpty();
    }

    @Test
    void shouldHandleLeapDayBirthday() {
        assertThat(AgeCalculator.age(LocalDate.of(2000, 2, 29), LocalDate.of(2021, 2, 28))).isEqualTo(20);
        assertThat(AgeCalculator.age(LocalDate.of(2000, 2, 29), LocalDate.of(2021, 3, 1))).isEqualTo(21);
    }
}
