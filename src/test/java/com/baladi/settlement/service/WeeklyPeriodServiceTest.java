package com.baladi.settlement.service;

import com.baladi.settlement.entity.WeeklyPeriod;
import com.baladi.settlement.repository.WeeklyPeriodRepository;
import com.baladi.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WeeklyPeriodServiceTest {

    @Mock
    private WeeklyPeriodRepository periodRepository;

    private WeeklyPeriodService periodService;

    @BeforeEach
    void setUp() {
        periodService = new WeeklyPeriodService(periodRepository, Fixtures.fixedClock(), Fixtures.properties());
    }

    private static WeeklyPeriod currentPeriod() {
        return WeeklyPeriod.builder()
                .year(2024)
                .weekNumber(2)
                .startsAt(Fixtures.WEEK_START)
                .endsAt(Fixtures.NEXT_WEEK_START.minusSeconds(1))
                .build();
    }

    @Test
    @DisplayName("the current week is opened when no period is active")
    void opensCurrentWeek() {
        given(periodRepository.findFirstByStatusOrderByStartsAtAsc(any())).willReturn(Optional.empty());
        given(periodRepository.findByYearAndWeekNumber(2024, 2)).willReturn(Optional.empty());
        given(periodRepository.save(any(WeeklyPeriod.class))).willAnswer(invocation -> invocation.getArgument(0));

        WeeklyPeriod period = periodService.ensureActivePeriod();

        assertThat(period.isActive()).isTrue();
        assertThat(period.getStartsAt()).isEqualTo(Fixtures.WEEK_START);
        assertThat(period.getEndsAt()).isEqualTo(Fixtures.NEXT_WEEK_START.minusSeconds(1));
        assertThat(period.windowEnd()).isEqualTo(Fixtures.NEXT_WEEK_START);
    }

    @Test
    @DisplayName("once the current week is closed the following week is opened")
    void currentWeekClosed() {
        WeeklyPeriod closed = currentPeriod();
        closed.close(1L, null, Fixtures.NOW);
        given(periodRepository.findFirstByStatusOrderByStartsAtAsc(any())).willReturn(Optional.empty());
        given(periodRepository.findByYearAndWeekNumber(2024, 2)).willReturn(Optional.of(closed));
        given(periodRepository.findByYearAndWeekNumber(2024, 3)).willReturn(Optional.empty());
        given(periodRepository.save(any(WeeklyPeriod.class))).willAnswer(invocation -> invocation.getArgument(0));

        WeeklyPeriod period = periodService.ensureActivePeriod();

        assertThat(period.getWeekNumber()).isEqualTo(3);
        assertThat(period.getStartsAt()).isEqualTo(Fixtures.NEXT_WEEK_START);
    }

    @Test
    @DisplayName("an active period is returned as-is")
    void activeExists() {
        WeeklyPeriod active = currentPeriod();
        given(periodRepository.findFirstByStatusOrderByStartsAtAsc(any())).willReturn(Optional.of(active));

        assertThat(periodService.ensureActivePeriod()).isSameAs(active);
        verify(periodRepository, never()).save(any());
    }

    @Test
    @DisplayName("the following period starts right where the previous one ends")
    void openFollowing() {
        given(periodRepository.findByYearAndWeekNumber(2024, 3)).willReturn(Optional.empty());
        given(periodRepository.save(any(WeeklyPeriod.class))).willAnswer(invocation -> invocation.getArgument(0));

        WeeklyPeriod next = periodService.openFollowing(currentPeriod());

        assertThat(next.getStartsAt()).isEqualTo(Fixtures.NEXT_WEEK_START);
        assertThat(next.getYear()).isEqualTo(2024);
    }
}
