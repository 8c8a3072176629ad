package com.trafficlens.reporting.core.date;

import com.trafficlens.reporting.core.exception.InvalidDateRangeException;
import com.trafficlens.reporting.core.model.DateRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;

/**
 * 日期预设 / 保存视图解析
 * "今天"取注入时钟在规范时区下的日期；周从周一开始，跨年时按自然日计算
 * （例如 2026-01-01 所在周为 2025-12-29 ~ 2026-01-04），不使用 ISO 周编号。
 */
@ApplicationScoped
public class DateRangeResolver {

    @Inject
    Clock clock;

    DateRangeResolver() {
    }

    public DateRangeResolver(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public DateRange resolvePreset(DatePreset preset) {
        return resolvePreset(preset, today());
    }

    static DateRange resolvePreset(DatePreset preset, LocalDate today) {
        return switch (preset) {
            case TODAY -> DateRange.singleDay(today);
            case YESTERDAY -> DateRange.singleDay(today.minusDays(1));
            case LAST_7_DAYS -> lastDays(today, 7);
            case LAST_14_DAYS -> lastDays(today, 14);
            case LAST_30_DAYS -> lastDays(today, 30);
            case LAST_90_DAYS -> lastDays(today, 90);
            case THIS_WEEK -> DateRange.of(weekStart(today), today);
            case LAST_WEEK -> {
                LocalDate start = weekStart(today).minusWeeks(1);
                yield DateRange.of(start, start.plusDays(6));
            }
            case THIS_MONTH -> DateRange.of(today.withDayOfMonth(1), today);
            case LAST_MONTH -> {
                LocalDate firstOfThisMonth = today.withDayOfMonth(1);
                // 本月第 0 天 = 上月最后一天
                yield DateRange.of(firstOfThisMonth.minusMonths(1), firstOfThisMonth.minusDays(1));
            }
        };
    }

    /**
     * 反查预设：按声明顺序返回第一个解析结果与给定范围完全相同的预设
     */
    public Optional<DatePreset> detectPreset(LocalDate start, LocalDate end) {
        return detectPreset(start, end, today());
    }

    static Optional<DatePreset> detectPreset(LocalDate start, LocalDate end, LocalDate today) {
        for (DatePreset preset : DatePreset.values()) {
            DateRange resolved = resolvePreset(preset, today);
            if (resolved.start().equals(start) && resolved.end().equals(end)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }

    public ResolvedViewParams resolveView(SavedView view) {
        return new ResolvedViewParams(view.reportType(), resolveDateRange(view), view.dimensions(), view.filters(),
                view.sortBy(), view.sortDirection());
    }

    /**
     * 相对视图在解析时计算日期，绝不使用保存时的日期
     */
    public DateRange resolveDateRange(SavedView view) {
        DateMode mode = view.dateMode() == null ? DateMode.NONE : view.dateMode();
        return switch (mode) {
            case NONE -> DateRange.singleDay(today());
            case RELATIVE -> {
                if (view.datePreset() == null) {
                    throw new InvalidDateRangeException("Relative saved view has no date preset");
                }
                yield resolvePreset(view.datePreset());
            }
            case ABSOLUTE -> DateRange.of(view.dateStart(), view.dateEnd());
        };
    }

    private static DateRange lastDays(LocalDate today, int days) {
        return DateRange.of(today.minusDays(days - 1L), today);
    }

    private static LocalDate weekStart(LocalDate day) {
        return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
