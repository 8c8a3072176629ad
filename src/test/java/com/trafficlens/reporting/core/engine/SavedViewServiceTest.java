package com.trafficlens.reporting.core.engine;

import com.trafficlens.reporting.core.date.DateMode;
import com.trafficlens.reporting.core.date.DatePreset;
import com.trafficlens.reporting.core.date.DateRangeResolver;
import com.trafficlens.reporting.core.date.ResolvedViewParams;
import com.trafficlens.reporting.core.date.SavedView;
import com.trafficlens.reporting.core.exception.InvalidDateRangeException;
import com.trafficlens.reporting.core.exception.UnknownDimensionException;
import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.FilterOperator;
import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.TableFilter;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.infra.persistence.SavedViewRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * SavedViewService 单元测试
 */
class SavedViewServiceTest {

    private SavedViewService service;
    private SavedViewRepository repository;

    @BeforeEach
    void setUp() {
        repository = mock(SavedViewRepository.class);
        service = new SavedViewService();
        service.repository = repository;
        service.resolver = new DateRangeResolver(Clock.fixed(Instant.parse("2026-02-10T12:00:00Z"), ZoneOffset.UTC));
        service.dimensionRegistry = new DimensionRegistry();
    }

    private static SavedView view(String name, ReportType type, DateMode mode, DatePreset preset,
                                  List<String> dimensions, List<TableFilter> filters) {
        return new SavedView(null, name, type, mode, preset, null, null, dimensions, filters, "cost", null, null, null);
    }

    @Test
    void testCreateValidView() {
        SavedView view = view("weekly", ReportType.MARKETING, DateMode.RELATIVE, DatePreset.LAST_7_DAYS,
                List.of("network", "campaign"), List.of(new TableFilter("network", FilterOperator.EQUALS, "Facebook")));
        SavedView stored = view.withIdentity(7L, "u1", Instant.parse("2026-02-10T12:00:00Z"));
        when(repository.save(view, "u1")).thenReturn(stored);

        assertEquals(stored, service.create(view, "u1"));
    }

    @Test
    void testCreateRejectsInvalidViews() {
        assertThrows(IllegalArgumentException.class, () -> service.create(
                view(" ", ReportType.MARKETING, DateMode.NONE, null, List.of("network"), null), "u1"));
        assertThrows(IllegalArgumentException.class, () -> service.create(
                view("x", null, DateMode.NONE, null, List.of("network"), null), "u1"));
        assertThrows(InvalidDateRangeException.class, () -> service.create(
                view("x", ReportType.MARKETING, DateMode.RELATIVE, null, List.of("network"), null), "u1"));
        assertThrows(InvalidDateRangeException.class, () -> service.create(new SavedView(null, "x",
                ReportType.MARKETING, DateMode.ABSOLUTE, null, LocalDate.of(2026, 2, 5), LocalDate.of(2026, 2, 1),
                List.of("network"), null, null, null, null, null), "u1"));
        assertThrows(UnknownDimensionException.class, () -> service.create(
                view("x", ReportType.DASHBOARD, DateMode.NONE, null, List.of("network"), null), "u1"));
        assertThrows(UnknownDimensionException.class, () -> service.create(
                view("x", ReportType.SESSIONS, DateMode.NONE, null, List.of("entryUrlPath"),
                        List.of(new TableFilter("urlPath", FilterOperator.CONTAINS, "a"))), "u1"));
        verify(repository, never()).save(any(), any());
    }

    @Test
    void testResolveUsesTodayNotSaveDate() {
        SavedView stored = new SavedView(3L, "month", ReportType.DASHBOARD, DateMode.RELATIVE, DatePreset.THIS_MONTH,
                null, null, List.of("country"), null, null, null, "u1", Instant.parse("2025-11-20T00:00:00Z"));
        when(repository.findById(3L, "u1")).thenReturn(Optional.of(stored));
        when(repository.findById(eq(4L), any())).thenReturn(Optional.empty());

        ResolvedViewParams params = service.resolve(3L, "u1").orElseThrow();

        assertEquals(DateRange.of(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 10)), params.dateRange());
        assertEquals(List.of("country"), params.dimensions());
        assertTrue(service.resolve(4L, "u1").isEmpty());
    }
}
