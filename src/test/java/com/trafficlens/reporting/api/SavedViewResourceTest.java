package com.trafficlens.reporting.api;

import com.trafficlens.reporting.core.date.DateMode;
import com.trafficlens.reporting.core.date.DatePreset;
import com.trafficlens.reporting.core.date.SavedView;
import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.infra.persistence.SavedViewRepository;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * SavedViewResource 接口测试
 */
@QuarkusTest
class SavedViewResourceTest {

    @InjectMock
    SavedViewRepository repository;

    private static SavedView stored() {
        return new SavedView(11L, "Weekly networks", ReportType.MARKETING, DateMode.RELATIVE, DatePreset.LAST_7_DAYS,
                null, null, List.of("network", "campaign"), List.of(), "cost", SortDirection.DESC, "u1",
                Instant.parse("2026-02-01T09:00:00Z"));
    }

    @Test
    void testCreate() {
        when(repository.save(any(SavedView.class), eq("u1"))).thenReturn(stored());

        given()
                .contentType(ContentType.JSON)
                .header("X-User-Id", "u1")
                .body("""
                        {"name":"Weekly networks","reportType":"MARKETING","dateMode":"relative",
                         "datePreset":"last7days","dimensions":["network","campaign"],"sortBy":"cost"}""")
                .when()
                .post("/api/v1/saved-views")
                .then()
                .statusCode(201)
                .body("status", equalTo("0000"))
                .body("dataArray[0].id", equalTo(11))
                .body("dataArray[0].datePreset", equalTo("last7days"))
                .body("dataArray[0].dateMode", equalTo("relative"));
    }

    @Test
    void testCreateRejectsUnknownDimension() {
        given()
                .contentType(ContentType.JSON)
                .body("""
                        {"name":"Bad","reportType":"DASHBOARD","dateMode":"none","dimensions":["urlPath"]}""")
                .when()
                .post("/api/v1/saved-views")
                .then()
                .statusCode(400)
                .body("status", equalTo("4000"));
        verify(repository, never()).save(any(), any());
    }

    @Test
    void testListRequiresReport() {
        when(repository.listByReport("u1", ReportType.MARKETING)).thenReturn(List.of(stored()));

        given()
                .header("X-User-Id", "u1")
                .queryParam("report", "MARKETING")
                .when()
                .get("/api/v1/saved-views")
                .then()
                .statusCode(200)
                .body("dataArray", hasSize(1))
                .body("dataArray[0].name", equalTo("Weekly networks"));

        given()
                .when()
                .get("/api/v1/saved-views")
                .then()
                .statusCode(400);
    }

    @Test
    void testResolvedAndNotFound() {
        when(repository.findById(11L, "u1")).thenReturn(Optional.of(stored()));
        when(repository.findById(anyLong(), eq("u2"))).thenReturn(Optional.empty());

        given()
                .header("X-User-Id", "u1")
                .when()
                .get("/api/v1/saved-views/11/resolved")
                .then()
                .statusCode(200)
                .body("dataArray[0].reportType", equalTo("MARKETING"))
                .body("dataArray[0].dateRange.start", notNullValue())
                .body("dataArray[0].dimensions", contains("network", "campaign"));

        given()
                .header("X-User-Id", "u2")
                .when()
                .get("/api/v1/saved-views/11")
                .then()
                .statusCode(404)
                .body("status", equalTo("4000"));
    }
}
