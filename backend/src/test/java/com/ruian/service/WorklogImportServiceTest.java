package com.ruian.service;

import com.ruian.dto.request.WorklogEntryRequest;
import com.ruian.dto.response.ImportSummaryResponse;
import com.ruian.entity.EmployeeWorklog;
import com.ruian.entity.EmployeeWorklog.ValidationResult;
import com.ruian.repository.EmployeeWorklogRepository;
import com.ruian.repository.ProductionInfoRepository;
import com.ruian.validation.WorklogValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static com.ruian.validation.ValidationFixtures.WORK_DAY;
import static com.ruian.validation.ValidationFixtures.production;
import static com.ruian.validation.ValidationFixtures.worklog;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WorklogImportService Unit Tests")
class WorklogImportServiceTest {

    @Mock
    private EmployeeWorklogRepository worklogRepository;

    @Mock
    private ProductionInfoRepository productionInfoRepository;

    @Captor
    private ArgumentCaptor<List<EmployeeWorklog>> savedCaptor;

    private WorklogImportService worklogImportService;

    @BeforeEach
    void setUp() {
        worklogImportService = new WorklogImportService(
                worklogRepository, productionInfoRepository, new WorklogValidator(false, "Asia/Shanghai"));
    }

    private WorklogEntryRequest row(String orderNo, String employeeId, Integer quantity) {
        return WorklogEntryRequest.builder()
                .orderNo(orderNo)
                .employeeId(employeeId)
                .employeeName("张三")
                .jobType("钝化")
                .quantity(quantity)
                .performanceFactor(new BigDecimal("1.20"))
                .workDate(WORK_DAY)
                .build();
    }

    @Test
    @DisplayName("importBatch should store passed, duplicate and unmatched rows and reject invalid ones")
    void testImportBatch_MixedBatch() {
        when(productionInfoRepository.findByOrderNoIn(anyCollection()))
                .thenReturn(List.of(production("2516572", "钝化", 500)));
        when(worklogRepository.findByOrderNoInOrderByIdAsc(anyCollection())).thenReturn(List.of());

        ImportSummaryResponse summary = worklogImportService.importBatch(List.of(
                row("2516572", "024", 50),
                row("2516572", "024", 50),
                row("9999999", "024", 50),
                row("2516572", "025", 0)));

        assertEquals(4, summary.getReceived());
        assertEquals(3, summary.getInserted());
        assertEquals(1, summary.getRejected());
        assertEquals(1, summary.getResultCounts().get("通过"));
        assertEquals(1, summary.getResultCounts().get("重复"));
        assertEquals(1, summary.getResultCounts().get("未匹配"));
        assertEquals(4, summary.getRejectedRows().get(0).getRowNumber());
        assertEquals("quantity", summary.getRejectedRows().get(0).getField());

        verify(worklogRepository).saveAll(savedCaptor.capture());
        List<EmployeeWorklog> saved = savedCaptor.getValue();
        assertEquals(3, saved.size());
        assertEquals(ValidationResult.PASSED, saved.get(0).getValidationResult());
        assertEquals(new BigDecimal("60.00"), saved.get(0).getPerformanceAmount());
        assertEquals(ValidationResult.DUPLICATE, saved.get(1).getValidationResult());
        assertEquals(new BigDecimal("60.00"), saved.get(1).getPerformanceAmount());
        assertEquals(ValidationResult.UNMATCHED, saved.get(2).getValidationResult());
    }

    @Test
    @DisplayName("importBatch should tag a row already stored for the same key as duplicate")
    void testImportBatch_DuplicateOfStoredRow() {
        EmployeeWorklog stored = worklog("2516572", "024", 50);
        stored.setId(7L);
        stored.setValidationResult(ValidationResult.PASSED);
        when(productionInfoRepository.findByOrderNoIn(anyCollection()))
                .thenReturn(List.of(production("2516572", "钝化", 500)));
        when(worklogRepository.findByOrderNoInOrderByIdAsc(anyCollection())).thenReturn(List.of(stored));

        ImportSummaryResponse summary = worklogImportService.importBatch(List.of(row("2516572", "024", 20)));

        assertEquals(1, summary.getResultCounts().get("重复"));
        verify(worklogRepository).saveAll(savedCaptor.capture());
        assertEquals(ValidationResult.DUPLICATE, savedCaptor.getValue().get(0).getValidationResult());
        // the stored row is not touched
        assertEquals(ValidationResult.PASSED, stored.getValidationResult());
    }

    @Test
    @DisplayName("importBatch should default a missing job type to 未知")
    void testImportBatch_DefaultJobType() {
        when(productionInfoRepository.findByOrderNoIn(anyCollection()))
                .thenReturn(List.of(production("2516572", "钝化", 500)));
        when(worklogRepository.findByOrderNoInOrderByIdAsc(anyCollection())).thenReturn(List.of());
        WorklogEntryRequest request = row("2516572", "024", 5);
        request.setJobType("  ");

        worklogImportService.importBatch(List.of(request));

        verify(worklogRepository).saveAll(savedCaptor.capture());
        EmployeeWorklog saved = savedCaptor.getValue().get(0);
        assertEquals("未知", saved.getJobType());
        assertEquals(ValidationResult.UNMATCHED, saved.getValidationResult());
        assertNotNull(saved.getUploadDate());
    }

    @Test
    @DisplayName("importBatch should not query production rows when no row has an order number")
    void testImportBatch_NoOrderNumbers() {
        ImportSummaryResponse summary = worklogImportService.importBatch(List.of(row(null, "024", 5)));

        assertEquals(1, summary.getRejected());
        assertEquals("orderNo", summary.getRejectedRows().get(0).getField());
        verify(productionInfoRepository, never()).findByOrderNoIn(any());
        verify(worklogRepository).saveAll(List.of());
    }

    @Test
    @DisplayName("importBatch should throw IllegalArgumentException for null rows")
    void testImportBatch_NullRows() {
        assertThrows(IllegalArgumentException.class, () -> worklogImportService.importBatch(null));
        verifyNoInteractions(worklogRepository, productionInfoRepository);
    }
}
