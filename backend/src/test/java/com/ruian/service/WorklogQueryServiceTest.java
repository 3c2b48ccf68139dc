package com.ruian.service;

import com.ruian.dto.response.PageResponse;
import com.ruian.dto.response.WorklogResponse;
import com.ruian.entity.EmployeeWorklog;
import com.ruian.entity.EmployeeWorklog.ValidationResult;
import com.ruian.repository.EmployeeWorklogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.util.List;

import static com.ruian.validation.ValidationFixtures.WORK_DAY;
import static com.ruian.validation.ValidationFixtures.worklog;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WorklogQueryService Unit Tests")
class WorklogQueryServiceTest {

    @Mock
    private EmployeeWorklogRepository worklogRepository;

    private WorklogQueryService worklogQueryService;

    @BeforeEach
    void setUp() {
        worklogQueryService = new WorklogQueryService(worklogRepository);
    }

    @Test
    @DisplayName("list should sort by latest work date and return results as labels")
    @SuppressWarnings("unchecked")
    void testList_PagesAndSorts() {
        EmployeeWorklog row = worklog("2516572", "024", 50);
        row.markValidated(new BigDecimal("60.00"), ValidationResult.PASSED);
        when(worklogRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(row), PageRequest.of(0, 10), 1));

        PageResponse<WorklogResponse> response =
                worklogQueryService.list(1, 10, "2516572", WORK_DAY.minusDays(1), WORK_DAY, "024");

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(worklogRepository).findAll(any(Specification.class), pageable.capture());
        assertEquals(0, pageable.getValue().getPageNumber());
        assertEquals(Sort.by(Sort.Order.desc("workDate"), Sort.Order.desc("id")), pageable.getValue().getSort());

        assertEquals(1, response.getTotal());
        assertEquals(1, response.getPage());
        assertEquals("通过", response.getItems().get(0).getValidationResult());
        assertEquals(0, new BigDecimal("60.00").compareTo(response.getItems().get(0).getPerformanceAmount()));
    }

    @Test
    @DisplayName("list should reject paging outside the allowed range")
    void testList_InvalidPaging() {
        assertThrows(IllegalArgumentException.class,
                () -> worklogQueryService.list(0, 10, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> worklogQueryService.list(1, 0, null, null, null, null));
        verifyNoInteractions(worklogRepository);
    }

    @Test
    @DisplayName("list should reject a start date after the end date")
    void testList_InvertedRange() {
        assertThrows(IllegalArgumentException.class,
                () -> worklogQueryService.list(1, 10, null, WORK_DAY, WORK_DAY.minusDays(1), null));
        verifyNoInteractions(worklogRepository);
    }

    @Test
    @DisplayName("getByOrderNo should return every worklog of the order")
    void testGetByOrderNo() {
        when(worklogRepository.findByOrderNoOrderByWorkDateDesc("2516572"))
                .thenReturn(List.of(worklog("2516572", "024", 50), worklog("2516572", "025", 30)));

        List<WorklogResponse> rows = worklogQueryService.getByOrderNo("2516572");

        assertEquals(2, rows.size());
        assertEquals("未校验", rows.get(0).getValidationResult());
    }

    @Test
    @DisplayName("getByOrderNo should reject a missing order number")
    void testGetByOrderNo_Null() {
        assertThrows(IllegalArgumentException.class, () -> worklogQueryService.getByOrderNo(null));
        verifyNoInteractions(worklogRepository);
    }
}
