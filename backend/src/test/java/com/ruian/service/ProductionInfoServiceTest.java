package com.ruian.service;

import com.ruian.dto.response.PageResponse;
import com.ruian.dto.response.ProductionInfoResponse;
import com.ruian.entity.ProductionInfo;
import com.ruian.repository.ProductionInfoRepository;
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

import java.util.List;

import static com.ruian.validation.ValidationFixtures.UPLOADED;
import static com.ruian.validation.ValidationFixtures.production;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProductionInfoService.
 *
 * Tests paging, sorting and argument checks of the production list and
 * the per-order lookup.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProductionInfoService Unit Tests")
class ProductionInfoServiceTest {

    @Mock
    private ProductionInfoRepository productionInfoRepository;

    private ProductionInfoService productionInfoService;

    @BeforeEach
    void setUp() {
        productionInfoService = new ProductionInfoService(productionInfoRepository);
    }

    @Test
    @DisplayName("list should request the 0-based page sorted by newest upload and map the result")
    @SuppressWarnings("unchecked")
    void testList_PagesAndSorts() {
        ProductionInfo row = production("2516572", "W/mG000-AMP", "GXZYD00652946", 500, "钝化", UPLOADED);
        when(productionInfoRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(row), PageRequest.of(1, 10), 11));

        PageResponse<ProductionInfoResponse> response =
                productionInfoService.list(2, 10, "2516", UPLOADED, UPLOADED.plusDays(30));

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(productionInfoRepository).findAll(any(Specification.class), pageable.capture());
        assertEquals(1, pageable.getValue().getPageNumber());
        assertEquals(10, pageable.getValue().getPageSize());
        assertEquals(Sort.by(Sort.Order.desc("uploadDate"), Sort.Order.desc("id")), pageable.getValue().getSort());

        assertEquals(11, response.getTotal());
        assertEquals(2, response.getPage());
        assertEquals(10, response.getPageSize());
        assertEquals(1, response.getItems().size());
        assertEquals("2516572", response.getItems().get(0).getOrderNo());
    }

    @Test
    @DisplayName("list should reject a page below 1 without querying")
    void testList_InvalidPage() {
        assertThrows(IllegalArgumentException.class,
                () -> productionInfoService.list(0, 10, null, null, null));
        verifyNoInteractions(productionInfoRepository);
    }

    @Test
    @DisplayName("list should reject a page size above 100 without querying")
    void testList_InvalidPageSize() {
        assertThrows(IllegalArgumentException.class,
                () -> productionInfoService.list(1, 101, null, null, null));
        verifyNoInteractions(productionInfoRepository);
    }

    @Test
    @DisplayName("list should reject a start date after the end date")
    void testList_InvertedRange() {
        assertThrows(IllegalArgumentException.class,
                () -> productionInfoService.list(1, 10, null, UPLOADED.plusDays(1), UPLOADED));
        verifyNoInteractions(productionInfoRepository);
    }

    @Test
    @DisplayName("getByOrderNo should look up the trimmed order number")
    void testGetByOrderNo() {
        ProductionInfo row = production("2516572", "W/mG000-AMP", "GXZYD00652946", 500, "钝化", UPLOADED);
        when(productionInfoRepository.findByOrderNoOrderByUploadDateDesc("2516572")).thenReturn(List.of(row));

        List<ProductionInfoResponse> rows = productionInfoService.getByOrderNo(" 2516572 ");

        assertEquals(1, rows.size());
        assertEquals("钝化", rows.get(0).getJobType());
    }

    @Test
    @DisplayName("getByOrderNo should reject a blank order number")
    void testGetByOrderNo_Blank() {
        assertThrows(IllegalArgumentException.class, () -> productionInfoService.getByOrderNo("  "));
        verifyNoInteractions(productionInfoRepository);
    }
}
