package com.playmarket.ecommerce.presentation.admin;

import com.playmarket.ecommerce.application.product.AdminProductService;
import com.playmarket.ecommerce.application.product.dto.ProductCommand;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import com.playmarket.ecommerce.domain.product.DuplicateVariantException;
import com.playmarket.ecommerce.domain.product.ProductNotFoundException;
import com.playmarket.ecommerce.domain.product.VariantAttributes;
import com.playmarket.ecommerce.presentation.common.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * AdminProductControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: AdminProductController (/admin/products)
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AdminProductController 단위 테스트")
class AdminProductControllerTest {

    private MockMvc mockMvc;

    @Mock
    private AdminProductService adminProductService;

    @InjectMocks
    private AdminProductController adminProductController;

    @BeforeEach
    void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(adminProductController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("등록 - 201, snake_case 본문이 명령으로 변환된다")
    void testCreateProduct_Created() throws Exception {
        // Given
        when(adminProductService.createProduct(any())).thenReturn(ProductSummaryResponse.builder()
                .id(5001L).slug("xbox-series-x-x-new").name("Xbox Series X").build());

        // When & Then
        mockMvc.perform(post("/admin/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Xbox Series X\",\"product_type\":\"console\",\"model\":\"X\","
                                + "\"condition\":\"New\",\"price\":499.00,\"offer_price\":379.00,\"quantity\":4}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slug").value("xbox-series-x-x-new"));

        ArgumentCaptor<ProductCommand> captor = ArgumentCaptor.forClass(ProductCommand.class);
        verify(adminProductService).createProduct(captor.capture());
        ProductCommand command = captor.getValue();
        assertEquals("console", command.getProductType());
        assertEquals(0, new BigDecimal("379.00").compareTo(command.getOfferPrice()));
        assertNull(command.getMemory());
    }

    @Test
    @DisplayName("등록 - 같은 옵션 조합이면 409")
    void testCreateProduct_Duplicate() throws Exception {
        // Given
        when(adminProductService.createProduct(any())).thenThrow(new DuplicateVariantException(
                "PlayStation 5", VariantAttributes.of("Disc", null, "New", null)));

        // When & Then
        mockMvc.perform(post("/admin/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"PlayStation 5\",\"product_type\":\"console\",\"price\":1}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_DUPLICATE_VARIANT"));
    }

    @Test
    @DisplayName("변형 등록 - 201")
    void testCreateVariant_Created() throws Exception {
        when(adminProductService.createVariant(eq("PlayStation 5"), any())).thenReturn(ProductSummaryResponse.builder()
                .slug("playstation-5-digital-new").variant(true).productRef("PlayStation 5").build());

        mockMvc.perform(post("/admin/products/{name}/variants", "PlayStation 5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\":\"Digital\",\"condition\":\"New\",\"price\":449.99}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.product_ref").value("PlayStation 5"));
    }

    @Test
    @DisplayName("수정 - 없는 slug는 404")
    void testUpdateProduct_NotFound() throws Exception {
        when(adminProductService.updateProduct(eq("nope"), any())).thenThrow(new ProductNotFoundException("nope"));

        mockMvc.perform(put("/admin/products/nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\":10}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("삭제 - 204")
    void testDeleteProduct_NoContent() throws Exception {
        mockMvc.perform(delete("/admin/products/playstation-5-disc-new"))
                .andExpect(status().isNoContent());

        verify(adminProductService).deleteProduct("playstation-5-disc-new");
    }

    @Test
    @DisplayName("삭제 - 없는 slug는 404")
    void testDeleteProduct_NotFound() throws Exception {
        doThrow(new ProductNotFoundException("nope")).when(adminProductService).deleteProduct("nope");

        mockMvc.perform(delete("/admin/products/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("연관 상품 교체 - 정리된 목록 반환")
    void testSetRelatedProducts() throws Exception {
        when(adminProductService.setRelatedProducts(eq("PlayStation 5"), anyList()))
                .thenReturn(List.of("DualSense"));

        mockMvc.perform(put("/admin/products/{name}/related", "PlayStation 5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"related_products\":[\"DualSense\",\"DualSense\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.related_products[0]").value("DualSense"));
    }

    @Test
    @DisplayName("옵션 조합으로 slug 조회")
    void testFindSlug() throws Exception {
        when(adminProductService.findSlug("PlayStation 5", VariantAttributes.of("Digital", null, "New", null)))
                .thenReturn("playstation-5-digital-new");

        mockMvc.perform(get("/admin/products/slug")
                        .param("name", "PlayStation 5")
                        .param("model", "Digital")
                        .param("condition", "New"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug").value("playstation-5-digital-new"));
    }

    @Test
    @DisplayName("본문이 JSON이 아니면 400")
    void testCreateProduct_MalformedBody() throws Exception {
        mockMvc.perform(post("/admin/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not-json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_INVALID_REQUEST"));
    }
}
