package com.playmarket.ecommerce.presentation.product;

import com.playmarket.ecommerce.application.product.ProductCatalogService;
import com.playmarket.ecommerce.application.product.dto.HomeProductResponse;
import com.playmarket.ecommerce.application.product.dto.ProductLookupResponse;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * CatalogController - 카탈로그 보조 조회 API
 * GET /catalog/products?ids=1,2           - ID 목록 조회 + 같은 상품군의 다른 변형
 * GET /catalog/home/{product_type}        - 홈 화면 모델 카드
 * GET /catalog/families/{name}            - 상품군 구성원 목록
 * GET /catalog/families/{name}/exists     - 상품군 존재 여부
 */
@RestController
@RequestMapping("/catalog")
public class CatalogController {

    private final ProductCatalogService productCatalogService;

    public CatalogController(ProductCatalogService productCatalogService) {
        this.productCatalogService = productCatalogService;
    }

    @GetMapping("/products")
    public ResponseEntity<ProductLookupResponse> retrieveByIds(
            @RequestParam(value = "ids", required = false) List<Long> ids) {
        return ResponseEntity.ok(productCatalogService.retrieveByIds(ids));
    }

    @GetMapping("/home/{product_type}")
    public ResponseEntity<List<HomeProductResponse>> listForHome(@PathVariable("product_type") String productType) {
        return ResponseEntity.ok(productCatalogService.listForHome(productType));
    }

    @GetMapping("/families/{name}")
    public ResponseEntity<List<ProductSummaryResponse>> listByName(@PathVariable("name") String name) {
        return ResponseEntity.ok(productCatalogService.listByName(name));
    }

    @GetMapping("/families/{name}/exists")
    public ResponseEntity<Map<String, Boolean>> exists(@PathVariable("name") String name) {
        return ResponseEntity.ok(Map.of("exists", productCatalogService.exists(name)));
    }
}
