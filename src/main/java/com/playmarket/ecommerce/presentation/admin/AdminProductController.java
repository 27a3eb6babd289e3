package com.playmarket.ecommerce.presentation.admin;

import com.playmarket.ecommerce.application.product.AdminProductService;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import com.playmarket.ecommerce.domain.product.VariantAttributes;
import com.playmarket.ecommerce.presentation.admin.request.ProductRequest;
import com.playmarket.ecommerce.presentation.admin.request.RelatedProductsRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * AdminProductController - 관리자 카탈로그 API
 * POST   /admin/products                     - 상품 등록 (같은 이름/타입의 상품군이 있으면 변형으로 합류)
 * POST   /admin/products/{name}/variants     - 기존 상품군에 변형 추가
 * PUT    /admin/products/{slug}              - 가격/재고/속성/이미지 수정
 * DELETE /admin/products/{slug}              - 삭제 (이미지 파일 포함)
 * PUT    /admin/products/{name}/related      - 연관 상품 지정
 * GET    /admin/products/slug?name=&model=.. - 속성 조합으로 slug 조회
 */
@RestController
@RequestMapping("/admin/products")
public class AdminProductController {

    private final AdminProductService adminProductService;

    public AdminProductController(AdminProductService adminProductService) {
        this.adminProductService = adminProductService;
    }

    @PostMapping
    public ResponseEntity<ProductSummaryResponse> createProduct(@RequestBody ProductRequest request) {
        ProductSummaryResponse response = adminProductService.createProduct(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/{name}/variants")
    public ResponseEntity<ProductSummaryResponse> createVariant(
            @PathVariable("name") String familyName,
            @RequestBody ProductRequest request) {
        ProductSummaryResponse response = adminProductService.createVariant(familyName, request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{slug}")
    public ResponseEntity<ProductSummaryResponse> updateProduct(
            @PathVariable("slug") String slug,
            @RequestBody ProductRequest request) {
        return ResponseEntity.ok(adminProductService.updateProduct(slug, request.toCommand()));
    }

    @DeleteMapping("/{slug}")
    public ResponseEntity<Void> deleteProduct(@PathVariable("slug") String slug) {
        adminProductService.deleteProduct(slug);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{name}/related")
    public ResponseEntity<Map<String, List<String>>> setRelatedProducts(
            @PathVariable("name") String familyName,
            @RequestBody RelatedProductsRequest request) {
        List<String> related = adminProductService.setRelatedProducts(familyName, request.getRelatedProducts());
        return ResponseEntity.ok(Map.of("related_products", related));
    }

    @GetMapping("/slug")
    public ResponseEntity<Map<String, String>> findSlug(
            @RequestParam("name") String name,
            @RequestParam(value = "model", required = false) String model,
            @RequestParam(value = "controller", required = false) String controller,
            @RequestParam(value = "condition", required = false) String condition,
            @RequestParam(value = "memory", required = false) String memory) {
        String slug = adminProductService.findSlug(name, VariantAttributes.of(model, controller, condition, memory));
        return ResponseEntity.ok(Map.of("slug", slug));
    }
}
