package com.playmarket.ecommerce.presentation.product;

import com.playmarket.ecommerce.application.product.ProductDetailService;
import com.playmarket.ecommerce.application.product.ProductListingService;
import com.playmarket.ecommerce.application.product.dto.ProductDetailResponse;
import com.playmarket.ecommerce.application.product.dto.ProductListFilter;
import com.playmarket.ecommerce.application.product.dto.ProductListResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * ProductController - 상품 조회 API (Presentation 계층)
 * GET /products - 대표 상품 목록 (필터, 정렬, 페이지, 패싯)
 * GET /products/{slug} - 상품 상세 (옵션별 가격 차이, 리뷰 요약, 연관 상품)
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductListingService productListingService;
    private final ProductDetailService productDetailService;

    public ProductController(ProductListingService productListingService,
                             ProductDetailService productDetailService) {
        this.productListingService = productListingService;
        this.productDetailService = productDetailService;
    }

    /**
     * 숫자 파라미터도 문자열로 받는다. page/limit은 잘못된 값이면 기본값으로,
     * min_price/max_price는 400으로 처리된다.
     */
    @GetMapping
    public ResponseEntity<ProductListResponse> getProductList(
            @RequestParam(value = "product_type", required = false) String productType,
            @RequestParam(value = "brand", required = false) String brand,
            @RequestParam(value = "condition", required = false) String condition,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "min_price", required = false) String minPrice,
            @RequestParam(value = "max_price", required = false) String maxPrice,
            @RequestParam(value = "product_ref", required = false) String productRef,
            @RequestParam(value = "sort", required = false) String sort,
            @RequestParam(value = "page", required = false) String page,
            @RequestParam(value = "limit", required = false) String limit) {

        ProductListFilter filter = ProductListFilter.builder()
                .productType(productType)
                .brand(brand)
                .condition(condition)
                .search(search)
                .minPrice(minPrice)
                .maxPrice(maxPrice)
                .productRef(productRef)
                .sort(sort)
                .page(page)
                .limit(limit)
                .build();

        return ResponseEntity.ok(productListingService.listProducts(filter));
    }

    @GetMapping("/{slug}")
    public ResponseEntity<ProductDetailResponse> getProductDetail(@PathVariable("slug") String slug) {
        return ResponseEntity.ok(productDetailService.getProductBySlug(slug));
    }
}
