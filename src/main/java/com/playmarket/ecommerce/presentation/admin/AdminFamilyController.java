package com.playmarket.ecommerce.presentation.admin;

import com.playmarket.ecommerce.application.product.AdminProductService;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import com.playmarket.ecommerce.presentation.admin.request.FamilyDetailsRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * AdminFamilyController - 관리자 상품군 API (상품명 기준)
 * PATCH  /admin/families/{name} - 브랜드/설명 수정 (모든 구성원에 반영)
 * DELETE /admin/families/{name} - 상품군 전체 삭제 (이미지 파일 포함)
 */
@RestController
@RequestMapping("/admin/families")
public class AdminFamilyController {

    private final AdminProductService adminProductService;

    public AdminFamilyController(AdminProductService adminProductService) {
        this.adminProductService = adminProductService;
    }

    @PatchMapping("/{name}")
    public ResponseEntity<List<ProductSummaryResponse>> updateFamilyDetails(
            @PathVariable("name") String familyName,
            @RequestBody FamilyDetailsRequest request) {
        return ResponseEntity.ok(adminProductService.updateFamilyDetails(
                familyName, request.getBrand(), request.getDescription()));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteFamily(@PathVariable("name") String familyName) {
        adminProductService.deleteFamily(familyName);
        return ResponseEntity.noContent().build();
    }
}
