package com.playmarket.ecommerce.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 상품군 저장소 (Port)
 */
public interface ProductFamilyRepository {

    Optional<ProductFamily> findByName(String name);

    /**
     * 이름 목록에 해당하는 상품군과 구성원 변형을 함께 조회
     */
    List<ProductFamily> findAllWithVariantsByNameIn(Collection<String> names);

    /**
     * 상품 타입 안에서 가장 큰 노출 순서. 없으면 empty
     */
    Optional<Integer> findMaxDisplayOrder(String productType);

    ProductFamily save(ProductFamily family);

    void delete(ProductFamily family);
}
