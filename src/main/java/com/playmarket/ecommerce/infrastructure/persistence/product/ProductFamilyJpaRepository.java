package com.playmarket.ecommerce.infrastructure.persistence.product;

import com.playmarket.ecommerce.domain.product.ProductFamily;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProductFamilyJpaRepository extends JpaRepository<ProductFamily, Long> {

    Optional<ProductFamily> findByName(String name);

    /**
     * 상품군과 구성원 변형을 한 번에 로딩 (fetch join)
     */
    @Query("SELECT DISTINCT f FROM ProductFamily f LEFT JOIN FETCH f.variants WHERE f.id = :familyId")
    Optional<ProductFamily> findWithVariantsById(@Param("familyId") Long familyId);

    @Query("SELECT DISTINCT f FROM ProductFamily f LEFT JOIN FETCH f.variants WHERE f.name IN :names")
    List<ProductFamily> findAllWithVariantsByNameIn(@Param("names") Collection<String> names);

    @Query("SELECT MAX(f.displayOrder) FROM ProductFamily f WHERE f.productType = :productType")
    Integer findMaxDisplayOrder(@Param("productType") String productType);

    @Query("SELECT DISTINCT f.productType FROM ProductFamily f ORDER BY f.productType")
    List<String> findDistinctProductTypes();

    @Query("SELECT DISTINCT f.brand FROM ProductFamily f " +
           "WHERE f.brand IS NOT NULL AND (:productType IS NULL OR f.productType = :productType) " +
           "ORDER BY f.brand")
    List<String> findDistinctBrands(@Param("productType") String productType);
}
