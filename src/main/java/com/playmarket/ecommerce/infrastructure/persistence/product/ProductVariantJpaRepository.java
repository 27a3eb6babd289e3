package com.playmarket.ecommerce.infrastructure.persistence.product;

import com.playmarket.ecommerce.domain.product.ProductVariant;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * ProductVariant JPA Repository
 *
 * 필터 인자가 null이면 해당 조건을 건너뛰는 (:x IS NULL OR ...) 형태를 사용한다.
 * 실구매가는 COALESCE(offerPrice, price)로 계산한다.
 */
public interface ProductVariantJpaRepository extends JpaRepository<ProductVariant, Long> {

    @Query("SELECT v FROM ProductVariant v JOIN FETCH v.family f WHERE v.slug = :slug")
    Optional<ProductVariant> findBySlugWithFamily(@Param("slug") String slug);

    boolean existsBySlug(String slug);

    @Query("SELECT v FROM ProductVariant v JOIN FETCH v.family f WHERE v.id IN :ids")
    List<ProductVariant> findAllWithFamilyByIdIn(@Param("ids") Collection<Long> ids);

    /**
     * 목록 필터 (findRepresentativeIds, countFamilies 공통)
     */
    String LISTING_FILTER =
            "WHERE v.variant = :variant " +
            "AND (:productRef IS NULL OR f.name = :productRef) " +
            "AND (:productType IS NULL OR f.productType = :productType) " +
            "AND (:brand IS NULL OR f.brand = :brand) " +
            "AND (:condition IS NULL OR v.attributes.condition = :condition) " +
            "AND (:search IS NULL OR LOWER(f.name) LIKE :search ESCAPE '!' " +
            "     OR LOWER(f.description) LIKE :search ESCAPE '!') " +
            "AND (:minPrice IS NULL OR COALESCE(v.offerPrice, v.price) >= :minPrice) " +
            "AND (:maxPrice IS NULL OR COALESCE(v.offerPrice, v.price) <= :maxPrice) ";

    /**
     * 상품군별 대표 변형 ID 한 페이지
     *
     * 같은 상품군의 후보는 노출 순서가 같으므로 대표는 가장 작은 ID다.
     * 상품군 노출 순서 오름차순(미지정은 마지막), 대표 ID 오름차순.
     */
    @Query("SELECT MIN(v.id) FROM ProductVariant v JOIN v.family f " +
           LISTING_FILTER +
           "GROUP BY f.id, f.displayOrder " +
           "ORDER BY CASE WHEN f.displayOrder IS NULL THEN 1 ELSE 0 END, f.displayOrder ASC, MIN(v.id) ASC")
    List<Long> findRepresentativeIds(@Param("variant") boolean variant,
                                     @Param("productRef") String productRef,
                                     @Param("productType") String productType,
                                     @Param("brand") String brand,
                                     @Param("condition") String condition,
                                     @Param("search") String searchPattern,
                                     @Param("minPrice") BigDecimal minPrice,
                                     @Param("maxPrice") BigDecimal maxPrice,
                                     Pageable pageable);

    @Query("SELECT COUNT(DISTINCT f.id) FROM ProductVariant v JOIN v.family f " + LISTING_FILTER)
    long countFamilies(@Param("variant") boolean variant,
                       @Param("productRef") String productRef,
                       @Param("productType") String productType,
                       @Param("brand") String brand,
                       @Param("condition") String condition,
                       @Param("search") String searchPattern,
                       @Param("minPrice") BigDecimal minPrice,
                       @Param("maxPrice") BigDecimal maxPrice);

    @Query("SELECT v FROM ProductVariant v JOIN FETCH v.family f " +
           "WHERE v.variant = false AND f.productType = :productType " +
           "ORDER BY CASE WHEN f.displayOrder IS NULL THEN 1 ELSE 0 END, f.displayOrder ASC, v.id ASC")
    List<ProductVariant> findBasesByProductType(@Param("productType") String productType);

    @Query("SELECT v FROM ProductVariant v JOIN FETCH v.family f " +
           "WHERE v.variant = true AND f.id IN :familyIds AND v.id NOT IN :excludeIds " +
           "ORDER BY v.id ASC")
    List<ProductVariant> findVariantsOfFamilies(@Param("familyIds") Collection<Long> familyIds,
                                                @Param("excludeIds") Collection<Long> excludeIds,
                                                Pageable pageable);

    @Query("SELECT DISTINCT v.attributes.condition FROM ProductVariant v JOIN v.family f " +
           "WHERE v.attributes.condition IS NOT NULL " +
           "AND (:productType IS NULL OR f.productType = :productType) " +
           "AND (:brand IS NULL OR f.brand = :brand) " +
           "ORDER BY v.attributes.condition")
    List<String> findDistinctConditions(@Param("productType") String productType,
                                        @Param("brand") String brand);

    @Query("SELECT MIN(COALESCE(v.offerPrice, v.price)), MAX(COALESCE(v.offerPrice, v.price)) " +
           "FROM ProductVariant v JOIN v.family f " +
           "WHERE (:productType IS NULL OR f.productType = :productType) " +
           "AND (:brand IS NULL OR f.brand = :brand) " +
           "AND (:condition IS NULL OR v.attributes.condition = :condition)")
    List<Object[]> findEffectivePriceRange(@Param("productType") String productType,
                                           @Param("brand") String brand,
                                           @Param("condition") String condition);

    @Query("SELECT v FROM ProductVariant v JOIN FETCH v.family f " +
           "WHERE f.productType = :productType AND f.name = :name AND v.attributesKey = :attributesKey")
    Optional<ProductVariant> findByTuple(@Param("productType") String productType,
                                         @Param("name") String name,
                                         @Param("attributesKey") String attributesKey);
}
