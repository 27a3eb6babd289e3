package com.playmarket.ecommerce.infrastructure.persistence.product;

import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductFamilyRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@Primary
public class MySQLProductFamilyRepository implements ProductFamilyRepository {

    private final ProductFamilyJpaRepository familyJpaRepository;

    public MySQLProductFamilyRepository(ProductFamilyJpaRepository familyJpaRepository) {
        this.familyJpaRepository = familyJpaRepository;
    }

    @Override
    public Optional<ProductFamily> findByName(String name) {
        return familyJpaRepository.findByName(name);
    }

    @Override
    public List<ProductFamily> findAllWithVariantsByNameIn(Collection<String> names) {
        if (names.isEmpty()) {
            return List.of();
        }
        return familyJpaRepository.findAllWithVariantsByNameIn(names);
    }

    @Override
    public Optional<Integer> findMaxDisplayOrder(String productType) {
        return Optional.ofNullable(familyJpaRepository.findMaxDisplayOrder(productType));
    }

    @Override
    public ProductFamily save(ProductFamily family) {
        return familyJpaRepository.save(family);
    }

    @Override
    public void delete(ProductFamily family) {
        familyJpaRepository.delete(family);
    }
}
