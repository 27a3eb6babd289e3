package com.playmarket.ecommerce.application.product;

import com.playmarket.ecommerce.application.product.dto.ProductCommand;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import com.playmarket.ecommerce.common.util.AfterCommit;
import com.playmarket.ecommerce.common.util.SlugGenerator;
import com.playmarket.ecommerce.domain.product.DuplicateVariantException;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductFamilyRepository;
import com.playmarket.ecommerce.domain.product.ProductNotFoundException;
import com.playmarket.ecommerce.domain.product.ProductRepository;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import com.playmarket.ecommerce.domain.product.VariantAttributes;
import com.playmarket.ecommerce.domain.storage.FileStorage;
import com.playmarket.ecommerce.infrastructure.config.CacheNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 관리자 상품 관리
 *
 * - 등록: 같은 (타입, 상품명, 옵션 조합)이 있으면 409
 *   같은 이름의 상품군이 있으면 그 상품군의 변형으로 합류, 없으면 새 상품군(노출 순서 = 타입 내 최대값 + 1)
 * - 변형 등록: 기존 상품군에 variant = true로 추가
 * - 수정: slug 기준. 없으면 404 (upsert 하지 않음). 이미지 교체 시 기존 파일 삭제
 * - 삭제: 이미지 파일 삭제, 마지막 구성원이면 상품군도 삭제
 * - 상품군 삭제 / 상품군 공통 정보(브랜드, 설명) 수정: 상품명 기준
 *
 * 옵션 조합 중복은 조회로 먼저 거르고, 동시 등록은 (family_id, attributes_key) 유니크 제약으로 409가 된다.
 * 이미지 파일은 커밋 이후에만 지운다.
 * 모든 변경은 상품 상세 캐시를 비운다.
 */
@Service
public class AdminProductService {

    private static final Logger log = LoggerFactory.getLogger(AdminProductService.class);

    private final ProductRepository productRepository;
    private final ProductFamilyRepository familyRepository;
    private final FileStorage fileStorage;

    public AdminProductService(ProductRepository productRepository,
                               ProductFamilyRepository familyRepository,
                               FileStorage fileStorage) {
        this.productRepository = productRepository;
        this.familyRepository = familyRepository;
        this.fileStorage = fileStorage;
    }

    @Transactional
    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public ProductSummaryResponse createProduct(ProductCommand command) {
        requireText(command.getName(), "name");
        requireText(command.getProductType(), "product_type");
        if (command.getPrice() == null) {
            throw new InvalidRequestException("price는 필수입니다");
        }

        String name = command.getName().trim();
        String productType = command.getProductType().trim();
        VariantAttributes attributes = command.toAttributes();
        rejectDuplicate(productType, name, attributes);

        Optional<ProductFamily> existing = familyRepository.findByName(name);
        ProductFamily family;
        boolean variant;
        if (existing.isPresent()) {
            family = existing.get();
            if (!family.getProductType().equals(productType)) {
                throw new InvalidRequestException(
                        "다른 상품 타입으로 이미 등록된 상품명입니다: " + name + " (" + family.getProductType() + ")");
            }
            variant = true;
        } else {
            int nextOrder = familyRepository.findMaxDisplayOrder(productType).map(max -> max + 1).orElse(1);
            family = familyRepository.save(ProductFamily.create(
                    name, productType, command.getBrand(), command.getDescription(), nextOrder));
            variant = false;
        }

        ProductVariant created = saveUnique(newVariant(family, command, attributes, variant));
        log.info("[AdminProductService] 상품 등록 - family={}, slug={}, variant={}",
                family.getName(), created.getSlug(), variant);
        return ProductSummaryResponse.from(created);
    }

    @Transactional
    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public ProductSummaryResponse createVariant(String familyName, ProductCommand command) {
        ProductFamily family = familyRepository.findByName(familyName)
                .orElseThrow(() -> new ProductNotFoundException(familyName));
        if (family.findBase().isEmpty()) {
            throw new ProductNotFoundException(familyName);
        }

        VariantAttributes attributes = command.toAttributes();
        rejectDuplicate(family.getProductType(), family.getName(), attributes);

        ProductVariant created = saveUnique(newVariant(family, command, attributes, true));
        log.info("[AdminProductService] 변형 등록 - family={}, slug={}", family.getName(), created.getSlug());
        return ProductSummaryResponse.from(created);
    }

    @Transactional
    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public ProductSummaryResponse updateProduct(String slug, ProductCommand command) {
        ProductVariant target = productRepository.findBySlugWithFamily(slug)
                .orElseThrow(() -> new ProductNotFoundException(slug));
        ProductFamily family = target.getFamily();

        VariantAttributes attributes = command.toAttributes();
        if (!attributes.equals(target.getAttributes())) {
            Optional<ProductVariant> clash = productRepository.findByTuple(
                    family.getProductType(), family.getName(), attributes);
            if (clash.isPresent() && !clash.get().getId().equals(target.getId())) {
                throw new DuplicateVariantException(family.getName(), attributes);
            }
            target.changeAttributes(attributes, uniqueSlug(family.getName(), attributes));
        }

        target.changePricing(command.getPrice(), command.getOfferPrice(), command.getQuantity());
        family.updateDetails(command.getBrand(), command.getDescription());

        List<String> replacedImages = new ArrayList<>();
        if (command.hasImages()) {
            replacedImages = target.replaceImages(command.getImages());
        }

        ProductVariant saved = saveUnique(target);
        deleteFilesAfterCommit(replacedImages);

        log.info("[AdminProductService] 상품 수정 - slug={}, newSlug={}, replacedImages={}",
                slug, saved.getSlug(), replacedImages.size());
        return ProductSummaryResponse.from(saved);
    }

    @Transactional
    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public void deleteProduct(String slug) {
        ProductVariant target = productRepository.findBySlugWithFamily(slug)
                .orElseThrow(() -> new ProductNotFoundException(slug));
        ProductFamily family = target.getFamily();
        List<String> images = new ArrayList<>(target.getImages());

        family.removeVariant(target);
        productRepository.delete(target);
        if (family.isEmpty()) {
            familyRepository.delete(family);
        }

        deleteFilesAfterCommit(images);
        log.info("[AdminProductService] 상품 삭제 - slug={}, family={}, familyDeleted={}",
                slug, family.getName(), family.isEmpty());
    }

    /**
     * 상품군 전체 삭제 (모든 구성원과 이미지 파일)
     */
    @Transactional
    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public void deleteFamily(String familyName) {
        ProductFamily family = familyRepository.findByName(familyName)
                .orElseThrow(() -> new ProductNotFoundException(familyName));

        List<ProductVariant> members = family.membersBaseFirst();
        List<String> images = new ArrayList<>();
        for (ProductVariant member : members) {
            images.addAll(member.getImages());
            family.removeVariant(member);
            productRepository.delete(member);
        }
        familyRepository.delete(family);

        deleteFilesAfterCommit(images);
        log.info("[AdminProductService] 상품군 삭제 - family={}, members={}, images={}",
                familyName, members.size(), images.size());
    }

    /**
     * 상품군 공통 정보 수정. null 값은 기존 값을 유지한다.
     */
    @Transactional
    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public List<ProductSummaryResponse> updateFamilyDetails(String familyName, String brand, String description) {
        ProductFamily family = familyRepository.findByName(familyName)
                .orElseThrow(() -> new ProductNotFoundException(familyName));
        family.updateDetails(brand, description);
        familyRepository.save(family);
        return family.membersBaseFirst().stream()
                .map(ProductSummaryResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public List<String> setRelatedProducts(String familyName, List<String> relatedNames) {
        ProductFamily family = familyRepository.findByName(familyName)
                .orElseThrow(() -> new ProductNotFoundException(familyName));
        family.replaceRelatedProducts(relatedNames);
        familyRepository.save(family);
        return new ArrayList<>(family.getRelatedProducts());
    }

    /**
     * 상품명과 옵션 조합으로 slug 조회 (옵션 전환용)
     */
    @Transactional(readOnly = true)
    public String findSlug(String name, VariantAttributes attributes) {
        ProductFamily family = familyRepository.findByName(name)
                .orElseThrow(() -> new ProductNotFoundException(name));
        return family.findVariant(attributes)
                .map(ProductVariant::getSlug)
                .orElseThrow(() -> new ProductNotFoundException(name + " " + attributes));
    }

    private ProductVariant newVariant(ProductFamily family, ProductCommand command,
                                      VariantAttributes attributes, boolean variant) {
        if (command.getPrice() == null) {
            throw new InvalidRequestException("price는 필수입니다");
        }
        try {
            return ProductVariant.create(
                    family,
                    uniqueSlug(family.getName(), attributes),
                    attributes,
                    command.getPrice(),
                    command.getOfferPrice(),
                    command.getQuantity() == null ? 0 : command.getQuantity(),
                    command.getImages(),
                    variant
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }

    private ProductVariant saveUnique(ProductVariant variant) {
        try {
            return productRepository.saveAndFlush(variant);
        } catch (DataIntegrityViolationException e) {
            log.warn("[AdminProductService] 유니크 제약 위반 - family={}, attributes={}, slug={}",
                    variant.getName(), variant.getAttributes(), variant.getSlug());
            throw new DuplicateVariantException(variant.getName(), variant.getAttributes());
        }
    }

    private void deleteFilesAfterCommit(List<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        List<String> targets = List.copyOf(paths);
        AfterCommit.run(() -> targets.forEach(fileStorage::deleteFile));
    }

    private void rejectDuplicate(String productType, String name, VariantAttributes attributes) {
        if (productRepository.findByTuple(productType, name, attributes).isPresent()) {
            throw new DuplicateVariantException(name, attributes);
        }
    }

    private String uniqueSlug(String name, VariantAttributes attributes) {
        String base = SlugGenerator.generate(name, attributes.getModel(), attributes.getController(),
                attributes.getCondition(), attributes.getMemory());
        if (base.isEmpty()) {
            throw new InvalidRequestException("slug를 만들 수 없는 상품명입니다: " + name);
        }
        String candidate = base;
        int sequence = 2;
        while (productRepository.existsBySlug(candidate)) {
            candidate = SlugGenerator.withSuffix(base, sequence++);
        }
        return candidate;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(field + "는 필수입니다");
        }
    }
}
