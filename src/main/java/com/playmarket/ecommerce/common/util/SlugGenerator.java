package com.playmarket.ecommerce.common.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 상품 slug 생성 유틸리티
 *
 * 규칙:
 * - 상품명과 옵션 값(model, controller, condition, memory)을 순서대로 이어 붙인다
 * - 소문자 변환, 영문/숫자 이외의 문자는 '-' 하나로 축약
 * - 앞뒤 '-' 제거
 *
 * 예: ("PlayStation 5", "Digital", null, "New", "1TB") → "playstation-5-digital-new-1tb"
 */
public final class SlugGenerator {

    private SlugGenerator() {
    }

    public static String generate(String name, String... attributes) {
        String joined = Stream.concat(Stream.of(name), Stream.of(attributes))
                .filter(Objects::nonNull)
                .filter(value -> !value.isBlank())
                .collect(Collectors.joining(" "));
        return normalize(joined);
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String ascii = Normalizer.normalize(value, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
    }

    /**
     * 충돌 시 숫자 접미사를 붙인 slug
     * 예: ("ps5-digital", 2) → "ps5-digital-2"
     */
    public static String withSuffix(String slug, int sequence) {
        return slug + "-" + sequence;
    }
}
