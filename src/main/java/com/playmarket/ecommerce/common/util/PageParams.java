package com.playmarket.ecommerce.common.util;

/**
 * page / limit 쿼리 파라미터 파싱
 *
 * 숫자가 아니거나 1 미만인 값은 오류 대신 기본값으로 대체한다.
 * limit은 maxLimit을 넘지 않도록 잘라낸다.
 */
public final class PageParams {

    private final int page;
    private final int limit;

    private PageParams(int page, int limit) {
        this.page = page;
        this.limit = limit;
    }

    public static PageParams parse(String rawPage, String rawLimit, int defaultLimit, int maxLimit) {
        int page = parsePositive(rawPage, 1);
        int limit = Math.min(parsePositive(rawLimit, defaultLimit), maxLimit);
        return new PageParams(page, limit);
    }

    static int parsePositive(String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value >= 1 ? value : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public int getPage() {
        return page;
    }

    public int getLimit() {
        return limit;
    }

    public long getOffset() {
        return (long) (page - 1) * limit;
    }

    public int totalPages(long totalCount) {
        return (int) ((totalCount + limit - 1) / limit);
    }
}
