package blog.platform.service;

import blog.platform.domain.PageRequest;
import blog.platform.exception.ValidationException;

/**
 * Pagination rules shared by both transports.
 *
 * Clients speak either limit/offset (REST) or page/page_size (gRPC); the post
 * service speaks limit/offset and the store speaks page/page_size. All
 * conversions and bounds live here so the two adapters cannot drift apart.
 */
public final class Pagination {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private Pagination() {
    }

    /**
     * Translate limit/offset into the page containing offset.
     * page_size = max(limit, 1), page = floor(offset / page_size) + 1.
     */
    public static PageRequest toPage(int limit, long offset) {
        if (offset < 0) {
            throw new ValidationException("offset", "must be >= 0");
        }
        int pageSize = Math.max(limit, 1);
        long page = offset / pageSize + 1;
        if (page > Integer.MAX_VALUE) {
            throw new ValidationException("offset", "is too large");
        }
        return new PageRequest((int) page, pageSize);
    }

    /**
     * Offset of the first row of a page, i.e. the requested offset rounded down
     */
    public static long toOffset(PageRequest pageRequest) {
        return pageRequest.offset();
    }

    /**
     * Resolve the REST limit query parameter: absent means the default, otherwise 1..100
     */
    public static int resolveLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit", "must be 1.." + MAX_LIMIT);
        }
        return limit;
    }

    /**
     * Resolve the REST offset query parameter: absent means 0, negative is rejected
     */
    public static long resolveOffset(Long offset) {
        if (offset == null) {
            return 0;
        }
        if (offset < 0) {
            throw new ValidationException("offset", "must be >= 0");
        }
        return offset;
    }

    /**
     * Resolve gRPC page parameters, given as unsigned 32-bit values.
     * page 0 means the first page, page_size 0 means the default.
     */
    public static PageRequest resolvePage(long page, long pageSize) {
        if (page < 0 || page > Integer.MAX_VALUE) {
            throw new ValidationException("page", "must be 1.." + Integer.MAX_VALUE);
        }
        if (pageSize < 0 || pageSize > MAX_LIMIT) {
            throw new ValidationException("page_size", "must be 1.." + MAX_LIMIT);
        }
        int resolvedPage = page == 0 ? 1 : (int) page;
        int resolvedSize = pageSize == 0 ? DEFAULT_LIMIT : (int) pageSize;
        return new PageRequest(resolvedPage, resolvedSize);
    }
}
