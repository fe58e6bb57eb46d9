package blog.platform.domain;

import lombok.Value;

/**
 * Store-facing page window. page starts at 1.
 */
@Value
public class PageRequest {
    int page;
    int pageSize;

    /**
     * Row offset of the first item on this page
     */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
