package blog.platform.interceptor;

import blog.platform.config.BlogProperties;
import blog.platform.exception.ConcurrencyLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Caps in-flight REST requests.
 * A request waits up to the acquire timeout for a slot and is rejected with 503 after that.
 */
@Component
@Slf4j
public class ConcurrencyLimitInterceptor implements HandlerInterceptor {

    private static final String PERMIT_ATTRIBUTE = ConcurrencyLimitInterceptor.class.getName() + ".permit";

    private final Semaphore permits;

    private final int limit;

    private final long acquireTimeoutMs;

    public ConcurrencyLimitInterceptor(BlogProperties properties) {
        this.limit = properties.getHttp().getConcurrencyLimit();
        this.acquireTimeoutMs = properties.getHttp().getAcquireTimeoutMs();
        this.permits = new Semaphore(limit);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        boolean permitted = permits.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS);
        if (!permitted) {
            log.warn("Concurrency limit of {} reached, rejecting {} {}", limit, request.getMethod(), request.getRequestURI());
            throw new ConcurrencyLimitExceededException("more than " + limit + " requests in flight");
        }
        request.setAttribute(PERMIT_ATTRIBUTE, Boolean.TRUE);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        if (request.getAttribute(PERMIT_ATTRIBUTE) != null) {
            request.removeAttribute(PERMIT_ATTRIBUTE);
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }
}
