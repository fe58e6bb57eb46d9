package blog.platform.interceptor;

import blog.platform.config.BlogProperties;
import blog.platform.exception.ConcurrencyLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyLimitInterceptorTest {

    private ConcurrencyLimitInterceptor interceptor;

    @BeforeEach
    void setUp() {
        BlogProperties properties = new BlogProperties();
        properties.getHttp().setConcurrencyLimit(1);
        properties.getHttp().setAcquireTimeoutMs(10);
        interceptor = new ConcurrencyLimitInterceptor(properties);
    }

    @Test
    void rejectsWhenAllPermitsAreTaken() throws Exception {
        MockHttpServletRequest first = new MockHttpServletRequest("GET", "/api/posts");
        MockHttpServletRequest second = new MockHttpServletRequest("GET", "/api/posts");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(first, response, new Object())).isTrue();
        assertThatThrownBy(() -> interceptor.preHandle(second, response, new Object()))
                .isInstanceOf(ConcurrencyLimitExceededException.class);

        interceptor.afterCompletion(first, response, new Object(), null);
        assertThat(interceptor.preHandle(second, response, new Object())).isTrue();
    }

    @Test
    void releasesOnlyAcquiredPermits() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/posts");
        MockHttpServletResponse response = new MockHttpServletResponse();

        interceptor.afterCompletion(request, response, new Object(), null);
        assertThat(interceptor.availablePermits()).isEqualTo(1);

        interceptor.preHandle(request, response, new Object());
        interceptor.afterCompletion(request, response, new Object(), null);
        interceptor.afterCompletion(request, response, new Object(), null);
        assertThat(interceptor.availablePermits()).isEqualTo(1);
    }
}
