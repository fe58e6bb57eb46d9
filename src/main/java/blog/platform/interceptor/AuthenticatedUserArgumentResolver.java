package blog.platform.interceptor;

import blog.platform.exception.UnauthorizedException;
import blog.platform.security.AuthenticatedUser;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies the identity stored by {@link BearerAuthInterceptor}
 */
@Component
public class AuthenticatedUserArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthenticatedUser.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object user = webRequest.getAttribute(BearerAuthInterceptor.AUTHENTICATED_USER_ATTRIBUTE,
                RequestAttributes.SCOPE_REQUEST);
        if (user == null) {
            // handler forgot @RequireAuth
            throw new UnauthorizedException("no authenticated user");
        }
        return user;
    }
}
