package com.admissions.prediction.web;

import com.admissions.prediction.exception.AuthenticationFailedException;
import com.admissions.prediction.service.AuthGate;
import com.admissions.prediction.service.AuthResult;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Authorizes protected requests from their Authorization header.
 *
 * Runs before the handler method, so request body binding, validation and
 * the predictor are never reached for an unauthenticated request. On success
 * the subject is exposed as the {@link #SUBJECT_ATTRIBUTE} request attribute.
 */
@Component
@RequiredArgsConstructor
public class BearerTokenInterceptor implements HandlerInterceptor {

    public static final String SUBJECT_ATTRIBUTE = "authenticatedSubject";

    public static final String AUTH_FAILURE_MESSAGE = "Authentication failed. Please provide a valid JWT token.";

    private final AuthGate authGate;

    /**
     * @return true when the request may proceed to the handler
     * @throws AuthenticationFailedException if the header does not carry a usable token
     */
    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // the async re-dispatch that writes the prediction was authorized on the initial dispatch
        if (request.getDispatcherType() == DispatcherType.ASYNC) {
            return true;
        }
        AuthResult<String> result = authGate.authorize(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (!result.isSuccess()) {
            throw new AuthenticationFailedException(result.getError(), AUTH_FAILURE_MESSAGE);
        }
        request.setAttribute(SUBJECT_ATTRIBUTE, result.getValue());
        return true;
    }
}
