package com.medclinic.backend.global.security;

import java.io.IOException;

import com.medclinic.backend.global.error.ProblemException;
import com.medclinic.backend.global.error.ProblemResponseWriter;
import com.medclinic.backend.modules.auth.application.AuthProblems;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Renders the problem recorded by {@link JwtAuthenticationFilter}, or {@code AUTHENTICATION_ERROR}
 * when the request carried no token at all.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        Object failure = request.getAttribute(JwtAuthenticationFilter.TOKEN_FAILURE_ATTRIBUTE);
        if (failure instanceof ProblemException problem) {
            problemResponseWriter.write(request, response, problem);
        } else {
            problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, AuthProblems.AUTHENTICATION_ERROR,
                    "Access token required");
        }
    }
}
